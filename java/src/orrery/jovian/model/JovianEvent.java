package orrery.jovian.model;

import orrery.jovian.GalileanMoon;
import orrery.jovian.JovianEventKind;

import java.io.Serializable;

/**
 * 带可见性标注的木卫事件
 *
 * 同时发生提示的 moon 和 kind 为 null
 */
public class JovianEvent implements Serializable {

    private static final long serialVersionUID = 1L;

    private final double julianDate;
    private final String text;
    private final GalileanMoon moon;
    private final JovianEventKind kind;
    private final boolean start;
    private final EventVisibility visibility;
    private final boolean simultaneousAlert;

    public JovianEvent(RawEvent raw, EventVisibility visibility) {
        this(raw.getJulianDate(), raw.getText(), raw.getMoon(), raw.getKind(), raw.isStart(), visibility, false);
    }

    private JovianEvent(double julianDate, String text, GalileanMoon moon, JovianEventKind kind,
                        boolean start, EventVisibility visibility, boolean simultaneousAlert) {
        this.julianDate = julianDate;
        this.text = text;
        this.moon = moon;
        this.kind = kind;
        this.start = start;
        this.visibility = visibility;
        this.simultaneousAlert = simultaneousAlert;
    }

    /**
     * 多颗卫星同时凌/影凌/被掩的提示
     */
    public static JovianEvent alert(double julianDate, String text, EventVisibility visibility) {
        return new JovianEvent(julianDate, text, null, null, false, visibility, true);
    }

    public double getJulianDate() {
        return julianDate;
    }

    public String getText() {
        return text;
    }

    public GalileanMoon getMoon() {
        return moon;
    }

    public JovianEventKind getKind() {
        return kind;
    }

    public boolean isStart() {
        return start;
    }

    public EventVisibility getVisibility() {
        return visibility;
    }

    public boolean isSimultaneousAlert() {
        return simultaneousAlert;
    }

    @Override
    public String toString() {
        return "JovianEvent{" +
                "jd=" + julianDate +
                ", text='" + text + '\'' +
                ", visibility=" + visibility +
                '}';
    }
}
