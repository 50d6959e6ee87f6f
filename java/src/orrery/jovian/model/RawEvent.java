package orrery.jovian.model;

import orrery.jovian.GalileanMoon;
import orrery.jovian.JovianEventKind;

import java.io.Serializable;

/**
 * 扫描得到的木卫事件（尚未标注可见性）
 */
public class RawEvent implements Serializable {

    private static final long serialVersionUID = 1L;

    private final double julianDate;
    private final String text;
    private final GalileanMoon moon;
    private final JovianEventKind kind;
    private final boolean start;

    public RawEvent(double julianDate, String text, GalileanMoon moon, JovianEventKind kind, boolean start) {
        this.julianDate = julianDate;
        this.text = text;
        this.moon = moon;
        this.kind = kind;
        this.start = start;
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

    @Override
    public String toString() {
        return "RawEvent{" +
                "jd=" + julianDate +
                ", text='" + text + '\'' +
                '}';
    }
}
