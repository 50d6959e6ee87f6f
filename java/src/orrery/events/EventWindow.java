package orrery.events;

import org.orekit.utils.Constants;

import java.io.Serializable;

/**
 * 事件窗口
 *
 * 某个主体（如一颗木卫）一种现象从开始到结束的时间段
 */
public class EventWindow implements Serializable {

    private static final long serialVersionUID = 1L;

    private final String subject;
    private final String kind;
    private final double startJulianDate;
    private final double endJulianDate;
    private final double durationMinutes;

    public EventWindow(String subject, String kind, double startJulianDate, double endJulianDate) {
        this.subject = subject;
        this.kind = kind;
        this.startJulianDate = startJulianDate;
        this.endJulianDate = endJulianDate;
        this.durationMinutes = (endJulianDate - startJulianDate) * Constants.JULIAN_DAY / 60.0;
    }

    // Getters
    public String getSubject() {
        return subject;
    }

    public String getKind() {
        return kind;
    }

    public double getStartJulianDate() {
        return startJulianDate;
    }

    public double getEndJulianDate() {
        return endJulianDate;
    }

    public double getDurationMinutes() {
        return durationMinutes;
    }

    /**
     * 某时刻是否落在窗口内（含端点）
     */
    public boolean contains(double julianDate) {
        return julianDate >= startJulianDate && julianDate <= endJulianDate;
    }

    @Override
    public String toString() {
        return "EventWindow{" +
                "subject='" + subject + '\'' +
                ", kind='" + kind + '\'' +
                ", start=" + startJulianDate +
                ", end=" + endJulianDate +
                ", duration=" + String.format("%.1f", durationMinutes) + "min" +
                '}';
    }
}
