package orrery.jovian;

import orrery.events.EventWindow;
import orrery.jovian.model.EventVisibility;
import orrery.jovian.model.JovianEvent;

import java.io.Serializable;
import java.util.*;

/**
 * 木卫事件表
 *
 * 按时间排序的事件（含同时发生提示）以及配对得到的现象窗口
 */
public class JovianEventReport implements Serializable {

    private static final long serialVersionUID = 1L;

    private final double startJulianDate;
    private final double endJulianDate;
    private final List<JovianEvent> events;
    private final List<EventWindow> windows;

    public JovianEventReport(double startJulianDate, double endJulianDate,
                             List<JovianEvent> events, List<EventWindow> windows) {
        this.startJulianDate = startJulianDate;
        this.endJulianDate = endJulianDate;
        this.events = Collections.unmodifiableList(new ArrayList<>(events));
        this.windows = Collections.unmodifiableList(new ArrayList<>(windows));
    }

    public double getStartJulianDate() {
        return startJulianDate;
    }

    public double getEndJulianDate() {
        return endJulianDate;
    }

    public List<JovianEvent> getEvents() {
        return events;
    }

    public List<EventWindow> getWindows() {
        return windows;
    }

    /**
     * 标为 NEXT 的事件
     */
    public Optional<JovianEvent> getNextVisibleEvent() {
        for (JovianEvent event : events) {
            if (event.getVisibility() == EventVisibility.NEXT && !event.isSimultaneousAlert()) {
                return Optional.of(event);
            }
        }
        return Optional.empty();
    }

    @Override
    public String toString() {
        return "JovianEventReport{" +
                "start=" + startJulianDate +
                ", end=" + endJulianDate +
                ", events=" + events.size() +
                ", windows=" + windows.size() +
                '}';
    }
}
