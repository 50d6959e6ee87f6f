package orrery.events;

import java.util.*;
import java.util.concurrent.ConcurrentHashMap;
import java.util.logging.Logger;

/**
 * 事件窗口追踪器
 *
 * 线程安全的窗口记录器，把开始/结束事件配对成 {@link EventWindow}
 */
public class EventWindowTracker {

    private static final Logger logger = Logger.getLogger(EventWindowTracker.class.getName());

    private final Map<String, WindowBuilder> activeWindows = new ConcurrentHashMap<>();
    private final List<EventWindow> completedWindows = Collections.synchronizedList(new ArrayList<>());

    /**
     * 记录窗口开始
     *
     * @param subject 主体名
     * @param kind 现象种类
     * @param julianDate 开始时刻
     */
    public void recordWindowStart(String subject, String kind, double julianDate) {
        WindowBuilder builder = new WindowBuilder(subject, kind);
        builder.setStart(julianDate);
        activeWindows.put(buildKey(subject, kind), builder);
    }

    /**
     * 记录窗口结束；没有对应的开始时忽略（扫描开始前已在进行的现象）
     *
     * @param subject 主体名
     * @param kind 现象种类
     * @param julianDate 结束时刻
     */
    public void recordWindowEnd(String subject, String kind, double julianDate) {
        WindowBuilder builder = activeWindows.remove(buildKey(subject, kind));
        if (builder != null) {
            builder.setEnd(julianDate);
            completedWindows.add(builder.build());
        } else {
            logger.fine("End without start for " + subject + " " + kind + " at " + julianDate);
        }
    }

    /**
     * 获取所有完成的窗口（按开始时刻排序）
     *
     * 扫描结束时仍未关闭的窗口被丢弃，之后的结束事件不再与之配对
     */
    public List<EventWindow> getAllWindows() {
        for (Map.Entry<String, WindowBuilder> entry : new ArrayList<>(activeWindows.entrySet())) {
            WindowBuilder builder = entry.getValue();
            if (activeWindows.remove(entry.getKey(), builder)) {
                logger.info("Discarding open window " + builder.subject + " " + builder.kind +
                            " started at " + builder.start);
            }
        }
        List<EventWindow> windows = new ArrayList<>(completedWindows);
        windows.sort(Comparator.comparingDouble(EventWindow::getStartJulianDate));
        return windows;
    }

    public int getWindowCount() {
        return completedWindows.size();
    }

    public void clear() {
        activeWindows.clear();
        completedWindows.clear();
    }

    private String buildKey(String subject, String kind) {
        return subject + ":" + kind;
    }

    /**
     * 窗口构建器（内部类）
     */
    private static class WindowBuilder {
        private final String subject;
        private final String kind;
        private double start;
        private double end;

        WindowBuilder(String subject, String kind) {
            this.subject = subject;
            this.kind = kind;
        }

        void setStart(double start) {
            this.start = start;
        }

        void setEnd(double end) {
            this.end = end;
        }

        EventWindow build() {
            return new EventWindow(subject, kind, start, end);
        }
    }
}
