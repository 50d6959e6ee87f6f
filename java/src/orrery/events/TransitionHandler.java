package orrery.events;

/**
 * 翻转事件处理器
 *
 * 把某个主体一种现象的翻转事件转交给窗口追踪器：谓词由假变真记为窗口开始，由真变假记为窗口结束
 */
public class TransitionHandler {

    private final String subject;
    private final String kind;
    private final EventWindowTracker tracker;

    /**
     * @param subject 主体名
     * @param kind 现象种类
     * @param tracker 窗口追踪器
     */
    public TransitionHandler(String subject, String kind, EventWindowTracker tracker) {
        this.subject = subject;
        this.kind = kind;
        this.tracker = tracker;
    }

    /**
     * 处理一次翻转
     *
     * @param julianDate 细化后的时刻
     * @param increasing 谓词是否由假变真
     */
    public void transitionOccurred(double julianDate, boolean increasing) {
        if (increasing) {
            tracker.recordWindowStart(subject, kind, julianDate);
        } else {
            tracker.recordWindowEnd(subject, kind, julianDate);
        }
    }

    public String getSubject() {
        return subject;
    }

    public String getKind() {
        return kind;
    }
}
