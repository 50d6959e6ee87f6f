package orrery.jovian;

import orrery.ephemeris.OutOfRangeException;
import orrery.events.EventDetector;
import orrery.events.EventSearchConfig;
import orrery.events.EventWindowTracker;
import orrery.events.TransitionHandler;
import orrery.jovian.model.EventVisibility;
import orrery.jovian.model.JovianEvent;
import orrery.jovian.model.MoonGeometryState;
import orrery.jovian.model.RawEvent;

import org.orekit.utils.Constants;

import java.util.*;
import java.util.function.DoublePredicate;
import java.util.logging.Logger;

/**
 * 木卫事件生成器
 *
 * 以分钟步长扫描四颗卫星的四种现象，状态翻转处二分细化；掩与食互相屏蔽（可配置）。
 * 无数据的时刻跳过，不中断扫描。
 */
public class JovianEventGenerator {

    private static final Logger logger = Logger.getLogger(JovianEventGenerator.class.getName());

    /** 开始事件后检查同时现象的延迟（日） */
    private static final double ALERT_CHECK_DELAY = 1.0 / Constants.JULIAN_DAY;

    private final JovianStateSource source;
    private final EventSearchConfig config;

    public JovianEventGenerator(JovianStateSource source, EventSearchConfig config) {
        this.source = source;
        this.config = config;
    }

    public JovianEventGenerator(JovianStateSource source) {
        this(source, new EventSearchConfig());
    }

    /**
     * 生成 [start, start + jovianScanDays] 的事件表
     *
     * @param startJulianDate 起始儒略日（UT）
     * @param nowJulianDate 当前时刻，其后第一个可见事件标为 NEXT
     * @param visible 某时刻事件对观测者是否可见
     */
    public JovianEventReport generate(double startJulianDate, double nowJulianDate, DoublePredicate visible) {
        double end = startJulianDate + config.getJovianScanDays();
        EventWindowTracker tracker = new EventWindowTracker();
        List<RawEvent> raw = scan(startJulianDate, end, tracker);

        List<JovianEvent> events = new ArrayList<>();
        boolean nextFound = false;
        for (RawEvent event : raw) {
            boolean isVisible = visible.test(event.getJulianDate());
            EventVisibility visibility = isVisible ? EventVisibility.VISIBLE : EventVisibility.HIDDEN;
            if (isVisible && !nextFound && event.getJulianDate() >= nowJulianDate) {
                visibility = EventVisibility.NEXT;
                nextFound = true;
            }
            events.add(new JovianEvent(event, visibility));
            if (event.isStart()) {
                JovianEvent alert = simultaneityAlert(event, visibility);
                if (alert != null) {
                    events.add(alert);
                }
            }
        }

        logger.info("Generated " + raw.size() + " Jovian events in [" + startJulianDate + ", " + end + "]");
        return new JovianEventReport(startJulianDate, end, events, tracker.getAllWindows());
    }

    /**
     * 扫描 [start, end] 的全部翻转事件，按时间排序
     */
    public List<RawEvent> scan(double startJulianDate, double endJulianDate) {
        return scan(startJulianDate, endJulianDate, new EventWindowTracker());
    }

    private List<RawEvent> scan(double startJulianDate, double endJulianDate, EventWindowTracker tracker) {
        double step = config.getMinuteStep();
        int iterations = config.getMinuteIterations();
        int totalSteps = (int) ((endJulianDate - startJulianDate) / step);

        Map<String, TransitionHandler> handlers = new HashMap<>();
        List<RawEvent> events = new ArrayList<>();
        double t = startJulianDate;
        Map<GalileanMoon, MoonGeometryState> prev = safeState(t);
        for (int k = 0; k < totalSteps; k++) {
            double next = startJulianDate + (k + 1) * step;
            Map<GalileanMoon, MoonGeometryState> curr = safeState(next);
            if (!prev.isEmpty() && !curr.isEmpty()) {
                for (GalileanMoon moon : GalileanMoon.values()) {
                    MoonGeometryState p = prev.get(moon);
                    MoonGeometryState c = curr.get(moon);
                    if (p == null || c == null) {
                        continue;
                    }
                    for (JovianEventKind kind : JovianEventKind.values()) {
                        boolean before = kind.isActive(p);
                        boolean after = kind.isActive(c);
                        if (before == after) {
                            continue;
                        }
                        double refined = EventDetector.bisectTransition(
                                jd -> isActive(jd, moon, kind), t, next, iterations);
                        if (config.isMaskHiddenTransitions() && isMasked(refined, moon, kind)) {
                            logger.fine("Masked " + kind + " of " + moon.getDisplayName() + " at " + refined);
                            continue;
                        }
                        String text = kind.describe(moon.getDisplayName(), after);
                        events.add(new RawEvent(refined, text, moon, kind, after));
                        handlers.computeIfAbsent(moon.getDisplayName() + ":" + kind,
                                key -> new TransitionHandler(moon.getDisplayName(), kind.name(), tracker))
                                .transitionOccurred(refined, after);
                    }
                }
            }
            prev = curr;
            t = next;
        }
        events.sort(Comparator.comparingDouble(RawEvent::getJulianDate));
        return events;
    }

    /**
     * 掩发生时卫星已在食中，或食发生时卫星已被掩，则不单独报告
     */
    private boolean isMasked(double julianDate, GalileanMoon moon, JovianEventKind kind) {
        if (kind != JovianEventKind.OCCULTATION && kind != JovianEventKind.ECLIPSE) {
            return false;
        }
        MoonGeometryState state = safeState(julianDate).get(moon);
        if (state == null) {
            return false;
        }
        return kind == JovianEventKind.OCCULTATION ? state.isEclipse() : state.isOccultation();
    }

    private JovianEvent simultaneityAlert(RawEvent event, EventVisibility visibility) {
        Map<GalileanMoon, MoonGeometryState> check = safeState(event.getJulianDate() + ALERT_CHECK_DELAY);
        int count = 0;
        for (MoonGeometryState state : check.values()) {
            if (event.getKind().isActive(state)) {
                count++;
            }
        }
        if (count < 2) {
            return null;
        }
        switch (event.getKind()) {
            case TRANSIT:
                return JovianEvent.alert(event.getJulianDate(),
                        "*** There are now " + count + " moons transiting! ***", visibility);
            case SHADOW_TRANSIT:
                return JovianEvent.alert(event.getJulianDate(),
                        "*** There are now " + count + " shadows transiting! ***", visibility);
            case OCCULTATION:
                return JovianEvent.alert(event.getJulianDate(),
                        "*** There are now " + count + " moons occulted! ***", visibility);
            default:
                return null;
        }
    }

    private boolean isActive(double julianDate, GalileanMoon moon, JovianEventKind kind) {
        MoonGeometryState state = safeState(julianDate).get(moon);
        return state != null && kind.isActive(state);
    }

    /**
     * 无数据（空映射或超出星历范围）时返回空映射
     */
    private Map<GalileanMoon, MoonGeometryState> safeState(double julianDate) {
        try {
            return source.stateAt(julianDate);
        } catch (OutOfRangeException e) {
            logger.fine("Skipping " + julianDate + ": " + e.getMessage());
            return Collections.emptyMap();
        }
    }
}
