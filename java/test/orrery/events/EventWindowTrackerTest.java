package orrery.events;

import org.junit.jupiter.api.Test;

import java.util.*;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class EventWindowTrackerTest {

    @Test
    void pairsStartAndEndTest() {
        EventWindowTracker tracker = new EventWindowTracker();
        TransitionHandler io = new TransitionHandler("Io", "TRANSIT", tracker);
        TransitionHandler europa = new TransitionHandler("Europa", "ECLIPSE", tracker);

        europa.transitionOccurred(10.2, true);
        io.transitionOccurred(10.1, true);
        io.transitionOccurred(10.15, false);
        europa.transitionOccurred(10.3, false);

        List<EventWindow> windows = tracker.getAllWindows();
        assertEquals(2, windows.size());
        assertEquals("Io", windows.get(0).getSubject());
        assertEquals("TRANSIT", windows.get(0).getKind());
        assertEquals(0.05 * 1440.0, windows.get(0).getDurationMinutes(), 1e-6);
        assertEquals("Europa", windows.get(1).getSubject());
        assertTrue(windows.get(1).contains(10.25));
    }

    @Test
    void unmatchedEventsDroppedTest() {
        EventWindowTracker tracker = new EventWindowTracker();
        // 扫描开始前已在进行
        tracker.recordWindowEnd("Ganymede", "OCCULTATION", 5.0);
        // 扫描结束时仍未结束
        tracker.recordWindowStart("Callisto", "SHADOW_TRANSIT", 6.0);

        assertEquals(0, tracker.getAllWindows().size());
        assertEquals(0, tracker.getWindowCount());

        tracker.recordWindowStart("Io", "TRANSIT", 7.0);
        tracker.recordWindowEnd("Io", "TRANSIT", 7.1);
        assertEquals(1, tracker.getWindowCount());
        tracker.clear();
        assertEquals(0, tracker.getWindowCount());
    }

    @Test
    void openWindowDiscardedOnceTest() {
        EventWindowTracker tracker = new EventWindowTracker();
        tracker.recordWindowStart("Callisto", "SHADOW_TRANSIT", 6.0);
        assertTrue(tracker.getAllWindows().isEmpty());

        // 已丢弃的窗口不能被后来的结束事件补全
        tracker.recordWindowEnd("Callisto", "SHADOW_TRANSIT", 6.5);
        assertEquals(0, tracker.getWindowCount());
        assertTrue(tracker.getAllWindows().isEmpty());
    }
}
