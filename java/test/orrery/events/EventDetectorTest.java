package orrery.events;

import org.hipparchus.analysis.UnivariateFunction;
import org.hipparchus.util.FastMath;
import orrery.geometry.Angles;
import org.junit.jupiter.api.Test;

import java.util.*;
import java.util.function.DoublePredicate;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class EventDetectorTest {

    private static final UnivariateFunction SINE = t -> FastMath.sin(2.0 * FastMath.PI * t / 10.0);

    @Test
    void bisectConvergenceTest() {
        double step = 1.0 / 1440.0;
        double t0 = 0.3 * step;
        double lo = 0.0;
        for (int iterations : new int[] {EventDetector.MINUTE_BRACKET_ITERATIONS, EventDetector.DAY_BRACKET_ITERATIONS}) {
            double root = EventDetector.bisect(t -> t - t0, lo, lo + step, iterations);
            assertTrue(FastMath.abs(root - t0) <= step / FastMath.pow(2.0, iterations),
                       "root " + root + " after " + iterations + " iterations");
        }
    }

    @Test
    void bisectPredicateTest() {
        DoublePredicate after = t -> t >= 7.25;
        double flip = EventDetector.bisectTransition(after, 7.0, 8.0, 12);
        assertEquals(7.25, flip, 1.0 / 4096.0);
    }

    @Test
    void findCrossingForwardAndBackwardTest() {
        Optional<Crossing> forward = EventDetector.findCrossing(SINE, 0.5, ScanDirection.FORWARD, 0.1, 200, 20);
        assertTrue(forward.isPresent());
        assertEquals(5.0, forward.get().getJulianDate(), 1e-6);
        assertFalse(forward.get().isRising());
        assertTrue(forward.get().getLowerBound() <= forward.get().getJulianDate());
        assertTrue(forward.get().getUpperBound() >= forward.get().getJulianDate());

        Optional<Crossing> backward = EventDetector.findCrossing(SINE, 4.5, ScanDirection.BACKWARD, 0.1, 200, 20);
        assertTrue(backward.isPresent());
        assertEquals(0.0, backward.get().getJulianDate(), 1e-6);
        assertTrue(backward.get().isRising(), "sine rises through zero at t = 0");
    }

    @Test
    void wrapJumpRejectedTest() {
        UnivariateFunction sawtooth = t -> Angles.wrapDegrees(36.0 * t);
        Optional<Crossing> guarded = EventDetector.findCrossing(sawtooth, 0.5, ScanDirection.FORWARD, 1.0, 30,
                                                                EventDetector.DAY_BRACKET_ITERATIONS, 180.0, null);
        assertTrue(guarded.isPresent());
        assertEquals(10.0, guarded.get().getJulianDate(), 1e-5);

        Optional<Crossing> unguarded = EventDetector.findCrossing(sawtooth, 0.5, ScanDirection.FORWARD, 1.0, 30,
                                                                  EventDetector.DAY_BRACKET_ITERATIONS);
        assertTrue(unguarded.isPresent());
        assertEquals(5.0, unguarded.get().getJulianDate(), 1e-5, "the ±180° jump looks like a root without a guard");
    }

    @Test
    void filterContinuesScanTest() {
        Optional<Crossing> rising = EventDetector.findCrossing(SINE, 0.5, ScanDirection.FORWARD, 0.1, 200, 20,
                                                               Double.POSITIVE_INFINITY, Crossing::isRising);
        assertTrue(rising.isPresent());
        assertEquals(10.0, rising.get().getJulianDate(), 1e-6);
    }

    @Test
    void noCrossingInRangeTest() {
        assertFalse(EventDetector.findCrossing(SINE, 0.5, ScanDirection.FORWARD, 0.1, 10, 20).isPresent());
    }

    @Test
    void goldenSectionTest() {
        double peak = EventDetector.goldenSection(t -> -(t - 3.3) * (t - 3.3), 0.0, 10.0, true,
                                                  EventDetector.GOLDEN_SECTION_EPSILON,
                                                  EventDetector.GOLDEN_SECTION_MAX_ITERATIONS);
        assertEquals(3.3, peak, 1e-4);
        double valley = EventDetector.goldenSection(t -> (t + 1.5) * (t + 1.5), -4.0, 4.0, false, 1e-6, 200);
        assertEquals(-1.5, valley, 1e-5);
    }

    @Test
    void findExtremumTest() {
        Optional<Extremum> max = EventDetector.findExtremum(SINE, 0.0, ScanDirection.FORWARD, 0.25, 100, true,
                                                            null, 1e-6, 200);
        assertTrue(max.isPresent());
        assertEquals(2.5, max.get().getJulianDate(), 1e-4);
        assertEquals(1.0, max.get().getValue(), 1e-6);
        assertTrue(max.get().isMaximum());

        Optional<Extremum> min = EventDetector.findExtremum(SINE, 0.0, ScanDirection.FORWARD, 0.25, 100, false,
                                                            v -> v < 0.0, 1e-6, 200);
        assertTrue(min.isPresent());
        assertEquals(7.5, min.get().getJulianDate(), 1e-4);

        assertFalse(EventDetector.findExtremum(SINE, 0.0, ScanDirection.FORWARD, 0.25, 100, true,
                                               v -> v > 2.0, 1e-6, 200).isPresent());
    }

    @Test
    void findExtremumAtStartTest() {
        UnivariateFunction hill = t -> -(t - 0.2) * (t - 0.2);
        for (ScanDirection direction : ScanDirection.values()) {
            Optional<Extremum> peak = EventDetector.findExtremum(hill, 0.0, direction, 1.0, 10, true, null,
                                                                 EventDetector.GOLDEN_SECTION_EPSILON,
                                                                 EventDetector.GOLDEN_SECTION_MAX_ITERATIONS);
            assertTrue(peak.isPresent(), "peak on the start sample, " + direction);
            assertEquals(0.2, peak.get().getJulianDate(), 1e-4);
        }
    }

    @Test
    void findAllTransitionsTest() {
        DoublePredicate inside = t -> t >= 2.3 && t <= 4.7;
        List<Crossing> transitions = EventDetector.findAllTransitions(inside, 0.0, 10.0, 1.0,
                                                                      EventDetector.MINUTE_BRACKET_ITERATIONS);
        assertEquals(2, transitions.size());
        assertEquals(2.3, transitions.get(0).getJulianDate(), 1.0 / 4096.0);
        assertTrue(transitions.get(0).isRising());
        assertEquals(4.7, transitions.get(1).getJulianDate(), 1.0 / 4096.0);
        assertFalse(transitions.get(1).isRising());
    }

    @Test
    void invalidArgumentsTest() {
        assertThrows(IllegalArgumentException.class,
                () -> EventDetector.findCrossing(SINE, 0.0, ScanDirection.FORWARD, 0.0, 10, 12));
        assertThrows(IllegalArgumentException.class,
                () -> EventDetector.findCrossing(SINE, 0.0, ScanDirection.FORWARD, -1.0, 10, 12));
        assertThrows(IllegalArgumentException.class,
                () -> EventDetector.findCrossing(SINE, 0.0, ScanDirection.FORWARD, 0.1, 10, 0));
        assertThrows(IllegalArgumentException.class,
                () -> EventDetector.findCrossing(SINE, 0.0, ScanDirection.FORWARD, 0.1, 0, 12));
        assertThrows(IllegalArgumentException.class,
                () -> EventDetector.bisect(SINE, 0.0, 1.0, -3));
    }
}
