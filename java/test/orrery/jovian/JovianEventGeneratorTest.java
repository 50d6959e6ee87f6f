package orrery.jovian;

import orrery.events.EventSearchConfig;
import orrery.events.EventWindow;
import orrery.jovian.model.EventVisibility;
import orrery.jovian.model.JovianEvent;
import orrery.jovian.model.MoonGeometryState;
import orrery.jovian.model.RawEvent;
import org.hipparchus.geometry.euclidean.threed.Vector3D;
import org.hipparchus.util.FastMath;
import org.junit.jupiter.api.Test;

import java.util.*;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class JovianEventGeneratorTest {

    private static final double T0 = 2460676.5;

    /**
     * 木卫一以每日 6 个木星半径匀速沿 +X 穿过，木卫二静止在圆盘前方
     */
    private static JovianStateSource linearSource(double ioZ, ShadowParameters shadow) {
        return jd -> {
            Map<GalileanMoon, MoonGeometryState> states = new EnumMap<>(GalileanMoon.class);
            double x = -3.0 + 6.0 * (jd - T0);
            states.put(GalileanMoon.IO, JovianShadowGeometry.evaluate(GalileanMoon.IO, new Vector3D(x, 0.0, ioZ), shadow));
            states.put(GalileanMoon.EUROPA,
                       JovianShadowGeometry.evaluate(GalileanMoon.EUROPA, new Vector3D(0.0, 0.5, -3.0), shadow));
            states.put(GalileanMoon.GANYMEDE,
                       JovianShadowGeometry.evaluate(GalileanMoon.GANYMEDE, new Vector3D(10.0, 0.0, 5.0), shadow));
            states.put(GalileanMoon.CALLISTO,
                       JovianShadowGeometry.evaluate(GalileanMoon.CALLISTO, new Vector3D(-20.0, 0.0, 5.0), shadow));
            return states;
        };
    }

    private static EventSearchConfig oneDayConfig() {
        EventSearchConfig config = new EventSearchConfig();
        config.setJovianScanDays(1.0);
        return config;
    }

    @Test
    void transitRefinementTest() {
        EventSearchConfig config = oneDayConfig();
        JovianEventGenerator generator = new JovianEventGenerator(linearSource(-2.0, new ShadowParameters(0.0, 1.0)), config);
        List<RawEvent> events = generator.scan(T0, T0 + 1.0);

        List<RawEvent> transits = events.stream()
                .filter(e -> e.getKind() == JovianEventKind.TRANSIT)
                .collect(Collectors.toList());
        assertEquals(2, transits.size());
        assertTrue(transits.get(0).isStart());
        assertFalse(transits.get(1).isStart());
        assertEquals("Io begins transit of Jupiter", transits.get(0).getText());

        double radius = 1.0 + GalileanMoon.IO.getRadius();
        double[] exact = {T0 + (3.0 - radius) / 6.0, T0 + (3.0 + radius) / 6.0};
        double step = config.getMinuteStep();
        for (int i = 0; i < 2; i++) {
            double refined = transits.get(i).getJulianDate();
            long k = (long) FastMath.floor((exact[i] - T0) / step);
            assertTrue(refined > T0 + k * step && refined < T0 + (k + 1) * step, "refined " + refined);
            assertEquals(exact[i], refined, step / 1000.0);
        }

        // 影子与卫星重合，影凌同时发生
        assertEquals(2, events.stream().filter(e -> e.getKind() == JovianEventKind.SHADOW_TRANSIT).count());
        assertEquals(4, events.size());
    }

    @Test
    void reportWithAlertsTest() {
        JovianEventGenerator generator = new JovianEventGenerator(linearSource(-2.0, new ShadowParameters(0.0, 1.0)),
                                                                  oneDayConfig());
        JovianEventReport report = generator.generate(T0, T0, jd -> true);

        List<JovianEvent> alerts = report.getEvents().stream()
                .filter(JovianEvent::isSimultaneousAlert)
                .collect(Collectors.toList());
        assertEquals(2, alerts.size());
        assertEquals("*** There are now 2 moons transiting! ***", alerts.get(0).getText());
        assertEquals("*** There are now 2 shadows transiting! ***", alerts.get(1).getText());
        assertEquals(6, report.getEvents().size());

        Optional<JovianEvent> next = report.getNextVisibleEvent();
        assertTrue(next.isPresent());
        assertEquals(GalileanMoon.IO, next.get().getMoon());
        assertEquals(JovianEventKind.TRANSIT, next.get().getKind());

        List<EventWindow> windows = report.getWindows();
        assertEquals(2, windows.size());
        for (EventWindow window : windows) {
            assertEquals("Io", window.getSubject());
            assertEquals(2.0 * (1.0 + GalileanMoon.IO.getRadius()) / 6.0 * 1440.0, window.getDurationMinutes(), 0.01);
        }
    }

    @Test
    void hiddenEventsTest() {
        JovianEventGenerator generator = new JovianEventGenerator(linearSource(-2.0, new ShadowParameters(0.0, 1.0)),
                                                                  oneDayConfig());
        JovianEventReport report = generator.generate(T0, T0, jd -> false);
        assertFalse(report.getNextVisibleEvent().isPresent());
        for (JovianEvent event : report.getEvents()) {
            assertEquals(EventVisibility.HIDDEN, event.getVisibility());
        }
    }

    @Test
    void occultationEclipseMaskingTest() {
        // 卫星在木星后方，影锥向 +X 偏移 1 个半径
        ShadowParameters shadow = new ShadowParameters(FastMath.atan(0.5), 1.0);

        EventSearchConfig masked = oneDayConfig();
        List<RawEvent> events = new JovianEventGenerator(linearSource(2.0, shadow), masked).scan(T0, T0 + 1.0);
        assertEquals(2, events.size());
        assertEquals(JovianEventKind.OCCULTATION, events.get(0).getKind());
        assertTrue(events.get(0).isStart());
        assertEquals(JovianEventKind.ECLIPSE, events.get(1).getKind());
        assertFalse(events.get(1).isStart());

        EventSearchConfig unmasked = oneDayConfig();
        unmasked.setMaskHiddenTransitions(false);
        List<RawEvent> all = new JovianEventGenerator(linearSource(2.0, shadow), unmasked).scan(T0, T0 + 1.0);
        assertEquals(4, all.size());
    }

    @Test
    void missingDataSkippedTest() {
        JovianStateSource gappy = jd -> jd < T0 + 0.5 ? Collections.emptyMap()
                                                      : linearSource(-2.0, new ShadowParameters(0.0, 1.0)).stateAt(jd);
        List<RawEvent> events = new JovianEventGenerator(gappy, oneDayConfig()).scan(T0, T0 + 1.0);
        // 只剩下后半天的两个结束事件
        assertEquals(2, events.size());
        assertFalse(events.get(0).isStart());
        assertFalse(events.get(1).isStart());
    }
}
