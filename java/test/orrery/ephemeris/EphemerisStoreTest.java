package orrery.ephemeris;

import org.hipparchus.exception.MathIllegalArgumentException;
import org.junit.jupiter.api.Test;

import java.util.*;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class EphemerisStoreTest {

    private static final double T0 = 2451545.0;

    /**
     * 赤经每天增加 2°，跨越 360°；其他通道线性变化
     */
    static List<BodySample> wrappingSamples(int count) {
        List<BodySample> samples = new ArrayList<>();
        for (int k = 0; k < count; k++) {
            double ra = (350.0 + 2.0 * k) % 360.0;
            samples.add(new BodySample(T0 + k, ra, -5.0 + 0.5 * k, 1.0 + 0.01 * k, 5.2, (100.0 + k) % 360.0, 1.0));
        }
        return samples;
    }

    @Test
    void roundTripTest() {
        EphemerisStore store = new EphemerisStore();
        List<BodySample> samples = wrappingSamples(12);
        store.load("Jupiter", samples);

        for (BodySample s : samples) {
            InterpolatedState state = store.interpolate("Jupiter", s.getJulianDate());
            assertEquals(s.getRa(), state.getRa(), 1e-9, "ra at " + s.getJulianDate());
            assertEquals(s.getDec(), state.getDec(), 1e-9);
            assertEquals(s.getDistGeo(), state.getDistGeo(), 1e-9);
            assertEquals(s.getDistSun(), state.getDistSun(), 1e-9);
            assertEquals(s.getEclipticLon(), state.getEclipticLon(), 1e-9);
            assertEquals(s.getEclipticLat(), state.getEclipticLat(), 1e-9);
        }
        assertEquals(12, store.getSampleCount("Jupiter"));
        assertEquals(samples.get(3), store.getSample("Jupiter", 3));
    }

    @Test
    void angleContinuityTest() {
        EphemerisStore store = new EphemerisStore();
        store.load("Mars", wrappingSamples(12));

        // 358° -> 0° 之间
        assertEquals(359.0, store.interpolate("Mars", T0 + 4.5).getRa(), 1e-9);
        // 0° -> 2° 之间
        assertEquals(1.0, store.interpolate("Mars", T0 + 5.5).getRa(), 1e-9);
        double ra = store.interpolate("Mars", T0 + 4.99).getRa();
        assertTrue(ra >= 0.0 && ra < 360.0, "normalized ra " + ra);
    }

    @Test
    void outOfRangeTest() {
        EphemerisStore store = new EphemerisStore();
        store.load("Venus", wrappingSamples(5));

        OutOfRangeException before = assertThrows(OutOfRangeException.class,
                () -> store.interpolate("Venus", T0 - 0.001));
        assertEquals("Venus", before.getBodyName());
        assertThrows(OutOfRangeException.class, () -> store.interpolate("Venus", T0 + 4.001));
        assertThrows(OutOfRangeException.class, () -> store.interpolate("Saturn", T0 + 1.0));
        assertThrows(OutOfRangeException.class, () -> store.interpolate("Venus", Double.NaN));
    }

    @Test
    void nonMonotonicTableRejectedTest() {
        EphemerisStore store = new EphemerisStore();
        double[] times = {T0, T0 + 2.0, T0 + 1.0};
        double[][] channels = new double[3][EphemerisStore.CHANNEL_COUNT];
        assertThrows(MathIllegalArgumentException.class, () -> store.load("Mercury", times, channels));
        assertFalse(store.contains("Mercury"));
    }

    @Test
    void nonFiniteTimeRejectedTest() {
        EphemerisStore store = new EphemerisStore();
        double[][] channels = new double[3][EphemerisStore.CHANNEL_COUNT];
        assertThrows(MathIllegalArgumentException.class,
                () -> store.load("Venus", new double[] {T0, Double.NaN, T0 + 2.0}, channels));
        assertThrows(MathIllegalArgumentException.class,
                () -> store.load("Venus", new double[] {T0, T0 + 1.0, Double.POSITIVE_INFINITY}, channels));
        assertFalse(store.contains("Venus"));
    }

    @Test
    void coverageTest() {
        EphemerisStore store = new EphemerisStore();
        store.load("Neptune", wrappingSamples(7));
        double[] coverage = store.getCoverage("Neptune");
        assertEquals(T0, coverage[0], 0.0);
        assertEquals(T0 + 6.0, coverage[1], 0.0);
        assertEquals(Collections.singleton("Neptune"), store.getBodyNames());
    }
}
