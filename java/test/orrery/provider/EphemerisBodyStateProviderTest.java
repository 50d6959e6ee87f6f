package orrery.provider;

import orrery.ephemeris.BodySample;
import orrery.ephemeris.EphemerisStore;
import orrery.ephemeris.OutOfRangeException;
import orrery.geometry.Angles;
import orrery.geometry.CoordinateTransforms;
import orrery.geometry.EclipticCoordinates;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.*;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

public class EphemerisBodyStateProviderTest {

    private static final double T0 = 2460000.5;

    private EphemerisBodyStateProvider provider;

    @BeforeEach
    void setUp() {
        EphemerisStore store = new EphemerisStore();
        List<BodySample> sun = new ArrayList<>();
        List<BodySample> mars = new ArrayList<>();
        for (int i = 0; i < 10; i++) {
            double jd = T0 + i;
            sun.add(new BodySample(jd, 330.0 + i, -10.0 + 0.4 * i, 0.99, 0.0, 334.0 + i, 0.0));
            mars.add(new BodySample(jd, 90.0, 24.0, 1.2, 1.6, 100.0 + 0.5 * i, 1.5));
        }
        store.load("Sun", sun);
        store.load("Mars", mars);
        provider = new EphemerisBodyStateProvider(store);
    }

    @Test
    void interpolatedStateTest() {
        BodyState mars = provider.getBodyState("Mars", T0 + 4.5);
        assertEquals(90.0, mars.getRa(), 1e-9);
        assertEquals(24.0, mars.getDec(), 1e-9);
        assertEquals(1.2, mars.getDistGeo(), 1e-12);
        assertEquals(102.25, mars.getHelioLon(), 1e-9);
        assertEquals(1.6, mars.getHelioPosition().getNorm(), 1e-9);

        EclipticCoordinates ecl = CoordinateTransforms.equatorialToEcliptic(90.0, 24.0, T0 + 4.5);
        assertEquals(ecl.getLongitude(), mars.getEclipticLon(), 1e-9);
        assertEquals(ecl.getLatitude(), mars.getEclipticLat(), 1e-9);
    }

    @Test
    void earthFromSunSamplesTest() {
        BodyState sun = provider.getBodyState("Sun", T0 + 3.0);
        BodyState earth = provider.getBodyState("Earth", T0 + 3.0);
        assertEquals(0.99, earth.getDistSun(), 1e-12);
        assertEquals(Angles.normalizeDegrees(sun.getEclipticLon() + 180.0), earth.getHelioLon(), 1e-9);
    }

    @Test
    void outOfCoverageTest() {
        assertThrows(OutOfRangeException.class, () -> provider.getBodyState("Mars", T0 + 20.0));
        assertThrows(OutOfRangeException.class, () -> provider.getBodyState("Jupiter", T0 + 1.0));
        assertThrows(OutOfRangeException.class, () -> provider.getBodyState("Earth", T0 - 1.0));
    }
}
