package orrery.visibility;

import orrery.geometry.JulianDates;
import orrery.geometry.SiderealTime;
import orrery.provider.KeplerianBodyStateProvider;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class RiseSetCalculatorTest {

    private final RiseSetCalculator calculator = new RiseSetCalculator(new KeplerianBodyStateProvider());

    @Test
    void semiDiurnalArcTest() {
        assertEquals(6.0, RiseSetCalculator.semiDiurnalArc(0.0, 0.0, 0.0), 1e-9);
        assertTrue(Double.isNaN(RiseSetCalculator.semiDiurnalArc(80.0, 20.0, -0.5667)));
        assertEquals(HorizonStatus.CIRCUMPOLAR, RiseSetCalculator.resolveStatus(80.0, 20.0, -0.5667));
        assertEquals(HorizonStatus.NEVER_RISES, RiseSetCalculator.resolveStatus(80.0, -20.0, -0.5667));
        assertEquals(HorizonStatus.RISES_AND_SETS, RiseSetCalculator.resolveStatus(45.0, 20.0, -0.5667));
    }

    @Test
    void closedFormTest() {
        Observer observer = new Observer("eq", "Equator", 0.0, 0.0);
        double midnight = JulianDates.localMidnight(2024, 1, 1, 0.0);
        double raDeg = SiderealTime.lstHours(midnight, 0.0) * 15.0 + 135.0;

        PlanetEvents events = RiseSetCalculator.closedForm(raDeg, 0.0, observer, 0.0, 2024, 1, 1);
        assertEquals(HorizonStatus.RISES_AND_SETS, events.getStatus());
        assertEquals(9.0 * RiseSetCalculator.SIDEREAL_FACTOR, events.getTransit(), 1e-6);
        assertEquals(3.0 * RiseSetCalculator.SIDEREAL_FACTOR, events.getRise(), 1e-6);
        assertEquals(15.0 * RiseSetCalculator.SIDEREAL_FACTOR, events.getSet(), 1e-6);

        PlanetEvents circumpolar = RiseSetCalculator.closedForm(raDeg, 60.0, new Observer("n", "North", 70.0, 0.0),
                                                                -0.5667, 2024, 1, 1);
        assertEquals(HorizonStatus.CIRCUMPOLAR, circumpolar.getStatus());
        assertTrue(Double.isNaN(circumpolar.getRise()));
    }

    @Test
    void equinoxSunTest() {
        Observer observer = new Observer("eq", "Equator", 0.0, 0.0);
        PlanetEvents sun = calculator.compute("Sun", 2024, 3, 20, observer);
        assertEquals(HorizonStatus.RISES_AND_SETS, sun.getStatus());
        // 时差约 -7.5 分钟
        assertEquals(12.12, sun.getTransit(), 0.05);
        assertEquals(6.06, sun.getRise(), 0.1);
        assertEquals(18.18, sun.getSet(), 0.1);
    }

    @Test
    void midsummerDayLengthTest() {
        Observer london = new Observer("lon", "London", 51.5, 0.0);
        PlanetEvents sun = calculator.compute("Sun", 2024, 6, 21, london);
        assertEquals(16.6, sun.getSet() - sun.getRise(), 0.15);

        Observer tromso = new Observer("tos", "Tromso", 69.65, 18.96, 0.0, 1.0);
        PlanetEvents midnightSun = calculator.compute("Sun", 2024, 6, 21, tromso);
        assertEquals(HorizonStatus.CIRCUMPOLAR, midnightSun.getStatus());
        assertTrue(Double.isNaN(midnightSun.getRise()));
        assertTrue(Double.isNaN(midnightSun.getSet()));
    }
}
