package orrery.geometry;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;

public class SiderealTimeTest {

    @Test
    void gmstTest() {
        // 1987-04-10 0h UT：13h10m46.3668s
        double expected = 13.0 + 10.0 / 60.0 + 46.3668 / 3600.0;
        assertEquals(expected, SiderealTime.gmstHours(2446895.5), 1e-5);
    }

    @Test
    void lstAndHourAngleTest() {
        double jd = 2446895.5;
        assertEquals(Angles.normalizeHours(SiderealTime.gmstHours(jd) + 6.0), SiderealTime.lstHours(jd, 90.0), 1e-9);
        assertEquals(-2.0, SiderealTime.hourAngleHours(1.0, 3.0), 1e-12);
        assertEquals(2.0, SiderealTime.hourAngleHours(1.0, 23.0), 1e-12);
    }
}
