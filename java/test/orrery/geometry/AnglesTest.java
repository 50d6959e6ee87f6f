package orrery.geometry;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;

public class AnglesTest {

    @Test
    void normalizeDegreesTest() {
        assertEquals(10.0, Angles.normalizeDegrees(370.0), 1e-12);
        assertEquals(350.0, Angles.normalizeDegrees(-10.0), 1e-12);
        assertEquals(0.0, Angles.normalizeDegrees(720.0), 1e-12);
        assertEquals(0.0, Angles.normalizeDegrees(-1e-18), 1e-12, "tiny negative must not map to 360");
    }

    @Test
    void wrapDegreesTest() {
        assertEquals(-170.0, Angles.wrapDegrees(190.0), 1e-12);
        assertEquals(180.0, Angles.wrapDegrees(-180.0), 1e-12);
        assertEquals(-1.0, Angles.wrapDegrees(359.0), 1e-12);
    }

    @Test
    void hoursTest() {
        assertEquals(1.5, Angles.normalizeHours(25.5), 1e-12);
        assertEquals(23.0, Angles.normalizeHours(-1.0), 1e-12);
        assertEquals(-11.0, Angles.wrapHours(13.0), 1e-12);
        assertEquals(12.0, Angles.wrapHours(-12.0), 1e-12);
    }

    @Test
    void unwrapNearTest() {
        assertEquals(361.0, Angles.unwrapNear(1.0, 359.0), 1e-12);
        assertEquals(-1.0, Angles.unwrapNear(359.0, 1.0), 1e-12);
        assertEquals(45.0, Angles.unwrapNear(45.0, 40.0), 1e-12);
    }
}
