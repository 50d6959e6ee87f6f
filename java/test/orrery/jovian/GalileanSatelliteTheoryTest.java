package orrery.jovian;

import org.hipparchus.geometry.euclidean.threed.Vector3D;
import org.junit.jupiter.api.Test;

import java.util.*;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class GalileanSatelliteTheoryTest {

    /** 1992-12-16 0h UT，Meeus《天文算法》例 44.b */
    private static final double JDE = 2448972.50068;

    /** 该时刻木星的地心距离（AU）、当天分点黄经和黄纬（度） */
    private static final double DELTA = 5.6609;
    private static final double LAMBDA = 191.8045;
    private static final double BETA = 1.2417;

    private static final double TOLERANCE = 1e-3;

    private final GalileanSatelliteTheory theory = new GalileanSatelliteTheory();

    @Test
    void meeusExampleTest() {
        Map<GalileanMoon, Vector3D> positions = theory.positions(JDE, DELTA, LAMBDA, BETA);
        assertEquals(4, positions.size());

        assertPosition(positions.get(GalileanMoon.IO), -3.4502, 0.2137);
        assertPosition(positions.get(GalileanMoon.EUROPA), 7.4418, 0.2753);
        assertPosition(positions.get(GalileanMoon.GANYMEDE), 1.2010, 0.5900);
        assertPosition(positions.get(GalileanMoon.CALLISTO), 7.0720, 1.0291);

        // 四颗卫星此刻都在木星远侧
        for (Vector3D v : positions.values()) {
            assertTrue(v.getZ() < 0.0, v.toString());
        }
    }

    @Test
    void noGeometryTest() {
        assertTrue(theory.positions(Double.NaN, DELTA, LAMBDA, BETA).isEmpty());
        assertTrue(theory.positions(JDE, 0.0, LAMBDA, BETA).isEmpty());
    }

    private static void assertPosition(Vector3D actual, double x, double y) {
        assertEquals(x, actual.getX(), TOLERANCE, "X " + actual);
        assertEquals(y, actual.getY(), TOLERANCE, "Y " + actual);
    }
}
