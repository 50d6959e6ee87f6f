package orrery.jovian;

import orrery.jovian.model.MoonGeometryState;
import orrery.provider.KeplerianBodyStateProvider;
import org.hipparchus.geometry.euclidean.threed.Vector3D;
import org.hipparchus.util.FastMath;
import org.junit.jupiter.api.Test;

import java.util.*;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class JovianShadowGeometryTest {

    private static final ShadowParameters NO_PHASE = new ShadowParameters(0.0, 1.0);

    @Test
    void inFrontOfDiskTest() {
        // 理论坐标的 Z 取反后为正，表示在木星前方
        MoonGeometryState s = JovianShadowGeometry.evaluate(GalileanMoon.IO, new Vector3D(0.3, 0.2, -5.0), NO_PHASE);
        assertTrue(s.isTransit());
        assertTrue(s.isShadowTransit());
        assertFalse(s.isOccultation());
        assertFalse(s.isEclipse());
        assertEquals(5.0, s.getZ(), 0.0);
    }

    @Test
    void behindDiskTest() {
        MoonGeometryState s = JovianShadowGeometry.evaluate(GalileanMoon.IO, new Vector3D(0.3, 0.2, 5.0), NO_PHASE);
        assertFalse(s.isTransit());
        assertFalse(s.isShadowTransit());
        assertTrue(s.isOccultation());
        assertTrue(s.isEclipse());
    }

    @Test
    void flattenedDiskTest() {
        GalileanMoon io = GalileanMoon.IO;
        assertTrue(JovianShadowGeometry.evaluate(io, new Vector3D(1.02, 0.0, -5.0), NO_PHASE).isTransit());
        assertTrue(JovianShadowGeometry.evaluate(io, new Vector3D(0.0, 0.95, -5.0), NO_PHASE).isTransit());
        // 极半径为赤道半径的 15/16
        assertFalse(JovianShadowGeometry.evaluate(io, new Vector3D(0.0, 1.0, -5.0), NO_PHASE).isTransit());
    }

    @Test
    void shadowOffsetTest() {
        ShadowParameters shadow = new ShadowParameters(FastMath.atan(0.5), 1.0);
        assertEquals(0.5, shadow.getXShiftPerZ(), 1e-12);

        // 卫星在前方 z = 2，影子向 +X 偏移 1
        MoonGeometryState front = JovianShadowGeometry.evaluate(GalileanMoon.EUROPA, new Vector3D(-0.5, 0.0, -2.0), shadow);
        assertEquals(0.5, front.getShadowX(), 1e-12);
        assertTrue(front.isTransit());
        assertTrue(front.isShadowTransit());

        // 卫星在后方 z = -2，本影中心在 X = 1
        MoonGeometryState behind = JovianShadowGeometry.evaluate(GalileanMoon.EUROPA, new Vector3D(1.8, 0.0, 2.0), shadow);
        assertFalse(behind.isOccultation());
        assertTrue(behind.isEclipse());
    }

    @Test
    void mutualExclusionTest() {
        JovianSystem system = new JovianSystem(new KeplerianBodyStateProvider());
        double start = 2460676.5;
        for (int h = 0; h < 24 * 20; h += 3) {
            Map<GalileanMoon, MoonGeometryState> states = system.stateAt(start + h / 24.0);
            assertEquals(4, states.size());
            for (MoonGeometryState s : states.values()) {
                assertFalse(s.isTransit() && s.isOccultation(), s.toString());
                assertFalse(s.isShadowTransit() && s.isEclipse(), s.toString());
                double limit = s.getMoon().getMeanDistance() * 1.2;
                assertTrue(FastMath.abs(s.getX()) < limit, s.toString());
            }
        }
    }
}
