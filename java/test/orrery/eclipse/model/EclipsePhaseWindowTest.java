package orrery.eclipse.model;

import orrery.geometry.JulianDates;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class EclipsePhaseWindowTest {

    private static final double GREATEST = 2459891.5;

    @Test
    void symmetricTotalTest() {
        EclipsePhaseWindow w = EclipsePhaseWindow.symmetric(GREATEST, LunarEclipseType.TOTAL, 360.0, 220.0, 86.0);
        assertTrue(w.hasPartial());
        assertTrue(w.hasTotal());
        assertEquals(GREATEST - 180.0 / 1440.0, w.getPenumbralStart(), 1e-9);
        assertEquals(GREATEST + 110.0 / 1440.0, w.getPartialEnd(), 1e-9);
        assertEquals(86.0 / 1440.0, w.getTotalEnd() - w.getTotalStart(), 1e-9);
        assertEquals(0.25, w.getPenumbralSpan(), 1e-9);

        assertEquals(3, w.depthAt(GREATEST));
        assertEquals(2, w.depthAt(GREATEST + 60.0 / 1440.0));
        assertEquals(1, w.depthAt(GREATEST - 150.0 / 1440.0));
        assertEquals(0, w.depthAt(GREATEST + 0.2));
    }

    @Test
    void absentPhasesTest() {
        EclipsePhaseWindow pen = EclipsePhaseWindow.symmetric(GREATEST, LunarEclipseType.PENUMBRAL, 240.0, 0.0, 0.0);
        assertFalse(pen.hasPartial());
        assertFalse(pen.hasTotal());
        assertTrue(Double.isNaN(pen.getPartialStart()));
        assertEquals(1, pen.depthAt(GREATEST));

        EclipsePhaseWindow partial = EclipsePhaseWindow.symmetric(GREATEST, LunarEclipseType.PARTIAL, 260.0, 80.0, 0.0);
        assertTrue(partial.hasPartial());
        assertFalse(partial.hasTotal());
        assertEquals(2, partial.depthAt(GREATEST));
    }

    @Test
    void nestingViolationRejectedTest() {
        // 本影阶段超出半影阶段
        assertThrows(IllegalArgumentException.class,
                () -> EclipsePhaseWindow.symmetric(GREATEST, LunarEclipseType.PARTIAL, 60.0, 90.0, 0.0));
        assertThrows(IllegalArgumentException.class,
                () -> new EclipsePhaseWindow(GREATEST, 1.0, 0.0, Double.NaN, Double.NaN, Double.NaN, Double.NaN));
        assertThrows(IllegalArgumentException.class,
                () -> new EclipsePhaseWindow(GREATEST, 0.0, 1.0, Double.NaN, Double.NaN, 0.4, 0.6));
        assertThrows(IllegalArgumentException.class,
                () -> new EclipsePhaseWindow(GREATEST, 0.0, 1.0, 0.2, Double.NaN, Double.NaN, Double.NaN));
    }

    @Test
    void forRecordTest() {
        LunarEclipseRecord record = LunarEclipseRecord.builder(LunarEclipseRecord.packDate(2022, 11, 8),
                                                               LunarEclipseType.TOTAL)
                .greatestEclipse(39551.0f, 70)
                .durations(359.9f, 219.6f, 84.9f)
                .build();
        double expectedUt = JulianDates.fromCalendar(2022, 11, 8, 0.0) + (39551.0 - 70.0) / 86400.0;
        assertEquals(expectedUt, record.getGreatestEclipseUt(), 1e-9);

        EclipsePhaseWindow w = EclipsePhaseWindow.forRecord(record);
        assertEquals(expectedUt, w.getGreatestEclipse(), 1e-9);
        assertEquals(359.9 / 1440.0, w.getPenumbralSpan(), 1e-6);
    }
}
