package orrery.eclipse;

import orrery.eclipse.model.EclipsePhaseWindow;
import orrery.eclipse.model.LocalCircumstances;
import orrery.eclipse.model.LunarEclipseRecord;
import orrery.eclipse.model.LunarEclipseType;
import orrery.eclipse.model.ShadowGeometry;
import orrery.visibility.Observer;
import orrery.visibility.VisibleLonRange;
import org.junit.jupiter.api.Test;

import java.util.*;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class LunarEclipseCalculatorTest {

    private static final Observer HONOLULU = new Observer("hnl", "Honolulu", 21.31, -157.86);
    private static final Observer CAIRO = new Observer("cai", "Cairo", 30.04, 31.24);
    /** 食甚前后月出 */
    private static final Observer EQUATOR_EAST = new Observer("eq", "Equator 101E", 0.0, 101.1);

    private final LunarEclipseCalculator calculator = new LunarEclipseCalculator();

    @Test
    void visibilityTest() {
        LunarEclipseRecord total = TestCanon.total2022();
        assertTrue(calculator.isVisible(total, HONOLULU));
        assertEquals(3, calculator.visibilityLevel(total, HONOLULU));
        assertFalse(calculator.isVisible(total, CAIRO));
        assertEquals(0, calculator.visibilityLevel(total, CAIRO));
    }

    @Test
    void alwaysUpCircumstancesTest() {
        LocalCircumstances local = calculator.localCircumstances(TestCanon.total2022(), HONOLULU);
        assertTrue(local.isAlwaysUp());
        assertTrue(local.isMoonUpAtStart());
        assertFalse(local.hasMoonrise());
        assertFalse(local.hasMoonset());
        assertEquals(85, local.getTotalMinutes(), 1);
        assertEquals(135, local.getPartialMinutes(), 1);
        assertEquals(140, local.getPenumbralMinutes(), 1);
        assertEquals(360, local.getVisibleMinutes(), 2);
    }

    @Test
    void neverUpCircumstancesTest() {
        LocalCircumstances local = calculator.localCircumstances(TestCanon.total2022(), CAIRO);
        assertTrue(local.isNeverUp());
        assertEquals(0, local.getVisibleMinutes());
    }

    @Test
    void moonriseDuringEclipseTest() {
        LunarEclipseRecord total = TestCanon.total2022();
        LocalCircumstances local = calculator.localCircumstances(total, EQUATOR_EAST);
        assertFalse(local.isMoonUpAtStart());
        assertTrue(local.hasMoonrise());
        assertFalse(local.hasMoonset());

        double greatest = total.getGreatestEclipseUt();
        assertEquals(greatest, local.getMoonrise(), 1.0 / 24.0);
        assertTrue(local.getTotalMinutes() > 0 && local.getTotalMinutes() < 85, local.toString());
        assertEquals(0, local.getPenumbralMinutes() - visiblePenumbralAfterRise(total, local.getMoonrise()), 1);
        assertTrue(calculator.isMoonUp(local.getMoonrise() + 0.01, total.getDeltaT(), EQUATOR_EAST));
        assertFalse(calculator.isMoonUp(local.getMoonrise() - 0.01, total.getDeltaT(), EQUATOR_EAST));
    }

    /** 月出后可见的半影阶段分钟数（月出在本影阶段内） */
    private static int visiblePenumbralAfterRise(LunarEclipseRecord record, double moonrise) {
        EclipsePhaseWindow w = EclipsePhaseWindow.forRecord(record);
        return (int) ((w.getPenumbralEnd() - w.getPartialEnd()) * 1440.0 + 0.5);
    }

    @Test
    void shadowGeometryAtGreatestTest() {
        LunarEclipseRecord total = TestCanon.total2022();
        ShadowGeometry greatest = calculator.shadowGeometry(total);
        assertTrue(greatest.isMoonCenterInUmbra(), greatest.toString());
        ShadowGeometry early = calculator.shadowGeometry(total, total.getGreatestEclipseUt() - 0.25);
        assertFalse(early.isMoonCenterInPenumbra(), early.toString());
    }

    @Test
    void visibleLongitudeRangeTest() {
        LunarEclipseRecord total = TestCanon.total2022();
        VisibleLonRange range = calculator.visibleLongitudeRange(total.getGreatestEclipseUt(), total.getDeltaT(), 21.31);
        assertTrue(range.contains(-157.86), range.toString());
        assertFalse(range.contains(31.24), range.toString());
    }

    @Test
    void filterTest() {
        List<LunarEclipseRecord> canon = Arrays.asList(TestCanon.total2022(), TestCanon.penumbral2023(),
                                                       TestCanon.partial2023());
        Set<LunarEclipseType> all = EnumSet.allOf(LunarEclipseType.class);

        assertEquals(3, calculator.filter(canon, 2022, 2023, all, null).size());
        assertEquals(2, calculator.filter(canon, 2023, 2030, all, null).size());

        List<LunarEclipseRecord> umbral = calculator.filter(canon, 2000, 2100,
                EnumSet.of(LunarEclipseType.PARTIAL, LunarEclipseType.TOTAL), null);
        assertEquals(2, umbral.size());
        assertEquals(LunarEclipseType.TOTAL, umbral.get(0).getType());

        List<LunarEclipseRecord> fromHonolulu = calculator.filter(canon, 2022, 2022, all, HONOLULU);
        assertEquals(1, fromHonolulu.size());
        assertTrue(calculator.filter(canon, 2022, 2022, all, CAIRO).isEmpty());
    }
}
