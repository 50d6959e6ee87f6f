package orrery.eclipse;

import orrery.eclipse.model.ShadowGeometry;
import orrery.eclipse.model.ShadowRadii;
import orrery.geometry.JulianDates;
import org.hipparchus.util.FastMath;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class EarthShadowModelTest {

    private static final double AU = SolarPositionSeries.AU_KM;

    @Test
    void radiiAtMeanDistanceTest() {
        ShadowRadii radii = EarthShadowModel.shadowRadii(AU, 384400.0);
        // 乘 1.05 大气放大后本影约 4836 km，半影约 8592 km
        assertEquals(4836.0, radii.getUmbraEquatorial(), 30.0);
        assertEquals(8592.0, radii.getPenumbraEquatorial(), 30.0);
        assertTrue(radii.getUmbraPolar() < radii.getUmbraEquatorial());
        assertTrue(radii.getPenumbraPolar() < radii.getPenumbraEquatorial());
        // 半影与本影半径之差约为月距处太阳视直径
        double sunDiameterAtMoon = 2.0 * EarthShadowModel.SOLAR_RADIUS / AU * 384400.0
                                   * EarthShadowModel.ATMOSPHERIC_EXPANSION;
        assertEquals(sunDiameterAtMoon, radii.getPenumbraEquatorial() - radii.getUmbraEquatorial(), 50.0);
    }

    @Test
    void umbraShrinksWithDistanceTest() {
        double near = EarthShadowModel.umbraRadius(EarthShadowModel.EARTH_EQUATORIAL_RADIUS, AU, 360000.0);
        double far = EarthShadowModel.umbraRadius(EarthShadowModel.EARTH_EQUATORIAL_RADIUS, AU, 405000.0);
        assertTrue(near > far);
        double nearPen = EarthShadowModel.penumbraRadius(EarthShadowModel.EARTH_EQUATORIAL_RADIUS, AU, 360000.0);
        double farPen = EarthShadowModel.penumbraRadius(EarthShadowModel.EARTH_EQUATORIAL_RADIUS, AU, 405000.0);
        assertTrue(farPen > nearPen);
    }

    @Test
    void exactOppositionTest() {
        ApparentPosition sun = new ApparentPosition(200.0, -10.0, 202.0, 0.0, AU);
        ApparentPosition moon = new ApparentPosition(20.0, 10.0, 22.0, 0.0, 384400.0);
        ShadowGeometry g = EarthShadowModel.shadowGeometry(2459891.5, sun, moon);
        assertEquals(0.0, g.getX(), 1e-6);
        assertEquals(0.0, g.getY(), 1e-6);
        assertTrue(g.isMoonCenterInUmbra());
        assertEquals(EarthShadowModel.MOON_RADIUS, g.getMoonDiskRadius(), 1.0);
        assertEquals(0.259, g.getMoonAngularRadius(), 0.001);
    }

    @Test
    void totalEclipse2022Test() {
        double greatestTT = JulianDates.fromCalendar(2022, 11, 8, 0.0) + 39551.0 / 86400.0;
        ShadowGeometry g = EarthShadowModel.shadowGeometry(greatestTT);
        assertTrue(g.isMoonCenterInUmbra(), g.toString());
        assertTrue(g.isMoonCenterInPenumbra());
        assertTrue(FastMath.hypot(g.getX(), g.getY()) < 2000.0, g.toString());

        ShadowGeometry before = EarthShadowModel.shadowGeometry(greatestTT - 0.25);
        assertFalse(before.isMoonCenterInPenumbra(), before.toString());
    }
}
