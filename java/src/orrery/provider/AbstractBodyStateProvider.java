package orrery.provider;

import orrery.geometry.Angles;
import orrery.geometry.CoordinateTransforms;

import org.hipparchus.geometry.euclidean.threed.Vector3D;

/**
 * 提供者基类：地球状态统一由太阳状态推导
 */
public abstract class AbstractBodyStateProvider implements BodyStateProvider {

    public static final String EARTH = "Earth";
    public static final String SUN = "Sun";
    public static final String MOON = "Moon";

    @Override
    public BodyState getBodyState(String name, double julianDate) {
        if (EARTH.equals(name)) {
            return earthState(julianDate);
        }
        return computeState(name, julianDate);
    }

    /**
     * 计算除地球外天体的状态
     */
    protected abstract BodyState computeState(String name, double julianDate);

    /**
     * 地球日心黄经 = 太阳地心黄经 + 180°，日心黄纬 = -太阳黄纬，日地距离 = 太阳地心距离
     */
    private BodyState earthState(double julianDate) {
        BodyState sun = computeState(SUN, julianDate);
        double helioLon = Angles.normalizeDegrees(sun.getEclipticLon() + 180.0);
        double helioLat = -sun.getEclipticLat();
        double helioDist = sun.getDistGeo();
        return BodyState.builder(EARTH, julianDate)
                .distances(0.0, helioDist)
                .heliocentric(helioLon, helioLat)
                .helioPosition(CoordinateTransforms.sphericalToCartesian(helioDist, helioLon, helioLat))
                .geoPosition(Vector3D.ZERO)
                .build();
    }
}
