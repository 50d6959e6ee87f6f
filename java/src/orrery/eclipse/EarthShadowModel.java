package orrery.eclipse;

import orrery.eclipse.model.ShadowGeometry;
import orrery.eclipse.model.ShadowRadii;

import org.hipparchus.util.FastMath;

/**
 * 地影锥几何
 *
 * 用相似三角形求月球距离处的本影、半影半径，并计入大气造成的 5% 扩大。
 * 只用于绘制食况示意图和求月球视大小，各阶段时刻取自食表历时。
 */
public final class EarthShadowModel {

    /** 太阳半径（km） */
    public static final double SOLAR_RADIUS = 695990.0;

    /** 地球赤道半径（km） */
    public static final double EARTH_EQUATORIAL_RADIUS = 6378.164;

    /** 地球极半径（km） */
    public static final double EARTH_POLAR_RADIUS = 6356.779;

    /** 月球半径（km） */
    public static final double MOON_RADIUS = 1738.2;

    /** 大气对地影的扩大系数 */
    public static final double ATMOSPHERIC_EXPANSION = 1.05;

    private EarthShadowModel() {
    }

    /**
     * 月球距离处的地影半径
     *
     * @param sunDistance 日地距离（km）
     * @param moonDistance 地月距离（km）
     */
    public static ShadowRadii shadowRadii(double sunDistance, double moonDistance) {
        return new ShadowRadii(umbraRadius(EARTH_EQUATORIAL_RADIUS, sunDistance, moonDistance),
                               umbraRadius(EARTH_POLAR_RADIUS, sunDistance, moonDistance),
                               penumbraRadius(EARTH_EQUATORIAL_RADIUS, sunDistance, moonDistance),
                               penumbraRadius(EARTH_POLAR_RADIUS, sunDistance, moonDistance));
    }

    /**
     * 本影半径：L 为太阳到本影锥顶的距离
     */
    static double umbraRadius(double earthRadius, double sunDistance, double moonDistance) {
        double l = sunDistance * (1.0 + earthRadius / (SOLAR_RADIUS - earthRadius));
        return SOLAR_RADIUS * (l - sunDistance - moonDistance) / l * ATMOSPHERIC_EXPANSION;
    }

    /**
     * 半影半径：Lp 为太阳到半影锥顶（日地之间）的距离
     */
    static double penumbraRadius(double earthRadius, double sunDistance, double moonDistance) {
        double lp = SOLAR_RADIUS * sunDistance / (SOLAR_RADIUS + earthRadius);
        return SOLAR_RADIUS * (sunDistance - lp + moonDistance) / lp * ATMOSPHERIC_EXPANSION;
    }

    /**
     * 由日月视位置求月球在影面上的位置
     *
     * @param julianDate 时刻，仅作记录
     * @param sun 太阳视位置
     * @param moon 月球视位置
     */
    public static ShadowGeometry shadowGeometry(double julianDate, ApparentPosition sun, ApparentPosition moon) {
        double moonDistance = moon.getDistanceKm();
        double dRa = FastMath.toRadians(sun.getRightAscension() - moon.getRightAscension()) - FastMath.PI;
        double dDec = FastMath.toRadians(-sun.getDeclination() - moon.getDeclination());
        double x = FastMath.sin(dRa) * moonDistance;
        double y = -FastMath.sin(dDec) * moonDistance;

        double angularRadius = FastMath.atan(MOON_RADIUS / moonDistance);
        return new ShadowGeometry(julianDate, x, y, FastMath.toDegrees(angularRadius),
                                  angularRadius * moonDistance,
                                  shadowRadii(sun.getDistanceKm(), moonDistance));
    }

    /**
     * 用解析级数求某力学时刻的影面位置
     *
     * @param julianDateTT 力学时儒略日
     */
    public static ShadowGeometry shadowGeometry(double julianDateTT) {
        return shadowGeometry(julianDateTT, SolarPositionSeries.compute(julianDateTT),
                              LunarPositionSeries.compute(julianDateTT));
    }
}
