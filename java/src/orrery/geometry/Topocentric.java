package orrery.geometry;

import org.hipparchus.util.FastMath;
import org.hipparchus.util.SinCos;
import org.orekit.utils.Constants;

/**
 * 周日视差改正（地心坐标 -> 站心坐标）
 *
 * 地球形状采用 WGS84 椭球
 */
public final class Topocentric {

    private static final double EARTH_RADIUS = Constants.WGS84_EARTH_EQUATORIAL_RADIUS;
    private static final double EARTH_FLATTENING = Constants.WGS84_EARTH_FLATTENING;
    private static final double AU = Constants.IAU_2012_ASTRONOMICAL_UNIT;

    private Topocentric() {
    }

    /**
     * 地心赤道坐标转站心赤道坐标
     *
     * @param raDeg 地心赤经（度）
     * @param decDeg 地心赤纬（度）
     * @param distanceAu 地心距离（AU）
     * @param latitudeDeg 观测者纬度（度）
     * @param lstHours 地方恒星时（小时）
     * @param heightMeters 观测者海拔（米）
     * @return 站心赤道坐标
     */
    public static EquatorialCoordinates toTopocentric(double raDeg, double decDeg, double distanceAu,
                                                      double latitudeDeg, double lstHours,
                                                      double heightMeters) {
        double lat = FastMath.toRadians(latitudeDeg);
        SinCos lst = FastMath.sinCos(FastMath.toRadians(lstHours * 15.0));

        double u = FastMath.atan((1 - EARTH_FLATTENING) * FastMath.tan(lat));
        double rhoSinPhi = (1 - EARTH_FLATTENING) * FastMath.sin(u)
                + (heightMeters / EARTH_RADIUS) * FastMath.sin(lat);
        double rhoCosPhi = FastMath.cos(u) + (heightMeters / EARTH_RADIUS) * FastMath.cos(lat);

        double radiusAu = EARTH_RADIUS / AU;
        double xo = radiusAu * rhoCosPhi * lst.cos();
        double yo = radiusAu * rhoCosPhi * lst.sin();
        double zo = radiusAu * rhoSinPhi;

        SinCos ra = FastMath.sinCos(FastMath.toRadians(raDeg));
        SinCos dec = FastMath.sinCos(FastMath.toRadians(decDeg));
        double xt = distanceAu * dec.cos() * ra.cos() - xo;
        double yt = distanceAu * dec.cos() * ra.sin() - yo;
        double zt = distanceAu * dec.sin() - zo;

        double rt = FastMath.sqrt(xt * xt + yt * yt + zt * zt);
        double raTop = Angles.normalizeDegrees(FastMath.toDegrees(FastMath.atan2(yt, xt)));
        double decTop = FastMath.toDegrees(FastMath.asin(zt / rt));
        return new EquatorialCoordinates(raTop, decTop);
    }
}
