package orrery.geometry;

import org.hipparchus.geometry.euclidean.threed.Vector3D;
import org.hipparchus.util.FastMath;
import org.hipparchus.util.SinCos;

/**
 * 赤道/黄道坐标转换
 */
public final class CoordinateTransforms {

    private CoordinateTransforms() {
    }

    /**
     * 平黄赤交角（度）
     *
     * @param jd 儒略日
     */
    public static double meanObliquity(double jd) {
        double t = JulianDates.centuriesSinceJ2000(jd);
        return 23.439291 - 0.0130042 * t;
    }

    /**
     * 赤道坐标转黄道坐标（使用当日平黄赤交角）
     *
     * @param raDeg 赤经（度）
     * @param decDeg 赤纬（度）
     * @param jd 儒略日
     * @return 黄经 [0, 360)，黄纬
     */
    public static EclipticCoordinates equatorialToEcliptic(double raDeg, double decDeg, double jd) {
        SinCos eps = FastMath.sinCos(FastMath.toRadians(meanObliquity(jd)));
        SinCos alpha = FastMath.sinCos(FastMath.toRadians(raDeg));
        SinCos delta = FastMath.sinCos(FastMath.toRadians(decDeg));

        double sinBeta = delta.sin() * eps.cos() - delta.cos() * eps.sin() * alpha.sin();
        double cbCl = delta.cos() * alpha.cos();
        double cbSl = delta.sin() * eps.sin() + delta.cos() * eps.cos() * alpha.sin();

        double lambda = FastMath.toDegrees(FastMath.atan2(cbSl, cbCl));
        double beta = FastMath.toDegrees(FastMath.asin(FastMath.max(-1.0, FastMath.min(1.0, sinBeta))));
        return new EclipticCoordinates(Angles.normalizeDegrees(lambda), beta);
    }

    /**
     * 黄道坐标转赤道坐标
     *
     * @param lonDeg 黄经（度）
     * @param latDeg 黄纬（度）
     * @param obliquityDeg 黄赤交角（度）
     */
    public static EquatorialCoordinates eclipticToEquatorial(double lonDeg, double latDeg, double obliquityDeg) {
        SinCos eps = FastMath.sinCos(FastMath.toRadians(obliquityDeg));
        SinCos lambda = FastMath.sinCos(FastMath.toRadians(lonDeg));
        SinCos beta = FastMath.sinCos(FastMath.toRadians(latDeg));

        double y = lambda.sin() * eps.cos() - beta.sin() / beta.cos() * eps.sin();
        double ra = FastMath.toDegrees(FastMath.atan2(y, lambda.cos()));
        double sinDec = beta.sin() * eps.cos() + beta.cos() * eps.sin() * lambda.sin();
        double dec = FastMath.toDegrees(FastMath.asin(FastMath.max(-1.0, FastMath.min(1.0, sinDec))));
        return new EquatorialCoordinates(Angles.normalizeDegrees(ra), dec);
    }

    /**
     * 球坐标转笛卡尔坐标
     *
     * @param distance 距离
     * @param lonDeg 经度（度）
     * @param latDeg 纬度（度）
     */
    public static Vector3D sphericalToCartesian(double distance, double lonDeg, double latDeg) {
        SinCos lon = FastMath.sinCos(FastMath.toRadians(lonDeg));
        SinCos lat = FastMath.sinCos(FastMath.toRadians(latDeg));
        return new Vector3D(distance * lat.cos() * lon.cos(),
                            distance * lat.cos() * lon.sin(),
                            distance * lat.sin());
    }
}
