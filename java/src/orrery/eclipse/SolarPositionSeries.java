package orrery.eclipse;

import orrery.geometry.Angles;
import orrery.geometry.JulianDates;

import org.hipparchus.util.FastMath;

/**
 * 太阳视位置（中等精度解析式，约 0.01°）
 */
public final class SolarPositionSeries {

    /** 天文单位（km），与食表计算保持一致 */
    public static final double AU_KM = 149597870.691;

    private SolarPositionSeries() {
    }

    /**
     * 计算太阳视位置
     *
     * @param julianDateTT 力学时儒略日
     */
    public static ApparentPosition compute(double julianDateTT) {
        double t = JulianDates.centuriesSinceJ2000(julianDateTT);
        double t2 = t * t;
        double t3 = t2 * t;

        double l0 = Angles.normalizeDegrees(280.46646 + 36000.76983 * t + 0.0003032 * t2);
        double m = Angles.normalizeDegrees(357.52911 + 35999.05029 * t - 0.0001537 * t2);
        double e = 0.016708634 - 0.000042037 * t - 0.0000001267 * t2;
        double mRad = FastMath.toRadians(m);

        // 中心差
        double c = (1.914602 - 0.004817 * t - 0.000014 * t2) * FastMath.sin(mRad)
                   + (0.019993 - 0.000101 * t) * FastMath.sin(2.0 * mRad)
                   + 0.000289 * FastMath.sin(3.0 * mRad);

        double trueLongitude = l0 + c;
        double trueAnomaly = FastMath.toRadians(m + c);
        double radius = 1.000001018 * (1.0 - e * e) / (1.0 + e * FastMath.cos(trueAnomaly));

        double omega = FastMath.toRadians(125.04 - 1934.136 * t);
        double lambda = Angles.normalizeDegrees(trueLongitude - 0.00569 - 0.00478 * FastMath.sin(omega));

        double eps0 = 23.0 + 26.0 / 60.0 + 21.448 / 3600.0
                      - (46.8150 / 3600.0) * t
                      - (0.00059 / 3600.0) * t2
                      + (0.001813 / 3600.0) * t3;
        double eps = FastMath.toRadians(eps0 + 0.00256 * FastMath.cos(omega));
        double lambdaRad = FastMath.toRadians(lambda);

        double ra = FastMath.atan2(FastMath.cos(eps) * FastMath.sin(lambdaRad), FastMath.cos(lambdaRad));
        double dec = FastMath.asin(FastMath.sin(eps) * FastMath.sin(lambdaRad));

        return new ApparentPosition(Angles.normalizeDegrees(FastMath.toDegrees(ra)), FastMath.toDegrees(dec),
                                    lambda, 0.0, radius * AU_KM);
    }
}
