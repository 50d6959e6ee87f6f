package orrery.geometry;

import org.hipparchus.util.FastMath;

/**
 * 大气折射（标准大气：1010 hPa，10°C）
 *
 * Saemundsson 公式由真高度求视高度，Bennett 公式由视高度求真高度。
 * 低于 -1° 时不做改正。
 */
public final class Refraction {

    private static final double MIN_ALTITUDE = -1.0;

    private Refraction() {
    }

    /**
     * 真高度 -> 视高度（度）
     */
    public static double apparentFromTrue(double trueAltitudeDeg) {
        if (trueAltitudeDeg < MIN_ALTITUDE) {
            return trueAltitudeDeg;
        }
        double arg = trueAltitudeDeg + 10.3 / (trueAltitudeDeg + 5.11);
        double arcmin = 1.02 / FastMath.tan(FastMath.toRadians(arg));
        return trueAltitudeDeg + arcmin / 60.0;
    }

    /**
     * 视高度 -> 真高度（度）
     */
    public static double trueFromApparent(double apparentAltitudeDeg) {
        if (apparentAltitudeDeg < MIN_ALTITUDE) {
            return apparentAltitudeDeg;
        }
        double arg = apparentAltitudeDeg + 7.31 / (apparentAltitudeDeg + 4.4);
        double arcmin = 1.0 / FastMath.tan(FastMath.toRadians(arg));
        return apparentAltitudeDeg - arcmin / 60.0;
    }
}
