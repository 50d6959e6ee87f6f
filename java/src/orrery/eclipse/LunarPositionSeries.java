package orrery.eclipse;

import orrery.geometry.Angles;
import orrery.geometry.JulianDates;

import org.hipparchus.util.FastMath;

/**
 * 月球视位置（ELP-2000/82 截断级数，60 项黄经/距离 + 60 项黄纬）
 *
 * 黄经含章动，赤道坐标使用真黄赤交角
 */
public final class LunarPositionSeries {

    /** 每行：D, M, M', F 的倍数；Σl 系数（1e-6 度）；Σr 系数（1e-3 km） */
    private static final int[][] LONGITUDE_DISTANCE_TERMS = {
        { 0,  0,  1,  0,   6288774,  -20905355},
        { 2,  0, -1,  0,   1274027,   -3699111},
        { 2,  0,  0,  0,    658314,   -2955968},
        { 0,  0,  2,  0,    213618,    -569925},
        { 0,  1,  0,  0,   -185116,      48888},
        { 0,  0,  0,  2,   -114332,      -3149},
        { 2,  0, -2,  0,     58793,     246158},
        { 2, -1, -1,  0,     57066,    -152138},
        { 2,  0,  1,  0,     53322,    -170733},
        { 2, -1,  0,  0,     45758,    -204586},
        { 0,  1, -1,  0,    -40923,    -129620},
        { 1,  0,  0,  0,    -34720,     108743},
        { 0,  1,  1,  0,    -30383,     104755},
        { 2,  0,  0, -2,     15327,      10321},
        { 0,  0,  1,  2,    -12528,          0},
        { 0,  0,  1, -2,     10980,      79661},
        { 4,  0, -1,  0,     10675,     -34782},
        { 0,  0,  3,  0,     10034,     -23210},
        { 4,  0, -2,  0,      8548,     -21636},
        { 2,  1, -1,  0,     -7888,      24208},
        { 2,  1,  0,  0,     -6766,      30824},
        { 1,  0, -1,  0,     -5163,      -8379},
        { 1,  1,  0,  0,      4987,     -16675},
        { 2, -1,  1,  0,      4036,     -12831},
        { 2,  0,  2,  0,      3994,     -10445},
        { 4,  0,  0,  0,      3861,     -11650},
        { 2,  0, -3,  0,      3665,      14403},
        { 0,  1, -2,  0,     -2689,      -7003},
        { 2,  0, -1,  2,     -2602,          0},
        { 2, -1, -2,  0,      2390,      10056},
        { 1,  0,  1,  0,     -2348,       6322},
        { 2, -2,  0,  0,      2236,      -9884},
        { 0,  1,  2,  0,     -2120,       5751},
        { 0,  2,  0,  0,     -2069,          0},
        { 2, -2, -1,  0,      2048,      -4950},
        { 2,  0,  1, -2,     -1773,       4130},
        { 2,  0,  0,  2,     -1595,          0},
        { 4, -1, -1,  0,      1215,      -3958},
        { 0,  0,  2,  2,     -1110,          0},
        { 3,  0, -1,  0,      -892,       3258},
        { 2,  1,  1,  0,      -810,       2616},
        { 4, -1, -2,  0,       759,      -1897},
        { 0,  2, -1,  0,      -713,      -2117},
        { 2,  2, -1,  0,      -700,       2354},
        { 2,  1, -2,  0,       691,          0},
        { 2, -1,  0, -2,       596,          0},
        { 4,  0,  1,  0,       549,      -1423},
        { 0,  0,  4,  0,       537,      -1117},
        { 4, -1,  0,  0,       520,      -1571},
        { 1,  0, -2,  0,      -487,      -1739},
        { 2,  1,  0, -2,      -399,          0},
        { 0,  0,  2, -2,      -381,      -4421},
        { 1,  1,  1,  0,       351,          0},
        { 3,  0, -2,  0,      -340,          0},
        { 4,  0, -3,  0,       330,          0},
        { 2, -1,  2,  0,       327,          0},
        { 0,  2,  1,  0,      -323,       1165},
        { 1,  1, -1,  0,       299,          0},
        { 2,  0,  3,  0,       294,          0},
        { 2,  0, -1, -2,         0,       8752}
    };

    /** 每行：D, M, M', F 的倍数；Σb 系数（1e-6 度） */
    private static final int[][] LATITUDE_TERMS = {
        { 0,  0,  0,  1,  5128122},
        { 0,  0,  1,  1,   280602},
        { 0,  0,  1, -1,   277693},
        { 2,  0,  0, -1,   173237},
        { 2,  0, -1,  1,    55413},
        { 2,  0, -1, -1,    46271},
        { 2,  0,  0,  1,    32573},
        { 0,  0,  2,  1,    17198},
        { 2,  0,  1, -1,     9266},
        { 0,  0,  2, -1,     8822},
        { 2, -1,  0, -1,     8216},
        { 2,  0, -2, -1,     4324},
        { 2,  0,  1,  1,     4200},
        { 2,  1,  0, -1,    -3359},
        { 2, -1, -1,  1,     2463},
        { 2, -1,  0,  1,     2211},
        { 2, -1, -1, -1,     2065},
        { 0,  1, -1, -1,    -1870},
        { 4,  0, -1, -1,     1828},
        { 0,  1,  0,  1,    -1794},
        { 0,  0,  0,  3,    -1749},
        { 0,  1, -1,  1,    -1565},
        { 1,  0,  0,  1,    -1491},
        { 0,  1,  1,  1,    -1475},
        { 0,  1,  1, -1,    -1410},
        { 0,  1,  0, -1,    -1344},
        { 1,  0,  0, -1,    -1335},
        { 0,  0,  3,  1,     1107},
        { 4,  0,  0, -1,     1021},
        { 4,  0, -1,  1,      833},
        { 0,  0,  1, -3,      777},
        { 4,  0, -2,  1,      671},
        { 2,  0,  0, -3,      607},
        { 2,  0,  2, -1,      596},
        { 2, -1,  1, -1,      491},
        { 2,  0, -2,  1,     -451},
        { 0,  0,  3, -1,      439},
        { 2,  0,  2,  1,      422},
        { 2,  0, -3, -1,      421},
        { 2,  1, -1,  1,     -366},
        { 2,  1,  0,  1,     -351},
        { 4,  0,  0,  1,      331},
        { 2, -1,  1,  1,      315},
        { 2, -2,  0, -1,      302},
        { 0,  0,  1,  3,     -283},
        { 2,  1,  1, -1,     -229},
        { 1,  1,  0, -1,      223},
        { 1,  1,  0,  1,      223},
        { 0,  1, -2, -1,     -220},
        { 2,  1, -1, -1,     -220},
        { 1,  0,  1,  1,     -185},
        { 2, -1, -2, -1,      181},
        { 0,  1,  2,  1,     -177},
        { 4,  0, -2, -1,      176},
        { 4, -1, -1, -1,      166},
        { 1,  0,  1, -1,     -164},
        { 4,  0,  1, -1,      132},
        { 1,  0, -1, -1,     -119},
        { 4, -1,  0, -1,      115},
        { 2, -2,  0,  1,      107}
    };

    private LunarPositionSeries() {
    }

    /**
     * 计算月球视位置
     *
     * @param julianDateTT 力学时儒略日
     */
    public static ApparentPosition compute(double julianDateTT) {
        double t = JulianDates.centuriesSinceJ2000(julianDateTT);
        double t2 = t * t;
        double t3 = t2 * t;
        double t4 = t3 * t;
        Nutation nutation = Nutation.compute(t);

        double lPrime = Angles.normalizeDegrees(218.3164477 + 481267.88123421 * t - 0.00157860 * t2
                                                + t3 / 538841.0 - t4 / 65194000.0);
        double d = Angles.normalizeDegrees(297.8501921 + 445267.1114034 * t - 0.0018819 * t2
                                           + t3 / 545868.0 - t4 / 113065000.0);
        double m = Angles.normalizeDegrees(357.5291092 + 35999.0502909 * t - 0.0001536 * t2
                                           + t3 / 24490000.0);
        double mPrime = Angles.normalizeDegrees(134.9633964 + 477198.8675055 * t + 0.0087414 * t2
                                                + t3 / 69699.0 - t4 / 14712000.0);
        double f = Angles.normalizeDegrees(93.2720950 + 483202.0175233 * t - 0.0036539 * t2
                                           - t3 / 3526000.0 - t4 / 863310000.0);
        double a1 = Angles.normalizeDegrees(119.75 + 131.849 * t);
        double a2 = Angles.normalizeDegrees(53.09 + 479264.290 * t);
        double a3 = Angles.normalizeDegrees(313.45 + 481266.484 * t);

        // 地球轨道偏心率修正
        double e = 1.0 - 0.002516 * t - 0.0000074 * t2;

        double[] args = {FastMath.toRadians(d), FastMath.toRadians(m),
                         FastMath.toRadians(mPrime), FastMath.toRadians(f)};

        double sigmaL = 0.0;
        double sigmaR = 0.0;
        for (int[] term : LONGITUDE_DISTANCE_TERMS) {
            double arg = argument(term, args);
            double factor = eccentricityFactor(term[1], e);
            sigmaL += factor * term[4] * FastMath.sin(arg);
            sigmaR += factor * term[5] * FastMath.cos(arg);
        }
        double sigmaB = 0.0;
        for (int[] term : LATITUDE_TERMS) {
            sigmaB += eccentricityFactor(term[1], e) * term[4] * FastMath.sin(argument(term, args));
        }

        // 金星、木星摄动及地球扁率项
        sigmaL += 3958.0 * sinDeg(a1) + 1962.0 * sinDeg(lPrime - f) + 318.0 * sinDeg(a2);
        sigmaB += -2235.0 * sinDeg(lPrime) + 382.0 * sinDeg(a3)
                  + 175.0 * sinDeg(a1 - f) + 175.0 * sinDeg(a1 + f)
                  + 127.0 * sinDeg(lPrime - mPrime) - 115.0 * sinDeg(lPrime + mPrime);

        double lambda = Angles.normalizeDegrees(lPrime + sigmaL * 1.0e-6 + nutation.getDeltaPsi() / 3600.0);
        double beta = sigmaB * 1.0e-6;
        double distanceKm = 385000.56 + sigmaR * 1.0e-3;

        double eps = FastMath.toRadians(nutation.getTrueObliquity());
        double lambdaRad = FastMath.toRadians(lambda);
        double betaRad = FastMath.toRadians(beta);
        double ra = FastMath.atan2(FastMath.sin(lambdaRad) * FastMath.cos(eps)
                                   - FastMath.tan(betaRad) * FastMath.sin(eps),
                                   FastMath.cos(lambdaRad));
        double dec = FastMath.asin(FastMath.sin(betaRad) * FastMath.cos(eps)
                                   + FastMath.cos(betaRad) * FastMath.sin(eps) * FastMath.sin(lambdaRad));

        return new ApparentPosition(Angles.normalizeDegrees(FastMath.toDegrees(ra)), FastMath.toDegrees(dec),
                                    lambda, beta, distanceKm);
    }

    private static double argument(int[] term, double[] args) {
        return term[0] * args[0] + term[1] * args[1] + term[2] * args[2] + term[3] * args[3];
    }

    private static double eccentricityFactor(int mMultiple, double e) {
        switch (Math.abs(mMultiple)) {
            case 1:
                return e;
            case 2:
                return e * e;
            default:
                return 1.0;
        }
    }

    private static double sinDeg(double degrees) {
        return FastMath.sin(FastMath.toRadians(degrees));
    }
}
