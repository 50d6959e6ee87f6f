package orrery.eclipse;

import orrery.geometry.Angles;

import org.hipparchus.util.FastMath;

/**
 * 章动（IAU 1980 理论，63 项）与黄赤交角
 *
 * 章动量单位为角秒，交角单位为度
 */
public final class Nutation {

    /**
     * 每行：D, M, M', F, Ω 的整数倍数；Δψ 系数及其 T 项；Δε 系数及其 T 项（0.0001"）
     */
    private static final double[][] TERMS = {
        { 0,  0,  0,  0,  1, -171996.0, -174.2, 92025.0, 8.9},
        {-2,  0,  0,  2,  2, -13187.0, -1.6, 5736.0, -3.1},
        { 0,  0,  0,  2,  2, -2274.0, -0.2, 977.0, -0.5},
        { 0,  0,  0,  0,  2, 2062.0, 0.2, -895.0, 0.5},
        { 0,  1,  0,  0,  0, 1426.0, -3.4, 54.0, -0.1},
        { 0,  0,  1,  0,  0, 712.0, 0.1, -7.0, 0.0},
        {-2,  1,  0,  2,  2, -517.0, 1.2, 224.0, -0.6},
        { 0,  0,  0,  2,  1, -386.0, -0.4, 200.0, 0.0},
        { 0,  0,  1,  2,  2, -301.0, 0.0, 129.0, -0.1},
        {-2, -1,  0,  2,  2, 217.0, -0.5, -95.0, 0.3},
        {-2,  0,  1,  0,  0, -158.0, 0.0, 0.0, 0.0},
        {-2,  0,  0,  2,  1, 129.0, 0.1, -70.0, 0.0},
        { 0,  0, -1,  2,  2, 123.0, 0.0, -53.0, 0.0},
        { 2,  0,  0,  0,  0, 63.0, 0.0, 0.0, 0.0},
        { 0,  0,  1,  0,  1, 63.0, 0.1, -33.0, 0.0},
        { 2,  0, -1,  2,  2, -59.0, 0.0, 26.0, 0.0},
        { 0,  0, -1,  0,  1, -58.0, -0.1, 32.0, 0.0},
        { 0,  0,  1,  2,  1, -51.0, 0.0, 27.0, 0.0},
        {-2,  0,  2,  0,  0, 48.0, 0.0, 0.0, 0.0},
        { 0,  0, -2,  2,  1, 46.0, 0.0, -24.0, 0.0},
        { 2,  0,  0,  2,  2, -38.0, 0.0, 16.0, 0.0},
        { 0,  0,  2,  2,  2, -31.0, 0.0, 13.0, 0.0},
        { 0,  0,  2,  0,  0, 29.0, 0.0, 0.0, 0.0},
        {-2,  0,  1,  2,  2, 29.0, 0.0, -12.0, 0.0},
        { 0,  0,  0,  2,  0, 26.0, 0.0, 0.0, 0.0},
        {-2,  0,  0,  2,  0, -22.0, 0.0, 0.0, 0.0},
        { 0,  0, -1,  2,  1, 21.0, 0.0, -10.0, 0.0},
        { 0,  2,  0,  0,  0, 17.0, -0.1, 0.0, 0.0},
        { 2,  0, -1,  0,  1, 16.0, 0.0, -8.0, 0.0},
        {-2,  2,  0,  2,  2, -16.0, 0.1, 7.0, 0.0},
        { 0,  1,  0,  0,  1, -15.0, 0.0, 9.0, 0.0},
        {-2,  0,  1,  0,  1, -13.0, 0.0, 7.0, 0.0},
        { 0, -1,  0,  0,  1, -12.0, 0.0, 6.0, 0.0},
        { 0,  0,  2, -2,  0, 11.0, 0.0, 0.0, 0.0},
        { 2,  0, -1,  2,  1, -10.0, 0.0, 5.0, 0.0},
        { 2,  0,  1,  2,  2, -8.0, 0.0, 3.0, 0.0},
        { 0,  1,  0,  2,  2, 7.0, 0.0, -3.0, 0.0},
        {-2,  1,  1,  0,  0, -7.0, 0.0, 0.0, 0.0},
        { 0, -1,  0,  2,  2, -7.0, 0.0, 3.0, 0.0},
        { 2,  0,  0,  2,  1, -7.0, 0.0, 3.0, 0.0},
        { 2,  0,  1,  0,  0, 6.0, 0.0, 0.0, 0.0},
        {-2,  0,  2,  2,  2, 6.0, 0.0, -3.0, 0.0},
        {-2,  0,  1,  2,  1, 6.0, 0.0, -3.0, 0.0},
        { 2,  0, -2,  0,  1, -6.0, 0.0, 3.0, 0.0},
        { 2,  0,  0,  0,  1, -6.0, 0.0, 3.0, 0.0},
        { 0, -1,  1,  0,  0, 5.0, 0.0, 0.0, 0.0},
        {-2, -1,  0,  2,  1, -5.0, 0.0, 3.0, 0.0},
        {-2,  0,  0,  0,  1, -5.0, 0.0, 3.0, 0.0},
        { 0,  0,  2,  2,  1, -5.0, 0.0, 3.0, 0.0},
        {-2,  0,  2,  0,  1, 4.0, 0.0, 0.0, 0.0},
        {-2,  1,  0,  2,  1, 4.0, 0.0, 0.0, 0.0},
        { 0,  0,  1, -2,  0, 4.0, 0.0, 0.0, 0.0},
        {-1,  0,  1,  0,  0, -4.0, 0.0, 0.0, 0.0},
        {-2,  1,  0,  0,  0, -4.0, 0.0, 0.0, 0.0},
        { 1,  0,  0,  0,  0, -4.0, 0.0, 0.0, 0.0},
        { 0,  0,  1,  2,  0, 3.0, 0.0, 0.0, 0.0},
        { 0,  0, -2,  2,  2, -3.0, 0.0, 0.0, 0.0},
        {-1, -1,  1,  0,  0, -3.0, 0.0, 0.0, 0.0},
        { 0,  1,  1,  0,  0, -3.0, 0.0, 0.0, 0.0},
        { 0, -1,  1,  2,  2, -3.0, 0.0, 0.0, 0.0},
        { 2, -1, -1,  2,  2, -3.0, 0.0, 0.0, 0.0},
        { 0,  0,  3,  2,  2, -3.0, 0.0, 0.0, 0.0},
        { 2, -1,  0,  2,  2, -3.0, 0.0, 0.0, 0.0}
    };

    private final double deltaPsi;
    private final double deltaEpsilon;
    private final double meanObliquity;

    private Nutation(double deltaPsi, double deltaEpsilon, double meanObliquity) {
        this.deltaPsi = deltaPsi;
        this.deltaEpsilon = deltaEpsilon;
        this.meanObliquity = meanObliquity;
    }

    /**
     * 计算章动
     *
     * @param t 自 J2000.0 起的儒略世纪数（TT）
     */
    public static Nutation compute(double t) {
        double t2 = t * t;
        double t3 = t2 * t;
        double d = Angles.normalizeDegrees(297.85036 + 445267.111480 * t - 0.0019142 * t2 + t3 / 189474.0);
        double m = Angles.normalizeDegrees(357.52772 + 35999.050340 * t - 0.0001603 * t2 - t3 / 300000.0);
        double mPrime = Angles.normalizeDegrees(134.96298 + 477198.867398 * t + 0.0086972 * t2 + t3 / 56250.0);
        double f = Angles.normalizeDegrees(93.27191 + 483202.017538 * t - 0.0036825 * t2 + t3 / 327270.0);
        double omega = Angles.normalizeDegrees(125.04452 - 1934.136261 * t + 0.0020708 * t2 + t3 / 450000.0);

        double dPsi = 0.0;
        double dEps = 0.0;
        for (double[] term : TERMS) {
            double arg = FastMath.toRadians(term[0] * d + term[1] * m + term[2] * mPrime
                                            + term[3] * f + term[4] * omega);
            dPsi += (term[5] + term[6] * t) * FastMath.sin(arg);
            dEps += (term[7] + term[8] * t) * FastMath.cos(arg);
        }
        dPsi *= 1.0e-4;
        dEps *= 1.0e-4;

        return new Nutation(dPsi, dEps, meanObliquity(t));
    }

    /**
     * 平黄赤交角（Laskar 多项式，度）
     *
     * @param t 自 J2000.0 起的儒略世纪数
     */
    public static double meanObliquity(double t) {
        double u = t / 100.0;
        double[] coefficients = {-4680.93, -1.55, 1999.25, -51.38, -249.67, -39.05, 7.12, 27.87, 5.79, 2.45};
        double sum = 0.0;
        double power = u;
        for (double c : coefficients) {
            sum += c * power;
            power *= u;
        }
        return 23.0 + 26.0 / 60.0 + (21.448 + sum) / 3600.0;
    }

    /** 黄经章动（角秒） */
    public double getDeltaPsi() {
        return deltaPsi;
    }

    /** 交角章动（角秒） */
    public double getDeltaEpsilon() {
        return deltaEpsilon;
    }

    /** 平黄赤交角（度） */
    public double getMeanObliquity() {
        return meanObliquity;
    }

    /** 真黄赤交角（度） */
    public double getTrueObliquity() {
        return meanObliquity + deltaEpsilon / 3600.0;
    }
}
