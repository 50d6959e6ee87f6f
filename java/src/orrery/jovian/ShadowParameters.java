package orrery.jovian;

import orrery.geometry.Angles;

import org.hipparchus.util.FastMath;

import java.io.Serializable;

/**
 * 木星阴影投影参数
 *
 * 由日-木-地三角形的相位角 α 和太阳相对木星的赤经差方向决定，每单位 Z 的 X 偏移为 sign·tan α
 */
public class ShadowParameters implements Serializable {

    private static final long serialVersionUID = 1L;

    private final double phaseAngle;
    private final double shadowSign;
    private final double xShiftPerZ;

    public ShadowParameters(double phaseAngle, double shadowSign) {
        this.phaseAngle = phaseAngle;
        this.shadowSign = shadowSign;
        this.xShiftPerZ = shadowSign * FastMath.tan(phaseAngle);
    }

    /**
     * 由距离三角形和赤经计算
     *
     * @param sunRa 太阳赤经（度）
     * @param jupiterRa 木星赤经（度）
     * @param jupiterSunDistance 日木距离 R（AU）
     * @param jupiterEarthDistance 地木距离 Δ（AU）
     * @param earthSunDistance 日地距离 r（AU）
     */
    public static ShadowParameters fromGeometry(double sunRa, double jupiterRa,
                                                double jupiterSunDistance, double jupiterEarthDistance,
                                                double earthSunDistance) {
        double big = jupiterSunDistance;
        double delta = jupiterEarthDistance;
        double r = earthSunDistance;
        double cosAlpha = (big * big + delta * delta - r * r) / (2.0 * big * delta);
        double alpha = FastMath.acos(FastMath.max(-1.0, FastMath.min(1.0, cosAlpha)));
        double sign = Angles.wrapDegrees(sunRa - jupiterRa) > 0.0 ? 1.0 : -1.0;
        return new ShadowParameters(alpha, sign);
    }

    /** 相位角（弧度） */
    public double getPhaseAngle() {
        return phaseAngle;
    }

    public double getShadowSign() {
        return shadowSign;
    }

    public double getXShiftPerZ() {
        return xShiftPerZ;
    }

    @Override
    public String toString() {
        return "ShadowParameters{" +
                "phaseAngle=" + FastMath.toDegrees(phaseAngle) +
                ", sign=" + shadowSign +
                ", xShiftPerZ=" + xShiftPerZ +
                '}';
    }
}
