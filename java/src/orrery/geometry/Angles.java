package orrery.geometry;

import org.hipparchus.util.FastMath;

/**
 * 角度归一化工具
 *
 * 所有方法以度或小时为单位，采用向下取整的取模（结果符号跟随除数）
 */
public final class Angles {

    private Angles() {
    }

    /**
     * 取模（floor division），结果与除数同号
     */
    public static double modulo(double dividend, double divisor) {
        return dividend - divisor * FastMath.floor(dividend / divisor);
    }

    /**
     * 归一化到 [0, 360)
     */
    public static double normalizeDegrees(double deg) {
        double v = modulo(deg, 360.0);
        return v >= 360.0 ? 0.0 : v;
    }

    /**
     * 归一化到 (-180, 180]
     */
    public static double wrapDegrees(double deg) {
        double v = normalizeDegrees(deg);
        return v > 180.0 ? v - 360.0 : v;
    }

    /**
     * 归一化到 [0, 24)
     */
    public static double normalizeHours(double hours) {
        double v = modulo(hours, 24.0);
        return v >= 24.0 ? 0.0 : v;
    }

    /**
     * 归一化到 (-12, 12]（时角）
     */
    public static double wrapHours(double hours) {
        double v = normalizeHours(hours);
        return v > 12.0 ? v - 24.0 : v;
    }

    /**
     * 将 value 展开到 reference 的 ±180° 范围内
     *
     * @param value 待展开角度（度）
     * @param reference 参考角度（度）
     * @return 与 reference 之差落在 [-180, 180] 内的等价角度
     */
    public static double unwrapNear(double value, double reference) {
        return reference + wrapDegrees(value - reference);
    }
}
