package orrery.jovian;

import orrery.jovian.model.MoonGeometryState;

import org.hipparchus.geometry.euclidean.threed.Vector3D;

import java.util.*;

/**
 * 木卫凌、影凌、掩、食的几何判定
 *
 * 木星按扁率 1/16 的椭圆盘处理，Y 方向按 1/(1-f) 放大后与圆盘比较。
 * 输入的 Z 取反后，z > 0 表示卫星在木星前方。
 */
public final class JovianShadowGeometry {

    /** 木星扁率，极/赤半径比 15/16 */
    public static final double FLATTENING = 1.0 / 16.0;

    private static final double Y_SCALE = 1.0 / (1.0 - FLATTENING);

    private JovianShadowGeometry() {
    }

    /**
     * 单颗卫星的几何状态
     *
     * @param moon 卫星
     * @param position 卫星理论给出的位置（木星半径）
     * @param shadow 阴影投影参数
     */
    public static MoonGeometryState evaluate(GalileanMoon moon, Vector3D position, ShadowParameters shadow) {
        double x = position.getX();
        double y = position.getY();
        double z = -position.getZ();
        double limitSq = (1.0 + moon.getRadius()) * (1.0 + moon.getRadius());

        double yScaled = y * Y_SCALE;
        boolean onDisk = x * x + yScaled * yScaled < limitSq;
        boolean transit = z > 0.0 && onDisk;
        boolean occultation = z < 0.0 && onDisk;

        double shift = shadow.getXShiftPerZ();
        double shadowX = x + z * shift;
        double shadowY = y;
        double shadowYScaled = shadowY * Y_SCALE;
        boolean shadowTransit = z > 0.0 && shadowX * shadowX + shadowYScaled * shadowYScaled < limitSq;

        // 本影中心在卫星所在 Z 平面上的 X 位置
        double centerX = -z * shift;
        double dx = x - centerX;
        boolean eclipse = z < 0.0 && dx * dx + yScaled * yScaled < limitSq;

        return new MoonGeometryState(moon, x, y, z, shadowX, shadowY,
                                     transit, occultation, shadowTransit, eclipse);
    }

    /**
     * 全部卫星的几何状态；positions 为空时返回空映射
     */
    public static Map<GalileanMoon, MoonGeometryState> evaluateAll(Map<GalileanMoon, Vector3D> positions,
                                                                   ShadowParameters shadow) {
        Map<GalileanMoon, MoonGeometryState> states = new EnumMap<>(GalileanMoon.class);
        for (Map.Entry<GalileanMoon, Vector3D> entry : positions.entrySet()) {
            states.put(entry.getKey(), evaluate(entry.getKey(), entry.getValue(), shadow));
        }
        return states;
    }
}
