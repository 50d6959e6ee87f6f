package orrery.jovian;

import org.hipparchus.geometry.euclidean.threed.Vector3D;

import java.util.*;

/**
 * 伽利略卫星位置理论
 */
public interface JovianSatelliteProvider {

    /**
     * 计算四颗卫星相对木星的视位置
     *
     * X 沿木星赤道向西为正，Y 向北，Z 指向地球为负（远侧为正），单位为木星赤道半径
     *
     * @param julianDateTT 力学时儒略日
     * @param deltaAu 地木距离（AU）
     * @param lambdaDeg 木星日心黄经（度，已做岁差改正）
     * @param betaDeg 木星日心黄纬（度）
     * @return 卫星 -> 位置；无法计算时为空映射
     */
    Map<GalileanMoon, Vector3D> positions(double julianDateTT, double deltaAu, double lambdaDeg, double betaDeg);
}
