package orrery.jovian.model;

import orrery.jovian.GalileanMoon;

import java.io.Serializable;

/**
 * 单颗木卫某时刻的几何状态
 *
 * 坐标以木星赤道半径为单位，z > 0 表示在木星前方
 */
public class MoonGeometryState implements Serializable {

    private static final long serialVersionUID = 1L;

    private final GalileanMoon moon;
    private final double x;
    private final double y;
    private final double z;
    private final double shadowX;
    private final double shadowY;
    private final boolean transit;
    private final boolean occultation;
    private final boolean shadowTransit;
    private final boolean eclipse;

    public MoonGeometryState(GalileanMoon moon, double x, double y, double z,
                             double shadowX, double shadowY,
                             boolean transit, boolean occultation,
                             boolean shadowTransit, boolean eclipse) {
        this.moon = moon;
        this.x = x;
        this.y = y;
        this.z = z;
        this.shadowX = shadowX;
        this.shadowY = shadowY;
        this.transit = transit;
        this.occultation = occultation;
        this.shadowTransit = shadowTransit;
        this.eclipse = eclipse;
    }

    // Getters
    public GalileanMoon getMoon() {
        return moon;
    }

    public double getX() {
        return x;
    }

    public double getY() {
        return y;
    }

    public double getZ() {
        return z;
    }

    public double getShadowX() {
        return shadowX;
    }

    public double getShadowY() {
        return shadowY;
    }

    public boolean isTransit() {
        return transit;
    }

    public boolean isOccultation() {
        return occultation;
    }

    public boolean isShadowTransit() {
        return shadowTransit;
    }

    public boolean isEclipse() {
        return eclipse;
    }

    @Override
    public String toString() {
        return "MoonGeometryState{" +
                "moon=" + moon +
                ", x=" + x +
                ", y=" + y +
                ", z=" + z +
                ", transit=" + transit +
                ", occultation=" + occultation +
                ", shadowTransit=" + shadowTransit +
                ", eclipse=" + eclipse +
                '}';
    }
}
