package orrery.eclipse.model;

import java.io.Serializable;

/**
 * 某时刻月球在影面上的位置
 *
 * 影面垂直于地影轴，原点在轴上；x 沿赤经方向，y 沿赤纬方向，单位 km。
 */
public class ShadowGeometry implements Serializable {

    private static final long serialVersionUID = 1L;

    private final double julianDate;
    private final double x;
    private final double y;
    private final double moonAngularRadius;
    private final double moonDiskRadius;
    private final ShadowRadii radii;

    public ShadowGeometry(double julianDate, double x, double y,
                          double moonAngularRadius, double moonDiskRadius, ShadowRadii radii) {
        this.julianDate = julianDate;
        this.x = x;
        this.y = y;
        this.moonAngularRadius = moonAngularRadius;
        this.moonDiskRadius = moonDiskRadius;
        this.radii = radii;
    }

    public boolean isMoonCenterInUmbra() {
        return radii.insideUmbra(x, y);
    }

    public boolean isMoonCenterInPenumbra() {
        return radii.insidePenumbra(x, y);
    }

    // Getters
    public double getJulianDate() {
        return julianDate;
    }

    public double getX() {
        return x;
    }

    public double getY() {
        return y;
    }

    /**
     * 月球角半径（度）
     */
    public double getMoonAngularRadius() {
        return moonAngularRadius;
    }

    /**
     * 月面在影面上的半径（km）
     */
    public double getMoonDiskRadius() {
        return moonDiskRadius;
    }

    public ShadowRadii getRadii() {
        return radii;
    }

    @Override
    public String toString() {
        return "ShadowGeometry{" +
                "jd=" + julianDate +
                ", x=" + x +
                ", y=" + y +
                ", moonAngularRadius=" + moonAngularRadius +
                ", radii=" + radii +
                '}';
    }
}
