package orrery.eclipse.model;

import java.io.Serializable;

/**
 * 月球距离处的地影半径（km），按地球赤道半径和极半径各算一次，构成椭圆截面
 */
public class ShadowRadii implements Serializable {

    private static final long serialVersionUID = 1L;

    private final double umbraEquatorial;
    private final double umbraPolar;
    private final double penumbraEquatorial;
    private final double penumbraPolar;

    public ShadowRadii(double umbraEquatorial, double umbraPolar,
                       double penumbraEquatorial, double penumbraPolar) {
        this.umbraEquatorial = umbraEquatorial;
        this.umbraPolar = umbraPolar;
        this.penumbraEquatorial = penumbraEquatorial;
        this.penumbraPolar = penumbraPolar;
    }

    /**
     * 影面坐标 (x, y) 是否落在本影椭圆内
     */
    public boolean insideUmbra(double x, double y) {
        return insideEllipse(x, y, umbraEquatorial, umbraPolar);
    }

    /**
     * 影面坐标 (x, y) 是否落在半影椭圆内
     */
    public boolean insidePenumbra(double x, double y) {
        return insideEllipse(x, y, penumbraEquatorial, penumbraPolar);
    }

    private static boolean insideEllipse(double x, double y, double a, double b) {
        double u = x / a;
        double v = y / b;
        return u * u + v * v < 1.0;
    }

    public double getUmbraEquatorial() {
        return umbraEquatorial;
    }

    public double getUmbraPolar() {
        return umbraPolar;
    }

    public double getPenumbraEquatorial() {
        return penumbraEquatorial;
    }

    public double getPenumbraPolar() {
        return penumbraPolar;
    }

    @Override
    public String toString() {
        return "ShadowRadii{" +
                "umbra=" + umbraEquatorial + "/" + umbraPolar +
                ", penumbra=" + penumbraEquatorial + "/" + penumbraPolar +
                '}';
    }
}
