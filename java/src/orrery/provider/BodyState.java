package orrery.provider;

import org.hipparchus.geometry.euclidean.threed.Vector3D;

import java.io.Serializable;

/**
 * 天体状态
 *
 * 赤经赤纬与地心黄道坐标（度），距离（AU），以及日心黄道位置矢量和地心赤道位置矢量（AU）。
 * 地球的地心量无定义，取 NaN。
 */
public class BodyState implements Serializable {

    private static final long serialVersionUID = 1L;

    private final String name;
    private final double julianDate;
    private final double ra;
    private final double dec;
    private final double eclipticLon;
    private final double eclipticLat;
    private final double distGeo;
    private final double distSun;
    private final double helioLon;
    private final double helioLat;
    private final Vector3D helioPosition;
    private final Vector3D geoPosition;

    private BodyState(Builder builder) {
        this.name = builder.name;
        this.julianDate = builder.julianDate;
        this.ra = builder.ra;
        this.dec = builder.dec;
        this.eclipticLon = builder.eclipticLon;
        this.eclipticLat = builder.eclipticLat;
        this.distGeo = builder.distGeo;
        this.distSun = builder.distSun;
        this.helioLon = builder.helioLon;
        this.helioLat = builder.helioLat;
        this.helioPosition = builder.helioPosition;
        this.geoPosition = builder.geoPosition;
    }

    public static Builder builder(String name, double julianDate) {
        return new Builder(name, julianDate);
    }

    public String getName() {
        return name;
    }

    public double getJulianDate() {
        return julianDate;
    }

    public double getRa() {
        return ra;
    }

    public double getDec() {
        return dec;
    }

    public double getEclipticLon() {
        return eclipticLon;
    }

    public double getEclipticLat() {
        return eclipticLat;
    }

    public double getDistGeo() {
        return distGeo;
    }

    public double getDistSun() {
        return distSun;
    }

    public double getHelioLon() {
        return helioLon;
    }

    public double getHelioLat() {
        return helioLat;
    }

    public Vector3D getHelioPosition() {
        return helioPosition;
    }

    public Vector3D getGeoPosition() {
        return geoPosition;
    }

    @Override
    public String toString() {
        return "BodyState{" +
                "name='" + name + '\'' +
                ", jd=" + julianDate +
                ", ra=" + ra +
                ", dec=" + dec +
                ", eclipticLon=" + eclipticLon +
                ", eclipticLat=" + eclipticLat +
                ", distGeo=" + distGeo +
                ", distSun=" + distSun +
                '}';
    }

    /**
     * 构建器（内部类）
     */
    public static class Builder {
        private final String name;
        private final double julianDate;
        private double ra = Double.NaN;
        private double dec = Double.NaN;
        private double eclipticLon = Double.NaN;
        private double eclipticLat = Double.NaN;
        private double distGeo = Double.NaN;
        private double distSun = Double.NaN;
        private double helioLon = Double.NaN;
        private double helioLat = Double.NaN;
        private Vector3D helioPosition = Vector3D.NaN;
        private Vector3D geoPosition = Vector3D.NaN;

        private Builder(String name, double julianDate) {
            this.name = name;
            this.julianDate = julianDate;
        }

        public Builder equatorial(double raDeg, double decDeg) {
            this.ra = raDeg;
            this.dec = decDeg;
            return this;
        }

        public Builder ecliptic(double lonDeg, double latDeg) {
            this.eclipticLon = lonDeg;
            this.eclipticLat = latDeg;
            return this;
        }

        public Builder distances(double geo, double sun) {
            this.distGeo = geo;
            this.distSun = sun;
            return this;
        }

        public Builder heliocentric(double lonDeg, double latDeg) {
            this.helioLon = lonDeg;
            this.helioLat = latDeg;
            return this;
        }

        public Builder helioPosition(Vector3D position) {
            this.helioPosition = position;
            return this;
        }

        public Builder geoPosition(Vector3D position) {
            this.geoPosition = position;
            return this;
        }

        public BodyState build() {
            return new BodyState(this);
        }
    }
}
