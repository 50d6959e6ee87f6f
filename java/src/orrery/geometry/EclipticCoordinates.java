package orrery.geometry;

import java.io.Serializable;
import java.util.Objects;

/**
 * 黄道坐标（黄经、黄纬，单位度）
 */
public class EclipticCoordinates implements Serializable {

    private static final long serialVersionUID = 1L;

    private final double longitude;
    private final double latitude;

    public EclipticCoordinates(double longitude, double latitude) {
        this.longitude = longitude;
        this.latitude = latitude;
    }

    public double getLongitude() {
        return longitude;
    }

    public double getLatitude() {
        return latitude;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof EclipticCoordinates)) return false;
        EclipticCoordinates that = (EclipticCoordinates) o;
        return Double.compare(longitude, that.longitude) == 0
                && Double.compare(latitude, that.latitude) == 0;
    }

    @Override
    public int hashCode() {
        return Objects.hash(longitude, latitude);
    }

    @Override
    public String toString() {
        return "EclipticCoordinates{" +
                "lon=" + longitude +
                ", lat=" + latitude +
                '}';
    }
}
