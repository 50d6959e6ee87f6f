package orrery.eclipse;

import java.io.Serializable;

/**
 * 地心视位置（度、km）
 */
public class ApparentPosition implements Serializable {

    private static final long serialVersionUID = 1L;

    private final double rightAscension;
    private final double declination;
    private final double eclipticLongitude;
    private final double eclipticLatitude;
    private final double distanceKm;

    public ApparentPosition(double rightAscension, double declination,
                            double eclipticLongitude, double eclipticLatitude,
                            double distanceKm) {
        this.rightAscension = rightAscension;
        this.declination = declination;
        this.eclipticLongitude = eclipticLongitude;
        this.eclipticLatitude = eclipticLatitude;
        this.distanceKm = distanceKm;
    }

    public double getRightAscension() {
        return rightAscension;
    }

    public double getRightAscensionHours() {
        return rightAscension / 15.0;
    }

    public double getDeclination() {
        return declination;
    }

    public double getEclipticLongitude() {
        return eclipticLongitude;
    }

    public double getEclipticLatitude() {
        return eclipticLatitude;
    }

    public double getDistanceKm() {
        return distanceKm;
    }

    @Override
    public String toString() {
        return "ApparentPosition{" +
                "ra=" + rightAscension +
                ", dec=" + declination +
                ", lon=" + eclipticLongitude +
                ", lat=" + eclipticLatitude +
                ", distanceKm=" + distanceKm +
                '}';
    }
}
