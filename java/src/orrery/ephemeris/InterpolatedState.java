package orrery.ephemeris;

import java.io.Serializable;
import java.util.Objects;

/**
 * 插值状态
 *
 * 字段与 {@link BodySample} 相同，由 {@link EphemerisStore#interpolate} 按需生成
 */
public class InterpolatedState implements Serializable {

    private static final long serialVersionUID = 1L;

    private final String bodyName;
    private final double julianDate;
    private final double ra;
    private final double dec;
    private final double distGeo;
    private final double distSun;
    private final double eclipticLon;
    private final double eclipticLat;

    InterpolatedState(String bodyName, double julianDate, double[] channels) {
        this.bodyName = bodyName;
        this.julianDate = julianDate;
        this.ra = channels[EphemerisStore.RA];
        this.dec = channels[EphemerisStore.DEC];
        this.distGeo = channels[EphemerisStore.DIST_GEO];
        this.distSun = channels[EphemerisStore.DIST_SUN];
        this.eclipticLon = channels[EphemerisStore.ECLIPTIC_LON];
        this.eclipticLat = channels[EphemerisStore.ECLIPTIC_LAT];
    }

    public String getBodyName() {
        return bodyName;
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

    public double getDistGeo() {
        return distGeo;
    }

    public double getDistSun() {
        return distSun;
    }

    public double getEclipticLon() {
        return eclipticLon;
    }

    public double getEclipticLat() {
        return eclipticLat;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof InterpolatedState)) return false;
        InterpolatedState that = (InterpolatedState) o;
        return Double.compare(julianDate, that.julianDate) == 0
                && Double.compare(ra, that.ra) == 0
                && Double.compare(dec, that.dec) == 0
                && Double.compare(distGeo, that.distGeo) == 0
                && Double.compare(distSun, that.distSun) == 0
                && Double.compare(eclipticLon, that.eclipticLon) == 0
                && Double.compare(eclipticLat, that.eclipticLat) == 0
                && Objects.equals(bodyName, that.bodyName);
    }

    @Override
    public int hashCode() {
        return Objects.hash(bodyName, julianDate, ra, dec, distGeo, distSun, eclipticLon, eclipticLat);
    }

    @Override
    public String toString() {
        return String.format("InterpolatedState[%s @ %.6f: ra=%.6f, dec=%.6f, distGeo=%.8f, distSun=%.8f, lon=%.6f, lat=%.6f]",
                bodyName, julianDate, ra, dec, distGeo, distSun, eclipticLon, eclipticLat);
    }
}
