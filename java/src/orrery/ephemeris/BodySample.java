package orrery.ephemeris;

import java.io.Serializable;
import java.util.Objects;

/**
 * 星历采样点
 *
 * 某天体在某一时刻的预计算状态，加载后不可变
 */
public class BodySample implements Serializable {

    private static final long serialVersionUID = 1L;

    private final double julianDate;
    private final double ra;            // 度
    private final double dec;           // 度
    private final double distGeo;       // AU
    private final double distSun;       // AU
    private final double eclipticLon;   // 度（日心）
    private final double eclipticLat;   // 度（日心）

    public BodySample(double julianDate, double ra, double dec, double distGeo,
                      double distSun, double eclipticLon, double eclipticLat) {
        this.julianDate = julianDate;
        this.ra = ra;
        this.dec = dec;
        this.distGeo = distGeo;
        this.distSun = distSun;
        this.eclipticLon = eclipticLon;
        this.eclipticLat = eclipticLat;
    }

    /**
     * 按通道顺序 {ra, dec, distGeo, distSun, eclipticLon, eclipticLat} 构造
     */
    static BodySample fromChannels(double julianDate, double[] channels) {
        return new BodySample(julianDate,
                channels[EphemerisStore.RA], channels[EphemerisStore.DEC],
                channels[EphemerisStore.DIST_GEO], channels[EphemerisStore.DIST_SUN],
                channels[EphemerisStore.ECLIPTIC_LON], channels[EphemerisStore.ECLIPTIC_LAT]);
    }

    double[] toChannels() {
        return new double[] {ra, dec, distGeo, distSun, eclipticLon, eclipticLat};
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
        if (!(o instanceof BodySample)) return false;
        BodySample that = (BodySample) o;
        return Double.compare(julianDate, that.julianDate) == 0
                && Double.compare(ra, that.ra) == 0
                && Double.compare(dec, that.dec) == 0
                && Double.compare(distGeo, that.distGeo) == 0
                && Double.compare(distSun, that.distSun) == 0
                && Double.compare(eclipticLon, that.eclipticLon) == 0
                && Double.compare(eclipticLat, that.eclipticLat) == 0;
    }

    @Override
    public int hashCode() {
        return Objects.hash(julianDate, ra, dec, distGeo, distSun, eclipticLon, eclipticLat);
    }

    @Override
    public String toString() {
        return "BodySample{" +
                "jd=" + julianDate +
                ", ra=" + ra +
                ", dec=" + dec +
                ", distGeo=" + distGeo +
                ", distSun=" + distSun +
                ", eclipticLon=" + eclipticLon +
                ", eclipticLat=" + eclipticLat +
                '}';
    }
}
