package orrery.geometry;

import org.hipparchus.util.FastMath;

/**
 * 地平坐标（方位角自北向东，高度角，单位度）
 */
public class HorizontalCoordinates {

    private final double azimuth;
    private final double altitude;

    public HorizontalCoordinates(double azimuth, double altitude) {
        this.azimuth = azimuth;
        this.altitude = altitude;
    }

    /**
     * 由时角计算高度角
     *
     * @param hourAngleHours 时角（小时）
     * @param latitudeDeg 观测者纬度（度）
     * @param declinationDeg 赤纬（度）
     * @return 高度角（度）
     */
    public static double altitude(double hourAngleHours, double latitudeDeg, double declinationDeg) {
        double ha = FastMath.toRadians(hourAngleHours * 15.0);
        double lat = FastMath.toRadians(latitudeDeg);
        double dec = FastMath.toRadians(declinationDeg);
        double sinAlt = FastMath.sin(lat) * FastMath.sin(dec)
                + FastMath.cos(lat) * FastMath.cos(dec) * FastMath.cos(ha);
        return FastMath.toDegrees(FastMath.asin(FastMath.max(-1.0, FastMath.min(1.0, sinAlt))));
    }

    /**
     * 由地方恒星时和赤道坐标计算地平坐标
     *
     * @param lstHours 地方恒星时（小时）
     * @param latitudeDeg 纬度（度）
     * @param raHours 赤经（小时）
     * @param declinationDeg 赤纬（度）
     */
    public static HorizontalCoordinates fromEquatorial(double lstHours, double latitudeDeg,
                                                       double raHours, double declinationDeg) {
        double ha = FastMath.toRadians((lstHours - raHours) * 15.0);
        double lat = FastMath.toRadians(latitudeDeg);
        double dec = FastMath.toRadians(declinationDeg);

        double sinAlt = FastMath.sin(lat) * FastMath.sin(dec)
                + FastMath.cos(lat) * FastMath.cos(dec) * FastMath.cos(ha);
        double alt = FastMath.asin(FastMath.max(-1.0, FastMath.min(1.0, sinAlt)));

        double cosAz = (FastMath.sin(dec) - FastMath.sin(alt) * FastMath.sin(lat))
                / (FastMath.cos(alt) * FastMath.cos(lat));
        double az = FastMath.toDegrees(FastMath.acos(FastMath.max(-1.0, FastMath.min(1.0, cosAz))));
        if (FastMath.sin(ha) > 0) {
            // 西半天
            az = 360.0 - az;
        }
        return new HorizontalCoordinates(az, FastMath.toDegrees(alt));
    }

    public double getAzimuth() {
        return azimuth;
    }

    public double getAltitude() {
        return altitude;
    }

    @Override
    public String toString() {
        return String.format("HorizontalCoordinates[az=%.3f°, alt=%.3f°]", azimuth, altitude);
    }
}
