package orrery.visibility;

import java.io.Serializable;

/**
 * 观测者
 *
 * 地理位置与所在时区
 */
public class Observer implements Serializable {

    private static final long serialVersionUID = 1L;

    private String id;
    private String name;
    private double latitude;        // 度，北为正
    private double longitude;       // 度，东为正
    private double altitude;        // 米
    private double timezoneOffset;  // 小时，相对 UT

    public Observer() {
    }

    public Observer(String id, String name, double latitude, double longitude) {
        this(id, name, latitude, longitude, 0.0, 0.0);
    }

    public Observer(String id, String name, double latitude, double longitude,
                    double altitude, double timezoneOffset) {
        this.id = id;
        this.name = name;
        this.latitude = latitude;
        this.longitude = longitude;
        this.altitude = altitude;
        this.timezoneOffset = timezoneOffset;
    }

    // Getters and Setters
    public String getId() {
        return id;
    }

    public void setId(String id) {
        this.id = id;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public double getLatitude() {
        return latitude;
    }

    public void setLatitude(double latitude) {
        this.latitude = latitude;
    }

    public double getLongitude() {
        return longitude;
    }

    public void setLongitude(double longitude) {
        this.longitude = longitude;
    }

    public double getAltitude() {
        return altitude;
    }

    public void setAltitude(double altitude) {
        this.altitude = altitude;
    }

    public double getTimezoneOffset() {
        return timezoneOffset;
    }

    public void setTimezoneOffset(double timezoneOffset) {
        this.timezoneOffset = timezoneOffset;
    }

    @Override
    public String toString() {
        return "Observer{" +
                "id='" + id + '\'' +
                ", name='" + name + '\'' +
                ", lat=" + latitude +
                ", lon=" + longitude +
                ", alt=" + altitude +
                ", tz=" + timezoneOffset +
                '}';
    }
}
