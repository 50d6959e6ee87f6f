package orrery.provider;

import java.io.Serializable;
import java.util.*;

/**
 * 天体平均轨道根数
 *
 * 用于开普勒近似计算，角度单位为度，半长轴单位为 AU，平黄经变化率单位为 度/日。
 */
public class BodyElements implements Serializable {

    private static final long serialVersionUID = 1L;

    private String name;
    private double meanLongitude;
    private double meanLongitudeRate;
    private double semiMajorAxis;
    private double eccentricity;
    private double inclination;
    private double longitudeOfPerihelion;
    private double ascendingNode;

    public BodyElements() {
    }

    public BodyElements(String name, double meanLongitude, double meanLongitudeRate,
                        double semiMajorAxis, double eccentricity, double inclination,
                        double longitudeOfPerihelion, double ascendingNode) {
        this.name = name;
        this.meanLongitude = meanLongitude;
        this.meanLongitudeRate = meanLongitudeRate;
        this.semiMajorAxis = semiMajorAxis;
        this.eccentricity = eccentricity;
        this.inclination = inclination;
        this.longitudeOfPerihelion = longitudeOfPerihelion;
        this.ascendingNode = ascendingNode;
    }

    /**
     * J2000 历元的八大行星根数
     */
    public static List<BodyElements> planets() {
        return Arrays.asList(
                new BodyElements("Mercury", 252.25, 4.09233, 0.38710, 0.20563, 7.005, 77.46, 48.33),
                new BodyElements("Venus", 181.98, 1.60213, 0.72333, 0.00677, 3.390, 131.53, 76.68),
                new BodyElements("Earth", 100.46, 0.985647, 1.00000, 0.01671, 0.000, 102.94, 0.0),
                new BodyElements("Mars", 355.45, 0.52403, 1.52368, 0.09340, 1.850, 336.04, 49.558),
                new BodyElements("Jupiter", 34.40, 0.08308, 5.20260, 0.04849, 1.305, 14.75, 100.46),
                new BodyElements("Saturn", 49.94, 0.03346, 9.55490, 0.05555, 2.485, 92.43, 113.71),
                new BodyElements("Uranus", 313.23, 0.01173, 19.1817, 0.04731, 0.773, 170.96, 74.00),
                new BodyElements("Neptune", 304.88, 0.00598, 30.0582, 0.00860, 1.770, 44.97, 131.78)
        );
    }

    /**
     * 哈雷彗星（星历缺失时的后备根数）
     */
    public static BodyElements halley() {
        return new BodyElements("Halley", 236.35, 0.013126, 17.834, 0.96714, 162.26, 169.75, 58.42);
    }

    // Getters and Setters
    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public double getMeanLongitude() {
        return meanLongitude;
    }

    public void setMeanLongitude(double meanLongitude) {
        this.meanLongitude = meanLongitude;
    }

    public double getMeanLongitudeRate() {
        return meanLongitudeRate;
    }

    public void setMeanLongitudeRate(double meanLongitudeRate) {
        this.meanLongitudeRate = meanLongitudeRate;
    }

    public double getSemiMajorAxis() {
        return semiMajorAxis;
    }

    public void setSemiMajorAxis(double semiMajorAxis) {
        this.semiMajorAxis = semiMajorAxis;
    }

    public double getEccentricity() {
        return eccentricity;
    }

    public void setEccentricity(double eccentricity) {
        this.eccentricity = eccentricity;
    }

    public double getInclination() {
        return inclination;
    }

    public void setInclination(double inclination) {
        this.inclination = inclination;
    }

    public double getLongitudeOfPerihelion() {
        return longitudeOfPerihelion;
    }

    public void setLongitudeOfPerihelion(double longitudeOfPerihelion) {
        this.longitudeOfPerihelion = longitudeOfPerihelion;
    }

    public double getAscendingNode() {
        return ascendingNode;
    }

    public void setAscendingNode(double ascendingNode) {
        this.ascendingNode = ascendingNode;
    }

    @Override
    public String toString() {
        return "BodyElements{" +
                "name='" + name + '\'' +
                ", L0=" + meanLongitude +
                ", a=" + semiMajorAxis +
                ", e=" + eccentricity +
                ", i=" + inclination +
                '}';
    }
}
