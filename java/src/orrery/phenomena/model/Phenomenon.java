package orrery.phenomena.model;

import orrery.phenomena.PhenomenonType;

import java.io.Serializable;

/**
 * 一次行星天象
 */
public class Phenomenon implements Serializable {

    private static final long serialVersionUID = 1L;

    private final String planet;
    private final PhenomenonType type;
    private final double julianDate;
    private final double value;

    /**
     * @param planet 行星名
     * @param type 天象类型
     * @param julianDate 儒略日
     * @param value 大距角（度），合和冲为 NaN
     */
    public Phenomenon(String planet, PhenomenonType type, double julianDate, double value) {
        this.planet = planet;
        this.type = type;
        this.julianDate = julianDate;
        this.value = value;
    }

    // Getters
    public String getPlanet() {
        return planet;
    }

    public PhenomenonType getType() {
        return type;
    }

    public double getJulianDate() {
        return julianDate;
    }

    public double getValue() {
        return value;
    }

    public boolean hasValue() {
        return !Double.isNaN(value);
    }

    @Override
    public String toString() {
        return "Phenomenon{" +
                "planet='" + planet + '\'' +
                ", type=" + type +
                ", jd=" + julianDate +
                (hasValue() ? ", value=" + value : "") +
                '}';
    }
}
