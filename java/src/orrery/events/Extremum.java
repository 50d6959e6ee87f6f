package orrery.events;

import java.io.Serializable;

/**
 * 局部极值
 */
public class Extremum implements Serializable {

    private static final long serialVersionUID = 1L;

    private final double julianDate;
    private final double value;
    private final boolean maximum;

    public Extremum(double julianDate, double value, boolean maximum) {
        this.julianDate = julianDate;
        this.value = value;
        this.maximum = maximum;
    }

    public double getJulianDate() {
        return julianDate;
    }

    public double getValue() {
        return value;
    }

    public boolean isMaximum() {
        return maximum;
    }

    @Override
    public String toString() {
        return "Extremum{" +
                "jd=" + julianDate +
                ", value=" + value +
                ", maximum=" + maximum +
                '}';
    }
}
