package orrery.geometry;

import java.io.Serializable;
import java.util.Objects;

/**
 * 赤道坐标（赤经、赤纬，单位度）
 */
public class EquatorialCoordinates implements Serializable {

    private static final long serialVersionUID = 1L;

    private final double rightAscension;  // 度
    private final double declination;     // 度

    public EquatorialCoordinates(double rightAscension, double declination) {
        this.rightAscension = rightAscension;
        this.declination = declination;
    }

    public double getRightAscension() {
        return rightAscension;
    }

    /**
     * 赤经（小时）
     */
    public double getRightAscensionHours() {
        return rightAscension / 15.0;
    }

    public double getDeclination() {
        return declination;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof EquatorialCoordinates)) return false;
        EquatorialCoordinates that = (EquatorialCoordinates) o;
        return Double.compare(rightAscension, that.rightAscension) == 0
                && Double.compare(declination, that.declination) == 0;
    }

    @Override
    public int hashCode() {
        return Objects.hash(rightAscension, declination);
    }

    @Override
    public String toString() {
        return "EquatorialCoordinates{" +
                "ra=" + rightAscension +
                ", dec=" + declination +
                '}';
    }
}
