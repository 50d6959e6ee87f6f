package orrery.visibility;

import java.io.Serializable;

/**
 * 某日的升起、中天、落下时刻（地方时小时，[0, 24)），无该事件时为 NaN
 */
public class PlanetEvents implements Serializable {

    private static final long serialVersionUID = 1L;

    private final double rise;
    private final double transit;
    private final double set;
    private final HorizonStatus status;

    public PlanetEvents(double rise, double transit, double set, HorizonStatus status) {
        this.rise = rise;
        this.transit = transit;
        this.set = set;
        this.status = status;
    }

    public double getRise() {
        return rise;
    }

    public double getTransit() {
        return transit;
    }

    public double getSet() {
        return set;
    }

    public HorizonStatus getStatus() {
        return status;
    }

    public boolean hasRise() {
        return !Double.isNaN(rise);
    }

    public boolean hasSet() {
        return !Double.isNaN(set);
    }

    @Override
    public String toString() {
        return "PlanetEvents{" +
                "rise=" + rise +
                ", transit=" + transit +
                ", set=" + set +
                ", status=" + status +
                '}';
    }
}
