package orrery.visibility;

import java.io.Serializable;

/**
 * 某纬度上天体在地平线上的经度区间
 *
 * 从升起经度 lon1 到落下经度 lon2（均在 [-180, 180]），lon1 > lon2 表示区间跨越 ±180°
 */
public class VisibleLonRange implements Serializable {

    private static final long serialVersionUID = 1L;

    private static final VisibleLonRange ALWAYS_UP = new VisibleLonRange(0.0, 0.0, true, false);
    private static final VisibleLonRange NEVER_UP = new VisibleLonRange(0.0, 0.0, false, true);

    private final double lon1;
    private final double lon2;
    private final boolean alwaysUp;
    private final boolean neverUp;

    private VisibleLonRange(double lon1, double lon2, boolean alwaysUp, boolean neverUp) {
        this.lon1 = lon1;
        this.lon2 = lon2;
        this.alwaysUp = alwaysUp;
        this.neverUp = neverUp;
    }

    public static VisibleLonRange between(double risingLon, double settingLon) {
        return new VisibleLonRange(risingLon, settingLon, false, false);
    }

    public static VisibleLonRange alwaysUp() {
        return ALWAYS_UP;
    }

    public static VisibleLonRange neverUp() {
        return NEVER_UP;
    }

    /**
     * 经度是否落在区间内（含端点）
     */
    public boolean contains(double lonDeg) {
        if (alwaysUp) {
            return true;
        }
        if (neverUp) {
            return false;
        }
        if (lon1 <= lon2) {
            return lonDeg >= lon1 && lonDeg <= lon2;
        }
        return lonDeg >= lon1 || lonDeg <= lon2;
    }

    public double getLon1() {
        return lon1;
    }

    public double getLon2() {
        return lon2;
    }

    public boolean isAlwaysUp() {
        return alwaysUp;
    }

    public boolean isNeverUp() {
        return neverUp;
    }

    public boolean isWrapping() {
        return !alwaysUp && !neverUp && lon1 > lon2;
    }

    @Override
    public String toString() {
        if (alwaysUp) {
            return "VisibleLonRange{alwaysUp}";
        }
        if (neverUp) {
            return "VisibleLonRange{neverUp}";
        }
        return "VisibleLonRange{" + lon1 + " -> " + lon2 + '}';
    }
}
