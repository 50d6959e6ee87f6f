package orrery.geometry;

/**
 * 恒星时
 */
public final class SiderealTime {

    private static final double GMST_AT_J2000 = 18.697374558;
    private static final double GMST_RATE = 24.06570982441908;

    private SiderealTime() {
    }

    /**
     * 格林尼治平恒星时（小时，[0, 24)）
     *
     * @param jd UT 儒略日
     */
    public static double gmstHours(double jd) {
        return Angles.normalizeHours(GMST_AT_J2000 + GMST_RATE * (jd - JulianDates.J2000));
    }

    /**
     * 地方恒星时（小时，[0, 24)）
     *
     * @param jd UT 儒略日
     * @param longitudeDeg 经度（度，东为正）
     */
    public static double lstHours(double jd, double longitudeDeg) {
        return Angles.normalizeHours(gmstHours(jd) + longitudeDeg / 15.0);
    }

    /**
     * 时角（小时，(-12, 12]）
     */
    public static double hourAngleHours(double lstHours, double raHours) {
        return Angles.wrapHours(lstHours - raHours);
    }
}
