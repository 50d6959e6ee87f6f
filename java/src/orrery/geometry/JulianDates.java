package orrery.geometry;

import org.hipparchus.util.FastMath;
import org.orekit.time.DateComponents;
import org.orekit.time.DateTimeComponents;
import org.orekit.time.TimeComponents;
import org.orekit.utils.Constants;

/**
 * 儒略日转换
 *
 * 日历换算交给 Orekit 的 DateComponents（1582年10月15日之前为儒略历），
 * 这里只负责儒略日与日内秒数之间的拼接。
 */
public final class JulianDates {

    /** J2000.0 历元的儒略日 */
    public static final double J2000 = 2451545.0;

    /** 2000-01-01T00:00 的儒略日 */
    private static final double J2000_MIDNIGHT = J2000 - 0.5;

    /** 默认 TT - UT（秒） */
    public static final double DEFAULT_DELTA_T = 69.184;

    private JulianDates() {
    }

    /**
     * 日历日期转儒略日
     *
     * @param year 年（天文纪年，公元前1年为0）
     * @param month 月 1-12
     * @param day 日
     * @param hours 日内小时（可为小数）
     * @return 儒略日
     */
    public static double fromCalendar(int year, int month, int day, double hours) {
        DateComponents date = new DateComponents(year, month, day);
        return J2000_MIDNIGHT + date.getJ2000Day() + hours / 24.0;
    }

    /**
     * 儒略日转日历日期时间
     */
    public static DateTimeComponents toCalendar(double jd) {
        double days = jd - J2000_MIDNIGHT;
        int dayNumber = (int) FastMath.floor(days);
        double seconds = (days - dayNumber) * Constants.JULIAN_DAY;
        if (seconds >= Constants.JULIAN_DAY) {
            // 舍入误差落到下一天
            dayNumber++;
            seconds = 0.0;
        }
        return new DateTimeComponents(new DateComponents(DateComponents.J2000_EPOCH, dayNumber),
                                      new TimeComponents(seconds));
    }

    /**
     * 自 J2000.0 起的儒略世纪数
     */
    public static double centuriesSinceJ2000(double jd) {
        return (jd - J2000) / (Constants.JULIAN_CENTURY / Constants.JULIAN_DAY);
    }

    /**
     * UT 儒略日转 TT 儒略日
     *
     * @param jdUt UT 儒略日
     * @param deltaTSeconds TT - UT（秒）
     */
    public static double utToTt(double jdUt, double deltaTSeconds) {
        return jdUt + deltaTSeconds / Constants.JULIAN_DAY;
    }

    /**
     * 当地时区偏移下某日的本地午夜对应的 UT 儒略日
     *
     * @param year 年
     * @param month 月
     * @param day 日
     * @param timezoneOffsetHours 时区偏移（小时，东为正）
     */
    public static double localMidnight(int year, int month, int day, double timezoneOffsetHours) {
        return fromCalendar(year, month, day, 0.0) - timezoneOffsetHours / 24.0;
    }
}
