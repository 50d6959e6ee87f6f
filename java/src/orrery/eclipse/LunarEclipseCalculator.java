package orrery.eclipse;

import orrery.eclipse.model.EclipsePhaseWindow;
import orrery.eclipse.model.LocalCircumstances;
import orrery.eclipse.model.LunarEclipseRecord;
import orrery.eclipse.model.LunarEclipseType;
import orrery.eclipse.model.ShadowGeometry;
import orrery.events.Crossing;
import orrery.events.EventDetector;
import orrery.geometry.JulianDates;
import orrery.geometry.SiderealTime;
import orrery.visibility.BodyKind;
import orrery.visibility.HorizonVisibility;
import orrery.visibility.Observer;
import orrery.visibility.VisibleLonRange;

import org.hipparchus.util.FastMath;

import java.util.*;
import java.util.function.DoublePredicate;
import java.util.logging.Logger;

/**
 * 月食计算器
 *
 * 阶段时刻取自食表，日月位置由解析级数在力学时（UT + 该条记录的 ΔT）求得，恒星时用 UT。
 * 月亮"在地平线上"指高度 > 0.125°，即月面上边缘露出。
 */
public class LunarEclipseCalculator {

    private static final Logger logger = Logger.getLogger(LunarEclipseCalculator.class.getName());

    /** 判断月亮可见的高度阈值（度） */
    public static final double MOON_UP_ALTITUDE = BodyKind.MOON.getStandardAltitude();

    /** 月出月落扫描步长：1 分钟 */
    public static final double RISE_SET_SCAN_STEP = 1.0 / 1440.0;

    /** 月出月落二分次数 */
    public static final int RISE_SET_ITERATIONS = 10;

    /** 扫描区间在半影食两端各放宽的天数 */
    public static final double RISE_SET_SCAN_MARGIN = 0.01;

    /** 首末时刻都看不到时再检查的半影食内部位置 */
    private static final double[] INTERIOR_FRACTIONS = {0.25, 0.50, 0.75};

    /**
     * 月亮地心视位置
     *
     * @param julianDateUt UT 儒略日
     * @param deltaTSeconds TT - UT（秒）
     */
    public ApparentPosition moonPosition(double julianDateUt, double deltaTSeconds) {
        return LunarPositionSeries.compute(JulianDates.utToTt(julianDateUt, deltaTSeconds));
    }

    /**
     * 观测者处的月亮高度（度，地心位置，不含折射）
     */
    public double moonAltitude(double julianDateUt, double deltaTSeconds, Observer observer) {
        ApparentPosition moon = moonPosition(julianDateUt, deltaTSeconds);
        double lst = SiderealTime.lstHours(julianDateUt, observer.getLongitude());
        double ha = SiderealTime.hourAngleHours(lst, moon.getRightAscensionHours());
        return HorizonVisibility.altitude(ha, observer.getLatitude(), moon.getDeclination());
    }

    public boolean isMoonUp(double julianDateUt, double deltaTSeconds, Observer observer) {
        return moonAltitude(julianDateUt, deltaTSeconds, observer) > MOON_UP_ALTITUDE;
    }

    /**
     * 该地能否看到这次月食的任何部分
     *
     * 先看半影食始末，都在地平线下时再看 25%/50%/75% 处，以免漏掉食中月出又月落的情形。
     */
    public boolean isVisible(LunarEclipseRecord record, Observer observer) {
        EclipsePhaseWindow window = EclipsePhaseWindow.forRecord(record);
        double deltaT = record.getDeltaT();
        if (isMoonUp(window.getPenumbralStart(), deltaT, observer)
                || isMoonUp(window.getPenumbralEnd(), deltaT, observer)) {
            return true;
        }
        double span = window.getPenumbralSpan();
        for (double fraction : INTERIOR_FRACTIONS) {
            if (isMoonUp(window.getPenumbralStart() + span * fraction, deltaT, observer)) {
                return true;
            }
        }
        return false;
    }

    /**
     * 可见等级：3 能看到全食，2 能看到本影部分食，1 能看到半影食，0 看不到
     *
     * 全食看始、中、末三个时刻，部分食和半影食看各自的始末。
     */
    public int visibilityLevel(LunarEclipseRecord record, Observer observer) {
        EclipsePhaseWindow window = EclipsePhaseWindow.forRecord(record);
        double deltaT = record.getDeltaT();
        if (window.hasTotal()) {
            double mid = 0.5 * (window.getTotalStart() + window.getTotalEnd());
            if (isMoonUp(window.getTotalStart(), deltaT, observer)
                    || isMoonUp(window.getTotalEnd(), deltaT, observer)
                    || isMoonUp(mid, deltaT, observer)) {
                return 3;
            }
        }
        if (window.hasPartial()) {
            if (isMoonUp(window.getPartialStart(), deltaT, observer)
                    || isMoonUp(window.getPartialEnd(), deltaT, observer)) {
                return 2;
            }
        }
        if (isMoonUp(window.getPenumbralStart(), deltaT, observer)
                || isMoonUp(window.getPenumbralEnd(), deltaT, observer)) {
            return 1;
        }
        return 0;
    }

    /**
     * 当地食况：半影食期间的月出月落，以及各阶段的可见分钟数
     */
    public LocalCircumstances localCircumstances(LunarEclipseRecord record, Observer observer) {
        EclipsePhaseWindow window = EclipsePhaseWindow.forRecord(record);
        double deltaT = record.getDeltaT();
        double penStart = window.getPenumbralStart();
        double penEnd = window.getPenumbralEnd();

        DoublePredicate moonUp = jd -> isMoonUp(jd, deltaT, observer);
        List<Crossing> transitions = EventDetector.findAllTransitions(
                moonUp, penStart - RISE_SET_SCAN_MARGIN, penEnd + RISE_SET_SCAN_MARGIN,
                RISE_SET_SCAN_STEP, RISE_SET_ITERATIONS);

        double moonrise = Double.NaN;
        double moonset = Double.NaN;
        for (Crossing crossing : transitions) {
            double jd = crossing.getJulianDate();
            if (jd < penStart || jd > penEnd) {
                continue;
            }
            if (crossing.isRising() && Double.isNaN(moonrise)) {
                moonrise = jd;
            } else if (!crossing.isRising() && Double.isNaN(moonset)) {
                moonset = jd;
            }
        }

        boolean upAtStart = moonUp.test(penStart);
        List<double[]> upIntervals = upIntervals(upAtStart, moonrise, moonset, penStart, penEnd);

        double total = 0.0;
        double partial = 0.0;
        double penumbral;
        if (window.hasTotal()) {
            total = visibleDays(upIntervals, window.getTotalStart(), window.getTotalEnd());
            partial = visibleDays(upIntervals, window.getPartialStart(), window.getTotalStart())
                      + visibleDays(upIntervals, window.getTotalEnd(), window.getPartialEnd());
        } else if (window.hasPartial()) {
            partial = visibleDays(upIntervals, window.getPartialStart(), window.getPartialEnd());
        }
        if (window.hasPartial()) {
            penumbral = visibleDays(upIntervals, penStart, window.getPartialStart())
                        + visibleDays(upIntervals, window.getPartialEnd(), penEnd);
        } else {
            penumbral = visibleDays(upIntervals, penStart, penEnd);
        }

        LocalCircumstances result = new LocalCircumstances(upAtStart, moonrise, moonset,
                                                           toMinutes(penumbral), toMinutes(partial),
                                                           toMinutes(total));
        logger.fine(record.formatDate() + " at " + observer.getName() + ": " + result);
        return result;
    }

    /**
     * 半影食期间月亮在地平线上的时段
     */
    private static List<double[]> upIntervals(boolean upAtStart, double moonrise, double moonset,
                                              double penStart, double penEnd) {
        List<double[]> intervals = new ArrayList<>();
        boolean hasRise = !Double.isNaN(moonrise);
        boolean hasSet = !Double.isNaN(moonset);
        if (upAtStart) {
            double end = hasSet ? moonset : penEnd;
            if (end > penStart) {
                intervals.add(new double[] {penStart, FastMath.min(end, penEnd)});
            }
            // 先落后升
            if (hasSet && hasRise && moonrise > moonset) {
                intervals.add(new double[] {moonrise, penEnd});
            }
        } else if (hasRise) {
            double end = hasSet && moonset > moonrise ? moonset : penEnd;
            intervals.add(new double[] {moonrise, FastMath.min(end, penEnd)});
        }
        return intervals;
    }

    private static double visibleDays(List<double[]> intervals, double start, double end) {
        if (end <= start) {
            return 0.0;
        }
        double visible = 0.0;
        for (double[] interval : intervals) {
            double overlapStart = FastMath.max(interval[0], start);
            double overlapEnd = FastMath.min(interval[1], end);
            if (overlapEnd > overlapStart) {
                visible += overlapEnd - overlapStart;
            }
        }
        return visible;
    }

    private static int toMinutes(double days) {
        return (int) (days * 1440.0 + 0.5);
    }

    /**
     * 某纬度上能看到月亮的经度区间（用于食况地图）
     *
     * @param julianDateUt UT 儒略日
     * @param deltaTSeconds TT - UT（秒）
     * @param latitude 纬度（度）
     */
    public VisibleLonRange visibleLongitudeRange(double julianDateUt, double deltaTSeconds, double latitude) {
        ApparentPosition moon = moonPosition(julianDateUt, deltaTSeconds);
        return HorizonVisibility.visibleLongitudeRange(latitude, SiderealTime.gmstHours(julianDateUt),
                                                       moon.getRightAscensionHours(), moon.getDeclination());
    }

    /**
     * 食甚时月球在影面上的位置
     */
    public ShadowGeometry shadowGeometry(LunarEclipseRecord record) {
        return shadowGeometry(record, record.getGreatestEclipseUt());
    }

    /**
     * 任意时刻月球在影面上的位置
     */
    public ShadowGeometry shadowGeometry(LunarEclipseRecord record, double julianDateUt) {
        return EarthShadowModel.shadowGeometry(JulianDates.utToTt(julianDateUt, record.getDeltaT()));
    }

    /**
     * 按年份范围、类型和（可选）当地可见性筛选
     *
     * @param records 食表
     * @param startYear 起始年（含）
     * @param endYear 结束年（含）
     * @param types 保留的类型
     * @param localObserver 非 null 时只保留该地能看到的月食
     */
    public List<LunarEclipseRecord> filter(List<LunarEclipseRecord> records, int startYear, int endYear,
                                           Set<LunarEclipseType> types, Observer localObserver) {
        List<LunarEclipseRecord> selected = new ArrayList<>();
        for (LunarEclipseRecord record : records) {
            int year = record.getYear();
            if (year < startYear || year > endYear) {
                continue;
            }
            if (!types.contains(record.getType())) {
                continue;
            }
            if (localObserver != null && !isVisible(record, localObserver)) {
                continue;
            }
            selected.add(record);
        }
        logger.fine("Selected " + selected.size() + " of " + records.size() + " lunar eclipses");
        return selected;
    }
}
