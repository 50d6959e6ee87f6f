package orrery.visibility;

import orrery.geometry.Angles;
import orrery.geometry.JulianDates;
import orrery.geometry.SiderealTime;
import orrery.provider.AbstractBodyStateProvider;
import orrery.provider.BodyState;
import orrery.provider.BodyStateProvider;

import org.hipparchus.util.FastMath;

/**
 * 升起、中天、落下时刻
 */
public class RiseSetCalculator {

    /** 平太阳日与恒星日之比 */
    public static final double SIDEREAL_FACTOR = 0.99727;

    /** 月球相对恒星每日东移，中天间隔约 1.035 日 */
    public static final double LUNAR_FACTOR = 1.035;

    private static final int TRANSIT_PASSES = 5;
    private static final int HORIZON_PASSES = 3;

    private final BodyStateProvider provider;
    private final double deltaTSeconds;

    public RiseSetCalculator(BodyStateProvider provider, double deltaTSeconds) {
        this.provider = provider;
        this.deltaTSeconds = deltaTSeconds;
    }

    public RiseSetCalculator(BodyStateProvider provider) {
        this(provider, JulianDates.DEFAULT_DELTA_T);
    }

    /**
     * 升落时角（小时），cos H = (sin h0 - sin φ sin δ)/(cos φ cos δ)；无解时为 NaN
     */
    public static double semiDiurnalArc(double latitudeDeg, double declinationDeg, double standardAltitude) {
        double lat = FastMath.toRadians(latitudeDeg);
        double dec = FastMath.toRadians(declinationDeg);
        double cosH = (FastMath.sin(FastMath.toRadians(standardAltitude)) - FastMath.sin(lat) * FastMath.sin(dec))
                      / (FastMath.cos(lat) * FastMath.cos(dec));
        if (cosH < -1.0 || cosH > 1.0 || Double.isNaN(cosH)) {
            return Double.NaN;
        }
        return FastMath.toDegrees(FastMath.acos(cosH)) / 15.0;
    }

    /**
     * 无升落时按 sin φ sin δ - sin h0 的符号区分拱极和不升
     */
    public static HorizonStatus resolveStatus(double latitudeDeg, double declinationDeg, double standardAltitude) {
        if (!Double.isNaN(semiDiurnalArc(latitudeDeg, declinationDeg, standardAltitude))) {
            return HorizonStatus.RISES_AND_SETS;
        }
        double s = FastMath.sin(FastMath.toRadians(latitudeDeg)) * FastMath.sin(FastMath.toRadians(declinationDeg))
                   - FastMath.sin(FastMath.toRadians(standardAltitude));
        return s > 0.0 ? HorizonStatus.CIRCUMPOLAR : HorizonStatus.NEVER_RISES;
    }

    /**
     * 给定固定赤道坐标的闭式升落
     *
     * @param raDeg 赤经（度）
     * @param decDeg 赤纬（度）
     * @param observer 观测者
     * @param standardAltitude 标准高度（度）
     * @param year 本地日期
     * @param month 月
     * @param day 日
     * @return 地方时小时
     */
    public static PlanetEvents closedForm(double raDeg, double decDeg, Observer observer, double standardAltitude,
                                          int year, int month, int day) {
        double midnight = JulianDates.localMidnight(year, month, day, observer.getTimezoneOffset());
        double lstAtMidnight = SiderealTime.lstHours(midnight, observer.getLongitude());
        double transitLocal = Angles.normalizeHours(raDeg / 15.0 - lstAtMidnight) * SIDEREAL_FACTOR;

        double arc = semiDiurnalArc(observer.getLatitude(), decDeg, standardAltitude);
        HorizonStatus status = resolveStatus(observer.getLatitude(), decDeg, standardAltitude);
        if (Double.isNaN(arc)) {
            return new PlanetEvents(Double.NaN, transitLocal, Double.NaN, status);
        }
        double rise = Angles.normalizeHours(transitLocal - arc * SIDEREAL_FACTOR);
        double set = Angles.normalizeHours(transitLocal + arc * SIDEREAL_FACTOR);
        return new PlanetEvents(rise, transitLocal, set, status);
    }

    /**
     * 由天体状态提供者迭代求某本地日期的升起、中天、落下
     *
     * 中天从本地正午起迭代 5 次；升落用上一次估计时刻的天体位置重解闭式时角
     *
     * @param body 天体名
     * @param year 本地日期
     * @param month 月
     * @param day 日
     * @param observer 观测者
     * @return 地方时小时，无事件为 NaN
     */
    public PlanetEvents compute(String body, int year, int month, int day, Observer observer) {
        BodyKind kind = BodyKind.forBody(body);
        double factor = AbstractBodyStateProvider.MOON.equals(body) ? LUNAR_FACTOR : SIDEREAL_FACTOR;
        double h0 = kind.getStandardAltitude();
        double midnight = JulianDates.localMidnight(year, month, day, observer.getTimezoneOffset());

        double transit = midnight + 0.5;
        BodyState state = null;
        for (int i = 0; i < TRANSIT_PASSES; i++) {
            state = stateAt(body, transit);
            transit -= hourAngle(state, transit, observer) / 24.0 * factor;
        }

        HorizonStatus status = resolveStatus(observer.getLatitude(), state.getDec(), h0);
        if (status != HorizonStatus.RISES_AND_SETS) {
            return new PlanetEvents(Double.NaN, toLocalHours(transit, midnight), Double.NaN, status);
        }

        double rise = refineHorizon(body, transit, observer, h0, factor, true);
        double set = refineHorizon(body, transit, observer, h0, factor, false);
        return new PlanetEvents(toLocalHours(rise, midnight), toLocalHours(transit, midnight),
                                toLocalHours(set, midnight), status);
    }

    /**
     * 从中天出发迭代求升起（rising=true）或落下时刻；某次无解时返回 NaN
     */
    private double refineHorizon(String body, double transit, Observer observer, double h0,
                                 double factor, boolean rising) {
        double sign = rising ? -1.0 : 1.0;
        double t = transit;
        for (int i = 0; i < HORIZON_PASSES; i++) {
            BodyState state = stateAt(body, t);
            double arc = semiDiurnalArc(observer.getLatitude(), state.getDec(), h0);
            if (Double.isNaN(arc)) {
                return Double.NaN;
            }
            double targetHa = sign * arc;
            double ha = hourAngle(state, t, observer);
            t += Angles.wrapHours(targetHa - ha) / 24.0 * factor;
        }
        return t;
    }

    private BodyState stateAt(String body, double julianDateUt) {
        return provider.getBodyState(body, JulianDates.utToTt(julianDateUt, deltaTSeconds));
    }

    private static double hourAngle(BodyState state, double julianDateUt, Observer observer) {
        double lst = SiderealTime.lstHours(julianDateUt, observer.getLongitude());
        return SiderealTime.hourAngleHours(lst, state.getRa() / 15.0);
    }

    private static double toLocalHours(double julianDate, double localMidnight) {
        if (Double.isNaN(julianDate)) {
            return Double.NaN;
        }
        return Angles.normalizeHours((julianDate - localMidnight) * 24.0);
    }
}
