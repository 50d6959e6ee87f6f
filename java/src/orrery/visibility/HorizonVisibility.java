package orrery.visibility;

import orrery.geometry.Angles;
import orrery.geometry.EquatorialCoordinates;
import orrery.geometry.HorizontalCoordinates;
import orrery.geometry.JulianDates;
import orrery.geometry.SiderealTime;
import orrery.geometry.Topocentric;
import orrery.provider.AbstractBodyStateProvider;
import orrery.provider.BodyState;
import orrery.provider.BodyStateProvider;

import org.hipparchus.util.FastMath;

import java.util.function.DoublePredicate;

/**
 * 地平可见性
 *
 * 静态方法为纯几何判断；实例方法结合天体状态提供者计算观测者处的高度角。
 */
public class HorizonVisibility {

    /** 民用意义上太阳落下的高度（含折射和视半径） */
    public static final double SUN_DOWN_ALTITUDE = -0.833;

    private static final double DEGENERATE_COS = 1.0e-10;

    private final BodyStateProvider provider;
    private final double deltaTSeconds;

    public HorizonVisibility(BodyStateProvider provider, double deltaTSeconds) {
        this.provider = provider;
        this.deltaTSeconds = deltaTSeconds;
    }

    public HorizonVisibility(BodyStateProvider provider) {
        this(provider, JulianDates.DEFAULT_DELTA_T);
    }

    /**
     * 高度角（度）
     *
     * @param hourAngleHours 时角（小时）
     * @param latitudeDeg 纬度
     * @param declinationDeg 赤纬
     */
    public static double altitude(double hourAngleHours, double latitudeDeg, double declinationDeg) {
        return HorizontalCoordinates.altitude(hourAngleHours, latitudeDeg, declinationDeg);
    }

    /**
     * 天体是否在地平线上
     */
    public static boolean isAboveHorizon(double hourAngleHours, double latitudeDeg, double declinationDeg,
                                         BodyKind kind) {
        return altitude(hourAngleHours, latitudeDeg, declinationDeg) > kind.getHorizonThreshold();
    }

    /**
     * 某纬度上天体在地平线上的经度区间
     *
     * cos H = -tan φ tan δ；升起时 H = -h，落下时 H = +h，lon = (H + RA - GMST)·15
     *
     * @param latitudeDeg 纬度
     * @param gmstHours 格林尼治恒星时（小时）
     * @param raHours 赤经（小时）
     * @param declinationDeg 赤纬
     */
    public static VisibleLonRange visibleLongitudeRange(double latitudeDeg, double gmstHours,
                                                        double raHours, double declinationDeg) {
        double lat = FastMath.toRadians(latitudeDeg);
        double dec = FastMath.toRadians(declinationDeg);
        double sinLat = FastMath.sin(lat);
        double cosLat = FastMath.cos(lat);
        double sinDec = FastMath.sin(dec);
        double cosDec = FastMath.cos(dec);

        // 极点或天极附近
        if (FastMath.abs(cosLat) < DEGENERATE_COS || FastMath.abs(cosDec) < DEGENERATE_COS) {
            return sinLat * sinDec > 0.0 ? VisibleLonRange.alwaysUp() : VisibleLonRange.neverUp();
        }

        double cosHa = -(sinLat * sinDec) / (cosLat * cosDec);
        if (cosHa <= -1.0) {
            return VisibleLonRange.alwaysUp();
        }
        if (cosHa >= 1.0) {
            return VisibleLonRange.neverUp();
        }

        double ha = FastMath.toDegrees(FastMath.acos(cosHa)) / 15.0;
        double lonRising = (-ha + raHours - gmstHours) * 15.0;
        double lonSetting = (ha + raHours - gmstHours) * 15.0;
        return VisibleLonRange.between(Angles.wrapDegrees(lonRising), Angles.wrapDegrees(lonSetting));
    }

    /**
     * 观测者处天体的高度角（站心，不含折射）
     *
     * @param body 天体名
     * @param julianDate UT 儒略日
     * @param observer 观测者
     */
    public double altitudeOf(String body, double julianDate, Observer observer) {
        BodyState state = provider.getBodyState(body, JulianDates.utToTt(julianDate, deltaTSeconds));
        double lst = SiderealTime.lstHours(julianDate, observer.getLongitude());
        EquatorialCoordinates topo = Topocentric.toTopocentric(state.getRa(), state.getDec(), state.getDistGeo(),
                                                               observer.getLatitude(), lst,
                                                               observer.getAltitude());
        double ha = SiderealTime.hourAngleHours(lst, topo.getRightAscensionHours());
        return altitude(ha, observer.getLatitude(), topo.getDeclination());
    }

    /**
     * 天黑（太阳高度 < -0.833°）且天体在地平线上
     */
    public boolean isDarkSkyVisible(String body, double julianDate, Observer observer) {
        return altitudeOf(AbstractBodyStateProvider.SUN, julianDate, observer) < SUN_DOWN_ALTITUDE
               && altitudeOf(body, julianDate, observer) > 0.0;
    }

    /**
     * {@link #isDarkSkyVisible} 的谓词形式，供事件生成器使用
     */
    public DoublePredicate darkSkyPredicate(String body, Observer observer) {
        return jd -> isDarkSkyVisible(body, jd, observer);
    }
}
