package orrery.ephemeris;

import orrery.geometry.Angles;

import org.hipparchus.exception.LocalizedCoreFormats;
import org.hipparchus.exception.MathIllegalArgumentException;
import org.hipparchus.util.MathArrays;
import org.hipparchus.util.MathUtils;

import java.util.*;
import java.util.concurrent.ConcurrentHashMap;
import java.util.logging.Logger;

/**
 * 星历存储
 *
 * 保存每个天体按时间排序的采样表，并用 Catmull-Rom 三次插值重建连续的位置函数。
 * 采样表加载后只读，多线程并发调用 {@link #interpolate} 无需同步。
 *
 * 通道顺序：{ra, dec, distGeo, distSun, eclipticLon, eclipticLat}，
 * 其中 ra 和 eclipticLon 为角度通道，插值前展开、插值后归一化到 [0, 360)。
 */
public class EphemerisStore {

    private static final Logger logger = Logger.getLogger(EphemerisStore.class.getName());

    // 通道索引
    public static final int RA = 0;
    public static final int DEC = 1;
    public static final int DIST_GEO = 2;
    public static final int DIST_SUN = 3;
    public static final int ECLIPTIC_LON = 4;
    public static final int ECLIPTIC_LAT = 5;

    /** 每个天体的通道数 */
    public static final int CHANNEL_COUNT = 6;

    private static final boolean[] ANGLE_CHANNEL = {true, false, false, false, true, false};

    private final Map<String, BodyTable> tables = new ConcurrentHashMap<>();

    public EphemerisStore() {
    }

    /**
     * 注册一个天体的采样表
     *
     * @param bodyName 天体名
     * @param samples 按时间严格递增的采样点
     * @throws MathIllegalArgumentException 时间戳含 NaN/无穷、不严格递增或采样点少于2个
     */
    public void load(String bodyName, List<BodySample> samples) {
        double[] times = new double[samples.size()];
        double[][] channels = new double[samples.size()][];
        for (int i = 0; i < samples.size(); i++) {
            BodySample s = samples.get(i);
            times[i] = s.getJulianDate();
            channels[i] = s.toChannels();
        }
        load(bodyName, times, channels);
    }

    /**
     * 以并行数组形式注册采样表（二进制文件读取器使用）
     *
     * @param bodyName 天体名
     * @param times 儒略日，严格递增
     * @param channels 每行 {@link #CHANNEL_COUNT} 个通道值
     */
    public void load(String bodyName, double[] times, double[][] channels) {
        Objects.requireNonNull(bodyName, "bodyName");
        if (times.length != channels.length) {
            throw new MathIllegalArgumentException(LocalizedCoreFormats.DIMENSIONS_MISMATCH,
                                                   times.length, channels.length);
        }
        if (times.length < 2) {
            throw new MathIllegalArgumentException(LocalizedCoreFormats.INSUFFICIENT_DIMENSION,
                                                   times.length, 2);
        }
        for (double[] row : channels) {
            if (row.length != CHANNEL_COUNT) {
                throw new MathIllegalArgumentException(LocalizedCoreFormats.DIMENSIONS_MISMATCH,
                                                       row.length, CHANNEL_COUNT);
            }
        }
        // 含非有限值或非单调的表直接拒绝，不登记
        MathUtils.checkFinite(times);
        MathArrays.checkOrder(times);

        double[] timeCopy = times.clone();
        double[][] channelCopy = new double[channels.length][];
        for (int i = 0; i < channels.length; i++) {
            channelCopy[i] = channels[i].clone();
        }
        tables.put(bodyName, new BodyTable(timeCopy, channelCopy));
        logger.fine("Loaded " + times.length + " samples for " + bodyName +
                    " [" + times[0] + ", " + times[times.length - 1] + "]");
    }

    /**
     * 插值得到任意时刻的状态
     *
     * @param bodyName 天体名
     * @param julianDate 儒略日
     * @return 插值状态
     * @throws OutOfRangeException 天体无数据，或时刻早于首个/晚于末个采样点
     */
    public InterpolatedState interpolate(String bodyName, double julianDate) {
        BodyTable table = tables.get(bodyName);
        if (table == null) {
            throw new OutOfRangeException(bodyName, julianDate);
        }
        double[] t = table.times;
        int n = t.length;
        if (!(julianDate >= t[0] && julianDate <= t[n - 1])) {
            throw new OutOfRangeException(bodyName, julianDate, t[0], t[n - 1]);
        }

        int i1 = bracketIndex(t, julianDate);
        int i2 = i1 + 1;
        int i0 = i1 > 0 ? i1 - 1 : i1;
        int i3 = i2 < n - 1 ? i2 + 1 : i2;
        double frac = (julianDate - t[i1]) / (t[i2] - t[i1]);

        double[] result = new double[CHANNEL_COUNT];
        for (int c = 0; c < CHANNEL_COUNT; c++) {
            double p0 = table.channels[i0][c];
            double p1 = table.channels[i1][c];
            double p2 = table.channels[i2][c];
            double p3 = table.channels[i3][c];
            if (ANGLE_CHANNEL[c]) {
                p0 = Angles.unwrapNear(p0, p1);
                p2 = Angles.unwrapNear(p2, p1);
                p3 = Angles.unwrapNear(p3, p2);
                result[c] = Angles.normalizeDegrees(catmullRom(p0, p1, p2, p3, frac));
            } else {
                result[c] = catmullRom(p0, p1, p2, p3, frac);
            }
        }
        return new InterpolatedState(bodyName, julianDate, result);
    }

    /**
     * 某天体是否已加载
     */
    public boolean contains(String bodyName) {
        return tables.containsKey(bodyName);
    }

    /**
     * 已加载的天体名
     */
    public Set<String> getBodyNames() {
        return new TreeSet<>(tables.keySet());
    }

    /**
     * 星历覆盖范围
     *
     * @return {首个儒略日, 末个儒略日}
     * @throws OutOfRangeException 天体无数据
     */
    public double[] getCoverage(String bodyName) {
        BodyTable table = tables.get(bodyName);
        if (table == null) {
            throw new OutOfRangeException(bodyName, Double.NaN);
        }
        return new double[] {table.times[0], table.times[table.times.length - 1]};
    }

    /**
     * 采样点数量
     */
    public int getSampleCount(String bodyName) {
        BodyTable table = tables.get(bodyName);
        return table == null ? 0 : table.times.length;
    }

    /**
     * 取回原始采样点
     */
    public BodySample getSample(String bodyName, int index) {
        BodyTable table = tables.get(bodyName);
        if (table == null) {
            throw new OutOfRangeException(bodyName, Double.NaN);
        }
        return BodySample.fromChannels(table.times[index], table.channels[index]);
    }

    /**
     * t[i1] <= date 的最大下标，限制在 n-2 以内
     */
    private static int bracketIndex(double[] t, double date) {
        int idx = Arrays.binarySearch(t, date);
        int i1 = idx >= 0 ? idx : -(idx + 1) - 1;
        return Math.max(0, Math.min(i1, t.length - 2));
    }

    /**
     * Catmull-Rom 三次插值，frac ∈ [0, 1] 为 p1 到 p2 之间的位置
     */
    static double catmullRom(double p0, double p1, double p2, double p3, double frac) {
        double t2 = frac * frac;
        double t3 = t2 * frac;
        return 0.5 * (2.0 * p1
                + (-p0 + p2) * frac
                + (2.0 * p0 - 5.0 * p1 + 4.0 * p2 - p3) * t2
                + (-p0 + 3.0 * p1 - 3.0 * p2 + p3) * t3);
    }

    /**
     * 单个天体的采样表（内部类）
     */
    private static class BodyTable {
        private final double[] times;
        private final double[][] channels;

        BodyTable(double[] times, double[][] channels) {
            this.times = times;
            this.channels = channels;
        }
    }
}
