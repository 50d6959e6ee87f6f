package orrery.helper;

import orrery.ephemeris.BodySample;
import orrery.ephemeris.EphemerisStore;
import orrery.provider.BodyState;
import orrery.provider.BodyStateProvider;

import java.util.*;

/**
 * SampleTableCollector - 星历采样表收集器
 *
 * 按固定步长向天体状态提供者取样，把结果整理成星历存储的采样点，
 * 可直接载入 {@link EphemerisStore} 或交给星历文件写出器。
 *
 * 数据格式：每行 1 + 6 × 天体数 列 [jd, 天体1的 ra, dec, distGeo, distSun, helioLon, helioLat, 天体2 ...]
 * 太阳没有日心坐标，对应通道写 0。
 */
public class SampleTableCollector {

    private final BodyStateProvider provider;
    private final List<String> bodies;
    private final ArrayList<double[]> data = new ArrayList<>();

    public SampleTableCollector(BodyStateProvider provider, List<String> bodies) {
        if (bodies.isEmpty()) {
            throw new IllegalArgumentException("At least one body is required");
        }
        this.provider = provider;
        this.bodies = new ArrayList<>(bodies);
    }

    /**
     * 取一个时刻的样
     *
     * @param julianDate 儒略日（提供者的时间尺度）
     */
    public void handleStep(double julianDate) {
        double[] row = new double[1 + bodies.size() * EphemerisStore.CHANNEL_COUNT];
        row[0] = julianDate;
        int offset = 1;
        for (String body : bodies) {
            BodyState s = provider.getBodyState(body, julianDate);
            row[offset + EphemerisStore.RA] = s.getRa();
            row[offset + EphemerisStore.DEC] = s.getDec();
            row[offset + EphemerisStore.DIST_GEO] = s.getDistGeo();
            row[offset + EphemerisStore.DIST_SUN] = zeroIfNaN(s.getDistSun());
            row[offset + EphemerisStore.ECLIPTIC_LON] = zeroIfNaN(s.getHelioLon());
            row[offset + EphemerisStore.ECLIPTIC_LAT] = zeroIfNaN(s.getHelioLat());
            offset += EphemerisStore.CHANNEL_COUNT;
        }
        data.add(row);
    }

    /**
     * 在 [start, end] 上按步长取样（含两端，末步不超过 end）
     *
     * @return 本次新增的行数
     */
    public int collect(double start, double end, double step) {
        if (!(step > 0.0)) {
            throw new IllegalArgumentException("Step must be positive: " + step);
        }
        int before = data.size();
        long steps = (long) Math.floor((end - start) / step + 1.0e-9);
        for (long k = 0; k <= steps; k++) {
            handleStep(start + k * step);
        }
        return data.size() - before;
    }

    private static double zeroIfNaN(double value) {
        return Double.isNaN(value) ? 0.0 : value;
    }

    /**
     * 获取所有收集的数据
     *
     * @return double[][] 二维数组，每行为一个时刻
     */
    public double[][] getResults() {
        return data.toArray(new double[0][]);
    }

    /**
     * 按天体拆分为采样点
     */
    public Map<String, List<BodySample>> getSamples() {
        Map<String, List<BodySample>> samples = new LinkedHashMap<>();
        for (int b = 0; b < bodies.size(); b++) {
            int offset = 1 + b * EphemerisStore.CHANNEL_COUNT;
            List<BodySample> list = new ArrayList<>(data.size());
            for (double[] row : data) {
                list.add(new BodySample(row[0],
                        row[offset + EphemerisStore.RA], row[offset + EphemerisStore.DEC],
                        row[offset + EphemerisStore.DIST_GEO], row[offset + EphemerisStore.DIST_SUN],
                        row[offset + EphemerisStore.ECLIPTIC_LON], row[offset + EphemerisStore.ECLIPTIC_LAT]));
            }
            samples.put(bodies.get(b), list);
        }
        return samples;
    }

    /**
     * 把收集到的采样点载入星历存储
     */
    public void loadInto(EphemerisStore store) {
        for (Map.Entry<String, List<BodySample>> entry : getSamples().entrySet()) {
            store.load(entry.getKey(), entry.getValue());
        }
    }

    public List<String> getBodies() {
        return Collections.unmodifiableList(bodies);
    }

    /**
     * 获取收集的数据点数量
     */
    public int getCount() {
        return data.size();
    }

    /**
     * 清空已收集的数据
     */
    public void clear() {
        data.clear();
    }
}
