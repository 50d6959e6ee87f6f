package orrery.events;

import orrery.geometry.JulianDates;

import java.io.Serializable;

/**
 * 事件搜索配置
 *
 * 控制扫描步长、二分次数和搜索范围
 */
public class EventSearchConfig implements Serializable {

    private static final long serialVersionUID = 1L;

    private double minuteStep = 1.0 / 1440.0;                                        // 分钟级扫描步长（日）
    private int minuteIterations = EventDetector.MINUTE_BRACKET_ITERATIONS;         // 分钟级括区二分次数
    private double dayStep = 1.0;                                                    // 日级扫描步长（日）
    private int dayIterations = EventDetector.DAY_BRACKET_ITERATIONS;               // 日级括区二分次数
    private double goldenSectionEpsilon = EventDetector.GOLDEN_SECTION_EPSILON;     // 黄金分割收敛阈值（日）
    private int goldenSectionMaxIterations = EventDetector.GOLDEN_SECTION_MAX_ITERATIONS;
    private double jovianScanDays = 2.0;                                             // 木卫事件扫描长度（日）
    private double deltaTSeconds = JulianDates.DEFAULT_DELTA_T;                      // TT - UT（秒）
    private int phenomenaRangeDays = 600;                                            // 行星动态搜索范围（日）
    private int marsPhenomenaRangeDays = 900;                                        // 火星会合周期较长
    private boolean maskHiddenTransitions = true;                                    // 掩食互相屏蔽
    private boolean useParallel = true;                                              // 批量计算是否并行

    public EventSearchConfig() {
    }

    /**
     * 某行星的动态搜索范围
     */
    public int phenomenaRangeFor(String planet) {
        return "Mars".equals(planet) ? marsPhenomenaRangeDays : phenomenaRangeDays;
    }

    // Getters and Setters
    public double getMinuteStep() {
        return minuteStep;
    }

    public void setMinuteStep(double minuteStep) {
        this.minuteStep = minuteStep;
    }

    public int getMinuteIterations() {
        return minuteIterations;
    }

    public void setMinuteIterations(int minuteIterations) {
        this.minuteIterations = minuteIterations;
    }

    public double getDayStep() {
        return dayStep;
    }

    public void setDayStep(double dayStep) {
        this.dayStep = dayStep;
    }

    public int getDayIterations() {
        return dayIterations;
    }

    public void setDayIterations(int dayIterations) {
        this.dayIterations = dayIterations;
    }

    public double getGoldenSectionEpsilon() {
        return goldenSectionEpsilon;
    }

    public void setGoldenSectionEpsilon(double goldenSectionEpsilon) {
        this.goldenSectionEpsilon = goldenSectionEpsilon;
    }

    public int getGoldenSectionMaxIterations() {
        return goldenSectionMaxIterations;
    }

    public void setGoldenSectionMaxIterations(int goldenSectionMaxIterations) {
        this.goldenSectionMaxIterations = goldenSectionMaxIterations;
    }

    public double getJovianScanDays() {
        return jovianScanDays;
    }

    public void setJovianScanDays(double jovianScanDays) {
        this.jovianScanDays = jovianScanDays;
    }

    public double getDeltaTSeconds() {
        return deltaTSeconds;
    }

    public void setDeltaTSeconds(double deltaTSeconds) {
        this.deltaTSeconds = deltaTSeconds;
    }

    public int getPhenomenaRangeDays() {
        return phenomenaRangeDays;
    }

    public void setPhenomenaRangeDays(int phenomenaRangeDays) {
        this.phenomenaRangeDays = phenomenaRangeDays;
    }

    public int getMarsPhenomenaRangeDays() {
        return marsPhenomenaRangeDays;
    }

    public void setMarsPhenomenaRangeDays(int marsPhenomenaRangeDays) {
        this.marsPhenomenaRangeDays = marsPhenomenaRangeDays;
    }

    public boolean isMaskHiddenTransitions() {
        return maskHiddenTransitions;
    }

    public void setMaskHiddenTransitions(boolean maskHiddenTransitions) {
        this.maskHiddenTransitions = maskHiddenTransitions;
    }

    public boolean isUseParallel() {
        return useParallel;
    }

    public void setUseParallel(boolean useParallel) {
        this.useParallel = useParallel;
    }

    @Override
    public String toString() {
        return "EventSearchConfig{" +
                "minuteStep=" + minuteStep +
                ", minuteIterations=" + minuteIterations +
                ", dayStep=" + dayStep +
                ", dayIterations=" + dayIterations +
                ", goldenSectionEpsilon=" + goldenSectionEpsilon +
                ", jovianScanDays=" + jovianScanDays +
                ", deltaTSeconds=" + deltaTSeconds +
                ", phenomenaRangeDays=" + phenomenaRangeDays +
                ", maskHiddenTransitions=" + maskHiddenTransitions +
                ", useParallel=" + useParallel +
                '}';
    }
}
