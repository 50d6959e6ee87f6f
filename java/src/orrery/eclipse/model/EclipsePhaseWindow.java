package orrery.eclipse.model;

import java.io.Serializable;

/**
 * 月食各阶段的起止时刻（UT 儒略日）
 *
 * 没有的阶段取 NaN；存在时满足 半影 ⊇ 本影部分 ⊇ 全食。
 */
public class EclipsePhaseWindow implements Serializable {

    private static final long serialVersionUID = 1L;

    /** 每日分钟数的两倍，历时/2880 即半历时（日） */
    private static final double HALF_DURATION_DIVISOR = 2880.0;

    private final double greatestEclipse;
    private final double penumbralStart;
    private final double penumbralEnd;
    private final double partialStart;
    private final double partialEnd;
    private final double totalStart;
    private final double totalEnd;

    public EclipsePhaseWindow(double greatestEclipse,
                              double penumbralStart, double penumbralEnd,
                              double partialStart, double partialEnd,
                              double totalStart, double totalEnd) {
        if (!(penumbralStart <= penumbralEnd)) {
            throw new IllegalArgumentException("Penumbral window is empty: " + penumbralStart + " > " + penumbralEnd);
        }
        checkNested("partial", partialStart, partialEnd, penumbralStart, penumbralEnd);
        if (!Double.isNaN(totalStart)) {
            if (Double.isNaN(partialStart)) {
                throw new IllegalArgumentException("Total phase without partial phase");
            }
            checkNested("total", totalStart, totalEnd, partialStart, partialEnd);
        }
        this.greatestEclipse = greatestEclipse;
        this.penumbralStart = penumbralStart;
        this.penumbralEnd = penumbralEnd;
        this.partialStart = partialStart;
        this.partialEnd = partialEnd;
        this.totalStart = totalStart;
        this.totalEnd = totalEnd;
    }

    /**
     * 由食表的历时字段构造，各阶段关于食甚对称
     *
     * @param greatestEclipse 食甚（UT 儒略日）
     * @param type 月食类型，决定哪些阶段存在
     * @param penumbralMinutes 半影食历时（分钟）
     * @param partialMinutes 本影部分食历时（分钟）
     * @param totalMinutes 全食历时（分钟）
     */
    public static EclipsePhaseWindow symmetric(double greatestEclipse, LunarEclipseType type,
                                               double penumbralMinutes, double partialMinutes,
                                               double totalMinutes) {
        double pen = penumbralMinutes / HALF_DURATION_DIVISOR;
        double par = partialMinutes / HALF_DURATION_DIVISOR;
        double tot = totalMinutes / HALF_DURATION_DIVISOR;
        boolean hasPartial = type != LunarEclipseType.PENUMBRAL;
        boolean hasTotal = type == LunarEclipseType.TOTAL;
        return new EclipsePhaseWindow(greatestEclipse,
                greatestEclipse - pen, greatestEclipse + pen,
                hasPartial ? greatestEclipse - par : Double.NaN,
                hasPartial ? greatestEclipse + par : Double.NaN,
                hasTotal ? greatestEclipse - tot : Double.NaN,
                hasTotal ? greatestEclipse + tot : Double.NaN);
    }

    public static EclipsePhaseWindow forRecord(LunarEclipseRecord record) {
        return symmetric(record.getGreatestEclipseUt(), record.getType(),
                         record.getPenumbralDuration(), record.getPartialDuration(), record.getTotalDuration());
    }

    private static void checkNested(String phase, double start, double end, double outerStart, double outerEnd) {
        if (Double.isNaN(start) != Double.isNaN(end)) {
            throw new IllegalArgumentException("Incomplete " + phase + " window");
        }
        if (Double.isNaN(start)) {
            return;
        }
        if (start > end || start < outerStart || end > outerEnd) {
            throw new IllegalArgumentException("The " + phase + " window [" + start + ", " + end +
                                               "] is not nested in [" + outerStart + ", " + outerEnd + "]");
        }
    }

    public boolean hasPartial() {
        return !Double.isNaN(partialStart);
    }

    public boolean hasTotal() {
        return !Double.isNaN(totalStart);
    }

    /**
     * 半影食历时（日）
     */
    public double getPenumbralSpan() {
        return penumbralEnd - penumbralStart;
    }

    /**
     * 某时刻所处的最深阶段：3 全食，2 本影部分食，1 半影食，0 不在食中
     */
    public int depthAt(double julianDate) {
        if (hasTotal() && julianDate >= totalStart && julianDate <= totalEnd) {
            return 3;
        }
        if (hasPartial() && julianDate >= partialStart && julianDate <= partialEnd) {
            return 2;
        }
        if (julianDate >= penumbralStart && julianDate <= penumbralEnd) {
            return 1;
        }
        return 0;
    }

    // Getters
    public double getGreatestEclipse() {
        return greatestEclipse;
    }

    public double getPenumbralStart() {
        return penumbralStart;
    }

    public double getPenumbralEnd() {
        return penumbralEnd;
    }

    public double getPartialStart() {
        return partialStart;
    }

    public double getPartialEnd() {
        return partialEnd;
    }

    public double getTotalStart() {
        return totalStart;
    }

    public double getTotalEnd() {
        return totalEnd;
    }

    @Override
    public String toString() {
        return "EclipsePhaseWindow{" +
                "greatest=" + greatestEclipse +
                ", penumbral=[" + penumbralStart + ", " + penumbralEnd + "]" +
                ", partial=[" + partialStart + ", " + partialEnd + "]" +
                ", total=[" + totalStart + ", " + totalEnd + "]" +
                '}';
    }
}
