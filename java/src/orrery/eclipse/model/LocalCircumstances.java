package orrery.eclipse.model;

import java.io.Serializable;

/**
 * 某地看到的月食情况
 *
 * 月出、月落只记录半影食期间的第一次，没有时为 NaN；各阶段可见分钟数互不重叠。
 */
public class LocalCircumstances implements Serializable {

    private static final long serialVersionUID = 1L;

    private final boolean moonUpAtStart;
    private final double moonrise;
    private final double moonset;
    private final int penumbralMinutes;
    private final int partialMinutes;
    private final int totalMinutes;

    public LocalCircumstances(boolean moonUpAtStart, double moonrise, double moonset,
                              int penumbralMinutes, int partialMinutes, int totalMinutes) {
        this.moonUpAtStart = moonUpAtStart;
        this.moonrise = moonrise;
        this.moonset = moonset;
        this.penumbralMinutes = penumbralMinutes;
        this.partialMinutes = partialMinutes;
        this.totalMinutes = totalMinutes;
    }

    public boolean hasMoonrise() {
        return !Double.isNaN(moonrise);
    }

    public boolean hasMoonset() {
        return !Double.isNaN(moonset);
    }

    /**
     * 整个食过程中月亮都在地平线上
     */
    public boolean isAlwaysUp() {
        return moonUpAtStart && !hasMoonrise() && !hasMoonset();
    }

    /**
     * 食过程中完全看不到
     */
    public boolean isNeverUp() {
        return getVisibleMinutes() == 0;
    }

    public int getVisibleMinutes() {
        return penumbralMinutes + partialMinutes + totalMinutes;
    }

    // Getters
    public boolean isMoonUpAtStart() {
        return moonUpAtStart;
    }

    public double getMoonrise() {
        return moonrise;
    }

    public double getMoonset() {
        return moonset;
    }

    public int getPenumbralMinutes() {
        return penumbralMinutes;
    }

    public int getPartialMinutes() {
        return partialMinutes;
    }

    public int getTotalMinutes() {
        return totalMinutes;
    }

    @Override
    public String toString() {
        return "LocalCircumstances{" +
                "moonUpAtStart=" + moonUpAtStart +
                ", moonrise=" + moonrise +
                ", moonset=" + moonset +
                ", penumbralMinutes=" + penumbralMinutes +
                ", partialMinutes=" + partialMinutes +
                ", totalMinutes=" + totalMinutes +
                '}';
    }
}
