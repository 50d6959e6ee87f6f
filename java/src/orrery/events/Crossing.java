package orrery.events;

import java.io.Serializable;

/**
 * 经细化的过零/翻转事件
 *
 * lowerBound、upperBound 为初始扫描括区（按时间先后），valueBefore、valueAfter 为括区两端的采样值。
 * 谓词翻转时采样值取 1（真）或 0（假）。
 */
public class Crossing implements Serializable {

    private static final long serialVersionUID = 1L;

    private final double julianDate;
    private final double lowerBound;
    private final double upperBound;
    private final double valueBefore;
    private final double valueAfter;

    public Crossing(double julianDate, double lowerBound, double upperBound,
                    double valueBefore, double valueAfter) {
        this.julianDate = julianDate;
        this.lowerBound = lowerBound;
        this.upperBound = upperBound;
        this.valueBefore = valueBefore;
        this.valueAfter = valueAfter;
    }

    public double getJulianDate() {
        return julianDate;
    }

    public double getLowerBound() {
        return lowerBound;
    }

    public double getUpperBound() {
        return upperBound;
    }

    public double getValueBefore() {
        return valueBefore;
    }

    public double getValueAfter() {
        return valueAfter;
    }

    /**
     * 信号是否由负变正（谓词由假变真）
     */
    public boolean isRising() {
        return valueAfter > valueBefore;
    }

    @Override
    public String toString() {
        return "Crossing{" +
                "jd=" + julianDate +
                ", bracket=[" + lowerBound + ", " + upperBound + "]" +
                ", rising=" + isRising() +
                '}';
    }
}
