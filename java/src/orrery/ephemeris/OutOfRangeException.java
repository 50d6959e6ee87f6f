package orrery.ephemeris;

/**
 * 查询时刻超出已加载星历范围，或该天体没有星历数据
 *
 * 不做外推：调用方必须处理此异常
 */
public class OutOfRangeException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final String bodyName;
    private final double julianDate;

    public OutOfRangeException(String bodyName, double julianDate, double first, double last) {
        super(String.format("%s: JD %.6f outside ephemeris coverage [%.6f, %.6f]",
                bodyName, julianDate, first, last));
        this.bodyName = bodyName;
        this.julianDate = julianDate;
    }

    public OutOfRangeException(String bodyName, double julianDate) {
        super(String.format("%s: no ephemeris data (JD %.6f)", bodyName, julianDate));
        this.bodyName = bodyName;
        this.julianDate = julianDate;
    }

    public String getBodyName() {
        return bodyName;
    }

    public double getJulianDate() {
        return julianDate;
    }
}
