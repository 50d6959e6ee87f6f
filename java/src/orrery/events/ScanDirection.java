package orrery.events;

/**
 * 扫描方向
 */
public enum ScanDirection {
    FORWARD(1.0),
    BACKWARD(-1.0);

    private final double sign;

    ScanDirection(double sign) {
        this.sign = sign;
    }

    /**
     * 步长符号：向前为 +1，向后为 -1
     */
    public double getSign() {
        return sign;
    }
}
