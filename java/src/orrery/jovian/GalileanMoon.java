package orrery.jovian;

/**
 * 伽利略卫星
 *
 * 半径以木星赤道半径为单位
 */
public enum GalileanMoon {
    IO("Io", 0.0255, 5.90569, 17295.0),
    EUROPA("Europa", 0.0218, 9.39657, 21819.0),
    GANYMEDE("Ganymede", 0.0368, 14.98832, 27558.0),
    CALLISTO("Callisto", 0.0337, 26.36273, 36548.0);

    private final String displayName;
    private final double radius;
    private final double meanDistance;
    private final double perspectiveConstant;

    GalileanMoon(String displayName, double radius, double meanDistance, double perspectiveConstant) {
        this.displayName = displayName;
        this.radius = radius;
        this.meanDistance = meanDistance;
        this.perspectiveConstant = perspectiveConstant;
    }

    public String getDisplayName() {
        return displayName;
    }

    /** 卫星半径（木星半径） */
    public double getRadius() {
        return radius;
    }

    /** 平均轨道半径（木星半径） */
    double getMeanDistance() {
        return meanDistance;
    }

    /** 地心视差修正常数 K */
    double getPerspectiveConstant() {
        return perspectiveConstant;
    }

    /**
     * 按名称查找，忽略大小写
     *
     * @throws IllegalArgumentException 未知名称
     */
    public static GalileanMoon fromName(String name) {
        for (GalileanMoon moon : values()) {
            if (moon.displayName.equalsIgnoreCase(name)) {
                return moon;
            }
        }
        throw new IllegalArgumentException("Unknown Galilean moon: " + name);
    }
}
