package orrery.visibility;

/**
 * 天体类别
 *
 * horizonThreshold 为判断"在地平线上"的高度阈值（日月取负的视半径），
 * standardAltitude 为计算升落时刻采用的标准高度（含大气折射）。
 */
public enum BodyKind {
    STAR(0.0, -0.5667),
    PLANET(0.0, -0.5667),
    SUN(-0.2667, -0.833),
    MOON(-0.2590, 0.125);

    private final double horizonThreshold;
    private final double standardAltitude;

    BodyKind(double horizonThreshold, double standardAltitude) {
        this.horizonThreshold = horizonThreshold;
        this.standardAltitude = standardAltitude;
    }

    public double getHorizonThreshold() {
        return horizonThreshold;
    }

    public double getStandardAltitude() {
        return standardAltitude;
    }

    /**
     * 由天体名判断类别，未知名称按行星处理
     */
    public static BodyKind forBody(String name) {
        if ("Sun".equals(name)) {
            return SUN;
        }
        if ("Moon".equals(name)) {
            return MOON;
        }
        return PLANET;
    }
}
