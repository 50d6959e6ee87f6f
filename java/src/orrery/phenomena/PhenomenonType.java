package orrery.phenomena;

/**
 * 行星天象类型
 */
public enum PhenomenonType {
    INFERIOR_CONJUNCTION("Inf. Conj.", 0.0),
    SUPERIOR_CONJUNCTION("Sup. Conj.", 0.0),
    CONJUNCTION("Conjunction", 0.0),
    OPPOSITION("Opposition", 180.0),
    GREATEST_ELONGATION_EAST("Max. East", Double.NaN),
    GREATEST_ELONGATION_WEST("Max. West", Double.NaN);

    private final String label;
    private final double targetAngle;

    PhenomenonType(String label, double targetAngle) {
        this.label = label;
        this.targetAngle = targetAngle;
    }

    public String getLabel() {
        return label;
    }

    /**
     * 行星与太阳黄经差的目标值（度），大距为 NaN
     */
    public double getTargetAngle() {
        return targetAngle;
    }

    public boolean isElongation() {
        return this == GREATEST_ELONGATION_EAST || this == GREATEST_ELONGATION_WEST;
    }
}
