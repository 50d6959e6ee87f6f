package orrery.eclipse.model;

/**
 * 月食类型，code 为食表记录中类型字节的低 4 位
 */
public enum LunarEclipseType {
    PENUMBRAL(0, "Penumbral"),
    PARTIAL(1, "Partial"),
    TOTAL(2, "Total");

    private final int code;
    private final String displayName;

    LunarEclipseType(int code, String displayName) {
        this.code = code;
        this.displayName = displayName;
    }

    public int getCode() {
        return code;
    }

    public String getDisplayName() {
        return displayName;
    }

    /**
     * 按类型码查找
     *
     * @throws IllegalArgumentException 未知类型码
     */
    public static LunarEclipseType fromCode(int code) {
        for (LunarEclipseType type : values()) {
            if (type.code == code) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown lunar eclipse type code: " + code);
    }
}
