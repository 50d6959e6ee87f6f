package orrery.jovian;

import orrery.jovian.model.MoonGeometryState;

/**
 * 木卫现象种类
 */
public enum JovianEventKind {
    TRANSIT("%s begins transit of Jupiter", "%s ends transit of Jupiter"),
    SHADOW_TRANSIT("%s's shadow begins to cross Jupiter", "%s's shadow leaves Jupiter's disk"),
    OCCULTATION("%s enters occultation by Jupiter", "%s exits occultation by Jupiter"),
    ECLIPSE("%s eclipsed by Jupiter's shadow", "%s exits eclipse by Jupiter's shadow");

    private final String startFormat;
    private final String endFormat;

    JovianEventKind(String startFormat, String endFormat) {
        this.startFormat = startFormat;
        this.endFormat = endFormat;
    }

    /**
     * 该现象在给定状态下是否正在发生
     */
    public boolean isActive(MoonGeometryState state) {
        switch (this) {
            case TRANSIT:
                return state.isTransit();
            case SHADOW_TRANSIT:
                return state.isShadowTransit();
            case OCCULTATION:
                return state.isOccultation();
            case ECLIPSE:
                return state.isEclipse();
            default:
                return false;
        }
    }

    /**
     * 事件描述
     *
     * @param moon 卫星名
     * @param start 开始或结束
     */
    public String describe(String moon, boolean start) {
        return String.format(start ? startFormat : endFormat, moon);
    }
}
