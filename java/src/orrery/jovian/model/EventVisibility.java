package orrery.jovian.model;

/**
 * 事件对观测者的可见性
 */
public enum EventVisibility {
    /** 天黑且木星在地平线上 */
    VISIBLE,
    /** 白天或木星在地平线下 */
    HIDDEN,
    /** 当前时刻之后第一个可见事件 */
    NEXT
}
