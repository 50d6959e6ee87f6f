package orrery.visibility;

/**
 * 某日天体相对地平线的状态
 */
public enum HorizonStatus {
    /** 正常升落 */
    RISES_AND_SETS,
    /** 拱极，整日在地平线上 */
    CIRCUMPOLAR,
    /** 整日在地平线下 */
    NEVER_RISES
}
