package orrery.provider;

import orrery.ephemeris.OutOfRangeException;

/**
 * 天体状态提供者
 *
 * 输入输出均为确定性的纯函数；超出支持范围时抛出 {@link OutOfRangeException}，不做截断。
 */
public interface BodyStateProvider {

    /**
     * 计算天体状态
     *
     * @param name 天体名（"Sun", "Moon", "Earth", "Mercury" ... "Neptune", "Halley"）
     * @param julianDate 儒略日（TT）
     * @return 天体状态
     * @throws OutOfRangeException 时刻超出支持范围或无该天体数据
     */
    BodyState getBodyState(String name, double julianDate);
}
