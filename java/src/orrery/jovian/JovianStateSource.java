package orrery.jovian;

import orrery.jovian.model.MoonGeometryState;

import java.util.*;

/**
 * 某时刻全部木卫的几何状态来源
 */
public interface JovianStateSource {

    /**
     * @param julianDate 儒略日（UT）
     * @return 卫星 -> 几何状态；该时刻无数据时为空映射
     */
    Map<GalileanMoon, MoonGeometryState> stateAt(double julianDate);
}
