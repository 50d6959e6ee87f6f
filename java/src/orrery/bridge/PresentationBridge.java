package orrery.bridge;

import orrery.eclipse.LunarEclipseCalculator;
import orrery.eclipse.model.EclipsePhaseWindow;
import orrery.eclipse.model.LunarEclipseRecord;
import orrery.eclipse.model.LunarEclipseType;
import orrery.events.EventSearchConfig;
import orrery.events.EventWindow;
import orrery.geometry.JulianDates;
import orrery.jovian.GalileanSatelliteTheory;
import orrery.jovian.JovianEventGenerator;
import orrery.jovian.JovianEventReport;
import orrery.jovian.JovianSystem;
import orrery.jovian.model.JovianEvent;
import orrery.phenomena.BatchPhenomenaCalculator;
import orrery.phenomena.model.ComputationStats;
import orrery.phenomena.model.PhenomenaBatchResult;
import orrery.phenomena.model.PhenomenaRow;
import orrery.phenomena.model.Phenomenon;
import orrery.phenomena.model.PlanetPhenomena;
import orrery.provider.BodyStateProvider;
import orrery.visibility.HorizonVisibility;
import orrery.visibility.Observer;
import orrery.visibility.PlanetEvents;
import orrery.visibility.RiseSetCalculator;

import java.util.*;

/**
 * 展示层调用入口
 *
 * 把计算结果转换成 Map/List 结构，供非 Java 调用方（脚本、界面层）直接使用。
 * 计算失败时返回 {error, errorMessage, errorType}，不抛出异常。
 */
public class PresentationBridge {

    private static final LunarEclipseCalculator eclipseCalculator = new LunarEclipseCalculator();

    private PresentationBridge() {
    }

    /**
     * 木卫事件表
     *
     * @param provider 天体状态提供者
     * @param startJulianDate 起始 UT 儒略日
     * @param nowJulianDate 当前 UT 儒略日
     * @param observer 观测者，用于判断天黑且木星在地平线上
     * @param config 搜索配置
     * @return 结果Map：events、windows
     */
    public static Map<String, Object> computeJovianEvents(BodyStateProvider provider, double startJulianDate,
                                                          double nowJulianDate, Observer observer,
                                                          EventSearchConfig config) {
        try {
            JovianSystem system = new JovianSystem(provider, new GalileanSatelliteTheory(),
                                                   config.getDeltaTSeconds());
            HorizonVisibility horizon = new HorizonVisibility(provider, config.getDeltaTSeconds());
            JovianEventReport report = new JovianEventGenerator(system, config)
                    .generate(startJulianDate, nowJulianDate,
                              horizon.darkSkyPredicate(JovianSystem.JUPITER, observer));

            Map<String, Object> map = new HashMap<>();
            map.put("events", convertEvents(report.getEvents()));
            map.put("windows", convertWindows(report.getWindows()));
            return map;
        } catch (Exception e) {
            return errorMap(e);
        }
    }

    /**
     * 行星天象表
     *
     * @return 结果Map：planets、errors、stats
     */
    public static Map<String, Object> computePhenomena(BodyStateProvider provider, double centerJulianDate,
                                                       EventSearchConfig config) {
        try {
            PhenomenaBatchResult result = new BatchPhenomenaCalculator(provider, config).computeAll(centerJulianDate);
            return convertPhenomena(result);
        } catch (Exception e) {
            return errorMap(e);
        }
    }

    /**
     * 月食列表
     *
     * @param canon 食表
     * @param startYear 起始年
     * @param endYear 结束年
     * @param types 保留的类型
     * @param observer 观测者；localOnly 为 true 时只保留该地可见的月食
     * @param localOnly 是否按当地可见性筛选
     * @return 结果Map：eclipses
     */
    public static Map<String, Object> computeLunarEclipses(List<LunarEclipseRecord> canon, int startYear,
                                                           int endYear, Set<LunarEclipseType> types,
                                                           Observer observer, boolean localOnly) {
        try {
            List<LunarEclipseRecord> selected = eclipseCalculator.filter(
                    canon, startYear, endYear, types, localOnly ? observer : null);
            List<Map<String, Object>> list = new ArrayList<>();
            for (LunarEclipseRecord record : selected) {
                Map<String, Object> m = new HashMap<>();
                EclipsePhaseWindow window = EclipsePhaseWindow.forRecord(record);
                m.put("date", record.formatDate());
                m.put("type", record.getType().getDisplayName());
                m.put("saros", (int) record.getSaros());
                m.put("greatestEclipse", window.getGreatestEclipse());
                m.put("timestamp", timestamp(window.getGreatestEclipse()));
                m.put("penumbralStart", window.getPenumbralStart());
                m.put("penumbralEnd", window.getPenumbralEnd());
                if (window.hasPartial()) {
                    m.put("partialStart", window.getPartialStart());
                    m.put("partialEnd", window.getPartialEnd());
                }
                if (window.hasTotal()) {
                    m.put("totalStart", window.getTotalStart());
                    m.put("totalEnd", window.getTotalEnd());
                }
                if (observer != null) {
                    m.put("visibilityLevel", eclipseCalculator.visibilityLevel(record, observer));
                }
                list.add(m);
            }
            Map<String, Object> map = new HashMap<>();
            map.put("eclipses", list);
            return map;
        } catch (Exception e) {
            return errorMap(e);
        }
    }

    /**
     * 各天体某日的升、中天、落（当地时，小时）
     *
     * @return 结果Map：bodies
     */
    public static Map<String, Object> computeRiseSet(BodyStateProvider provider, List<String> bodies,
                                                     int year, int month, int day, Observer observer,
                                                     EventSearchConfig config) {
        try {
            RiseSetCalculator calculator = new RiseSetCalculator(provider, config.getDeltaTSeconds());
            List<Map<String, Object>> list = new ArrayList<>();
            for (String body : bodies) {
                PlanetEvents events = calculator.compute(body, year, month, day, observer);
                Map<String, Object> m = new HashMap<>();
                m.put("body", body);
                m.put("rise", events.getRise());
                m.put("transit", events.getTransit());
                m.put("set", events.getSet());
                m.put("status", events.getStatus().name());
                list.add(m);
            }
            Map<String, Object> map = new HashMap<>();
            map.put("bodies", list);
            return map;
        } catch (Exception e) {
            return errorMap(e);
        }
    }

    /**
     * 事件转换为 {timestamp, text, category, visibility}
     */
    static List<Map<String, Object>> convertEvents(List<JovianEvent> events) {
        List<Map<String, Object>> list = new ArrayList<>();
        for (JovianEvent event : events) {
            Map<String, Object> m = new HashMap<>();
            m.put("julianDate", event.getJulianDate());
            m.put("timestamp", timestamp(event.getJulianDate()));
            m.put("text", event.getText());
            m.put("category", event.isSimultaneousAlert() ? "ALERT" : event.getKind().name());
            m.put("visibility", event.getVisibility().name());
            if (event.getMoon() != null) {
                m.put("moon", event.getMoon().getDisplayName());
            }
            list.add(m);
        }
        return list;
    }

    static List<Map<String, Object>> convertWindows(List<EventWindow> windows) {
        List<Map<String, Object>> list = new ArrayList<>();
        for (EventWindow w : windows) {
            Map<String, Object> m = new HashMap<>();
            m.put("subject", w.getSubject());
            m.put("kind", w.getKind());
            m.put("startJulianDate", w.getStartJulianDate());
            m.put("endJulianDate", w.getEndJulianDate());
            m.put("durationMinutes", w.getDurationMinutes());
            list.add(m);
        }
        return list;
    }

    static Map<String, Object> convertPhenomena(PhenomenaBatchResult result) {
        List<Map<String, Object>> planets = new ArrayList<>();
        for (PlanetPhenomena p : result.getPlanets()) {
            List<Map<String, Object>> rows = new ArrayList<>();
            for (PhenomenaRow row : p.getRows()) {
                Map<String, Object> r = new HashMap<>();
                r.put("label", row.getLabel());
                r.put("category", row.getType().name());
                row.getLast().ifPresent(ph -> r.put("last", convertPhenomenon(ph)));
                row.getNext().ifPresent(ph -> r.put("next", convertPhenomenon(ph)));
                rows.add(r);
            }
            Map<String, Object> pm = new HashMap<>();
            pm.put("planet", p.getPlanet());
            pm.put("rows", rows);
            planets.add(pm);
        }

        Map<String, Object> errors = new HashMap<>();
        for (Map.Entry<String, PhenomenaBatchResult.PlanetError> entry : result.getErrors().entrySet()) {
            errors.put(entry.getKey(), entry.getValue().toString());
        }

        // 统计信息
        ComputationStats stats = result.getStats();
        Map<String, Object> statsMap = new HashMap<>();
        statsMap.put("computationTimeMs", stats.getComputationTimeMs());
        statsMap.put("nPhenomena", stats.getNPhenomenaFound());
        statsMap.put("nFailures", stats.getNFailures());
        statsMap.put("memoryUsageMb", stats.getMemoryUsageMb());

        Map<String, Object> map = new HashMap<>();
        map.put("planets", planets);
        map.put("errors", errors);
        map.put("stats", statsMap);
        return map;
    }

    private static Map<String, Object> convertPhenomenon(Phenomenon phenomenon) {
        Map<String, Object> m = new HashMap<>();
        m.put("julianDate", phenomenon.getJulianDate());
        m.put("timestamp", timestamp(phenomenon.getJulianDate()));
        if (phenomenon.hasValue()) {
            m.put("angle", phenomenon.getValue());
        }
        return m;
    }

    private static String timestamp(double julianDate) {
        return JulianDates.toCalendar(julianDate).toString();
    }

    /**
     * 错误信息
     */
    static Map<String, Object> errorMap(Exception e) {
        Map<String, Object> errorResult = new HashMap<>();
        errorResult.put("error", true);
        errorResult.put("errorMessage", e.getMessage());
        errorResult.put("errorType", e.getClass().getName());
        return errorResult;
    }
}
