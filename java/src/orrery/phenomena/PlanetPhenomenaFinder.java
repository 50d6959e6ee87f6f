package orrery.phenomena;

import orrery.events.Crossing;
import orrery.events.EventDetector;
import orrery.events.EventSearchConfig;
import orrery.events.Extremum;
import orrery.events.ScanDirection;
import orrery.geometry.Angles;
import orrery.phenomena.model.PhenomenaRow;
import orrery.phenomena.model.Phenomenon;
import orrery.phenomena.model.PlanetPhenomena;
import orrery.provider.AbstractBodyStateProvider;
import orrery.provider.BodyStateProvider;

import org.hipparchus.analysis.UnivariateFunction;
import org.hipparchus.util.FastMath;

import java.util.*;
import java.util.function.DoublePredicate;
import java.util.function.Predicate;

/**
 * 行星天象搜索
 *
 * 合、冲：对黄经差信号 wrap(wrap(λp - λ☉) - 目标) 做日步长扫描和 20 次二分；
 * 大距：对带符号的黄经差找局部极值，再用黄金分割细化。
 * 时间使用提供者的时间尺度（儒略日）。
 */
public class PlanetPhenomenaFinder {

    /** 内行星 */
    public static final List<String> INFERIOR_PLANETS = Collections.unmodifiableList(Arrays.asList(
            "Mercury", "Venus"));

    /** 外行星 */
    public static final List<String> SUPERIOR_PLANETS = Collections.unmodifiableList(Arrays.asList(
            "Mars", "Jupiter", "Saturn", "Uranus", "Neptune"));

    /** 过零括区两端差值超过此值视为 ±180° 回绕 */
    private static final double MAX_JUMP = 180.0;

    private final BodyStateProvider provider;
    private final EventSearchConfig config;

    public PlanetPhenomenaFinder(BodyStateProvider provider, EventSearchConfig config) {
        this.provider = provider;
        this.config = config;
    }

    public PlanetPhenomenaFinder(BodyStateProvider provider) {
        this(provider, new EventSearchConfig());
    }

    /**
     * 全部行星，内行星在前
     */
    public static List<String> allPlanets() {
        List<String> planets = new ArrayList<>(INFERIOR_PLANETS);
        planets.addAll(SUPERIOR_PLANETS);
        return planets;
    }

    public static boolean isInferior(String planet) {
        return INFERIOR_PLANETS.contains(planet);
    }

    /**
     * 行星适用的天象类型（按表格顺序）
     *
     * @throws IllegalArgumentException 不是行星
     */
    public static List<PhenomenonType> typesFor(String planet) {
        if (isInferior(planet)) {
            return Arrays.asList(PhenomenonType.INFERIOR_CONJUNCTION, PhenomenonType.GREATEST_ELONGATION_WEST,
                                 PhenomenonType.SUPERIOR_CONJUNCTION, PhenomenonType.GREATEST_ELONGATION_EAST);
        }
        if (SUPERIOR_PLANETS.contains(planet)) {
            return Arrays.asList(PhenomenonType.CONJUNCTION, PhenomenonType.OPPOSITION);
        }
        throw new IllegalArgumentException("Not a planet: " + planet);
    }

    /**
     * 带符号的黄经差 λp - λ☉（度，(-180, 180]），正值为东大距一侧
     */
    public double elongation(String planet, double julianDate) {
        double planetLon = provider.getBodyState(planet, julianDate).getEclipticLon();
        double sunLon = provider.getBodyState(AbstractBodyStateProvider.SUN, julianDate).getEclipticLon();
        return Angles.wrapDegrees(planetLon - sunLon);
    }

    /**
     * 某类天象对应的标量信号
     */
    public UnivariateFunction signal(String planet, PhenomenonType type) {
        if (type.isElongation()) {
            return t -> elongation(planet, t);
        }
        double target = type.getTargetAngle();
        return t -> Angles.wrapDegrees(elongation(planet, t) - target);
    }

    /**
     * 下合时行星比太阳近，上合时行星比太阳远
     */
    private Predicate<Crossing> conjunctionFilter(String planet, PhenomenonType type) {
        if (type != PhenomenonType.INFERIOR_CONJUNCTION && type != PhenomenonType.SUPERIOR_CONJUNCTION) {
            return null;
        }
        boolean wantInferior = type == PhenomenonType.INFERIOR_CONJUNCTION;
        return crossing -> {
            double jd = crossing.getJulianDate();
            boolean inferior = provider.getBodyState(planet, jd).getDistGeo()
                               < provider.getBodyState(AbstractBodyStateProvider.SUN, jd).getDistGeo();
            return inferior == wantInferior;
        };
    }

    /**
     * 从 start 沿 direction 找最近一次天象
     *
     * @return 天象，扫描范围内没有时为空
     */
    public Optional<Phenomenon> find(String planet, PhenomenonType type, double start, ScanDirection direction) {
        int range = config.phenomenaRangeFor(planet);
        double step = config.getDayStep();
        int maxSteps = (int) FastMath.ceil(range / step);
        UnivariateFunction f = signal(planet, type);

        if (type.isElongation()) {
            boolean east = type == PhenomenonType.GREATEST_ELONGATION_EAST;
            DoublePredicate gate = east ? v -> v > 0.0 : v -> v < 0.0;
            Optional<Extremum> extremum = EventDetector.findExtremum(
                    f, start, direction, step, maxSteps, east, gate,
                    config.getGoldenSectionEpsilon(), config.getGoldenSectionMaxIterations());
            return extremum.map(e -> new Phenomenon(planet, type, e.getJulianDate(), FastMath.abs(e.getValue())));
        }

        Optional<Crossing> crossing = EventDetector.findCrossing(
                f, start, direction, step, maxSteps, config.getDayIterations(),
                MAX_JUMP, conjunctionFilter(planet, type));
        return crossing.map(c -> new Phenomenon(planet, type, c.getJulianDate(), Double.NaN));
    }

    /**
     * 中心日期前后最近的两次
     */
    public PhenomenaRow findRow(String planet, PhenomenonType type, double centerDate) {
        Phenomenon last = find(planet, type, centerDate, ScanDirection.BACKWARD).orElse(null);
        Phenomenon next = find(planet, type, centerDate, ScanDirection.FORWARD).orElse(null);
        return new PhenomenaRow(type, last, next);
    }

    /**
     * 一颗行星的完整天象表
     */
    public PlanetPhenomena compute(String planet, double centerDate) {
        List<PhenomenaRow> rows = new ArrayList<>();
        for (PhenomenonType type : typesFor(planet)) {
            rows.add(findRow(planet, type, centerDate));
        }
        return new PlanetPhenomena(planet, rows);
    }
}
