package orrery.phenomena;

import orrery.events.EventSearchConfig;
import orrery.phenomena.model.ComputationStats;
import orrery.phenomena.model.PhenomenaBatchResult;
import orrery.phenomena.model.PhenomenaBatchResult.PlanetError;
import orrery.phenomena.model.PlanetPhenomena;
import orrery.provider.BodyStateProvider;

import java.util.*;
import java.util.concurrent.*;
import java.util.logging.Logger;

/**
 * 批量天象计算器
 *
 * 一次算出所有行星在中心日期前后的天象表；各行星相互独立，可并行计算。
 * 单颗行星失败（如超出星历范围）只记入结果，不影响其他行星。
 */
public class BatchPhenomenaCalculator {

    private static final Logger logger = Logger.getLogger(BatchPhenomenaCalculator.class.getName());

    private final PlanetPhenomenaFinder finder;
    private final EventSearchConfig config;

    public BatchPhenomenaCalculator(BodyStateProvider provider, EventSearchConfig config) {
        this.finder = new PlanetPhenomenaFinder(provider, config);
        this.config = config;
    }

    /**
     * 计算全部行星（主入口）
     *
     * @param centerDate 中心儒略日
     */
    public PhenomenaBatchResult computeAll(double centerDate) {
        return compute(PlanetPhenomenaFinder.allPlanets(), centerDate);
    }

    /**
     * 计算指定行星
     *
     * @param planets 行星名列表
     * @param centerDate 中心儒略日
     */
    public PhenomenaBatchResult compute(List<String> planets, double centerDate) {
        long startNs = System.nanoTime();

        Map<String, PlanetPhenomena> results = new ConcurrentHashMap<>();
        Map<String, PlanetError> errors = new ConcurrentHashMap<>();

        if (config.isUseParallel() && planets.size() > 1) {
            computeParallel(planets, centerDate, results, errors);
        } else {
            computeSequential(planets, centerDate, results, errors);
        }

        // 按输入顺序输出
        List<PlanetPhenomena> ordered = new ArrayList<>();
        for (String planet : planets) {
            PlanetPhenomena p = results.get(planet);
            if (p != null) {
                ordered.add(p);
            }
        }

        long elapsedNs = System.nanoTime() - startNs;
        ComputationStats stats = new ComputationStats(
            TimeUnit.NANOSECONDS.toMillis(elapsedNs),
            planets.size(),
            PhenomenaBatchResult.countPhenomena(ordered),
            errors.size(),
            Runtime.getRuntime().totalMemory() / (1024 * 1024)
        );
        logger.info("Phenomena batch finished: " + stats);
        return new PhenomenaBatchResult(centerDate, ordered, new TreeMap<>(errors), stats);
    }

    private void computeOne(String planet, double centerDate,
                            Map<String, PlanetPhenomena> results, Map<String, PlanetError> errors) {
        try {
            results.put(planet, finder.compute(planet, centerDate));
        } catch (RuntimeException e) {
            logger.warning("Phenomena for " + planet + " failed: " + e.getMessage());
            errors.put(planet, PlanetError.of(e));
        }
    }

    /**
     * 串行计算
     */
    private void computeSequential(List<String> planets, double centerDate,
                                   Map<String, PlanetPhenomena> results, Map<String, PlanetError> errors) {
        for (String planet : planets) {
            computeOne(planet, centerDate, results, errors);
        }
    }

    /**
     * 并行计算（每颗行星一个任务）
     */
    private void computeParallel(List<String> planets, double centerDate,
                                 Map<String, PlanetPhenomena> results, Map<String, PlanetError> errors) {
        ExecutorService executor = Executors.newFixedThreadPool(
            Math.min(planets.size(), Runtime.getRuntime().availableProcessors())
        );

        try {
            List<Future<?>> futures = new ArrayList<>();
            for (String planet : planets) {
                futures.add(executor.submit(() -> computeOne(planet, centerDate, results, errors)));
            }

            // 等待所有任务完成
            for (Future<?> f : futures) {
                try {
                    f.get();
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    throw new IllegalStateException("Parallel phenomena search interrupted", e);
                } catch (ExecutionException e) {
                    throw new IllegalStateException("Parallel phenomena search failed", e.getCause());
                }
            }
        } finally {
            executor.shutdown();
        }
    }
}
