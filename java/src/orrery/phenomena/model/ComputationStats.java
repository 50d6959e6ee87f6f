package orrery.phenomena.model;

import java.io.Serializable;

/**
 * 计算统计信息
 *
 * 记录批量计算的性能指标
 */
public class ComputationStats implements Serializable {

    private static final long serialVersionUID = 1L;

    private final long computationTimeMs;
    private final int nPlanets;
    private final int nPhenomenaFound;
    private final int nFailures;
    private final long memoryUsageMb;

    public ComputationStats(long computationTimeMs, int nPlanets,
                            int nPhenomenaFound, int nFailures, long memoryUsageMb) {
        this.computationTimeMs = computationTimeMs;
        this.nPlanets = nPlanets;
        this.nPhenomenaFound = nPhenomenaFound;
        this.nFailures = nFailures;
        this.memoryUsageMb = memoryUsageMb;
    }

    // Getters
    public long getComputationTimeMs() {
        return computationTimeMs;
    }

    public int getNPlanets() {
        return nPlanets;
    }

    public int getNPhenomenaFound() {
        return nPhenomenaFound;
    }

    public int getNFailures() {
        return nFailures;
    }

    public long getMemoryUsageMb() {
        return memoryUsageMb;
    }

    @Override
    public String toString() {
        return String.format(
            "ComputationStats{time=%dms, planets=%d, phenomena=%d, failures=%d, mem=%dMB}",
            computationTimeMs, nPlanets, nPhenomenaFound, nFailures, memoryUsageMb
        );
    }
}
