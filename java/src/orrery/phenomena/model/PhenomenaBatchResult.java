package orrery.phenomena.model;

import java.io.Serializable;
import java.util.*;

/**
 * 批量计算结果
 *
 * 包含每颗行星的天象表，以及计算失败的行星和失败原因
 */
public class PhenomenaBatchResult implements Serializable {

    private static final long serialVersionUID = 1L;

    private final double centerDate;
    private final List<PlanetPhenomena> planets;
    private final Map<String, PlanetError> errors;
    private final ComputationStats stats;

    public PhenomenaBatchResult(double centerDate, List<PlanetPhenomena> planets,
                                Map<String, PlanetError> errors, ComputationStats stats) {
        this.centerDate = centerDate;
        this.planets = planets;
        this.errors = errors;
        this.stats = stats;
    }

    // Getters
    public double getCenterDate() {
        return centerDate;
    }

    public List<PlanetPhenomena> getPlanets() {
        return planets;
    }

    public Map<String, PlanetError> getErrors() {
        return errors;
    }

    public ComputationStats getStats() {
        return stats;
    }

    public boolean hasErrors() {
        return !errors.isEmpty();
    }

    /**
     * 获取找到的天象总数（前后各算一次）
     */
    public int getTotalPhenomenaCount() {
        return countPhenomena(planets);
    }

    public static int countPhenomena(List<PlanetPhenomena> planets) {
        int count = 0;
        for (PlanetPhenomena p : planets) {
            for (PhenomenaRow row : p.getRows()) {
                count += row.getLast().isPresent() ? 1 : 0;
                count += row.getNext().isPresent() ? 1 : 0;
            }
        }
        return count;
    }

    /**
     * 单颗行星的失败信息
     */
    public static class PlanetError implements Serializable {

        private static final long serialVersionUID = 1L;

        private final String errorType;
        private final String errorMessage;

        public PlanetError(String errorType, String errorMessage) {
            this.errorType = errorType;
            this.errorMessage = errorMessage;
        }

        public static PlanetError of(Throwable t) {
            return new PlanetError(t.getClass().getName(), t.getMessage());
        }

        public String getErrorType() {
            return errorType;
        }

        public String getErrorMessage() {
            return errorMessage;
        }

        @Override
        public String toString() {
            return errorType + ": " + errorMessage;
        }
    }
}
