package orrery.phenomena.model;

import java.io.Serializable;
import java.util.*;

/**
 * 一颗行星的天象表
 */
public class PlanetPhenomena implements Serializable {

    private static final long serialVersionUID = 1L;

    private final String planet;
    private final List<PhenomenaRow> rows;

    public PlanetPhenomena(String planet, List<PhenomenaRow> rows) {
        this.planet = planet;
        this.rows = Collections.unmodifiableList(new ArrayList<>(rows));
    }

    public String getPlanet() {
        return planet;
    }

    public List<PhenomenaRow> getRows() {
        return rows;
    }

    @Override
    public String toString() {
        return "PlanetPhenomena{" +
                "planet='" + planet + '\'' +
                ", rows=" + rows +
                '}';
    }
}
