package orrery.jovian;

import orrery.ephemeris.OutOfRangeException;
import orrery.geometry.JulianDates;
import orrery.jovian.model.MoonGeometryState;
import orrery.provider.AbstractBodyStateProvider;
import orrery.provider.BodyState;
import orrery.provider.BodyStateProvider;

import org.hipparchus.geometry.euclidean.threed.Vector3D;

import java.util.*;
import java.util.logging.Logger;

/**
 * 木星系统状态
 *
 * 由天体状态提供者取木星和太阳位置，交给卫星理论得到各卫星坐标，再做阴影几何判定
 */
public class JovianSystem implements JovianStateSource {

    private static final Logger logger = Logger.getLogger(JovianSystem.class.getName());

    public static final String JUPITER = "Jupiter";

    private final BodyStateProvider provider;
    private final JovianSatelliteProvider satellites;
    private final double deltaTSeconds;

    public JovianSystem(BodyStateProvider provider, JovianSatelliteProvider satellites, double deltaTSeconds) {
        this.provider = provider;
        this.satellites = satellites;
        this.deltaTSeconds = deltaTSeconds;
    }

    public JovianSystem(BodyStateProvider provider) {
        this(provider, new GalileanSatelliteTheory(), JulianDates.DEFAULT_DELTA_T);
    }

    /**
     * @throws OutOfRangeException 木星或太阳无该时刻数据
     */
    @Override
    public Map<GalileanMoon, MoonGeometryState> stateAt(double julianDate) {
        double jdTT = JulianDates.utToTt(julianDate, deltaTSeconds);
        BodyState jupiter = provider.getBodyState(JUPITER, jdTT);

        double t = JulianDates.centuriesSinceJ2000(jdTT);
        double precession = 1.396971 * t + 0.0003086 * t * t;
        Map<GalileanMoon, Vector3D> positions = satellites.positions(
                jdTT, jupiter.getDistGeo(), jupiter.getEclipticLon() + precession, jupiter.getEclipticLat());
        if (positions.isEmpty()) {
            logger.fine("No satellite geometry at " + julianDate);
            return Collections.emptyMap();
        }

        BodyState sun = provider.getBodyState(AbstractBodyStateProvider.SUN, jdTT);
        BodyState earth = provider.getBodyState(AbstractBodyStateProvider.EARTH, jdTT);
        ShadowParameters shadow = ShadowParameters.fromGeometry(
                sun.getRa(), jupiter.getRa(), jupiter.getDistSun(), jupiter.getDistGeo(), earth.getDistSun());
        return JovianShadowGeometry.evaluateAll(positions, shadow);
    }

    public double getDeltaTSeconds() {
        return deltaTSeconds;
    }
}
