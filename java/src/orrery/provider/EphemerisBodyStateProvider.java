package orrery.provider;

import orrery.ephemeris.EphemerisStore;
import orrery.ephemeris.InterpolatedState;
import orrery.ephemeris.OutOfRangeException;
import orrery.geometry.CoordinateTransforms;
import orrery.geometry.EclipticCoordinates;

/**
 * 基于星历存储的天体状态提供者
 *
 * 地心黄道坐标由插值得到的赤经赤纬换算；日心黄道坐标直接取采样通道。
 */
public class EphemerisBodyStateProvider extends AbstractBodyStateProvider {

    private final EphemerisStore store;

    public EphemerisBodyStateProvider(EphemerisStore store) {
        this.store = store;
    }

    /**
     * @throws OutOfRangeException 时刻超出星历范围或无该天体数据
     */
    @Override
    protected BodyState computeState(String name, double julianDate) {
        InterpolatedState s = store.interpolate(name, julianDate);
        EclipticCoordinates ecl = CoordinateTransforms.equatorialToEcliptic(s.getRa(), s.getDec(), julianDate);
        return BodyState.builder(name, julianDate)
                .equatorial(s.getRa(), s.getDec())
                .ecliptic(ecl.getLongitude(), ecl.getLatitude())
                .distances(s.getDistGeo(), s.getDistSun())
                .heliocentric(s.getEclipticLon(), s.getEclipticLat())
                .helioPosition(CoordinateTransforms.sphericalToCartesian(
                        s.getDistSun(), s.getEclipticLon(), s.getEclipticLat()))
                .geoPosition(CoordinateTransforms.sphericalToCartesian(s.getDistGeo(), s.getRa(), s.getDec()))
                .build();
    }

    public EphemerisStore getStore() {
        return store;
    }
}
