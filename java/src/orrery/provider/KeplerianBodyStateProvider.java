package orrery.provider;

import orrery.eclipse.ApparentPosition;
import orrery.eclipse.LunarPositionSeries;
import orrery.eclipse.SolarPositionSeries;
import orrery.ephemeris.OutOfRangeException;
import orrery.geometry.Angles;
import orrery.geometry.CoordinateTransforms;
import orrery.geometry.EclipticCoordinates;
import orrery.geometry.JulianDates;

import org.hipparchus.geometry.euclidean.threed.Vector3D;
import org.hipparchus.util.FastMath;
import org.hipparchus.util.SinCos;

import java.util.*;

/**
 * 开普勒近似的天体状态提供者
 *
 * 不依赖星历文件，精度约为角分量级。太阳用低精度解析式，月球用截断 ELP 级数，
 * 其余天体由平均轨道根数解开普勒方程。
 */
public class KeplerianBodyStateProvider extends AbstractBodyStateProvider {

    /** 牛顿迭代次数 */
    private static final int KEPLER_ITERATIONS = 6;

    private final Map<String, BodyElements> elements = new LinkedHashMap<>();

    public KeplerianBodyStateProvider() {
        this(BodyElements.planets());
        register(BodyElements.halley());
    }

    public KeplerianBodyStateProvider(Collection<BodyElements> bodies) {
        for (BodyElements body : bodies) {
            register(body);
        }
    }

    /**
     * 注册或替换一个天体的根数
     */
    public void register(BodyElements body) {
        elements.put(body.getName(), body);
    }

    public Set<String> getBodyNames() {
        Set<String> names = new LinkedHashSet<>();
        names.add(SUN);
        names.add(MOON);
        names.addAll(elements.keySet());
        return names;
    }

    /**
     * @throws OutOfRangeException 未注册的天体
     */
    @Override
    protected BodyState computeState(String name, double julianDate) {
        if (SUN.equals(name)) {
            return sunState(julianDate);
        }
        if (MOON.equals(name)) {
            return moonState(julianDate);
        }
        BodyElements body = elements.get(name);
        if (body == null || Double.isNaN(julianDate)) {
            throw new OutOfRangeException(name, julianDate);
        }
        return planetState(body, julianDate);
    }

    /**
     * 解开普勒方程 E - e sin E = M（弧度）
     */
    public static double solveKepler(double meanAnomaly, double eccentricity) {
        double e = meanAnomaly + eccentricity * FastMath.sin(meanAnomaly);
        for (int k = 0; k < KEPLER_ITERATIONS; k++) {
            double delta = (meanAnomaly - (e - eccentricity * FastMath.sin(e)))
                           / (1.0 - eccentricity * FastMath.cos(e));
            e += delta;
        }
        return e;
    }

    private BodyState sunState(double julianDate) {
        double n = julianDate - JulianDates.J2000;
        double l = Angles.normalizeDegrees(280.460 + 0.9856474 * n);
        double g = FastMath.toRadians(Angles.normalizeDegrees(357.528 + 0.9856003 * n));
        double lambda = Angles.normalizeDegrees(l + 1.915 * FastMath.sin(g) + 0.020 * FastMath.sin(2.0 * g));
        double epsilon = FastMath.toRadians(obliquity(n));
        double r = 1.00014 - 0.01671 * FastMath.cos(g) - 0.00014 * FastMath.cos(2.0 * g);

        double lambdaRad = FastMath.toRadians(lambda);
        double ra = Angles.normalizeDegrees(FastMath.toDegrees(
                FastMath.atan2(FastMath.cos(epsilon) * FastMath.sin(lambdaRad), FastMath.cos(lambdaRad))));
        double dec = FastMath.toDegrees(FastMath.asin(FastMath.sin(epsilon) * FastMath.sin(lambdaRad)));

        return BodyState.builder(SUN, julianDate)
                .equatorial(ra, dec)
                .ecliptic(lambda, 0.0)
                .distances(r, 0.0)
                .helioPosition(Vector3D.ZERO)
                .geoPosition(CoordinateTransforms.sphericalToCartesian(r, ra, dec))
                .build();
    }

    private BodyState moonState(double julianDate) {
        if (Double.isNaN(julianDate)) {
            throw new OutOfRangeException(MOON, julianDate);
        }
        ApparentPosition moon = LunarPositionSeries.compute(julianDate);
        double distAu = moon.getDistanceKm() / SolarPositionSeries.AU_KM;
        Vector3D geoEcliptic = CoordinateTransforms.sphericalToCartesian(
                distAu, moon.getEclipticLongitude(), moon.getEclipticLatitude());
        Vector3D helio = earthHelioPosition(julianDate - JulianDates.J2000).add(geoEcliptic);

        return BodyState.builder(MOON, julianDate)
                .equatorial(moon.getRightAscension(), moon.getDeclination())
                .ecliptic(moon.getEclipticLongitude(), moon.getEclipticLatitude())
                .distances(distAu, helio.getNorm())
                .heliocentric(Angles.normalizeDegrees(FastMath.toDegrees(helio.getAlpha())),
                              FastMath.toDegrees(helio.getDelta()))
                .helioPosition(helio)
                .geoPosition(CoordinateTransforms.sphericalToCartesian(
                        distAu, moon.getRightAscension(), moon.getDeclination()))
                .build();
    }

    private BodyState planetState(BodyElements p, double julianDate) {
        double d = julianDate - JulianDates.J2000;

        double lp = FastMath.toRadians((p.getMeanLongitude() + p.getMeanLongitudeRate() * d) % 360.0);
        double node = FastMath.toRadians(p.getAscendingNode());
        double incl = FastMath.toRadians(p.getInclination());
        double perihelion = FastMath.toRadians(p.getLongitudeOfPerihelion());
        double e = p.getEccentricity();
        double a = p.getSemiMajorAxis();

        double ea = solveKepler(lp - perihelion, e);
        double xv = a * (FastMath.cos(ea) - e);
        double yv = a * FastMath.sqrt(1.0 - e * e) * FastMath.sin(ea);
        double u = FastMath.atan2(yv, xv) + perihelion - node;
        double rp = FastMath.sqrt(xv * xv + yv * yv);

        SinCos scU = FastMath.sinCos(u);
        SinCos scN = FastMath.sinCos(node);
        SinCos scI = FastMath.sinCos(incl);
        Vector3D helio = new Vector3D(
                rp * (scU.cos() * scN.cos() - scU.sin() * scN.sin() * scI.cos()),
                rp * (scU.cos() * scN.sin() + scU.sin() * scN.cos() * scI.cos()),
                rp * scU.sin() * scI.sin());
        Vector3D geo = helio.subtract(earthHelioPosition(d));

        // 黄道 -> 赤道
        SinCos scE = FastMath.sinCos(FastMath.toRadians(obliquity(d)));
        double xeq = geo.getX();
        double yeq = geo.getY() * scE.cos() - geo.getZ() * scE.sin();
        double zeq = geo.getY() * scE.sin() + geo.getZ() * scE.cos();
        double ra = Angles.normalizeDegrees(FastMath.toDegrees(FastMath.atan2(yeq, xeq)));
        double dec = FastMath.toDegrees(FastMath.atan2(zeq, FastMath.sqrt(xeq * xeq + yeq * yeq)));
        EclipticCoordinates ecl = CoordinateTransforms.equatorialToEcliptic(ra, dec, julianDate);

        return BodyState.builder(p.getName(), julianDate)
                .equatorial(ra, dec)
                .ecliptic(ecl.getLongitude(), ecl.getLatitude())
                .distances(geo.getNorm(), rp)
                .heliocentric(Angles.normalizeDegrees(FastMath.toDegrees(helio.getAlpha())),
                              FastMath.toDegrees(helio.getDelta()))
                .helioPosition(helio)
                .geoPosition(new Vector3D(xeq, yeq, zeq))
                .build();
    }

    /**
     * 地球日心黄道位置（AU），d 为 J2000 起算日数
     */
    private static Vector3D earthHelioPosition(double d) {
        double me = FastMath.toRadians((357.529 + 0.98560028 * d) % 360.0);
        double le = FastMath.toRadians((280.466 + 0.98564736 * d) % 360.0)
                    + FastMath.toRadians(1.915 * FastMath.sin(me) + 0.020 * FastMath.sin(2.0 * me))
                    + FastMath.PI;
        double re = 1.00014 - 0.01671 * FastMath.cos(me);
        return new Vector3D(re * FastMath.cos(le), re * FastMath.sin(le), 0.0);
    }

    private static double obliquity(double daysSinceJ2000) {
        return 23.439 - 0.0000004 * daysSinceJ2000;
    }
}
