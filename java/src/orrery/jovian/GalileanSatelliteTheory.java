package orrery.jovian;

import orrery.geometry.JulianDates;

import org.hipparchus.geometry.euclidean.threed.Vector3D;
import org.hipparchus.util.FastMath;
import org.hipparchus.util.SinCos;
import org.orekit.utils.Constants;

import java.util.*;

/**
 * 伽利略卫星高精度位置（Meeus《天文算法》第二版第 44 章）
 *
 * 周期项 Σ1–Σ4、黄纬项和向径项，岁差改正到当天，依次旋转到木星赤道、黄道和地球视向，
 * 最后做光行时和透视改正。
 */
public class GalileanSatelliteTheory implements JovianSatelliteProvider {

    /** 理论历元 JD 2443000.5 */
    private static final double THEORY_EPOCH = 2443000.5;

    /** 光行时（日/AU） */
    private static final double LIGHT_TIME_PER_AU = 0.0057755183;

    /** 木星近日点经度 Π */
    private static final double JUPITER_PERIHELION = 13.469942;

    /** 透视改正中的地木距离比例常数 */
    private static final double PERSPECTIVE_SCALE = 2095.0;

    @Override
    public Map<GalileanMoon, Vector3D> positions(double julianDateTT, double deltaAu,
                                                 double lambdaDeg, double betaDeg) {
        if (Double.isNaN(julianDateTT) || Double.isNaN(deltaAu) || !(deltaAu > 0.0)) {
            return Collections.emptyMap();
        }

        double t = julianDateTT - THEORY_EPOCH - LIGHT_TIME_PER_AU * deltaAu;
        Arguments arg = new Arguments(t);

        double[] sigma = {sigma1(arg), sigma2(arg), sigma3(arg), sigma4(arg)};
        double[] meanLon = {arg.l1, arg.l2, arg.l3, arg.l4};
        double[] trueLon = new double[4];
        for (int i = 0; i < 4; i++) {
            trueLon[i] = meanLon[i] + sigma[i];
        }
        double[] latitude = {
            atanD(tanB1(arg, trueLon[0], sigma[0])),
            atanD(tanB2(arg, trueLon[1], sigma[1])),
            atanD(tanB3(arg, trueLon[2], sigma[2])),
            atanD(tanB4(arg, trueLon[3]))
        };
        double[] radiusCorrection = {rho1(arg), rho2(arg), rho3(arg), rho4(arg)};

        // 岁差：1950.0 分点到当天
        double t0 = (julianDateTT - 2433282.423) / Constants.JULIAN_CENTURY;
        double precession = 1.3966626 * t0 + 0.0003088 * t0 * t0;
        double psi = arg.psi + precession;

        // 木星赤道对轨道面倾角，按 1900 历元
        double t1900 = (julianDateTT - 2415020.5) / Constants.JULIAN_CENTURY;
        double inclination = 3.120262 + 0.0006 * t1900;

        double te = JulianDates.centuriesSinceJ2000(julianDateTT);
        double ascendingNode = 100.464407 + 1.0209774 * te + 0.00040315 * te * te + 0.000000404 * te * te * te;
        double orbitInclination = 1.303267 - 0.0054965 * te + 0.00000466 * te * te - 0.000000002 * te * te * te;

        GalileanMoon[] moons = GalileanMoon.values();
        Vector3D[] frame = new Vector3D[moons.length + 1];
        for (int i = 0; i < moons.length; i++) {
            double r = moons[i].getMeanDistance() * (1.0 + radiusCorrection[i]);
            double lon = trueLon[i] + precession - psi;
            frame[i] = new Vector3D(r * cosD(lon) * cosD(latitude[i]),
                                    r * sinD(lon) * cosD(latitude[i]),
                                    r * sinD(latitude[i]));
        }
        // 虚拟第五颗卫星：木星北极方向，用于求视向转角 D
        frame[moons.length] = Vector3D.PLUS_K;

        for (int i = 0; i < frame.length; i++) {
            Vector3D v = rotateX(frame[i], inclination);
            v = rotateZ(v, psi - ascendingNode);
            v = rotateX(v, orbitInclination);
            v = rotateZ(v, ascendingNode);
            v = rotateZ(v, 90.0 - lambdaDeg);
            frame[i] = rotateX(v, -betaDeg);
        }

        Vector3D pole = frame[moons.length];
        SinCos scD = FastMath.sinCos(FastMath.atan2(pole.getX(), pole.getZ()));

        Map<GalileanMoon, Vector3D> result = new EnumMap<>(GalileanMoon.class);
        for (int i = 0; i < moons.length; i++) {
            Vector3D v = frame[i];
            double x = v.getX() * scD.cos() - v.getZ() * scD.sin();
            double y = v.getX() * scD.sin() + v.getZ() * scD.cos();
            double z = v.getY();

            // 卫星自身到地球的光行差
            double sq = x * x + y * y + z * z;
            double term = FastMath.max(0.0, 1.0 - x * x / sq);
            x += FastMath.abs(z) * FastMath.sqrt(term) / moons[i].getPerspectiveConstant();

            // 透视
            double w = deltaAu / (deltaAu + z / PERSPECTIVE_SCALE);
            result.put(moons[i], new Vector3D(x * w, y * w, z));
        }
        return result;
    }

    /** 绕 X 轴旋转（度） */
    private static Vector3D rotateX(Vector3D v, double angleDeg) {
        SinCos sc = FastMath.sinCos(FastMath.toRadians(angleDeg));
        return new Vector3D(v.getX(),
                            v.getY() * sc.cos() - v.getZ() * sc.sin(),
                            v.getY() * sc.sin() + v.getZ() * sc.cos());
    }

    /** 绕 Z 轴旋转（度） */
    private static Vector3D rotateZ(Vector3D v, double angleDeg) {
        SinCos sc = FastMath.sinCos(FastMath.toRadians(angleDeg));
        return new Vector3D(v.getX() * sc.cos() - v.getY() * sc.sin(),
                            v.getX() * sc.sin() + v.getY() * sc.cos(),
                            v.getZ());
    }

    private static double sinD(double deg) {
        return FastMath.sin(FastMath.toRadians(deg));
    }

    private static double cosD(double deg) {
        return FastMath.cos(FastMath.toRadians(deg));
    }

    private static double atanD(double v) {
        return FastMath.toDegrees(FastMath.atan(v));
    }

    private static double sigma1(Arguments a) {
        double pi = JUPITER_PERIHELION;
        return 0.47259 * sinD(2.0 * (a.l1 - a.l2)) - 0.00186 * sinD(a.g)
               - 0.03478 * sinD(a.pi3 - a.pi4) + 0.00162 * sinD(a.pi2 - a.pi3)
               + 0.01081 * sinD(a.l2 - 2.0 * a.l3 + a.pi3) + 0.00158 * sinD(4.0 * (a.l1 - a.l2))
               + 0.00738 * sinD(a.phiLambda) - 0.00155 * sinD(a.l1 - a.l3)
               + 0.00713 * sinD(a.l2 - 2.0 * a.l3 + a.pi2) - 0.00138 * sinD(a.psi + a.om3 - 2.0 * pi - 2.0 * a.g)
               - 0.00674 * sinD(a.pi1 + a.pi3 - 2.0 * pi - 2.0 * a.g)
               - 0.00115 * sinD(2.0 * (a.l1 - 2.0 * a.l2 + a.om2))
               + 0.00666 * sinD(a.l2 - 2.0 * a.l3 + a.pi4) + 0.00089 * sinD(a.pi2 - a.pi4)
               + 0.00445 * sinD(a.l1 - a.pi3) + 0.00085 * sinD(a.l1 + a.pi3 - 2.0 * pi - 2.0 * a.g)
               - 0.00354 * sinD(a.l1 - a.l2) + 0.00083 * sinD(a.om2 - a.om3)
               - 0.00317 * sinD(2.0 * a.psi - 2.0 * pi) + 0.00053 * sinD(a.psi - a.om2)
               + 0.00265 * sinD(a.l1 - a.pi4);
    }

    private static double sigma2(Arguments a) {
        double pi = JUPITER_PERIHELION;
        return 1.06476 * sinD(2.0 * (a.l2 - a.l3)) - 0.00115 * sinD(a.l1 - 2.0 * a.l3 + a.pi3)
               + 0.04256 * sinD(a.l1 - 2.0 * a.l2 + a.pi3) - 0.00094 * sinD(2.0 * (a.l2 - a.om2))
               + 0.03581 * sinD(a.l2 - a.pi3) + 0.00086 * sinD(2.0 * (a.l1 - 2.0 * a.l2 + a.om2))
               + 0.02395 * sinD(a.l1 - 2.0 * a.l2 + a.pi4) - 0.00086 * sinD(5.0 * a.gPrime - 2.0 * a.g + 52.225)
               + 0.01984 * sinD(a.l2 - a.pi4) - 0.00078 * sinD(a.l2 - a.l4)
               - 0.01778 * sinD(a.phiLambda) - 0.00064 * sinD(3.0 * a.l3 - 7.0 * a.l4 + 4.0 * a.pi4)
               + 0.01654 * sinD(a.l2 - a.pi2) + 0.00064 * sinD(a.pi1 - a.pi4)
               + 0.01334 * sinD(a.l2 - 2.0 * a.l3 + a.pi2) - 0.00063 * sinD(a.l1 - 2.0 * a.l3 + a.pi4)
               + 0.01294 * sinD(a.pi3 - a.pi4) + 0.00058 * sinD(a.om3 - a.om4)
               - 0.01142 * sinD(a.l2 - a.l3) + 0.00056 * sinD(2.0 * (a.psi - pi - a.g))
               - 0.01057 * sinD(a.g) + 0.00056 * sinD(2.0 * (a.l2 - a.l4))
               - 0.00775 * sinD(2.0 * (a.psi - pi)) + 0.00055 * sinD(2.0 * (a.l1 - a.l3))
               + 0.00524 * sinD(2.0 * (a.l1 - a.l2))
               + 0.00052 * sinD(3.0 * a.l3 - 7.0 * a.l4 + a.pi3 + 3.0 * a.pi4)
               - 0.00460 * sinD(a.l1 - a.l3) - 0.00043 * sinD(a.l1 - a.pi3)
               + 0.00316 * sinD(a.psi - 2.0 * a.g + a.om3 - 2.0 * pi) + 0.00041 * sinD(5.0 * (a.l2 - a.l3))
               - 0.00203 * sinD(a.pi1 + a.pi3 - 2.0 * pi - 2.0 * a.g) + 0.00041 * sinD(a.pi4 - pi)
               + 0.00146 * sinD(a.psi - a.om3) + 0.00032 * sinD(a.om2 - a.om3)
               - 0.00145 * sinD(2.0 * a.g) + 0.00032 * sinD(2.0 * (a.l3 - a.g - pi))
               + 0.00125 * sinD(a.psi - a.om4);
    }

    private static double sigma3(Arguments a) {
        double pi = JUPITER_PERIHELION;
        return 0.16490 * sinD(a.l3 - a.pi3) + 0.00091 * sinD(a.om3 - a.om4)
               + 0.09081 * sinD(a.l3 - a.pi4) + 0.00080 * sinD(3.0 * a.l3 - 7.0 * a.l4 + a.pi3 + 3.0 * a.pi4)
               - 0.06907 * sinD(a.l2 - a.l3) - 0.00075 * sinD(2.0 * a.l2 - 3.0 * a.l3 + a.pi3)
               + 0.03784 * sinD(a.pi3 - a.pi4) + 0.00072 * sinD(a.pi1 + a.pi3 - 2.0 * pi - 2.0 * a.g)
               + 0.01846 * sinD(2.0 * (a.l3 - a.l4)) + 0.00069 * sinD(a.pi4 - pi)
               - 0.01340 * sinD(a.g) - 0.00058 * sinD(2.0 * a.l3 - 3.0 * a.l4 + a.pi4)
               - 0.01014 * sinD(2.0 * (a.psi - pi)) - 0.00057 * sinD(a.l3 - 2.0 * a.l4 + a.pi4)
               + 0.00704 * sinD(a.l2 - 2.0 * a.l3 + a.pi3) + 0.00056 * sinD(a.l3 + a.pi3 - 2.0 * pi - 2.0 * a.g)
               - 0.00620 * sinD(a.l2 - 2.0 * a.l3 + a.pi2) - 0.00052 * sinD(a.l2 - 2.0 * a.l3 + a.pi1)
               - 0.00541 * sinD(a.l3 - a.l4) - 0.00050 * sinD(a.pi2 - a.pi3)
               + 0.00381 * sinD(a.l2 - 2.0 * a.l3 + a.pi4) + 0.00048 * sinD(a.l3 - 2.0 * a.l4 + a.pi3)
               + 0.00235 * sinD(a.psi - a.om3) - 0.00045 * sinD(2.0 * a.l2 - 3.0 * a.l3 + a.pi4)
               + 0.00198 * sinD(a.psi - a.om4) - 0.00041 * sinD(a.pi2 - a.pi4)
               + 0.00176 * sinD(a.phiLambda) - 0.00038 * sinD(2.0 * a.g)
               + 0.00130 * sinD(3.0 * (a.l3 - a.l4)) - 0.00037 * sinD(a.pi3 - a.pi4 + a.om3 - a.om4)
               + 0.00125 * sinD(a.l1 - a.l3)
               - 0.00032 * sinD(3.0 * a.l3 - 7.0 * a.l4 + 2.0 * a.pi3 + 2.0 * a.pi4)
               - 0.00119 * sinD(5.0 * a.gPrime - 2.0 * a.g + 52.225) + 0.00030 * sinD(4.0 * (a.l3 - a.l4))
               + 0.00109 * sinD(a.l1 - a.l2) + 0.00029 * sinD(a.l3 + a.pi4 - 2.0 * pi - 2.0 * a.g)
               - 0.00100 * sinD(3.0 * a.l3 - 7.0 * a.l4 + 4.0 * a.pi4)
               - 0.00028 * sinD(a.om3 + a.psi - 2.0 * pi - 2.0 * a.g)
               + 0.00026 * sinD(a.l3 - pi - a.g) - 0.00021 * sinD(a.l3 - a.pi2)
               + 0.00024 * sinD(a.l2 - 3.0 * a.l3 + 2.0 * a.l4) + 0.00017 * sinD(2.0 * (a.l3 - a.pi3))
               + 0.00021 * sinD(2.0 * (a.l3 - pi - a.g));
    }

    private static double sigma4(Arguments a) {
        double pi = JUPITER_PERIHELION;
        return 0.84287 * sinD(a.l4 - a.pi4) + 0.00061 * sinD(a.l1 - a.l4)
               + 0.03431 * sinD(a.pi4 - a.pi3) - 0.00056 * sinD(a.psi - a.om3)
               - 0.03305 * sinD(2.0 * (a.psi - pi)) - 0.00054 * sinD(a.l3 - 2.0 * a.l4 + a.pi3)
               - 0.03211 * sinD(a.g) + 0.00051 * sinD(a.l2 - a.l4)
               - 0.01862 * sinD(a.l4 - a.pi3) + 0.00042 * sinD(2.0 * (a.psi - a.g - pi))
               + 0.01186 * sinD(a.psi - a.om4) + 0.00039 * sinD(2.0 * (a.pi4 - a.om4))
               + 0.00623 * sinD(a.l4 + a.pi4 - 2.0 * a.g - 2.0 * pi) + 0.00036 * sinD(a.psi + pi - a.pi4 - a.om4)
               + 0.00387 * sinD(2.0 * (a.l4 - a.pi4)) + 0.00035 * sinD(2.0 * a.gPrime - a.g + 188.37)
               - 0.00284 * sinD(5.0 * a.gPrime - 2.0 * a.g + 52.225)
               - 0.00035 * sinD(a.l4 - a.pi4 + 2.0 * pi - 2.0 * a.psi)
               - 0.00234 * sinD(2.0 * (a.psi - a.pi4)) - 0.00032 * sinD(a.l4 + a.pi4 - 2.0 * pi - a.g)
               - 0.00223 * sinD(a.l3 - a.l4) + 0.00030 * sinD(2.0 * a.gPrime - 2.0 * a.g + 149.15)
               - 0.00208 * sinD(a.l4 - pi)
               + 0.00029 * sinD(3.0 * a.l3 - 7.0 * a.l4 + 2.0 * a.pi3 + 2.0 * a.pi4)
               + 0.00178 * sinD(a.psi + a.om4 - 2.0 * a.pi4) + 0.00028 * sinD(a.l4 - a.pi4 + 2.0 * a.psi - 2.0 * pi)
               + 0.00134 * sinD(a.pi4 - pi) - 0.00028 * sinD(2.0 * (a.l4 - a.om4))
               + 0.00125 * sinD(2.0 * (a.l4 - a.g - pi)) - 0.00027 * sinD(a.pi3 - a.pi4 + a.om3 - a.om4)
               - 0.00117 * sinD(2.0 * a.g) - 0.00026 * sinD(5.0 * a.gPrime - 3.0 * a.g + 188.37)
               - 0.00112 * sinD(2.0 * (a.l3 - a.l4)) + 0.00025 * sinD(a.om4 - a.om3)
               + 0.00107 * sinD(3.0 * a.l3 - 7.0 * a.l4 + 4.0 * a.pi4)
               - 0.00025 * sinD(a.l2 - 3.0 * a.l3 + 2.0 * a.l4)
               + 0.00102 * sinD(a.l4 - a.g - pi) - 0.00023 * sinD(3.0 * (a.l3 - a.l4))
               + 0.00096 * sinD(2.0 * a.l4 - a.psi - a.om4) + 0.00021 * sinD(2.0 * a.l4 - 2.0 * pi - 3.0 * a.g)
               + 0.00087 * sinD(2.0 * (a.psi - a.om4)) - 0.00021 * sinD(2.0 * a.l3 - 3.0 * a.l4 + a.pi4)
               - 0.00085 * sinD(3.0 * a.l3 - 7.0 * a.l4 + a.pi3 + 3.0 * a.pi4)
               + 0.00019 * sinD(a.l4 - a.pi4 - a.g)
               + 0.00085 * sinD(a.l3 - 2.0 * a.l4 + a.pi4) - 0.00019 * sinD(2.0 * a.l4 - a.pi3 - a.pi4)
               - 0.00081 * sinD(2.0 * (a.l4 - a.psi)) - 0.00018 * sinD(a.l4 - a.pi4 + a.g)
               + 0.00071 * sinD(a.l4 + a.pi4 - 2.0 * pi - 3.0 * a.g)
               - 0.00016 * sinD(a.l4 + a.pi3 - 2.0 * pi - 2.0 * a.g);
    }

    private static double tanB1(Arguments a, double lon, double sigma) {
        double pi = JUPITER_PERIHELION;
        return 0.0006393 * sinD(lon - a.om1)
               + 0.0001825 * sinD(lon - a.om2)
               + 0.0000329 * sinD(lon - a.om3)
               - 0.0000311 * sinD(lon - a.psi)
               + 0.0000093 * sinD(lon - a.om4)
               + 0.0000075 * sinD(3.0 * lon - 4.0 * a.l2 - 1.9927 * sigma + a.om2)
               + 0.0000046 * sinD(lon + a.psi - 2.0 * pi - 2.0 * a.g);
    }

    private static double tanB2(Arguments a, double lon, double sigma) {
        double pi = JUPITER_PERIHELION;
        return 0.0081004 * sinD(lon - a.om2)
               + 0.0004512 * sinD(lon - a.om3)
               - 0.0003284 * sinD(lon - a.psi)
               + 0.0001160 * sinD(lon - a.om4)
               + 0.0000272 * sinD(a.l1 - 2.0 * a.l3 + 1.0146 * sigma + a.om2)
               - 0.0000144 * sinD(lon - a.om1)
               + 0.0000143 * sinD(lon + a.psi - 2.0 * pi - 2.0 * a.g)
               + 0.0000035 * sinD(lon - a.psi + a.g)
               - 0.0000028 * sinD(a.l1 - 2.0 * a.l3 + 1.0146 * sigma + a.om3);
    }

    private static double tanB3(Arguments a, double lon, double sigma) {
        double pi = JUPITER_PERIHELION;
        return 0.0032402 * sinD(lon - a.om3)
               - 0.0016911 * sinD(lon - a.psi)
               + 0.0006847 * sinD(lon - a.om4)
               - 0.0002797 * sinD(lon - a.om2)
               + 0.0000321 * sinD(lon + a.psi - 2.0 * pi - 2.0 * a.g)
               + 0.0000051 * sinD(lon - a.psi + a.g)
               - 0.0000045 * sinD(lon - a.psi - a.g)
               - 0.0000045 * sinD(lon + a.psi - 2.0 * pi)
               + 0.0000037 * sinD(lon + a.psi - 2.0 * pi - 3.0 * a.g)
               + 0.0000030 * sinD(2.0 * a.l2 - 3.0 * lon + 4.03 * sigma + a.om2)
               - 0.0000021 * sinD(2.0 * a.l2 - 3.0 * lon + 4.03 * sigma + a.om3);
    }

    private static double tanB4(Arguments a, double lon) {
        double pi = JUPITER_PERIHELION;
        return -0.0076579 * sinD(lon - a.psi)
               + 0.0044134 * sinD(lon - a.om4)
               - 0.0005112 * sinD(lon - a.om3)
               + 0.0000773 * sinD(lon + a.psi - 2.0 * pi - 2.0 * a.g)
               + 0.0000104 * sinD(lon - a.psi + a.g)
               - 0.0000102 * sinD(lon - a.psi - a.g)
               + 0.0000088 * sinD(lon + a.psi - 2.0 * pi - 3.0 * a.g)
               - 0.0000038 * sinD(lon + a.psi - 2.0 * pi - a.g);
    }

    private static double rho1(Arguments a) {
        double pi = JUPITER_PERIHELION;
        return -0.0041339 * cosD(2.0 * (a.l1 - a.l2))
               - 0.0000387 * cosD(a.l1 - a.pi3)
               - 0.0000214 * cosD(a.l1 - a.pi4)
               + 0.0000170 * cosD(a.l1 - a.l2)
               - 0.0000131 * cosD(4.0 * (a.l1 - a.l2))
               + 0.0000106 * cosD(a.l1 - a.l3)
               - 0.0000066 * cosD(a.l1 + a.pi3 - 2.0 * pi - 2.0 * a.g);
    }

    private static double rho2(Arguments a) {
        return 0.0093848 * cosD(a.l1 - a.l2)
               - 0.0003116 * cosD(a.l2 - a.pi3)
               - 0.0001744 * cosD(a.l2 - a.pi4)
               - 0.0001442 * cosD(a.l2 - a.pi2)
               + 0.0000553 * cosD(a.l2 - a.l3)
               + 0.0000523 * cosD(a.l1 - a.l3)
               - 0.0000290 * cosD(2.0 * (a.l1 - a.l2))
               + 0.0000164 * cosD(2.0 * (a.l2 - a.om2))
               + 0.0000107 * cosD(a.l1 - 2.0 * a.l3 + a.pi3)
               - 0.0000102 * cosD(a.l2 - a.pi1)
               - 0.0000091 * cosD(2.0 * (a.l1 - a.l3));
    }

    private static double rho3(Arguments a) {
        double pi = JUPITER_PERIHELION;
        return -0.0014388 * cosD(a.l3 - a.pi3)
               - 0.0007919 * cosD(a.l3 - a.pi4)
               + 0.0006342 * cosD(a.l2 - a.l3)
               - 0.0001761 * cosD(2.0 * (a.l3 - a.l4))
               + 0.0000294 * cosD(a.l3 - a.l4)
               - 0.0000156 * cosD(3.0 * (a.l3 - a.l4))
               + 0.0000156 * cosD(a.l1 - a.l3)
               - 0.0000153 * cosD(a.l1 - a.l2)
               + 0.0000070 * cosD(2.0 * a.l2 - 3.0 * a.l3 + a.pi3)
               - 0.0000051 * cosD(a.l3 + a.pi3 - 2.0 * pi - 2.0 * a.g);
    }

    private static double rho4(Arguments a) {
        double pi = JUPITER_PERIHELION;
        return -0.0073546 * cosD(a.l4 - a.pi4)
               + 0.0001621 * cosD(a.l4 - a.pi3)
               + 0.0000974 * cosD(a.l3 - a.l4)
               - 0.0000543 * cosD(a.l4 + a.pi4 - 2.0 * pi - 2.0 * a.g)
               - 0.0000271 * cosD(2.0 * (a.l4 - a.pi4))
               + 0.0000182 * cosD(a.l4 - pi)
               + 0.0000177 * cosD(2.0 * (a.l3 - a.l4))
               - 0.0000167 * cosD(2.0 * a.l4 - a.psi - a.om4)
               + 0.0000167 * cosD(a.psi - a.om4)
               - 0.0000155 * cosD(2.0 * (a.l4 - pi - a.g))
               + 0.0000142 * cosD(2.0 * (a.l4 - a.psi))
               + 0.0000105 * cosD(a.l1 - a.l4)
               + 0.0000092 * cosD(a.l2 - a.l4)
               - 0.0000089 * cosD(a.l4 - pi - a.g)
               - 0.0000062 * cosD(a.l4 + a.pi4 - 2.0 * pi - 3.0 * a.g)
               + 0.0000048 * cosD(2.0 * (a.l4 - a.om4));
    }

    /**
     * 平根数与基本幅角（度），t 为扣除光行时后自理论历元的日数
     */
    private static class Arguments {
        private final double l1;
        private final double l2;
        private final double l3;
        private final double l4;
        private final double pi1;
        private final double pi2;
        private final double pi3;
        private final double pi4;
        private final double om1;
        private final double om2;
        private final double om3;
        private final double om4;
        private final double phiLambda;
        private final double psi;
        private final double g;
        private final double gPrime;

        Arguments(double t) {
            l1 = 106.07719 + 203.488955790 * t;
            l2 = 175.73161 + 101.374724735 * t;
            l3 = 120.55883 + 50.317609207 * t;
            l4 = 84.44459 + 21.571071177 * t;

            pi1 = 97.0881 + 0.16138586 * t;
            pi2 = 154.8663 + 0.04726307 * t;
            pi3 = 188.1840 + 0.00712734 * t;
            pi4 = 335.2868 + 0.00184000 * t;

            om1 = 312.3346 - 0.13279386 * t;
            om2 = 100.4411 - 0.03263064 * t;
            om3 = 119.1942 - 0.00717703 * t;
            om4 = 322.6186 - 0.00175934 * t;

            // 木星长周期项
            double gamma = 0.33033 * sinD(163.679 + 0.0010512 * t) + 0.03439 * sinD(34.486 - 0.0161731 * t);
            phiLambda = 199.6766 + 0.17379190 * t;
            psi = 316.5182 - 0.00000208 * t;
            g = 30.23756 + 0.0830925701 * t + gamma;
            gPrime = 31.97853 + 0.0334597339 * t;
        }
    }
}
