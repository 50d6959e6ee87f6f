package orrery.events;

import org.hipparchus.analysis.UnivariateFunction;
import org.hipparchus.util.FastMath;

import java.util.*;
import java.util.function.DoublePredicate;
import java.util.function.Predicate;

/**
 * 事件检测器
 *
 * 定步长扫描找出括区，再用定次数二分细化；极值用黄金分割搜索。
 * 所有循环都有固定上界。时间单位为日（儒略日）。
 */
public final class EventDetector {

    /** 分钟级括区的二分次数，精度约 0.015 秒 */
    public static final int MINUTE_BRACKET_ITERATIONS = 12;

    /** 日级括区的二分次数，精度约 0.08 秒 */
    public static final int DAY_BRACKET_ITERATIONS = 20;

    /** 黄金分割比例 (√5 - 1) / 2 */
    public static final double GOLDEN_RATIO = (FastMath.sqrt(5.0) - 1.0) / 2.0;

    /** 黄金分割默认收敛阈值（日） */
    public static final double GOLDEN_SECTION_EPSILON = 1.0e-4;

    /** 黄金分割默认迭代上限 */
    public static final int GOLDEN_SECTION_MAX_ITERATIONS = 200;

    private EventDetector() {
    }

    /**
     * 二分细化标量信号的过零点
     *
     * @param f 信号
     * @param lower 括区下界
     * @param upper 括区上界，f(lower) 与 f(upper) 异号
     * @param iterations 二分次数
     * @return 最终括区中点
     */
    public static double bisect(UnivariateFunction f, double lower, double upper, int iterations) {
        checkIterations(iterations);
        double lo = lower;
        double hi = upper;
        double fLo = f.value(lo);
        for (int i = 0; i < iterations; i++) {
            double mid = 0.5 * (lo + hi);
            double fMid = f.value(mid);
            if (fLo * fMid > 0.0) {
                lo = mid;
                fLo = fMid;
            } else {
                hi = mid;
            }
        }
        return 0.5 * (lo + hi);
    }

    /**
     * 二分细化布尔谓词的翻转点
     *
     * @param predicate 谓词，两端取值不同
     * @param lower 括区下界
     * @param upper 括区上界
     * @param iterations 二分次数
     * @return 最终括区中点
     */
    public static double bisectTransition(DoublePredicate predicate, double lower, double upper, int iterations) {
        checkIterations(iterations);
        double lo = lower;
        double hi = upper;
        boolean atLo = predicate.test(lo);
        for (int i = 0; i < iterations; i++) {
            double mid = 0.5 * (lo + hi);
            if (predicate.test(mid) == atLo) {
                lo = mid;
            } else {
                hi = mid;
            }
        }
        return 0.5 * (lo + hi);
    }

    /**
     * 从 start 出发定步长扫描，找第一个被接受的过零点
     *
     * 相邻采样值之差超过 maxJump 的括区视为角度回绕造成的跳变，不是根。
     *
     * @param f 信号
     * @param start 起始时刻
     * @param direction 扫描方向
     * @param step 步长（日，正数）
     * @param maxSteps 最多扫描步数
     * @param iterations 二分次数
     * @param maxJump 允许的最大跳变，不限制时传 {@link Double#POSITIVE_INFINITY}
     * @param filter 细化后的过零点过滤器，拒绝后继续扫描；可为 null
     * @return 过零点，范围内没有时为空
     */
    public static Optional<Crossing> findCrossing(UnivariateFunction f, double start, ScanDirection direction,
                                                  double step, int maxSteps, int iterations,
                                                  double maxJump, Predicate<Crossing> filter) {
        checkStep(step);
        checkIterations(iterations);
        checkMaxSteps(maxSteps);

        double signedStep = direction.getSign() * step;
        double tPrev = start;
        double vPrev = f.value(tPrev);
        for (int k = 1; k <= maxSteps; k++) {
            double t = start + k * signedStep;
            double v = f.value(t);
            if (vPrev * v <= 0.0 && FastMath.abs(v - vPrev) <= maxJump) {
                double lo = FastMath.min(tPrev, t);
                double hi = FastMath.max(tPrev, t);
                double before = direction == ScanDirection.FORWARD ? vPrev : v;
                double after = direction == ScanDirection.FORWARD ? v : vPrev;
                Crossing crossing = new Crossing(bisect(f, lo, hi, iterations), lo, hi, before, after);
                if (filter == null || filter.test(crossing)) {
                    return Optional.of(crossing);
                }
            }
            tPrev = t;
            vPrev = v;
        }
        return Optional.empty();
    }

    /**
     * 不带跳变保护和过滤器的扫描
     */
    public static Optional<Crossing> findCrossing(UnivariateFunction f, double start, ScanDirection direction,
                                                  double step, int maxSteps, int iterations) {
        return findCrossing(f, start, direction, step, maxSteps, iterations, Double.POSITIVE_INFINITY, null);
    }

    /**
     * 黄金分割搜索单峰区间内的极值
     *
     * @param f 信号
     * @param a 区间下界
     * @param b 区间上界
     * @param maximize true 找极大值，false 找极小值
     * @param epsilon 区间宽度收敛阈值
     * @param maxIterations 迭代上限
     * @return 最终区间中点
     */
    public static double goldenSection(UnivariateFunction f, double a, double b, boolean maximize,
                                       double epsilon, int maxIterations) {
        checkIterations(maxIterations);
        double lo = a;
        double hi = b;
        for (int i = 0; i < maxIterations && hi - lo >= epsilon; i++) {
            double c = hi - GOLDEN_RATIO * (hi - lo);
            double d = lo + GOLDEN_RATIO * (hi - lo);
            double fc = f.value(c);
            double fd = f.value(d);
            boolean keepLeft = maximize ? fc > fd : fc < fd;
            if (keepLeft) {
                hi = d;
            } else {
                lo = c;
            }
        }
        return 0.5 * (lo + hi);
    }

    /**
     * 定步长扫描找局部极值，再在 [t - step, t + step] 上做黄金分割
     *
     * 第一个被检查的中间采样是 start 本身，与前后各一步的采样比较。
     *
     * @param f 信号
     * @param start 起始时刻
     * @param direction 扫描方向
     * @param step 粗扫描步长
     * @param maxSteps 最多扫描步数
     * @param maximize true 找极大值
     * @param gate 对中间采样值的附加条件，可为 null
     * @param epsilon 黄金分割收敛阈值
     * @param maxIterations 黄金分割迭代上限
     * @return 极值，范围内没有时为空
     */
    public static Optional<Extremum> findExtremum(UnivariateFunction f, double start, ScanDirection direction,
                                                  double step, int maxSteps, boolean maximize,
                                                  DoublePredicate gate, double epsilon, int maxIterations) {
        checkStep(step);
        checkMaxSteps(maxSteps);

        // 起点本身也可以是极值所在的中间采样
        double signedStep = direction.getSign() * step;
        double v0 = f.value(start - signedStep);
        double v1 = f.value(start);
        for (int k = 1; k <= maxSteps; k++) {
            double v2 = f.value(start + k * signedStep);
            boolean peak = maximize ? v1 > v0 && v1 > v2 : v1 < v0 && v1 < v2;
            if (peak && (gate == null || gate.test(v1))) {
                double center = start + (k - 1) * signedStep;
                double t = goldenSection(f, center - step, center + step, maximize, epsilon, maxIterations);
                return Optional.of(new Extremum(t, f.value(t), maximize));
            }
            v0 = v1;
            v1 = v2;
        }
        return Optional.empty();
    }

    /**
     * 找出 [start, end] 内谓词的全部翻转点（按时间先后）
     *
     * @param predicate 谓词
     * @param start 起始时刻
     * @param end 结束时刻
     * @param step 扫描步长
     * @param iterations 二分次数
     */
    public static List<Crossing> findAllTransitions(DoublePredicate predicate, double start, double end,
                                                    double step, int iterations) {
        checkStep(step);
        checkIterations(iterations);

        List<Crossing> transitions = new ArrayList<>();
        long steps = (long) FastMath.ceil((end - start) / step);
        double tPrev = start;
        boolean prev = predicate.test(tPrev);
        for (long k = 1; k <= steps; k++) {
            double t = FastMath.min(start + k * step, end);
            boolean current = predicate.test(t);
            if (current != prev) {
                double jd = bisectTransition(predicate, tPrev, t, iterations);
                transitions.add(new Crossing(jd, tPrev, t, prev ? 1.0 : 0.0, current ? 1.0 : 0.0));
            }
            tPrev = t;
            prev = current;
        }
        return transitions;
    }

    private static void checkStep(double step) {
        if (!(step > 0.0)) {
            throw new IllegalArgumentException("Step must be positive: " + step);
        }
    }

    private static void checkIterations(int iterations) {
        if (iterations <= 0) {
            throw new IllegalArgumentException("Iteration count must be positive: " + iterations);
        }
    }

    private static void checkMaxSteps(int maxSteps) {
        if (maxSteps <= 0) {
            throw new IllegalArgumentException("Maximum step count must be positive: " + maxSteps);
        }
    }
}
