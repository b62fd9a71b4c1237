package superdarn.tdiff;

import org.hipparchus.analysis.UnivariateFunction;
import org.hipparchus.exception.MathIllegalStateException;
import org.hipparchus.optim.ConvergenceChecker;
import org.hipparchus.optim.InitialGuess;
import org.hipparchus.optim.MaxEval;
import org.hipparchus.optim.MaxIter;
import org.hipparchus.optim.PointValuePair;
import org.hipparchus.optim.nonlinear.scalar.GoalType;
import org.hipparchus.optim.nonlinear.scalar.ObjectiveFunction;
import org.hipparchus.optim.nonlinear.scalar.noderiv.NelderMeadSimplex;
import org.hipparchus.optim.nonlinear.scalar.noderiv.SimplexOptimizer;
import org.hipparchus.util.FastMath;

import java.util.ArrayList;
import java.util.List;
import java.util.logging.Logger;

/**
 * 带稳定性检验的 Nelder-Mead 一维极小化
 *
 * 以上一次的结果为起点反复运行单纯形法。连续两次收敛到同一点时，先沿远离初值的方向
 * 推开一小步（步长随发现的局部极小个数增加），再向反方向推开一次，
 * 两次都回到同一点才认为极小稳定。总迭代次数超过上限时返回NaN。
 */
public class RigorousSimplex {

    private static final Logger logger = Logger.getLogger(RigorousSimplex.class.getName());

    private static final double NONZERO_STEP = 0.05;
    private static final double ZERO_STEP = 0.00025;
    private static final double KICK_SCALE = 0.001;

    private final double tolerance;
    private final int maxIterations;

    public RigorousSimplex(double tolerance, int maxIterations) {
        if (!(tolerance > 0.0) || maxIterations <= 0) {
            throw new IllegalArgumentException(String.format(
                "tolerance and iteration limit must be positive: tol=%g, maxiter=%d", tolerance, maxIterations));
        }
        this.tolerance = tolerance;
        this.maxIterations = maxIterations;
    }

    /**
     * 极小化
     *
     * @param x0 初值
     * @param objective 目标函数
     * @return 极小点、函数值和总迭代次数，超过迭代上限时极小点为NaN
     */
    public SimplexResult minimize(double x0, UnivariateFunction objective) {
        int totalIterations = 0;
        Double localMin = null;
        List<KickRecord> records = new ArrayList<>();
        double kickLevel = 2.0;
        double xmin = x0;
        double newXmin = x0;
        SimplexResult res = null;

        while (totalIterations < maxIterations) {
            res = localMinimize(xmin, objective);
            newXmin = res.getX();
            totalIterations += res.getIterations();
            if (!res.isConverged()) {
                break;
            }

            if (localMin != null) {
                xmin = localMin;
            }
            if (FastMath.abs(newXmin - xmin) < tolerance) {
                KickRecord seen = findRecord(records, res.getValue());
                if (localMin == null && seen == null) {
                    localMin = xmin;
                    kickLevel += 0.5;
                    double increment = KICK_SCALE * kickLevel;
                    double sign = FastMath.signum(xmin - x0);
                    newXmin += increment * sign;
                    records.add(new KickRecord(increment, sign, xmin, res));
                } else if (seen != null && seen.count == 1) {
                    newXmin = seen.xmin - seen.sign * seen.increment;
                    seen.count++;
                } else {
                    break;
                }
            } else if (localMin != null) {
                localMin = null;
            }
            xmin = newXmin;
        }

        if (res == null || totalIterations > maxIterations || !res.isConverged()) {
            logger.info(String.format("Simplex did not converge from %.6f within %d iterations", x0, maxIterations));
            return SimplexResult.failed(totalIterations, "maximum number of iterations exceeded");
        }
        KickRecord best = null;
        for (KickRecord r : records) {
            if (best == null || r.result.getValue() < best.result.getValue()) {
                best = r;
            }
        }
        if (best != null && res.getValue() > best.result.getValue()) {
            return best.result.withX(best.xmin, totalIterations);
        }
        return res.withX(newXmin, totalIterations);
    }

    /**
     * 单次 Nelder-Mead 极小化
     */
    SimplexResult localMinimize(double start, UnivariateFunction objective) {
        double step = start == 0.0 ? ZERO_STEP : NONZERO_STEP * start;
        SimplexOptimizer optimizer = new SimplexOptimizer(new SimplexChecker(tolerance));
        try {
            PointValuePair optimum = optimizer.optimize(
                MaxEval.unlimited(),
                new MaxIter(maxIterations),
                new ObjectiveFunction(point -> objective.value(point[0])),
                GoalType.MINIMIZE,
                new InitialGuess(new double[] {start}),
                new NelderMeadSimplex(new double[] {step}));
            if (Double.isNaN(optimum.getValue())) {
                return SimplexResult.failed(maxIterations + 1, "objective is undefined near " + start);
            }
            return new SimplexResult(optimum.getPoint()[0], optimum.getValue(),
                optimizer.getIterations(), true, "converged");
        } catch (MathIllegalStateException e) {
            logger.fine("Nelder-Mead stopped early: " + e.getMessage());
            return SimplexResult.failed(maxIterations + 1, e.getMessage());
        }
    }

    private KickRecord findRecord(List<KickRecord> records, double value) {
        double match = tolerance * tolerance;
        for (KickRecord r : records) {
            if (FastMath.abs(r.result.getValue() - value) <= match) {
                return r;
            }
        }
        return null;
    }

    public double getTolerance() {
        return tolerance;
    }

    public int getMaxIterations() {
        return maxIterations;
    }

    /**
     * 已检验过的局部极小
     */
    private static class KickRecord {
        int count = 1;
        final double increment;
        final double sign;
        final double xmin;
        final SimplexResult result;

        KickRecord(double increment, double sign, double xmin, SimplexResult result) {
            this.increment = increment;
            this.sign = sign;
            this.xmin = xmin;
            this.result = result;
        }
    }

    /**
     * 各顶点函数值变化不超过 tol 且位置变化不超过 0.1·tol 时收敛
     */
    private static class SimplexChecker implements ConvergenceChecker<PointValuePair> {
        private final double tolerance;

        SimplexChecker(double tolerance) {
            this.tolerance = tolerance;
        }

        @Override
        public boolean converged(int iteration, PointValuePair previous, PointValuePair current) {
            double df = FastMath.abs(previous.getValue() - current.getValue());
            double dx = FastMath.abs(previous.getPoint()[0] - current.getPoint()[0]);
            return df <= tolerance && dx <= 0.1 * tolerance;
        }
    }
}
