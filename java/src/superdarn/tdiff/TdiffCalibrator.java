package superdarn.tdiff;

import org.hipparchus.util.FastMath;

import java.util.logging.Logger;

/**
 * tdiff 标定
 *
 * 先在初值附近求目标函数的全局极小，再把参考位置分别移动 ±refErr 重新求解，
 * 取两者相对估计值的较大偏移作为不确定度。
 */
public class TdiffCalibrator {

    private static final Logger logger = Logger.getLogger(TdiffCalibrator.class.getName());

    public static final double DEFAULT_TDIFF_TOLERANCE = 1.0e-4;
    public static final int DEFAULT_MAX_ITERATIONS = 2000;

    private final DistributionMinimizer minimizer;

    /**
     * @param functionTolerance 两个极小视为同等显著的目标函数差（位置单位）
     */
    public TdiffCalibrator(double functionTolerance) {
        this(DEFAULT_TDIFF_TOLERANCE, functionTolerance, DEFAULT_MAX_ITERATIONS);
    }

    public TdiffCalibrator(double tdiffTolerance, double functionTolerance, int maxIterations) {
        if (!(tdiffTolerance > 0.0)) {
            throw new IllegalArgumentException("tdiff tolerance must be positive: " + tdiffTolerance);
        }
        if (!(functionTolerance >= 0.0)) {
            throw new IllegalArgumentException("Function tolerance must be non-negative: " + functionTolerance);
        }
        if (maxIterations <= 0) {
            throw new IllegalArgumentException("Maximum iterations must be positive: " + maxIterations);
        }
        this.minimizer = new DistributionMinimizer(tdiffTolerance, functionTolerance, maxIterations);
    }

    /**
     * @param initialTdiff 初值（微秒），通常取硬件表中的值
     * @param objective 目标函数
     * @param referenceError 参考位置的不确定度
     * @param period 混叠周期（微秒），NaN表示不做周期搜索
     */
    public TdiffEstimate calculate(double initialTdiff, TdiffObjective objective,
                                  double referenceError, double period) {
        if (objective == null) {
            throw new IllegalArgumentException("Objective function is required");
        }
        SimplexResult res = minimizer.minimize(initialTdiff, objective, period);
        double tdiff = res.getX();
        if (Double.isNaN(tdiff)) {
            logger.info(String.format("No tdiff found from %.4f after %d iterations: %s",
                initialTdiff, res.getIterations(), res.getMessage()));
            return new TdiffEstimate(Double.NaN, Double.NaN, res.getIterations(), res.getValue(), false);
        }

        double reference = objective.getReference();
        double high = minimizer.minimize(initialTdiff, objective.withReference(reference + referenceError),
            period).getX();
        double low = minimizer.minimize(initialTdiff, objective.withReference(reference - referenceError),
            period).getX();

        double uncertainty = Double.NaN;
        if (!Double.isNaN(high)) {
            uncertainty = FastMath.abs(high - tdiff);
        }
        if (!Double.isNaN(low) && (Double.isNaN(uncertainty) || uncertainty < FastMath.abs(low - tdiff))) {
            uncertainty = FastMath.abs(low - tdiff);
        }

        logger.fine(String.format("tdiff %.6f +/- %.6f us (f=%.4g, nit=%d)",
            tdiff, uncertainty, res.getValue(), res.getIterations()));
        return new TdiffEstimate(tdiff, uncertainty, res.getIterations(), res.getValue(), res.isConverged());
    }

    public DistributionMinimizer getMinimizer() {
        return minimizer;
    }
}
