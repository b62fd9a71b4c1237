package superdarn.helper;

import org.hipparchus.exception.MathRuntimeException;
import org.hipparchus.fitting.GaussianCurveFitter;
import org.hipparchus.fitting.WeightedObservedPoints;

import java.util.Optional;
import java.util.logging.Logger;

/**
 * 高斯曲线拟合
 *
 * 模型 A·exp(-(x-μ)²/(2σ²))。拟合不收敛或参数非法时返回空，不向外抛出异常。
 */
public class GaussianPeakFitter {

    private static final Logger logger = Logger.getLogger(GaussianPeakFitter.class.getName());

    private static final int MAX_ITERATIONS = 1000;

    /**
     * @param x 横坐标（箱中心）
     * @param y 纵坐标（计数）
     * @param amplitude 初始振幅
     * @param mean 初始均值
     * @param sigma 初始标准差
     * @return {振幅, 均值, 标准差}，失败时为空
     */
    public Optional<double[]> fit(double[] x, double[] y, double amplitude, double mean, double sigma) {
        WeightedObservedPoints observations = new WeightedObservedPoints();
        for (int i = 0; i < x.length; i++) {
            observations.add(x[i], y[i]);
        }
        try {
            double[] coeff = GaussianCurveFitter.create()
                .withStartPoint(new double[] {amplitude, mean, sigma})
                .withMaxIterations(MAX_ITERATIONS)
                .fit(observations.toList());
            for (double c : coeff) {
                if (Double.isNaN(c) || Double.isInfinite(c)) {
                    return Optional.empty();
                }
            }
            coeff[2] = Math.abs(coeff[2]);
            return Optional.of(coeff);
        } catch (MathRuntimeException e) {
            logger.fine("Gaussian fit failed near " + mean + ": " + e.getMessage());
            return Optional.empty();
        }
    }
}
