package superdarn.helper;

import org.hipparchus.stat.descriptive.moment.Mean;
import org.hipparchus.stat.descriptive.moment.StandardDeviation;
import org.hipparchus.stat.regression.SimpleRegression;

import java.util.Arrays;
import java.util.Optional;

/**
 * 直线拟合及残差统计
 *
 * 最小二乘拟合失败（点数不足或自变量没有变化）时 {@link #fit} 返回空，
 * 调用方可以退化为 {@link #flat} 的水平线。
 */
public class LineFit {

    private final double slope;
    private final double intercept;

    public LineFit(double slope, double intercept) {
        this.slope = slope;
        this.intercept = intercept;
    }

    /**
     * 最小二乘直线拟合
     *
     * @param x 自变量
     * @param y 因变量
     * @return 拟合结果，无法拟合时为空
     */
    public static Optional<LineFit> fit(double[] x, double[] y) {
        if (x.length != y.length) {
            throw new IllegalArgumentException(String.format(
                "x and y must have the same length: %d != %d", x.length, y.length));
        }
        SimpleRegression regression = new SimpleRegression();
        for (int i = 0; i < x.length; i++) {
            if (!Double.isNaN(x[i]) && !Double.isNaN(y[i])) {
                regression.addData(x[i], y[i]);
            }
        }
        double slope = regression.getSlope();
        double intercept = regression.getIntercept();
        if (Double.isNaN(slope) || Double.isNaN(intercept)) {
            return Optional.empty();
        }
        return Optional.of(new LineFit(slope, intercept));
    }

    /**
     * 斜率为零、截距为均值的水平线
     */
    public static LineFit flat(double[] y) {
        return new LineFit(0.0, new Mean().evaluate(finite(y)));
    }

    public double valueAt(double x) {
        return intercept + slope * x;
    }

    /**
     * 残差：拟合值减观测值
     */
    public double[] residuals(double[] x, double[] y) {
        double[] dev = new double[x.length];
        for (int i = 0; i < x.length; i++) {
            dev[i] = valueAt(x[i]) - y[i];
        }
        return dev;
    }

    /**
     * 残差的总体标准差（忽略NaN）
     */
    public static double populationStd(double[] values) {
        double[] v = finite(values);
        if (v.length == 0) {
            return Double.NaN;
        }
        return new StandardDeviation(false).evaluate(v);
    }

    /**
     * 每个值的z分数绝对值
     *
     * 标准差为零时所有点都在均值上，z分数取0。
     */
    public static double[] absoluteZScores(double[] values) {
        double[] v = finite(values);
        double[] z = new double[values.length];
        if (v.length == 0) {
            Arrays.fill(z, Double.NaN);
            return z;
        }
        double mean = new Mean().evaluate(v);
        double std = new StandardDeviation(false).evaluate(v);
        for (int i = 0; i < values.length; i++) {
            if (Double.isNaN(values[i])) {
                z[i] = Double.NaN;
            } else if (std == 0.0) {
                z[i] = 0.0;
            } else {
                z[i] = Math.abs((values[i] - mean) / std);
            }
        }
        return z;
    }

    public double getSlope() { return slope; }
    public double getIntercept() { return intercept; }

    private static double[] finite(double[] values) {
        return Arrays.stream(values).filter(d -> !Double.isNaN(d)).toArray();
    }

    @Override
    public String toString() {
        return String.format("LineFit{slope=%.5f, intercept=%.4f}", slope, intercept);
    }
}
