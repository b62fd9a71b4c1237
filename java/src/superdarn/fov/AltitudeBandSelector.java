package superdarn.fov;

import superdarn.fov.model.AltitudeBand;
import superdarn.helper.GaussianPeakFitter;
import superdarn.helper.HeightHistogram;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.logging.Logger;

/**
 * 虚高分组
 *
 * 对距离门窗口内的虚高做直方图，在每个峰上拟合高斯曲线，以均值±3σ作为分组边界
 * （限制在区域的高度范围内）。峰越高优先级越高，重叠时低优先级的分组让出边界；
 * 分组之间、以及分组覆盖不到的上下两端用宽度约为 vhBox 的均匀分组补齐。
 * 找不到峰或所有拟合都失败时退化为均匀分组。
 */
public class AltitudeBandSelector {

    private static final Logger logger = Logger.getLogger(AltitudeBandSelector.class.getName());

    private static final int PEAK_ORDER = 2;
    private static final int MIN_BINS = 10;

    private final GaussianPeakFitter fitter;

    public AltitudeBandSelector() {
        this(new GaussianPeakFitter());
    }

    public AltitudeBandSelector(GaussianPeakFitter fitter) {
        this.fitter = fitter;
    }

    /**
     * 确定虚高分组
     *
     * @param heights 窗口内各点的虚高（km）
     * @param regionMin 区域下界（km）
     * @param regionMax 区域上界（km）
     * @param vhBox 建议的分组宽度（km）
     * @param minPoints 以全局最大值作为峰所需的最少点数
     * @return 按高度递增的分组，没有有效虚高时为空
     */
    public List<AltitudeBand> select(double[] heights, double regionMin, double regionMax,
                                     double vhBox, int minPoints) {
        if (!(vhBox > 0.0) || !(regionMax > regionMin)) {
            throw new IllegalArgumentException(String.format(
                "invalid height limits [%.1f, %.1f] or box %.1f", regionMin, regionMax, vhBox));
        }
        double[] finite = Arrays.stream(heights).filter(h -> !Double.isNaN(h)).toArray();
        if (finite.length == 0) {
            return new ArrayList<>();
        }
        double tmin = Arrays.stream(finite).min().getAsDouble();
        double tmax = Arrays.stream(finite).max().getAsDouble();

        int bins = Math.max((int) ((regionMax - regionMin) / (vhBox * 0.25)), MIN_BINS);
        HeightHistogram histogram = new HeightHistogram(finite, bins, regionMin, regionMax);

        List<Integer> peaks = histogram.relativeMaxima(PEAK_ORDER);
        if (peaks.isEmpty()) {
            int global = histogram.globalMaximum();
            if (histogram.count(global) > minPoints) {
                peaks.add(global);
            }
        }
        if (peaks.isEmpty()) {
            return uniformBands(tmin, tmax, vhBox, Double.NEGATIVE_INFINITY, Double.POSITIVE_INFINITY);
        }

        // 按峰高降序拟合，峰高相同时低高度优先
        peaks.sort(Comparator.comparingDouble((Integer ih) -> -histogram.count(ih))
            .thenComparingInt(ih -> ih));

        List<Double> mins = new ArrayList<>();
        List<Double> maxs = new ArrayList<>();
        List<Double> means = new ArrayList<>();
        double[] centers = histogram.getCenters();
        for (int ih : peaks) {
            double center = centers[ih];
            Optional<double[]> coeff = fitter.fit(centers, histogram.getCounts(),
                histogram.count(ih), center, 0.5 * vhBox);
            if (!coeff.isPresent()) {
                continue;
            }
            double mean = coeff.get()[1];
            double sigma = coeff.get()[2];
            double vmin = Math.max(mean - 3.0 * sigma, regionMin);
            double vmax = Math.min(mean + 3.0 * sigma, regionMax);
            double vlow = Math.max(mean - 2.0 * sigma, regionMin);
            double vhigh = Math.min(mean + 2.0 * sigma, regionMax);
            if (center < vlow || center > vhigh) {
                logger.fine(String.format("Gaussian fit at %.1f km misses its peak at %.1f km", mean, center));
                continue;
            }
            histogram.clear(vmin, vmax);
            mins.add(vmin);
            maxs.add(vmax);
            means.add(mean);
        }

        if (mins.isEmpty()) {
            return uniformBands(tmin, tmax, vhBox, regionMin, regionMax);
        }
        return reconcile(mins, maxs, means, tmin, tmax, regionMin, regionMax, vhBox);
    }

    /**
     * 覆盖 [tmin, tmax] 的等宽分组
     */
    static List<AltitudeBand> uniformBands(double tmin, double tmax, double vhBox,
                                           double lowerLimit, double upperLimit) {
        double span = tmax - tmin;
        int count = (int) Math.floor(span / vhBox) + 1;
        double start = tmin + 0.5 * span - 0.5 * count * vhBox;
        List<AltitudeBand> bands = new ArrayList<>();
        for (int n = 0; n < count; n++) {
            double low = Math.max(start + n * vhBox, lowerLimit);
            double high = Math.min(start + (n + 1) * vhBox, upperLimit);
            if (low < high) {
                bands.add(new AltitudeBand(low, high));
            }
        }
        return bands;
    }

    private List<AltitudeBand> reconcile(List<Double> mins, List<Double> maxs, List<Double> means,
                                         double tmin, double tmax, double regionMin,
                                         double regionMax, double vhBox) {
        int fitted = mins.size();
        List<double[]> bands = new ArrayList<>();   // {min, max, peak, priority}

        // 低于最低分组的点
        int lowest = indexOfMin(mins);
        if (mins.get(lowest) > tmin) {
            double top = mins.get(lowest);
            long count = Math.round((top - tmin) / vhBox);
            if (count == 0) {
                mins.set(lowest, Math.max(Math.floor(tmin), regionMin));
            } else {
                double span = (top - tmin) / count;
                for (int n = 0; n < count; n++) {
                    double low = Math.max(tmin + n * span, regionMin);
                    bands.add(new double[] {low, tmin + (n + 1.0) * span, tmin + (n + 0.5) * span,
                        fitted + bands.size() + 1});
                }
            }
        }

        List<Integer> order = new ArrayList<>();
        for (int i = 0; i < fitted; i++) {
            order.add(i);
        }
        order.sort(Comparator.comparingDouble(mins::get));

        for (int iv : order) {
            double vmin = mins.get(iv);
            if (!bands.isEmpty()) {
                double[] last = bands.get(bands.size() - 1);
                if (last[1] >= means.get(iv) || vmin <= last[2]) {
                    if (last[3] < iv) {
                        vmin = last[1];
                    } else {
                        last[1] = vmin;
                        if (last[1] <= last[0]) {
                            bands.remove(bands.size() - 1);
                        }
                    }
                } else if (last[1] < vmin) {
                    double bmin = last[1];
                    long count = Math.round((vmin - bmin) / vhBox);
                    if (count == 0) {
                        last[1] = vmin;
                    } else {
                        double span = (vmin - bmin) / count;
                        for (int n = 0; n < count; n++) {
                            bands.add(new double[] {bmin + n * span, bmin + (n + 1.0) * span,
                                bmin + (n + 0.5) * span, fitted + bands.size() + 1});
                        }
                    }
                }
            }
            if (vmin < maxs.get(iv)) {
                bands.add(new double[] {vmin, maxs.get(iv), means.get(iv), iv});
            }
        }

        if (bands.isEmpty()) {
            return uniformBands(tmin, tmax, vhBox, regionMin, regionMax);
        }

        // 高于最高分组的点，最上面的分组要包含 tmax
        int highest = 0;
        for (int i = 1; i < bands.size(); i++) {
            if (bands.get(i)[1] > bands.get(highest)[1]) {
                highest = i;
            }
        }
        double top = bands.get(highest)[1];
        if (top <= tmax) {
            long count = Math.round((tmax - top) / vhBox);
            double ceiling = Math.min(Math.floor(tmax) + 1.0, regionMax);
            if (count == 0) {
                bands.get(highest)[1] = ceiling;
            } else {
                double span = (tmax - top) / count;
                for (int n = 0; n < count; n++) {
                    double high = n == count - 1 ? ceiling : Math.min(top + (n + 1.0) * span, regionMax);
                    bands.add(new double[] {top + n * span, high, top + (n + 0.5) * span,
                        fitted + bands.size() + 1});
                }
            }
        }

        List<AltitudeBand> result = new ArrayList<>();
        for (double[] b : bands) {
            result.add(new AltitudeBand(b[0], b[1]));
        }
        return result;
    }

    private static int indexOfMin(List<Double> values) {
        int best = 0;
        for (int i = 1; i < values.size(); i++) {
            if (values.get(i) < values.get(best)) {
                best = i;
            }
        }
        return best;
    }
}
