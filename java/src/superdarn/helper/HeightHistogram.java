package superdarn.helper;

import java.util.ArrayList;
import java.util.List;

/**
 * 等宽直方图及局部极大值搜索
 *
 * 区间 [min, max] 等分为若干个箱，最后一个箱包含上界，区间外和NaN值忽略。
 */
public class HeightHistogram {

    private final double min;
    private final double width;
    private final double[] counts;

    public HeightHistogram(double[] values, int binCount, double min, double max) {
        if (binCount <= 0 || !(max > min)) {
            throw new IllegalArgumentException(String.format(
                "histogram needs a positive bin count and max > min: bins=%d, range=[%f, %f]",
                binCount, min, max));
        }
        this.min = min;
        this.width = (max - min) / binCount;
        this.counts = new double[binCount];
        for (double v : values) {
            if (Double.isNaN(v) || v < min || v > max) {
                continue;
            }
            int bin = (int) ((v - min) / width);
            if (bin >= binCount) {
                bin = binCount - 1;
            }
            counts[bin] += 1.0;
        }
    }

    public int size() {
        return counts.length;
    }

    public double count(int bin) {
        return counts[bin];
    }

    public double[] getCounts() {
        return counts.clone();
    }

    public double center(int bin) {
        return min + (bin + 0.5) * width;
    }

    public double[] getCenters() {
        double[] c = new double[counts.length];
        for (int i = 0; i < c.length; i++) {
            c[i] = center(i);
        }
        return c;
    }

    /**
     * 把中心落在 [low, high) 内的箱清零
     */
    public void clear(double low, double high) {
        for (int i = 0; i < counts.length; i++) {
            double c = center(i);
            if (c >= low && c < high) {
                counts[i] = 0.0;
            }
        }
    }

    /**
     * 严格大于两侧各 order 个箱的局部极大值（边界按夹取处理，因此端点不会是极大值）
     *
     * @return 极大值所在箱的索引
     */
    public List<Integer> relativeMaxima(int order) {
        List<Integer> maxima = new ArrayList<>();
        int n = counts.length;
        for (int i = 0; i < n; i++) {
            boolean peak = true;
            for (int shift = 1; shift <= order && peak; shift++) {
                int left = Math.max(i - shift, 0);
                int right = Math.min(i + shift, n - 1);
                peak = counts[i] > counts[left] && counts[i] > counts[right];
            }
            if (peak) {
                maxima.add(i);
            }
        }
        return maxima;
    }

    /**
     * @return 最大计数所在的第一个箱
     */
    public int globalMaximum() {
        int best = 0;
        for (int i = 1; i < counts.length; i++) {
            if (counts[i] > counts[best]) {
                best = i;
            }
        }
        return best;
    }
}
