package superdarn.fov;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 电离层区域的虚高范围配置
 *
 * 区域标签映射到 [hmin, hmax)，最高的区域上界闭合。
 * 构造时检查区域按高度单调递增且互不重叠。
 */
public class RegionConfig {

    private static final String[] DEFAULT_LABELS = {"D", "E", "F"};
    private static final double[] DEFAULT_MIN = {75.0, 115.0, 150.0};
    private static final double[] DEFAULT_MAX = {115.0, 150.0, 900.0};

    private final Map<String, double[]> bounds;
    private final List<String> labels;

    /**
     * 默认区域：D [75,115)，E [115,150)，F [150,900]
     */
    public static RegionConfig defaults() {
        Map<String, double[]> map = new LinkedHashMap<>();
        for (int i = 0; i < DEFAULT_LABELS.length; i++) {
            map.put(DEFAULT_LABELS[i], new double[] {DEFAULT_MIN[i], DEFAULT_MAX[i]});
        }
        return new RegionConfig(map);
    }

    /**
     * @param regionBounds 区域标签到 {hmin, hmax}（km）的映射
     */
    public RegionConfig(Map<String, double[]> regionBounds) {
        if (regionBounds == null || regionBounds.isEmpty()) {
            throw new IllegalArgumentException("at least one ionospheric region is required");
        }
        List<Map.Entry<String, double[]>> entries = new ArrayList<>(regionBounds.entrySet());
        entries.sort((a, b) -> Double.compare(a.getValue()[0], b.getValue()[0]));

        Map<String, double[]> ordered = new LinkedHashMap<>();
        double previousMax = Double.NEGATIVE_INFINITY;
        for (Map.Entry<String, double[]> e : entries) {
            String label = e.getKey();
            double[] range = e.getValue();
            if (label == null || label.length() != 1) {
                throw new IllegalArgumentException("region labels must be single characters: " + label);
            }
            if (range == null || range.length != 2) {
                throw new IllegalArgumentException("region " + label + " needs a {min, max} pair");
            }
            if (range[0] < 0.0 || !(range[0] < range[1])) {
                throw new IllegalArgumentException(String.format(
                    "region %s has invalid height limits [%.1f, %.1f]", label, range[0], range[1]));
            }
            if (range[0] < previousMax) {
                throw new IllegalArgumentException(String.format(
                    "region %s [%.1f, %.1f] overlaps the region below it", label, range[0], range[1]));
            }
            previousMax = range[1];
            ordered.put(label, new double[] {range[0], range[1]});
        }
        this.bounds = Collections.unmodifiableMap(ordered);
        this.labels = Collections.unmodifiableList(new ArrayList<>(ordered.keySet()));
    }

    /**
     * @return 按高度递增排序的区域标签
     */
    public List<String> getLabels() {
        return labels;
    }

    public boolean hasRegion(String label) {
        return bounds.containsKey(label);
    }

    public double getMin(String label) {
        return range(label)[0];
    }

    public double getMax(String label) {
        return range(label)[1];
    }

    /**
     * @return 所有区域中最低的下界
     */
    public double getLowestMin() {
        return bounds.get(labels.get(0))[0];
    }

    /**
     * @return 所有区域中最高的上界
     */
    public double getHighestMax() {
        return bounds.get(labels.get(labels.size() - 1))[1];
    }

    public boolean isTopRegion(String label) {
        return labels.get(labels.size() - 1).equals(label);
    }

    private double[] range(String label) {
        double[] r = bounds.get(label);
        if (r == null) {
            throw new IllegalArgumentException("unknown ionospheric region: " + label);
        }
        return r;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("RegionConfig{");
        for (String label : labels) {
            double[] r = bounds.get(label);
            sb.append(String.format("%s=[%.0f,%.0f) ", label, r[0], r[1]));
        }
        return sb.toString().trim() + "}";
    }
}
