package superdarn.fov.calculator;

import superdarn.fov.RegionConfig;

/**
 * 传播路径合理性判断
 *
 * 按虚高划分电离层区域，并用HF雷达的经验约束检查（跳数, 虚高, 距离）组合：
 * D区散射只出现在0.5跳且距离不超过500 km；0.5/1.0跳的E区散射距离不超过900 km。
 */
public class PropagationValidator {

    private static final double D_REGION_MAX_DISTANCE = 500.0;  // km
    private static final double E_REGION_MAX_DISTANCE = 900.0;  // km

    private final RegionConfig regions;

    public PropagationValidator(RegionConfig regions) {
        this.regions = regions;
    }

    /**
     * 虚高所在的电离层区域
     *
     * @param height 虚高（km）
     * @return 区域标签，不在任何区域内时返回空字符串
     */
    public String assignRegion(double height) {
        if (Double.isNaN(height)) {
            return "";
        }
        String region = "";
        for (String label : regions.getLabels()) {
            double min = regions.getMin(label);
            double max = regions.getMax(label);
            boolean inside = regions.isTopRegion(label)
                ? height >= min && height <= max
                : height >= min && height < max;
            if (inside) {
                region = label;
            }
        }
        return region;
    }

    /**
     * @param hop 跳数
     * @param height 虚高（km）
     * @param distance 到第一个反射点的斜距（km）
     * @return 传播路径是否合理
     */
    public boolean isRealistic(double hop, double height, double distance) {
        if (regions.hasRegion("D") && height <= regions.getMax("D")) {
            return !(hop > 0.5 || distance > D_REGION_MAX_DISTANCE);
        }
        if (regions.hasRegion("E") && height <= regions.getMax("E")) {
            return !(hop < 1.5 && distance > E_REGION_MAX_DISTANCE);
        }
        return true;
    }

    public RegionConfig getRegions() {
        return regions;
    }
}
