package superdarn.fov;

/**
 * 地面散射筛选参数
 */
public class GroundScatterConfig {

    private final int minRangeGate;   // 近距离门界限，之内需限制功率
    private final int maxRangeGate;   // 超过该距离门的点不作为地面散射
    private final int rangeGateBox;   // 邻域半宽（距离门）
    private final double maxPower;    // 近距离门允许的最大功率（dB）
    private final double minFraction; // 邻域中地面散射的最小比例
    private final int minPoints;      // 邻域中的最少点数

    public GroundScatterConfig() {
        this(10, 76, 5, 5.0, 0.5, 5);
    }

    public GroundScatterConfig(int minRangeGate, int maxRangeGate, int rangeGateBox,
                               double maxPower, double minFraction, int minPoints) {
        if (rangeGateBox <= 0) {
            throw new IllegalArgumentException("range gate box must be positive: " + rangeGateBox);
        }
        if (minFraction < 0.0 || minFraction > 1.0) {
            throw new IllegalArgumentException("groundscatter fraction must lie in [0, 1]: " + minFraction);
        }
        if (minPoints <= 0) {
            throw new IllegalArgumentException("minimum point count must be positive: " + minPoints);
        }
        this.minRangeGate = minRangeGate;
        this.maxRangeGate = maxRangeGate;
        this.rangeGateBox = rangeGateBox;
        this.maxPower = maxPower;
        this.minFraction = minFraction;
        this.minPoints = minPoints;
    }

    /**
     * 返回替换了最大距离门的副本
     */
    public GroundScatterConfig withMaxRangeGate(int maxGate) {
        return new GroundScatterConfig(minRangeGate, maxGate, rangeGateBox, maxPower,
            minFraction, minPoints);
    }

    public int getMinRangeGate() { return minRangeGate; }
    public int getMaxRangeGate() { return maxRangeGate; }
    public int getRangeGateBox() { return rangeGateBox; }
    public double getMaxPower() { return maxPower; }
    public double getMinFraction() { return minFraction; }
    public int getMinPoints() { return minPoints; }

    @Override
    public String toString() {
        return String.format("GroundScatterConfig{minRg=%d, maxRg=%d, box=%d, maxP=%.1f, gsTol=%.2f, nmin=%d}",
            minRangeGate, maxRangeGate, rangeGateBox, maxPower, minFraction, minPoints);
    }
}
