package superdarn.fov;

import superdarn.fov.model.GeometryErrors;

import java.time.Duration;
import java.util.Arrays;

/**
 * 视场判定配置
 *
 * 不可变配置对象，每次运行构建一次，通过 {@link Builder} 设置参数并在 build() 时校验。
 * rgBox、rgMax、vhBox 按距离门分段一一对应：距离门 r 使用第一个满足 r &lt; rgMax[i] 的分段。
 */
public class FovConfig {

    private final int minPoints;
    private final RegionConfig regions;
    private final int[] rangeGateBox;
    private final int[] rangeGateMax;
    private final double[] virtualHeightBox;
    private final double maxHop;
    private final Duration utBox;
    private final boolean propagationTest;
    private final boolean strictGroundScatter;
    private final GeometryErrors geometryErrors;
    private final int step;
    private final double minTemporalFraction;
    private final GroundScatterConfig groundScatter;

    private FovConfig(Builder b) {
        this.minPoints = b.minPoints;
        this.regions = b.regions;
        this.rangeGateBox = b.rangeGateBox.clone();
        this.rangeGateMax = b.rangeGateMax.clone();
        this.virtualHeightBox = b.virtualHeightBox.clone();
        this.maxHop = b.maxHop;
        this.utBox = b.utBox;
        this.propagationTest = b.propagationTest;
        this.strictGroundScatter = b.strictGroundScatter;
        this.geometryErrors = b.geometryErrors;
        this.step = b.step;
        this.minTemporalFraction = b.minTemporalFraction;
        this.groundScatter = b.groundScatter;
    }

    public static FovConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * 查找距离门所属的分段
     *
     * @param rangeGate 距离门
     * @return 分段索引，超出最大距离门时返回-1
     */
    public int limitIndex(double rangeGate) {
        for (int i = 0; i < rangeGateMax.length; i++) {
            if (rangeGate < rangeGateMax[i]) {
                return i;
            }
        }
        return -1;
    }

    public int getMinPoints() { return minPoints; }
    public RegionConfig getRegions() { return regions; }
    public int getRangeGateBox(int index) { return rangeGateBox[index]; }
    public int getRangeGateMax(int index) { return rangeGateMax[index]; }
    public double getVirtualHeightBox(int index) { return virtualHeightBox[index]; }
    public int getLimitCount() { return rangeGateMax.length; }
    public int getMinRangeGateBox() { return Arrays.stream(rangeGateBox).min().getAsInt(); }
    public int getLargestRangeGateMax() { return rangeGateMax[rangeGateMax.length - 1]; }
    public double getMaxHop() { return maxHop; }
    public Duration getUtBox() { return utBox; }
    public boolean isPropagationTest() { return propagationTest; }
    public boolean isStrictGroundScatter() { return strictGroundScatter; }
    public GeometryErrors getGeometryErrors() { return geometryErrors; }
    public int getStep() { return step; }
    public double getMinTemporalFraction() { return minTemporalFraction; }
    public GroundScatterConfig getGroundScatter() { return groundScatter; }

    @Override
    public String toString() {
        return "FovConfig{" +
                "minPoints=" + minPoints +
                ", regions=" + regions +
                ", rgBox=" + Arrays.toString(rangeGateBox) +
                ", rgMax=" + Arrays.toString(rangeGateMax) +
                ", vhBox=" + Arrays.toString(virtualHeightBox) +
                ", maxHop=" + maxHop +
                ", utBox=" + utBox +
                ", ptest=" + propagationTest +
                ", strictGs=" + strictGroundScatter +
                ", step=" + step +
                '}';
    }

    /**
     * 配置构建器
     */
    public static class Builder {
        private int minPoints = 3;
        private RegionConfig regions = RegionConfig.defaults();
        private int[] rangeGateBox = {2, 5, 10, 20};
        private int[] rangeGateMax = {5, 25, 40, 76};
        private double[] virtualHeightBox = {50.0, 50.0, 50.0, 150.0};
        private double maxHop = 3.0;
        private Duration utBox = Duration.ofMinutes(20);
        private boolean propagationTest = true;
        private boolean strictGroundScatter = false;
        private GeometryErrors geometryErrors = GeometryErrors.NONE;
        private int step = 6;
        private double minTemporalFraction = 0.1;
        private GroundScatterConfig groundScatter = new GroundScatterConfig();

        public Builder minPoints(int minPoints) { this.minPoints = minPoints; return this; }
        public Builder regions(RegionConfig regions) { this.regions = regions; return this; }
        public Builder rangeGateBox(int... box) { this.rangeGateBox = box; return this; }
        public Builder rangeGateMax(int... max) { this.rangeGateMax = max; return this; }
        public Builder virtualHeightBox(double... box) { this.virtualHeightBox = box; return this; }
        public Builder maxHop(double maxHop) { this.maxHop = maxHop; return this; }
        public Builder utBox(Duration utBox) { this.utBox = utBox; return this; }
        public Builder propagationTest(boolean ptest) { this.propagationTest = ptest; return this; }
        public Builder strictGroundScatter(boolean strict) { this.strictGroundScatter = strict; return this; }
        public Builder geometryErrors(GeometryErrors errors) { this.geometryErrors = errors; return this; }
        public Builder step(int step) { this.step = step; return this; }
        public Builder minTemporalFraction(double frac) { this.minTemporalFraction = frac; return this; }
        public Builder groundScatter(GroundScatterConfig gs) { this.groundScatter = gs; return this; }

        public FovConfig build() {
            if (minPoints < 0) {
                throw new IllegalArgumentException("minimum point count must not be negative: " + minPoints);
            }
            if (regions == null || geometryErrors == null || groundScatter == null) {
                throw new IllegalArgumentException("regions, geometry errors and groundscatter settings are required");
            }
            if (rangeGateBox == null || rangeGateMax == null || virtualHeightBox == null
                    || rangeGateBox.length == 0
                    || rangeGateBox.length != rangeGateMax.length
                    || rangeGateBox.length != virtualHeightBox.length) {
                throw new IllegalArgumentException(
                    "range gate box, range gate limit and virtual height box lists must be non-empty and of equal length");
            }
            for (int i = 0; i < rangeGateBox.length; i++) {
                if (rangeGateBox[i] < 1) {
                    throw new IllegalArgumentException("range gate box is too small: " + Arrays.toString(rangeGateBox));
                }
                if (virtualHeightBox[i] <= 0.0) {
                    throw new IllegalArgumentException("virtual height box must be positive: " + Arrays.toString(virtualHeightBox));
                }
                if (rangeGateMax[i] < 0 || (i > 0 && rangeGateMax[i] <= rangeGateMax[i - 1])) {
                    throw new IllegalArgumentException("range gate limits must increase: " + Arrays.toString(rangeGateMax));
                }
            }
            if (maxHop < 0.5) {
                throw new IllegalArgumentException("maximum hop must be at least 0.5: " + maxHop);
            }
            if (utBox == null || utBox.isZero() || utBox.isNegative()) {
                throw new IllegalArgumentException("UT box must be a positive duration: " + utBox);
            }
            if (minTemporalFraction <= 0.0 || minTemporalFraction > 1.0) {
                throw new IllegalArgumentException("minimum temporal fraction must lie in (0, 1]: " + minTemporalFraction);
            }
            if (step < 1) {
                throw new IllegalArgumentException("processing step must be at least 1: " + step);
            }
            return new FovConfig(this);
        }
    }
}
