package superdarn.fov.model;

/**
 * 虚高分组区间 [min, max)
 */
public class AltitudeBand {

    private final double min;
    private final double max;

    public AltitudeBand(double min, double max) {
        this.min = min;
        this.max = max;
    }

    public double getMin() { return min; }
    public double getMax() { return max; }

    public boolean contains(double height) {
        return !Double.isNaN(height) && height >= min && height < max;
    }

    @Override
    public String toString() {
        return String.format("AltitudeBand[%.1f, %.1f)", min, max);
    }
}
