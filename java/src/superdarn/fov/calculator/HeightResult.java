package superdarn.fov.calculator;

/**
 * 虚高计算结果（km）
 */
public class HeightResult {

    private final double height;
    private final double error;

    public HeightResult(double height, double error) {
        this.height = height;
        this.error = error;
    }

    public static HeightResult unresolved() {
        return new HeightResult(Double.NaN, Double.NaN);
    }

    public double getHeight() { return height; }
    public double getError() { return error; }

    @Override
    public String toString() {
        return String.format("HeightResult{h=%.2f, err=%.2f}", height, error);
    }
}
