package superdarn.tdiff;

/**
 * 一维极小化结果
 *
 * 未收敛时 x 为NaN，iterations 仍给出已用的迭代次数。
 */
public class SimplexResult {

    private final double x;
    private final double value;
    private final int iterations;
    private final boolean converged;
    private final String message;

    public SimplexResult(double x, double value, int iterations, boolean converged, String message) {
        this.x = x;
        this.value = value;
        this.iterations = iterations;
        this.converged = converged;
        this.message = message;
    }

    public static SimplexResult failed(int iterations, String message) {
        return new SimplexResult(Double.NaN, Double.NaN, iterations, false, message);
    }

    /**
     * 返回替换了极小点和迭代次数的副本
     */
    public SimplexResult withX(double newX, int newIterations) {
        return new SimplexResult(newX, value, newIterations, converged && !Double.isNaN(newX), message);
    }

    public double getX() { return x; }
    public double getValue() { return value; }
    public int getIterations() { return iterations; }
    public boolean isConverged() { return converged; }
    public String getMessage() { return message; }

    @Override
    public String toString() {
        return String.format("SimplexResult{x=%.8f, f=%.6g, nit=%d, converged=%s, message='%s'}",
            x, value, iterations, converged, message);
    }
}
