package superdarn.tdiff;

/**
 * tdiff 估计值及收敛信息
 */
public class TdiffEstimate {

    private final double tdiff;
    private final double uncertainty;
    private final int iterations;
    private final double value;
    private final boolean converged;

    public TdiffEstimate(double tdiff, double uncertainty, int iterations, double value, boolean converged) {
        this.tdiff = tdiff;
        this.uncertainty = uncertainty;
        this.iterations = iterations;
        this.value = value;
        this.converged = converged;
    }

    /** 微秒，失败时为NaN */
    public double getTdiff() { return tdiff; }
    /** 微秒，无法估计时为NaN */
    public double getUncertainty() { return uncertainty; }
    public int getIterations() { return iterations; }
    /** 极小处的目标函数值 */
    public double getValue() { return value; }
    public boolean isConverged() { return converged; }

    @Override
    public String toString() {
        return String.format("TdiffEstimate{tdiff=%.6f, err=%.6f, nit=%d, f=%.6g, converged=%s}",
            tdiff, uncertainty, iterations, value, converged);
    }
}
