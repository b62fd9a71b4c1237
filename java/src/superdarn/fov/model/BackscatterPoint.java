package superdarn.fov.model;

/**
 * 单个距离门的后向散射观测
 *
 * 来自上游拟合的不可变输入，派生字段保存在 {@link ResolvedPoint} 中。
 */
public class BackscatterPoint {

    private final int rangeGate;
    private final double phi0;            // 相位差（弧度）
    private final double phi0Error;       // 相位差误差（弧度）
    private final double powerLambda;     // 指数拟合功率 p_l（dB）
    private final double powerSigma;      // 高斯拟合功率 p_s（dB）
    private final double velocity;        // 多普勒速度（m/s）
    private final double spectralWidth;   // 谱宽（m/s）
    private final int groundScatterFlag;  // 上游地面散射标志

    public BackscatterPoint(int rangeGate, double phi0, double phi0Error,
                            double powerLambda, double powerSigma,
                            double velocity, double spectralWidth,
                            int groundScatterFlag) {
        this.rangeGate = rangeGate;
        this.phi0 = phi0;
        this.phi0Error = phi0Error;
        this.powerLambda = powerLambda;
        this.powerSigma = powerSigma;
        this.velocity = velocity;
        this.spectralWidth = spectralWidth;
        this.groundScatterFlag = groundScatterFlag;
    }

    /**
     * 创建只含相位和功率信息的观测点（速度、谱宽置零）
     */
    public BackscatterPoint(int rangeGate, double phi0, double phi0Error,
                            double power, int groundScatterFlag) {
        this(rangeGate, phi0, phi0Error, power, power, 0.0, 0.0, groundScatterFlag);
    }

    public int getRangeGate() { return rangeGate; }
    public double getPhi0() { return phi0; }
    public double getPhi0Error() { return phi0Error; }
    public double getPowerLambda() { return powerLambda; }
    public double getPowerSigma() { return powerSigma; }
    public double getVelocity() { return velocity; }
    public double getSpectralWidth() { return spectralWidth; }
    public int getGroundScatterFlag() { return groundScatterFlag; }

    @Override
    public String toString() {
        return String.format("BackscatterPoint{rg=%d, phi0=%.4f, p_l=%.1f, p_s=%.1f, gflg=%d}",
            rangeGate, phi0, powerLambda, powerSigma, groundScatterFlag);
    }
}
