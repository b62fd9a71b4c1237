package superdarn.tdiff;

/**
 * 用于 tdiff 标定的单个回波
 */
public class CalibrationSample {

    private final double phi0;
    private final double phi0Error;
    private final int fovFlag;
    private final int beamNumber;
    private final double transmitFrequency;
    private final double distance;

    /**
     * @param phi0 相位差（弧度）
     * @param phi0Error 相位差误差（弧度）
     * @param fovFlag 视场标志（1或-1）
     * @param beamNumber 波束号
     * @param transmitFrequency 发射频率（kHz）
     * @param distance 雷达到反射点的斜距（km）
     */
    public CalibrationSample(double phi0, double phi0Error, int fovFlag, int beamNumber,
                             double transmitFrequency, double distance) {
        this.phi0 = phi0;
        this.phi0Error = phi0Error;
        this.fovFlag = fovFlag;
        this.beamNumber = beamNumber;
        this.transmitFrequency = transmitFrequency;
        this.distance = distance;
    }

    public double getPhi0() { return phi0; }
    public double getPhi0Error() { return phi0Error; }
    public int getFovFlag() { return fovFlag; }
    public int getBeamNumber() { return beamNumber; }
    public double getTransmitFrequency() { return transmitFrequency; }
    public double getDistance() { return distance; }

    @Override
    public String toString() {
        return String.format("CalibrationSample{bm=%d, fov=%d, tfreq=%.0f, phi0=%.4f, dist=%.1f}",
            beamNumber, fovFlag, transmitFrequency, phi0, distance);
    }
}
