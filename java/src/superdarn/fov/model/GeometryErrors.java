package superdarn.fov.model;

/**
 * 几何参数误差
 *
 * 仰角误差传播使用的波束方位、视轴（度）和干涉仪坐标（米）误差。
 */
public class GeometryErrors {

    /** 全部为零的误差 */
    public static final GeometryErrors NONE = new GeometryErrors(0.0, 0.0, 0.0, 0.0, 0.0);

    private final double beamAzimuthError;
    private final double boresiteError;
    private final double interferometerXError;
    private final double interferometerYError;
    private final double interferometerZError;

    public GeometryErrors(double beamAzimuthError, double boresiteError,
                          double interferometerXError, double interferometerYError,
                          double interferometerZError) {
        if (beamAzimuthError < 0.0 || boresiteError < 0.0 || interferometerXError < 0.0
                || interferometerYError < 0.0 || interferometerZError < 0.0) {
            throw new IllegalArgumentException("geometry errors must not be negative");
        }
        this.beamAzimuthError = beamAzimuthError;
        this.boresiteError = boresiteError;
        this.interferometerXError = interferometerXError;
        this.interferometerYError = interferometerYError;
        this.interferometerZError = interferometerZError;
    }

    public double getBeamAzimuthError() { return beamAzimuthError; }
    public double getBoresiteError() { return boresiteError; }
    public double getInterferometerXError() { return interferometerXError; }
    public double getInterferometerYError() { return interferometerYError; }
    public double getInterferometerZError() { return interferometerZError; }

    @Override
    public String toString() {
        return String.format("GeometryErrors{bmaz=%.3f, boresite=%.3f, ix=%.3f, iy=%.3f, iz=%.3f}",
            beamAzimuthError, boresiteError, interferometerXError,
            interferometerYError, interferometerZError);
    }
}
