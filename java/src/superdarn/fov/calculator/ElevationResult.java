package superdarn.fov.calculator;

/**
 * 仰角计算结果
 */
public class ElevationResult {

    private static final ElevationResult UNRESOLVED = new ElevationResult(Double.NaN, Double.NaN, 0);

    private final double elevation;       // 度
    private final double elevationError;  // 度
    private final int phaseAmbiguity;

    public ElevationResult(double elevation, double elevationError, int phaseAmbiguity) {
        this.elevation = elevation;
        this.elevationError = elevationError;
        this.phaseAmbiguity = phaseAmbiguity;
    }

    public static ElevationResult unresolved() {
        return UNRESOLVED;
    }

    public double getElevation() { return elevation; }
    public double getElevationError() { return elevationError; }
    public int getPhaseAmbiguity() { return phaseAmbiguity; }

    public boolean isResolved() {
        return !Double.isNaN(elevation);
    }

    @Override
    public String toString() {
        return String.format("ElevationResult{elv=%.3f, err=%.3f, amb=%d}",
            elevation, elevationError, phaseAmbiguity);
    }
}
