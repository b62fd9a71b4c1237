package superdarn.tdiff;

import org.hipparchus.util.FastMath;
import superdarn.fov.model.RadarGeometry;

import java.util.List;

/**
 * 以虚高为位置的分布目标函数
 *
 * h = sqrt(d^2 + R^2 + 2dR·sin(elv)) - R
 */
public class VirtualHeightDistribution extends BackscatterDistribution {

    private final double earthRadius;

    /**
     * @param earthRadius 地球半径（km）
     * @param referenceHeight 参考虚高（km）
     */
    public VirtualHeightDistribution(RadarGeometry geometry, double earthRadius,
                                     List<CalibrationSample> samples, double referenceHeight) {
        super(geometry, samples, referenceHeight);
        if (!(earthRadius > 0.0)) {
            throw new IllegalArgumentException("Earth radius must be positive: " + earthRadius);
        }
        this.earthRadius = earthRadius;
    }

    @Override
    protected double locate(CalibrationSample sample, double elevation) {
        double d = sample.getDistance();
        return FastMath.sqrt(d * d + earthRadius * earthRadius
            + 2.0 * d * earthRadius * FastMath.sin(elevation)) - earthRadius;
    }

    @Override
    public VirtualHeightDistribution withReference(double referenceHeight) {
        return new VirtualHeightDistribution(geometry, earthRadius, samples, referenceHeight);
    }

    public double getEarthRadius() {
        return earthRadius;
    }
}
