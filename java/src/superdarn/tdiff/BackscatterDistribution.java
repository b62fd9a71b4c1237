package superdarn.tdiff;

import org.hipparchus.stat.descriptive.moment.Mean;
import org.hipparchus.stat.descriptive.moment.StandardDeviation;
import org.hipparchus.util.FastMath;
import superdarn.fov.calculator.ElevationModel;
import superdarn.fov.model.RadarGeometry;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 回波位置分布相对参考位置的偏离程度
 *
 * f(tdiff) = sqrt((mean - ref)^2 + std^2)，std 为总体标准差。
 * 同时考察均值和离散度，避免出现分居参考位置两侧的双峰分布。
 * 没有任何可用位置时返回NaN。
 */
public abstract class BackscatterDistribution implements TdiffObjective {

    protected final RadarGeometry geometry;
    protected final List<CalibrationSample> samples;
    protected final double reference;
    private final ElevationModel elevationModel;

    protected BackscatterDistribution(RadarGeometry geometry, List<CalibrationSample> samples,
                                      double reference) {
        if (geometry == null) {
            throw new IllegalArgumentException("Radar geometry is required");
        }
        if (samples == null) {
            throw new IllegalArgumentException("Calibration samples are required");
        }
        this.geometry = geometry;
        this.samples = Collections.unmodifiableList(new ArrayList<>(samples));
        this.reference = reference;
        this.elevationModel = new ElevationModel(geometry);
    }

    @Override
    public double value(double tdiff) {
        if (Double.isNaN(tdiff)) {
            return Double.NaN;
        }
        List<Double> locations = new ArrayList<>(samples.size());
        for (CalibrationSample sample : samples) {
            double elv = elevationModel.elevationRadians(sample.getPhi0(), sample.getPhi0Error(),
                sample.getFovFlag(), geometry.cosBeamOffset(sample.getBeamNumber()),
                sample.getTransmitFrequency(), tdiff, 0);
            if (Double.isNaN(elv) || Double.isNaN(sample.getDistance())) {
                continue;
            }
            double loc = locate(sample, elv);
            if (!Double.isNaN(loc)) {
                locations.add(loc);
            }
        }
        return spread(locations, reference);
    }

    /**
     * 单个回波的位置
     *
     * @param elevation 仰角（弧度）
     * @return 位置，无法计算时为NaN
     */
    protected abstract double locate(CalibrationSample sample, double elevation);

    static double spread(List<Double> locations, double reference) {
        if (locations.isEmpty()) {
            return Double.NaN;
        }
        double[] values = new double[locations.size()];
        for (int i = 0; i < values.length; i++) {
            values[i] = locations.get(i);
        }
        double mean = new Mean().evaluate(values);
        double std = new StandardDeviation(false).evaluate(values);
        return FastMath.sqrt((mean - reference) * (mean - reference) + std * std);
    }

    @Override
    public double getReference() {
        return reference;
    }

    public List<CalibrationSample> getSamples() {
        return samples;
    }
}
