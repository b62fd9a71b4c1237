package superdarn.tdiff;

import superdarn.fov.model.BackscatterPoint;
import superdarn.fov.model.FieldOfView;
import superdarn.fov.model.PropagationSolution;
import superdarn.fov.model.RadarBeam;
import superdarn.fov.model.ResolvedBeam;
import superdarn.fov.model.ResolvedPoint;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.logging.Logger;

/**
 * 从已解算的波束中挑选标定用回波
 *
 * 条件：观测模式、波束号、频段一致，功率不低于下限，距离门在 [minRg, maxRg] 内，
 * 可选的视场标志和地面散射标志，以及可选的时间段（闭区间，任一命中即可）。
 * 视场未确定的点按前视场取距离和标志。
 */
public class CalibrationSampleSelector {

    private static final Logger logger = Logger.getLogger(CalibrationSampleSelector.class.getName());

    private final int programId;
    private final int beamNumber;
    private final int band;
    private final double minPower;
    private final int minRangeGate;
    private final int maxRangeGate;
    private final Integer fovFlag;
    private final Integer groundScatterFlag;
    private final List<TimeWindow> windows;

    private CalibrationSampleSelector(Builder builder) {
        this.programId = builder.programId;
        this.beamNumber = builder.beamNumber;
        this.band = builder.band;
        this.minPower = builder.minPower;
        this.minRangeGate = builder.minRangeGate;
        this.maxRangeGate = builder.maxRangeGate;
        this.fovFlag = builder.fovFlag;
        this.groundScatterFlag = builder.groundScatterFlag;
        this.windows = Collections.unmodifiableList(new ArrayList<>(builder.windows));
    }

    public static Builder builder(int programId, int beamNumber, int band) {
        return new Builder(programId, beamNumber, band);
    }

    /**
     * @param beams 已解算的波束
     * @param bands 该雷达的频段表
     * @return 满足条件的回波，频段未定义时为空
     */
    public List<CalibrationSample> select(List<ResolvedBeam> beams, FrequencyBands bands) {
        List<CalibrationSample> samples = new ArrayList<>();
        if (!bands.hasBand(band)) {
            logger.warning("Undefined frequency band " + band);
            return samples;
        }
        for (ResolvedBeam resolved : beams) {
            RadarBeam beam = resolved.getBeam();
            if (beam.getProgramId() != programId || beam.getBeamNumber() != beamNumber
                || !inWindow(beam.getTime())
                || bands.bandFor(beam.getTransmitFrequency()) != band) {
                continue;
            }
            for (ResolvedPoint p : resolved.getPoints()) {
                if (accepts(p)) {
                    samples.add(toSample(p, beam));
                }
            }
        }
        logger.fine(String.format("Selected %d samples for cp %d beam %d band %d",
            samples.size(), programId, beamNumber, band));
        return samples;
    }

    private boolean accepts(ResolvedPoint p) {
        BackscatterPoint point = p.getPoint();
        if (!(point.getPowerLambda() >= minPower)) {
            return false;
        }
        if (point.getRangeGate() < minRangeGate || point.getRangeGate() > maxRangeGate) {
            return false;
        }
        if (fovFlag != null && p.getFovFlag() != fovFlag) {
            return false;
        }
        return groundScatterFlag == null || point.getGroundScatterFlag() == groundScatterFlag;
    }

    private boolean inWindow(Instant time) {
        if (windows.isEmpty()) {
            return true;
        }
        for (TimeWindow w : windows) {
            if (w.contains(time)) {
                return true;
            }
        }
        return false;
    }

    private static CalibrationSample toSample(ResolvedPoint p, RadarBeam beam) {
        FieldOfView fov = FieldOfView.fromFlag(p.getFovFlag());
        if (fov == null) {
            fov = FieldOfView.FRONT;
        }
        PropagationSolution solution = p.getSolution(fov);
        BackscatterPoint point = p.getPoint();
        return new CalibrationSample(point.getPhi0(), point.getPhi0Error(), fov.getFlag(),
            beam.getBeamNumber(), beam.getTransmitFrequency(), solution.getDistance());
    }

    /**
     * 闭区间时间段
     */
    public static class TimeWindow {
        private final Instant start;
        private final Instant end;

        public TimeWindow(Instant start, Instant end) {
            if (start == null || end == null || end.isBefore(start)) {
                throw new IllegalArgumentException("Invalid time window: " + start + " to " + end);
            }
            this.start = start;
            this.end = end;
        }

        public boolean contains(Instant time) {
            return !time.isBefore(start) && !time.isAfter(end);
        }

        public Instant getStart() { return start; }
        public Instant getEnd() { return end; }
    }

    public static class Builder {
        private final int programId;
        private final int beamNumber;
        private final int band;
        private double minPower = 0.0;
        private int minRangeGate = 0;
        private int maxRangeGate = 75;
        private Integer fovFlag;
        private Integer groundScatterFlag;
        private final List<TimeWindow> windows = new ArrayList<>();

        private Builder(int programId, int beamNumber, int band) {
            this.programId = programId;
            this.beamNumber = beamNumber;
            this.band = band;
        }

        public Builder minPower(double dB) { this.minPower = dB; return this; }
        public Builder rangeGates(int min, int max) { this.minRangeGate = min; this.maxRangeGate = max; return this; }
        public Builder fovFlag(Integer flag) { this.fovFlag = flag; return this; }
        public Builder groundScatterFlag(Integer flag) { this.groundScatterFlag = flag; return this; }
        public Builder window(Instant start, Instant end) { this.windows.add(new TimeWindow(start, end)); return this; }

        public CalibrationSampleSelector build() {
            if (minRangeGate > maxRangeGate) {
                throw new IllegalArgumentException(String.format(
                    "Minimum range gate %d exceeds maximum %d", minRangeGate, maxRangeGate));
            }
            return new CalibrationSampleSelector(this);
        }
    }
}
