package superdarn.fov.model;

import java.time.Instant;
import java.util.Collections;
import java.util.List;

/**
 * 视场判定后的波束记录
 */
public class ResolvedBeam {

    private final RadarBeam beam;
    private final List<ResolvedPoint> points;
    private final double tdiff;
    private final double tdiffError;
    private final Instant scanTime;

    public ResolvedBeam(RadarBeam beam, List<ResolvedPoint> points,
                        double tdiff, double tdiffError, Instant scanTime) {
        if (beam.getPoints().size() != points.size()) {
            throw new IllegalArgumentException(String.format(
                "resolved point count %d does not match beam point count %d",
                points.size(), beam.getPoints().size()));
        }
        this.beam = beam;
        this.points = Collections.unmodifiableList(points);
        this.tdiff = tdiff;
        this.tdiffError = tdiffError;
        this.scanTime = scanTime;
    }

    /**
     * 查找指定距离门的观测点
     *
     * @return 点的索引，不存在时为-1
     */
    public int indexOfGate(int rangeGate) {
        for (int i = 0; i < points.size(); i++) {
            if (points.get(i).getRangeGate() == rangeGate) {
                return i;
            }
        }
        return -1;
    }

    public RadarBeam getBeam() { return beam; }
    public int getBeamNumber() { return beam.getBeamNumber(); }
    public Instant getTime() { return beam.getTime(); }
    public List<ResolvedPoint> getPoints() { return points; }
    public double getTdiff() { return tdiff; }
    public double getTdiffError() { return tdiffError; }
    public Instant getScanTime() { return scanTime; }

    @Override
    public String toString() {
        return String.format("ResolvedBeam{beam=%d, time=%s, scan=%s, points=%d, tdiff=%.4f}",
            beam.getBeamNumber(), beam.getTime(), scanTime, points.size(), tdiff);
    }
}
