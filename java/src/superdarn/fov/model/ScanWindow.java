package superdarn.fov.model;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 一次扫描的波束组
 *
 * 相同雷达程序、波束号单调变化、相邻波束时间间隔不超过驻留时间的若干倍。
 * 由波束流逐步构建，交给扫描视场判定后丢弃。
 */
public class ScanWindow {

    private final List<RadarBeam> beams = new ArrayList<>();
    private int direction = 0;

    public ScanWindow(RadarBeam first) {
        beams.add(first);
    }

    /**
     * 尝试把波束加入当前扫描
     *
     * @param beam 新波束
     * @param maxBeamStep 允许的最大波束号跳变
     * @return 加入成功返回true，否则说明当前扫描已结束
     */
    public boolean tryAdd(RadarBeam beam, int maxBeamStep) {
        RadarBeam last = beams.get(beams.size() - 1);
        int deltaBeam = beam.getBeamNumber() - last.getBeamNumber();
        if (deltaBeam == 0 || Math.abs(deltaBeam) > maxBeamStep
                || beam.getProgramId() != getProgramId()) {
            return false;
        }
        double deltaSeconds = (beam.getTime().toEpochMilli() - last.getTime().toEpochMilli()) / 1000.0;
        double dwellSeconds = beam.getIntegrationTime().toNanos() * 1.0e-9;
        if (deltaSeconds > 3.0 * Math.abs(deltaBeam) * dwellSeconds) {
            return false;
        }
        int sign = Integer.signum(deltaBeam);
        if (direction != 0 && direction != sign) {
            return false;
        }
        direction = sign;
        beams.add(beam);
        return true;
    }

    public List<RadarBeam> getBeams() {
        return Collections.unmodifiableList(beams);
    }

    public int size() {
        return beams.size();
    }

    public Instant getScanTime() {
        return beams.get(0).getTime();
    }

    public int getProgramId() {
        return beams.get(0).getProgramId();
    }

    @Override
    public String toString() {
        return String.format("ScanWindow{start=%s, cp=%d, beams=%d, direction=%d}",
            getScanTime(), getProgramId(), beams.size(), direction);
    }
}
