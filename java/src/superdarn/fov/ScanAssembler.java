package superdarn.fov;

import superdarn.fov.model.RadarBeam;
import superdarn.fov.model.ScanWindow;

/**
 * 扫描组装器
 *
 * 把按时间排列的波束流切分为扫描：新波束无法加入当前扫描时，当前扫描结束，
 * 新波束开始下一次扫描。
 */
public class ScanAssembler {

    // 相邻波束号允许的最大跳变
    public static final int MAX_BEAM_STEP = 3;

    private ScanWindow current;

    /**
     * 加入一条波束
     *
     * @return 因此结束的扫描，当前扫描仍在进行时返回null
     */
    public ScanWindow add(RadarBeam beam) {
        if (current == null) {
            current = new ScanWindow(beam);
            return null;
        }
        if (current.tryAdd(beam, MAX_BEAM_STEP)) {
            return null;
        }
        ScanWindow completed = current;
        current = new ScanWindow(beam);
        return completed;
    }

    /**
     * 结束数据流，返回最后一次扫描
     *
     * @return 最后一次扫描，没有数据时返回null
     */
    public ScanWindow finish() {
        ScanWindow last = current;
        current = null;
        return last;
    }
}
