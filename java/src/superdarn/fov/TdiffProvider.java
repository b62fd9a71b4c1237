package superdarn.fov;

import java.time.Instant;

/**
 * tdiff 来源，例如按频段标定的结果
 */
public interface TdiffProvider {

    /**
     * @param stationId 雷达站号
     * @param time 观测时间
     * @param tfreq 发射频率（kHz）
     * @return tdiff（微秒），未知时返回NaN
     */
    double tdiffFor(int stationId, Instant time, double tfreq);

    /**
     * @return tdiff误差（微秒），未知时返回NaN
     */
    default double tdiffErrorFor(int stationId, Instant time, double tfreq) {
        return Double.NaN;
    }
}
