package superdarn.fov;

import superdarn.fov.model.RadarGeometry;

import java.time.Instant;

/**
 * 雷达硬件几何参数来源
 */
public interface RadarGeometryProvider {

    /**
     * @param stationId 雷达站号
     * @param time 观测时间
     * @return 该时刻有效的几何参数，未知时返回null
     */
    RadarGeometry geometryFor(int stationId, Instant time);
}
