package superdarn.fov;

import superdarn.fov.model.RadarBeam;

/**
 * 按时间顺序提供波束记录
 */
public interface BeamSource {

    /**
     * @return 下一条波束记录，没有更多数据时返回null
     */
    RadarBeam next();
}
