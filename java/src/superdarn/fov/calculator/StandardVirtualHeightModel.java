package superdarn.fov.calculator;

import org.hipparchus.util.FastMath;

/**
 * 标准虚高模型
 *
 * 近距离线性增至115 km，中距离在115 km与参考高度间线性过渡，远距离取最大虚高。
 * 电离层跳（非整数跳）与地面跳（整数跳）使用不同的过渡距离。
 */
public class StandardVirtualHeightModel implements EmpiricalHeightModel {

    private static final double DEFAULT_MAX_HEIGHT = 400.0;   // km
    private static final double DEFAULT_ALTITUDE = 300.0;     // km
    private static final double E_LAYER_HEIGHT = 115.0;       // km

    private final double maxHeight;
    private final double altitude;
    private final double earthRadius;

    public StandardVirtualHeightModel() {
        this(DEFAULT_MAX_HEIGHT, DEFAULT_ALTITUDE, 6371.0);
    }

    /**
     * @param maxHeight 最大虚高（km）
     * @param altitude 参考高度（km），NaN表示由仰角估计
     * @param earthRadius 地球半径（km），用于由仰角估计参考高度
     */
    public StandardVirtualHeightModel(double maxHeight, double altitude, double earthRadius) {
        this.maxHeight = maxHeight;
        this.altitude = altitude;
        this.earthRadius = earthRadius;
    }

    /**
     * @param slantRange 总斜距（km），内部按跳数换算为单跳斜距
     */
    @Override
    public double virtualHeight(double slantRange, double hop) {
        return adjustedVirtualHeight(slantRange / (2.0 * hop), hop, Double.NaN);
    }

    /**
     * @param adjustedRange 已按跳数换算的斜距（km）
     * @param hop 跳数
     * @param elevation 仰角（度），参考高度为NaN时用于估计参考高度，可为NaN
     * @return 虚高（km）
     */
    public double adjustedVirtualHeight(double adjustedRange, double hop, double elevation) {
        double alt = altitude;
        if (Double.isNaN(alt)) {
            if (Double.isNaN(elevation)) {
                alt = DEFAULT_ALTITUDE;
            } else {
                alt = FastMath.sqrt(earthRadius * earthRadius + adjustedRange * adjustedRange
                    + 2.0 * adjustedRange * earthRadius * FastMath.sin(FastMath.toRadians(elevation)))
                    - earthRadius;
            }
        }

        boolean groundHop = hop == FastMath.floor(hop);
        double low = groundHop ? 300.0 : 600.0;
        double high = groundHop ? 500.0 : 800.0;

        double vheight;
        if (adjustedRange < 150.0) {
            vheight = adjustedRange / 150.0 * E_LAYER_HEIGHT;
        } else if (adjustedRange <= low) {
            vheight = E_LAYER_HEIGHT;
        } else if (adjustedRange <= high) {
            vheight = E_LAYER_HEIGHT + (adjustedRange - low) / 200.0 * (alt - E_LAYER_HEIGHT);
        } else {
            vheight = maxHeight;
        }

        if (hop > 1.0 && !Double.isNaN(vheight)) {
            vheight *= groundHop ? 2.0 * (hop - 0.5) : 2.0 * hop;
        }
        return vheight;
    }
}
