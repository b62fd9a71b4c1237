package superdarn.fov.calculator;

import org.hipparchus.util.FastMath;
import org.orekit.utils.Constants;

/**
 * 基于仰角的虚高模型
 *
 * 假设信号沿直线传播，以地球半径、半径加虚高和斜距构成三角形，由余弦定理求虚高。
 * 不检查虚高是否为正，合理性由 {@link PropagationValidator} 判断。
 */
public class VirtualHeightModel {

    private final double earthRadius;       // km
    private final double earthRadiusError;  // km

    /**
     * @param earthRadius 雷达所在纬度的地球半径（km）
     */
    public VirtualHeightModel(double earthRadius) {
        this(earthRadius, 0.0);
    }

    public VirtualHeightModel(double earthRadius, double earthRadiusError) {
        if (!(earthRadius > 0.0)) {
            throw new IllegalArgumentException("earth radius must be positive: " + earthRadius);
        }
        this.earthRadius = earthRadius;
        this.earthRadiusError = earthRadiusError;
    }

    /**
     * 距离门到第一个反射点的斜距
     *
     * @param rangeGate 距离门（可为非整数）
     * @param sampleSeparation smsep（微秒）
     * @param firstLagRange lagfr（微秒）
     * @param hop 跳数，0.5 表示直接电离层回波
     * @return 斜距（km）
     */
    public static double slantDistance(double rangeGate, double sampleSeparation,
                                       double firstLagRange, double hop) {
        return 5.0e-10 * Constants.SPEED_OF_LIGHT * (rangeGate * sampleSeparation + firstLagRange)
            / (2.0 * hop);
    }

    /**
     * 斜距对应的距离门，{@link #slantDistance} 的逆运算（0.5跳）
     */
    public static double rangeGateAt(double distance, double sampleSeparation, double firstLagRange) {
        return (distance / (5.0e-10 * Constants.SPEED_OF_LIGHT) - firstLagRange) / sampleSeparation;
    }

    /**
     * 虚高
     *
     * @param distance 到反射点的斜距（km）
     * @param elevation 仰角（度）
     * @return 虚高（km），输入为NaN时返回NaN
     */
    public double virtualHeight(double distance, double elevation) {
        if (Double.isNaN(distance) || Double.isNaN(elevation)) {
            return Double.NaN;
        }
        double sinElv = FastMath.sin(FastMath.toRadians(elevation));
        return FastMath.sqrt(distance * distance + earthRadius * earthRadius
            + 2.0 * distance * earthRadius * sinElv) - earthRadius;
    }

    /**
     * 虚高及误差
     *
     * @param distance 斜距（km）
     * @param distanceError 斜距误差（km）
     * @param elevation 仰角（度）
     * @param elevationError 仰角误差（度）
     */
    public HeightResult virtualHeightWithError(double distance, double distanceError,
                                               double elevation, double elevationError) {
        if (Double.isNaN(distance) || Double.isNaN(elevation)) {
            return HeightResult.unresolved();
        }
        double elvRad = FastMath.toRadians(elevation);
        double sinElv = FastMath.sin(elvRad);
        double hsqrt = FastMath.sqrt(distance * distance + earthRadius * earthRadius
            + 2.0 * distance * earthRadius * sinElv);
        double height = hsqrt - earthRadius;

        double termElv = 0.0;
        if (!Double.isNaN(elevationError) && elevationError > 0.0) {
            double t = distance * earthRadius * FastMath.cos(elvRad) / hsqrt;
            termElv = square(FastMath.toRadians(elevationError) * t);
        }
        double termRadius = 0.0;
        if (!Double.isNaN(earthRadiusError) && earthRadiusError > 0.0) {
            double t = (earthRadius + distance * sinElv) / hsqrt - 1.0;
            termRadius = square(earthRadiusError * t);
        }
        double termDist = 0.0;
        if (!Double.isNaN(distanceError) && distanceError > 0.0) {
            double t = (distance + earthRadius * sinElv) / hsqrt;
            termDist = square(distanceError * t);
        }
        return new HeightResult(height, FastMath.sqrt(termElv + termRadius + termDist));
    }

    /**
     * 由虚高和斜距反求仰角
     *
     * @return 仰角（度），三角形不成立时为NaN
     */
    public double elevationFromHeight(double height, double distance) {
        if (Double.isNaN(height) || Double.isNaN(distance) || distance <= 0.0) {
            return Double.NaN;
        }
        double top = earthRadius + height;
        double sinElv = (top * top - distance * distance - earthRadius * earthRadius)
            / (2.0 * distance * earthRadius);
        if (sinElv < -1.0 || sinElv > 1.0) {
            return Double.NaN;
        }
        return FastMath.toDegrees(FastMath.asin(sinElv));
    }

    public double getEarthRadius() {
        return earthRadius;
    }

    private static double square(double x) {
        return x * x;
    }
}
