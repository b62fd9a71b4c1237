package superdarn.fov.model;

import java.util.Locale;

/**
 * 某一视场假设下的传播路径解
 *
 * 仰角、虚高及其误差、跳数、电离层区域和到第一个反射点的距离。
 * 无法求解的量以NaN表示（区域为空字符串）。
 */
public class PropagationSolution {

    private final double elevation;           // 度
    private final double elevationError;      // 度
    private final double virtualHeight;       // km
    private final double virtualHeightError;  // km
    private final double hop;
    private final String region;
    private final double distance;            // km

    public PropagationSolution(double elevation, double elevationError,
                               double virtualHeight, double virtualHeightError,
                               double hop, String region, double distance) {
        this.elevation = elevation;
        this.elevationError = elevationError;
        this.virtualHeight = virtualHeight;
        this.virtualHeightError = virtualHeightError;
        this.hop = hop;
        this.region = region == null ? "" : region;
        this.distance = distance;
    }

    /**
     * 不可解的传播路径
     */
    public static PropagationSolution unresolved() {
        return new PropagationSolution(Double.NaN, Double.NaN, Double.NaN, Double.NaN,
            Double.NaN, "", Double.NaN);
    }

    public double getElevation() { return elevation; }
    public double getElevationError() { return elevationError; }
    public double getVirtualHeight() { return virtualHeight; }
    public double getVirtualHeightError() { return virtualHeightError; }
    public double getHop() { return hop; }
    public String getRegion() { return region; }
    public double getDistance() { return distance; }

    public boolean hasElevation() {
        return !Double.isNaN(elevation);
    }

    /**
     * @return 跳数有限且区域为单个字母
     */
    public boolean isGoodPath() {
        return !Double.isNaN(hop) && region.length() == 1;
    }

    /**
     * 传播路径键，例如 "0.5F"、"1.5E"
     */
    public String pathKey() {
        return String.format(Locale.ROOT, "%.1f%s", hop, region);
    }

    @Override
    public String toString() {
        return String.format(Locale.ROOT, "PropagationSolution{elv=%.2f, vh=%.1f, hop=%.1f, region='%s', dist=%.1f}",
            elevation, virtualHeight, hop, region, distance);
    }
}
