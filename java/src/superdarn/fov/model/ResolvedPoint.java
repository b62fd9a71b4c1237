package superdarn.fov.model;

/**
 * 视场判定后的观测点
 *
 * 保留原始观测，附加前/后视场的传播解、更新后的地面散射标志、
 * 视场标志及其历史（pastFov），以及所选视场对应的输出值。
 * 未确定视场（标志0）的点输出前视场的值，误差为NaN。
 */
public class ResolvedPoint {

    private final BackscatterPoint point;
    private final PropagationSolution front;
    private final PropagationSolution back;
    private final int groundScatterFlag;

    private int fovFlag;
    private int pastFov;
    private double elevation;
    private double elevationError;
    private double virtualHeight;
    private double virtualHeightError;
    private double hop;
    private String region;

    public ResolvedPoint(BackscatterPoint point, int groundScatterFlag,
                         PropagationSolution front, PropagationSolution back) {
        this.point = point;
        this.groundScatterFlag = groundScatterFlag;
        this.front = front;
        this.back = back;
        assign(0, 0);
    }

    /**
     * 设置视场标志和历史标志，并据此更新输出值
     *
     * @param flag 1=前，-1=后，0=未确定
     * @param past 被替换的视场标志
     */
    public void assign(int flag, int past) {
        this.fovFlag = flag;
        this.pastFov = past;
        FieldOfView fov = FieldOfView.fromFlag(flag);
        if (fov == null) {
            copyValues(front, false);
        } else {
            copyValues(getSolution(fov), true);
        }
    }

    /**
     * 改变视场标志，输出值改为指定视场的传播解（用于恢复历史视场）
     */
    public void reinstate(int flag, FieldOfView valuesFrom) {
        this.fovFlag = flag;
        this.pastFov = 0;
        copyValues(getSolution(valuesFrom), true);
    }

    private void copyValues(PropagationSolution s, boolean withErrors) {
        this.elevation = s.getElevation();
        this.virtualHeight = s.getVirtualHeight();
        this.hop = s.getHop();
        this.region = s.getRegion();
        this.elevationError = withErrors ? s.getElevationError() : Double.NaN;
        this.virtualHeightError = withErrors ? s.getVirtualHeightError() : Double.NaN;
    }

    public PropagationSolution getSolution(FieldOfView fov) {
        return fov == FieldOfView.FRONT ? front : back;
    }

    /**
     * @return 当前视场的传播解，未确定时为null
     */
    public PropagationSolution getAssignedSolution() {
        FieldOfView fov = FieldOfView.fromFlag(fovFlag);
        return fov == null ? null : getSolution(fov);
    }

    public boolean hasAnyElevation() {
        return front.hasElevation() || back.hasElevation();
    }

    public BackscatterPoint getPoint() { return point; }
    public int getRangeGate() { return point.getRangeGate(); }
    public PropagationSolution getFront() { return front; }
    public PropagationSolution getBack() { return back; }
    public int getGroundScatterFlag() { return groundScatterFlag; }
    public int getFovFlag() { return fovFlag; }
    public int getPastFov() { return pastFov; }
    public double getElevation() { return elevation; }
    public double getElevationError() { return elevationError; }
    public double getVirtualHeight() { return virtualHeight; }
    public double getVirtualHeightError() { return virtualHeightError; }
    public double getHop() { return hop; }
    public String getRegion() { return region; }

    @Override
    public String toString() {
        return String.format("ResolvedPoint{rg=%d, fov=%d, past=%d, elv=%.2f, vh=%.1f, hop=%.1f, region='%s'}",
            point.getRangeGate(), fovFlag, pastFov, elevation, virtualHeight, hop, region);
    }
}
