package superdarn.fov.model;

import org.hipparchus.geometry.euclidean.threed.Vector3D;
import org.hipparchus.util.FastMath;

/**
 * 雷达硬件几何参数
 *
 * 站址、天线阵朝向、干涉仪相对主阵的偏移以及tdiff。每个雷达/时期加载一次，只读。
 */
public class RadarGeometry {

    private final int stationId;
    private final double geoLatitude;      // 地理纬度（度）
    private final double geoLongitude;     // 地理经度（度）
    private final double altitude;         // 海拔（km）
    private final double boresite;         // 视轴方位角（度）
    private final double beamSeparation;   // 波束间隔（度）
    private final int maxBeam;
    private final int maxGate;
    private final Vector3D interferometer; // 干涉仪偏移（米）
    private final double phaseDifference;  // phidiff，±1
    private final double tdiff;            // 微秒
    private final double tdiffError;       // 微秒

    public RadarGeometry(int stationId, double geoLatitude, double geoLongitude,
                         double altitude, double boresite, double beamSeparation,
                         int maxBeam, int maxGate, Vector3D interferometer,
                         double phaseDifference, double tdiff, double tdiffError) {
        if (maxBeam <= 0 || maxGate <= 0) {
            throw new IllegalArgumentException(String.format(
                "beam and gate counts must be positive: maxBeam=%d, maxGate=%d", maxBeam, maxGate));
        }
        if (interferometer == null || interferometer.getNorm() <= 0.0) {
            throw new IllegalArgumentException("interferometer offset must be a non-zero vector");
        }
        this.stationId = stationId;
        this.geoLatitude = geoLatitude;
        this.geoLongitude = geoLongitude;
        this.altitude = altitude;
        this.boresite = boresite;
        this.beamSeparation = beamSeparation;
        this.maxBeam = maxBeam;
        this.maxGate = maxGate;
        this.interferometer = interferometer;
        this.phaseDifference = phaseDifference;
        this.tdiff = tdiff;
        this.tdiffError = tdiffError;
    }

    /**
     * 返回替换了tdiff的副本
     */
    public RadarGeometry withTdiff(double newTdiff, double newTdiffError) {
        return new RadarGeometry(stationId, geoLatitude, geoLongitude, altitude, boresite,
            beamSeparation, maxBeam, maxGate, interferometer, phaseDifference,
            newTdiff, newTdiffError);
    }

    /**
     * 波束号转换为方位角
     *
     * @param beamNumber 波束号（可以是非整数）
     * @return 方位角（度）
     */
    public double beamToAzimuth(double beamNumber) {
        return boresite - ((maxBeam - 1) / 2.0 - beamNumber) * beamSeparation;
    }

    /**
     * @param beamNumber 波束号
     * @return 波束相对视轴夹角的余弦
     */
    public double cosBeamOffset(double beamNumber) {
        return FastMath.cos(FastMath.toRadians(beamToAzimuth(beamNumber) - boresite));
    }

    /**
     * @return 天线间距（米）
     */
    public double getAntennaSeparation() {
        return interferometer.getNorm();
    }

    /**
     * @return 干涉仪在主阵前方为1，否则为-1
     */
    public double getPhaseSign() {
        return interferometer.getY() > 0.0 ? 1.0 : -1.0;
    }

    /**
     * @return 干涉仪与主阵高度差引起的仰角修正（弧度）
     */
    public double getElevationCorrection() {
        return getPhaseSign() * phaseDifference
            * FastMath.asin(interferometer.getZ() / getAntennaSeparation());
    }

    public int getStationId() { return stationId; }
    public double getGeoLatitude() { return geoLatitude; }
    public double getGeoLongitude() { return geoLongitude; }
    public double getAltitude() { return altitude; }
    public double getBoresite() { return boresite; }
    public double getBeamSeparation() { return beamSeparation; }
    public int getMaxBeam() { return maxBeam; }
    public int getMaxGate() { return maxGate; }
    public Vector3D getInterferometer() { return interferometer; }
    public double getPhaseDifference() { return phaseDifference; }
    public double getTdiff() { return tdiff; }
    public double getTdiffError() { return tdiffError; }

    @Override
    public String toString() {
        return String.format("RadarGeometry{stid=%d, lat=%.3f, lon=%.3f, boresite=%.2f, beams=%d, gates=%d, tdiff=%.4f}",
            stationId, geoLatitude, geoLongitude, boresite, maxBeam, maxGate, tdiff);
    }
}
