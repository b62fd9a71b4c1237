package superdarn.helper;

import org.hipparchus.geometry.euclidean.threed.Vector3D;
import org.hipparchus.util.FastMath;
import org.orekit.bodies.GeodeticPoint;
import org.orekit.bodies.OneAxisEllipsoid;
import org.orekit.frames.Frame;
import org.orekit.frames.FramesFactory;
import org.orekit.time.AbsoluteDate;
import org.orekit.utils.Constants;

/**
 * WGS84 地球几何
 *
 * 只做地固坐标下的静态几何运算（不涉及时间尺度），因此以GCRF作为椭球的本体坐标系，
 * 不需要加载orekit-data。
 */
public class EarthGeometry {

    private static final double METERS_PER_KM = 1000.0;

    private final Frame bodyFrame;
    private final OneAxisEllipsoid earth;

    public EarthGeometry() {
        this.bodyFrame = FramesFactory.getGCRF();
        this.earth = new OneAxisEllipsoid(
            Constants.WGS84_EARTH_EQUATORIAL_RADIUS,
            Constants.WGS84_EARTH_FLATTENING,
            bodyFrame
        );
    }

    /**
     * 椭球面上某点到地心的距离
     *
     * @param latitude 地理纬度（度）
     * @param longitude 地理经度（度）
     * @return 地球半径（km）
     */
    public double radiusAt(double latitude, double longitude) {
        GeodeticPoint surface = new GeodeticPoint(
            FastMath.toRadians(latitude), FastMath.toRadians(longitude), 0.0);
        return earth.transform(surface).getNorm() / METERS_PER_KM;
    }

    /**
     * 沿视线方向直线传播一段距离后的位置
     *
     * @param latitude 起点地理纬度（度）
     * @param longitude 起点地理经度（度）
     * @param altitude 起点海拔（km）
     * @param azimuth 方位角（度，自北向东）
     * @param elevation 仰角（度）
     * @param distance 距离（km）
     * @return 终点的大地坐标，任一输入为NaN时返回null
     */
    public GeodeticPoint pointAlongView(double latitude, double longitude, double altitude,
                                        double azimuth, double elevation, double distance) {
        if (Double.isNaN(azimuth) || Double.isNaN(elevation) || Double.isNaN(distance)) {
            return null;
        }
        GeodeticPoint origin = new GeodeticPoint(FastMath.toRadians(latitude),
            FastMath.toRadians(longitude), altitude * METERS_PER_KM);

        double az = FastMath.toRadians(azimuth);
        double el = FastMath.toRadians(elevation);
        Vector3D horizontal = new Vector3D(FastMath.cos(az), origin.getNorth(),
                                           FastMath.sin(az), origin.getEast());
        Vector3D direction = new Vector3D(FastMath.cos(el), horizontal,
                                          FastMath.sin(el), origin.getZenith());

        Vector3D start = earth.transform(origin);
        Vector3D end = new Vector3D(1.0, start, distance * METERS_PER_KM, direction);
        return earth.transform(end, bodyFrame, AbsoluteDate.ARBITRARY_EPOCH);
    }

    /**
     * 视线终点的地理纬度
     *
     * @return 纬度（度），无法计算时为NaN
     */
    public double latitudeAlongView(double latitude, double longitude, double altitude,
                                    double azimuth, double elevation, double distance) {
        GeodeticPoint p = pointAlongView(latitude, longitude, altitude, azimuth, elevation, distance);
        return p == null ? Double.NaN : FastMath.toDegrees(p.getLatitude());
    }
}
