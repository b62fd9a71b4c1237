package superdarn.tdiff;

import org.hipparchus.util.FastMath;
import superdarn.fov.model.RadarGeometry;
import superdarn.helper.EarthGeometry;

import java.util.List;

/**
 * 以反射点地理纬度为位置的分布目标函数
 *
 * 适用于已知回波来自某一纬度的情形（如加热器激发的人工回波）。
 */
public class LatitudeDistribution extends BackscatterDistribution {

    private final EarthGeometry earth;

    public LatitudeDistribution(RadarGeometry geometry, EarthGeometry earth,
                                List<CalibrationSample> samples, double referenceLatitude) {
        super(geometry, samples, referenceLatitude);
        if (earth == null) {
            throw new IllegalArgumentException("Earth geometry is required");
        }
        this.earth = earth;
    }

    @Override
    protected double locate(CalibrationSample sample, double elevation) {
        return earth.latitudeAlongView(geometry.getGeoLatitude(), geometry.getGeoLongitude(),
            geometry.getAltitude(), geometry.beamToAzimuth(sample.getBeamNumber()),
            FastMath.toDegrees(elevation), sample.getDistance());
    }

    @Override
    public LatitudeDistribution withReference(double referenceLatitude) {
        return new LatitudeDistribution(geometry, earth, samples, referenceLatitude);
    }
}
