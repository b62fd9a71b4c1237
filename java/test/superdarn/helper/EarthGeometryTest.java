package superdarn.helper;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class EarthGeometryTest {

    private final EarthGeometry earth = new EarthGeometry();

    @Test
    void radiusFollowsWgs84() {
        assertThat(earth.radiusAt(0.0, 0.0)).isCloseTo(6378.137, within(1.0e-6));
        assertThat(earth.radiusAt(90.0, 0.0)).isCloseTo(6356.752, within(1.0e-3));
        assertThat(earth.radiusAt(62.32, 26.61)).isBetween(6356.752, 6378.137);
    }

    @Test
    void lookingNorthIncreasesLatitude() {
        double start = earth.latitudeAlongView(62.32, 26.61, 0.0, 0.0, 0.0, 0.0);
        assertThat(start).isCloseTo(62.32, within(1.0e-9));

        double north = earth.latitudeAlongView(62.32, 26.61, 0.0, 0.0, 0.0, 100.0);
        assertThat(north - 62.32).isBetween(0.85, 0.95);

        double south = earth.latitudeAlongView(62.32, 26.61, 0.0, 180.0, 20.0, 100.0);
        assertThat(south).isLessThan(62.32);
    }

    @Test
    void missingElevationGivesNan() {
        assertThat(earth.latitudeAlongView(62.32, 26.61, 0.0, 0.0, Double.NaN, 100.0)).isNaN();
        assertThat(earth.pointAlongView(62.32, 26.61, 0.0, 0.0, 10.0, Double.NaN)).isNull();
    }
}
