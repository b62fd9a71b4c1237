package superdarn.fov;

import org.junit.jupiter.api.Test;
import superdarn.RadarFixtures;
import superdarn.fov.calculator.VirtualHeightModel;
import superdarn.fov.model.BackscatterPoint;
import superdarn.fov.model.PropagationSolution;
import superdarn.fov.model.RadarBeam;
import superdarn.fov.model.RadarGeometry;
import superdarn.fov.model.ResolvedPoint;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class BeamFitUpdaterTest {

    private static final double EARTH_RADIUS = 6360.0;

    private final RadarGeometry geometry = RadarFixtures.geometry();
    private final BeamFitUpdater updater = new BeamFitUpdater(FovConfig.defaults());

    @Test
    void ionosphericPointGetsHalfHopFRegionPath() {
        double phi0 = RadarFixtures.phaseFor(geometry, 7, 20.0, RadarFixtures.TFREQ, 0.0);
        RadarBeam beam = RadarFixtures.beam(7, RadarFixtures.T0)
            .addPoint(new BackscatterPoint(15, phi0, 0.1, 20.0, 0))
            .build();

        List<ResolvedPoint> points = updater.update(beam, geometry, EARTH_RADIUS, 0.0, Double.NaN);

        assertThat(points).hasSize(1);
        ResolvedPoint point = points.get(0);
        assertThat(point.getFovFlag()).isZero();
        PropagationSolution front = point.getFront();
        double distance = VirtualHeightModel.slantDistance(15, 300.0, 1200.0, 0.5);
        assertThat(front.getElevation()).isCloseTo(20.0, within(0.01));
        assertThat(front.getHop()).isEqualTo(0.5);
        assertThat(front.getRegion()).isEqualTo("F");
        assertThat(front.getDistance()).isCloseTo(distance, within(1.0e-9));
        assertThat(front.getVirtualHeight()).isCloseTo(
            new VirtualHeightModel(EARTH_RADIUS).virtualHeight(distance, front.getElevation()), within(1.0e-6));
    }

    @Test
    void groundScatterClusterUsesOneHop() {
        RadarBeam.Builder builder = RadarFixtures.beam(7, RadarFixtures.T0);
        for (int rg = 30; rg < 40; rg++) {
            double phi0 = RadarFixtures.phaseFor(geometry, 7, 15.0, RadarFixtures.TFREQ, 0.0);
            builder.addPoint(new BackscatterPoint(rg, phi0, 0.1, 10.0, 1));
        }

        List<ResolvedPoint> points = updater.update(builder.build(), geometry, EARTH_RADIUS, 0.0, Double.NaN);

        for (ResolvedPoint point : points) {
            assertThat(point.getGroundScatterFlag()).isEqualTo(1);
            assertThat(point.getFront().getHop()).isEqualTo(1.0);
            assertThat(point.getFront().getRegion()).isEqualTo("F");
        }
    }

    @Test
    void isolatedGroundScatterIsRejected() {
        double phi0 = RadarFixtures.phaseFor(geometry, 7, 20.0, RadarFixtures.TFREQ, 0.0);
        RadarBeam beam = RadarFixtures.beam(7, RadarFixtures.T0)
            .addPoint(new BackscatterPoint(15, phi0, 0.1, 20.0, 1))
            .build();

        ResolvedPoint point = updater.update(beam, geometry, EARTH_RADIUS, 0.0, Double.NaN).get(0);

        assertThat(point.getGroundScatterFlag()).isEqualTo(-1);
        assertThat(point.getFront().getHop()).isEqualTo(0.5);
    }

    @Test
    void negativePowerHasNoPath() {
        double phi0 = RadarFixtures.phaseFor(geometry, 7, 20.0, RadarFixtures.TFREQ, 0.0);
        RadarBeam beam = RadarFixtures.beam(7, RadarFixtures.T0)
            .addPoint(new BackscatterPoint(15, phi0, 0.1, -1.0, 0))
            .build();

        ResolvedPoint point = updater.update(beam, geometry, EARTH_RADIUS, 0.0, Double.NaN).get(0);

        assertThat(point.getFront().isGoodPath()).isFalse();
        assertThat(point.getBack().isGoodPath()).isFalse();
    }
}
