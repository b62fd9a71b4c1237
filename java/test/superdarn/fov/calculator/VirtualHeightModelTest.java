package superdarn.fov.calculator;

import org.junit.jupiter.api.Test;
import superdarn.RadarFixtures;
import superdarn.fov.model.FieldOfView;
import superdarn.fov.model.GeometryErrors;
import superdarn.fov.model.RadarGeometry;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class VirtualHeightModelTest {

    private final VirtualHeightModel model = new VirtualHeightModel(6360.0);

    @Test
    void slantDistanceAndRangeGateAreInverse() {
        double d = VirtualHeightModel.slantDistance(20.0, 300.0, 1200.0, 0.5);
        assertThat(d).isCloseTo(1079.3, within(0.1));
        assertThat(VirtualHeightModel.rangeGateAt(d, 300.0, 1200.0)).isCloseTo(20.0, within(1.0e-9));
        assertThat(VirtualHeightModel.slantDistance(20.0, 300.0, 1200.0, 1.0)).isCloseTo(0.5 * d, within(1.0e-9));
    }

    @Test
    void heightInvertsBackToElevation() {
        for (double elv : new double[] {0.0, 12.5, 30.0, 45.0}) {
            double h = model.virtualHeight(800.0, elv);
            assertThat(model.elevationFromHeight(h, 800.0)).isCloseTo(elv, within(1.0e-9));
        }
    }

    @Test
    void elevationModelAndHeightModelComposeConsistently() {
        RadarGeometry geometry = RadarFixtures.geometry();
        ElevationModel elevationModel = new ElevationModel(geometry);
        double phi0 = RadarFixtures.phaseFor(geometry, 9, 22.0, RadarFixtures.TFREQ, 0.0);
        double elv = elevationModel.calculate(phi0, 0.01, 9, RadarFixtures.TFREQ, 0.0, 0.0,
            GeometryErrors.NONE, 0, FieldOfView.FRONT).getElevation();

        double h = model.virtualHeight(900.0, elv);
        assertThat(model.elevationFromHeight(h, 900.0)).isCloseTo(22.0, within(1.0e-6));
    }

    @Test
    void nanInputsGiveNan() {
        assertThat(model.virtualHeight(Double.NaN, 10.0)).isNaN();
        assertThat(model.virtualHeight(500.0, Double.NaN)).isNaN();
        assertThat(model.virtualHeightWithError(500.0, 0.0, Double.NaN, 0.1).getHeight()).isNaN();
        assertThat(model.elevationFromHeight(Double.NaN, 500.0)).isNaN();
    }

    @Test
    void impossibleTriangleGivesNan() {
        assertThat(model.elevationFromHeight(2000.0, 100.0)).isNaN();
    }

    @Test
    void heightErrorGrowsWithElevationError() {
        HeightResult exact = model.virtualHeightWithError(600.0, 0.0, 20.0, 0.0);
        HeightResult uncertain = model.virtualHeightWithError(600.0, 0.0, 20.0, 1.0);
        assertThat(exact.getError()).isZero();
        assertThat(uncertain.getError()).isPositive();
        assertThat(uncertain.getHeight()).isCloseTo(exact.getHeight(), within(1.0e-12));
    }

    @Test
    void rejectsNonPositiveRadius() {
        assertThatThrownBy(() -> new VirtualHeightModel(0.0)).isInstanceOf(IllegalArgumentException.class);
    }
}
