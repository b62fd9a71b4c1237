package superdarn.fov.calculator;

import org.hipparchus.geometry.euclidean.threed.Vector3D;
import org.hipparchus.util.FastMath;
import org.junit.jupiter.api.Test;
import superdarn.RadarFixtures;
import superdarn.fov.model.FieldOfView;
import superdarn.fov.model.GeometryErrors;
import superdarn.fov.model.RadarGeometry;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class ElevationModelTest {

    private final RadarGeometry geometry = RadarFixtures.geometry();
    private final ElevationModel model = new ElevationModel(geometry);

    @Test
    void recoversElevationUsedToBuildPhase() {
        for (double elv : new double[] {10.0, 25.0, 35.0}) {
            double phi0 = RadarFixtures.phaseFor(geometry, 7, elv, RadarFixtures.TFREQ, 0.0);
            ElevationResult result = model.calculate(phi0, 0.01, 7, RadarFixtures.TFREQ, 0.0, 0.0,
                GeometryErrors.NONE, 0, FieldOfView.FRONT);
            assertThat(result.isResolved()).isTrue();
            assertThat(result.getElevation()).isCloseTo(elv, within(1.0e-6));
        }
    }

    @Test
    void removesCablePhaseOffset() {
        double phi0 = RadarFixtures.phaseFor(geometry, 3, 20.0, RadarFixtures.TFREQ, 0.35);
        ElevationResult result = model.calculate(phi0, 0.01, 3, RadarFixtures.TFREQ, 0.35, 0.0,
            GeometryErrors.NONE, 0, FieldOfView.FRONT);
        assertThat(result.getElevation()).isCloseTo(20.0, within(1.0e-6));
    }

    @Test
    void backFieldOfViewGivesDifferentElevation() {
        double phi0 = RadarFixtures.phaseFor(geometry, 7, 25.0, RadarFixtures.TFREQ, 0.0);
        ElevationResult back = model.calculate(phi0, 0.01, 7, RadarFixtures.TFREQ, 0.0, 0.0,
            GeometryErrors.NONE, 0, FieldOfView.BACK);
        assertThat(back.isResolved()).isTrue();
        assertThat(Math.abs(back.getElevation() - 25.0)).isGreaterThan(1.0);
    }

    @Test
    void aliasWidensWindowToHigherElevation() {
        double phi0 = RadarFixtures.phaseFor(geometry, 7, 25.0, RadarFixtures.TFREQ, 0.0);
        ElevationResult direct = model.calculate(phi0, 0.01, 7, RadarFixtures.TFREQ, 0.0, 0.0,
            GeometryErrors.NONE, 0, FieldOfView.FRONT);
        ElevationResult aliased = model.calculate(phi0, 0.01, 7, RadarFixtures.TFREQ, 0.0, 0.0,
            GeometryErrors.NONE, 1, FieldOfView.FRONT);
        assertThat(aliased.getElevation()).isGreaterThan(direct.getElevation());
    }

    @Test
    void propagatesPhaseErrorInDegrees() {
        double phi0 = RadarFixtures.phaseFor(geometry, 7, 25.0, RadarFixtures.TFREQ, 0.0);
        ElevationResult small = model.calculate(phi0, 0.01, 7, RadarFixtures.TFREQ, 0.0, 0.0,
            GeometryErrors.NONE, 0, FieldOfView.FRONT);
        ElevationResult large = model.calculate(phi0, 0.1, 7, RadarFixtures.TFREQ, 0.0, 0.0,
            GeometryErrors.NONE, 0, FieldOfView.FRONT);
        assertThat(small.getElevationError()).isPositive();
        assertThat(large.getElevationError()).isCloseTo(10.0 * small.getElevationError(), within(1.0e-9));
    }

    @Test
    void missingPhaseIsUnresolved() {
        assertThat(model.calculate(Double.NaN, 0.1, 7, RadarFixtures.TFREQ, 0.0, 0.0,
            GeometryErrors.NONE, 0, FieldOfView.FRONT).isResolved()).isFalse();
        assertThat(model.calculate(0.0, 0.0, 7, RadarFixtures.TFREQ, 0.0, 0.0,
            GeometryErrors.NONE, 0, FieldOfView.FRONT).isResolved()).isFalse();
    }

    @Test
    void phaseOutsideWindowIsUnresolved() {
        // 天线间距1 m时允许的最大相位远小于观测相位
        RadarGeometry tiny = new RadarGeometry(1, 60.0, 0.0, 0.0, 0.0, 3.24, 16, 75,
            new Vector3D(0.0, 1.0, 0.0), 1.0, 0.0, 0.0);
        ElevationResult result = new ElevationModel(tiny).calculate(3.0, 0.1, 7, RadarFixtures.TFREQ,
            0.0, 0.0, GeometryErrors.NONE, 0, FieldOfView.FRONT);
        assertThat(result.isResolved()).isFalse();
        assertThat(result.getElevation()).isNaN();
    }

    @Test
    void radianFormAgreesWithFullCalculation() {
        double phi0 = RadarFixtures.phaseFor(geometry, 5, 18.0, RadarFixtures.TFREQ, 0.1);
        ElevationResult full = model.calculate(phi0, 0.01, 5, RadarFixtures.TFREQ, 0.1, 0.0,
            GeometryErrors.NONE, 0, FieldOfView.FRONT);
        double radians = model.elevationRadians(phi0, 0.01, 1, geometry.cosBeamOffset(5),
            RadarFixtures.TFREQ, 0.1, 0);
        assertThat(FastMath.toDegrees(radians)).isCloseTo(full.getElevation(), within(1.0e-9));
        assertThat(model.elevationRadians(phi0, 0.01, 0, geometry.cosBeamOffset(5),
            RadarFixtures.TFREQ, 0.1, 0)).isNaN();
    }

    @Test
    void cablePhaseOffsetIsLinearInTdiff() {
        assertThat(ElevationModel.cablePhaseOffset(10000.0, 0.0)).isZero();
        assertThat(ElevationModel.cablePhaseOffset(10000.0, 0.1))
            .isCloseTo(-2.0 * FastMath.PI, within(1.0e-12));
    }
}
