package superdarn.tdiff;

import org.junit.jupiter.api.Test;
import superdarn.RadarFixtures;
import superdarn.fov.model.PropagationSolution;
import superdarn.fov.model.ResolvedBeam;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CalibrationSampleSelectorTest {

    private static final Instant T0 = RadarFixtures.T0;

    private final FrequencyBands bands = new FrequencyBands(new int[] {0, 1},
        new double[] {10000.0, 12000.0}, new double[] {11000.0, 13000.0});
    private final PropagationSolution back = new PropagationSolution(40.0, 0.1, 450.0, 5.0, 0.5, "F", 700.0);

    private List<ResolvedBeam> beams() {
        List<ResolvedBeam> beams = new ArrayList<>();
        beams.add(RadarFixtures.resolvedBeam(7, T0, 10, RadarFixtures.solution(20.0, 300.0, 0.5, "F"), back));
        beams.add(RadarFixtures.resolvedBeam(7, T0.plus(Duration.ofMinutes(1)), 40,
            RadarFixtures.solution(20.0, 300.0, 0.5, "F"), back));
        beams.add(RadarFixtures.resolvedBeam(3, T0, 10, RadarFixtures.solution(20.0, 300.0, 0.5, "F"), back));
        beams.add(RadarFixtures.resolvedBeam(7, T0.plus(Duration.ofHours(2)), 12,
            RadarFixtures.solution(20.0, 300.0, 0.5, "F"), back));
        return beams;
    }

    @Test
    void selectsMatchingBeamWithinGatesAndWindow() {
        CalibrationSampleSelector selector = CalibrationSampleSelector.builder(153, 7, 1)
            .rangeGates(0, 30)
            .window(T0, T0.plus(Duration.ofMinutes(30)))
            .build();

        List<CalibrationSample> samples = selector.select(beams(), bands);

        assertThat(samples).hasSize(1);
        CalibrationSample sample = samples.get(0);
        assertThat(sample.getBeamNumber()).isEqualTo(7);
        assertThat(sample.getFovFlag()).isEqualTo(1);
        assertThat(sample.getDistance()).isEqualTo(600.0);
        assertThat(sample.getTransmitFrequency()).isEqualTo(RadarFixtures.TFREQ);
    }

    @Test
    void defaultsKeepEveryGateAndTime() {
        assertThat(CalibrationSampleSelector.builder(153, 7, 1).build().select(beams(), bands)).hasSize(3);
        assertThat(CalibrationSampleSelector.builder(154, 7, 1).build().select(beams(), bands)).isEmpty();
    }

    @Test
    void windowsAreClosedAndCombined() {
        CalibrationSampleSelector selector = CalibrationSampleSelector.builder(153, 7, 1)
            .window(T0.plus(Duration.ofMinutes(1)), T0.plus(Duration.ofMinutes(1)))
            .window(T0.plus(Duration.ofHours(1)), T0.plus(Duration.ofHours(2)))
            .build();

        List<CalibrationSample> samples = selector.select(beams(), bands);

        assertThat(samples).hasSize(2);
    }

    @Test
    void assignedBackFieldOfViewUsesBackDistance() {
        List<ResolvedBeam> beams = beams();
        RadarFixtures.only(beams.get(0)).assign(-1, 1);

        List<CalibrationSample> samples = CalibrationSampleSelector.builder(153, 7, 1)
            .fovFlag(-1)
            .build()
            .select(beams, bands);

        assertThat(samples).hasSize(1);
        assertThat(samples.get(0).getFovFlag()).isEqualTo(-1);
        assertThat(samples.get(0).getDistance()).isEqualTo(700.0);
    }

    @Test
    void pointFiltersApply() {
        assertThat(CalibrationSampleSelector.builder(153, 7, 1).minPower(25.0).build().select(beams(), bands))
            .isEmpty();
        assertThat(CalibrationSampleSelector.builder(153, 7, 1).groundScatterFlag(1).build().select(beams(), bands))
            .isEmpty();
        assertThat(CalibrationSampleSelector.builder(153, 7, 1).groundScatterFlag(0).build().select(beams(), bands))
            .hasSize(3);
    }

    @Test
    void otherOrUndefinedBandsSelectNothing() {
        assertThat(CalibrationSampleSelector.builder(153, 7, 0).build().select(beams(), bands)).isEmpty();
        assertThat(CalibrationSampleSelector.builder(153, 7, 5).build().select(beams(), bands)).isEmpty();
    }

    @Test
    void rejectsInvalidLimits() {
        assertThatThrownBy(() -> CalibrationSampleSelector.builder(153, 7, 1).rangeGates(10, 5).build())
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new CalibrationSampleSelector.TimeWindow(T0, T0.minusSeconds(1)))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
