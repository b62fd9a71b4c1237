package superdarn.fov;

import org.junit.jupiter.api.Test;
import superdarn.RadarFixtures;
import superdarn.fov.model.PropagationSolution;
import superdarn.fov.model.ResolvedBeam;
import superdarn.fov.model.ResolvedPoint;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class TemporalContinuityResolverTest {

    private static final int ODD_ONE = 4;

    @Test
    void isolatedBackPointReturnsToPastFieldOfView() {
        List<ResolvedBeam> series = series(13);
        ResolvedPoint odd = RadarFixtures.only(series.get(ODD_ONE));
        odd.assign(-1, 1);

        new TemporalContinuityResolver(FovConfig.defaults()).resolve(series);

        assertThat(odd.getFovFlag()).isEqualTo(1);
        assertThat(odd.getElevation()).isEqualTo(20.0);
        assertThat(odd.getVirtualHeight()).isEqualTo(300.0);
        assertThat(RadarFixtures.only(series.get(0)).getFovFlag()).isEqualTo(1);
    }

    @Test
    void isolatedPointWithoutHistoryBecomesUnassigned() {
        List<ResolvedBeam> series = series(13);
        ResolvedPoint odd = RadarFixtures.only(series.get(ODD_ONE));
        odd.assign(-1, 0);

        new TemporalContinuityResolver(FovConfig.defaults()).resolve(series);

        assertThat(odd.getFovFlag()).isZero();
        assertThat(odd.getPastFov()).isZero();
    }

    @Test
    void earlierStepSkipsTheCheck() {
        List<ResolvedBeam> series = series(13);
        ResolvedPoint odd = RadarFixtures.only(series.get(ODD_ONE));
        odd.assign(-1, 1);

        new TemporalContinuityResolver(FovConfig.builder().step(5).build()).resolve(series);

        assertThat(odd.getFovFlag()).isEqualTo(-1);
    }

    @Test
    void incompleteWindowIsNotEvaluated() {
        List<ResolvedBeam> series = series(5);
        ResolvedPoint odd = RadarFixtures.only(series.get(ODD_ONE));
        odd.assign(-1, 1);

        new TemporalContinuityResolver(FovConfig.defaults()).resolve(series);

        assertThat(odd.getFovFlag()).isEqualTo(-1);
    }

    @Test
    void restrictionCanLeaveTooFewPoints() {
        List<ResolvedBeam> series = series(13);
        ResolvedPoint odd = RadarFixtures.only(series.get(ODD_ONE));
        odd.assign(-1, 1);

        new TemporalContinuityResolver(FovConfig.defaults(),
            Collections.singletonList(TemporalContinuityResolver.Restriction.virtualHeight(0.0, 100.0)))
            .resolve(series);

        assertThat(odd.getFovFlag()).isEqualTo(-1);
    }

    /**
     * 波束5每2分钟一次观测，除一个点外都在前视场
     */
    private static List<ResolvedBeam> series(int count) {
        List<ResolvedBeam> series = new ArrayList<>();
        for (int k = 0; k < count; k++) {
            PropagationSolution front = RadarFixtures.solution(20.0, 300.0, 0.5, "F");
            PropagationSolution back = RadarFixtures.solution(35.0, 320.0, 0.5, "F");
            ResolvedBeam beam = RadarFixtures.resolvedBeam(5, RadarFixtures.T0.plus(Duration.ofMinutes(2L * k)),
                15, front, back);
            RadarFixtures.only(beam).assign(1, 0);
            series.add(beam);
        }
        return series;
    }
}
