package superdarn.fov;

import org.junit.jupiter.api.Test;
import superdarn.RadarFixtures;
import superdarn.fov.calculator.VirtualHeightModel;
import superdarn.fov.model.BackscatterPoint;
import superdarn.fov.model.RadarBeam;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class GroundScatterClassifierTest {

    private final GroundScatterClassifier classifier = new GroundScatterClassifier(new GroundScatterConfig());

    @Test
    void isolatedGroundScatterIsNotConfirmed() {
        List<BackscatterPoint> points = new ArrayList<>();
        for (int rg = 10; rg < 30; rg++) {
            points.add(new BackscatterPoint(rg, 1.0, 0.1, 20.0, rg == 20 ? 1 : 0));
        }
        for (int rg = 30; rg < 40; rg++) {
            points.add(new BackscatterPoint(rg, 1.0, 0.1, 10.0, 1));
        }
        RadarBeam beam = RadarFixtures.beam(7, RadarFixtures.T0).points(points).build();

        Set<Integer> ground = classifier.select(beam, distances(beam));

        assertThat(ground).doesNotContain(10);
        Set<Integer> cluster = new HashSet<>();
        for (int i = 20; i < 30; i++) {
            cluster.add(i);
        }
        assertThat(ground).containsExactlyInAnyOrderElementsOf(cluster);
    }

    @Test
    void pointTestRejectsNearHighPowerAndNegativePower() {
        double far = VirtualHeightModel.slantDistance(20, 300.0, 1200.0, 0.5);
        assertThat(classifier.passesPointTest(new BackscatterPoint(20, 1.0, 0.1, 20.0, 1), far)).isTrue();
        assertThat(classifier.passesPointTest(new BackscatterPoint(20, 1.0, 0.1, 20.0, 0), far)).isFalse();
        assertThat(classifier.passesPointTest(new BackscatterPoint(20, 1.0, 0.1, -1.0, 1), far)).isFalse();
        assertThat(classifier.passesPointTest(new BackscatterPoint(5, 1.0, 0.1, 10.0, 1), far)).isFalse();
        assertThat(classifier.passesPointTest(new BackscatterPoint(5, 1.0, 0.1, 3.0, 1), far)).isTrue();
        assertThat(classifier.passesPointTest(new BackscatterPoint(20, 1.0, 0.1, 20.0, 1), 60.0)).isFalse();
    }

    @Test
    void windowFractionCountsAcceptedNeighbours() {
        int[] gates = {1, 2, 3, 4, 5};
        Set<Integer> accepted = new HashSet<>(Arrays.asList(0, 1));

        GroundScatterClassifier.WindowCount middle =
            GroundScatterClassifier.fractionInWindow(gates, accepted, 2, 2, 0, 75);
        assertThat(middle.getTotal()).isEqualTo(4);
        assertThat(middle.getFraction()).isEqualTo(0.5);

        GroundScatterClassifier.WindowCount edge =
            GroundScatterClassifier.fractionInWindow(gates, accepted, 4, 2, 0, 5);
        assertThat(edge.getTotal()).isEqualTo(3);
        assertThat(edge.getFraction()).isZero();
    }

    @Test
    void rejectsMismatchedDistances() {
        RadarBeam beam = RadarFixtures.beam(7, RadarFixtures.T0)
            .addPoint(new BackscatterPoint(20, 1.0, 0.1, 20.0, 1)).build();
        assertThatThrownBy(() -> classifier.select(beam, new double[0]))
            .isInstanceOf(IllegalArgumentException.class);
    }

    private static double[] distances(RadarBeam beam) {
        double[] d = new double[beam.getPoints().size()];
        for (int i = 0; i < d.length; i++) {
            d[i] = VirtualHeightModel.slantDistance(beam.getPoints().get(i).getRangeGate(),
                beam.getSampleSeparation(), beam.getFirstLagRange(), 0.5);
        }
        return d;
    }
}
