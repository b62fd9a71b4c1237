package superdarn.fov;

import org.hipparchus.distribution.continuous.NormalDistribution;
import org.junit.jupiter.api.Test;
import superdarn.fov.model.AltitudeBand;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class AltitudeBandSelectorTest {

    private final AltitudeBandSelector selector = new AltitudeBandSelector();

    @Test
    void singleLayerIsCoveredByItsBand() {
        double[] heights = normalSample(306.25, 20.0, 200);

        List<AltitudeBand> bands = selector.select(heights, 150.0, 900.0, 50.0, 3);

        assertThat(bands).isNotEmpty();
        assertCovered(heights, bands);
        AltitudeBand peak = bandContaining(bands, 300.0);
        assertThat(peak.getMin()).isBetween(150.0, 280.0);
        assertThat(peak.getMax()).isBetween(320.0, 900.0);
    }

    @Test
    void separatedLayersGetSeparateBands() {
        double[] low = normalSample(256.25, 10.0, 100);
        double[] high = normalSample(506.25, 10.0, 100);
        double[] heights = new double[low.length + high.length];
        System.arraycopy(low, 0, heights, 0, low.length);
        System.arraycopy(high, 0, heights, low.length, high.length);

        List<AltitudeBand> bands = selector.select(heights, 150.0, 900.0, 50.0, 3);

        assertCovered(heights, bands);
        assertThat(bandContaining(bands, 250.0)).isNotSameAs(bandContaining(bands, 500.0));
        for (int i = 1; i < bands.size(); i++) {
            assertThat(bands.get(i).getMin()).isGreaterThanOrEqualTo(bands.get(i - 1).getMax() - 1.0e-9);
        }
    }

    @Test
    void noHeightsGiveNoBands() {
        assertThat(selector.select(new double[] {Double.NaN}, 150.0, 900.0, 50.0, 3)).isEmpty();
    }

    @Test
    void uniformBandsAreCentredOnData() {
        List<AltitudeBand> one = AltitudeBandSelector.uniformBands(300.0, 307.0, 50.0,
            Double.NEGATIVE_INFINITY, Double.POSITIVE_INFINITY);
        assertThat(one).hasSize(1);
        assertThat(one.get(0).getMin()).isCloseTo(278.5, within(1.0e-9));
        assertThat(one.get(0).getMax()).isCloseTo(328.5, within(1.0e-9));

        List<AltitudeBand> three = AltitudeBandSelector.uniformBands(200.0, 330.0, 50.0, 150.0, 900.0);
        assertThat(three).hasSize(3);
        assertThat(three.get(0).getMin()).isCloseTo(190.0, within(1.0e-9));
        assertThat(three.get(2).getMax()).isCloseTo(340.0, within(1.0e-9));
    }

    @Test
    void uniformBandsAreClampedToRegion() {
        List<AltitudeBand> bands = AltitudeBandSelector.uniformBands(150.0, 160.0, 50.0, 150.0, 900.0);
        assertThat(bands).hasSize(1);
        assertThat(bands.get(0).getMin()).isEqualTo(150.0);
    }

    @Test
    void rejectsInvalidLimits() {
        assertThatThrownBy(() -> selector.select(new double[] {300.0}, 900.0, 150.0, 50.0, 3))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> selector.select(new double[] {300.0}, 150.0, 900.0, 0.0, 3))
            .isInstanceOf(IllegalArgumentException.class);
    }

    private static double[] normalSample(double mean, double sigma, int n) {
        NormalDistribution normal = new NormalDistribution(mean, sigma);
        double[] values = new double[n];
        for (int i = 0; i < n; i++) {
            values[i] = normal.inverseCumulativeProbability((i + 0.5) / n);
        }
        return values;
    }

    private static void assertCovered(double[] heights, List<AltitudeBand> bands) {
        for (double h : heights) {
            assertThat(bands.stream().anyMatch(b -> b.contains(h)))
                .as("height %.2f is inside a band of %s", h, bands)
                .isTrue();
        }
    }

    private static AltitudeBand bandContaining(List<AltitudeBand> bands, double h) {
        return bands.stream().filter(b -> b.contains(h)).findFirst()
            .orElseThrow(() -> new AssertionError("no band contains " + h));
    }
}
