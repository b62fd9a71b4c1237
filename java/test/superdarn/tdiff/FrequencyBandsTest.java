package superdarn.tdiff;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class FrequencyBandsTest {

    private final FrequencyBands bands = new FrequencyBands(new int[] {0, 1},
        new double[] {10000.0, 12000.0}, new double[] {11000.0, 13000.0});

    @Test
    void bandLookupIsInclusive() {
        assertThat(bands.bandFor(12000.0)).isEqualTo(1);
        assertThat(bands.bandFor(11000.0)).isEqualTo(0);
        assertThat(bands.bandFor(11500.0)).isEqualTo(-1);
        assertThat(bands.size()).isEqualTo(2);
        assertThat(bands.hasBand(1)).isTrue();
        assertThat(bands.hasBand(4)).isFalse();
    }

    @Test
    void periodFollowsBandCentre() {
        assertThat(bands.meanFrequency(1)).isEqualTo(12500);
        assertThat(bands.period(1)).isCloseTo(0.08, within(1.0e-12));
        assertThat(bands.meanFrequency(4)).isEqualTo(-1);
        assertThat(bands.period(4)).isNaN();
    }

    @Test
    void rejectsInconsistentTables() {
        assertThatThrownBy(() -> new FrequencyBands(new int[] {0}, new double[] {1.0, 2.0}, new double[] {3.0}))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new FrequencyBands(new int[] {0}, new double[] {5.0}, new double[] {3.0}))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
