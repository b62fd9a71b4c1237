package superdarn.fov;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class FovConfigTest {

    @Test
    void defaultsMatchStandardProcessing() {
        FovConfig config = FovConfig.defaults();
        assertThat(config.getMinPoints()).isEqualTo(3);
        assertThat(config.getMaxHop()).isEqualTo(3.0);
        assertThat(config.getUtBox()).isEqualTo(Duration.ofMinutes(20));
        assertThat(config.getStep()).isEqualTo(6);
        assertThat(config.getMinRangeGateBox()).isEqualTo(2);
        assertThat(config.getLargestRangeGateMax()).isEqualTo(76);
        assertThat(config.getRegions().getLabels()).containsExactly("D", "E", "F");
    }

    @Test
    void rangeGateLimitsSelectBoxes() {
        FovConfig config = FovConfig.defaults();
        assertThat(config.limitIndex(0)).isZero();
        assertThat(config.limitIndex(4)).isZero();
        assertThat(config.limitIndex(5)).isEqualTo(1);
        assertThat(config.limitIndex(39)).isEqualTo(2);
        assertThat(config.limitIndex(75)).isEqualTo(3);
        assertThat(config.limitIndex(76)).isEqualTo(-1);
        assertThat(config.getRangeGateBox(1)).isEqualTo(5);
        assertThat(config.getVirtualHeightBox(3)).isEqualTo(150.0);
    }

    @Test
    void rejectsMismatchedLimitLists() {
        assertThatThrownBy(() -> FovConfig.builder().rangeGateBox(2, 5).build())
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void rejectsNonIncreasingLimits() {
        assertThatThrownBy(() -> FovConfig.builder().rangeGateMax(5, 25, 25, 76).build())
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void rejectsNegativeBoxes() {
        assertThatThrownBy(() -> FovConfig.builder().rangeGateBox(2, -5, 10, 20).build())
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> FovConfig.builder().virtualHeightBox(50.0, 0.0, 50.0, 150.0).build())
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> FovConfig.builder().utBox(Duration.ZERO).build())
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void rejectsOverlappingRegions() {
        Map<String, double[]> bounds = new LinkedHashMap<>();
        bounds.put("E", new double[] {100.0, 160.0});
        bounds.put("F", new double[] {150.0, 900.0});
        assertThatThrownBy(() -> new RegionConfig(bounds)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void regionsAreOrderedByHeight() {
        Map<String, double[]> bounds = new LinkedHashMap<>();
        bounds.put("F", new double[] {150.0, 800.0});
        bounds.put("E", new double[] {100.0, 150.0});
        RegionConfig regions = new RegionConfig(bounds);
        assertThat(regions.getLabels()).containsExactly("E", "F");
        assertThat(regions.getLowestMin()).isEqualTo(100.0);
        assertThat(regions.getHighestMax()).isEqualTo(800.0);
        assertThat(regions.isTopRegion("F")).isTrue();
        assertThatThrownBy(() -> regions.getMin("D")).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void groundScatterSettingsAreValidated() {
        assertThatThrownBy(() -> new GroundScatterConfig(10, 76, 0, 5.0, 0.5, 5))
            .isInstanceOf(IllegalArgumentException.class);
        assertThat(new GroundScatterConfig().withMaxRangeGate(110).getMaxRangeGate()).isEqualTo(110);
    }
}
