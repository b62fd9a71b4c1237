package superdarn.tdiff;

import org.hipparchus.analysis.UnivariateFunction;
import org.hipparchus.util.FastMath;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class RigorousSimplexTest {

    private static final UnivariateFunction SINE = x -> FastMath.sin(x);

    private final RigorousSimplex simplex = new RigorousSimplex(1.0e-4, 2000);

    @Test
    void findsNearestMinimumOfSine() {
        SimplexResult fromZero = simplex.minimize(0.0, SINE);
        assertThat(fromZero.isConverged()).isTrue();
        assertThat(fromZero.getX()).isCloseTo(-FastMath.PI / 2.0, within(1.0e-4));
        assertThat(fromZero.getValue()).isCloseTo(-1.0, within(1.0e-6));

        assertThat(simplex.minimize(FastMath.PI, SINE).getX())
            .isCloseTo(1.5 * FastMath.PI, within(1.0e-4));
    }

    @Test
    void startNearMaximumFollowsTheSlope() {
        SimplexResult res = simplex.minimize(FastMath.toRadians(-271.0), SINE);
        assertThat(res.getX()).isCloseTo(-2.5 * FastMath.PI, within(1.0e-4));
        assertThat(res.getIterations()).isPositive().isLessThanOrEqualTo(2000);
    }

    @Test
    void undefinedObjectiveFails() {
        SimplexResult res = simplex.minimize(0.5, x -> Double.NaN);
        assertThat(res.isConverged()).isFalse();
        assertThat(res.getX()).isNaN();
    }

    @Test
    void rejectsInvalidSettings() {
        assertThatThrownBy(() -> new RigorousSimplex(0.0, 10)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new RigorousSimplex(1.0e-4, 0)).isInstanceOf(IllegalArgumentException.class);
    }
}
