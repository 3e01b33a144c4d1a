package tw.gc.portfolio.backtester.services.allocation;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import tw.gc.portfolio.backtester.model.WeightBounds;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for {@link BoxConstraints}.
 */
class BoxConstraintsTest {

    @Test
    @DisplayName("should spread a deficit in proportion to room below the cap")
    void shouldSpreadDeficit() {
        double[] w = BoxConstraints.enforce(new double[] {0.7, 0.2, 0.1}, new WeightBounds(0.0, 0.4));

        assertThat(w).containsExactly(new double[] {0.4, 0.32, 0.28}, within(1e-12));
    }

    @Test
    @DisplayName("should remove a surplus in proportion to headroom above the floor")
    void shouldRemoveSurplus() {
        double[] w = BoxConstraints.enforce(new double[] {0.0, 0.5, 0.5}, new WeightBounds(0.1, 1.0));

        assertThat(w).containsExactly(new double[] {0.1, 0.45, 0.45}, within(1e-12));
    }

    @Test
    @DisplayName("should normalize before clipping and leave feasible weights untouched")
    void shouldNormalizeFirst() {
        double[] w = BoxConstraints.enforce(new double[] {2.0, 1.0, 1.0}, WeightBounds.longOnly());

        assertThat(w).containsExactly(new double[] {0.5, 0.25, 0.25}, within(1e-15));
        assertThat(BoxConstraints.satisfies(w, WeightBounds.longOnly(), 1e-12)).isTrue();
    }

    @Test
    @DisplayName("should map non-finite entries to the floor")
    void shouldHandleNonFinite() {
        double[] w = BoxConstraints.enforce(new double[] {Double.NaN, 1.0, 1.0}, new WeightBounds(0.1, 0.6));

        assertThat(BoxConstraints.satisfies(w, new WeightBounds(0.1, 0.6), 1e-12)).isTrue();
    }

    @Test
    @DisplayName("should keep clipped weights when a cap just short of 1/n pins every asset")
    void shouldKeepPinnedWeightsAtCap() {
        // Given
        WeightBounds bounds = new WeightBounds(0.0, 0.3333333333);
        double third = 1.0 / 3.0;

        // When
        double[] w = BoxConstraints.enforce(new double[] {third, third, third}, bounds);

        // Then
        assertThat(w).doesNotContain(Double.NaN);
        assertThat(w).containsExactly(new double[] {0.3333333333, 0.3333333333, 0.3333333333}, within(1e-15));
        assertThat(BoxConstraints.satisfies(w, bounds, 1e-6)).isTrue();
    }

    @Test
    @DisplayName("should keep clipped weights when a floor just above 1/n pins every asset")
    void shouldKeepPinnedWeightsAtFloor() {
        // Given
        WeightBounds bounds = new WeightBounds(0.2500000001, 1.0);

        // When
        double[] w = BoxConstraints.enforce(new double[] {0.25, 0.25, 0.25, 0.25}, bounds);

        // Then
        assertThat(w).doesNotContain(Double.NaN);
        assertThat(w).containsOnly(0.2500000001);
    }

    @Test
    @DisplayName("should reject infeasible bounds")
    void shouldRejectInfeasible() {
        assertThatThrownBy(() -> BoxConstraints.enforce(new double[] {0.5, 0.5}, new WeightBounds(0.0, 0.4)))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
