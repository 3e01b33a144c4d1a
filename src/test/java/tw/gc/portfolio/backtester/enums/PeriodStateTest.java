package tw.gc.portfolio.backtester.enums;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for {@link PeriodState}.
 */
class PeriodStateTest {

    @Test
    @DisplayName("should advance through the forward chain")
    void shouldAdvanceForward() {
        PeriodState state = PeriodState.ESTIMATING
            .advanceTo(PeriodState.ALLOCATING)
            .advanceTo(PeriodState.APPLYING)
            .advanceTo(PeriodState.RECORDED);

        assertThat(state).isEqualTo(PeriodState.RECORDED);
        assertThat(state.isTerminal()).isTrue();
    }

    @Test
    @DisplayName("should allow skipping from any non-terminal state")
    void shouldAllowSkip() {
        assertThat(PeriodState.ESTIMATING.canTransitionTo(PeriodState.SKIPPED)).isTrue();
        assertThat(PeriodState.ALLOCATING.canTransitionTo(PeriodState.SKIPPED)).isTrue();
        assertThat(PeriodState.APPLYING.canTransitionTo(PeriodState.SKIPPED)).isTrue();
    }

    @Test
    @DisplayName("should reject jumps, reversals and leaving terminal states")
    void shouldRejectIllegalTransitions() {
        assertThatThrownBy(() -> PeriodState.ESTIMATING.advanceTo(PeriodState.APPLYING))
            .isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(() -> PeriodState.APPLYING.advanceTo(PeriodState.ALLOCATING))
            .isInstanceOf(IllegalStateException.class);
        assertThat(PeriodState.RECORDED.canTransitionTo(PeriodState.SKIPPED)).isFalse();
        assertThat(PeriodState.SKIPPED.canTransitionTo(PeriodState.ESTIMATING)).isFalse();
    }
}
