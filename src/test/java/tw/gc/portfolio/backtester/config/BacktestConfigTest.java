package tw.gc.portfolio.backtester.config;

import java.time.Duration;
import java.time.LocalDate;
import java.util.List;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import tw.gc.portfolio.backtester.enums.CovarianceMethod;
import tw.gc.portfolio.backtester.enums.StrategyType;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for {@link BacktestConfig}.
 */
class BacktestConfigTest {

    @Nested
    @DisplayName("Defaults")
    class DefaultsTests {

        @Test
        @DisplayName("should use a 24 month window, semi-annual rebalancing and a 40% cap")
        void shouldUseDefaults() {
            BacktestConfig config = BacktestConfig.defaults();

            assertThat(config.estimationWindowPeriods()).isEqualTo(24);
            assertThat(config.rebalanceEveryPeriods()).isEqualTo(6);
            assertThat(config.weightBounds().min()).isZero();
            assertThat(config.weightBounds().max()).isEqualTo(0.40);
            assertThat(config.periodsPerYear()).isEqualTo(12);
            assertThat(config.covarianceMethod()).isEqualTo(CovarianceMethod.SAMPLE);
            assertThat(config.strategies()).containsExactly(StrategyType.values());
            assertThat(config.hasExplicitSchedule()).isFalse();
            assertThat(config.parallelism()).isPositive();
        }

        @Test
        @DisplayName("toBuilder should reproduce an equal configuration")
        void toBuilderRoundTrip() {
            BacktestConfig config = BacktestConfig.builder()
                .transactionCostBps(15)
                .allocationTimeout(Duration.ofSeconds(5))
                .strategies(List.of(StrategyType.RISK_PARITY))
                .build();

            assertThat(config.toBuilder().build()).isEqualTo(config);
        }

        @Test
        @DisplayName("should drop duplicate strategies and treat empty as all")
        void shouldNormalizeStrategies() {
            BacktestConfig config = BacktestConfig.builder()
                .strategies(List.of(StrategyType.RISK_PARITY, StrategyType.RISK_PARITY))
                .build();
            assertThat(config.strategies()).containsExactly(StrategyType.RISK_PARITY);

            assertThat(BacktestConfig.builder().strategies(List.of()).build().strategies())
                .hasSize(StrategyType.values().length);
        }
    }

    @Nested
    @DisplayName("Validation")
    class ValidationTests {

        @Test
        @DisplayName("should reject a single rebalancing boundary")
        void shouldRejectSingleBoundary() {
            assertThatThrownBy(() -> BacktestConfig.builder()
                .rebalancingDates(List.of(LocalDate.of(2020, 1, 31))).build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("two boundaries");
        }

        @Test
        @DisplayName("should reject unsorted rebalancing dates")
        void shouldRejectUnsortedBoundaries() {
            assertThatThrownBy(() -> BacktestConfig.builder()
                .rebalancingDates(List.of(LocalDate.of(2020, 6, 30), LocalDate.of(2020, 1, 31))).build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("strictly ascending");
        }

        @Test
        @DisplayName("should reject a window shorter than the minimum")
        void shouldRejectShortWindow() {
            assertThatThrownBy(() -> BacktestConfig.builder().estimationWindowPeriods(6).build())
                .isInstanceOf(IllegalArgumentException.class);
        }

        @Test
        @DisplayName("should reject damping outside (0, 1] and alpha outside (0, 1)")
        void shouldRejectBadRanges() {
            assertThatThrownBy(() -> BacktestConfig.builder().riskParityDamping(0.0).build())
                .isInstanceOf(IllegalArgumentException.class);
            assertThatThrownBy(() -> BacktestConfig.builder().riskParityDamping(1.5).build())
                .isInstanceOf(IllegalArgumentException.class);
            assertThatThrownBy(() -> BacktestConfig.builder().significanceLevel(1.0).build())
                .isInstanceOf(IllegalArgumentException.class);
            assertThatThrownBy(() -> BacktestConfig.builder().transactionCostBps(-1).build())
                .isInstanceOf(IllegalArgumentException.class);
            assertThatThrownBy(() -> BacktestConfig.builder().allocationTimeout(Duration.ZERO).build())
                .isInstanceOf(IllegalArgumentException.class);
        }
    }
}
