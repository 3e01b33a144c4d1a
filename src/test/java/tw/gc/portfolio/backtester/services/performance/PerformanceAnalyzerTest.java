package tw.gc.portfolio.backtester.services.performance;

import java.time.LocalDate;
import java.util.List;
import java.util.Map;

import org.apache.commons.math3.stat.StatUtils;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import tw.gc.portfolio.backtester.model.PerformanceMetrics;
import tw.gc.portfolio.backtester.model.RealizedReturnSeries;
import tw.gc.portfolio.backtester.model.RiskFreeRate;

import static org.assertj.core.api.Assertions.*;
import static tw.gc.portfolio.backtester.testutil.ReturnsMatrixTestFactory.monthEnds;

/**
 * Unit tests for {@link PerformanceAnalyzer}.
 */
class PerformanceAnalyzerTest {

    private static final double[] RETURNS = {0.10, -0.05, 0.02, 0.03};
    private static final double[] NO_RISK_FREE = new double[4];

    private PerformanceAnalyzer analyzer;

    @BeforeEach
    void setUp() {
        analyzer = new PerformanceAnalyzer(new ValueAtRiskCalculator());
    }

    @Nested
    @DisplayName("Return and risk")
    class ReturnRiskTests {

        @Test
        @DisplayName("should annualize the arithmetic mean and report total return separately")
        void shouldAnnualize() {
            PerformanceMetrics metrics = analyzer.analyze(RETURNS, NO_RISK_FREE, 12);

            assertThat(metrics.observations()).isEqualTo(4);
            assertThat(metrics.annualizedReturn()).isCloseTo(0.30, within(1e-12));
            assertThat(metrics.totalReturn()).isCloseTo(1.1 * 0.95 * 1.02 * 1.03 - 1.0, within(1e-12));
            double expectedVol = Math.sqrt(StatUtils.variance(RETURNS)) * Math.sqrt(12);
            assertThat(metrics.annualizedVolatility()).isCloseTo(expectedVol, within(1e-12));
            assertThat(metrics.sharpeRatio()).isCloseTo(0.30 / expectedVol, within(1e-12));
            assertThat(metrics.hitRate()).isCloseTo(0.75, within(1e-12));
        }

        @Test
        @DisplayName("should subtract the periodic risk-free rate for Sharpe")
        void shouldUseExcessReturns() {
            double[] riskFree = {0.005, 0.005, 0.005, 0.005};

            PerformanceMetrics metrics = analyzer.analyze(RETURNS, riskFree, 12);

            assertThat(metrics.sharpeRatio()).isCloseTo((0.30 - 0.06) / metrics.annualizedVolatility(), within(1e-12));
        }

        @Test
        @DisplayName("should leave Sharpe undefined for a constant series")
        void shouldLeaveSharpeUndefinedWhenFlat() {
            double[] flat = {0.0078125, 0.0078125, 0.0078125};

            PerformanceMetrics metrics = analyzer.analyze(flat, new double[3], 12);

            assertThat(metrics.annualizedVolatility()).isZero();
            assertThat(metrics.sharpeRatio()).isNaN();
        }

        @Test
        @DisplayName("should reject misaligned risk-free rates")
        void shouldRejectMisaligned() {
            assertThatThrownBy(() -> analyzer.analyze(RETURNS, new double[3], 12))
                .isInstanceOf(IllegalArgumentException.class);
        }

        @Test
        @DisplayName("should return empty metrics for an empty series")
        void shouldHandleEmpty() {
            PerformanceMetrics metrics = analyzer.analyze(RealizedReturnSeries.empty(), RiskFreeRate.zero(), 12);

            assertThat(metrics.observations()).isZero();
            assertThat(metrics.sharpeRatio()).isNaN();
            assertThat(metrics.maxDrawdown()).isZero();
        }
    }

    @Nested
    @DisplayName("Downside")
    class DownsideTests {

        @Test
        @DisplayName("should measure drawdown from the running peak")
        void shouldMeasureDrawdown() {
            PerformanceMetrics metrics = analyzer.analyze(RETURNS, NO_RISK_FREE, 12);

            assertThat(metrics.maxDrawdown()).isCloseTo(-0.05, within(1e-12));
        }

        @Test
        @DisplayName("should count the starting value as the first peak")
        void shouldIncludeInitialPeak() {
            PerformanceMetrics metrics = analyzer.analyze(new double[] {-0.10, 0.05}, new double[2], 12);

            assertThat(metrics.maxDrawdown()).isCloseTo(-0.10, within(1e-12));
        }

        @Test
        @DisplayName("should use the RMS of negative excess returns for Sortino")
        void shouldComputeSortino() {
            PerformanceMetrics metrics = analyzer.analyze(RETURNS, NO_RISK_FREE, 12);

            assertThat(metrics.downsideObserved()).isTrue();
            assertThat(metrics.sortinoRatio()).isCloseTo(0.30 / (0.05 * Math.sqrt(12)), within(1e-10));
        }

        @Test
        @DisplayName("should flag Sortino as undefined when no period loses")
        void shouldFlagNoDownside() {
            PerformanceMetrics metrics = analyzer.analyze(new double[] {0.01, 0.02, 0.03}, new double[3], 12);

            assertThat(metrics.downsideObserved()).isFalse();
            assertThat(metrics.sortinoRatio()).isNaN();
            assertThat(metrics.sortinoLabel()).isEqualTo(PerformanceMetrics.NO_DOWNSIDE_OBSERVED);
        }

        @Test
        @DisplayName("should report historical VaR and CVaR as positive losses")
        void shouldReportVar() {
            PerformanceMetrics metrics = analyzer.analyze(RETURNS, NO_RISK_FREE, 12);

            assertThat(metrics.valueAtRisk95()).isCloseTo(0.05, within(1e-12));
            assertThat(metrics.conditionalValueAtRisk95()).isCloseTo(0.05, within(1e-12));
            assertThat(metrics.valueAtRisk99()).isCloseTo(0.05, within(1e-12));
            assertThat(metrics.conditionalValueAtRisk99()).isCloseTo(0.05, within(1e-12));
        }
    }

    @Test
    @DisplayName("should resolve a risk-free series on the return dates")
    void shouldResolveRiskFreeSeries() {
        List<LocalDate> dates = monthEnds(4);
        RealizedReturnSeries series = RealizedReturnSeries.of(dates, RETURNS);
        RiskFreeRate riskFree = RiskFreeRate.periodic(Map.of(dates.get(0), 0.005));

        PerformanceMetrics metrics = analyzer.analyze(series, riskFree, 12);

        assertThat(metrics.sharpeRatio()).isCloseTo((0.30 - 0.06) / metrics.annualizedVolatility(), within(1e-12));
    }
}
