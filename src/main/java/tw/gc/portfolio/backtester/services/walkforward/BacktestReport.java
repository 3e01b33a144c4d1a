package tw.gc.portfolio.backtester.services.walkforward;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import tw.gc.portfolio.backtester.enums.StrategyType;
import tw.gc.portfolio.backtester.model.SignificanceComparison;

/**
 * Output of a backtest run: per-strategy histories, skipped periods and pairwise comparisons.
 *
 * @param assets          asset universe
 * @param periods         every scheduled period, recorded or skipped
 * @param skippedPeriods  periods that contributed no observations, with the reason
 * @param strategies      results per strategy, in configured order
 * @param comparisons     pairwise Sharpe ratio tests
 * @param durationMs      wall-clock duration of the run
 */
public record BacktestReport(
    List<String> assets,
    List<RebalancingPeriod> periods,
    List<SkippedPeriod> skippedPeriods,
    Map<StrategyType, StrategyBacktest> strategies,
    List<SignificanceComparison> comparisons,
    long durationMs
) {
    public BacktestReport {
        assets = List.copyOf(assets);
        periods = List.copyOf(periods);
        skippedPeriods = List.copyOf(skippedPeriods);
        strategies = Collections.unmodifiableMap(new LinkedHashMap<>(strategies));
        comparisons = List.copyOf(comparisons);
    }

    public StrategyBacktest strategy(StrategyType type) {
        StrategyBacktest backtest = strategies.get(type);
        if (backtest == null) {
            throw new IllegalArgumentException("Strategy not part of this backtest: " + type);
        }
        return backtest;
    }

    /**
     * Generates a human-readable summary.
     */
    public String generateReport() {
        StringBuilder sb = new StringBuilder();
        sb.append("""
            ═══════════════════════════════════════════════════════════════
            PORTFOLIO BACKTEST REPORT
            ═══════════════════════════════════════════════════════════════
            Assets: %d | Periods: %d scheduled, %d skipped | Duration: %d ms
            """.formatted(assets.size(), periods.size(), skippedPeriods.size(), durationMs));

        for (StrategyBacktest backtest : strategies.values()) {
            sb.append("\n%-28s %s%n".formatted(backtest.strategy().getDescription(), backtest.metrics().describe()));
            sb.append("    Avg turnover %.1f%% | Costs %.4f%% | Degraded periods: %d %s%n".formatted(
                backtest.averageTurnover() * 100, backtest.totalTransactionCost() * 100,
                backtest.degradedCount(), backtest.degradedPeriods()));
        }

        if (!skippedPeriods.isEmpty()) {
            sb.append("\nSkipped periods:\n");
            for (SkippedPeriod skipped : skippedPeriods) {
                sb.append("  - %s: %s%n".formatted(skipped.period().describe(), skipped.reason()));
            }
        }

        if (!comparisons.isEmpty()) {
            sb.append("\nSharpe ratio tests (Jobson-Korkie | bootstrap):\n");
            for (SignificanceComparison comparison : comparisons) {
                sb.append("  %s | bootstrap p %.4f [%.4f, %.4f]%n".formatted(
                    comparison.jobsonKorkie().describe(), comparison.bootstrap().pValue(),
                    comparison.bootstrap().lowerBound(), comparison.bootstrap().upperBound()));
            }
        }
        sb.append("═══════════════════════════════════════════════════════════════\n");
        return sb.toString();
    }
}
