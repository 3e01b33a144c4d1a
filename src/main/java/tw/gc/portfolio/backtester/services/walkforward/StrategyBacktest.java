package tw.gc.portfolio.backtester.services.walkforward;

import java.util.List;

import tw.gc.portfolio.backtester.enums.StrategyType;
import tw.gc.portfolio.backtester.model.PerformanceMetrics;
import tw.gc.portfolio.backtester.model.RealizedReturnSeries;

/**
 * Full out-of-sample history of one strategy.
 *
 * @param allocations          recorded periods in chronological order
 * @param realizedReturns      concatenated net returns of all recorded periods
 * @param metrics              consolidated metrics over {@code realizedReturns}
 * @param degradedPeriods      indexes of periods that used a fallback allocation
 * @param averageTurnover      mean one-way turnover per rebalance
 * @param totalTransactionCost sum of the costs deducted
 */
public record StrategyBacktest(
    StrategyType strategy,
    List<PeriodAllocation> allocations,
    RealizedReturnSeries realizedReturns,
    PerformanceMetrics metrics,
    List<Integer> degradedPeriods,
    double averageTurnover,
    double totalTransactionCost
) {
    public StrategyBacktest {
        allocations = List.copyOf(allocations);
        degradedPeriods = List.copyOf(degradedPeriods);
    }

    public int degradedCount() {
        return degradedPeriods.size();
    }
}
