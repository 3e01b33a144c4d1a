package tw.gc.portfolio.backtester.services.walkforward;

import tw.gc.portfolio.backtester.enums.PeriodState;
import tw.gc.portfolio.backtester.enums.StrategyType;
import tw.gc.portfolio.backtester.model.PerformanceMetrics;
import tw.gc.portfolio.backtester.model.PortfolioWeights;
import tw.gc.portfolio.backtester.model.RealizedReturnSeries;
import tw.gc.portfolio.backtester.services.allocation.AllocationResult;

/**
 * Recorded outcome of one (strategy, period) unit.
 *
 * @param allocation      weights and allocator diagnostics
 * @param turnover        one-way turnover against the previous period's target weights
 * @param transactionCost cost deducted from the first test-period return
 * @param realizedReturns net returns of the fixed weights over the test window
 * @param metrics         metrics of this period alone
 */
public record PeriodAllocation(
    StrategyType strategy,
    RebalancingPeriod period,
    PeriodState state,
    AllocationResult allocation,
    double turnover,
    double transactionCost,
    RealizedReturnSeries realizedReturns,
    PerformanceMetrics metrics
) {
    public PortfolioWeights weights() {
        return allocation.weights();
    }

    public boolean degraded() {
        return allocation.degraded();
    }
}
