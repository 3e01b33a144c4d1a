package tw.gc.portfolio.backtester.services.allocation;

import java.util.Objects;

import tw.gc.portfolio.backtester.enums.StrategyType;
import tw.gc.portfolio.backtester.model.PortfolioWeights;

/**
 * Max-Sharpe allocation with its ex-ante (estimation window) statistics.
 *
 * @param expectedReturn annualized ex-ante return of the weights
 * @param volatility     annualized ex-ante volatility of the weights
 * @param sharpeRatio    ex-ante Sharpe ratio, NaN for zero volatility
 * @param riskFreeRate   annualized rate the Sharpe ratio was maximized against
 */
public record MeanVarianceResult(
    PortfolioWeights weights,
    AllocationDiagnostics diagnostics,
    double expectedReturn,
    double volatility,
    double sharpeRatio,
    double riskFreeRate
) implements AllocationResult {

    public MeanVarianceResult {
        Objects.requireNonNull(weights, "weights");
        Objects.requireNonNull(diagnostics, "diagnostics");
    }

    @Override
    public StrategyType strategy() {
        return StrategyType.MEAN_VARIANCE;
    }
}
