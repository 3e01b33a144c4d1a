package tw.gc.portfolio.backtester.model;

/**
 * Paired bootstrap distribution of the per-period Sharpe ratio difference A - B.
 *
 * @param observedDifference Sharpe difference on the original sample
 * @param validResamples     resamples where both Sharpe ratios were defined
 * @param lowerBound         2.5th percentile of the resampled differences
 * @param upperBound         97.5th percentile of the resampled differences
 * @param pValue             two-sided sign p-value, 2 x min(P(d <= 0), P(d >= 0)) capped at 1
 */
public record BootstrapResult(
    String strategyA,
    String strategyB,
    int iterations,
    int validResamples,
    long seed,
    double observedDifference,
    double meanDifference,
    double standardError,
    double lowerBound,
    double upperBound,
    double pValue,
    boolean significant
) {
}
