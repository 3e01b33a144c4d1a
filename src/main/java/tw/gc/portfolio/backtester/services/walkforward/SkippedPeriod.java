package tw.gc.portfolio.backtester.services.walkforward;

/**
 * A period that produced no allocation and no return observations.
 */
public record SkippedPeriod(RebalancingPeriod period, String reason) {
}
