package tw.gc.portfolio.backtester.model;

/**
 * Risk and return summary of a realized return series.
 *
 * <p>Annualization convention: arithmetic mean periodic return x periods per year.
 * {@code totalReturn} is the compounded growth over the whole series and is reported
 * separately; it is never used in place of the annualized return.
 *
 * @param observations           number of periods
 * @param annualizedReturn       mean periodic return x periods per year
 * @param totalReturn            prod(1 + r) - 1
 * @param annualizedVolatility   sample std (n - 1) x sqrt(periods per year)
 * @param sharpeRatio            annualized mean excess return / annualized volatility, NaN if undefined
 * @param sortinoRatio           annualized mean excess return / annualized downside deviation,
 *                               NaN when no downside was observed
 * @param downsideObserved       false when no period returned less than the risk-free rate
 * @param maxDrawdown            min over time of value / running peak - 1 (zero or negative)
 * @param valueAtRisk95          historical 95% VaR as a positive loss fraction
 * @param conditionalValueAtRisk95 historical 95% expected shortfall as a positive loss fraction
 * @param valueAtRisk99          historical 99% VaR as a positive loss fraction
 * @param conditionalValueAtRisk99 historical 99% expected shortfall as a positive loss fraction
 * @param hitRate                share of periods with a positive return
 */
public record PerformanceMetrics(
    int observations,
    double annualizedReturn,
    double totalReturn,
    double annualizedVolatility,
    double sharpeRatio,
    double sortinoRatio,
    boolean downsideObserved,
    double maxDrawdown,
    double valueAtRisk95,
    double conditionalValueAtRisk95,
    double valueAtRisk99,
    double conditionalValueAtRisk99,
    double hitRate
) {
    public static final String NO_DOWNSIDE_OBSERVED = "no downside observed";

    public static PerformanceMetrics empty() {
        return new PerformanceMetrics(0, Double.NaN, 0.0, Double.NaN, Double.NaN, Double.NaN,
            false, 0.0, Double.NaN, Double.NaN, Double.NaN, Double.NaN, Double.NaN);
    }

    /**
     * Sortino ratio for display, or the sentinel text when it is undefined.
     */
    public String sortinoLabel() {
        if (!downsideObserved) {
            return NO_DOWNSIDE_OBSERVED;
        }
        return Double.isNaN(sortinoRatio) ? "n/a" : "%.3f".formatted(sortinoRatio);
    }

    public String describe() {
        return "Return %.2f%% | Vol %.2f%% | Sharpe %.3f | Sortino %s | MaxDD %.2f%% | n=%d".formatted(
            annualizedReturn * 100, annualizedVolatility * 100, sharpeRatio, sortinoLabel(),
            maxDrawdown * 100, observations);
    }
}
