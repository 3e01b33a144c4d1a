package tw.gc.portfolio.backtester.model;

import tw.gc.portfolio.backtester.enums.SignificanceStatus;

/**
 * Jobson-Korkie (Memmel-corrected) comparison of two Sharpe ratios.
 *
 * <p>Sharpe ratios here are per-period (not annualized) ratios of mean excess return to the
 * sample standard deviation of excess returns, the quantities the test statistic is built on.
 * For {@link SignificanceStatus#INDETERMINATE} results the statistic and p-value are NaN.
 */
public record SignificanceResult(
    String strategyA,
    String strategyB,
    double sharpeA,
    double sharpeB,
    double difference,
    double correlation,
    double statistic,
    double pValue,
    boolean significant,
    double significanceLevel,
    int observations,
    SignificanceStatus status
) {
    public String describe() {
        return switch (status) {
            case IDENTICAL -> "%s vs %s: identical series (p = 1.000)".formatted(strategyA, strategyB);
            case INDETERMINATE -> "%s vs %s: indeterminate (non-positive variance of Sharpe difference)"
                .formatted(strategyA, strategyB);
            case DETERMINATE -> "%s vs %s: ΔSharpe %.4f | z %.3f | p %.4f%s".formatted(
                strategyA, strategyB, difference, statistic, pValue, significant ? " *" : "");
        };
    }
}
