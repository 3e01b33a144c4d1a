package tw.gc.portfolio.backtester.enums;

/**
 * Outcome class of a Sharpe ratio comparison.
 */
public enum SignificanceStatus {
    /** A finite test statistic and p-value were computed */
    DETERMINATE,

    /** The two series are identical; difference is zero and p-value is one */
    IDENTICAL,

    /** The variance of the Sharpe difference was not positive; no statistic is reported */
    INDETERMINATE
}
