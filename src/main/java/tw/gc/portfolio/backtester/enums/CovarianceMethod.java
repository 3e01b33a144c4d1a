package tw.gc.portfolio.backtester.enums;

/**
 * Covariance estimator used by the parameter estimator.
 */
public enum CovarianceMethod {
    /** Unbiased sample covariance (n - 1 denominator) */
    SAMPLE,

    /** Ledoit-Wolf shrinkage towards the constant-correlation target */
    LEDOIT_WOLF
}
