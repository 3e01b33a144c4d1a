package tw.gc.portfolio.backtester.enums;

/**
 * Typed reasons attached to an allocation when something did not go as planned.
 */
public enum WarningCode {
    OPTIMIZATION_DID_NOT_CONVERGE(true),
    SINGULAR_COVARIANCE(true),
    NON_POSITIVE_TANGENCY_DENOMINATOR(true),
    DEGENERATE_COVARIANCE(true),
    ZERO_ASSET_VOLATILITY(true),
    ALLOCATION_TIMEOUT(true),
    ALLOCATION_FAILED(true),

    /** The ERC iteration ran out of budget; the last iterate is still used */
    RISK_PARITY_DID_NOT_CONVERGE(false),

    /** Shrinkage could not be computed and the sample covariance was used */
    SHRINKAGE_UNAVAILABLE(false);

    private final boolean degrading;

    WarningCode(boolean degrading) {
        this.degrading = degrading;
    }

    /**
     * @return true if a result carrying this warning must be reported as degraded
     */
    public boolean isDegrading() {
        return degrading;
    }
}
