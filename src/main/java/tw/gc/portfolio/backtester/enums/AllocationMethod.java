package tw.gc.portfolio.backtester.enums;

/**
 * The procedure that actually produced a weight vector.
 */
public enum AllocationMethod {
    EQUAL_WEIGHT(false),
    MAX_SHARPE_OPTIMIZER(false),
    ANALYTICAL_TANGENCY(true),
    EQUAL_RISK_CONTRIBUTION(false),
    INVERSE_VOLATILITY_FALLBACK(true),
    EQUAL_WEIGHT_FALLBACK(true);

    private final boolean fallback;

    AllocationMethod(boolean fallback) {
        this.fallback = fallback;
    }

    public boolean isFallback() {
        return fallback;
    }
}
