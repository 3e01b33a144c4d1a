package tw.gc.portfolio.backtester.enums;

/**
 * Allocation strategies compared by the backtest.
 */
public enum StrategyType {
    /**
     * Naive 1/N diversification. Needs no estimated parameters.
     */
    EQUAL_WEIGHT("equal-weight", "Equal Weight (1/N)", false),

    /**
     * Markowitz maximum-Sharpe portfolio under box and budget constraints.
     */
    MEAN_VARIANCE("mean-variance", "Mean-Variance (Max Sharpe)", true),

    /**
     * Equal Risk Contribution portfolio.
     */
    RISK_PARITY("risk-parity", "Risk Parity (ERC)", true);

    private final String code;
    private final String description;
    private final boolean requiresEstimation;

    StrategyType(String code, String description, boolean requiresEstimation) {
        this.code = code;
        this.description = description;
        this.requiresEstimation = requiresEstimation;
    }

    public String getCode() {
        return code;
    }

    public String getDescription() {
        return description;
    }

    public boolean requiresEstimation() {
        return requiresEstimation;
    }

    /**
     * Parse from code string (e.g., "risk-parity") or enum name.
     */
    public static StrategyType fromCode(String code) {
        for (StrategyType type : values()) {
            if (type.code.equalsIgnoreCase(code) || type.name().equalsIgnoreCase(code)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown strategy: " + code);
    }
}
