package tw.gc.portfolio.backtester.enums;

/**
 * How the values of a returns matrix are expressed.
 */
public enum ReturnType {
    /** Simple periodic return: P(t) / P(t-1) - 1 */
    SIMPLE,

    /** Continuously compounded return: ln(P(t) / P(t-1)) */
    LOG;

    /**
     * Converts a stored value to a simple return.
     * Portfolio returns are always aggregated as weighted simple returns.
     */
    public double toSimple(double value) {
        return this == LOG ? Math.expm1(value) : value;
    }
}
