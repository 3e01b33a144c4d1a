package tw.gc.portfolio.backtester.services.allocation;

/**
 * f(w) = -(w·μ - r_f) / sqrt(wᵀΣw), the function the max-Sharpe portfolio minimizes.
 * A numerically zero volatility evaluates to {@link #ZERO_VOLATILITY_PENALTY} instead of
 * dividing by zero.
 */
public final class NegativeSharpeObjective {

    public static final double ZERO_VOLATILITY_PENALTY = 1e6;

    private static final double ZERO_VOLATILITY = 1e-12;

    private final double[] expectedReturns;
    private final double[][] covariance;
    private final double riskFreeRate;

    public NegativeSharpeObjective(double[] expectedReturns, double[][] covariance, double riskFreeRate) {
        this.expectedReturns = expectedReturns;
        this.covariance = covariance;
        this.riskFreeRate = riskFreeRate;
    }

    public double value(double[] weights) {
        double volatility = volatility(weights);
        if (volatility < ZERO_VOLATILITY) {
            return ZERO_VOLATILITY_PENALTY;
        }
        return -(expectedReturn(weights) - riskFreeRate) / volatility;
    }

    public double expectedReturn(double[] weights) {
        double ret = 0.0;
        for (int i = 0; i < weights.length; i++) {
            ret += weights[i] * expectedReturns[i];
        }
        return ret;
    }

    public double volatility(double[] weights) {
        return RiskContributions.portfolioVolatility(covariance, weights);
    }

    /**
     * Sharpe ratio of {@code weights}, NaN when volatility is numerically zero.
     */
    public double sharpe(double[] weights) {
        double volatility = volatility(weights);
        return volatility < ZERO_VOLATILITY ? Double.NaN : (expectedReturn(weights) - riskFreeRate) / volatility;
    }
}
