package tw.gc.portfolio.backtester.services.significance;

import org.apache.commons.math3.stat.StatUtils;

/**
 * Per-period Sharpe ratio helpers shared by the significance tests.
 */
final class SharpeRatios {

    private SharpeRatios() {
    }

    /**
     * mean / sample std (n − 1), NaN when the std is zero.
     */
    static double perPeriod(double[] excessReturns) {
        double std = Math.sqrt(StatUtils.variance(excessReturns));
        return std > 0.0 ? StatUtils.mean(excessReturns) / std : Double.NaN;
    }

    static double[] excess(double[] returns, double[] periodicRiskFree) {
        double[] excess = new double[returns.length];
        for (int i = 0; i < returns.length; i++) {
            excess[i] = returns[i] - periodicRiskFree[i];
        }
        return excess;
    }
}
