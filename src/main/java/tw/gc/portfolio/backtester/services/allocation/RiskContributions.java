package tw.gc.portfolio.backtester.services.allocation;

import java.util.ArrayList;
import java.util.List;

/**
 * Portfolio risk decomposition helpers.
 */
public final class RiskContributions {

    private RiskContributions() {
    }

    public static double[] covarianceTimes(double[][] covariance, double[] weights) {
        int n = weights.length;
        double[] result = new double[n];
        for (int i = 0; i < n; i++) {
            double sum = 0.0;
            for (int j = 0; j < n; j++) {
                sum += covariance[i][j] * weights[j];
            }
            result[i] = sum;
        }
        return result;
    }

    public static double portfolioVariance(double[][] covariance, double[] weights) {
        double[] sigmaW = covarianceTimes(covariance, weights);
        double variance = 0.0;
        for (int i = 0; i < weights.length; i++) {
            variance += weights[i] * sigmaW[i];
        }
        return variance;
    }

    public static double portfolioVolatility(double[][] covariance, double[] weights) {
        return Math.sqrt(Math.max(portfolioVariance(covariance, weights), 0.0));
    }

    /**
     * RC_i = w_i (Σw)_i / σ_p; the contributions sum to σ_p.
     */
    public static double[] contributions(double[][] covariance, double[] weights, double portfolioVolatility) {
        double[] sigmaW = covarianceTimes(covariance, weights);
        double[] rc = new double[weights.length];
        for (int i = 0; i < rc.length; i++) {
            rc[i] = weights[i] * sigmaW[i] / portfolioVolatility;
        }
        return rc;
    }

    /**
     * max |RC_i / (σ_p / n) - 1|
     */
    public static double maxRelativeDeviation(double[] contributions, double portfolioVolatility) {
        double target = portfolioVolatility / contributions.length;
        double max = 0.0;
        for (double rc : contributions) {
            max = Math.max(max, Math.abs(rc / target - 1.0));
        }
        return max;
    }

    public static RiskContributionDiagnostics diagnose(double[][] covariance, double[] weights) {
        double sigma = portfolioVolatility(covariance, weights);
        int n = weights.length;
        if (!(sigma > 0.0)) {
            return new RiskContributionDiagnostics(0.0, List.of(), Double.NaN, Double.NaN, Double.NaN);
        }
        double[] rc = contributions(covariance, weights, sigma);
        List<Double> shares = new ArrayList<>(n);
        double meanShare = 1.0 / n;
        double squared = 0.0;
        double max = Double.NEGATIVE_INFINITY;
        double min = Double.POSITIVE_INFINITY;
        for (double contribution : rc) {
            double share = contribution / sigma;
            shares.add(share);
            squared += (share - meanShare) * (share - meanShare);
            max = Math.max(max, contribution);
            min = Math.min(min, contribution);
        }
        double ratio = min > 0.0 ? max / min : Double.POSITIVE_INFINITY;
        return new RiskContributionDiagnostics(sigma, shares, maxRelativeDeviation(rc, sigma),
            Math.sqrt(squared / n), ratio);
    }
}
