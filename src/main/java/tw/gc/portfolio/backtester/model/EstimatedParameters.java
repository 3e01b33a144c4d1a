package tw.gc.portfolio.backtester.model;

import java.time.LocalDate;
import java.util.List;
import java.util.Objects;

import org.apache.commons.math3.linear.Array2DRowRealMatrix;
import org.apache.commons.math3.linear.RealMatrix;

import tw.gc.portfolio.backtester.enums.CovarianceMethod;

/**
 * Annualized moments estimated from one estimation window.
 *
 * <p>Arrays are defensively copied on the way in and on the way out.
 *
 * @param assets             universe order of every vector and matrix below
 * @param expectedReturns    annualized mean returns (mean x periods per year)
 * @param covariance         annualized covariance matrix
 * @param riskFreeRate       annualized risk-free rate over the estimation window
 * @param observations       number of periods in the window
 * @param windowStart        first date of the window
 * @param windowEnd          last date of the window
 * @param method             covariance estimator actually used
 * @param shrinkageIntensity Ledoit-Wolf intensity, 0 for the sample estimator
 * @param warnings           non-fatal estimation notes carried into allocation diagnostics
 */
public record EstimatedParameters(
    List<String> assets,
    double[] expectedReturns,
    double[][] covariance,
    double riskFreeRate,
    int observations,
    LocalDate windowStart,
    LocalDate windowEnd,
    CovarianceMethod method,
    double shrinkageIntensity,
    List<AllocationWarning> warnings
) {
    public EstimatedParameters {
        Objects.requireNonNull(assets, "assets");
        int n = assets.size();
        if (expectedReturns == null || expectedReturns.length != n) {
            throw new IllegalArgumentException("Expected returns must have one entry per asset");
        }
        if (covariance == null || covariance.length != n) {
            throw new IllegalArgumentException("Covariance must be %d x %d".formatted(n, n));
        }
        double[][] covCopy = new double[n][];
        for (int i = 0; i < n; i++) {
            if (covariance[i] == null || covariance[i].length != n) {
                throw new IllegalArgumentException("Covariance must be %d x %d".formatted(n, n));
            }
            covCopy[i] = covariance[i].clone();
        }
        assets = List.copyOf(assets);
        expectedReturns = expectedReturns.clone();
        covariance = covCopy;
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
    }

    @Override
    public double[] expectedReturns() {
        return expectedReturns.clone();
    }

    @Override
    public double[][] covariance() {
        double[][] copy = new double[covariance.length][];
        for (int i = 0; i < covariance.length; i++) {
            copy[i] = covariance[i].clone();
        }
        return copy;
    }

    public int assetCount() {
        return assets.size();
    }

    public RealMatrix covarianceMatrix() {
        return new Array2DRowRealMatrix(covariance, true);
    }

    /**
     * Annualized volatility per asset, sqrt of the covariance diagonal.
     */
    public double[] volatilities() {
        double[] vols = new double[covariance.length];
        for (int i = 0; i < vols.length; i++) {
            vols[i] = Math.sqrt(Math.max(covariance[i][i], 0.0));
        }
        return vols;
    }

    /**
     * Expected returns in excess of the window's risk-free rate.
     */
    public double[] excessReturns() {
        double[] excess = expectedReturns.clone();
        for (int i = 0; i < excess.length; i++) {
            excess[i] -= riskFreeRate;
        }
        return excess;
    }
}
