package tw.gc.portfolio.backtester.testutil;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;

import tw.gc.portfolio.backtester.enums.CovarianceMethod;
import tw.gc.portfolio.backtester.enums.ReturnType;
import tw.gc.portfolio.backtester.model.EstimatedParameters;
import tw.gc.portfolio.backtester.model.ReturnsMatrix;

/**
 * Factory for creating synthetic return data in tests.
 */
public final class ReturnsMatrixTestFactory {

    public static final LocalDate START = LocalDate.of(2018, 1, 31);

    private ReturnsMatrixTestFactory() {
    }

    /**
     * Month-end dates starting at {@link #START}.
     */
    public static List<LocalDate> monthEnds(int count) {
        return monthEnds(START, count);
    }

    public static List<LocalDate> monthEnds(LocalDate start, int count) {
        List<LocalDate> dates = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            LocalDate month = start.plusMonths(i);
            dates.add(month.withDayOfMonth(month.lengthOfMonth()));
        }
        return dates;
    }

    public static List<String> assets(int count) {
        List<String> assets = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            assets.add("ASSET" + (i + 1));
        }
        return assets;
    }

    public static ReturnsMatrix matrix(double[][] rows) {
        return new ReturnsMatrix(monthEnds(rows.length), assets(rows[0].length), rows, ReturnType.SIMPLE);
    }

    /**
     * Independent Gaussian monthly returns.
     */
    public static ReturnsMatrix gaussian(int periods, double[] monthlyMeans, double[] monthlyVols, long seed) {
        Random random = new Random(seed);
        double[][] rows = new double[periods][monthlyMeans.length];
        for (int t = 0; t < periods; t++) {
            for (int i = 0; i < monthlyMeans.length; i++) {
                rows[t][i] = monthlyMeans[i] + monthlyVols[i] * random.nextGaussian();
            }
        }
        return matrix(rows);
    }

    /**
     * Returns whose annualized sample covariance (n - 1 denominator, x 12) is exactly
     * diag(annualVariances): each asset is its mean plus a scaled Walsh sign pattern, and the
     * patterns are mutually orthogonal and zero-mean over any multiple of 8 periods.
     */
    public static ReturnsMatrix diagonalCovariance(int periods, double[] monthlyMeans, double[] annualVariances) {
        if (periods % 8 != 0 || annualVariances.length > 3) {
            throw new IllegalArgumentException("Need a multiple of 8 periods and at most 3 assets");
        }
        double[][] rows = new double[periods][annualVariances.length];
        for (int i = 0; i < annualVariances.length; i++) {
            double scale = Math.sqrt(annualVariances[i] / 12.0 * (periods - 1) / periods);
            for (int t = 0; t < periods; t++) {
                rows[t][i] = monthlyMeans[i] + scale * walsh(i, t);
            }
        }
        return matrix(rows);
    }

    private static double walsh(int pattern, int t) {
        int blockLength = 1 << pattern;
        return ((t / blockLength) % 2 == 0) ? 1.0 : -1.0;
    }

    /**
     * Parameters given directly, bypassing estimation.
     */
    public static EstimatedParameters parameters(double[] expectedReturns, double[][] covariance, double riskFreeRate) {
        return new EstimatedParameters(
            assets(expectedReturns.length),
            expectedReturns,
            covariance,
            riskFreeRate,
            24,
            START,
            START.plusMonths(23),
            CovarianceMethod.SAMPLE,
            0.0,
            List.of()
        );
    }

    public static double[][] diagonal(double... variances) {
        double[][] covariance = new double[variances.length][variances.length];
        for (int i = 0; i < variances.length; i++) {
            covariance[i][i] = variances[i];
        }
        return covariance;
    }
}
