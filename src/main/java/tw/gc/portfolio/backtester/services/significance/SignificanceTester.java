package tw.gc.portfolio.backtester.services.significance;

import java.util.Arrays;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.math3.distribution.NormalDistribution;
import org.apache.commons.math3.stat.StatUtils;
import org.apache.commons.math3.stat.correlation.Covariance;
import org.springframework.stereotype.Service;

import tw.gc.portfolio.backtester.config.BacktestConfig;
import tw.gc.portfolio.backtester.enums.SignificanceStatus;
import tw.gc.portfolio.backtester.exceptions.IndeterminateSignificanceException;
import tw.gc.portfolio.backtester.exceptions.InsufficientDataException;
import tw.gc.portfolio.backtester.model.BootstrapResult;
import tw.gc.portfolio.backtester.model.RealizedReturnSeries;
import tw.gc.portfolio.backtester.model.RiskFreeRate;
import tw.gc.portfolio.backtester.model.SignificanceComparison;
import tw.gc.portfolio.backtester.model.SignificanceResult;

/**
 * Jobson-Korkie test of the difference between two Sharpe ratios, with Memmel's (2003)
 * correction:
 * <pre>
 *   Var(Ŝa − Ŝb) = (1/T) [ 2 − 2ρ + ½ (Ŝa² + Ŝb² − 2 Ŝa Ŝb ρ²) ]
 *   z = (Ŝa − Ŝb) / sqrt(Var),   p = 2 (1 − Φ(|z|))
 * </pre>
 * Ŝ are per-period Sharpe ratios of excess returns and ρ is the correlation of the two excess
 * return series. Swapping A and B negates the difference and leaves |z| and p unchanged.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class SignificanceTester {

    /** Fewest aligned observations accepted by either test */
    public static final int MIN_OBSERVATIONS = 3;

    private static final NormalDistribution STANDARD_NORMAL = new NormalDistribution(0.0, 1.0);

    private final BootstrapSharpeTest bootstrapSharpeTest;

    /**
     * Aligns two realized series on their common dates and runs both tests side by side.
     */
    public SignificanceComparison compare(String nameA, RealizedReturnSeries seriesA,
                                          String nameB, RealizedReturnSeries seriesB,
                                          BacktestConfig config) {
        RealizedReturnSeries alignedA = seriesA.alignedWith(seriesB);
        RealizedReturnSeries alignedB = seriesB.alignedWith(seriesA);
        RiskFreeRate riskFreeRate = config.riskFreeRate();
        double[] periodicRiskFree = riskFreeRate.periodicRates(alignedA.dates(), config.periodsPerYear());

        SignificanceResult jobsonKorkie = jobsonKorkie(nameA, alignedA.toArray(), nameB, alignedB.toArray(),
            periodicRiskFree, config.significanceLevel());
        BootstrapResult bootstrap = bootstrapSharpeTest.test(
            nameA, SharpeRatios.excess(alignedA.toArray(), periodicRiskFree),
            nameB, SharpeRatios.excess(alignedB.toArray(), periodicRiskFree),
            config.bootstrapIterations(), config.bootstrapSeed(), config.significanceLevel());

        log.info("📈 {} | bootstrap p {}", jobsonKorkie.describe(), "%.4f".formatted(bootstrap.pValue()));
        return new SignificanceComparison(jobsonKorkie, bootstrap);
    }

    /**
     * @param returnsA         periodic returns of A
     * @param returnsB         periodic returns of B, same periods as A
     * @param periodicRiskFree periodic risk-free rate of the same periods
     * @throws InsufficientDataException if fewer than {@link #MIN_OBSERVATIONS} periods are given
     */
    public SignificanceResult jobsonKorkie(String nameA, double[] returnsA, String nameB, double[] returnsB,
                                           double[] periodicRiskFree, double significanceLevel) {
        if (returnsA.length != returnsB.length || returnsA.length != periodicRiskFree.length) {
            throw new IllegalArgumentException("Series must be aligned: %d, %d and %d observations"
                .formatted(returnsA.length, returnsB.length, periodicRiskFree.length));
        }
        int t = returnsA.length;
        if (t < MIN_OBSERVATIONS) {
            throw new InsufficientDataException("Jobson-Korkie needs at least %d observations, got %d"
                .formatted(MIN_OBSERVATIONS, t));
        }

        double[] excessA = SharpeRatios.excess(returnsA, periodicRiskFree);
        double[] excessB = SharpeRatios.excess(returnsB, periodicRiskFree);
        double sharpeA = SharpeRatios.perPeriod(excessA);
        double sharpeB = SharpeRatios.perPeriod(excessB);

        if (Arrays.equals(returnsA, returnsB)) {
            return new SignificanceResult(nameA, nameB, sharpeA, sharpeB, 0.0, 1.0, 0.0, 1.0, false,
                significanceLevel, t, SignificanceStatus.IDENTICAL);
        }

        try {
            return determinate(nameA, nameB, excessA, excessB, sharpeA, sharpeB, significanceLevel);
        } catch (IndeterminateSignificanceException e) {
            log.warn("⚠️ {} vs {}: {}", nameA, nameB, e.getMessage());
            double correlation = correlation(excessA, excessB);
            return new SignificanceResult(nameA, nameB, sharpeA, sharpeB, sharpeA - sharpeB, correlation,
                Double.NaN, Double.NaN, false, significanceLevel, t, SignificanceStatus.INDETERMINATE);
        }
    }

    private SignificanceResult determinate(String nameA, String nameB, double[] excessA, double[] excessB,
                                           double sharpeA, double sharpeB, double significanceLevel) {
        int t = excessA.length;
        if (Double.isNaN(sharpeA) || Double.isNaN(sharpeB)) {
            throw new IndeterminateSignificanceException("Sharpe ratio undefined for a zero-volatility series");
        }
        double rho = correlation(excessA, excessB);
        double variance = (2.0 - 2.0 * rho
            + 0.5 * (sharpeA * sharpeA + sharpeB * sharpeB - 2.0 * sharpeA * sharpeB * rho * rho)) / t;
        if (!(variance > 0.0) || !Double.isFinite(variance)) {
            throw new IndeterminateSignificanceException(
                "Variance of the Sharpe difference is %.3e, not positive".formatted(variance));
        }

        double difference = sharpeA - sharpeB;
        double statistic = difference / Math.sqrt(variance);
        double pValue = 2.0 * (1.0 - STANDARD_NORMAL.cumulativeProbability(Math.abs(statistic)));
        return new SignificanceResult(nameA, nameB, sharpeA, sharpeB, difference, rho, statistic, pValue,
            pValue < significanceLevel, significanceLevel, t, SignificanceStatus.DETERMINATE);
    }

    private static double correlation(double[] x, double[] y) {
        double std = Math.sqrt(StatUtils.variance(x)) * Math.sqrt(StatUtils.variance(y));
        if (!(std > 0.0)) {
            return Double.NaN;
        }
        return new Covariance().covariance(x, y, true) / std;
    }
}
