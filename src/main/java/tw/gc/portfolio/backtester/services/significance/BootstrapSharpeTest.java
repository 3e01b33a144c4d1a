package tw.gc.portfolio.backtester.services.significance;

import java.util.Arrays;
import java.util.Random;

import lombok.extern.slf4j.Slf4j;
import org.apache.commons.math3.stat.StatUtils;
import org.apache.commons.math3.stat.descriptive.rank.Percentile;
import org.springframework.stereotype.Component;

import tw.gc.portfolio.backtester.exceptions.InsufficientDataException;
import tw.gc.portfolio.backtester.model.BootstrapResult;

/**
 * Distribution-free check of a Sharpe ratio difference: periods are resampled in pairs with
 * replacement, so the dependence between the two strategies is preserved.
 */
@Component
@Slf4j
public class BootstrapSharpeTest {

    /**
     * @param excessA per-period excess returns of A
     * @param excessB per-period excess returns of B, aligned with A
     */
    public BootstrapResult test(String nameA, double[] excessA, String nameB, double[] excessB,
                                int iterations, long seed, double significanceLevel) {
        if (excessA.length != excessB.length) {
            throw new IllegalArgumentException("Series must be aligned: %d vs %d observations"
                .formatted(excessA.length, excessB.length));
        }
        int t = excessA.length;
        if (t < 3) {
            throw new InsufficientDataException("Bootstrap needs at least 3 observations, got " + t);
        }

        double observed = SharpeRatios.perPeriod(excessA) - SharpeRatios.perPeriod(excessB);

        Random random = new Random(seed);
        double[] differences = new double[iterations];
        int valid = 0;
        double[] sampleA = new double[t];
        double[] sampleB = new double[t];
        for (int b = 0; b < iterations; b++) {
            for (int i = 0; i < t; i++) {
                int index = random.nextInt(t);
                sampleA[i] = excessA[index];
                sampleB[i] = excessB[index];
            }
            double difference = SharpeRatios.perPeriod(sampleA) - SharpeRatios.perPeriod(sampleB);
            if (Double.isFinite(difference)) {
                differences[valid++] = difference;
            }
        }

        if (valid == 0) {
            log.warn("⚠️ Bootstrap {} vs {}: no resample had defined Sharpe ratios", nameA, nameB);
            return new BootstrapResult(nameA, nameB, iterations, 0, seed, observed,
                Double.NaN, Double.NaN, Double.NaN, Double.NaN, Double.NaN, false);
        }

        double[] kept = Arrays.copyOf(differences, valid);
        int atOrBelowZero = 0;
        int atOrAboveZero = 0;
        for (double d : kept) {
            if (d <= 0.0) {
                atOrBelowZero++;
            }
            if (d >= 0.0) {
                atOrAboveZero++;
            }
        }
        double pValue = Math.min(1.0, 2.0 * Math.min(atOrBelowZero, atOrAboveZero) / valid);

        Percentile percentile = new Percentile();
        percentile.setData(kept);
        double lower = percentile.evaluate(2.5);
        double upper = percentile.evaluate(97.5);

        return new BootstrapResult(
            nameA,
            nameB,
            iterations,
            valid,
            seed,
            observed,
            StatUtils.mean(kept),
            valid > 1 ? Math.sqrt(StatUtils.variance(kept)) : 0.0,
            lower,
            upper,
            pValue,
            pValue < significanceLevel
        );
    }
}
