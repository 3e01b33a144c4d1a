package tw.gc.portfolio.backtester.services.performance;

import java.util.Arrays;

import org.springframework.stereotype.Component;

/**
 * Historical Value-at-Risk and expected shortfall of a periodic return series.
 * Losses are reported as positive fractions; a series without losses in the tail reports 0.
 */
@Component
public class ValueAtRiskCalculator {

    public ValueAtRiskResult calculate(double[] returns) {
        if (returns.length == 0) {
            return new ValueAtRiskResult(Double.NaN, Double.NaN, Double.NaN, Double.NaN, 0);
        }
        return new ValueAtRiskResult(
            historicalVar(returns, 0.95),
            historicalVar(returns, 0.99),
            conditionalVar(returns, 0.95),
            conditionalVar(returns, 0.99),
            returns.length
        );
    }

    public double historicalVar(double[] returns, double confidence) {
        double[] sorted = returns.clone();
        Arrays.sort(sorted);
        double quantile = sorted[tailIndex(sorted.length, confidence)];
        return Math.max(0.0, -quantile);
    }

    public double conditionalVar(double[] returns, double confidence) {
        double[] sorted = returns.clone();
        Arrays.sort(sorted);
        double threshold = sorted[tailIndex(sorted.length, confidence)];

        double sum = 0.0;
        int count = 0;
        for (double value : sorted) {
            if (value <= threshold) {
                sum += value;
                count++;
            }
        }

        if (count == 0) {
            return 0.0;
        }

        return Math.max(0.0, -(sum / count));
    }

    private static int tailIndex(int size, double confidence) {
        int index = (int) Math.floor((1.0 - confidence) * size);
        return Math.min(Math.max(index, 0), size - 1);
    }

    public record ValueAtRiskResult(
        double var95,
        double var99,
        double cvar95,
        double cvar99,
        int sampleSize
    ) {
    }
}
