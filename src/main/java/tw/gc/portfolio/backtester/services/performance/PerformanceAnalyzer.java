package tw.gc.portfolio.backtester.services.performance;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.math3.stat.StatUtils;
import org.springframework.stereotype.Service;

import tw.gc.portfolio.backtester.model.PerformanceMetrics;
import tw.gc.portfolio.backtester.model.RealizedReturnSeries;
import tw.gc.portfolio.backtester.model.RiskFreeRate;

/**
 * Risk/return metrics of realized portfolio returns.
 *
 * <p>All annualized figures follow one convention: arithmetic mean periodic value × periods per
 * year for returns, standard deviation × sqrt(periods per year) for dispersion. Only recorded
 * periods count as observations; skipped periods are absent from the series rather than zero.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class PerformanceAnalyzer {

    private final ValueAtRiskCalculator valueAtRiskCalculator;

    public PerformanceMetrics analyze(RealizedReturnSeries series, RiskFreeRate riskFreeRate, int periodsPerYear) {
        return analyze(series.toArray(), riskFreeRate.periodicRates(series.dates(), periodsPerYear), periodsPerYear);
    }

    /**
     * @param returns          periodic simple returns
     * @param periodicRiskFree periodic risk-free rate aligned with {@code returns}
     * @param periodsPerYear   annualization factor
     */
    public PerformanceMetrics analyze(double[] returns, double[] periodicRiskFree, int periodsPerYear) {
        if (returns.length != periodicRiskFree.length) {
            throw new IllegalArgumentException("Got %d returns but %d risk-free rates"
                .formatted(returns.length, periodicRiskFree.length));
        }
        int n = returns.length;
        if (n == 0) {
            return PerformanceMetrics.empty();
        }

        double[] excess = new double[n];
        for (int i = 0; i < n; i++) {
            excess[i] = returns[i] - periodicRiskFree[i];
        }

        double annualizedReturn = StatUtils.mean(returns) * periodsPerYear;
        double annualizedExcess = StatUtils.mean(excess) * periodsPerYear;
        double volatility = n > 1 ? Math.sqrt(StatUtils.variance(returns)) * Math.sqrt(periodsPerYear) : Double.NaN;
        double sharpe = volatility > 0.0 ? annualizedExcess / volatility : Double.NaN;

        double downsideSquares = 0.0;
        int downsideCount = 0;
        for (double e : excess) {
            if (e < 0.0) {
                downsideSquares += e * e;
                downsideCount++;
            }
        }
        boolean downsideObserved = downsideCount > 0;
        double sortino = Double.NaN;
        if (downsideObserved) {
            double downsideDeviation = Math.sqrt(downsideSquares / downsideCount) * Math.sqrt(periodsPerYear);
            sortino = annualizedExcess / downsideDeviation;
        }

        double value = 1.0;
        double peak = 1.0;
        double maxDrawdown = 0.0;
        int positive = 0;
        for (double r : returns) {
            value *= 1.0 + r;
            peak = Math.max(peak, value);
            maxDrawdown = Math.min(maxDrawdown, value / peak - 1.0);
            if (r > 0.0) {
                positive++;
            }
        }

        ValueAtRiskCalculator.ValueAtRiskResult var = valueAtRiskCalculator.calculate(returns);

        return new PerformanceMetrics(
            n,
            annualizedReturn,
            value - 1.0,
            volatility,
            sharpe,
            sortino,
            downsideObserved,
            maxDrawdown,
            var.var95(),
            var.cvar95(),
            var.var99(),
            var.cvar99(),
            (double) positive / n
        );
    }
}
