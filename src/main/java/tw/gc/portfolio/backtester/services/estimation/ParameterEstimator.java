package tw.gc.portfolio.backtester.services.estimation;

import java.util.ArrayList;
import java.util.List;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.math3.stat.StatUtils;
import org.apache.commons.math3.stat.correlation.Covariance;
import org.springframework.stereotype.Service;

import tw.gc.portfolio.backtester.config.BacktestConfig;
import tw.gc.portfolio.backtester.enums.CovarianceMethod;
import tw.gc.portfolio.backtester.enums.WarningCode;
import tw.gc.portfolio.backtester.exceptions.InsufficientDataException;
import tw.gc.portfolio.backtester.model.AllocationWarning;
import tw.gc.portfolio.backtester.model.EstimatedParameters;
import tw.gc.portfolio.backtester.model.ReturnsMatrix;

/**
 * Turns an estimation window into annualized expected returns and covariance.
 *
 * <p>Pure function of the window: no state, no look-ahead, safe to call from any thread.
 * Zero-variance assets are kept; the allocators decide how to deal with a singular matrix.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class ParameterEstimator {

    private final LedoitWolfShrinkage ledoitWolfShrinkage;

    /**
     * Estimates parameters with the settings of {@code config}. The risk-free rate is the
     * annualized mean of the rates dated inside the window.
     */
    public EstimatedParameters estimate(ReturnsMatrix window, BacktestConfig config) {
        double riskFree = config.riskFreeRate().annualizedOver(window.dates(), config.periodsPerYear());
        return estimate(window, config.periodsPerYear(), config.minEstimationPeriods(),
            config.covarianceMethod(), riskFree);
    }

    /**
     * @throws InsufficientDataException if the window has fewer than {@code minPeriods} rows
     */
    public EstimatedParameters estimate(ReturnsMatrix window, int periodsPerYear, int minPeriods,
                                        CovarianceMethod method, double annualRiskFreeRate) {
        int rows = window.rows();
        if (rows < Math.max(2, minPeriods)) {
            throw new InsufficientDataException("Estimation window has %d periods, at least %d required"
                .formatted(rows, Math.max(2, minPeriods)));
        }
        int n = window.assetCount();
        double[][] data = window.toArray();

        double[] expected = new double[n];
        for (int i = 0; i < n; i++) {
            expected[i] = StatUtils.mean(window.column(i)) * periodsPerYear;
        }

        List<AllocationWarning> warnings = new ArrayList<>();
        double[][] periodic;
        double intensity = 0.0;
        CovarianceMethod used = method;
        if (method == CovarianceMethod.LEDOIT_WOLF) {
            LedoitWolfShrinkage.ShrinkageEstimate shrinkage = ledoitWolfShrinkage.shrink(data);
            periodic = shrinkage.covariance();
            intensity = shrinkage.intensity();
            if (!shrinkage.applied()) {
                used = CovarianceMethod.SAMPLE;
                periodic = new Covariance(data, true).getCovarianceMatrix().getData();
                warnings.add(AllocationWarning.of(WarningCode.SHRINKAGE_UNAVAILABLE,
                    "Ledoit-Wolf target undefined for window ending %s, sample covariance used"
                        .formatted(window.date(rows - 1))));
            }
        } else if (n == 1) {
            periodic = new double[][] {{StatUtils.variance(window.column(0))}};
        } else {
            periodic = new Covariance(data, true).getCovarianceMatrix().getData();
        }

        double[][] annualized = new double[n][n];
        for (int i = 0; i < n; i++) {
            for (int j = 0; j < n; j++) {
                annualized[i][j] = periodic[i][j] * periodsPerYear;
            }
        }

        log.debug("Estimated {} assets over {} periods ({} → {}), method={}, shrinkage={}",
            n, rows, window.date(0), window.date(rows - 1), used, intensity);

        return new EstimatedParameters(
            window.assets(),
            expected,
            annualized,
            annualRiskFreeRate,
            rows,
            window.date(0),
            window.date(rows - 1),
            used,
            intensity,
            warnings
        );
    }
}
