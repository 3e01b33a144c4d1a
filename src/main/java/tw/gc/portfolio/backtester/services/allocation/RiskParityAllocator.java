package tw.gc.portfolio.backtester.services.allocation;

import java.util.ArrayList;
import java.util.List;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import tw.gc.portfolio.backtester.config.BacktestConfig;
import tw.gc.portfolio.backtester.enums.AllocationMethod;
import tw.gc.portfolio.backtester.enums.StrategyType;
import tw.gc.portfolio.backtester.enums.WarningCode;
import tw.gc.portfolio.backtester.exceptions.DegenerateCovarianceException;
import tw.gc.portfolio.backtester.model.AllocationWarning;
import tw.gc.portfolio.backtester.model.EstimatedParameters;
import tw.gc.portfolio.backtester.model.PortfolioWeights;
import tw.gc.portfolio.backtester.model.WeightBounds;

/**
 * Equal Risk Contribution allocation by damped multiplicative fixed-point iteration.
 *
 * <pre>
 *   w⁰ ∝ 1/σ_i
 *   σ_p = sqrt(wᵀΣw),  RC_i = w_i (Σw)_i / σ_p,  target = σ_p / n
 *   w_i ← w_i · (target / RC_i)^τ,  then Σw = 1
 * </pre>
 * Stops once max |RC_i / target − 1| is below the tolerance, otherwise keeps the last iterate
 * after the iteration budget. The result is then projected onto the box bounds; the risk
 * contribution dispersion after that projection is reported, not hidden.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class RiskParityAllocator implements PortfolioAllocator {

    /** Portfolio volatility below this is treated as degenerate */
    private static final double ZERO_VOLATILITY = 1e-12;

    /** Step ratio used for an asset whose risk contribution is not positive */
    private static final double MAX_STEP_RATIO = 10.0;

    private final EqualWeightAllocator equalWeightAllocator;

    /**
     * State of the ERC iteration when it stopped.
     */
    record ErcIteration(double[] weights, int iterations, boolean converged, double maxRelativeDeviation) {
    }

    @Override
    public StrategyType strategyType() {
        return StrategyType.RISK_PARITY;
    }

    @Override
    public AllocationResult allocate(AllocationRequest request) {
        EstimatedParameters params = request.requireParameters();
        BacktestConfig config = request.config();
        WeightBounds bounds = config.weightBounds();
        bounds.requireFeasibleFor(request.assetCount());

        List<AllocationWarning> warnings = new ArrayList<>(params.warnings());
        double[] volatilities = params.volatilities();
        for (int i = 0; i < volatilities.length; i++) {
            if (!(volatilities[i] > ZERO_VOLATILITY)) {
                String message = "Asset %s has zero volatility in window ending %s"
                    .formatted(params.assets().get(i), params.windowEnd());
                log.warn("⚠️ {}; inverse-volatility start impossible, using equal weight", message);
                warnings.add(AllocationWarning.of(WarningCode.ZERO_ASSET_VOLATILITY, message));
                return equalWeightResult(params, warnings);
            }
        }

        double[][] covariance = params.covariance();
        double[] start = inverseVolatility(volatilities);
        ErcIteration iteration;
        try {
            iteration = iterate(start, covariance, config.riskParityTolerance(),
                config.riskParityMaxIterations(), config.riskParityDamping());
        } catch (DegenerateCovarianceException e) {
            log.warn("⚠️ {}; using inverse-volatility weights", e.getMessage());
            warnings.add(AllocationWarning.of(WarningCode.DEGENERATE_COVARIANCE, e.getMessage()));
            return inverseVolatilityResult(params, bounds, warnings);
        }

        if (!iteration.converged()) {
            String message = "ERC did not converge in %d iterations (max deviation %.3e > %.1e)"
                .formatted(iteration.iterations(), iteration.maxRelativeDeviation(), config.riskParityTolerance());
            log.warn("⚠️ {} for window ending {}; keeping last iterate", message, params.windowEnd());
            warnings.add(AllocationWarning.of(WarningCode.RISK_PARITY_DID_NOT_CONVERGE, message));
        } else {
            log.debug("ERC converged in {} iterations for window ending {}", iteration.iterations(), params.windowEnd());
        }

        double[] bounded = BoxConstraints.enforce(iteration.weights(), bounds);
        return new RiskParityResult(
            PortfolioWeights.of(params.assets(), bounded),
            AllocationDiagnostics.of(AllocationMethod.EQUAL_RISK_CONTRIBUTION, warnings),
            iteration.iterations(),
            iteration.converged(),
            iteration.maxRelativeDeviation(),
            RiskContributions.diagnose(covariance, bounded)
        );
    }

    @Override
    public AllocationResult fallback(AllocationRequest request, AllocationWarning reason) {
        List<AllocationWarning> warnings = new ArrayList<>();
        warnings.add(reason);
        EstimatedParameters params = request.parameters();
        if (params == null) {
            PortfolioWeights weights = equalWeightAllocator.weights(request.assets());
            return new RiskParityResult(weights,
                AllocationDiagnostics.of(AllocationMethod.EQUAL_WEIGHT_FALLBACK, warnings),
                0, false, Double.NaN,
                new RiskContributionDiagnostics(Double.NaN, List.of(), Double.NaN, Double.NaN, Double.NaN));
        }
        warnings.addAll(params.warnings());
        for (double vol : params.volatilities()) {
            if (!(vol > ZERO_VOLATILITY)) {
                warnings.add(AllocationWarning.of(WarningCode.ZERO_ASSET_VOLATILITY,
                    "Zero asset volatility in window ending " + params.windowEnd()));
                return equalWeightResult(params, warnings);
            }
        }
        return inverseVolatilityResult(params, request.config().weightBounds(), warnings);
    }

    /**
     * Runs the damped ERC fixed point from {@code start}.
     *
     * @throws DegenerateCovarianceException if portfolio volatility collapses to zero
     */
    ErcIteration iterate(double[] start, double[][] covariance, double tolerance, int maxIterations, double damping) {
        int n = start.length;
        double[] w = BoxConstraints.normalize(start);
        for (int k = 0; k < maxIterations; k++) {
            double sigma = RiskContributions.portfolioVolatility(covariance, w);
            if (!(sigma > ZERO_VOLATILITY)) {
                throw new DegenerateCovarianceException("Portfolio volatility %.3e is numerically zero at iteration %d"
                    .formatted(sigma, k));
            }
            double[] rc = RiskContributions.contributions(covariance, w, sigma);
            double deviation = RiskContributions.maxRelativeDeviation(rc, sigma);
            if (deviation < tolerance) {
                return new ErcIteration(w, k, true, deviation);
            }
            double target = sigma / n;
            double[] next = new double[n];
            for (int i = 0; i < n; i++) {
                double ratio = rc[i] > 0.0 ? target / rc[i] : MAX_STEP_RATIO;
                next[i] = w[i] * Math.pow(ratio, damping);
            }
            w = BoxConstraints.normalize(next);
        }
        double sigma = RiskContributions.portfolioVolatility(covariance, w);
        if (!(sigma > ZERO_VOLATILITY)) {
            throw new DegenerateCovarianceException("Portfolio volatility %.3e is numerically zero".formatted(sigma));
        }
        double deviation = RiskContributions.maxRelativeDeviation(
            RiskContributions.contributions(covariance, w, sigma), sigma);
        return new ErcIteration(w, maxIterations, deviation < tolerance, deviation);
    }

    /**
     * w_i ∝ 1 / σ_i
     */
    static double[] inverseVolatility(double[] volatilities) {
        double[] inverse = new double[volatilities.length];
        for (int i = 0; i < volatilities.length; i++) {
            inverse[i] = 1.0 / volatilities[i];
        }
        return BoxConstraints.normalize(inverse);
    }

    private RiskParityResult inverseVolatilityResult(EstimatedParameters params, WeightBounds bounds,
                                                     List<AllocationWarning> warnings) {
        double[] weights = BoxConstraints.enforce(inverseVolatility(params.volatilities()), bounds);
        return new RiskParityResult(
            PortfolioWeights.of(params.assets(), weights),
            AllocationDiagnostics.of(AllocationMethod.INVERSE_VOLATILITY_FALLBACK, warnings),
            0, false, Double.NaN,
            RiskContributions.diagnose(params.covariance(), weights)
        );
    }

    private RiskParityResult equalWeightResult(EstimatedParameters params, List<AllocationWarning> warnings) {
        PortfolioWeights weights = equalWeightAllocator.weights(params.assets());
        return new RiskParityResult(
            weights,
            AllocationDiagnostics.of(AllocationMethod.EQUAL_WEIGHT_FALLBACK, warnings),
            0, false, Double.NaN,
            RiskContributions.diagnose(params.covariance(), weights.toArray())
        );
    }
}
