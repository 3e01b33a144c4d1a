package tw.gc.portfolio.backtester.services.allocation;

import java.util.Objects;

import tw.gc.portfolio.backtester.enums.StrategyType;
import tw.gc.portfolio.backtester.model.PortfolioWeights;

/**
 * Equal Risk Contribution allocation.
 *
 * <p>{@code preClipMaxDeviation} is measured on the last ERC iterate, before the box bounds are
 * enforced; {@code riskContributions} describes the final, bounded weights. Clipping can make
 * the final dispersion much larger than the convergence tolerance.
 *
 * @param iterations          ERC iterations performed
 * @param converged           true if the deviation fell below tolerance within the budget
 * @param preClipMaxDeviation max |RC_i / target - 1| of the unbounded solution, NaN if not iterated
 * @param riskContributions   risk contribution dispersion of the final weights
 */
public record RiskParityResult(
    PortfolioWeights weights,
    AllocationDiagnostics diagnostics,
    int iterations,
    boolean converged,
    double preClipMaxDeviation,
    RiskContributionDiagnostics riskContributions
) implements AllocationResult {

    public RiskParityResult {
        Objects.requireNonNull(weights, "weights");
        Objects.requireNonNull(diagnostics, "diagnostics");
        Objects.requireNonNull(riskContributions, "riskContributions");
    }

    @Override
    public StrategyType strategy() {
        return StrategyType.RISK_PARITY;
    }
}
