package tw.gc.portfolio.backtester.services.allocation;

import java.util.List;

/**
 * Dispersion of per-asset risk contributions RC_i = w_i (Σw)_i / σ_p around the equal target σ_p / n.
 *
 * @param portfolioVolatility   σ_p
 * @param contributionShares    RC_i / σ_p per asset, sums to 1
 * @param maxRelativeDeviation  max |RC_i / target - 1|
 * @param contributionStdDev    population std of RC_i / σ_p
 * @param maxToMinRatio         max RC_i / min RC_i, infinite when some contribution is not positive
 */
public record RiskContributionDiagnostics(
    double portfolioVolatility,
    List<Double> contributionShares,
    double maxRelativeDeviation,
    double contributionStdDev,
    double maxToMinRatio
) {
    public RiskContributionDiagnostics {
        contributionShares = contributionShares == null ? List.of() : List.copyOf(contributionShares);
    }
}
