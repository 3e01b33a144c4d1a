package tw.gc.portfolio.backtester.services.allocation;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for {@link RiskContributions}.
 */
class RiskContributionsTest {

    private static final double[][] COVARIANCE = {
        {0.04, 0.018, 0.008},
        {0.018, 0.09, 0.024},
        {0.008, 0.024, 0.16}
    };

    @Test
    @DisplayName("contributions should add up to portfolio volatility")
    void contributionsSumToVolatility() {
        double[] w = {0.5, 0.3, 0.2};
        double sigma = RiskContributions.portfolioVolatility(COVARIANCE, w);

        double[] rc = RiskContributions.contributions(COVARIANCE, w, sigma);

        assertThat(rc[0] + rc[1] + rc[2]).isCloseTo(sigma, within(1e-14));
    }

    @Test
    @DisplayName("equal weights on identical assets should have equal contributions")
    void identicalAssetsHaveEqualContributions() {
        double[][] cov = {{0.04, 0.01}, {0.01, 0.04}};

        RiskContributionDiagnostics diagnostics = RiskContributions.diagnose(cov, new double[] {0.5, 0.5});

        assertThat(diagnostics.maxRelativeDeviation()).isCloseTo(0.0, within(1e-14));
        assertThat(diagnostics.maxToMinRatio()).isCloseTo(1.0, within(1e-14));
        assertThat(diagnostics.contributionShares()).allSatisfy(share -> assertThat(share).isCloseTo(0.5, within(1e-14)));
    }

    @Test
    @DisplayName("zero portfolio volatility should give undefined diagnostics")
    void zeroVolatilityDiagnostics() {
        double[][] cov = {{0.04, -0.04}, {-0.04, 0.04}};

        RiskContributionDiagnostics diagnostics = RiskContributions.diagnose(cov, new double[] {0.5, 0.5});

        assertThat(diagnostics.portfolioVolatility()).isZero();
        assertThat(diagnostics.contributionShares()).isEmpty();
        assertThat(diagnostics.maxRelativeDeviation()).isNaN();
    }
}
