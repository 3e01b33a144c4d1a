package tw.gc.portfolio.backtester.services.estimation;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Ledoit-Wolf (2004) shrinkage of the sample covariance towards the constant-correlation target.
 *
 * <p>The target keeps every sample variance and replaces each correlation by the average sample
 * correlation. The intensity minimizing the expected Frobenius loss is estimated from the data
 * and clamped to [0, 1]:
 * <pre>
 *   Σ* = δ·F + (1 − δ)·S,   δ = max(0, min(1, (π − ρ) / γ / T))
 * </pre>
 * Moments use the 1/T normalization of the original estimator and are per-period (not annualized).
 */
@Component
@Slf4j
public class LedoitWolfShrinkage {

    /**
     * Shrunk covariance and the intensity that produced it.
     *
     * @param covariance per-period covariance matrix
     * @param intensity  shrinkage intensity δ in [0, 1]
     * @param applied    false if the target could not be built and the sample covariance was returned
     */
    public record ShrinkageEstimate(double[][] covariance, double intensity, boolean applied) {
    }

    /**
     * @param returns per-period observations, {@code [row][asset]}, at least two rows
     */
    public ShrinkageEstimate shrink(double[][] returns) {
        int t = returns.length;
        int n = returns[0].length;

        double[][] x = demean(returns);
        double[][] sample = crossProduct(x, x, t);

        double[] sqrtVar = new double[n];
        for (int i = 0; i < n; i++) {
            sqrtVar[i] = Math.sqrt(sample[i][i]);
        }
        if (n < 2) {
            return new ShrinkageEstimate(sample, 0.0, false);
        }
        for (int i = 0; i < n; i++) {
            if (!(sqrtVar[i] > 0.0)) {
                log.warn("⚠️ Ledoit-Wolf target undefined: asset {} has zero variance, using sample covariance", i);
                return new ShrinkageEstimate(sample, 0.0, false);
            }
        }

        // average pairwise correlation
        double correlationSum = 0.0;
        for (int i = 0; i < n; i++) {
            for (int j = 0; j < n; j++) {
                if (i != j) {
                    correlationSum += sample[i][j] / (sqrtVar[i] * sqrtVar[j]);
                }
            }
        }
        double rBar = correlationSum / (n * (n - 1.0));

        double[][] prior = new double[n][n];
        for (int i = 0; i < n; i++) {
            for (int j = 0; j < n; j++) {
                prior[i][j] = i == j ? sample[i][i] : rBar * sqrtVar[i] * sqrtVar[j];
            }
        }

        // π: asymptotic variance of the sample covariance entries
        double[][] y = new double[t][n];
        double[][] x3 = new double[t][n];
        for (int r = 0; r < t; r++) {
            for (int i = 0; i < n; i++) {
                double v = x[r][i];
                y[r][i] = v * v;
                x3[r][i] = v * v * v;
            }
        }
        double[][] yy = crossProduct(y, y, t);
        double[][] xx = crossProduct(x, x, 1);
        double[][] phiMat = new double[n][n];
        double phi = 0.0;
        for (int i = 0; i < n; i++) {
            for (int j = 0; j < n; j++) {
                phiMat[i][j] = yy[i][j] - 2.0 * xx[i][j] * sample[i][j] / t + sample[i][j] * sample[i][j];
                phi += phiMat[i][j];
            }
        }

        // ρ: covariance between the target and the sample estimates
        double[][] x3x = crossProduct(x3, x, t);
        double rho = 0.0;
        for (int i = 0; i < n; i++) {
            rho += phiMat[i][i];
        }
        double offDiagonal = 0.0;
        for (int i = 0; i < n; i++) {
            for (int j = 0; j < n; j++) {
                if (i != j) {
                    double theta = x3x[i][j] - sample[i][i] * sample[i][j];
                    offDiagonal += (sqrtVar[j] / sqrtVar[i]) * theta;
                }
            }
        }
        rho += rBar * offDiagonal;

        // γ: misspecification of the target
        double gamma = 0.0;
        for (int i = 0; i < n; i++) {
            for (int j = 0; j < n; j++) {
                double diff = sample[i][j] - prior[i][j];
                gamma += diff * diff;
            }
        }

        double intensity = gamma > 0.0 ? Math.max(0.0, Math.min(1.0, (phi - rho) / gamma / t)) : 0.0;

        double[][] shrunk = new double[n][n];
        for (int i = 0; i < n; i++) {
            for (int j = 0; j < n; j++) {
                shrunk[i][j] = intensity * prior[i][j] + (1.0 - intensity) * sample[i][j];
            }
        }
        log.debug("Ledoit-Wolf intensity {} (rBar={}, T={}, N={})", intensity, rBar, t, n);
        return new ShrinkageEstimate(shrunk, intensity, true);
    }

    private static double[][] demean(double[][] returns) {
        int t = returns.length;
        int n = returns[0].length;
        double[] means = new double[n];
        for (double[] row : returns) {
            for (int i = 0; i < n; i++) {
                means[i] += row[i];
            }
        }
        for (int i = 0; i < n; i++) {
            means[i] /= t;
        }
        double[][] x = new double[t][n];
        for (int r = 0; r < t; r++) {
            for (int i = 0; i < n; i++) {
                x[r][i] = returns[r][i] - means[i];
            }
        }
        return x;
    }

    /**
     * a'b / divisor
     */
    private static double[][] crossProduct(double[][] a, double[][] b, double divisor) {
        int n = a[0].length;
        double[][] result = new double[n][n];
        for (int r = 0; r < a.length; r++) {
            for (int i = 0; i < n; i++) {
                double ai = a[r][i];
                for (int j = 0; j < n; j++) {
                    result[i][j] += ai * b[r][j];
                }
            }
        }
        for (int i = 0; i < n; i++) {
            for (int j = 0; j < n; j++) {
                result[i][j] /= divisor;
            }
        }
        return result;
    }
}
