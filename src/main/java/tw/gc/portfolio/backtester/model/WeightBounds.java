package tw.gc.portfolio.backtester.model;

/**
 * Global box constraint {@code min <= w_i <= max} applied to every asset.
 *
 * @param min lower bound per asset, in [0, 1]
 * @param max upper bound per asset, in [min, 1]
 */
public record WeightBounds(double min, double max) {

    /** Slack used when comparing weights against the bounds */
    public static final double TOLERANCE = 1e-9;

    public WeightBounds {
        if (!Double.isFinite(min) || !Double.isFinite(max)) {
            throw new IllegalArgumentException("Weight bounds must be finite, got [%s, %s]".formatted(min, max));
        }
        if (min < 0.0 || max > 1.0 || min > max) {
            throw new IllegalArgumentException("Weight bounds must satisfy 0 <= min <= max <= 1, got [%s, %s]"
                .formatted(min, max));
        }
    }

    /**
     * Long-only, fully unconstrained bounds [0, 1].
     */
    public static WeightBounds longOnly() {
        return new WeightBounds(0.0, 1.0);
    }

    /**
     * A fully-invested portfolio of {@code assetCount} assets exists within these bounds
     * iff {@code n * min <= 1 <= n * max}.
     */
    public boolean isFeasibleFor(int assetCount) {
        return assetCount > 0
            && assetCount * min <= 1.0 + TOLERANCE
            && assetCount * max >= 1.0 - TOLERANCE;
    }

    /**
     * @throws IllegalArgumentException if no fully-invested portfolio satisfies the bounds
     */
    public void requireFeasibleFor(int assetCount) {
        if (!isFeasibleFor(assetCount)) {
            throw new IllegalArgumentException(
                "Weight bounds [%.4f, %.4f] are infeasible for %d assets (need n*min <= 1 <= n*max)"
                    .formatted(min, max, assetCount));
        }
    }

    public boolean contains(double weight) {
        return weight >= min - TOLERANCE && weight <= max + TOLERANCE;
    }

    public boolean isUpperBinding() {
        return max < 1.0;
    }

    public String describe() {
        return "[%.2f%%, %.2f%%]".formatted(min * 100, max * 100);
    }
}
