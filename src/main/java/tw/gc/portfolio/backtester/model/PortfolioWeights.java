package tw.gc.portfolio.backtester.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Immutable fully-invested long-only weight vector over an ordered asset universe.
 *
 * <p>Validated on construction: one finite, non-negative weight per asset and
 * {@code |sum - 1| <= 1e-6}.
 *
 * @param assets asset identifiers, in universe order
 * @param values weight per asset, aligned with {@code assets}
 */
public record PortfolioWeights(List<String> assets, List<Double> values) {

    /** Budget tolerance on the sum of weights */
    public static final double SUM_TOLERANCE = 1e-6;

    private static final double NEGATIVE_TOLERANCE = 1e-12;

    public PortfolioWeights {
        Objects.requireNonNull(assets, "assets");
        Objects.requireNonNull(values, "values");
        if (assets.isEmpty()) {
            throw new IllegalArgumentException("Weights need at least one asset");
        }
        if (assets.size() != values.size()) {
            throw new IllegalArgumentException("Got %d assets but %d weights".formatted(assets.size(), values.size()));
        }
        double sum = 0.0;
        for (int i = 0; i < values.size(); i++) {
            Double w = values.get(i);
            if (w == null || !Double.isFinite(w) || w < -NEGATIVE_TOLERANCE) {
                throw new IllegalArgumentException("Invalid weight %s for %s".formatted(w, assets.get(i)));
            }
            sum += w;
        }
        if (Math.abs(sum - 1.0) > SUM_TOLERANCE) {
            throw new IllegalArgumentException("Weights must sum to 1, got %.10f".formatted(sum));
        }
        assets = List.copyOf(assets);
        values = List.copyOf(values);
    }

    public static PortfolioWeights of(List<String> assets, double[] weights) {
        List<Double> boxed = new ArrayList<>(weights.length);
        for (double w : weights) {
            boxed.add(w);
        }
        return new PortfolioWeights(assets, boxed);
    }

    /**
     * 1/N weights.
     */
    public static PortfolioWeights equal(List<String> assets) {
        int n = assets.size();
        if (n == 0) {
            throw new IllegalArgumentException("Weights need at least one asset");
        }
        return new PortfolioWeights(assets, Collections.nCopies(n, 1.0 / n));
    }

    public int size() {
        return values.size();
    }

    public double weight(int index) {
        return values.get(index);
    }

    public double weight(String asset) {
        int index = assets.indexOf(asset);
        if (index < 0) {
            throw new IllegalArgumentException("Unknown asset: " + asset);
        }
        return values.get(index);
    }

    public double[] toArray() {
        double[] result = new double[values.size()];
        for (int i = 0; i < result.length; i++) {
            result[i] = values.get(i);
        }
        return result;
    }

    /**
     * Weighted sum of one period's simple returns.
     */
    public double apply(double[] simpleReturns) {
        if (simpleReturns.length != values.size()) {
            throw new IllegalArgumentException("Got %d returns for %d weights".formatted(simpleReturns.length, values.size()));
        }
        double total = 0.0;
        for (int i = 0; i < simpleReturns.length; i++) {
            total += values.get(i) * simpleReturns[i];
        }
        return total;
    }

    public boolean within(WeightBounds bounds) {
        return values.stream().allMatch(bounds::contains);
    }

    /**
     * Herfindahl-Hirschman concentration index, sum of squared weights (1/N .. 1).
     */
    public double herfindahlIndex() {
        return values.stream().mapToDouble(w -> w * w).sum();
    }

    /**
     * Effective number of assets, 1 / HHI.
     */
    public double effectiveAssetCount() {
        return 1.0 / herfindahlIndex();
    }
}
