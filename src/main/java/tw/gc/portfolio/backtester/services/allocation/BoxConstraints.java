package tw.gc.portfolio.backtester.services.allocation;

import tw.gc.portfolio.backtester.model.WeightBounds;

/**
 * Projects raw weights onto {w : Σw = 1, min <= w_i <= max}.
 *
 * <p>Weights are first clipped to the box. A surplus is then removed from every weight in
 * proportion to its headroom above {@code min}; a deficit is added in proportion to the room
 * below {@code max}. Each weight moves by at most its own headroom (or room), so the bounds hold
 * and the budget is met in a single pass whenever {@code n·min <= 1 <= n·max}. Bounds accepted
 * within {@link WeightBounds#TOLERANCE} of a full box can leave no headroom (or room) at all; the
 * clipped weights are then returned as they are.
 */
public final class BoxConstraints {

    private static final double BUDGET_EPSILON = 1e-15;

    private BoxConstraints() {
    }

    /**
     * @param raw    weights, any sign; normalized first if their sum is positive
     * @param bounds feasible bounds for {@code raw.length} assets
     * @return a new array satisfying the budget and the bounds
     * @throws IllegalArgumentException if the bounds are infeasible for this universe
     */
    public static double[] enforce(double[] raw, WeightBounds bounds) {
        int n = raw.length;
        bounds.requireFeasibleFor(n);

        double rawSum = 0.0;
        for (double w : raw) {
            rawSum += w;
        }
        double scale = rawSum > 0.0 && Double.isFinite(rawSum) ? 1.0 / rawSum : 1.0;

        double[] w = new double[n];
        double sum = 0.0;
        for (int i = 0; i < n; i++) {
            double value = Double.isFinite(raw[i]) ? raw[i] * scale : bounds.min();
            w[i] = Math.max(bounds.min(), Math.min(bounds.max(), value));
            sum += w[i];
        }

        double headroom = sum - n * bounds.min();
        double room = n * bounds.max() - sum;
        if (sum > 1.0 + BUDGET_EPSILON && headroom > 0.0) {
            double surplus = sum - 1.0;
            for (int i = 0; i < n; i++) {
                w[i] -= surplus * (w[i] - bounds.min()) / headroom;
            }
        } else if (sum < 1.0 - BUDGET_EPSILON && room > 0.0) {
            double deficit = 1.0 - sum;
            for (int i = 0; i < n; i++) {
                w[i] += deficit * (bounds.max() - w[i]) / room;
            }
        }

        for (int i = 0; i < n; i++) {
            w[i] = Math.max(bounds.min(), Math.min(bounds.max(), w[i]));
        }
        return w;
    }

    /**
     * Scales non-negative weights to sum to one.
     */
    public static double[] normalize(double[] weights) {
        double sum = 0.0;
        for (double w : weights) {
            sum += w;
        }
        double[] result = new double[weights.length];
        for (int i = 0; i < weights.length; i++) {
            result[i] = weights[i] / sum;
        }
        return result;
    }

    public static boolean satisfies(double[] weights, WeightBounds bounds, double budgetTolerance) {
        double sum = 0.0;
        for (double w : weights) {
            if (!bounds.contains(w)) {
                return false;
            }
            sum += w;
        }
        return Math.abs(sum - 1.0) <= budgetTolerance;
    }
}
