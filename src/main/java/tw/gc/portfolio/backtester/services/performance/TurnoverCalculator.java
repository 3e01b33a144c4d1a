package tw.gc.portfolio.backtester.services.performance;

import java.util.List;

import org.springframework.stereotype.Component;

import tw.gc.portfolio.backtester.model.PortfolioWeights;

/**
 * One-way turnover between consecutive target weights and the transaction cost it incurs.
 */
@Component
public class TurnoverCalculator {

    /** Turnover of the initial purchase, when there is no previous portfolio */
    public static final double INITIAL_TURNOVER = 1.0;

    private static final double BASIS_POINTS = 10_000.0;

    /**
     * ½ Σ |w_new − w_old|, or {@link #INITIAL_TURNOVER} when {@code previous} is null.
     */
    public double turnover(PortfolioWeights previous, PortfolioWeights next) {
        if (previous == null) {
            return INITIAL_TURNOVER;
        }
        if (!previous.assets().equals(next.assets())) {
            throw new IllegalArgumentException("Cannot compare weights over different universes");
        }
        double sum = 0.0;
        for (int i = 0; i < next.size(); i++) {
            sum += Math.abs(next.weight(i) - previous.weight(i));
        }
        return sum / 2.0;
    }

    /**
     * Cost as a return fraction: turnover × bps / 10 000.
     */
    public double transactionCost(double turnover, double costBps) {
        return turnover * costBps / BASIS_POINTS;
    }

    public double averageTurnover(List<Double> turnovers) {
        return turnovers.stream().mapToDouble(Double::doubleValue).average().orElse(0.0);
    }
}
