package tw.gc.portfolio.backtester.services.allocation;

import java.util.Objects;

import tw.gc.portfolio.backtester.enums.StrategyType;
import tw.gc.portfolio.backtester.model.PortfolioWeights;

public record EqualWeightResult(PortfolioWeights weights, AllocationDiagnostics diagnostics)
    implements AllocationResult {

    public EqualWeightResult {
        Objects.requireNonNull(weights, "weights");
        Objects.requireNonNull(diagnostics, "diagnostics");
    }

    @Override
    public StrategyType strategy() {
        return StrategyType.EQUAL_WEIGHT;
    }
}
