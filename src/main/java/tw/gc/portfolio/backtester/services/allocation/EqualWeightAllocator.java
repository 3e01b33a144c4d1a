package tw.gc.portfolio.backtester.services.allocation;

import java.util.List;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import tw.gc.portfolio.backtester.enums.AllocationMethod;
import tw.gc.portfolio.backtester.enums.StrategyType;
import tw.gc.portfolio.backtester.exceptions.EmptyUniverseException;
import tw.gc.portfolio.backtester.model.AllocationWarning;
import tw.gc.portfolio.backtester.model.PortfolioWeights;

/**
 * 1/N allocation. Ignores all return data.
 */
@Component
@Slf4j
public class EqualWeightAllocator implements PortfolioAllocator {

    @Override
    public StrategyType strategyType() {
        return StrategyType.EQUAL_WEIGHT;
    }

    @Override
    public AllocationResult allocate(AllocationRequest request) {
        request.config().weightBounds().requireFeasibleFor(request.assetCount());
        return new EqualWeightResult(weights(request.assets()), AllocationDiagnostics.clean(AllocationMethod.EQUAL_WEIGHT));
    }

    @Override
    public AllocationResult fallback(AllocationRequest request, AllocationWarning reason) {
        log.warn("⚠️ Equal weight allocation replaced by itself after: {}", reason.message());
        return new EqualWeightResult(weights(request.assets()),
            AllocationDiagnostics.of(AllocationMethod.EQUAL_WEIGHT, List.of(reason)));
    }

    /**
     * @throws EmptyUniverseException if {@code assets} is empty
     */
    public PortfolioWeights weights(List<String> assets) {
        if (assets == null || assets.isEmpty()) {
            throw new EmptyUniverseException("Cannot build equal weights for an empty universe");
        }
        return PortfolioWeights.equal(assets);
    }
}
