package tw.gc.portfolio.backtester.services.allocation;

import java.util.List;
import java.util.Objects;

import tw.gc.portfolio.backtester.config.BacktestConfig;
import tw.gc.portfolio.backtester.exceptions.EmptyUniverseException;
import tw.gc.portfolio.backtester.model.EstimatedParameters;

/**
 * Input of one allocation.
 *
 * @param assets     ordered asset universe
 * @param parameters estimated moments, null for strategies that need none
 * @param config     run settings (bounds, tolerances, iteration budgets)
 */
public record AllocationRequest(List<String> assets, EstimatedParameters parameters, BacktestConfig config) {

    public AllocationRequest {
        Objects.requireNonNull(config, "config");
        if (assets == null || assets.isEmpty()) {
            throw new EmptyUniverseException("Cannot allocate over an empty universe");
        }
        assets = List.copyOf(assets);
        if (parameters != null && !parameters.assets().equals(assets)) {
            throw new IllegalArgumentException("Estimated parameters do not match the asset universe");
        }
    }

    public static AllocationRequest of(EstimatedParameters parameters, BacktestConfig config) {
        return new AllocationRequest(parameters.assets(), parameters, config);
    }

    public int assetCount() {
        return assets.size();
    }

    public EstimatedParameters requireParameters() {
        if (parameters == null) {
            throw new IllegalArgumentException("This allocator needs estimated parameters");
        }
        return parameters;
    }
}
