package tw.gc.portfolio.backtester.services.allocation;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

import tw.gc.portfolio.backtester.enums.StrategyType;
import tw.gc.portfolio.backtester.model.PortfolioWeights;

/**
 * Outcome of one allocation: weights plus strategy-specific diagnostics.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type")
@JsonSubTypes({
    @JsonSubTypes.Type(value = EqualWeightResult.class, name = "EQUAL_WEIGHT"),
    @JsonSubTypes.Type(value = MeanVarianceResult.class, name = "MEAN_VARIANCE"),
    @JsonSubTypes.Type(value = RiskParityResult.class, name = "RISK_PARITY")
})
public sealed interface AllocationResult permits EqualWeightResult, MeanVarianceResult, RiskParityResult {

    StrategyType strategy();

    PortfolioWeights weights();

    AllocationDiagnostics diagnostics();

    default boolean degraded() {
        return diagnostics().degraded();
    }
}
