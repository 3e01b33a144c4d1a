package tw.gc.portfolio.backtester.services.allocation;

import tw.gc.portfolio.backtester.enums.StrategyType;
import tw.gc.portfolio.backtester.model.AllocationWarning;

/**
 * Turns estimated parameters into a fully-invested weight vector within the box bounds.
 *
 * <p>Implementations are stateless and thread-safe. Recoverable numerical failures are handled
 * inside {@link #allocate} and surface as degraded results, never as exceptions.
 */
public interface PortfolioAllocator {

    StrategyType strategyType();

    /**
     * Runs the primary allocation method, falling back internally when it fails.
     */
    AllocationResult allocate(AllocationRequest request);

    /**
     * Produces the strategy's own fallback without attempting the primary method. Used when the
     * primary method was aborted from outside, e.g. on timeout. Must be cheap and must not fail
     * on a feasible request.
     *
     * @param reason why the primary method was abandoned
     */
    AllocationResult fallback(AllocationRequest request, AllocationWarning reason);
}
