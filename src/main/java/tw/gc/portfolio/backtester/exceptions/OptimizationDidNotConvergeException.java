package tw.gc.portfolio.backtester.exceptions;

/**
 * The constrained optimizer failed or returned a solution that does not pass verification.
 */
public class OptimizationDidNotConvergeException extends PortfolioEngineException {

    public OptimizationDidNotConvergeException(String message) {
        super(message);
    }

    public OptimizationDidNotConvergeException(String message, Throwable cause) {
        super(message, cause);
    }
}
