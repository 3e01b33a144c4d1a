package tw.gc.portfolio.backtester.exceptions;

/**
 * Portfolio volatility collapsed to (numerically) zero during an iterative allocation.
 */
public class DegenerateCovarianceException extends PortfolioEngineException {

    public DegenerateCovarianceException(String message) {
        super(message);
    }

    public DegenerateCovarianceException(String message, Throwable cause) {
        super(message, cause);
    }
}
