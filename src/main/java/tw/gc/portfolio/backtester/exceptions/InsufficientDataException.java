package tw.gc.portfolio.backtester.exceptions;

/**
 * A window holds fewer observations than the computation needs.
 */
public class InsufficientDataException extends PortfolioEngineException {

    public InsufficientDataException(String message) {
        super(message);
    }

    public InsufficientDataException(String message, Throwable cause) {
        super(message, cause);
    }
}
