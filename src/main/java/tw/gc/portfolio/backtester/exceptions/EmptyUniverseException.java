package tw.gc.portfolio.backtester.exceptions;

/**
 * The asset universe is empty. Aborts the whole run.
 */
public class EmptyUniverseException extends PortfolioEngineException {

    public EmptyUniverseException(String message) {
        super(message);
    }

    public EmptyUniverseException(String message, Throwable cause) {
        super(message, cause);
    }
}
