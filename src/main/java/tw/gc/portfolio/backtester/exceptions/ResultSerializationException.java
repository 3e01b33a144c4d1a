package tw.gc.portfolio.backtester.exceptions;

/**
 * Backtest output could not be written to or read from JSON.
 */
public class ResultSerializationException extends PortfolioEngineException {

    public ResultSerializationException(String message) {
        super(message);
    }

    public ResultSerializationException(String message, Throwable cause) {
        super(message, cause);
    }
}
