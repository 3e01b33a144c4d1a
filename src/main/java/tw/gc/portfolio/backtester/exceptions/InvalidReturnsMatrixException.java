package tw.gc.portfolio.backtester.exceptions;

/**
 * Malformed input returns: unsorted or duplicate dates, ragged rows, duplicate assets or non-finite values.
 */
public class InvalidReturnsMatrixException extends PortfolioEngineException {

    public InvalidReturnsMatrixException(String message) {
        super(message);
    }

    public InvalidReturnsMatrixException(String message, Throwable cause) {
        super(message, cause);
    }
}
