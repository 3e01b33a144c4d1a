package tw.gc.portfolio.backtester.exceptions;

/**
 * The covariance matrix cannot be inverted.
 */
public class SingularCovarianceException extends PortfolioEngineException {

    public SingularCovarianceException(String message) {
        super(message);
    }

    public SingularCovarianceException(String message, Throwable cause) {
        super(message, cause);
    }
}
