package tw.gc.portfolio.backtester.exceptions;

/**
 * The variance of a Sharpe ratio difference is not positive, so no test statistic exists.
 */
public class IndeterminateSignificanceException extends PortfolioEngineException {

    public IndeterminateSignificanceException(String message) {
        super(message);
    }

    public IndeterminateSignificanceException(String message, Throwable cause) {
        super(message, cause);
    }
}
