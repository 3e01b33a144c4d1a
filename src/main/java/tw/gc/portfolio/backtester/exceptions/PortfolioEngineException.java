package tw.gc.portfolio.backtester.exceptions;

/**
 * Base class for every failure raised by the portfolio construction and backtesting engine.
 */
public class PortfolioEngineException extends RuntimeException {

    public PortfolioEngineException(String message) {
        super(message);
    }

    public PortfolioEngineException(String message, Throwable cause) {
        super(message, cause);
    }
}
