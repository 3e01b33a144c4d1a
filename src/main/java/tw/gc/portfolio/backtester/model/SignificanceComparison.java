package tw.gc.portfolio.backtester.model;

/**
 * Parametric and resampling comparisons of one strategy pair, reported side by side.
 */
public record SignificanceComparison(SignificanceResult jobsonKorkie, BootstrapResult bootstrap) {
}
