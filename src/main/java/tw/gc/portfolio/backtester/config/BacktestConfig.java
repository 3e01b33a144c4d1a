package tw.gc.portfolio.backtester.config;

import java.time.Duration;
import java.time.LocalDate;
import java.util.List;
import java.util.Objects;

import tw.gc.portfolio.backtester.enums.CovarianceMethod;
import tw.gc.portfolio.backtester.enums.StrategyType;
import tw.gc.portfolio.backtester.model.RiskFreeRate;
import tw.gc.portfolio.backtester.model.WeightBounds;

/**
 * Immutable settings of one backtest run, passed explicitly to every component that needs them.
 *
 * <p>Rebalancing follows {@code rebalancingDates} when given: k + 1 ascending boundaries define k
 * test windows {@code [b_i, b_{i+1})}. Otherwise a schedule is generated with one test window
 * every {@code rebalanceEveryPeriods} rows, starting once {@code estimationWindowPeriods} rows
 * are available.
 *
 * @param riskFreeRate            annual scalar or periodic series
 * @param rebalancingDates        explicit period boundaries, empty for a generated schedule
 * @param rebalanceEveryPeriods   test window length of a generated schedule
 * @param weightBounds            per-asset box constraint
 * @param estimationWindowPeriods rolling look-back length in periods
 * @param minEstimationPeriods    fewest estimation rows accepted, otherwise the period is skipped
 * @param minTestPeriods          fewest test rows accepted, otherwise the period is skipped
 * @param periodsPerYear          annualization factor (12 for monthly data)
 * @param meanVarianceTolerance   interior-point tolerance of the max-Sharpe solver
 * @param meanVarianceMaxIterations iteration cap of the max-Sharpe solver
 * @param riskParityTolerance     max relative risk-contribution deviation accepted as converged
 * @param riskParityMaxIterations iteration budget of the ERC fixed point
 * @param riskParityDamping       damping exponent in (0, 1] of the ERC update
 * @param significanceLevel       alpha of the Sharpe ratio tests
 * @param bootstrapIterations     resamples of the bootstrap test
 * @param bootstrapSeed           seed of the bootstrap random generator
 * @param transactionCostBps      one-way cost in basis points charged on turnover
 * @param covarianceMethod        covariance estimator
 * @param parallelism             worker threads for (strategy x period) units
 * @param allocationTimeout       wall-clock cap per allocation unit
 * @param strategies              strategies to run, in report order
 */
public record BacktestConfig(
    RiskFreeRate riskFreeRate,
    List<LocalDate> rebalancingDates,
    int rebalanceEveryPeriods,
    WeightBounds weightBounds,
    int estimationWindowPeriods,
    int minEstimationPeriods,
    int minTestPeriods,
    int periodsPerYear,
    double meanVarianceTolerance,
    int meanVarianceMaxIterations,
    double riskParityTolerance,
    int riskParityMaxIterations,
    double riskParityDamping,
    double significanceLevel,
    int bootstrapIterations,
    long bootstrapSeed,
    double transactionCostBps,
    CovarianceMethod covarianceMethod,
    int parallelism,
    Duration allocationTimeout,
    List<StrategyType> strategies
) {
    /** Annual risk-free rate used when none is configured (Brazilian CDI average of the study period) */
    public static final double DEFAULT_RISK_FREE_RATE = 0.065;

    /** Months between rebalances of a generated schedule (semi-annual) */
    public static final int DEFAULT_REBALANCE_EVERY_PERIODS = 6;

    /** Rolling estimation window in periods (24 months) */
    public static final int DEFAULT_ESTIMATION_WINDOW = 24;

    /** Fewest periods accepted for estimation */
    public static final int DEFAULT_MIN_ESTIMATION_PERIODS = 12;

    public static final double DEFAULT_WEIGHT_MIN = 0.0;
    public static final double DEFAULT_WEIGHT_MAX = 0.40;

    public BacktestConfig {
        Objects.requireNonNull(riskFreeRate, "riskFreeRate");
        Objects.requireNonNull(weightBounds, "weightBounds");
        Objects.requireNonNull(covarianceMethod, "covarianceMethod");
        Objects.requireNonNull(allocationTimeout, "allocationTimeout");
        rebalancingDates = rebalancingDates == null ? List.of() : List.copyOf(rebalancingDates);
        strategies = strategies == null || strategies.isEmpty()
            ? List.of(StrategyType.values())
            : List.copyOf(strategies.stream().distinct().toList());

        if (rebalancingDates.size() == 1) {
            throw new IllegalArgumentException("rebalancingDates needs at least two boundaries, got one");
        }
        for (int i = 1; i < rebalancingDates.size(); i++) {
            if (!rebalancingDates.get(i).isAfter(rebalancingDates.get(i - 1))) {
                throw new IllegalArgumentException("rebalancingDates must be strictly ascending: %s follows %s"
                    .formatted(rebalancingDates.get(i), rebalancingDates.get(i - 1)));
            }
        }
        if (rebalanceEveryPeriods < 1) {
            throw new IllegalArgumentException("rebalanceEveryPeriods must be >= 1, got: " + rebalanceEveryPeriods);
        }
        if (minEstimationPeriods < 2) {
            throw new IllegalArgumentException("minEstimationPeriods must be >= 2, got: " + minEstimationPeriods);
        }
        if (estimationWindowPeriods < minEstimationPeriods) {
            throw new IllegalArgumentException("estimationWindowPeriods (%d) must be >= minEstimationPeriods (%d)"
                .formatted(estimationWindowPeriods, minEstimationPeriods));
        }
        if (minTestPeriods < 1) {
            throw new IllegalArgumentException("minTestPeriods must be >= 1, got: " + minTestPeriods);
        }
        if (periodsPerYear < 1) {
            throw new IllegalArgumentException("periodsPerYear must be >= 1, got: " + periodsPerYear);
        }
        if (!(meanVarianceTolerance > 0) || !(riskParityTolerance > 0)) {
            throw new IllegalArgumentException("Optimizer tolerances must be positive");
        }
        if (meanVarianceMaxIterations < 1 || riskParityMaxIterations < 1) {
            throw new IllegalArgumentException("Optimizer iteration budgets must be >= 1");
        }
        if (!(riskParityDamping > 0) || riskParityDamping > 1) {
            throw new IllegalArgumentException("riskParityDamping must be in (0, 1], got: " + riskParityDamping);
        }
        if (!(significanceLevel > 0) || !(significanceLevel < 1)) {
            throw new IllegalArgumentException("significanceLevel must be in (0, 1), got: " + significanceLevel);
        }
        if (bootstrapIterations < 1) {
            throw new IllegalArgumentException("bootstrapIterations must be >= 1, got: " + bootstrapIterations);
        }
        if (transactionCostBps < 0 || !Double.isFinite(transactionCostBps)) {
            throw new IllegalArgumentException("transactionCostBps must be >= 0, got: " + transactionCostBps);
        }
        if (parallelism < 1) {
            throw new IllegalArgumentException("parallelism must be >= 1, got: " + parallelism);
        }
        if (allocationTimeout.isNegative() || allocationTimeout.isZero()) {
            throw new IllegalArgumentException("allocationTimeout must be positive, got: " + allocationTimeout);
        }
    }

    /**
     * Creates the default configuration: monthly data, 24-month rolling window, semi-annual
     * rebalancing, long-only weights capped at 40%.
     */
    public static BacktestConfig defaults() {
        return builder().build();
    }

    public boolean hasExplicitSchedule() {
        return !rebalancingDates.isEmpty();
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
            .riskFreeRate(riskFreeRate)
            .rebalancingDates(rebalancingDates)
            .rebalanceEveryPeriods(rebalanceEveryPeriods)
            .weightBounds(weightBounds)
            .estimationWindowPeriods(estimationWindowPeriods)
            .minEstimationPeriods(minEstimationPeriods)
            .minTestPeriods(minTestPeriods)
            .periodsPerYear(periodsPerYear)
            .meanVarianceTolerance(meanVarianceTolerance)
            .meanVarianceMaxIterations(meanVarianceMaxIterations)
            .riskParityTolerance(riskParityTolerance)
            .riskParityMaxIterations(riskParityMaxIterations)
            .riskParityDamping(riskParityDamping)
            .significanceLevel(significanceLevel)
            .bootstrapIterations(bootstrapIterations)
            .bootstrapSeed(bootstrapSeed)
            .transactionCostBps(transactionCostBps)
            .covarianceMethod(covarianceMethod)
            .parallelism(parallelism)
            .allocationTimeout(allocationTimeout)
            .strategies(strategies);
    }

    /**
     * Builder for creating BacktestConfig instances, pre-filled with defaults.
     */
    public static class Builder {
        private RiskFreeRate riskFreeRate = RiskFreeRate.annual(DEFAULT_RISK_FREE_RATE);
        private List<LocalDate> rebalancingDates = List.of();
        private int rebalanceEveryPeriods = DEFAULT_REBALANCE_EVERY_PERIODS;
        private WeightBounds weightBounds = new WeightBounds(DEFAULT_WEIGHT_MIN, DEFAULT_WEIGHT_MAX);
        private int estimationWindowPeriods = DEFAULT_ESTIMATION_WINDOW;
        private int minEstimationPeriods = DEFAULT_MIN_ESTIMATION_PERIODS;
        private int minTestPeriods = 1;
        private int periodsPerYear = 12;
        private double meanVarianceTolerance = 1e-6;
        private int meanVarianceMaxIterations = 500;
        private double riskParityTolerance = 1e-8;
        private int riskParityMaxIterations = 100;
        private double riskParityDamping = 0.3;
        private double significanceLevel = 0.05;
        private int bootstrapIterations = 2000;
        private long bootstrapSeed = 42L;
        private double transactionCostBps = 0.0;
        private CovarianceMethod covarianceMethod = CovarianceMethod.SAMPLE;
        private int parallelism = Math.max(1, Runtime.getRuntime().availableProcessors());
        private Duration allocationTimeout = Duration.ofSeconds(30);
        private List<StrategyType> strategies = List.of(StrategyType.values());

        public Builder riskFreeRate(RiskFreeRate riskFreeRate) {
            this.riskFreeRate = riskFreeRate;
            return this;
        }

        public Builder rebalancingDates(List<LocalDate> rebalancingDates) {
            this.rebalancingDates = rebalancingDates;
            return this;
        }

        public Builder rebalanceEveryPeriods(int rebalanceEveryPeriods) {
            this.rebalanceEveryPeriods = rebalanceEveryPeriods;
            return this;
        }

        public Builder weightBounds(WeightBounds weightBounds) {
            this.weightBounds = weightBounds;
            return this;
        }

        public Builder estimationWindowPeriods(int estimationWindowPeriods) {
            this.estimationWindowPeriods = estimationWindowPeriods;
            return this;
        }

        public Builder minEstimationPeriods(int minEstimationPeriods) {
            this.minEstimationPeriods = minEstimationPeriods;
            return this;
        }

        public Builder minTestPeriods(int minTestPeriods) {
            this.minTestPeriods = minTestPeriods;
            return this;
        }

        public Builder periodsPerYear(int periodsPerYear) {
            this.periodsPerYear = periodsPerYear;
            return this;
        }

        public Builder meanVarianceTolerance(double meanVarianceTolerance) {
            this.meanVarianceTolerance = meanVarianceTolerance;
            return this;
        }

        public Builder meanVarianceMaxIterations(int meanVarianceMaxIterations) {
            this.meanVarianceMaxIterations = meanVarianceMaxIterations;
            return this;
        }

        public Builder riskParityTolerance(double riskParityTolerance) {
            this.riskParityTolerance = riskParityTolerance;
            return this;
        }

        public Builder riskParityMaxIterations(int riskParityMaxIterations) {
            this.riskParityMaxIterations = riskParityMaxIterations;
            return this;
        }

        public Builder riskParityDamping(double riskParityDamping) {
            this.riskParityDamping = riskParityDamping;
            return this;
        }

        public Builder significanceLevel(double significanceLevel) {
            this.significanceLevel = significanceLevel;
            return this;
        }

        public Builder bootstrapIterations(int bootstrapIterations) {
            this.bootstrapIterations = bootstrapIterations;
            return this;
        }

        public Builder bootstrapSeed(long bootstrapSeed) {
            this.bootstrapSeed = bootstrapSeed;
            return this;
        }

        public Builder transactionCostBps(double transactionCostBps) {
            this.transactionCostBps = transactionCostBps;
            return this;
        }

        public Builder covarianceMethod(CovarianceMethod covarianceMethod) {
            this.covarianceMethod = covarianceMethod;
            return this;
        }

        public Builder parallelism(int parallelism) {
            this.parallelism = parallelism;
            return this;
        }

        public Builder allocationTimeout(Duration allocationTimeout) {
            this.allocationTimeout = allocationTimeout;
            return this;
        }

        public Builder strategies(List<StrategyType> strategies) {
            this.strategies = strategies;
            return this;
        }

        public BacktestConfig build() {
            return new BacktestConfig(
                riskFreeRate, rebalancingDates, rebalanceEveryPeriods, weightBounds,
                estimationWindowPeriods, minEstimationPeriods, minTestPeriods, periodsPerYear,
                meanVarianceTolerance, meanVarianceMaxIterations,
                riskParityTolerance, riskParityMaxIterations, riskParityDamping,
                significanceLevel, bootstrapIterations, bootstrapSeed, transactionCostBps,
                covarianceMethod, parallelism, allocationTimeout, strategies);
        }
    }
}
