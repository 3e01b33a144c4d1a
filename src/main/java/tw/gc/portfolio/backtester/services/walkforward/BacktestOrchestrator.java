package tw.gc.portfolio.backtester.services.walkforward;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicLong;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import tw.gc.portfolio.backtester.config.BacktestConfig;
import tw.gc.portfolio.backtester.enums.PeriodState;
import tw.gc.portfolio.backtester.enums.StrategyType;
import tw.gc.portfolio.backtester.enums.WarningCode;
import tw.gc.portfolio.backtester.exceptions.InsufficientDataException;
import tw.gc.portfolio.backtester.exceptions.PortfolioEngineException;
import tw.gc.portfolio.backtester.model.AllocationWarning;
import tw.gc.portfolio.backtester.model.EstimatedParameters;
import tw.gc.portfolio.backtester.model.PerformanceMetrics;
import tw.gc.portfolio.backtester.model.PortfolioWeights;
import tw.gc.portfolio.backtester.model.RealizedReturnSeries;
import tw.gc.portfolio.backtester.model.ReturnsMatrix;
import tw.gc.portfolio.backtester.model.SignificanceComparison;
import tw.gc.portfolio.backtester.services.allocation.AllocationRequest;
import tw.gc.portfolio.backtester.services.allocation.AllocationResult;
import tw.gc.portfolio.backtester.services.allocation.PortfolioAllocator;
import tw.gc.portfolio.backtester.services.estimation.ParameterEstimator;
import tw.gc.portfolio.backtester.services.performance.PerformanceAnalyzer;
import tw.gc.portfolio.backtester.services.performance.TurnoverCalculator;
import tw.gc.portfolio.backtester.services.significance.SignificanceTester;

/**
 * Rolling out-of-sample backtest of several allocation strategies.
 *
 * <p>For every rebalancing period the estimation window (rows strictly before the test window)
 * is estimated once and shared by all strategies. Each (strategy, period) allocation then runs
 * as an independent unit on a fixed thread pool, bounded by the configured timeout. The
 * resulting weights are held fixed over the test window to produce realized returns.
 *
 * <pre>
 * ESTIMATING → ALLOCATING → APPLYING → RECORDED
 *      └─ insufficient estimation or test rows, or no risk-free rate ─→ SKIPPED
 * </pre>
 *
 * <p>Failure semantics: a failing or timed-out unit is replaced by its strategy's fallback and
 * recorded as degraded; an empty universe, malformed input or infeasible bounds abort the run.
 *
 * <p>All units are submitted up front and collected in order. A unit's timeout runs from the
 * moment a pool thread picks it up; a unit still queued when collected gets one full timeout to
 * start. {@code Future.cancel(true)} only interrupts: an allocator that never checks for
 * interruption keeps its pool thread until it returns, and the pool is shut down without
 * waiting for it.
 */
@Service
@Slf4j
public class BacktestOrchestrator {

    private static final long NOT_STARTED = Long.MIN_VALUE;

    private final ParameterEstimator parameterEstimator;
    private final Map<StrategyType, PortfolioAllocator> allocators;
    private final RebalancingSchedule rebalancingSchedule;
    private final PerformanceAnalyzer performanceAnalyzer;
    private final TurnoverCalculator turnoverCalculator;
    private final SignificanceTester significanceTester;

    public BacktestOrchestrator(ParameterEstimator parameterEstimator,
                                List<PortfolioAllocator> allocators,
                                RebalancingSchedule rebalancingSchedule,
                                PerformanceAnalyzer performanceAnalyzer,
                                TurnoverCalculator turnoverCalculator,
                                SignificanceTester significanceTester) {
        this.parameterEstimator = parameterEstimator;
        this.allocators = new EnumMap<>(StrategyType.class);
        for (PortfolioAllocator allocator : allocators) {
            this.allocators.put(allocator.strategyType(), allocator);
        }
        this.rebalancingSchedule = rebalancingSchedule;
        this.performanceAnalyzer = performanceAnalyzer;
        this.turnoverCalculator = turnoverCalculator;
        this.significanceTester = significanceTester;
    }

    /**
     * A period that passed the data checks, with its shared estimate (null if no strategy needs one).
     */
    private record ActivePeriod(RebalancingPeriod period, EstimatedParameters parameters) {
    }

    /**
     * A submitted allocation unit.
     */
    private record AllocationUnit(StrategyType strategy, ActivePeriod active, AllocationRequest request,
                                  AtomicLong startedAt, Future<AllocationResult> future) {
    }

    /**
     * Runs the backtest.
     *
     * @param returns full returns history
     * @param config  run settings
     * @return per-strategy allocations, realized returns, metrics and pairwise tests
     * @throws IllegalArgumentException if the weight bounds are infeasible for the universe
     */
    public BacktestReport run(ReturnsMatrix returns, BacktestConfig config) {
        Objects.requireNonNull(returns, "returns");
        Objects.requireNonNull(config, "config");
        long startTime = System.currentTimeMillis();

        config.weightBounds().requireFeasibleFor(returns.assetCount());
        List<StrategyType> strategies = config.strategies();
        for (StrategyType strategy : strategies) {
            if (!allocators.containsKey(strategy)) {
                throw new IllegalStateException("No allocator registered for " + strategy);
            }
        }

        log.info("🚀 Starting portfolio backtest: {} assets, {} periods of data", returns.assetCount(), returns.rows());
        log.info("   Strategies: {} | Bounds {} | Window {} periods", strategies,
            config.weightBounds().describe(), config.estimationWindowPeriods());

        List<RebalancingPeriod> periods = rebalancingSchedule.build(returns, config);
        List<SkippedPeriod> skipped = new ArrayList<>();
        List<ActivePeriod> active = prepare(returns, periods, config, skipped);

        Map<StrategyType, List<AllocationResult>> allocations = allocateAll(returns, active, config);

        Map<StrategyType, StrategyBacktest> results = new LinkedHashMap<>();
        for (StrategyType strategy : strategies) {
            results.put(strategy, apply(strategy, active, allocations.get(strategy), returns, config));
        }

        List<SignificanceComparison> comparisons = compareAll(results, config);

        long durationMs = System.currentTimeMillis() - startTime;
        BacktestReport report = new BacktestReport(returns.assets(), periods, skipped, results, comparisons, durationMs);
        log.info("✅ Backtest complete in {} ms: {} periods recorded, {} skipped",
            durationMs, active.size(), skipped.size());
        results.values().forEach(r -> log.info("   {}: {}", r.strategy().getDescription(), r.metrics().describe()));
        return report;
    }

    private List<ActivePeriod> prepare(ReturnsMatrix returns, List<RebalancingPeriod> periods,
                                       BacktestConfig config, List<SkippedPeriod> skipped) {
        boolean needsEstimation = config.strategies().stream().anyMatch(StrategyType::requiresEstimation);
        List<ActivePeriod> active = new ArrayList<>();
        for (RebalancingPeriod period : periods) {
            PeriodState state = PeriodState.ESTIMATING;
            String reason = skipReason(returns, period, config);
            if (reason == null && needsEstimation) {
                try {
                    EstimatedParameters parameters = parameterEstimator.estimate(period.estimationWindow(returns), config);
                    active.add(new ActivePeriod(period, parameters));
                    continue;
                } catch (InsufficientDataException e) {
                    reason = e.getMessage();
                }
            } else if (reason == null) {
                active.add(new ActivePeriod(period, null));
                continue;
            }
            state = state.advanceTo(PeriodState.SKIPPED);
            log.warn("⚠️ {} {}: {}", period.describe(), state, reason);
            skipped.add(new SkippedPeriod(period, reason));
        }
        return active;
    }

    private static String skipReason(ReturnsMatrix returns, RebalancingPeriod period, BacktestConfig config) {
        if (period.estimationRows() < config.minEstimationPeriods()) {
            return "estimation window has %d periods, at least %d required"
                .formatted(period.estimationRows(), config.minEstimationPeriods());
        }
        if (period.testRows() < config.minTestPeriods()) {
            return "test window has %d periods, at least %d required"
                .formatted(period.testRows(), config.minTestPeriods());
        }
        // estimation rows precede test rows, so covering the first row covers the period
        int firstRow = period.estimationRows() > 0 ? period.estimationFromRow() : period.testFromRow();
        if (firstRow < returns.rows() && !config.riskFreeRate().covers(returns.date(firstRow))) {
            return "no risk-free observation on or before " + returns.date(firstRow);
        }
        return null;
    }

    private Map<StrategyType, List<AllocationResult>> allocateAll(ReturnsMatrix returns, List<ActivePeriod> active,
                                                                  BacktestConfig config) {
        Map<StrategyType, List<AllocationResult>> results = new EnumMap<>(StrategyType.class);
        config.strategies().forEach(strategy -> results.put(strategy, new ArrayList<>()));
        int unitCount = active.size() * config.strategies().size();
        if (unitCount == 0) {
            return results;
        }

        ExecutorService executor = Executors.newFixedThreadPool(Math.min(config.parallelism(), unitCount));
        try {
            List<AllocationUnit> units = new ArrayList<>(unitCount);
            for (ActivePeriod period : active) {
                for (StrategyType strategy : config.strategies()) {
                    PortfolioAllocator allocator = allocators.get(strategy);
                    AllocationRequest request = new AllocationRequest(returns.assets(),
                        strategy.requiresEstimation() ? period.parameters() : null, config);
                    AtomicLong startedAt = new AtomicLong(NOT_STARTED);
                    Future<AllocationResult> future = executor.submit(() -> {
                        startedAt.set(System.nanoTime());
                        return allocator.allocate(request);
                    });
                    units.add(new AllocationUnit(strategy, period, request, startedAt, future));
                }
            }
            for (AllocationUnit unit : units) {
                results.get(unit.strategy()).add(await(unit, config));
            }
        } finally {
            executor.shutdownNow();
        }
        return results;
    }

    private AllocationResult await(AllocationUnit unit, BacktestConfig config) {
        PortfolioAllocator allocator = allocators.get(unit.strategy());
        int index = unit.active().period().index();
        try {
            return getWithinTimeout(unit, config.allocationTimeout().toNanos());
        } catch (TimeoutException e) {
            unit.future().cancel(true);
            String message = "%s allocation for period %d exceeded %s".formatted(
                unit.strategy(), index, config.allocationTimeout());
            log.warn("⚠️ {}; using fallback", message);
            return allocator.fallback(unit.request(), AllocationWarning.of(WarningCode.ALLOCATION_TIMEOUT, message));
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            String message = "%s allocation for period %d failed: %s".formatted(
                unit.strategy(), index, cause.getMessage());
            log.error("❌ {}; using fallback", message, cause);
            return allocator.fallback(unit.request(), AllocationWarning.of(WarningCode.ALLOCATION_FAILED, message));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new PortfolioEngineException("Backtest interrupted while allocating period " + index, e);
        }
    }

    private static AllocationResult getWithinTimeout(AllocationUnit unit, long timeoutNanos)
            throws InterruptedException, ExecutionException, TimeoutException {
        long startedAt = unit.startedAt().get();
        if (startedAt == NOT_STARTED) {
            try {
                return unit.future().get(timeoutNanos, TimeUnit.NANOSECONDS);
            } catch (TimeoutException e) {
                startedAt = unit.startedAt().get();
                if (startedAt == NOT_STARTED) {
                    throw e;
                }
            }
        }
        long remaining = startedAt + timeoutNanos - System.nanoTime();
        return unit.future().get(Math.max(0L, remaining), TimeUnit.NANOSECONDS);
    }

    private StrategyBacktest apply(StrategyType strategy, List<ActivePeriod> active, List<AllocationResult> results,
                                   ReturnsMatrix returns, BacktestConfig config) {
        List<PeriodAllocation> allocations = new ArrayList<>();
        List<RealizedReturnSeries> parts = new ArrayList<>();
        List<Integer> degraded = new ArrayList<>();
        List<Double> turnovers = new ArrayList<>();
        double totalCost = 0.0;
        PortfolioWeights previous = null;

        for (int i = 0; i < active.size(); i++) {
            RebalancingPeriod period = active.get(i).period();
            AllocationResult result = results.get(i);
            PeriodState state = PeriodState.ALLOCATING.advanceTo(PeriodState.APPLYING);

            double turnover = turnoverCalculator.turnover(previous, result.weights());
            double cost = turnoverCalculator.transactionCost(turnover, config.transactionCostBps());

            ReturnsMatrix test = period.testWindow(returns);
            double[] realized = new double[test.rows()];
            for (int row = 0; row < realized.length; row++) {
                realized[row] = result.weights().apply(test.simpleRow(row));
            }
            if (realized.length > 0) {
                realized[0] -= cost;
            }
            RealizedReturnSeries series = RealizedReturnSeries.of(test.dates(), realized);
            PerformanceMetrics metrics = performanceAnalyzer.analyze(series, config.riskFreeRate(), config.periodsPerYear());
            state = state.advanceTo(PeriodState.RECORDED);

            allocations.add(new PeriodAllocation(strategy, period, state, result, turnover, cost, series, metrics));
            parts.add(series);
            turnovers.add(turnover);
            totalCost += cost;
            if (result.degraded()) {
                degraded.add(period.index());
                log.warn("⚠️ {} period {} used degraded allocation {}: {}", strategy, period.index(),
                    result.diagnostics().method(), result.diagnostics().warnings());
            }
            previous = result.weights();
        }

        RealizedReturnSeries all = RealizedReturnSeries.concat(parts);
        PerformanceMetrics metrics = performanceAnalyzer.analyze(all, config.riskFreeRate(), config.periodsPerYear());
        return new StrategyBacktest(strategy, allocations, all, metrics, degraded,
            turnoverCalculator.averageTurnover(turnovers), totalCost);
    }

    private List<SignificanceComparison> compareAll(Map<StrategyType, StrategyBacktest> results, BacktestConfig config) {
        List<StrategyBacktest> backtests = new ArrayList<>(results.values());
        List<SignificanceComparison> comparisons = new ArrayList<>();
        for (int i = 0; i < backtests.size(); i++) {
            for (int j = i + 1; j < backtests.size(); j++) {
                StrategyBacktest a = backtests.get(i);
                StrategyBacktest b = backtests.get(j);
                try {
                    comparisons.add(significanceTester.compare(
                        a.strategy().name(), a.realizedReturns(), b.strategy().name(), b.realizedReturns(), config));
                } catch (InsufficientDataException e) {
                    log.warn("⚠️ Skipping {} vs {} comparison: {}", a.strategy(), b.strategy(), e.getMessage());
                }
            }
        }
        return comparisons;
    }
}
