package tw.gc.portfolio.backtester.controllers;

import java.time.LocalDate;
import java.util.List;
import java.util.Map;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import tw.gc.portfolio.backtester.config.BacktestConfig;
import tw.gc.portfolio.backtester.config.BacktestProperties;
import tw.gc.portfolio.backtester.enums.CovarianceMethod;
import tw.gc.portfolio.backtester.enums.ReturnType;
import tw.gc.portfolio.backtester.enums.StrategyType;
import tw.gc.portfolio.backtester.exceptions.PortfolioEngineException;
import tw.gc.portfolio.backtester.model.ReturnsMatrix;
import tw.gc.portfolio.backtester.model.RiskFreeRate;
import tw.gc.portfolio.backtester.model.WeightBounds;
import tw.gc.portfolio.backtester.services.export.BacktestResultCodec;
import tw.gc.portfolio.backtester.services.walkforward.BacktestOrchestrator;
import tw.gc.portfolio.backtester.services.walkforward.BacktestReport;

@RestController
@RequestMapping("/api/backtests")
@RequiredArgsConstructor
@Slf4j
public class BacktestController {

    private final BacktestOrchestrator backtestOrchestrator;
    private final BacktestProperties backtestProperties;
    private final BacktestResultCodec backtestResultCodec;

    /**
     * Returns table and optional overrides of the configured defaults.
     */
    public record BacktestRequest(
        List<LocalDate> dates,
        List<String> assets,
        List<List<Double>> returns,
        ReturnType returnType,
        Double riskFreeRate,
        Map<LocalDate, Double> riskFreeSeries,
        List<LocalDate> rebalancingDates,
        Integer rebalanceEveryPeriods,
        Double weightMin,
        Double weightMax,
        Integer estimationWindowPeriods,
        Double transactionCostBps,
        CovarianceMethod covarianceMethod,
        List<StrategyType> strategies
    ) {}

    // ========================================================================
    // RUN BACKTEST
    // ========================================================================

    @PostMapping
    public ResponseEntity<?> runBacktest(@RequestBody BacktestRequest request) {
        try {
            return ResponseEntity.ok(execute(request));
        } catch (PortfolioEngineException | IllegalArgumentException e) {
            log.warn("Rejected backtest request: {}", e.getMessage());
            return ResponseEntity.badRequest().body(Map.of(
                "status", "error",
                "message", String.valueOf(e.getMessage())
            ));
        }
    }

    @PostMapping("/weights")
    public ResponseEntity<?> weightsTable(@RequestBody BacktestRequest request) {
        try {
            BacktestReport report = execute(request);
            return ResponseEntity.ok(report.strategies().values().stream()
                .flatMap(backtest -> backtestResultCodec.weightsTable(backtest).stream())
                .toList());
        } catch (PortfolioEngineException | IllegalArgumentException e) {
            log.warn("Rejected weights request: {}", e.getMessage());
            return ResponseEntity.badRequest().body(Map.of(
                "status", "error",
                "message", String.valueOf(e.getMessage())
            ));
        }
    }

    private BacktestReport execute(BacktestRequest request) {
        ReturnsMatrix returns = ReturnsMatrix.fromRows(
            request.dates(), request.assets(), request.returns(), request.returnType());
        BacktestConfig config = toConfig(request);
        log.info("Running backtest over {} with {}", returns, config.strategies());
        return backtestOrchestrator.run(returns, config);
    }

    BacktestConfig toConfig(BacktestRequest request) {
        BacktestConfig defaults = backtestProperties.toConfig();
        BacktestConfig.Builder builder = defaults.toBuilder();
        if (request.riskFreeSeries() != null && !request.riskFreeSeries().isEmpty()) {
            builder.riskFreeRate(RiskFreeRate.periodic(request.riskFreeSeries()));
        } else if (request.riskFreeRate() != null) {
            builder.riskFreeRate(RiskFreeRate.annual(request.riskFreeRate()));
        }
        if (request.rebalancingDates() != null) {
            builder.rebalancingDates(request.rebalancingDates());
        }
        if (request.rebalanceEveryPeriods() != null) {
            builder.rebalanceEveryPeriods(request.rebalanceEveryPeriods());
        }
        if (request.weightMin() != null || request.weightMax() != null) {
            builder.weightBounds(new WeightBounds(
                request.weightMin() != null ? request.weightMin() : defaults.weightBounds().min(),
                request.weightMax() != null ? request.weightMax() : defaults.weightBounds().max()));
        }
        if (request.estimationWindowPeriods() != null) {
            builder.estimationWindowPeriods(request.estimationWindowPeriods());
        }
        if (request.transactionCostBps() != null) {
            builder.transactionCostBps(request.transactionCostBps());
        }
        if (request.covarianceMethod() != null) {
            builder.covarianceMethod(request.covarianceMethod());
        }
        if (request.strategies() != null && !request.strategies().isEmpty()) {
            builder.strategies(request.strategies());
        }
        return builder.build();
    }
}
