package tw.gc.portfolio.backtester.config;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import tw.gc.portfolio.backtester.enums.CovarianceMethod;
import tw.gc.portfolio.backtester.enums.StrategyType;
import tw.gc.portfolio.backtester.model.RiskFreeRate;
import tw.gc.portfolio.backtester.model.WeightBounds;

/**
 * Default backtest settings bound from {@code application.yml}. Services never read this class;
 * it is converted once into a {@link BacktestConfig} that is passed along explicitly.
 */
@Data
@Component
@ConfigurationProperties(prefix = "backtest")
public class BacktestProperties {

    /**
     * Annual risk-free rate (e.g. 0.065 for 6.5% a year).
     */
    private double riskFreeRate = BacktestConfig.DEFAULT_RISK_FREE_RATE;

    private int rebalanceEveryPeriods = BacktestConfig.DEFAULT_REBALANCE_EVERY_PERIODS;

    private int estimationWindowPeriods = BacktestConfig.DEFAULT_ESTIMATION_WINDOW;

    private int minEstimationPeriods = BacktestConfig.DEFAULT_MIN_ESTIMATION_PERIODS;

    private int minTestPeriods = 1;

    private int periodsPerYear = 12;

    private Weights weights = new Weights();
    @Data
    public static class Weights {
        private double min = BacktestConfig.DEFAULT_WEIGHT_MIN;
        private double max = BacktestConfig.DEFAULT_WEIGHT_MAX;
    }

    private MeanVariance meanVariance = new MeanVariance();
    @Data
    public static class MeanVariance {
        private double tolerance = 1e-6;
        private int maxIterations = 500;
    }

    private RiskParity riskParity = new RiskParity();
    @Data
    public static class RiskParity {
        private double tolerance = 1e-8;
        private int maxIterations = 100;
        private double damping = 0.3;
    }

    private Significance significance = new Significance();
    @Data
    public static class Significance {
        private double level = 0.05;
        private int bootstrapIterations = 2000;
        private long bootstrapSeed = 42L;
    }

    /**
     * One-way transaction cost in basis points charged on turnover at each rebalance.
     */
    private double transactionCostBps = 0.0;

    private CovarianceMethod covarianceMethod = CovarianceMethod.SAMPLE;

    /**
     * Worker threads; 0 means one per available processor.
     */
    private int parallelism = 0;

    private Duration allocationTimeout = Duration.ofSeconds(30);

    private List<StrategyType> strategies = new ArrayList<>(List.of(StrategyType.values()));

    public BacktestConfig toConfig() {
        return BacktestConfig.builder()
            .riskFreeRate(RiskFreeRate.annual(riskFreeRate))
            .rebalanceEveryPeriods(rebalanceEveryPeriods)
            .weightBounds(new WeightBounds(weights.getMin(), weights.getMax()))
            .estimationWindowPeriods(estimationWindowPeriods)
            .minEstimationPeriods(minEstimationPeriods)
            .minTestPeriods(minTestPeriods)
            .periodsPerYear(periodsPerYear)
            .meanVarianceTolerance(meanVariance.getTolerance())
            .meanVarianceMaxIterations(meanVariance.getMaxIterations())
            .riskParityTolerance(riskParity.getTolerance())
            .riskParityMaxIterations(riskParity.getMaxIterations())
            .riskParityDamping(riskParity.getDamping())
            .significanceLevel(significance.getLevel())
            .bootstrapIterations(significance.getBootstrapIterations())
            .bootstrapSeed(significance.getBootstrapSeed())
            .transactionCostBps(transactionCostBps)
            .covarianceMethod(covarianceMethod)
            .parallelism(parallelism > 0 ? parallelism : Math.max(1, Runtime.getRuntime().availableProcessors()))
            .allocationTimeout(allocationTimeout)
            .strategies(strategies)
            .build();
    }
}
