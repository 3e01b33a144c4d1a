package tw.gc.portfolio.backtester.services.export;

import java.util.ArrayList;
import java.util.List;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import tw.gc.portfolio.backtester.config.BacktestConfig;
import tw.gc.portfolio.backtester.enums.StrategyType;
import tw.gc.portfolio.backtester.exceptions.ResultSerializationException;
import tw.gc.portfolio.backtester.model.PortfolioWeights;
import tw.gc.portfolio.backtester.model.ReturnsMatrix;
import tw.gc.portfolio.backtester.model.WeightBounds;
import tw.gc.portfolio.backtester.services.allocation.EqualWeightAllocator;
import tw.gc.portfolio.backtester.services.allocation.RiskParityAllocator;
import tw.gc.portfolio.backtester.services.estimation.LedoitWolfShrinkage;
import tw.gc.portfolio.backtester.services.estimation.ParameterEstimator;
import tw.gc.portfolio.backtester.services.performance.PerformanceAnalyzer;
import tw.gc.portfolio.backtester.services.performance.TurnoverCalculator;
import tw.gc.portfolio.backtester.services.performance.ValueAtRiskCalculator;
import tw.gc.portfolio.backtester.services.significance.BootstrapSharpeTest;
import tw.gc.portfolio.backtester.services.significance.SignificanceTester;
import tw.gc.portfolio.backtester.services.walkforward.BacktestOrchestrator;
import tw.gc.portfolio.backtester.services.walkforward.BacktestReport;
import tw.gc.portfolio.backtester.services.walkforward.RebalancingSchedule;

import static org.assertj.core.api.Assertions.*;
import static tw.gc.portfolio.backtester.testutil.ReturnsMatrixTestFactory.gaussian;

/**
 * Unit tests for {@link BacktestResultCodec}.
 */
class BacktestResultCodecTest {

    private BacktestResultCodec codec;
    private BacktestReport report;

    @BeforeEach
    void setUp() {
        ObjectMapper objectMapper = new ObjectMapper().findAndRegisterModules();
        objectMapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        codec = new BacktestResultCodec(objectMapper);

        EqualWeightAllocator equalWeight = new EqualWeightAllocator();
        BacktestOrchestrator orchestrator = new BacktestOrchestrator(
            new ParameterEstimator(new LedoitWolfShrinkage()),
            List.of(equalWeight, new RiskParityAllocator(equalWeight)),
            new RebalancingSchedule(),
            new PerformanceAnalyzer(new ValueAtRiskCalculator()),
            new TurnoverCalculator(),
            new SignificanceTester(new BootstrapSharpeTest()));
        ReturnsMatrix returns = gaussian(36, new double[] {0.01, 0.008, 0.012}, new double[] {0.04, 0.03, 0.05}, 9L);
        BacktestConfig config = BacktestConfig.builder()
            .weightBounds(WeightBounds.longOnly())
            .strategies(List.of(StrategyType.EQUAL_WEIGHT, StrategyType.RISK_PARITY))
            .bootstrapIterations(100)
            .parallelism(1)
            .build();
        report = orchestrator.run(returns, config);
    }

    @Test
    @DisplayName("should round-trip portfolio weights")
    void shouldRoundTripWeights() {
        PortfolioWeights weights = PortfolioWeights.of(List.of("BOVA11", "IVVB11", "GOLD11"), new double[] {0.5, 0.3, 0.2});

        String json = codec.writeWeights(weights);

        assertThat(json).contains("\"assets\"").contains("BOVA11");
        assertThat(codec.readWeights(json)).isEqualTo(weights);
    }

    @Test
    @DisplayName("should flatten one row per strategy, period and asset")
    void shouldFlattenWeightsTable() {
        String json = codec.writeWeightsTable(report);

        List<BacktestResultCodec.WeightRow> rows = codec.readWeightsTable(json);

        assertThat(rows).hasSize(2 * 2 * 3);
        assertThat(rows.get(0).strategy()).isEqualTo(StrategyType.EQUAL_WEIGHT);
        assertThat(rows.get(0).periodStart()).isEqualTo(report.periods().get(0).periodStart());
        assertThat(rows.get(0).weight()).isCloseTo(1 / 3.0, within(1e-15));
        assertThat(json).contains(report.periods().get(0).periodStart().toString());
        List<BacktestResultCodec.WeightRow> expected = new ArrayList<>(
            codec.weightsTable(report.strategy(StrategyType.EQUAL_WEIGHT)));
        expected.addAll(codec.weightsTable(report.strategy(StrategyType.RISK_PARITY)));
        assertThat(rows).isEqualTo(expected);
    }

    @Test
    @DisplayName("should serialize the full report with typed allocations")
    void shouldWriteReport() {
        String json = codec.writeReport(report);

        assertThat(json).contains("\"type\" : \"RISK_PARITY\"").contains("\"comparisons\"");
    }

    @Test
    @DisplayName("should wrap malformed input")
    void shouldRejectMalformedInput() {
        assertThatThrownBy(() -> codec.readWeights("{\"assets\": [\"A\"], \"values\": [0.4]}"))
            .isInstanceOf(ResultSerializationException.class);
        assertThatThrownBy(() -> codec.readWeightsTable("not json"))
            .isInstanceOf(ResultSerializationException.class);
    }
}
