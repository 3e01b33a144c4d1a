package tw.gc.portfolio.backtester.services.export;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import tw.gc.portfolio.backtester.enums.StrategyType;
import tw.gc.portfolio.backtester.exceptions.ResultSerializationException;
import tw.gc.portfolio.backtester.model.PortfolioWeights;
import tw.gc.portfolio.backtester.services.walkforward.BacktestReport;
import tw.gc.portfolio.backtester.services.walkforward.PeriodAllocation;
import tw.gc.portfolio.backtester.services.walkforward.StrategyBacktest;

/**
 * JSON output of backtest results for downstream reporting.
 *
 * <p>The weights table is flattened to one row per (strategy, period, asset) so it loads directly
 * into a spreadsheet or data frame.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class BacktestResultCodec {

    private static final TypeReference<List<WeightRow>> WEIGHT_ROWS = new TypeReference<>() {
    };

    private final ObjectMapper objectMapper;

    /**
     * One cell of the weights table.
     */
    public record WeightRow(StrategyType strategy, int period, LocalDate periodStart, String asset, double weight,
                            boolean degraded) {
    }

    public String writeWeights(PortfolioWeights weights) {
        return write(weights);
    }

    public PortfolioWeights readWeights(String json) {
        try {
            return objectMapper.readValue(json, PortfolioWeights.class);
        } catch (JsonProcessingException e) {
            throw new ResultSerializationException("Cannot read portfolio weights: " + e.getOriginalMessage(), e);
        }
    }

    public List<WeightRow> weightsTable(StrategyBacktest backtest) {
        List<WeightRow> rows = new ArrayList<>();
        for (PeriodAllocation allocation : backtest.allocations()) {
            PortfolioWeights weights = allocation.weights();
            for (int i = 0; i < weights.size(); i++) {
                rows.add(new WeightRow(backtest.strategy(), allocation.period().index(),
                    allocation.period().periodStart(), weights.assets().get(i), weights.weight(i),
                    allocation.degraded()));
            }
        }
        return rows;
    }

    public String writeWeightsTable(BacktestReport report) {
        List<WeightRow> rows = new ArrayList<>();
        report.strategies().values().forEach(backtest -> rows.addAll(weightsTable(backtest)));
        return write(rows);
    }

    public List<WeightRow> readWeightsTable(String json) {
        try {
            return objectMapper.readValue(json, WEIGHT_ROWS);
        } catch (JsonProcessingException e) {
            throw new ResultSerializationException("Cannot read weights table: " + e.getOriginalMessage(), e);
        }
    }

    public String writeReport(BacktestReport report) {
        return write(report);
    }

    private String write(Object value) {
        try {
            return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(value);
        } catch (JsonProcessingException e) {
            log.error("❌ Failed to serialize {}: {}", value.getClass().getSimpleName(), e.getOriginalMessage());
            throw new ResultSerializationException("Cannot serialize " + value.getClass().getSimpleName(), e);
        }
    }
}
