package tw.gc.portfolio.backtester.controllers;

import java.time.LocalDate;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import tw.gc.portfolio.backtester.config.BacktestConfig;
import tw.gc.portfolio.backtester.config.BacktestProperties;
import tw.gc.portfolio.backtester.enums.CovarianceMethod;
import tw.gc.portfolio.backtester.enums.StrategyType;
import tw.gc.portfolio.backtester.services.export.BacktestResultCodec;
import tw.gc.portfolio.backtester.services.walkforward.BacktestOrchestrator;
import tw.gc.portfolio.backtester.services.walkforward.BacktestReport;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(BacktestController.class)
class BacktestControllerTest {

    private static final String VALID_REQUEST = """
        {
          "dates": ["2020-01-31", "2020-02-29", "2020-03-31"],
          "assets": ["BOVA11", "IVVB11"],
          "returns": [[0.01, 0.02], [-0.03, 0.01], [0.02, 0.00]],
          "returnType": "SIMPLE",
          "strategies": ["EQUAL_WEIGHT"]
        }
        """;

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private BacktestOrchestrator backtestOrchestrator;

    @MockitoBean
    private BacktestProperties backtestProperties;

    @MockitoBean
    private BacktestResultCodec backtestResultCodec;

    @BeforeEach
    void setUp() {
        when(backtestProperties.toConfig()).thenReturn(BacktestConfig.defaults());
    }

    private static BacktestReport emptyReport() {
        return new BacktestReport(List.of("BOVA11", "IVVB11"), List.of(), List.of(), Map.of(), List.of(), 7L);
    }

    @Test
    void testRunBacktest() throws Exception {
        when(backtestOrchestrator.run(any(), any())).thenReturn(emptyReport());

        mockMvc.perform(post("/api/backtests")
                .contentType(MediaType.APPLICATION_JSON)
                .content(VALID_REQUEST))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.assets[0]").value("BOVA11"))
            .andExpect(jsonPath("$.durationMs").value(7));

        verify(backtestOrchestrator).run(any(), any());
    }

    @Test
    void testWeightsTable() throws Exception {
        when(backtestOrchestrator.run(any(), any())).thenReturn(emptyReport());

        mockMvc.perform(post("/api/backtests/weights")
                .contentType(MediaType.APPLICATION_JSON)
                .content(VALID_REQUEST))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$").isArray());
    }

    @Test
    void testRejectsUnsortedDates() throws Exception {
        String request = VALID_REQUEST.replace("\"2020-02-29\", \"2020-03-31\"", "\"2020-03-31\", \"2020-02-29\"");

        mockMvc.perform(post("/api/backtests")
                .contentType(MediaType.APPLICATION_JSON)
                .content(request))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.status").value("error"))
            .andExpect(jsonPath("$.message").value(org.hamcrest.Matchers.containsString("strictly ascending")));

        verify(backtestOrchestrator, never()).run(any(), any());
    }

    @Test
    void testRejectsInvertedBounds() throws Exception {
        String request = VALID_REQUEST.replace("\"returnType\"", "\"weightMin\": 0.6, \"weightMax\": 0.2, \"returnType\"");

        mockMvc.perform(post("/api/backtests")
                .contentType(MediaType.APPLICATION_JSON)
                .content(request))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.status").value("error"));
    }

    @Nested
    @DisplayName("Request overrides")
    class OverrideTests {

        @Test
        @DisplayName("should overlay request settings on the configured defaults")
        void shouldOverlayRequest() {
            BacktestController controller = new BacktestController(null, new BacktestProperties(), null);
            BacktestController.BacktestRequest request = new BacktestController.BacktestRequest(
                List.of(), List.of(), List.of(), null,
                0.10, null,
                List.of(LocalDate.of(2020, 1, 31), LocalDate.of(2020, 7, 31)),
                null, null, 0.5, 12, 25.0, CovarianceMethod.LEDOIT_WOLF, List.of(StrategyType.RISK_PARITY));

            BacktestConfig config = controller.toConfig(request);

            assertThat(config.riskFreeRate().annualizedOver(List.of(), 12)).isEqualTo(0.10);
            assertThat(config.hasExplicitSchedule()).isTrue();
            assertThat(config.weightBounds().min()).isEqualTo(BacktestConfig.DEFAULT_WEIGHT_MIN);
            assertThat(config.weightBounds().max()).isEqualTo(0.5);
            assertThat(config.estimationWindowPeriods()).isEqualTo(12);
            assertThat(config.transactionCostBps()).isEqualTo(25.0);
            assertThat(config.covarianceMethod()).isEqualTo(CovarianceMethod.LEDOIT_WOLF);
            assertThat(config.strategies()).containsExactly(StrategyType.RISK_PARITY);
            assertThat(config.rebalanceEveryPeriods()).isEqualTo(BacktestConfig.DEFAULT_REBALANCE_EVERY_PERIODS);
        }

        @Test
        @DisplayName("a risk-free series should take precedence over the scalar rate")
        void seriesTakesPrecedence() {
            BacktestController controller = new BacktestController(null, new BacktestProperties(), null);
            BacktestController.BacktestRequest request = new BacktestController.BacktestRequest(
                List.of(), List.of(), List.of(), null,
                0.10, Map.of(LocalDate.of(2020, 1, 31), 0.004),
                null, null, null, null, null, null, null, null);

            BacktestConfig config = controller.toConfig(request);

            assertThat(config.riskFreeRate().isSeries()).isTrue();
        }
    }
}
