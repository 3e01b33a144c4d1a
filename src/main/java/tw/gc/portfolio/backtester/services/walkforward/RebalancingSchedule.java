package tw.gc.portfolio.backtester.services.walkforward;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import tw.gc.portfolio.backtester.config.BacktestConfig;
import tw.gc.portfolio.backtester.model.ReturnsMatrix;

/**
 * Builds the ordered, non-overlapping rebalancing periods of a backtest.
 *
 * <p>Explicit boundaries b_0 &lt; … &lt; b_k give k periods with test rows b_i ≤ date &lt; b_{i+1}.
 * Without boundaries, test windows of {@code rebalanceEveryPeriods} rows are laid end to end,
 * the first one starting once {@code estimationWindowPeriods} rows are available (the last
 * window may be shorter). In both cases the estimation window is the last
 * {@code estimationWindowPeriods} rows strictly before the test window.
 */
@Component
@Slf4j
public class RebalancingSchedule {

    public List<RebalancingPeriod> build(ReturnsMatrix returns, BacktestConfig config) {
        List<RebalancingPeriod> periods = config.hasExplicitSchedule()
            ? fromBoundaries(returns, config.rebalancingDates(), config.estimationWindowPeriods())
            : generate(returns, config.rebalanceEveryPeriods(), config.estimationWindowPeriods());
        log.info("   Built {} rebalancing periods ({})", periods.size(),
            config.hasExplicitSchedule() ? "explicit boundaries" : "every %d periods".formatted(config.rebalanceEveryPeriods()));
        return periods;
    }

    List<RebalancingPeriod> fromBoundaries(ReturnsMatrix returns, List<LocalDate> boundaries, int window) {
        List<RebalancingPeriod> periods = new ArrayList<>();
        for (int i = 0; i + 1 < boundaries.size(); i++) {
            LocalDate start = boundaries.get(i);
            LocalDate end = boundaries.get(i + 1);
            int testFrom = returns.firstRowOnOrAfter(start);
            int testTo = returns.firstRowOnOrAfter(end);
            int estimationTo = testFrom;
            int estimationFrom = Math.max(0, estimationTo - window);
            periods.add(new RebalancingPeriod(i, start, end, estimationFrom, estimationTo, testFrom, testTo));
        }
        return periods;
    }

    List<RebalancingPeriod> generate(ReturnsMatrix returns, int every, int window) {
        List<RebalancingPeriod> periods = new ArrayList<>();
        int rows = returns.rows();
        if (rows <= window) {
            log.warn("⚠️ Insufficient data: {} periods available, more than {} required for one rebalance", rows, window);
            return periods;
        }
        int index = 0;
        for (int testFrom = window; testFrom < rows; testFrom += every) {
            int testTo = Math.min(rows, testFrom + every);
            LocalDate start = returns.date(testFrom);
            LocalDate end = testTo < rows ? returns.date(testTo) : returns.date(rows - 1).plusDays(1);
            periods.add(new RebalancingPeriod(index++, start, end, testFrom - window, testFrom, testFrom, testTo));
        }
        return periods;
    }
}
