package tw.gc.portfolio.backtester.services.walkforward;

import java.time.LocalDate;

import tw.gc.portfolio.backtester.model.ReturnsMatrix;

/**
 * One rebalancing period: an estimation window immediately followed by a test window.
 *
 * <pre>
 * rows:  ... │ estimationFromRow ... estimationToRow-1 │ testFromRow ... testToRow-1 │ ...
 *            └──── estimate & allocate (past) ────────┴──── apply fixed weights ───┘
 * </pre>
 *
 * <p>Row ranges are half-open. The estimation window ends where the test window starts, so
 * weights for this period can only depend on rows strictly before {@code periodStart}.
 *
 * @param index             zero-based position in the schedule
 * @param periodStart       first date of the test window (inclusive boundary)
 * @param periodEnd         end boundary of the test window (exclusive)
 * @param estimationFromRow first estimation row
 * @param estimationToRow   one past the last estimation row
 * @param testFromRow       first test row
 * @param testToRow         one past the last test row
 */
public record RebalancingPeriod(
    int index,
    LocalDate periodStart,
    LocalDate periodEnd,
    int estimationFromRow,
    int estimationToRow,
    int testFromRow,
    int testToRow
) {
    /**
     * Compact constructor with validation.
     */
    public RebalancingPeriod {
        if (index < 0) {
            throw new IllegalArgumentException("index must be non-negative, got: %d".formatted(index));
        }
        if (periodStart == null || periodEnd == null) {
            throw new IllegalArgumentException("Period boundaries must be non-null");
        }
        if (!periodStart.isBefore(periodEnd)) {
            throw new IllegalArgumentException("periodStart (%s) must be before periodEnd (%s)"
                .formatted(periodStart, periodEnd));
        }
        if (estimationFromRow < 0 || estimationFromRow > estimationToRow) {
            throw new IllegalArgumentException("Invalid estimation rows [%d, %d)"
                .formatted(estimationFromRow, estimationToRow));
        }
        if (estimationToRow > testFromRow) {
            throw new IllegalArgumentException("Estimation window (to row %d) must end before the test window (row %d)"
                .formatted(estimationToRow, testFromRow));
        }
        if (testFromRow > testToRow) {
            throw new IllegalArgumentException("Invalid test rows [%d, %d)".formatted(testFromRow, testToRow));
        }
    }

    public int estimationRows() {
        return estimationToRow - estimationFromRow;
    }

    public int testRows() {
        return testToRow - testFromRow;
    }

    /**
     * @return an independent copy of the estimation rows
     */
    public ReturnsMatrix estimationWindow(ReturnsMatrix returns) {
        return returns.slice(estimationFromRow, estimationToRow);
    }

    /**
     * @return an independent copy of the test rows
     */
    public ReturnsMatrix testWindow(ReturnsMatrix returns) {
        return returns.slice(testFromRow, testToRow);
    }

    public boolean isInTestPeriod(LocalDate date) {
        return !date.isBefore(periodStart) && date.isBefore(periodEnd);
    }

    public String describe() {
        return "Period %d: Estimate rows [%d, %d) (%d) | Test [%s → %s) rows [%d, %d) (%d)"
            .formatted(index, estimationFromRow, estimationToRow, estimationRows(),
                periodStart, periodEnd, testFromRow, testToRow, testRows());
    }
}
