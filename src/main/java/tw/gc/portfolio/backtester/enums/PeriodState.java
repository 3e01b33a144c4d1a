package tw.gc.portfolio.backtester.enums;

/**
 * Lifecycle of one (strategy, rebalancing period) unit of work.
 *
 * <pre>
 * ESTIMATING → ALLOCATING → APPLYING → RECORDED
 *      └──────────┴────────────┴─────→ SKIPPED
 * </pre>
 */
public enum PeriodState {
    ESTIMATING,
    ALLOCATING,
    APPLYING,
    RECORDED,
    SKIPPED;

    public boolean isTerminal() {
        return this == RECORDED || this == SKIPPED;
    }

    /**
     * Checks whether moving from this state to {@code next} is a legal transition.
     */
    public boolean canTransitionTo(PeriodState next) {
        if (isTerminal()) {
            return false;
        }
        if (next == SKIPPED) {
            return true;
        }
        return next.ordinal() == ordinal() + 1;
    }

    /**
     * Returns {@code next} if the transition is legal.
     *
     * @throws IllegalStateException on an illegal transition
     */
    public PeriodState advanceTo(PeriodState next) {
        if (!canTransitionTo(next)) {
            throw new IllegalStateException("Illegal period transition %s -> %s".formatted(this, next));
        }
        return next;
    }
}
