package tw.gc.portfolio.backtester.model;

import java.util.Objects;

import tw.gc.portfolio.backtester.enums.WarningCode;

/**
 * A typed annotation explaining why an allocation deviates from its primary method.
 */
public record AllocationWarning(WarningCode code, String message) {

    public AllocationWarning {
        Objects.requireNonNull(code, "code");
        message = message == null ? code.name() : message;
    }

    public static AllocationWarning of(WarningCode code, String message) {
        return new AllocationWarning(code, message);
    }

    public boolean degrading() {
        return code.isDegrading();
    }
}
