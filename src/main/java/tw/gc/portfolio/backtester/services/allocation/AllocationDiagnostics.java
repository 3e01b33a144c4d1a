package tw.gc.portfolio.backtester.services.allocation;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

import tw.gc.portfolio.backtester.enums.AllocationMethod;
import tw.gc.portfolio.backtester.model.AllocationWarning;

/**
 * What produced a weight vector and whether it is a degraded outcome.
 *
 * @param method   procedure that produced the weights
 * @param degraded true if a fallback was used or any warning is degrading
 * @param warnings typed annotations, in the order they were raised
 */
public record AllocationDiagnostics(AllocationMethod method, boolean degraded, List<AllocationWarning> warnings) {

    public AllocationDiagnostics {
        Objects.requireNonNull(method, "method");
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
    }

    public static AllocationDiagnostics of(AllocationMethod method, List<AllocationWarning> warnings) {
        boolean degraded = method.isFallback()
            || (warnings != null && warnings.stream().anyMatch(AllocationWarning::degrading));
        return new AllocationDiagnostics(method, degraded, warnings);
    }

    public static AllocationDiagnostics clean(AllocationMethod method) {
        return of(method, List.of());
    }

    public AllocationDiagnostics withWarning(AllocationWarning warning) {
        List<AllocationWarning> all = new ArrayList<>(warnings);
        all.add(warning);
        return of(method, all);
    }
}
