package tw.gc.portfolio.backtester.model;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Dated sequence of realized simple portfolio returns.
 *
 * @param dates   period dates, strictly ascending
 * @param returns realized simple return per period
 */
public record RealizedReturnSeries(List<LocalDate> dates, List<Double> returns) {

    public RealizedReturnSeries {
        Objects.requireNonNull(dates, "dates");
        Objects.requireNonNull(returns, "returns");
        if (dates.size() != returns.size()) {
            throw new IllegalArgumentException("Got %d dates but %d returns".formatted(dates.size(), returns.size()));
        }
        for (int i = 1; i < dates.size(); i++) {
            if (!dates.get(i).isAfter(dates.get(i - 1))) {
                throw new IllegalArgumentException("Return dates must be strictly ascending: %s follows %s"
                    .formatted(dates.get(i), dates.get(i - 1)));
            }
        }
        dates = List.copyOf(dates);
        returns = List.copyOf(returns);
    }

    public static RealizedReturnSeries empty() {
        return new RealizedReturnSeries(List.of(), List.of());
    }

    public static RealizedReturnSeries of(List<LocalDate> dates, double[] returns) {
        List<Double> boxed = new ArrayList<>(returns.length);
        for (double r : returns) {
            boxed.add(r);
        }
        return new RealizedReturnSeries(dates, boxed);
    }

    public int size() {
        return returns.size();
    }

    public boolean isEmpty() {
        return returns.isEmpty();
    }

    public double[] toArray() {
        return returns.stream().mapToDouble(Double::doubleValue).toArray();
    }

    /**
     * Concatenates period series in chronological order.
     */
    public static RealizedReturnSeries concat(List<RealizedReturnSeries> parts) {
        List<LocalDate> dates = new ArrayList<>();
        List<Double> returns = new ArrayList<>();
        for (RealizedReturnSeries part : parts) {
            dates.addAll(part.dates());
            returns.addAll(part.returns());
        }
        return new RealizedReturnSeries(dates, returns);
    }

    /**
     * Restricts this series to the dates it shares with {@code other}.
     */
    public RealizedReturnSeries alignedWith(RealizedReturnSeries other) {
        Map<LocalDate, Double> byDate = new HashMap<>();
        for (int i = 0; i < other.size(); i++) {
            byDate.put(other.dates().get(i), other.returns().get(i));
        }
        List<LocalDate> commonDates = new ArrayList<>();
        List<Double> commonReturns = new ArrayList<>();
        for (int i = 0; i < dates.size(); i++) {
            if (byDate.containsKey(dates.get(i))) {
                commonDates.add(dates.get(i));
                commonReturns.add(returns.get(i));
            }
        }
        return new RealizedReturnSeries(commonDates, commonReturns);
    }
}
