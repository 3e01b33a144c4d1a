package tw.gc.portfolio.backtester.model;

import java.time.LocalDate;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Objects;
import java.util.TreeMap;

import tw.gc.portfolio.backtester.exceptions.InsufficientDataException;

/**
 * Risk-free rate, either a constant annual rate or a periodic series keyed by date.
 *
 * <p>An annual rate {@code r} maps to the periodic rate {@code r / periodsPerYear}. A series
 * lookup uses the latest observation dated on or before the requested date, so a period can
 * never see a rate published after it.
 */
public final class RiskFreeRate {

    private final double annualRate;
    private final NavigableMap<LocalDate, Double> periodicRates;

    private RiskFreeRate(double annualRate, NavigableMap<LocalDate, Double> periodicRates) {
        this.annualRate = annualRate;
        this.periodicRates = periodicRates;
    }

    public static RiskFreeRate annual(double annualRate) {
        if (!Double.isFinite(annualRate)) {
            throw new IllegalArgumentException("Risk-free rate must be finite, got: " + annualRate);
        }
        return new RiskFreeRate(annualRate, null);
    }

    public static RiskFreeRate zero() {
        return annual(0.0);
    }

    /**
     * @param ratesByDate periodic (not annualized) rates, e.g. monthly CDI
     */
    public static RiskFreeRate periodic(Map<LocalDate, Double> ratesByDate) {
        Objects.requireNonNull(ratesByDate, "ratesByDate");
        if (ratesByDate.isEmpty()) {
            throw new IllegalArgumentException("Risk-free series must not be empty");
        }
        TreeMap<LocalDate, Double> copy = new TreeMap<>();
        ratesByDate.forEach((date, rate) -> {
            if (date == null || rate == null || !Double.isFinite(rate)) {
                throw new IllegalArgumentException("Invalid risk-free observation %s=%s".formatted(date, rate));
            }
            copy.put(date, rate);
        });
        return new RiskFreeRate(Double.NaN, Collections.unmodifiableNavigableMap(copy));
    }

    public boolean isSeries() {
        return periodicRates != null;
    }

    /**
     * True when a rate is known for {@code date} and, by the floor lookup, for every later date.
     */
    public boolean covers(LocalDate date) {
        return periodicRates == null || periodicRates.floorKey(date) != null;
    }

    /**
     * Periodic rate applying to the period dated {@code date}.
     *
     * @throws InsufficientDataException if a series has no observation on or before {@code date}
     */
    public double periodicRate(LocalDate date, int periodsPerYear) {
        if (periodicRates == null) {
            return annualRate / periodsPerYear;
        }
        Map.Entry<LocalDate, Double> entry = periodicRates.floorEntry(date);
        if (entry == null) {
            throw new InsufficientDataException("No risk-free observation on or before " + date);
        }
        return entry.getValue();
    }

    public double[] periodicRates(List<LocalDate> dates, int periodsPerYear) {
        double[] rates = new double[dates.size()];
        for (int i = 0; i < rates.length; i++) {
            rates[i] = periodicRate(dates.get(i), periodsPerYear);
        }
        return rates;
    }

    /**
     * Annualized mean rate over the given dates (arithmetic, periodic mean x periods per year).
     */
    public double annualizedOver(List<LocalDate> dates, int periodsPerYear) {
        if (periodicRates == null || dates.isEmpty()) {
            return periodicRates == null ? annualRate : 0.0;
        }
        double sum = 0.0;
        for (LocalDate date : dates) {
            sum += periodicRate(date, periodsPerYear);
        }
        return sum / dates.size() * periodsPerYear;
    }

    @Override
    public String toString() {
        return periodicRates == null
            ? "RiskFreeRate[annual=%.4f]".formatted(annualRate)
            : "RiskFreeRate[series, %d observations]".formatted(periodicRates.size());
    }
}
