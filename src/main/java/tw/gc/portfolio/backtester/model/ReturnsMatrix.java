package tw.gc.portfolio.backtester.model;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

import tw.gc.portfolio.backtester.enums.ReturnType;
import tw.gc.portfolio.backtester.exceptions.EmptyUniverseException;
import tw.gc.portfolio.backtester.exceptions.InvalidReturnsMatrixException;

/**
 * Validated, immutable table of periodic asset returns.
 *
 * <p>Rows are periods in strictly ascending date order, columns are the assets of a fixed
 * universe. Every row carries exactly one finite value per asset.
 *
 * <pre>
 *              PETR4    VALE3    ITUB4
 * 2018-01-31   0.0412  -0.0135   0.0220
 * 2018-02-28  -0.0087   0.0301   0.0045
 * ...
 * </pre>
 *
 * <p>Slices are independent copies, so a window handed to a worker thread can never observe
 * or cause mutation elsewhere.
 */
public final class ReturnsMatrix {

    private final List<LocalDate> dates;
    private final List<String> assets;
    private final double[][] values;
    private final ReturnType returnType;

    /**
     * @param dates      period dates, strictly ascending
     * @param assets     asset identifiers, unique and non-blank
     * @param values     row-major values, {@code values[row][asset]}
     * @param returnType how the values are expressed
     * @throws EmptyUniverseException        if there are no assets
     * @throws InvalidReturnsMatrixException if the table is malformed
     */
    public ReturnsMatrix(List<LocalDate> dates, List<String> assets, double[][] values, ReturnType returnType) {
        if (assets == null || assets.isEmpty()) {
            throw new EmptyUniverseException("Returns matrix has no assets");
        }
        if (dates == null || values == null) {
            throw new InvalidReturnsMatrixException("Dates and values must be non-null");
        }
        if (dates.size() != values.length) {
            throw new InvalidReturnsMatrixException("Got %d dates but %d rows of values"
                .formatted(dates.size(), values.length));
        }
        validateAssets(assets);
        validateDates(dates);
        this.assets = List.copyOf(assets);
        this.dates = List.copyOf(dates);
        this.values = copyValidated(values, this.assets, this.dates);
        this.returnType = returnType == null ? ReturnType.SIMPLE : returnType;
    }

    private static void validateAssets(List<String> assets) {
        Set<String> seen = new HashSet<>();
        for (String asset : assets) {
            if (asset == null || asset.isBlank()) {
                throw new InvalidReturnsMatrixException("Asset identifiers must be non-blank");
            }
            if (!seen.add(asset)) {
                throw new InvalidReturnsMatrixException("Duplicate asset column: " + asset);
            }
        }
    }

    private static void validateDates(List<LocalDate> dates) {
        LocalDate previous = null;
        for (LocalDate date : dates) {
            if (date == null) {
                throw new InvalidReturnsMatrixException("Dates must be non-null");
            }
            if (previous != null && !date.isAfter(previous)) {
                throw new InvalidReturnsMatrixException("Dates must be strictly ascending: %s follows %s"
                    .formatted(date, previous));
            }
            previous = date;
        }
    }

    private static double[][] copyValidated(double[][] values, List<String> assets, List<LocalDate> dates) {
        double[][] copy = new double[values.length][];
        for (int row = 0; row < values.length; row++) {
            double[] source = values[row];
            if (source == null || source.length != assets.size()) {
                throw new InvalidReturnsMatrixException("Row %s has %d values, expected one per asset (%d)"
                    .formatted(dates.get(row), source == null ? 0 : source.length, assets.size()));
            }
            for (int col = 0; col < source.length; col++) {
                if (!Double.isFinite(source[col])) {
                    throw new InvalidReturnsMatrixException("Non-finite return %s for %s on %s"
                        .formatted(source[col], assets.get(col), dates.get(row)));
                }
            }
            copy[row] = source.clone();
        }
        return copy;
    }

    public List<LocalDate> dates() {
        return dates;
    }

    public List<String> assets() {
        return assets;
    }

    public ReturnType returnType() {
        return returnType;
    }

    public int rows() {
        return values.length;
    }

    public int assetCount() {
        return assets.size();
    }

    public boolean isEmpty() {
        return values.length == 0;
    }

    public LocalDate date(int row) {
        return dates.get(row);
    }

    public double value(int row, int asset) {
        return values[row][asset];
    }

    /**
     * @return a copy of one period's values, as stored
     */
    public double[] row(int row) {
        return values[row].clone();
    }

    /**
     * @return a copy of one period's values converted to simple returns
     */
    public double[] simpleRow(int row) {
        double[] result = values[row].clone();
        for (int i = 0; i < result.length; i++) {
            result[i] = returnType.toSimple(result[i]);
        }
        return result;
    }

    /**
     * @return a copy of one asset's time series, as stored
     */
    public double[] column(int asset) {
        double[] result = new double[values.length];
        for (int row = 0; row < values.length; row++) {
            result[row] = values[row][asset];
        }
        return result;
    }

    /**
     * @return a deep copy of all values, {@code [row][asset]}
     */
    public double[][] toArray() {
        double[][] copy = new double[values.length][];
        for (int row = 0; row < values.length; row++) {
            copy[row] = values[row].clone();
        }
        return copy;
    }

    /**
     * Returns an independent matrix holding rows {@code [fromInclusive, toExclusive)}.
     */
    public ReturnsMatrix slice(int fromInclusive, int toExclusive) {
        Objects.checkFromToIndex(fromInclusive, toExclusive, values.length);
        double[][] rows = new double[toExclusive - fromInclusive][];
        for (int row = fromInclusive; row < toExclusive; row++) {
            rows[row - fromInclusive] = values[row];
        }
        return new ReturnsMatrix(dates.subList(fromInclusive, toExclusive), assets, rows, returnType);
    }

    /**
     * Index of the first row dated on or after {@code date}, or {@link #rows()} if none.
     */
    public int firstRowOnOrAfter(LocalDate date) {
        int index = Collections.binarySearch(dates, date);
        return index >= 0 ? index : -(index + 1);
    }

    /**
     * Builds a matrix from per-row lists, as received from a JSON request body.
     */
    public static ReturnsMatrix fromRows(List<LocalDate> dates, List<String> assets,
                                         List<List<Double>> rows, ReturnType returnType) {
        if (rows == null) {
            throw new InvalidReturnsMatrixException("Returns rows must be non-null");
        }
        List<double[]> converted = new ArrayList<>(rows.size());
        for (List<Double> row : rows) {
            if (row == null) {
                throw new InvalidReturnsMatrixException("Returns rows must be non-null");
            }
            double[] values = new double[row.size()];
            for (int i = 0; i < values.length; i++) {
                Double value = row.get(i);
                if (value == null) {
                    throw new InvalidReturnsMatrixException("Missing return value in row " + converted.size());
                }
                values[i] = value;
            }
            converted.add(values);
        }
        return new ReturnsMatrix(dates, assets, converted.toArray(new double[0][]), returnType);
    }

    @Override
    public String toString() {
        return "ReturnsMatrix[%d periods x %d assets, %s, %s]".formatted(
            rows(), assetCount(), returnType,
            isEmpty() ? "empty" : dates.get(0) + " → " + dates.get(dates.size() - 1));
    }
}
