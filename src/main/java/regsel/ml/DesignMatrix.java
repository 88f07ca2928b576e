package regsel.ml;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Validated regression input: an n×p matrix X (rows = observations), a response y of length n,
 * and a stable name for every column.
 * <p>
 * When the matrix carries an intercept it is always column 0, named {@link #INTERCEPT}, and holds
 * only ones. Each row also carries a row id (its position in the source table) so that models
 * built from different column sets can be checked for being fit on the same observations.
 * <p>
 * Instances are immutable; every "modification" returns a new matrix.
 */
public final class DesignMatrix {

    public static final String INTERCEPT = "(Intercept)";

    private final double[][] x;
    private final double[] y;
    private final List<String> columnNames;
    private final Map<String, Integer> columnIndex;
    private final boolean intercept;
    private final int[] rowIds;

    private DesignMatrix(double[][] x, double[] y, List<String> columnNames, boolean intercept, int[] rowIds) {
        this.x = x;
        this.y = y;
        this.columnNames = Collections.unmodifiableList(new ArrayList<>(columnNames));
        this.intercept = intercept;
        this.rowIds = rowIds;
        Map<String, Integer> index = new HashMap<>();
        for (int j = 0; j < columnNames.size(); j++) {
            if (index.put(columnNames.get(j), j) != null) {
                throw new IllegalArgumentException("Duplicate column name: " + columnNames.get(j));
            }
        }
        this.columnIndex = index;
    }

    /**
     * Build a matrix from raw rows. If {@code intercept} is true, column 0 must be the
     * intercept column (all ones) and {@code names.get(0)} must be {@link #INTERCEPT}.
     */
    public static DesignMatrix of(double[][] x, double[] y, List<String> names, boolean intercept) {
        Objects.requireNonNull(x, "x");
        Objects.requireNonNull(y, "y");
        Objects.requireNonNull(names, "names");
        int n = x.length;
        double[][] copy = new double[n][];
        for (int i = 0; i < n; i++) {
            copy[i] = Objects.requireNonNull(x[i], "row " + i).clone();
        }
        int[] ids = new int[n];
        for (int i = 0; i < n; i++) ids[i] = i;
        return validated(copy, y.clone(), names, intercept, ids);
    }

    /** Prepend an intercept column to {@code predictors} (rows = observations). */
    public static DesignMatrix withIntercept(double[][] predictors, double[] y, String... names) {
        return fromColumns(transpose(predictors, names.length), y, Arrays.asList(names), true, null);
    }

    /** Use {@code predictors} as-is, no intercept. */
    public static DesignMatrix withoutIntercept(double[][] predictors, double[] y, String... names) {
        return fromColumns(transpose(predictors, names.length), y, Arrays.asList(names), false, null);
    }

    public static Builder builder() {
        return new Builder();
    }

    private static double[][] transpose(double[][] rows, int p) {
        Objects.requireNonNull(rows, "predictors");
        double[][] cols = new double[p][rows.length];
        for (int i = 0; i < rows.length; i++) {
            if (rows[i] == null || rows[i].length != p) {
                throw new DimensionException("Row " + i + " has " + (rows[i] == null ? 0 : rows[i].length)
                    + " values, expected " + p);
            }
            for (int j = 0; j < p; j++) cols[j][i] = rows[i][j];
        }
        return cols;
    }

    private static DesignMatrix fromColumns(double[][] columns, double[] y, List<String> names,
                                            boolean intercept, int[] rowIds) {
        Objects.requireNonNull(y, "y");
        if (columns.length != names.size()) {
            throw new DimensionException(columns.length + " columns but " + names.size() + " names");
        }
        int n = y.length;
        int p = columns.length + (intercept ? 1 : 0);
        double[][] rows = new double[n][p];
        List<String> allNames = new ArrayList<>(p);
        if (intercept) allNames.add(INTERCEPT);
        allNames.addAll(names);
        for (int j = 0; j < columns.length; j++) {
            if (columns[j].length != n) {
                throw new DimensionException("Column '" + names.get(j) + "' has " + columns[j].length
                    + " values but the response has " + n);
            }
        }
        int offset = intercept ? 1 : 0;
        for (int i = 0; i < n; i++) {
            if (intercept) rows[i][0] = 1.0;
            for (int j = 0; j < columns.length; j++) rows[i][j + offset] = columns[j][i];
        }
        int[] ids = rowIds;
        if (ids == null) {
            ids = new int[n];
            for (int i = 0; i < n; i++) ids[i] = i;
        } else if (ids.length != n) {
            throw new DimensionException(ids.length + " row ids for " + n + " observations");
        } else {
            ids = ids.clone();
        }
        return validated(rows, y.clone(), allNames, intercept, ids);
    }

    private static DesignMatrix validated(double[][] x, double[] y, List<String> names, boolean intercept, int[] rowIds) {
        int n = x.length;
        if (y.length != n) {
            throw new DimensionException("X has " + n + " rows but y has " + y.length + " values");
        }
        int p = names.size();
        if (p == 0) {
            throw new DimensionException("Design matrix needs at least one column");
        }
        if (n < p) {
            throw new DimensionException("n = " + n + " observations is fewer than p = " + p + " columns");
        }
        for (int i = 0; i < n; i++) {
            if (x[i].length != p) {
                throw new DimensionException("Row " + i + " has " + x[i].length + " values, expected " + p);
            }
            if (!Double.isFinite(y[i])) {
                throw new RegressionException("Response value at row " + i + " is not finite: " + y[i]);
            }
            for (int j = 0; j < p; j++) {
                if (!Double.isFinite(x[i][j])) {
                    throw new RegressionException("Value at row " + i + ", column '" + names.get(j)
                        + "' is not finite: " + x[i][j]);
                }
            }
        }
        if (intercept) {
            if (!INTERCEPT.equals(names.get(0))) {
                throw new IllegalArgumentException("Intercept column must be column 0 named " + INTERCEPT);
            }
            for (int i = 0; i < n; i++) {
                if (x[i][0] != 1.0) {
                    throw new IllegalArgumentException("Intercept column must contain only ones (row " + i + ")");
                }
            }
        } else if (names.contains(INTERCEPT)) {
            throw new IllegalArgumentException(INTERCEPT + " is reserved for the intercept column");
        }
        return new DesignMatrix(x, y, names, intercept, rowIds);
    }

    public int rows() {
        return x.length;
    }

    public int columns() {
        return columnNames.size();
    }

    public double get(int row, int column) {
        return x[row][column];
    }

    public double response(int row) {
        return y[row];
    }

    public double[] response() {
        return y.clone();
    }

    public double[] row(int i) {
        return x[i].clone();
    }

    public double[] column(int j) {
        double[] c = new double[x.length];
        for (int i = 0; i < x.length; i++) c[i] = x[i][j];
        return c;
    }

    public boolean hasIntercept() {
        return intercept;
    }

    public List<String> columnNames() {
        return columnNames;
    }

    public String columnName(int j) {
        return columnNames.get(j);
    }

    public int[] rowIds() {
        return rowIds.clone();
    }

    /** Index of the named column. */
    public int columnIndex(String name) {
        Integer j = columnIndex.get(name);
        if (j == null) throw new UnknownTermException(name);
        return j;
    }

    /** Indices of all columns other than the intercept. */
    public int[] predictorIndices() {
        int start = intercept ? 1 : 0;
        int[] idx = new int[columns() - start];
        for (int j = start; j < columns(); j++) idx[j - start] = j;
        return idx;
    }

    public List<String> predictorNames() {
        return columnNames.subList(intercept ? 1 : 0, columns());
    }

    /**
     * Project onto a subset of columns. Indices are sorted and deduplicated, so the intercept
     * (column 0) stays in front when selected.
     */
    public DesignMatrix selectColumns(int... columns) {
        int[] idx = Arrays.stream(columns).sorted().distinct().toArray();
        if (idx.length == 0) {
            throw new DimensionException("Column selection is empty");
        }
        for (int j : idx) {
            if (j < 0 || j >= columns()) {
                throw new UnknownTermException("#" + j);
            }
        }
        double[][] rows = new double[x.length][idx.length];
        for (int i = 0; i < x.length; i++) {
            for (int k = 0; k < idx.length; k++) rows[i][k] = x[i][idx[k]];
        }
        List<String> names = new ArrayList<>(idx.length);
        for (int j : idx) names.add(columnNames.get(j));
        boolean keepsIntercept = intercept && idx[0] == 0;
        return validated(rows, y, names, keepsIntercept, rowIds);
    }

    /** Project onto the named columns (intercept kept only when named). */
    public DesignMatrix select(List<String> names) {
        int[] idx = new int[names.size()];
        for (int k = 0; k < idx.length; k++) idx[k] = columnIndex(names.get(k));
        return selectColumns(idx);
    }

    /** Same matrix without the named column. */
    public DesignMatrix without(String name) {
        int drop = columnIndex(name);
        int[] keep = new int[columns() - 1];
        for (int j = 0, k = 0; j < columns(); j++) {
            if (j != drop) keep[k++] = j;
        }
        return selectColumns(keep);
    }

    /** Same X and row ids with a new response vector. */
    public DesignMatrix withResponse(double[] newY) {
        if (newY.length != x.length) {
            throw new DimensionException("Response has " + newY.length + " values, expected " + x.length);
        }
        return validated(x, newY.clone(), columnNames, intercept, rowIds);
    }

    /** Same matrix with column {@code j} replaced by {@code values}. */
    public DesignMatrix withColumn(int j, double[] values) {
        if (values.length != x.length) {
            throw new DimensionException("Column has " + values.length + " values, expected " + x.length);
        }
        if (intercept && j == 0) {
            throw new IllegalArgumentException("The intercept column cannot be replaced");
        }
        double[][] rows = new double[x.length][];
        for (int i = 0; i < x.length; i++) {
            rows[i] = x[i].clone();
            rows[i][j] = values[i];
        }
        return validated(rows, y, columnNames, intercept, rowIds);
    }

    /** Rows in the given order (indices may repeat), keeping their row ids. */
    public DesignMatrix selectRows(int[] rows) {
        double[][] data = new double[rows.length][];
        double[] resp = new double[rows.length];
        int[] ids = new int[rows.length];
        for (int k = 0; k < rows.length; k++) {
            data[k] = x[rows[k]].clone();
            resp[k] = y[rows[k]];
            ids[k] = rowIds[rows[k]];
        }
        return validated(data, resp, columnNames, intercept, ids);
    }

    /** Read-only view of the rows for the solver; callers must not modify it. */
    double[][] rawRows() {
        return x;
    }

    double[] rawResponse() {
        return y;
    }

    @Override
    public String toString() {
        Map<String, Object> summary = new LinkedHashMap<>();
        summary.put("n", rows());
        summary.put("columns", columnNames);
        return "DesignMatrix" + summary;
    }

    /** Column-wise builder, the natural shape for data coming out of a table. */
    public static final class Builder {
        private final List<String> names = new ArrayList<>();
        private final List<double[]> columns = new ArrayList<>();
        private double[] response;
        private boolean intercept = true;
        private int[] rowIds;

        private Builder() {
        }

        public Builder intercept(boolean intercept) {
            this.intercept = intercept;
            return this;
        }

        public Builder response(double[] y) {
            this.response = y;
            return this;
        }

        public Builder column(String name, double[] values) {
            names.add(Objects.requireNonNull(name, "name"));
            columns.add(Objects.requireNonNull(values, "values"));
            return this;
        }

        public Builder rowIds(int[] rowIds) {
            this.rowIds = rowIds;
            return this;
        }

        public DesignMatrix build() {
            if (response == null) throw new IllegalStateException("response not set");
            return fromColumns(columns.toArray(new double[0][]), response, names, intercept, rowIds);
        }
    }
}
