package regsel.data;

import regsel.ml.DesignMatrix;
import regsel.ml.DimensionException;
import regsel.ml.UnknownTermException;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Named numeric columns of equal length, with NaN marking a missing value.
 * <p>
 * This is the tabular side of an analysis: columns are chosen by name and turned into a
 * {@link DesignMatrix} of complete cases, each row remembering its position in the table.
 */
public final class DataTable {

    private static final Set<String> MISSING = Set.of("", "NA", "NaN", "nan", "?", ".");

    private final Map<String, double[]> columns;
    private final int rows;

    private DataTable(Map<String, double[]> columns, int rows) {
        this.columns = columns;
        this.rows = rows;
    }

    public static DataTable of(Map<String, double[]> columns) {
        Map<String, double[]> copy = new LinkedHashMap<>();
        int rows = -1;
        for (Map.Entry<String, double[]> e : columns.entrySet()) {
            double[] values = e.getValue();
            if (rows >= 0 && values.length != rows) {
                throw new DimensionException("Column '" + e.getKey() + "' has " + values.length
                    + " values, expected " + rows);
            }
            rows = values.length;
            copy.put(e.getKey(), values.clone());
        }
        if (copy.isEmpty()) throw new IllegalArgumentException("A table needs at least one column");
        return new DataTable(copy, rows);
    }

    /**
     * Load a CSV. Fields are separated by ',', ';' or tab; lines starting with '#' are comments.
     * The first line is the header unless its first field is numeric, in which case columns are
     * named V1, V2, ... Empty fields and NA, NaN, '?' or '.' are missing values.
     */
    public static DataTable fromCsv(Path path) throws IOException {
        return parse(Files.readAllLines(path, StandardCharsets.UTF_8));
    }

    public static DataTable parse(List<String> lines) {
        List<String> header = null;
        List<double[]> body = new ArrayList<>();
        int lineNo = 0;
        for (String raw : lines) {
            lineNo++;
            String line = raw.trim();
            if (line.isEmpty() || line.startsWith("#")) continue;
            String[] parts = line.split("[,;\t]", -1);
            if (header == null && body.isEmpty() && !isNumeric(parts[0])) {
                header = new ArrayList<>(parts.length);
                for (String p : parts) header.add(unquote(p));
                continue;
            }
            double[] row = new double[parts.length];
            for (int j = 0; j < parts.length; j++) {
                String cell = unquote(parts[j]);
                if (MISSING.contains(cell)) {
                    row[j] = Double.NaN;
                    continue;
                }
                try {
                    row[j] = Double.parseDouble(cell);
                } catch (NumberFormatException e) {
                    throw new IllegalArgumentException("Line " + lineNo + ", field " + (j + 1)
                        + ": not a number: '" + cell + "'", e);
                }
            }
            body.add(row);
        }
        if (body.isEmpty()) throw new IllegalArgumentException("No data rows");
        int width = header != null ? header.size() : body.get(0).length;
        if (header == null) {
            header = new ArrayList<>(width);
            for (int j = 0; j < width; j++) header.add("V" + (j + 1));
        }
        Map<String, double[]> columns = new LinkedHashMap<>();
        for (int j = 0; j < width; j++) {
            double[] col = new double[body.size()];
            for (int i = 0; i < body.size(); i++) {
                double[] row = body.get(i);
                if (row.length != width) {
                    throw new DimensionException("Data row " + (i + 1) + " has " + row.length
                        + " fields, expected " + width);
                }
                col[i] = row[j];
            }
            if (columns.put(header.get(j), col) != null) {
                throw new IllegalArgumentException("Duplicate column name: " + header.get(j));
            }
        }
        return new DataTable(columns, body.size());
    }

    private static String unquote(String s) {
        String t = s.trim();
        if (t.length() >= 2 && (t.startsWith("\"") && t.endsWith("\"") || t.startsWith("'") && t.endsWith("'"))) {
            t = t.substring(1, t.length() - 1).trim();
        }
        return t;
    }

    private static boolean isNumeric(String s) {
        String t = unquote(s);
        if (MISSING.contains(t)) return true;
        try {
            Double.parseDouble(t);
            return true;
        } catch (NumberFormatException e) {
            return false;
        }
    }

    public int rows() {
        return rows;
    }

    public List<String> columnNames() {
        return Collections.unmodifiableList(new ArrayList<>(columns.keySet()));
    }

    public double[] column(String name) {
        double[] c = columns.get(name);
        if (c == null) throw new UnknownTermException(name);
        return c.clone();
    }

    /** Number of rows with a missing value in any of the named columns. */
    public int incompleteRows(List<String> names) {
        return rows - completeRows(names).length;
    }

    private int[] completeRows(List<String> names) {
        List<double[]> cols = new ArrayList<>(names.size());
        for (String name : names) {
            double[] c = columns.get(name);
            if (c == null) throw new UnknownTermException(name);
            cols.add(c);
        }
        int[] keep = new int[rows];
        int count = 0;
        for (int i = 0; i < rows; i++) {
            boolean complete = true;
            for (double[] c : cols) {
                if (Double.isNaN(c[i])) {
                    complete = false;
                    break;
                }
            }
            if (complete) keep[count++] = i;
        }
        return Arrays.copyOf(keep, count);
    }

    /**
     * Design matrix of the complete cases on {@code response} and {@code predictors}.
     * Row ids are positions in this table, so two matrices built from different column lists
     * can be compared for using the same observations.
     */
    public DesignMatrix toDesignMatrix(String response, List<String> predictors, boolean intercept) {
        if (predictors.contains(response)) {
            throw new IllegalArgumentException("Response '" + response + "' cannot also be a predictor");
        }
        List<String> used = new ArrayList<>(predictors.size() + 1);
        used.add(response);
        used.addAll(predictors);
        int[] keep = completeRows(used);

        DesignMatrix.Builder builder = DesignMatrix.builder()
            .intercept(intercept)
            .rowIds(keep)
            .response(pick(columns.get(response), keep));
        for (String name : predictors) {
            builder.column(name, pick(columns.get(name), keep));
        }
        return builder.build();
    }

    private static double[] pick(double[] column, int[] rows) {
        double[] out = new double[rows.length];
        for (int k = 0; k < rows.length; k++) out[k] = column[rows[k]];
        return out;
    }
}
