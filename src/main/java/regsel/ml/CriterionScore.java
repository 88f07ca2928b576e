package regsel.ml;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Scores of one predictor subset. {@code size} counts the selected predictors (k);
 * {@code parameters} counts every coefficient in the model (k plus the intercept and any
 * forced columns).
 */
public final class CriterionScore {

    private final int[] columns;
    private final List<String> names;
    private final int parameters;
    private final double rss;
    private final double aic;
    private final double bic;
    private final double adjustedRSquared;
    private final double cp;

    public CriterionScore(int[] columns, List<String> names, int parameters, double rss,
                          double aic, double bic, double adjustedRSquared, double cp) {
        this.columns = columns.clone();
        this.names = Collections.unmodifiableList(names);
        this.parameters = parameters;
        this.rss = rss;
        this.aic = aic;
        this.bic = bic;
        this.adjustedRSquared = adjustedRSquared;
        this.cp = cp;
    }

    /** Design-matrix indices of the selected predictors, ascending. */
    public int[] getColumns() {
        return columns.clone();
    }

    public List<String> getNames() {
        return names;
    }

    public int size() {
        return columns.length;
    }

    public int getParameters() { return parameters; }
    public double getRss() { return rss; }
    public double getAic() { return aic; }
    public double getBic() { return bic; }
    public double getAdjustedRSquared() { return adjustedRSquared; }
    public double getCp() { return cp; }

    /** Same selected columns, ignoring scores. */
    public boolean sameSubset(CriterionScore other) {
        return Arrays.equals(columns, other.columns);
    }

    static int compareLexically(CriterionScore a, CriterionScore b) {
        return Arrays.compare(a.columns, b.columns);
    }

    @Override
    public String toString() {
        return names + " rss=" + rss + " aic=" + aic + " bic=" + bic + " adjR2=" + adjustedRSquared + " cp=" + cp;
    }
}
