package regsel.ml;

/**
 * One line of a coefficient table: estimate, standard error, t statistic against zero,
 * two-sided p-value and confidence bounds. Values are kept exactly as computed.
 */
public final class CoefficientRow {

    private final String term;
    private final double estimate;
    private final double standardError;
    private final double tStatistic;
    private final double pValue;
    private final double lower;
    private final double upper;

    public CoefficientRow(String term, double estimate, double standardError, double tStatistic,
                          double pValue, double lower, double upper) {
        this.term = term;
        this.estimate = estimate;
        this.standardError = standardError;
        this.tStatistic = tStatistic;
        this.pValue = pValue;
        this.lower = lower;
        this.upper = upper;
    }

    public String getTerm() { return term; }
    public double getEstimate() { return estimate; }
    public double getStandardError() { return standardError; }
    public double getTStatistic() { return tStatistic; }
    public double getPValue() { return pValue; }
    public double getLower() { return lower; }
    public double getUpper() { return upper; }

    /** False for coefficients of aliased columns (all numbers NaN). */
    public boolean isEstimable() {
        return !Double.isNaN(estimate);
    }

    @Override
    public String toString() {
        return term + ": " + estimate + " (se " + standardError + ", t " + tStatistic + ", p " + pValue
            + ", [" + lower + ", " + upper + "])";
    }
}
