package regsel.ml;

/** t = (β̂ − c) / se(β̂) with its two-sided p-value from t(n − rank). */
public final class TTestResult {

    private final String term;
    private final double estimate;
    private final double hypothesized;
    private final double standardError;
    private final double tStatistic;
    private final int df;
    private final double pValue;

    public TTestResult(String term, double estimate, double hypothesized, double standardError,
                       double tStatistic, int df, double pValue) {
        this.term = term;
        this.estimate = estimate;
        this.hypothesized = hypothesized;
        this.standardError = standardError;
        this.tStatistic = tStatistic;
        this.df = df;
        this.pValue = pValue;
    }

    public String getTerm() { return term; }
    public double getEstimate() { return estimate; }
    public double getHypothesized() { return hypothesized; }
    public double getStandardError() { return standardError; }
    public double getTStatistic() { return tStatistic; }
    public int getDf() { return df; }
    public double getPValue() { return pValue; }

    @Override
    public String toString() {
        return "t(" + df + ") = " + tStatistic + " for " + term + " = " + hypothesized + ", p = " + pValue;
    }
}
