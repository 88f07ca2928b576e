package regsel.ml;

/**
 * Extra-sum-of-squares F test of a reduced model against a full model:
 * F = ((RSS₀ − RSS₁)/(df₀ − df₁)) / (RSS₁/df₁).
 */
public final class FTestResult {

    private final double fStatistic;
    private final int numeratorDf;
    private final int denominatorDf;
    private final double pValue;
    private final double rssReduced;
    private final double rssFull;

    public FTestResult(double fStatistic, int numeratorDf, int denominatorDf, double pValue,
                       double rssReduced, double rssFull) {
        this.fStatistic = fStatistic;
        this.numeratorDf = numeratorDf;
        this.denominatorDf = denominatorDf;
        this.pValue = pValue;
        this.rssReduced = rssReduced;
        this.rssFull = rssFull;
    }

    public double getFStatistic() { return fStatistic; }
    public int getNumeratorDf() { return numeratorDf; }
    public int getDenominatorDf() { return denominatorDf; }
    public double getPValue() { return pValue; }
    public double getRssReduced() { return rssReduced; }
    public double getRssFull() { return rssFull; }

    @Override
    public String toString() {
        return "F(" + numeratorDf + ", " + denominatorDf + ") = " + fStatistic + ", p = " + pValue;
    }
}
