package regsel.ml;

import org.apache.commons.math3.linear.MatrixUtils;
import org.apache.commons.math3.linear.RealMatrix;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Result of one least-squares fit. Immutable; a fit on a new response is a new instance.
 * <p>
 * Coefficients of columns that were aliased (linearly dependent on earlier columns) are
 * {@code NaN} and reported as not estimable. Everything needed for inference is kept from the
 * factorization X = QR of the retained columns: R, R⁻¹ (so (XᵗX)⁻¹ = R⁻¹R⁻ᵗ without forming XᵗX),
 * the residuals and the leverages ‖Qᵢ‖².
 */
public final class FittedModel {

    private final DesignMatrix design;
    private final double[] coefficients;
    private final boolean[] estimable;
    private final int[] retained;
    private final int[] rankPosition;
    private final double[][] r;
    private final double[][] rInverse;
    private final double[] fitted;
    private final double[] residuals;
    private final double[] leverage;
    private final double rss;
    private final double tss;
    private final double conditionNumber;

    FittedModel(DesignMatrix design, double[] coefficients, int[] retained, double[][] r, double[][] rInverse,
                double[] fitted, double[] residuals, double[] leverage, double rss, double conditionNumber) {
        this.design = design;
        this.coefficients = coefficients;
        this.retained = retained;
        this.r = r;
        this.rInverse = rInverse;
        this.fitted = fitted;
        this.residuals = residuals;
        this.leverage = leverage;
        this.rss = rss;
        this.conditionNumber = conditionNumber;
        this.estimable = new boolean[design.columns()];
        this.rankPosition = new int[design.columns()];
        Arrays.fill(rankPosition, -1);
        for (int k = 0; k < retained.length; k++) {
            estimable[retained[k]] = true;
            rankPosition[retained[k]] = k;
        }
        this.tss = totalSumOfSquares(design.rawResponse(), design.hasIntercept());
    }

    static double totalSumOfSquares(double[] y, boolean centered) {
        double mean = 0;
        if (centered) {
            for (double v : y) mean += v;
            mean /= y.length;
        }
        double ss = 0;
        for (double v : y) ss += (v - mean) * (v - mean);
        return ss;
    }

    /** The matrix this model was fit on. */
    public DesignMatrix getDesign() {
        return design;
    }

    public int getObservations() {
        return design.rows();
    }

    public int getRank() {
        return retained.length;
    }

    /** n − getRank(X). */
    public int getResidualDf() {
        return design.rows() - retained.length;
    }

    public double getRss() {
        return rss;
    }

    /** Total sum of squares, about the mean when the model has an intercept. */
    public double getTss() {
        return tss;
    }

    /** σ̂² = RSS / (n − rank); NaN for a saturated fit. */
    public double getSigma2() {
        int df = getResidualDf();
        return df > 0 ? rss / df : Double.NaN;
    }

    public double getSigma() {
        return Math.sqrt(getSigma2());
    }

    public boolean hasIntercept() {
        return design.hasIntercept();
    }

    public List<String> getTerms() {
        return design.columnNames();
    }

    /** Names of the columns with an estimable coefficient, in design order. */
    public List<String> getEstimableTerms() {
        List<String> out = new ArrayList<>(retained.length);
        for (int j : retained) out.add(design.columnName(j));
        return out;
    }

    public List<String> getAliasedTerms() {
        List<String> out = new ArrayList<>();
        for (int j = 0; j < estimable.length; j++) {
            if (!estimable[j]) out.add(design.columnName(j));
        }
        return out;
    }

    public int termIndex(String term) {
        return design.columnIndex(term);
    }

    public boolean isEstimable(int j) {
        return estimable[j];
    }

    public double[] getCoefficients() {
        return coefficients.clone();
    }

    public double getCoefficient(int j) {
        return coefficients[j];
    }

    public double getCoefficient(String term) {
        return coefficients[termIndex(term)];
    }

    /** se(β̂ⱼ) = σ̂·‖row j of R⁻¹‖. */
    public double getStandardError(int j) {
        int k = rankPosition[j];
        if (k < 0) return Double.NaN;
        double ss = 0;
        for (int c = k; c < rInverse.length; c++) ss += rInverse[k][c] * rInverse[k][c];
        return getSigma() * Math.sqrt(ss);
    }

    public double getStandardError(String term) {
        return getStandardError(termIndex(term));
    }

    /** Element (a, b) of (XᵗX)⁻¹ = R⁻¹R⁻ᵗ; NaN when either column is aliased. */
    public double getUnscaledCovariance(int a, int b) {
        int ka = rankPosition[a];
        int kb = rankPosition[b];
        if (ka < 0 || kb < 0) return Double.NaN;
        double s = 0;
        for (int c = Math.max(ka, kb); c < rInverse.length; c++) s += rInverse[ka][c] * rInverse[kb][c];
        return s;
    }

    /** (XᵗX)⁻¹ over the retained columns, in {@link #getEstimableTerms()} order. */
    public RealMatrix getUnscaledCovariance() {
        RealMatrix ri = MatrixUtils.createRealMatrix(rInverse);
        return ri.multiply(ri.transpose());
    }

    /** σ̂²(XᵗX)⁻¹ over the retained columns. */
    public RealMatrix getCovariance() {
        return getUnscaledCovariance().scalarMultiply(getSigma2());
    }

    /** Element (a, b) of XᵗX = RᵗR, reconstructed from the factorization. */
    public double getCrossProduct(int a, int b) {
        int ka = rankPosition[a];
        int kb = rankPosition[b];
        if (ka < 0 || kb < 0) return Double.NaN;
        double s = 0;
        for (int k = 0; k <= Math.min(ka, kb); k++) s += r[k][ka] * r[k][kb];
        return s;
    }

    /** Upper-triangular R of the retained columns. */
    public RealMatrix getR() {
        return MatrixUtils.createRealMatrix(r);
    }

    public double[] getFitted() {
        return fitted.clone();
    }

    public double[] getResiduals() {
        return residuals.clone();
    }

    public double[] getLeverage() {
        return leverage.clone();
    }

    /** Ratio of the largest to the smallest singular value of the retained columns of X. */
    public double getConditionNumber() {
        return conditionNumber;
    }

    public double getRSquared() {
        return tss > 0 ? 1.0 - rss / tss : 0;
    }

    public double getAdjustedRSquared() {
        int n = getObservations();
        int denomDf = hasIntercept() ? n - 1 : n;
        int df = getResidualDf();
        if (df <= 0 || tss <= 0) return Double.NaN;
        return 1.0 - (rss / df) / (tss / denomDf);
    }

    /** Gaussian log-likelihood at the MLE σ² = RSS/n. */
    public double getLogLikelihood() {
        int n = getObservations();
        return -0.5 * n * (Math.log(2 * Math.PI) + Math.log(rss / n) + 1);
    }

    /** n·ln(RSS/n) + 2·rank, the form used for subset ranking. */
    public double getAic() {
        int n = getObservations();
        return n * Math.log(rss / n) + 2.0 * getRank();
    }

    /** n·ln(RSS/n) + ln(n)·rank. */
    public double getBic() {
        int n = getObservations();
        return n * Math.log(rss / n) + Math.log(n) * getRank();
    }

    /** Prediction for one row laid out like the design matrix (intercept entry included). */
    public double predict(double[] row) {
        if (row.length != coefficients.length) {
            throw new DimensionException("Row has " + row.length + " values, model has " + coefficients.length + " terms");
        }
        double yHat = 0;
        for (int j : retained) yHat += coefficients[j] * row[j];
        return yHat;
    }

    @Override
    public String toString() {
        return "FittedModel{terms=" + getTerms() + ", coefficients=" + Arrays.toString(coefficients)
            + ", rss=" + rss + ", df=" + getResidualDf() + "}";
    }
}
