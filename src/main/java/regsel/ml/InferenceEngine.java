package regsel.ml;

import org.apache.commons.math3.distribution.FDistribution;
import org.apache.commons.math3.distribution.TDistribution;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * t and F tests, confidence intervals and regions, and fit diagnostics, all derived from a
 * {@link FittedModel}'s sufficient statistics (β̂, RSS, df and R⁻¹).
 * <p>
 * Refits (dropping a term, VIF regressions) go through the solver given at construction.
 */
public class InferenceEngine {

    private final LeastSquaresSolver solver;

    public InferenceEngine() {
        this(new LeastSquaresSolver());
    }

    public InferenceEngine(LeastSquaresSolver solver) {
        this.solver = Objects.requireNonNull(solver, "solver");
    }

    /**
     * Compare nested models fit on the same observations.
     *
     * @throws NotNestedException           if reduced's columns are not a proper subset of full's
     * @throws InconsistentSampleException  if the two were fit on different observations
     */
    public FTestResult fTest(FittedModel full, FittedModel reduced) {
        requireSameSample(full, reduced);
        Set<String> fullTerms = new HashSet<>(full.getTerms());
        for (String term : reduced.getTerms()) {
            if (!fullTerms.contains(term)) {
                throw new NotNestedException("Reduced model term '" + term + "' is not in the full model " + full.getTerms());
            }
        }
        int df0 = reduced.getResidualDf();
        int df1 = full.getResidualDf();
        if (df0 <= df1) {
            throw new NotNestedException("Reduced model must have more residual df than the full model ("
                + df0 + " vs " + df1 + ")");
        }
        return fStatistic(reduced.getRss(), df0, full.getRss(), df1);
    }

    /** Global F test of the model against the intercept-only model (or the empty model). */
    public FTestResult overallFTest(FittedModel model) {
        int n = model.getObservations();
        int df0 = model.hasIntercept() ? n - 1 : n;
        if (df0 - model.getResidualDf() <= 0) {
            throw new NotNestedException("No estimable terms to test beyond the intercept");
        }
        return fStatistic(model.getTss(), df0, model.getRss(), model.getResidualDf());
    }

    /** F test for dropping a single term; F equals the square of that term's t statistic. */
    public FTestResult dropTermFTest(FittedModel model, String term) {
        requireEstimable(model, term);
        FittedModel reduced = solver.fit(model.getDesign().without(term));
        return fTest(model, reduced);
    }

    private static FTestResult fStatistic(double rss0, int df0, double rss1, int df1) {
        int numDf = df0 - df1;
        double f = ((rss0 - rss1) / numDf) / (rss1 / df1);
        double p = df1 > 0 ? 1.0 - new FDistribution(numDf, df1).cumulativeProbability(f) : Double.NaN;
        return new FTestResult(f, numDf, df1, p, rss0, rss1);
    }

    private static void requireSameSample(FittedModel a, FittedModel b) {
        if (a.getObservations() != b.getObservations()) {
            throw new InconsistentSampleException("Models were fit on " + a.getObservations() + " and "
                + b.getObservations() + " observations");
        }
        if (!Arrays.equals(a.getDesign().rowIds(), b.getDesign().rowIds())) {
            throw new InconsistentSampleException("Models were fit on different rows of the source data");
        }
        if (!Arrays.equals(a.getDesign().rawResponse(), b.getDesign().rawResponse())) {
            throw new InconsistentSampleException("Models were fit on different responses");
        }
    }

    private static int requireEstimable(FittedModel model, String term) {
        int j = model.termIndex(term);
        if (!model.isEstimable(j)) {
            throw new RankDeficiencyException("Term '" + term + "' is aliased and has no estimate",
                List.of(term), model.getRank());
        }
        return j;
    }

    public TTestResult tTest(FittedModel model, String term) {
        return tTest(model, term, 0);
    }

    /** t = (β̂ − c)/se(β̂), two-sided against t(n − rank). */
    public TTestResult tTest(FittedModel model, String term, double hypothesized) {
        int j = requireEstimable(model, term);
        double estimate = model.getCoefficient(j);
        double se = model.getStandardError(j);
        double t = (estimate - hypothesized) / se;
        int df = model.getResidualDf();
        return new TTestResult(term, estimate, hypothesized, se, t, df, twoSidedP(t, df));
    }

    static double twoSidedP(double t, int df) {
        if (df <= 0 || Double.isNaN(t)) return Double.NaN;
        return 2.0 * new TDistribution(df).cumulativeProbability(-Math.abs(t));
    }

    /** β̂ ± t₁₋α/₂,df · se, as {lower, upper}. */
    public double[] confidenceInterval(FittedModel model, String term, double alpha) {
        requireAlpha(alpha);
        int j = requireEstimable(model, term);
        double half = criticalT(model.getResidualDf(), alpha) * model.getStandardError(j);
        return new double[] {model.getCoefficient(j) - half, model.getCoefficient(j) + half};
    }

    private static double criticalT(int df, double alpha) {
        if (df <= 0) return Double.NaN;
        return new TDistribution(df).inverseCumulativeProbability(1 - alpha / 2);
    }

    private static void requireAlpha(double alpha) {
        if (!(alpha > 0 && alpha < 1)) {
            throw new IllegalArgumentException("alpha must be in (0, 1): " + alpha);
        }
    }

    /** One row per term; aliased terms get a row of NaN. */
    public List<CoefficientRow> coefficientTable(FittedModel model, double alpha) {
        requireAlpha(alpha);
        int df = model.getResidualDf();
        double tCrit = criticalT(df, alpha);
        List<CoefficientRow> rows = new ArrayList<>(model.getTerms().size());
        for (int j = 0; j < model.getTerms().size(); j++) {
            String term = model.getTerms().get(j);
            if (!model.isEstimable(j)) {
                rows.add(new CoefficientRow(term, Double.NaN, Double.NaN, Double.NaN, Double.NaN, Double.NaN, Double.NaN));
                continue;
            }
            double estimate = model.getCoefficient(j);
            double se = model.getStandardError(j);
            double t = estimate / se;
            rows.add(new CoefficientRow(term, estimate, se, t, twoSidedP(t, df),
                estimate - tCrit * se, estimate + tCrit * se));
        }
        return rows;
    }

    /** Joint (1 − α) region for two coefficients. */
    public ConfidenceEllipse confidenceEllipse(FittedModel model, String termA, String termB, double alpha) {
        requireAlpha(alpha);
        int a = requireEstimable(model, termA);
        int b = requireEstimable(model, termB);
        if (a == b) {
            throw new IllegalArgumentException("A joint region needs two different terms, got '" + termA + "' twice");
        }
        int df = model.getResidualDf();
        if (df <= 0) {
            throw new DimensionException("No residual degrees of freedom for a confidence region");
        }
        double[][] v = {
            {model.getUnscaledCovariance(a, a), model.getUnscaledCovariance(a, b)},
            {model.getUnscaledCovariance(b, a), model.getUnscaledCovariance(b, b)}
        };
        double f = new FDistribution(2, df).inverseCumulativeProbability(1 - alpha);
        return new ConfidenceEllipse(termA, termB, model.getCoefficient(a), model.getCoefficient(b),
            v, 2 * model.getSigma2() * f, 1 - alpha);
    }

    /** Condition number and VIF of every estimable predictor. */
    public CollinearityDiagnostics collinearity(FittedModel model) {
        DesignMatrix retained = model.getDesign().select(model.getEstimableTerms());
        Map<String, Double> vif = new LinkedHashMap<>();
        for (String term : retained.predictorNames()) {
            if (retained.columns() == 1) {
                vif.put(term, 1.0);
                continue;
            }
            DesignMatrix others = retained.without(term).withResponse(retained.column(retained.columnIndex(term)));
            FittedModel aux = solver.fit(others);
            double r2 = aux.getRSquared();
            vif.put(term, 1.0 / (1.0 - r2));
        }
        return new CollinearityDiagnostics(model.getConditionNumber(), vif);
    }

    public InfluenceDiagnostics influence(FittedModel model) {
        double[] h = model.getLeverage();
        double[] e = model.getResiduals();
        double sigma = model.getSigma();
        int rank = model.getRank();
        double[] standardized = new double[h.length];
        double[] cooks = new double[h.length];
        for (int i = 0; i < h.length; i++) {
            double oneMinusH = 1 - h[i];
            if (oneMinusH <= 0) {
                standardized[i] = Double.NaN;
                cooks[i] = Double.NaN;
                continue;
            }
            standardized[i] = e[i] / (sigma * Math.sqrt(oneMinusH));
            cooks[i] = standardized[i] * standardized[i] * h[i] / (rank * oneMinusH);
        }
        return new InfluenceDiagnostics(h, standardized, cooks);
    }
}
