package regsel;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import regsel.data.DataTable;
import regsel.data.SampleData;
import regsel.ml.CollinearityDiagnostics;
import regsel.ml.Criterion;
import regsel.ml.DesignMatrix;
import regsel.ml.EmpiricalDistribution;
import regsel.ml.FTestResult;
import regsel.ml.FittedModel;
import regsel.ml.InferenceEngine;
import regsel.ml.LeastSquaresSolver;
import regsel.ml.PermutationTarget;
import regsel.ml.PermutationTestResult;
import regsel.ml.ResamplingEngine;
import regsel.ml.StatisticFunction;
import regsel.ml.SubsetSearchResult;
import regsel.ml.SubsetSelector;
import regsel.ml.TransformResult;
import regsel.ml.TransformSearch;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Runs one analysis per request. Requests and responses are plain maps (decoded from and encoded
 * to JSON by {@link WebApp}).
 * <p>
 * Every request names its data the same way: either {@code "sample": true} for the built-in
 * synthetic table or {@code "data": {"column": [numbers or null], ...}}, plus
 * {@code "response"}, {@code "predictors"} (default: every other column) and
 * {@code "intercept"} (default true). Rows with a missing value in a used column are dropped.
 */
public class AnalysisService {

    private static final Logger logger = LogManager.getLogger(AnalysisService.class);

    private final AnalysisConfig config;

    public AnalysisService(AnalysisConfig config) {
        this.config = config;
    }

    public AnalysisConfig getConfig() {
        return config;
    }

    private LeastSquaresSolver solver(Map<String, Object> req) {
        boolean drop = getBoolean(req, "dropAliased", false);
        return new LeastSquaresSolver(drop ? LeastSquaresSolver.RankPolicy.DROP_ALIASED
            : LeastSquaresSolver.RankPolicy.REFUSE, config.getRankTolerance());
    }

    /** Coefficient table, overall F test, fit summary and collinearity diagnostics. */
    public Map<String, Object> fit(Map<String, Object> req) {
        DesignMatrix design = design(req);
        double alpha = getDouble(req, "alpha", config.getAlpha());
        LeastSquaresSolver solver = solver(req);
        InferenceEngine inference = new InferenceEngine(solver);
        FittedModel model = solver.fit(design);

        Map<String, Object> out = new LinkedHashMap<>();
        out.put("n", model.getObservations());
        out.put("coefficients", ResultTables.coefficients(inference.coefficientTable(model, alpha)));
        out.put("aliased", model.getAliasedTerms());
        out.put("rss", model.getRss());
        out.put("residualDf", model.getResidualDf());
        out.put("sigma", model.getSigma());
        out.put("rSquared", model.getRSquared());
        out.put("adjustedRSquared", model.getAdjustedRSquared());
        out.put("aic", model.getAic());
        out.put("bic", model.getBic());
        if (model.getRank() > (model.hasIntercept() ? 1 : 0) && model.getResidualDf() > 0) {
            FTestResult f = inference.overallFTest(model);
            Map<String, Object> overall = new LinkedHashMap<>();
            overall.put("F", f.getFStatistic());
            overall.put("df1", f.getNumeratorDf());
            overall.put("df2", f.getDenominatorDf());
            overall.put("p", f.getPValue());
            out.put("overallF", overall);
        }
        CollinearityDiagnostics collinearity = inference.collinearity(model);
        out.put("conditionNumber", collinearity.getConditionNumber());
        out.put("vif", collinearity.getVarianceInflation());
        out.put("fitted", model.getFitted());
        out.put("residuals", model.getResiduals());
        return out;
    }

    /** Best subsets per size and their ranking under the requested criterion. */
    public Map<String, Object> subsets(Map<String, Object> req) {
        DesignMatrix design = design(req);
        int maxSize = getInt(req, "maxSize", config.getMaxSize());
        int nbest = getInt(req, "nbest", 1);
        Criterion criterion = Criterion.parse(getString(req, "criterion", "AIC"));
        List<String> forced = getStringList(req, "forced", List.of());

        SubsetSelector selector = new SubsetSelector(solver(req), nbest, forced, config.getThreads());
        SubsetSearchResult result = selector.search(design, maxSize);

        Map<String, Object> out = new LinkedHashMap<>();
        out.put("n", design.rows());
        out.put("criterion", criterion.name());
        out.put("bestPerSize", ResultTables.subsets(result.getBestPerSize()));
        out.put("ranked", ResultTables.subsets(result.ranked(criterion)));
        out.put("best", result.best(criterion).getNames());
        out.put("evaluated", result.getEvaluatedSubsets());
        out.put("pruned", result.getPrunedBranches());
        out.put("invalid", result.getInvalidSubsets());
        return out;
    }

    /** Residual (default) or case bootstrap of one statistic. */
    public Map<String, Object> bootstrap(Map<String, Object> req) {
        DesignMatrix design = design(req);
        StatisticFunction statistic = statistic(req);
        int replicates = getInt(req, "replicates", config.getReplicates());
        double alpha = getDouble(req, "alpha", config.getAlpha());
        ResamplingEngine engine = engine(req);
        String mode = getString(req, "mode", "residual");

        EmpiricalDistribution dist;
        if ("case".equalsIgnoreCase(mode) || "cases".equalsIgnoreCase(mode)) {
            dist = engine.bootstrapCases(design, statistic, replicates);
        } else if ("residual".equalsIgnoreCase(mode)) {
            dist = engine.bootstrap(solver(req).fit(design), statistic, replicates);
        } else {
            throw new IllegalArgumentException("Unknown bootstrap mode: " + mode);
        }
        Map<String, Object> out = distribution(dist);
        out.put("mode", mode);
        double[] ci = dist.percentileInterval(alpha);
        out.put("lower", ci[0]);
        out.put("upper", ci[1]);
        out.put("bias", dist.getBias());
        return out;
    }

    /** Permutation test of the response (global null) or of one predictor column. */
    public Map<String, Object> permute(Map<String, Object> req) {
        DesignMatrix design = design(req);
        String targetName = getString(req, "target", "response");
        PermutationTarget target = "response".equals(targetName)
            ? PermutationTarget.response()
            : PermutationTarget.column(targetName);
        int replicates = getInt(req, "replicates", config.getReplicates());
        PermutationTestResult result = engine(req).permute(design, target, statistic(req), replicates);

        Map<String, Object> out = distribution(result.getDistribution());
        out.put("target", target.toString());
        out.put("p", result.getPValue());
        return out;
    }

    public Map<String, Object> boxcox(Map<String, Object> req) {
        DesignMatrix design = design(req);
        double[] grid = grid(req, -2, 2, 0.05);
        LeastSquaresSolver solver = solver(req);
        return transform(new TransformSearch(solver, getDouble(req, "level", 0.95)).boxcox(design, grid), solver);
    }

    public Map<String, Object> logshift(Map<String, Object> req) {
        DesignMatrix design = design(req);
        double[] grid = grid(req, 0, 10, 0.1);
        LeastSquaresSolver solver = solver(req);
        return transform(new TransformSearch(solver, getDouble(req, "level", 0.95)).logshift(design, grid), solver);
    }

    private Map<String, Object> transform(TransformResult result, LeastSquaresSolver solver) {
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("kind", result.getKind().name());
        out.put("best", result.getBest().getParameter());
        out.put("logLik", result.getBest().getLogLikelihood());
        double[] ci = result.getInterval();
        out.put("lower", ci[0]);
        out.put("upper", ci[1]);
        out.put("level", result.getLevel());
        out.put("intervalTouchesGridEdge", result.intervalTouchesGridEdge());
        out.put("profile", ResultTables.profile(result));
        result.getBest().getModel().ifPresent(m -> {
            out.put("rss", m.getRss());
            out.put("coefficients", ResultTables.coefficients(
                new InferenceEngine(solver).coefficientTable(m, config.getAlpha())));
        });
        return out;
    }

    private static Map<String, Object> distribution(EmpiricalDistribution dist) {
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("observed", dist.getObserved());
        out.put("requested", dist.getRequested());
        out.put("completed", dist.getCompleted());
        out.put("failed", dist.getFailed());
        out.put("mean", dist.getMean());
        out.put("stdError", dist.getStandardError());
        out.put("quantiles", ResultTables.quantiles(dist));
        return out;
    }

    private ResamplingEngine engine(Map<String, Object> req) {
        long seed = getLong(req, "seed", config.getSeed());
        return new ResamplingEngine(solver(req), seed, config.getThreads());
    }

    private static StatisticFunction statistic(Map<String, Object> req) {
        return StatisticFunction.named(getString(req, "statistic", "coef"), getString(req, "term", null));
    }

    private static double[] grid(Map<String, Object> req, double from, double to, double step) {
        Object g = req.get("grid");
        if (g instanceof List<?>) {
            List<?> values = (List<?>) g;
            double[] out = new double[values.size()];
            for (int i = 0; i < out.length; i++) out[i] = toDouble(values.get(i), "grid");
            return out;
        }
        if (g instanceof Map<?, ?>) {
            @SuppressWarnings("unchecked")
            Map<String, Object> range = (Map<String, Object>) g;
            return TransformSearch.grid(getDouble(range, "from", from), getDouble(range, "to", to),
                getDouble(range, "step", step));
        }
        return TransformSearch.grid(from, to, step);
    }

    /** Table from the request, then the design matrix of its complete cases. */
    DesignMatrix design(Map<String, Object> req) {
        DataTable table = table(req);
        String response = getString(req, "response", table.columnNames().get(0));
        List<String> predictors = getStringList(req, "predictors", null);
        if (predictors == null) {
            predictors = new ArrayList<>(table.columnNames());
            predictors.remove(response);
        }
        boolean intercept = getBoolean(req, "intercept", true);
        List<String> used = new ArrayList<>(predictors);
        used.add(response);
        int dropped = table.incompleteRows(used);
        if (dropped > 0) {
            logger.info("Dropping {} of {} rows with missing values", dropped, table.rows());
        }
        return table.toDesignMatrix(response, predictors, intercept);
    }

    private static DataTable table(Map<String, Object> req) {
        if (getBoolean(req, "sample", false)) {
            return SampleData.table();
        }
        Object data = req.get("data");
        if (!(data instanceof Map<?, ?>)) {
            throw new IllegalArgumentException("Missing 'data' object (or \"sample\": true)");
        }
        Map<String, double[]> columns = new LinkedHashMap<>();
        for (Map.Entry<?, ?> e : ((Map<?, ?>) data).entrySet()) {
            if (!(e.getValue() instanceof List<?>)) {
                throw new IllegalArgumentException("Column '" + e.getKey() + "' must be an array");
            }
            List<?> values = (List<?>) e.getValue();
            double[] col = new double[values.size()];
            for (int i = 0; i < col.length; i++) {
                Object v = values.get(i);
                col[i] = v == null ? Double.NaN : toDouble(v, String.valueOf(e.getKey()));
            }
            columns.put(String.valueOf(e.getKey()), col);
        }
        return DataTable.of(columns);
    }

    private static double toDouble(Object v, String field) {
        if (v instanceof Number) return ((Number) v).doubleValue();
        throw new IllegalArgumentException("'" + field + "' must contain only numbers, got: " + v);
    }

    private static int getInt(Map<String, Object> m, String key, int def) {
        Object v = m.get(key);
        return v instanceof Number ? ((Number) v).intValue() : def;
    }

    private static long getLong(Map<String, Object> m, String key, long def) {
        Object v = m.get(key);
        return v instanceof Number ? ((Number) v).longValue() : def;
    }

    private static double getDouble(Map<String, Object> m, String key, double def) {
        Object v = m.get(key);
        return v instanceof Number ? ((Number) v).doubleValue() : def;
    }

    private static boolean getBoolean(Map<String, Object> m, String key, boolean def) {
        Object v = m.get(key);
        return v instanceof Boolean ? (Boolean) v : def;
    }

    private static String getString(Map<String, Object> m, String key, String def) {
        Object v = m.get(key);
        return v instanceof String ? (String) v : def;
    }

    private static List<String> getStringList(Map<String, Object> m, String key, List<String> def) {
        Object v = m.get(key);
        if (!(v instanceof List<?>)) return def;
        List<String> out = new ArrayList<>();
        for (Object o : (List<?>) v) out.add(String.valueOf(o));
        return out;
    }
}
