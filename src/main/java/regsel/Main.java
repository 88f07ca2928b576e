package regsel;

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

import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Command-line analysis: fit, inference, best subsets, resampling and Box-Cox on one table.
 * <p>
 * Usage: {@code Main [file.csv [response [predictor ...]]]}. Without arguments the built-in
 * synthetic table is used with y as response.
 */
public class Main {

    public static void main(String[] args) throws Exception {
        AnalysisConfig config = AnalysisConfig.fromEnvironment();
        DataTable table = args.length > 0 && !args[0].isBlank()
            ? DataTable.fromCsv(Paths.get(args[0].trim()))
            : SampleData.table();
        String response = args.length > 1 ? args[1] : table.columnNames().get(0);
        List<String> predictors = new ArrayList<>(args.length > 2
            ? Arrays.asList(args).subList(2, args.length)
            : table.columnNames());
        predictors.remove(response);

        DesignMatrix design = table.toDesignMatrix(response, predictors, true);
        System.out.println(run(design, config));
    }

    /** The full report for one design, as text. */
    static String run(DesignMatrix design, AnalysisConfig config) {
        StringBuilder out = new StringBuilder();
        LeastSquaresSolver solver = new LeastSquaresSolver(LeastSquaresSolver.RankPolicy.DROP_ALIASED,
            config.getRankTolerance());
        InferenceEngine inference = new InferenceEngine(solver);
        double alpha = config.getAlpha();

        // --- OLS fit and coefficient table
        FittedModel model = solver.fit(design);
        out.append("=== Least squares fit (n = ").append(model.getObservations()).append(") ===\n");
        out.append(ResultTables.render(ResultTables.coefficients(inference.coefficientTable(model, alpha))));
        if (!model.getAliasedTerms().isEmpty()) {
            out.append("Not estimable (aliased): ").append(model.getAliasedTerms()).append('\n');
        }
        out.append("R² = ").append(model.getRSquared())
            .append(", adjusted R² = ").append(model.getAdjustedRSquared())
            .append(", σ̂ = ").append(model.getSigma())
            .append(" on ").append(model.getResidualDf()).append(" df\n");
        if (model.getRank() > (model.hasIntercept() ? 1 : 0)) {
            FTestResult overall = inference.overallFTest(model);
            out.append("Overall ").append(overall).append('\n');
        }
        CollinearityDiagnostics collinearity = inference.collinearity(model);
        out.append("Condition number = ").append(collinearity.getConditionNumber())
            .append(", VIF = ").append(collinearity.getVarianceInflation()).append("\n\n");

        // --- best subsets
        DesignMatrix retained = design.select(model.getEstimableTerms());
        SubsetSelector selector = new SubsetSelector(new LeastSquaresSolver(LeastSquaresSolver.RankPolicy.REFUSE,
            config.getRankTolerance()), 1, List.of(), config.getThreads());
        SubsetSearchResult subsets = selector.search(retained, config.getMaxSize());
        out.append("=== Best subsets (sizes 1..").append(Math.min(config.getMaxSize(), retained.predictorNames().size()))
            .append(") ===\n");
        out.append(ResultTables.render(ResultTables.subsets(subsets.getBestPerSize())));
        for (Criterion c : Criterion.values()) {
            out.append("Best by ").append(c).append(": ").append(subsets.best(c).getNames()).append('\n');
        }
        out.append('\n');

        // --- resampling on the first predictor
        if (!retained.predictorNames().isEmpty()) {
            String term = retained.predictorNames().get(0);
            FittedModel retainedFit = solver.fit(retained);
            ResamplingEngine engine = new ResamplingEngine(solver, config.getSeed(), config.getThreads());
            EmpiricalDistribution boot = engine.bootstrap(retainedFit, StatisticFunction.coefficient(term),
                config.getReplicates());
            double[] ci = boot.percentileInterval(alpha);
            out.append("=== Residual bootstrap of ").append(term).append(" (B = ").append(boot.getCompleted()).append(") ===\n");
            out.append(ResultTables.render(ResultTables.quantiles(boot)));
            out.append("Percentile interval: [").append(ci[0]).append(", ").append(ci[1])
                .append("], bootstrap se = ").append(boot.getStandardError()).append('\n');
            PermutationTestResult perm = engine.permute(retained, PermutationTarget.column(term),
                StatisticFunction.tStatistic(term), config.getReplicates());
            out.append(perm).append("\n\n");
        }

        // --- response transformation
        TransformSearch transforms = new TransformSearch(solver, 0.95);
        double min = Arrays.stream(design.response()).min().orElse(0);
        TransformResult result = min > 0
            ? transforms.boxcox(design, TransformSearch.grid(-2, 2, 0.05))
            : transforms.logshift(design, TransformSearch.grid(Math.max(0, -min) + 0.05, Math.max(0, -min) + 10, 0.05));
        out.append("=== Response transformation ===\n").append(result).append('\n');
        return out.toString();
    }
}
