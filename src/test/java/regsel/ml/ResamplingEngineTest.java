package regsel.ml;

import org.junit.jupiter.api.Test;

import java.util.Random;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

public class ResamplingEngineTest {

    private final LeastSquaresSolver solver = new LeastSquaresSolver();

    private DesignMatrix design(long seed, int n, double... beta) {
        return Synthetic.design(new Random(seed), n, 1, beta, 1);
    }

    @Test
    void sameSeedGivesTheSameReplicatesRegardlessOfThreads() {
        FittedModel model = solver.fit(design(107, 50, 0.5, -0.2));
        StatisticFunction stat = StatisticFunction.coefficient("x1");

        EmpiricalDistribution serial = new ResamplingEngine(solver, 42, 1).bootstrap(model, stat, 300);
        EmpiricalDistribution parallel = new ResamplingEngine(solver, 42, 6).bootstrap(model, stat, 300);
        EmpiricalDistribution other = new ResamplingEngine(solver, 43, 6).bootstrap(model, stat, 300);

        assertThat(parallel.getValues()).containsExactly(serial.getValues());
        assertThat(other.getValues()).isNotEqualTo(serial.getValues());
        assertThat(serial.getCompleted()).isEqualTo(300);
        assertThat(serial.getObserved()).isEqualTo(model.getCoefficient("x1"));
    }

    @Test
    void replicateGeneratorsAreIndependentOfEachOther() {
        ResamplingEngine engine = new ResamplingEngine(5);
        long first = engine.replicateRng(0).nextLong();
        assertThat(engine.replicateRng(0).nextLong()).isEqualTo(first);
        assertThat(engine.replicateRng(1).nextLong()).isNotEqualTo(first);
    }

    @Test
    void residualBootstrapStandardErrorTracksNormalTheory() {
        FittedModel model = solver.fit(design(109, 100, 1.0, 0.5));
        EmpiricalDistribution d = new ResamplingEngine(solver, 7, 4)
            .bootstrap(model, StatisticFunction.coefficient("x1"), 1000);
        double se = model.getStandardError("x1");
        assertThat(d.getStandardError()).isCloseTo(se, within(0.15 * se));
        assertThat(Math.abs(d.getBias())).isLessThan(0.25 * se);
    }

    @Test
    void percentileIntervalsCoverTheTrueSlope() {
        Random random = new Random(113);
        int covered = 0;
        int trials = 100;
        for (int t = 0; t < trials; t++) {
            DesignMatrix d = Synthetic.design(random, 40, 1, new double[] {2.0}, 1);
            FittedModel model = solver.fit(d);
            double[] ci = new ResamplingEngine(solver, t, 2)
                .bootstrap(model, StatisticFunction.coefficient("x1"), 200)
                .percentileInterval(0.05);
            if (ci[0] <= 2.0 && 2.0 <= ci[1]) covered++;
        }
        assertThat(covered / (double) trials).isBetween(0.85, 1.0);
    }

    @Test
    void permutationPValueDoesNotDependOnRowOrder() {
        DesignMatrix d = design(127, 40, 0.3, 0.1);
        int[] reversed = new int[d.rows()];
        for (int i = 0; i < reversed.length; i++) reversed[i] = reversed.length - 1 - i;
        DesignMatrix shuffled = d.selectRows(reversed);

        ResamplingEngine engine = new ResamplingEngine(solver, 99, 3);
        PermutationTestResult a = engine.permute(d, PermutationTarget.response(), StatisticFunction.overallF(), 400);
        PermutationTestResult b = engine.permute(shuffled, PermutationTarget.response(), StatisticFunction.overallF(), 400);

        assertThat(b.getObserved()).isCloseTo(a.getObserved(), within(1e-9));
        assertThat(b.getPValue()).isEqualTo(a.getPValue());
        double[] va = a.getDistribution().getValues();
        double[] vb = b.getDistribution().getValues();
        for (int i = 0; i < va.length; i++) {
            assertThat(vb[i]).isCloseTo(va[i], within(1e-9 * Math.max(1, Math.abs(va[i]))));
        }
    }

    @Test
    void responsePermutationAgreesWithTheOverallFTest() {
        DesignMatrix d = design(131, 50, 0.25, 0.1);
        FittedModel model = solver.fit(d);
        double fP = new InferenceEngine(solver).overallFTest(model).getPValue();
        PermutationTestResult result = new ResamplingEngine(solver, 1, 4)
            .permute(d, PermutationTarget.response(), StatisticFunction.overallF(), 2000);
        assertThat(result.getPValue()).isCloseTo(fP, within(0.05));
        assertThat(result.getObserved()).isCloseTo(new InferenceEngine(solver).overallFTest(model).getFStatistic(), within(1e-9));
    }

    @Test
    void columnPermutationAgreesWithTheTTest() {
        DesignMatrix d = design(137, 60, 0.2, 0.8);
        FittedModel model = solver.fit(d);
        double tP = new InferenceEngine(solver).tTest(model, "x1").getPValue();
        PermutationTestResult result = new ResamplingEngine(solver, 2, 4)
            .permute(d, PermutationTarget.column("x1"), StatisticFunction.absTStatistic("x1"), 2000);
        assertThat(result.getPValue()).isCloseTo(tP, within(0.06));
        assertThat(result.getTarget().getColumn()).isEqualTo("x1");
    }

    @Test
    void stopsEarlyWhenAsked() {
        FittedModel model = solver.fit(design(139, 30, 1.0));
        AtomicInteger calls = new AtomicInteger();
        EmpiricalDistribution d = new ResamplingEngine(solver, 3, 1)
            .bootstrap(model, StatisticFunction.coefficient("x1"), 500, () -> calls.getAndIncrement() >= 10);
        assertThat(d.getCompleted()).isEqualTo(10);
        assertThat(d.getRequested()).isEqualTo(500);
        assertThat(d.getSkipped()).isEqualTo(490);
    }

    @Test
    void rankDeficientCaseResamplesAreCountedAsFailed() {
        Random random = new Random(149);
        int n = 20;
        double[] x = Synthetic.normals(random, n);
        double[] flag = new double[n];
        flag[7] = 1;
        double[] y = new double[n];
        for (int i = 0; i < n; i++) y[i] = x[i] + flag[i] + random.nextGaussian();
        DesignMatrix d = DesignMatrix.builder().response(y).column("x", x).column("flag", flag).build();

        EmpiricalDistribution dist = new ResamplingEngine(solver, 11, 2)
            .bootstrapCases(d, StatisticFunction.coefficient("x"), 60);
        assertThat(dist.getFailed()).isGreaterThan(0);
        assertThat(dist.getCompleted() + dist.getFailed()).isEqualTo(60);
        assertThat(dist.getSkipped()).isZero();
    }

    @Test
    void caseBootstrapIsReproducible() {
        DesignMatrix d = design(151, 35, 1.0, -1.0);
        StatisticFunction stat = StatisticFunction.rSquared();
        double[] a = new ResamplingEngine(solver, 8, 1).bootstrapCases(d, stat, 150).getValues();
        double[] b = new ResamplingEngine(solver, 8, 5).bootstrapCases(d, stat, 150).getValues();
        assertThat(b).containsExactly(a);
    }

    @Test
    void interceptAndUnknownColumnsCannotBePermuted() {
        DesignMatrix d = design(157, 20, 1.0);
        ResamplingEngine engine = new ResamplingEngine(1);
        StatisticFunction stat = StatisticFunction.overallF();
        assertThatThrownBy(() -> engine.permute(d, PermutationTarget.column(DesignMatrix.INTERCEPT), stat, 10))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> engine.permute(d, PermutationTarget.column("nope"), stat, 10))
            .isInstanceOf(UnknownTermException.class);
        assertThatThrownBy(() -> engine.bootstrapCases(d, stat, 0))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void empiricalQuantilesInterpolate() {
        EmpiricalDistribution d = new EmpiricalDistribution(2.5, new double[] {4, 1, 3, 2}, 5, 1);
        assertThat(d.getValues()).containsExactly(1, 2, 3, 4);
        assertThat(d.quantile(0)).isEqualTo(1);
        assertThat(d.quantile(1)).isEqualTo(4);
        assertThat(d.quantile(0.5)).isCloseTo(2.5, within(1e-12));
        assertThat(d.quantile(0.25)).isCloseTo(1.75, within(1e-12));
        assertThat(d.getMean()).isCloseTo(2.5, within(1e-12));
        assertThat(d.getBias()).isCloseTo(0, within(1e-12));
        assertThat(d.getUpperTailFraction()).isCloseTo(0.5, within(1e-12));
        assertThat(d.getSkipped()).isZero();
    }

    @Test
    void upperTailCountsReplicatesThatTieTheObservedValueUpToRounding() {
        EmpiricalDistribution d = new EmpiricalDistribution(0.1 + 0.2, new double[] {0.3, -0.3, 0.3, 0.1}, 4, 0);
        assertThat(0.1 + 0.2).isGreaterThan(0.3);
        assertThat(d.getUpperTailFraction()).isCloseTo(0.75, within(1e-12));
    }

    @Test
    void statisticsResolveByName() {
        FittedModel model = solver.fit(design(163, 25, 1.0, 2.0));
        assertThat(StatisticFunction.named("coef", "x2").apply(model)).isEqualTo(model.getCoefficient("x2"));
        assertThat(StatisticFunction.named("F", null).apply(model))
            .isCloseTo(new InferenceEngine(solver).overallFTest(model).getFStatistic(), within(1e-9));
        assertThat(StatisticFunction.named("abs-t", "x1").apply(model)).isGreaterThanOrEqualTo(0);
        assertThatThrownBy(() -> StatisticFunction.named("t", " ")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> StatisticFunction.named("median", "x1")).isInstanceOf(IllegalArgumentException.class);
        assertThat(StatisticFunction.named("r2", null).apply(model)).isEqualTo(model.getRSquared());
    }
}
