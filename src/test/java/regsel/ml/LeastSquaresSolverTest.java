package regsel.ml;

import org.apache.commons.math3.linear.LUDecomposition;
import org.apache.commons.math3.linear.MatrixUtils;
import org.apache.commons.math3.linear.RealMatrix;
import org.junit.jupiter.api.Test;

import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

public class LeastSquaresSolverTest {

    private final LeastSquaresSolver solver = new LeastSquaresSolver();

    @Test
    void exactLineIsRecovered() {
        double[][] x = {{0}, {1}, {2}, {3}, {4}};
        double[] y = {1, 3, 5, 7, 9};
        FittedModel m = solver.fit(DesignMatrix.withIntercept(x, y, "x"));
        assertThat(m.getCoefficient(DesignMatrix.INTERCEPT)).isCloseTo(1, within(1e-12));
        assertThat(m.getCoefficient("x")).isCloseTo(2, within(1e-12));
        assertThat(m.getRss()).isCloseTo(0, within(1e-20));
        assertThat(m.getRank()).isEqualTo(2);
        assertThat(m.getResidualDf()).isEqualTo(3);
    }

    @Test
    void simpleRegressionMatchesTextbookFormulas() {
        Random random = new Random(7);
        int n = 30;
        double[][] x = Synthetic.normalRows(random, n, 1);
        double[] y = Synthetic.response(random, x, 2, new double[] {1.5}, 0.7);
        FittedModel m = solver.fit(DesignMatrix.withIntercept(x, y, "x"));

        double mx = 0;
        double my = 0;
        for (int i = 0; i < n; i++) {
            mx += x[i][0];
            my += y[i];
        }
        mx /= n;
        my /= n;
        double sxx = 0;
        double sxy = 0;
        for (int i = 0; i < n; i++) {
            sxx += (x[i][0] - mx) * (x[i][0] - mx);
            sxy += (x[i][0] - mx) * (y[i] - my);
        }
        double slope = sxy / sxx;
        double intercept = my - slope * mx;
        double rss = 0;
        for (int i = 0; i < n; i++) {
            double e = y[i] - intercept - slope * x[i][0];
            rss += e * e;
        }
        double sigma = Math.sqrt(rss / (n - 2));

        assertThat(m.getCoefficient("x")).isCloseTo(slope, within(1e-10));
        assertThat(m.getCoefficient(0)).isCloseTo(intercept, within(1e-10));
        assertThat(m.getRss()).isCloseTo(rss, within(1e-9));
        assertThat(m.getStandardError("x")).isCloseTo(sigma / Math.sqrt(sxx), within(1e-10));
        assertThat(m.getStandardError(0)).isCloseTo(sigma * Math.sqrt(1.0 / n + mx * mx / sxx), within(1e-10));
    }

    @Test
    void agreesWithNormalEquationsOnWellConditionedDesign() {
        DesignMatrix d = Synthetic.design(new Random(11), 80, 0.5, new double[] {1, -2, 0.25, 3}, 1.0);
        double[] qr = solver.fit(d).getCoefficients();
        double[] naive = NormalEquationsSolver.solve(d);
        for (int j = 0; j < qr.length; j++) {
            assertThat(qr[j]).isCloseTo(naive[j], within(1e-9));
        }
        assertThat(NormalEquationsSolver.rSquared(d, naive)).isCloseTo(solver.fit(d).getRSquared(), within(1e-10));
    }

    @Test
    void staysAccurateWhereNormalEquationsBreakDown() {
        Random random = new Random(5);
        int n = 100;
        double[] x1 = new double[n];
        double[] x2 = new double[n];
        double[] y = new double[n];
        for (int i = 0; i < n; i++) {
            x1[i] = random.nextDouble();
            x2[i] = x1[i] + 1e-7 * random.nextGaussian();
            y[i] = 1 + x1[i] + x2[i];
        }
        DesignMatrix d = DesignMatrix.builder().response(y).column("x1", x1).column("x2", x2).build();
        FittedModel m = new LeastSquaresSolver(LeastSquaresSolver.RankPolicy.REFUSE, 1e-10).fit(d);
        assertThat(m.getConditionNumber()).isGreaterThan(1e6);

        double[] truth = {1, 1, 1};
        double qrError = maxError(m.getCoefficients(), truth);
        assertThat(qrError).isLessThan(1e-4);

        double naiveError;
        try {
            naiveError = maxError(NormalEquationsSolver.solve(d), truth);
        } catch (RankDeficiencyException e) {
            // XᵗX is singular to working precision
            return;
        }
        assertThat(naiveError).isGreaterThan(Math.max(100 * qrError, 1e-6));
    }

    private static double maxError(double[] estimate, double[] truth) {
        double max = 0;
        for (int j = 0; j < truth.length; j++) max = Math.max(max, Math.abs(estimate[j] - truth[j]));
        return max;
    }

    @Test
    void refusesRankDeficientDesignNamingTheLaterColumn() {
        Random random = new Random(3);
        double[] a = Synthetic.normals(random, 20);
        double[] b = Synthetic.normals(random, 20);
        double[] sum = new double[20];
        for (int i = 0; i < 20; i++) sum[i] = a[i] + b[i];
        DesignMatrix d = DesignMatrix.builder().response(Synthetic.normals(random, 20))
            .column("a", a).column("b", b).column("sum", sum).build();

        assertThatThrownBy(() -> solver.fit(d))
            .isInstanceOfSatisfying(RankDeficiencyException.class, e -> {
                assertThat(e.getAliasedColumns()).containsExactly("sum");
                assertThat(e.getRank()).isEqualTo(3);
            });
    }

    @Test
    void dropPolicyMarksAliasedCoefficients() {
        Random random = new Random(3);
        double[] a = Synthetic.normals(random, 25);
        double[] twiceA = new double[25];
        for (int i = 0; i < 25; i++) twiceA[i] = 2 * a[i];
        double[] b = Synthetic.normals(random, 25);
        double[] y = Synthetic.normals(random, 25);
        DesignMatrix d = DesignMatrix.builder().response(y)
            .column("a", a).column("twiceA", twiceA).column("b", b).build();

        LeastSquaresSolver dropping = new LeastSquaresSolver(LeastSquaresSolver.RankPolicy.DROP_ALIASED, 1e-7);
        FittedModel m = dropping.fit(d);
        assertThat(m.getRank()).isEqualTo(3);
        assertThat(m.getAliasedTerms()).containsExactly("twiceA");
        assertThat(m.isEstimable(d.columnIndex("twiceA"))).isFalse();
        assertThat(m.getCoefficient("twiceA")).isNaN();
        assertThat(m.getStandardError("twiceA")).isNaN();
        assertThat(m.getResidualDf()).isEqualTo(22);

        FittedModel reduced = solver.fit(d.without("twiceA"));
        assertThat(m.getRss()).isCloseTo(reduced.getRss(), within(1e-10));
        assertThat(m.getCoefficient("b")).isCloseTo(reduced.getCoefficient("b"), within(1e-10));
        assertThat(m.getStandardError("a")).isCloseTo(reduced.getStandardError("a"), within(1e-10));
    }

    @Test
    void rejectsBadShapes() {
        assertThatThrownBy(() -> solver.fit(new double[][] {{1, 2, 3}, {4, 5, 6}}, new double[] {1, 2}))
            .isInstanceOf(DimensionException.class);
        assertThatThrownBy(() -> solver.fit(new double[][] {{1}, {2}, {3}}, new double[] {1, 2}))
            .isInstanceOf(DimensionException.class);
    }

    @Test
    void leverageIsTheHatDiagonal() {
        DesignMatrix d = Synthetic.design(new Random(21), 12, 1, new double[] {1, 2}, 0.5);
        FittedModel m = solver.fit(d);

        double[][] rows = new double[d.rows()][];
        for (int i = 0; i < d.rows(); i++) rows[i] = d.row(i);
        RealMatrix x = MatrixUtils.createRealMatrix(rows);
        RealMatrix hat = x.multiply(new LUDecomposition(x.transpose().multiply(x)).getSolver().getInverse())
            .multiply(x.transpose());
        double[] h = m.getLeverage();
        double total = 0;
        for (int i = 0; i < h.length; i++) {
            assertThat(h[i]).isCloseTo(hat.getEntry(i, i), within(1e-10));
            total += h[i];
        }
        assertThat(total).isCloseTo(m.getRank(), within(1e-10));
    }

    @Test
    void covarianceAndCrossProductComeFromR() {
        DesignMatrix d = Synthetic.design(new Random(8), 40, 0, new double[] {1, 1, 1}, 1);
        FittedModel m = solver.fit(d);
        for (int a = 0; a < d.columns(); a++) {
            for (int b = 0; b < d.columns(); b++) {
                double xtx = 0;
                for (int i = 0; i < d.rows(); i++) xtx += d.get(i, a) * d.get(i, b);
                assertThat(m.getCrossProduct(a, b)).isCloseTo(xtx, within(1e-9 * Math.max(1, Math.abs(xtx))));
            }
        }
        RealMatrix product = m.getUnscaledCovariance().multiply(m.getR().transpose().multiply(m.getR()));
        for (int a = 0; a < d.columns(); a++) {
            for (int b = 0; b < d.columns(); b++) {
                assertThat(product.getEntry(a, b)).isCloseTo(a == b ? 1 : 0, within(1e-10));
            }
        }
        assertThat(Math.sqrt(m.getCovariance().getEntry(2, 2))).isCloseTo(m.getStandardError(2), within(1e-12));
    }

    @Test
    void rescalingAPredictorOnlyRescalesItsCoefficient() {
        DesignMatrix d = Synthetic.design(new Random(13), 50, 1, new double[] {0.5, -1, 2}, 1);
        double factor = 1000;
        int j = d.columnIndex("x2");
        double[] scaled = d.column(j);
        for (int i = 0; i < scaled.length; i++) scaled[i] *= factor;
        FittedModel before = solver.fit(d);
        FittedModel after = solver.fit(d.withColumn(j, scaled));
        InferenceEngine inference = new InferenceEngine();

        assertThat(after.getCoefficient(j)).isCloseTo(before.getCoefficient(j) / factor, within(1e-12));
        assertThat(after.getStandardError(j)).isCloseTo(before.getStandardError(j) / factor, within(1e-12));
        for (int k = 0; k < d.columns(); k++) {
            String term = d.columnName(k);
            assertThat(inference.tTest(after, term).getTStatistic())
                .isCloseTo(inference.tTest(before, term).getTStatistic(), within(1e-8));
            if (k != j) {
                assertThat(after.getCoefficient(k)).isCloseTo(before.getCoefficient(k), within(1e-9));
            }
        }
        assertThat(after.getRss()).isCloseTo(before.getRss(), within(1e-9));
        assertThat(after.getRSquared()).isCloseTo(before.getRSquared(), within(1e-12));
        assertThat(inference.overallFTest(after).getFStatistic())
            .isCloseTo(inference.overallFTest(before).getFStatistic(), within(1e-8));
        double[] r0 = before.getResiduals();
        double[] r1 = after.getResiduals();
        for (int i = 0; i < r0.length; i++) assertThat(r1[i]).isCloseTo(r0[i], within(1e-10));
    }

    @Test
    void predictUsesEstimableCoefficients() {
        FittedModel m = solver.fit(DesignMatrix.withIntercept(new double[][] {{0}, {1}, {2}}, new double[] {1, 2, 3}, "x"));
        assertThat(m.predict(new double[] {1, 10})).isCloseTo(11, within(1e-12));
        assertThatThrownBy(() -> m.predict(new double[] {1}))
            .isInstanceOf(DimensionException.class);
    }
}
