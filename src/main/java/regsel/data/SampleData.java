package regsel.data;

import org.apache.commons.rng.UniformRandomProvider;
import org.apache.commons.rng.sampling.distribution.ZigguratSampler;
import org.apache.commons.rng.simple.RandomSource;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Deterministic synthetic data for demos and smoke checks.
 * <p>
 * Columns: a strictly positive response {@code y} with multiplicative errors (so a log-like
 * transform is favored), two informative predictors {@code x1, x2}, a pure-noise predictor
 * {@code x3} and {@code x4}, which is nearly collinear with {@code x1}.
 */
public final class SampleData {

    public static final long DEFAULT_SEED = 20240601L;

    private SampleData() {
    }

    public static DataTable table() {
        return table(60, DEFAULT_SEED);
    }

    public static DataTable table(int n, long seed) {
        UniformRandomProvider rng = RandomSource.XO_SHI_RO_256_PP.create(seed);
        ZigguratSampler.NormalizedGaussian gauss = ZigguratSampler.NormalizedGaussian.of(rng);
        double[] y = new double[n];
        double[] x1 = new double[n];
        double[] x2 = new double[n];
        double[] x3 = new double[n];
        double[] x4 = new double[n];
        for (int i = 0; i < n; i++) {
            x1[i] = 10 + 2 * gauss.sample();
            x2[i] = gauss.sample();
            x3[i] = gauss.sample();
            x4[i] = x1[i] + 0.05 * gauss.sample();
            y[i] = Math.exp(0.5 + 0.15 * x1[i] + 0.3 * x2[i] + 0.2 * gauss.sample());
        }
        Map<String, double[]> columns = new LinkedHashMap<>();
        columns.put("y", y);
        columns.put("x1", x1);
        columns.put("x2", x2);
        columns.put("x3", x3);
        columns.put("x4", x4);
        return DataTable.of(columns);
    }
}
