package regsel.ml;

import org.apache.commons.math3.linear.MatrixUtils;
import org.apache.commons.math3.linear.SingularValueDecomposition;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Ordinary least squares via Householder QR.
 * <p>
 * Model: y = Xβ + ε. With X = QR (Q orthonormal n×r, R upper-triangular r×r) the estimate solves
 * Rβ̂ = Qᵗy by back-substitution, so XᵗX is never formed and the condition number is not squared.
 * <p>
 * Columns are reduced in their design order. A column whose norm, after removing its projection
 * onto the columns already retained, falls below {@code tolerance} times its original norm is
 * aliased: it is a combination of earlier columns, so later columns are always the ones dropped.
 * What happens next depends on the {@link RankPolicy} of the solver:
 * <ul>
 *   <li>{@link RankPolicy#REFUSE} (default) throws {@link RankDeficiencyException};</li>
 *   <li>{@link RankPolicy#DROP_ALIASED} fits the retained columns and reports the aliased
 *       coefficients as NaN.</li>
 * </ul>
 * Instances are stateless and safe to share between threads.
 */
public class LeastSquaresSolver {

    private static final Logger logger = LogManager.getLogger(LeastSquaresSolver.class);

    public static final double DEFAULT_TOLERANCE = 1e-7;

    public enum RankPolicy {
        REFUSE,
        DROP_ALIASED
    }

    private final RankPolicy policy;
    private final double tolerance;

    public LeastSquaresSolver() {
        this(RankPolicy.REFUSE, DEFAULT_TOLERANCE);
    }

    public LeastSquaresSolver(RankPolicy policy, double tolerance) {
        if (!(tolerance > 0 && tolerance < 1)) {
            throw new IllegalArgumentException("tolerance must be in (0, 1): " + tolerance);
        }
        this.policy = policy;
        this.tolerance = tolerance;
    }

    public double getTolerance() {
        return tolerance;
    }

    /**
     * Fit raw arrays (rows = observations, no intercept added).
     *
     * @throws DimensionException       if n &lt; p or the shapes do not match
     * @throws RankDeficiencyException  if X is rank deficient and the policy is REFUSE
     */
    public FittedModel fit(double[][] x, double[] y) {
        if (x == null || y == null) {
            throw new DimensionException("X and y must be non-null");
        }
        if (x.length != y.length) {
            throw new DimensionException("X has " + x.length + " rows but y has " + y.length + " values");
        }
        int p = x.length == 0 ? 0 : x[0].length;
        List<String> names = new ArrayList<>(p);
        for (int j = 0; j < p; j++) names.add("x" + (j + 1));
        return fit(DesignMatrix.of(x, y, names, false));
    }

    public FittedModel fit(DesignMatrix design) {
        double[][] rows = design.rawRows();
        double[] y = design.rawResponse();
        int n = design.rows();
        int p = design.columns();

        // column-major working copy, overwritten by the reflections
        double[][] a = new double[p][n];
        double[] originalNorm = new double[p];
        for (int j = 0; j < p; j++) {
            double ss = 0;
            for (int i = 0; i < n; i++) {
                a[j][i] = rows[i][j];
                ss += rows[i][j] * rows[i][j];
            }
            originalNorm[j] = Math.sqrt(ss);
        }
        double[] qty = y.clone();

        double[][] reflectors = new double[p][];
        int[] retained = new int[p];
        List<String> aliased = new ArrayList<>();
        int rank = 0;
        for (int j = 0; j < p; j++) {
            double norm = rank < n ? norm(a[j], rank) : 0;
            if (originalNorm[j] == 0 || norm <= tolerance * originalNorm[j]) {
                aliased.add(design.columnName(j));
                continue;
            }
            double[] v = householder(a[j], rank, norm);
            for (int jj = j + 1; jj < p; jj++) reflect(v, a[jj], rank);
            reflect(v, qty, rank);
            reflectors[rank] = v;
            retained[rank] = j;
            rank++;
        }

        if (!aliased.isEmpty()) {
            if (policy == RankPolicy.REFUSE) {
                throw new RankDeficiencyException(aliased, rank);
            }
            logger.debug("Dropping aliased columns {} (rank {} of {})", aliased, rank, p);
        }

        int[] kept = new int[rank];
        System.arraycopy(retained, 0, kept, 0, rank);
        double[][] r = new double[rank][rank];
        for (int k = 0; k < rank; k++) {
            double[] col = a[kept[k]];
            for (int i = 0; i <= k; i++) r[i][k] = col[i];
        }
        double[][] rInverse = invertUpper(r);

        double[] beta = new double[p];
        Arrays.fill(beta, Double.NaN);
        double[] b = backSubstitute(r, qty);
        for (int k = 0; k < rank; k++) beta[kept[k]] = b[k];

        // RSS = ‖y‖² − ‖f‖², taken as the squared tail of Qᵗy
        double rss = 0;
        for (int i = rank; i < n; i++) rss += qty[i] * qty[i];

        double[] fitted = new double[n];
        double[] residuals = new double[n];
        for (int i = 0; i < n; i++) {
            double yHat = 0;
            for (int k = 0; k < rank; k++) yHat += rows[i][kept[k]] * b[k];
            fitted[i] = yHat;
            residuals[i] = y[i] - yHat;
        }

        double[] leverage = leverage(reflectors, rank, n);
        double condition = conditionNumber(r);
        if (condition > 1e10) {
            logger.warn("Design {} is nearly singular (condition number {})", design.columnNames(), condition);
        }
        return new FittedModel(design, beta, kept, r, rInverse, fitted, residuals, leverage, rss, condition);
    }

    private static double norm(double[] v, int from) {
        double scale = 0;
        for (int i = from; i < v.length; i++) scale = Math.max(scale, Math.abs(v[i]));
        if (scale == 0) return 0;
        double ss = 0;
        for (int i = from; i < v.length; i++) {
            double s = v[i] / scale;
            ss += s * s;
        }
        return scale * Math.sqrt(ss);
    }

    /**
     * Build the reflector that maps col[k..] onto α·e₁ and apply it to col in place.
     * Returns v (zero above k) scaled so that H = I − v·vᵗ.
     */
    private static double[] householder(double[] col, int k, double norm) {
        int n = col.length;
        double alpha = col[k] > 0 ? -norm : norm;
        double[] v = new double[n];
        for (int i = k; i < n; i++) v[i] = col[i];
        v[k] -= alpha;
        double vv = 0;
        for (int i = k; i < n; i++) vv += v[i] * v[i];
        double scale = Math.sqrt(2.0 / vv);
        for (int i = k; i < n; i++) v[i] *= scale;
        col[k] = alpha;
        for (int i = k + 1; i < n; i++) col[i] = 0;
        return v;
    }

    private static void reflect(double[] v, double[] z, int k) {
        double dot = 0;
        for (int i = k; i < z.length; i++) dot += v[i] * z[i];
        if (dot == 0) return;
        for (int i = k; i < z.length; i++) z[i] -= dot * v[i];
    }

    private static double[] backSubstitute(double[][] r, double[] f) {
        int rank = r.length;
        double[] b = new double[rank];
        for (int i = rank - 1; i >= 0; i--) {
            double s = f[i];
            for (int k = i + 1; k < rank; k++) s -= r[i][k] * b[k];
            b[i] = s / r[i][i];
        }
        return b;
    }

    static double[][] invertUpper(double[][] r) {
        int m = r.length;
        double[][] inv = new double[m][m];
        for (int c = 0; c < m; c++) {
            inv[c][c] = 1.0 / r[c][c];
            for (int i = c - 1; i >= 0; i--) {
                double s = 0;
                for (int k = i + 1; k <= c; k++) s += r[i][k] * inv[k][c];
                inv[i][c] = -s / r[i][i];
            }
        }
        return inv;
    }

    /** hᵢ = Σₖ Q[i][k]², with Q = H₀H₁…H_{r−1} applied to the first r unit vectors. */
    private static double[] leverage(double[][] reflectors, int rank, int n) {
        double[] h = new double[n];
        double[] e = new double[n];
        for (int c = 0; c < rank; c++) {
            Arrays.fill(e, 0);
            e[c] = 1;
            for (int k = rank - 1; k >= 0; k--) reflect(reflectors[k], e, k);
            for (int i = 0; i < n; i++) h[i] += e[i] * e[i];
        }
        return h;
    }

    private static double conditionNumber(double[][] r) {
        if (r.length == 0) return Double.NaN;
        return new SingularValueDecomposition(MatrixUtils.createRealMatrix(r)).getConditionNumber();
    }
}
