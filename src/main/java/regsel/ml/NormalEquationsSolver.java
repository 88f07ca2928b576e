package regsel.ml;

import org.apache.commons.math3.linear.DecompositionSolver;
import org.apache.commons.math3.linear.LUDecomposition;
import org.apache.commons.math3.linear.MatrixUtils;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.RealVector;

import java.util.List;

/**
 * Naive least squares through the normal equations: β = (XᵗX)⁻¹Xᵗy.
 * <p>
 * Forming XᵗX squares the condition number of X, so this is only a comparison routine for
 * checking {@link LeastSquaresSolver} on well-conditioned problems and for showing how it
 * degrades on near-collinear ones. It is not used by any analysis.
 */
public final class NormalEquationsSolver {

    private NormalEquationsSolver() {
    }

    /**
     * @return β̂, one entry per column of the design
     * @throws RankDeficiencyException if XᵗX is numerically singular
     */
    public static double[] solve(DesignMatrix design) {
        RealMatrix x = MatrixUtils.createRealMatrix(design.rawRows());
        RealVector y = MatrixUtils.createRealVector(design.rawResponse());

        RealMatrix xt = x.transpose();
        RealMatrix xtx = xt.multiply(x);
        DecompositionSolver solver = new LUDecomposition(xtx).getSolver();
        if (!solver.isNonSingular()) {
            throw new RankDeficiencyException("XᵗX is singular; cannot compute (XᵗX)⁻¹", List.of(), -1);
        }
        return solver.solve(xt.operate(y)).toArray();
    }

    /** R² = 1 − SS_res / SS_tot for the normal-equations estimate. */
    public static double rSquared(DesignMatrix design, double[] beta) {
        double[] y = design.rawResponse();
        double[][] x = design.rawRows();
        double ssRes = 0;
        for (int i = 0; i < y.length; i++) {
            double fitted = 0;
            for (int j = 0; j < beta.length; j++) fitted += x[i][j] * beta[j];
            ssRes += (y[i] - fitted) * (y[i] - fitted);
        }
        double ssTot = FittedModel.totalSumOfSquares(y, design.hasIntercept());
        return ssTot > 0 ? 1.0 - ssRes / ssTot : 0;
    }
}
