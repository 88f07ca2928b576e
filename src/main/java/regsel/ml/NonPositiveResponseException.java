package regsel.ml;

/** Box-Cox needs a strictly positive response; use the shifted-log search otherwise. */
public class NonPositiveResponseException extends RegressionException {

    public NonPositiveResponseException(int row, double value) {
        super("Box-Cox requires y > 0, but y[" + row + "] = " + value + "; use the shifted-log transform instead");
    }
}
