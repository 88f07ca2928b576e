package regsel.ml;

/** Two models that should share their observations were fit on different samples. */
public class InconsistentSampleException extends RegressionException {

    public InconsistentSampleException(String message) {
        super(message);
    }
}
