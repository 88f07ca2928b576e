package regsel.ml;

/** The reduced model of an F-test is not a proper sub-model of the full model. */
public class NotNestedException extends RegressionException {

    public NotNestedException(String message) {
        super(message);
    }
}
