package regsel.ml;

/**
 * Base type of every failure raised by the regression core.
 * <p>
 * Extends {@link IllegalArgumentException}: all of these describe input (a matrix, a model pair,
 * a term name, a response) that the requested computation cannot accept.
 */
public class RegressionException extends IllegalArgumentException {

    public RegressionException(String message) {
        super(message);
    }

    public RegressionException(String message, Throwable cause) {
        super(message, cause);
    }
}
