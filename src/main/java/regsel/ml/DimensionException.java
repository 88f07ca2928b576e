package regsel.ml;

/** Shape mismatch between X and y, a ragged matrix, or fewer observations than columns. */
public class DimensionException extends RegressionException {

    public DimensionException(String message) {
        super(message);
    }
}
