package regsel.ml;

/** A term (column name) was requested that the matrix or model does not contain. */
public class UnknownTermException extends RegressionException {

    private final String term;

    public UnknownTermException(String term) {
        super("Unknown term: '" + term + "'");
        this.term = term;
    }

    public String getTerm() {
        return term;
    }
}
