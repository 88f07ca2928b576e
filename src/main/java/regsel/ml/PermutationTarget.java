package regsel.ml;

import java.util.Objects;

/** What a permutation test shuffles: the whole response, or one predictor column. */
public final class PermutationTarget {

    private static final PermutationTarget RESPONSE = new PermutationTarget(null);

    private final String column;

    private PermutationTarget(String column) {
        this.column = column;
    }

    /** Shuffle y: tests the global null of no relationship. */
    public static PermutationTarget response() {
        return RESPONSE;
    }

    /** Shuffle one predictor, holding the others at their observed values. */
    public static PermutationTarget column(String name) {
        return new PermutationTarget(Objects.requireNonNull(name, "name"));
    }

    public boolean isResponse() {
        return column == null;
    }

    public String getColumn() {
        return column;
    }

    @Override
    public String toString() {
        return isResponse() ? "response" : column;
    }
}
