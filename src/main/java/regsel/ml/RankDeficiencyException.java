package regsel.ml;

import java.util.List;

/**
 * The design matrix does not have full column rank.
 * <p>
 * Detected by the rank-revealing QR in {@link LeastSquaresSolver}; {@link #getAliasedColumns()}
 * lists the columns that are linear combinations of columns appearing before them.
 */
public class RankDeficiencyException extends RegressionException {

    private final List<String> aliasedColumns;
    private final int rank;

    public RankDeficiencyException(List<String> aliasedColumns, int rank) {
        super("Design matrix is rank deficient (rank " + rank + "); aliased columns: " + aliasedColumns);
        this.aliasedColumns = List.copyOf(aliasedColumns);
        this.rank = rank;
    }

    public RankDeficiencyException(String message, List<String> aliasedColumns, int rank) {
        super(message);
        this.aliasedColumns = List.copyOf(aliasedColumns);
        this.rank = rank;
    }

    public List<String> getAliasedColumns() {
        return aliasedColumns;
    }

    public int getRank() {
        return rank;
    }
}
