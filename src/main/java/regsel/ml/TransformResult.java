package regsel.ml;

import java.util.Collections;
import java.util.List;

/**
 * Profile-likelihood search result: every grid point scored, the maximizer (with its refit),
 * and the likelihood interval {θ : ℓ(θ) ≥ max ℓ − ½χ²₁(level)} over the grid.
 */
public final class TransformResult {

    public enum Kind {
        BOX_COX,
        LOG_SHIFT
    }

    private final Kind kind;
    private final List<TransformCandidate> profile;
    private final TransformCandidate best;
    private final double lower;
    private final double upper;
    private final double level;

    TransformResult(Kind kind, List<TransformCandidate> profile, TransformCandidate best,
                    double lower, double upper, double level) {
        this.kind = kind;
        this.profile = Collections.unmodifiableList(profile);
        this.best = best;
        this.lower = lower;
        this.upper = upper;
        this.level = level;
    }

    public Kind getKind() {
        return kind;
    }

    /** Scored grid points in grid order (points skipped as invalid are absent). */
    public List<TransformCandidate> getProfile() {
        return profile;
    }

    public TransformCandidate getBest() {
        return best;
    }

    /** {lower, upper} of the likelihood interval. */
    public double[] getInterval() {
        return new double[] {lower, upper};
    }

    public double getLevel() {
        return level;
    }

    /** True when the interval reaches an end of the grid, so the true interval may be wider. */
    public boolean intervalTouchesGridEdge() {
        return lower == profile.get(0).getParameter()
            || upper == profile.get(profile.size() - 1).getParameter();
    }

    public boolean contains(double parameter) {
        return parameter >= lower && parameter <= upper;
    }

    @Override
    public String toString() {
        return kind + " best=" + best.getParameter() + " interval=[" + lower + ", " + upper + "] (" + level + ")";
    }
}
