package regsel.ml;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Outcome of a best-subset search: the minimal-RSS subsets retained for each size and the
 * bookkeeping of the search itself.
 */
public final class SubsetSearchResult {

    private final List<CriterionScore> bestPerSize;
    private final FittedModel fullModel;
    private final long evaluated;
    private final long pruned;
    private final long invalid;

    SubsetSearchResult(List<CriterionScore> bestPerSize, FittedModel fullModel, long evaluated, long pruned, long invalid) {
        this.bestPerSize = Collections.unmodifiableList(new ArrayList<>(bestPerSize));
        this.fullModel = fullModel;
        this.evaluated = evaluated;
        this.pruned = pruned;
        this.invalid = invalid;
    }

    /** Retained subsets ordered by size, then by RSS within a size. */
    public List<CriterionScore> getBestPerSize() {
        return bestPerSize;
    }

    /** The minimal-RSS subset of size k. */
    public CriterionScore bestOfSize(int k) {
        for (CriterionScore s : bestPerSize) {
            if (s.size() == k) return s;
        }
        throw new IllegalArgumentException("No valid subset of size " + k);
    }

    /** All retained subsets, best first under {@code criterion}. */
    public List<CriterionScore> ranked(Criterion criterion) {
        List<CriterionScore> out = new ArrayList<>(bestPerSize);
        out.sort(criterion.comparator());
        return out;
    }

    public CriterionScore best(Criterion criterion) {
        if (bestPerSize.isEmpty()) {
            throw new IllegalStateException("Search produced no valid subset");
        }
        return ranked(criterion).get(0);
    }

    /** Fit with every candidate column, the source of σ̂² for Cp. */
    public FittedModel getFullModel() {
        return fullModel;
    }

    /** Subsets fitted and scored. */
    public long getEvaluatedSubsets() {
        return evaluated;
    }

    /** Branches cut by the RSS bound. */
    public long getPrunedBranches() {
        return pruned;
    }

    /** Rank-deficient subsets skipped during the search. */
    public long getInvalidSubsets() {
        return invalid;
    }
}
