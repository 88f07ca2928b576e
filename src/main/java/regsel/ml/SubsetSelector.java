package regsel.ml;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.Deque;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ForkJoinPool;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

/**
 * Exhaustive best-subset regression with branch-and-bound pruning.
 *
 * <h2>Search</h2>
 * <p>The intercept and any forced columns are in every model and do not count towards the
 * subset size k. Subsets of the remaining candidate predictors are enumerated depth first in
 * lexicographic order from an explicit stack of {@link SearchNode}s. A node holds the chosen
 * candidates and the first candidate still allowed; every subset below it lies between the
 * chosen set and the chosen set plus all remaining candidates. RSS cannot increase as columns
 * are added, so the RSS of that largest set bounds every subset in the branch, and a branch is
 * dropped when its bound cannot beat the incumbents of any size it could still reach.
 *
 * <p>The top-level branches (one per first candidate) are independent and run in parallel;
 * their per-size incumbents are merged at the end.
 *
 * <h2>Scores</h2>
 * <p>With p = k + forced columns: AIC = n·ln(RSS/n) + 2p, BIC = n·ln(RSS/n) + ln(n)·p,
 * adjusted R² = 1 − (RSS/(n−p))/(TSS/(n−1)) and Cp = RSS/σ̂²_full + 2p − n.
 *
 * <h2>Usage</h2>
 * <pre>{@code
 * SubsetSearchResult result = new SubsetSelector().search(design, 3);
 * CriterionScore best = result.best(Criterion.AIC);
 * }</pre>
 */
public class SubsetSelector {

    private static final Logger logger = LogManager.getLogger(SubsetSelector.class);

    private static final double BOUND_SLACK = 1e-10;

    private final LeastSquaresSolver solver;
    private final LeastSquaresSolver boundSolver;
    private final int nbest;
    private final List<String> forcedColumns;
    private final int parallelism;

    public SubsetSelector() {
        this(new LeastSquaresSolver(), 1, List.of(), Runtime.getRuntime().availableProcessors());
    }

    /**
     * @param solver        fits the scored subsets; subsets it rejects as rank deficient are skipped
     * @param nbest         subsets kept per size
     * @param forcedColumns predictors included in every model besides the intercept
     * @param parallelism   worker threads for the top-level branches
     */
    public SubsetSelector(LeastSquaresSolver solver, int nbest, List<String> forcedColumns, int parallelism) {
        if (nbest < 1) throw new IllegalArgumentException("nbest must be >= 1: " + nbest);
        if (parallelism < 1) throw new IllegalArgumentException("parallelism must be >= 1: " + parallelism);
        this.solver = Objects.requireNonNull(solver, "solver");
        this.boundSolver = new LeastSquaresSolver(LeastSquaresSolver.RankPolicy.DROP_ALIASED, solver.getTolerance());
        this.nbest = nbest;
        this.forcedColumns = List.copyOf(forcedColumns);
        this.parallelism = parallelism;
    }

    /**
     * Search all subsets of up to {@code maxSize} candidate predictors.
     *
     * @return the {@code nbest} minimal-RSS subsets of every size 1..maxSize that has a valid subset
     */
    public SubsetSearchResult search(DesignMatrix design, int maxSize) {
        if (maxSize < 1) throw new IllegalArgumentException("maxSize must be >= 1: " + maxSize);

        List<Integer> forced = new ArrayList<>();
        if (design.hasIntercept()) forced.add(0);
        for (String name : forcedColumns) {
            int j = design.columnIndex(name);
            if (!forced.contains(j)) forced.add(j);
        }
        int[] candidates = IntStream.range(0, design.columns()).filter(j -> !forced.contains(j)).toArray();
        if (candidates.length == 0) {
            throw new IllegalArgumentException("No candidate predictors to select from");
        }
        int limit = Math.min(maxSize, candidates.length);

        FittedModel full = fitFull(design);
        Scoring scoring = new Scoring(design, forced.stream().mapToInt(Integer::intValue).toArray(),
            candidates, full.getSigma2());

        logger.debug("Best-subset search over {} candidates (forced {}), sizes 1..{}",
            candidates.length, forced.size(), limit);

        List<Partial> partials;
        ForkJoinPool pool = new ForkJoinPool(parallelism);
        try {
            partials = pool.submit(() -> IntStream.range(0, candidates.length)
                .parallel()
                .mapToObj(first -> searchBranch(scoring, first, limit))
                .collect(Collectors.toList())).get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Subset search interrupted", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException) throw (RuntimeException) cause;
            throw new IllegalStateException("Subset search failed", cause);
        } finally {
            pool.shutdown();
        }

        Partial merged = new Partial(limit, nbest);
        for (Partial p : partials) merged.merge(p);

        List<CriterionScore> best = new ArrayList<>();
        for (int k = 1; k <= limit; k++) best.addAll(merged.incumbents.get(k - 1));
        logger.debug("Evaluated {} subsets, pruned {} branches, skipped {} rank-deficient subsets",
            merged.evaluated, merged.pruned, merged.invalid);
        return new SubsetSearchResult(best, full, merged.evaluated, merged.pruned, merged.invalid);
    }

    private FittedModel fitFull(DesignMatrix design) {
        try {
            return solver.fit(design);
        } catch (RankDeficiencyException e) {
            logger.warn("Full model is rank deficient ({}); σ̂² for Cp comes from the retained columns",
                e.getAliasedColumns());
            return boundSolver.fit(design);
        }
    }

    /** Depth-first search of all subsets whose first candidate is {@code first}. */
    private Partial searchBranch(Scoring scoring, int first, int limit) {
        Partial partial = new Partial(limit, nbest);
        int m = scoring.candidates.length;
        Deque<SearchNode> stack = new ArrayDeque<>();
        stack.push(new SearchNode(new int[] {first}, first + 1));
        while (!stack.isEmpty()) {
            SearchNode node = stack.pop();
            partial.offer(scoring, node.chosen);

            int remaining = m - node.next;
            if (remaining == 0 || node.chosen.length == limit) continue;

            int[] all = node.withAllFrom(m);
            if (!scoring.fits(all.length)) {
                pushChildren(stack, node, m);
                continue;
            }
            double bound = scoring.rss(boundSolver, all);
            if (partial.cannotImprove(bound, node.chosen.length + 1, Math.min(limit, node.chosen.length + remaining))) {
                partial.pruned++;
                continue;
            }
            pushChildren(stack, node, m);
        }
        return partial;
    }

    private static void pushChildren(Deque<SearchNode> stack, SearchNode node, int m) {
        // reverse order, so the smallest next candidate is expanded first
        for (int c = m - 1; c >= node.next; c--) {
            stack.push(node.child(c));
        }
    }

    /** Immutable search state: chosen candidate positions and the first one still allowed. */
    private static final class SearchNode {
        private final int[] chosen;
        private final int next;

        private SearchNode(int[] chosen, int next) {
            this.chosen = chosen;
            this.next = next;
        }

        private SearchNode child(int candidate) {
            int[] grown = Arrays.copyOf(chosen, chosen.length + 1);
            grown[chosen.length] = candidate;
            return new SearchNode(grown, candidate + 1);
        }

        private int[] withAllFrom(int m) {
            int[] all = Arrays.copyOf(chosen, chosen.length + m - next);
            for (int c = next, k = chosen.length; c < m; c++, k++) all[k] = c;
            return all;
        }
    }

    /** Fixed quantities shared by every subset of one search. */
    private final class Scoring {
        private final DesignMatrix design;
        private final int[] forced;
        private final int[] candidates;
        private final double sigma2Full;
        private final int n;
        private final double tss;

        private Scoring(DesignMatrix design, int[] forced, int[] candidates, double sigma2Full) {
            this.design = design;
            this.forced = forced;
            this.candidates = candidates;
            this.sigma2Full = sigma2Full;
            this.n = design.rows();
            this.tss = FittedModel.totalSumOfSquares(design.rawResponse(), design.hasIntercept());
        }

        private DesignMatrix project(int[] chosen) {
            int[] columns = Arrays.copyOf(forced, forced.length + chosen.length);
            for (int k = 0; k < chosen.length; k++) columns[forced.length + k] = candidates[chosen[k]];
            return design.selectColumns(columns);
        }

        /** Whether a model with {@code chosen} candidates has no more columns than observations. */
        private boolean fits(int chosen) {
            return forced.length + chosen <= n;
        }

        private double rss(LeastSquaresSolver s, int[] chosen) {
            return s.fit(project(chosen)).getRss();
        }

        private CriterionScore score(int[] chosen) {
            FittedModel model = solver.fit(project(chosen));
            double rss = model.getRss();
            int p = forced.length + chosen.length;
            int[] columns = new int[chosen.length];
            List<String> names = new ArrayList<>(chosen.length);
            for (int k = 0; k < chosen.length; k++) {
                columns[k] = candidates[chosen[k]];
                names.add(design.columnName(columns[k]));
            }
            double logLik = n * Math.log(rss / n);
            double aic = logLik + 2.0 * p;
            double bic = logLik + Math.log(n) * p;
            int tssDf = design.hasIntercept() ? n - 1 : n;
            double adjR2 = n > p && tss > 0 ? 1.0 - (rss / (n - p)) / (tss / tssDf) : Double.NaN;
            double cp = sigma2Full > 0 ? rss / sigma2Full + 2.0 * p - n : Double.NaN;
            return new CriterionScore(columns, names, p, rss, aic, bic, adjR2, cp);
        }
    }

    /**
     * Per-size incumbents of one branch, confined to the thread searching it.
     * Merging two partials is associative.
     */
    private static final class Partial {
        private static final Comparator<CriterionScore> BY_RSS = Comparator
            .comparingDouble(CriterionScore::getRss)
            .thenComparing(CriterionScore::compareLexically);

        private final List<List<CriterionScore>> incumbents;
        private final int nbest;
        private long evaluated;
        private long pruned;
        private long invalid;

        private Partial(int limit, int nbest) {
            this.nbest = nbest;
            this.incumbents = new ArrayList<>(limit);
            for (int k = 0; k < limit; k++) incumbents.add(new ArrayList<>(nbest + 1));
        }

        private void offer(Scoring scoring, int[] chosen) {
            CriterionScore score;
            try {
                score = scoring.score(chosen);
            } catch (RankDeficiencyException | DimensionException e) {
                invalid++;
                return;
            }
            evaluated++;
            insert(score);
        }

        private void insert(CriterionScore score) {
            List<CriterionScore> list = incumbents.get(score.size() - 1);
            list.add(score);
            list.sort(BY_RSS);
            if (list.size() > nbest) list.remove(list.size() - 1);
        }

        /** True when {@code bound} cannot beat the incumbents of any size in [from, to]. */
        private boolean cannotImprove(double bound, int from, int to) {
            for (int k = from; k <= to; k++) {
                List<CriterionScore> list = incumbents.get(k - 1);
                if (list.size() < nbest) return false;
                double worst = list.get(list.size() - 1).getRss();
                if (bound <= worst + BOUND_SLACK * Math.max(1.0, worst)) return false;
            }
            return true;
        }

        private void merge(Partial other) {
            for (List<CriterionScore> list : other.incumbents) {
                for (CriterionScore s : list) insert(s);
            }
            evaluated += other.evaluated;
            pruned += other.pruned;
            invalid += other.invalid;
        }
    }
}
