package regsel.ml;

import org.apache.commons.rng.UniformRandomProvider;
import org.apache.commons.rng.sampling.PermutationSampler;
import org.apache.commons.rng.simple.RandomSource;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ForkJoinPool;
import java.util.concurrent.ForkJoinTask;
import java.util.function.BooleanSupplier;
import java.util.stream.IntStream;

/**
 * Bootstrap and permutation inference by repeated refitting.
 *
 * <h2>Replicates</h2>
 * <p>Replicate b draws from its own generator, {@code XO_SHI_RO_256_PP} seeded with
 * {@code {seed, b}}, so its value depends only on the seed and its index and never on which
 * worker runs it or in what order. Draws are made over the observations sorted by row id,
 * which makes results independent of the row order of the input as well.
 *
 * <h2>Execution</h2>
 * <p>Replicate indices are split into batches run on a {@link ForkJoinPool}; each replicate
 * writes only its own slot, and the slots are collected into an {@link EmpiricalDistribution}
 * at the end. A stop condition is checked before each replicate: once it returns true no new
 * replicates start, and the distribution is built from those that finished.
 */
public class ResamplingEngine {

    private static final Logger logger = LogManager.getLogger(ResamplingEngine.class);

    private static final int BATCH_SIZE = 64;
    private static final byte DONE = 1;
    private static final byte FAILED = 2;

    private final LeastSquaresSolver solver;
    private final long seed;
    private final int parallelism;

    public ResamplingEngine(long seed) {
        this(new LeastSquaresSolver(), seed, Runtime.getRuntime().availableProcessors());
    }

    public ResamplingEngine(LeastSquaresSolver solver, long seed, int parallelism) {
        if (parallelism < 1) throw new IllegalArgumentException("parallelism must be >= 1: " + parallelism);
        this.solver = Objects.requireNonNull(solver, "solver");
        this.seed = seed;
        this.parallelism = parallelism;
    }

    public long getSeed() {
        return seed;
    }

    /** The generator for replicate {@code index}. */
    UniformRandomProvider replicateRng(int index) {
        return RandomSource.XO_SHI_RO_256_PP.create(new long[] {seed, index});
    }

    public EmpiricalDistribution bootstrap(FittedModel model, StatisticFunction statistic, int replicates) {
        return bootstrap(model, statistic, replicates, () -> false);
    }

    /**
     * Residual bootstrap: y* = ŷ + e*, with e* drawn with replacement from the residuals,
     * refit on the same X and evaluate {@code statistic}.
     */
    public EmpiricalDistribution bootstrap(FittedModel model, StatisticFunction statistic, int replicates,
                                           BooleanSupplier stop) {
        requireReplicates(replicates);
        DesignMatrix design = model.getDesign();
        double[] fitted = model.getFitted();
        double[] residuals = model.getResiduals();
        int[] order = canonicalOrder(design);
        int n = order.length;
        return run(statistic.apply(model), replicates, stop, b -> {
            UniformRandomProvider rng = replicateRng(b);
            double[] yStar = new double[n];
            for (int k = 0; k < n; k++) {
                int row = order[k];
                yStar[row] = fitted[row] + residuals[order[rng.nextInt(n)]];
            }
            return statistic.apply(solver.fit(design.withResponse(yStar)));
        });
    }

    public EmpiricalDistribution bootstrapCases(DesignMatrix design, StatisticFunction statistic, int replicates) {
        return bootstrapCases(design, statistic, replicates, () -> false);
    }

    /** Case (pairs) bootstrap: resample whole observations with replacement and refit. */
    public EmpiricalDistribution bootstrapCases(DesignMatrix design, StatisticFunction statistic, int replicates,
                                                BooleanSupplier stop) {
        requireReplicates(replicates);
        int[] order = canonicalOrder(design);
        int n = order.length;
        double observed = statistic.apply(solver.fit(design));
        return run(observed, replicates, stop, b -> {
            UniformRandomProvider rng = replicateRng(b);
            int[] rows = new int[n];
            for (int k = 0; k < n; k++) rows[k] = order[rng.nextInt(n)];
            return statistic.apply(solver.fit(design.selectRows(rows)));
        });
    }

    public PermutationTestResult permute(DesignMatrix design, PermutationTarget target,
                                         StatisticFunction statistic, int replicates) {
        return permute(design, target, statistic, replicates, () -> false);
    }

    /**
     * Permutation test: shuffle the target, refit, and compare |T*| with the observed |T|.
     *
     * @throws UnknownTermException if the target column is not in the design
     */
    public PermutationTestResult permute(DesignMatrix design, PermutationTarget target,
                                         StatisticFunction statistic, int replicates, BooleanSupplier stop) {
        requireReplicates(replicates);
        int column = -1;
        if (!target.isResponse()) {
            column = design.columnIndex(target.getColumn());
            if (design.hasIntercept() && column == 0) {
                throw new IllegalArgumentException("The intercept column cannot be permuted");
            }
        }
        double[] source = column < 0 ? design.response() : design.column(column);
        int[] order = canonicalOrder(design);
        int n = order.length;
        double observed = statistic.apply(solver.fit(design));
        int targetColumn = column;
        EmpiricalDistribution distribution = run(observed, replicates, stop, b -> {
            int[] shuffle = PermutationSampler.natural(n);
            PermutationSampler.shuffle(replicateRng(b), shuffle);
            double[] permuted = new double[n];
            for (int k = 0; k < n; k++) permuted[order[k]] = source[order[shuffle[k]]];
            DesignMatrix perturbed = targetColumn < 0
                ? design.withResponse(permuted)
                : design.withColumn(targetColumn, permuted);
            return statistic.apply(solver.fit(perturbed));
        });
        return new PermutationTestResult(target, distribution);
    }

    private static void requireReplicates(int replicates) {
        if (replicates < 1) throw new IllegalArgumentException("replicates must be >= 1: " + replicates);
    }

    private static int[] canonicalOrder(DesignMatrix design) {
        int[] ids = design.rowIds();
        return IntStream.range(0, ids.length).boxed()
            .sorted(Comparator.comparingInt(i -> ids[i]))
            .mapToInt(Integer::intValue)
            .toArray();
    }

    @FunctionalInterface
    private interface Replicate {
        double compute(int index);
    }

    private EmpiricalDistribution run(double observed, int replicates, BooleanSupplier stop, Replicate replicate) {
        double[] values = new double[replicates];
        byte[] status = new byte[replicates];
        int batches = (replicates + BATCH_SIZE - 1) / BATCH_SIZE;

        ForkJoinPool pool = new ForkJoinPool(parallelism);
        try {
            List<ForkJoinTask<?>> tasks = new ArrayList<>(batches);
            for (int batch = 0; batch < batches; batch++) {
                int start = batch * BATCH_SIZE;
                int end = Math.min(start + BATCH_SIZE, replicates);
                tasks.add(pool.submit(() -> {
                    for (int b = start; b < end; b++) {
                        if (stop.getAsBoolean()) return;
                        try {
                            values[b] = replicate.compute(b);
                            status[b] = Double.isFinite(values[b]) ? DONE : FAILED;
                        } catch (RankDeficiencyException e) {
                            status[b] = FAILED;
                        }
                    }
                }));
            }
            for (ForkJoinTask<?> task : tasks) {
                task.join();
            }
        } finally {
            pool.shutdown();
        }

        // join() makes every slot written by the workers visible here
        double[] done = new double[replicates];
        int completed = 0;
        int failed = 0;
        for (int b = 0; b < replicates; b++) {
            if (status[b] == DONE) {
                done[completed++] = values[b];
            } else if (status[b] == FAILED) {
                failed++;
            }
        }
        if (failed > 0) {
            logger.warn("{} of {} replicates could not be refit and were dropped", failed, replicates);
        }
        if (completed + failed < replicates) {
            logger.debug("Stopped after {} of {} replicates", completed + failed, replicates);
        }
        return new EmpiricalDistribution(observed, Arrays.copyOf(done, completed), replicates, failed);
    }
}
