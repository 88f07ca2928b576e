package regsel.ml;

import org.apache.commons.math3.distribution.ChiSquaredDistribution;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

/**
 * Profile-likelihood search for a response transformation.
 * <p>
 * Box-Cox: g_λ(y) = (y^λ − 1)/λ (λ ≠ 0), ln y (λ = 0). Each λ is fitted on the response divided by
 * ġ^{λ−1} (ġ the geometric mean of y), which puts every RSS on the scale of y, so
 * ℓ(λ) = −(n/2)·ln(RSS_λ/n). This equals −(n/2)·ln(RSS/n) + (λ−1)·Σ ln yᵢ for the unscaled g_λ(y).
 * <p>
 * Shifted log: g_α(y) = ln(y + α) with ℓ(α) = −(n/2)·ln(RSS_α/n) − Σ ln(yᵢ + α), for responses
 * that are not strictly positive.
 * <p>
 * Grid points are independent fits and are evaluated in parallel.
 */
public class TransformSearch {

    private static final Logger logger = LogManager.getLogger(TransformSearch.class);

    private final LeastSquaresSolver solver;
    private final double level;

    public TransformSearch() {
        this(new LeastSquaresSolver(), 0.95);
    }

    /**
     * @param level coverage of the likelihood interval, 0.95 by default
     */
    public TransformSearch(LeastSquaresSolver solver, double level) {
        if (!(level > 0 && level < 1)) throw new IllegalArgumentException("level must be in (0, 1): " + level);
        this.solver = Objects.requireNonNull(solver, "solver");
        this.level = level;
    }

    /** {from, from + step, ..., to}, inclusive of {@code to} when it falls on the grid. */
    public static double[] grid(double from, double to, double step) {
        if (!(step > 0) || to < from) {
            throw new IllegalArgumentException("Bad grid [" + from + ", " + to + "] step " + step);
        }
        int count = (int) Math.floor((to - from) / step + 1e-9) + 1;
        double[] g = new double[count];
        for (int i = 0; i < count; i++) {
            // snapped so 0 and 1 are hit exactly on decimal grids; large values keep full precision
            double v = from + i * step;
            g[i] = Math.abs(v) < 1e6 ? Math.rint(v * 1e12) / 1e12 + 0.0 : v;
        }
        return g;
    }

    /**
     * @throws NonPositiveResponseException if any yᵢ ≤ 0
     */
    public TransformResult boxcox(DesignMatrix design, double[] lambdaGrid) {
        requireGrid(lambdaGrid);
        double[] y = design.response();
        double sumLog = 0;
        for (int i = 0; i < y.length; i++) {
            if (!(y[i] > 0)) throw new NonPositiveResponseException(i, y[i]);
            sumLog += Math.log(y[i]);
        }
        double geometricMean = Math.exp(sumLog / y.length);
        int n = y.length;

        List<TransformCandidate> profile = IntStream.range(0, lambdaGrid.length)
            .parallel()
            .mapToObj(k -> {
                double lambda = lambdaGrid[k];
                double[] z = new double[n];
                double scale = Math.pow(geometricMean, lambda - 1);
                for (int i = 0; i < n; i++) z[i] = boxcox(y[i], lambda) / scale;
                double rss = solver.fit(design.withResponse(z)).getRss();
                return new TransformCandidate(lambda, -0.5 * n * Math.log(rss / n), null);
            })
            .collect(Collectors.toList());

        return finish(TransformResult.Kind.BOX_COX, design, profile, parameter -> {
            double[] z = new double[n];
            for (int i = 0; i < n; i++) z[i] = boxcox(y[i], parameter);
            return z;
        });
    }

    /** g_λ(y), with the λ → 0 limit ln y. */
    public static double boxcox(double y, double lambda) {
        if (Math.abs(lambda) < 1e-12) return Math.log(y);
        return (Math.pow(y, lambda) - 1) / lambda;
    }

    /**
     * Shifted-log search. Grid values with yᵢ + α ≤ 0 for some observation are skipped.
     *
     * @throws IllegalArgumentException if no grid value is admissible
     */
    public TransformResult logshift(DesignMatrix design, double[] alphaGrid) {
        requireGrid(alphaGrid);
        double[] y = design.response();
        double min = Double.POSITIVE_INFINITY;
        for (double v : y) min = Math.min(min, v);
        int n = y.length;
        double smallest = min;

        List<TransformCandidate> profile = IntStream.range(0, alphaGrid.length)
            .parallel()
            .filter(k -> smallest + alphaGrid[k] > 0)
            .mapToObj(k -> {
                double alpha = alphaGrid[k];
                double[] z = new double[n];
                double jacobian = 0;
                for (int i = 0; i < n; i++) {
                    z[i] = Math.log(y[i] + alpha);
                    jacobian += z[i];
                }
                double rss = solver.fit(design.withResponse(z)).getRss();
                return new TransformCandidate(alpha, -0.5 * n * Math.log(rss / n) - jacobian, null);
            })
            .collect(Collectors.toList());
        if (profile.isEmpty()) {
            throw new IllegalArgumentException("No shift in the grid makes y + alpha positive (min y = " + min + ")");
        }
        if (profile.size() < alphaGrid.length) {
            logger.debug("Skipped {} shifts with y + alpha <= 0", alphaGrid.length - profile.size());
        }

        return finish(TransformResult.Kind.LOG_SHIFT, design, profile, alpha -> {
            double[] z = new double[n];
            for (int i = 0; i < n; i++) z[i] = Math.log(y[i] + alpha);
            return z;
        });
    }

    private static void requireGrid(double[] grid) {
        if (grid == null || grid.length == 0) {
            throw new IllegalArgumentException("Parameter grid must not be empty");
        }
    }

    @FunctionalInterface
    private interface Transform {
        double[] apply(double parameter);
    }

    private TransformResult finish(TransformResult.Kind kind, DesignMatrix design,
                                   List<TransformCandidate> profile, Transform transform) {
        TransformCandidate best = profile.get(0);
        for (TransformCandidate c : profile) {
            if (c.getLogLikelihood() > best.getLogLikelihood()) best = c;
        }
        double cutoff = best.getLogLikelihood()
            - 0.5 * new ChiSquaredDistribution(1).inverseCumulativeProbability(level);
        double lower = Double.POSITIVE_INFINITY;
        double upper = Double.NEGATIVE_INFINITY;
        for (TransformCandidate c : profile) {
            if (c.getLogLikelihood() >= cutoff) {
                lower = Math.min(lower, c.getParameter());
                upper = Math.max(upper, c.getParameter());
            }
        }
        FittedModel refit = solver.fit(design.withResponse(transform.apply(best.getParameter())));
        TransformCandidate chosen = new TransformCandidate(best.getParameter(), best.getLogLikelihood(), refit);

        List<TransformCandidate> scored = new ArrayList<>(profile);
        scored.set(scored.indexOf(best), chosen);
        logger.debug("{}: best parameter {} (logLik {}), interval [{}, {}]",
            kind, chosen.getParameter(), chosen.getLogLikelihood(), lower, upper);
        return new TransformResult(kind, scored, chosen, lower, upper, level);
    }
}
