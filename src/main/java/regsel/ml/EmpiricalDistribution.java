package regsel.ml;

import org.apache.commons.math3.stat.descriptive.moment.Mean;
import org.apache.commons.math3.stat.descriptive.moment.StandardDeviation;

import java.util.Arrays;

/**
 * Replicate values of a statistic plus the value on the observed data.
 * <p>
 * {@link #getCompleted()} can be smaller than {@link #getRequested()} when the run was stopped early or
 * some replicates could not be refit; the distribution is then built from what completed.
 */
public final class EmpiricalDistribution {

    private final double observed;
    private final double[] sorted;
    private final int requested;
    private final int failed;

    public EmpiricalDistribution(double observed, double[] values, int requested, int failed) {
        this.observed = observed;
        this.sorted = values.clone();
        Arrays.sort(this.sorted);
        this.requested = requested;
        this.failed = failed;
    }

    public double getObserved() {
        return observed;
    }

    /** Replicate values in ascending order. */
    public double[] getValues() {
        return sorted.clone();
    }

    public int getCompleted() {
        return sorted.length;
    }

    public int getRequested() {
        return requested;
    }

    /** Replicates dropped because their refit failed (rank-deficient resample). */
    public int getFailed() {
        return failed;
    }

    /** Replicates never run because the run was stopped. */
    public int getSkipped() {
        return requested - failed - sorted.length;
    }

    /**
     * Quantile with linear interpolation between order statistics
     * (position (m − 1)·q in the sorted sample).
     */
    public double quantile(double q) {
        if (!(q >= 0 && q <= 1)) throw new IllegalArgumentException("q must be in [0, 1]: " + q);
        if (sorted.length == 0) return Double.NaN;
        double pos = (sorted.length - 1) * q;
        int lo = (int) Math.floor(pos);
        int hi = Math.min(lo + 1, sorted.length - 1);
        double frac = pos - lo;
        return sorted[lo] + frac * (sorted[hi] - sorted[lo]);
    }

    /** Two-sided percentile interval: the α/2 and 1 − α/2 quantiles. */
    public double[] percentileInterval(double alpha) {
        if (!(alpha > 0 && alpha < 1)) throw new IllegalArgumentException("alpha must be in (0, 1): " + alpha);
        return new double[] {quantile(alpha / 2), quantile(1 - alpha / 2)};
    }

    public double getMean() {
        return sorted.length == 0 ? Double.NaN : new Mean().evaluate(sorted);
    }

    /** Standard deviation of the replicates, the resampling standard error. */
    public double getStandardError() {
        return sorted.length < 2 ? Double.NaN : new StandardDeviation().evaluate(sorted);
    }

    /** mean − observed. */
    public double getBias() {
        return getMean() - observed;
    }

    /** Fraction of replicates with |value| ≥ |observed|, up to a relative tolerance of 1e-12. */
    public double getUpperTailFraction() {
        if (sorted.length == 0) return Double.NaN;
        // replicates that tie the observed value up to rounding count as at least as extreme
        double threshold = Math.abs(observed) * (1 - 1e-12);
        int count = 0;
        for (double v : sorted) {
            if (Math.abs(v) >= threshold) count++;
        }
        return (double) count / sorted.length;
    }

    @Override
    public String toString() {
        return "EmpiricalDistribution{observed=" + observed + ", completed=" + getCompleted()
            + "/" + requested + ", mean=" + getMean() + ", se=" + getStandardError() + "}";
    }
}
