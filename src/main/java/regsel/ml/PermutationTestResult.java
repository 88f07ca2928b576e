package regsel.ml;

/**
 * Permutation test outcome. The p-value is the fraction of replicate statistics whose absolute
 * value equals or exceeds the absolute observed statistic.
 */
public final class PermutationTestResult {

    private final PermutationTarget target;
    private final EmpiricalDistribution distribution;

    public PermutationTestResult(PermutationTarget target, EmpiricalDistribution distribution) {
        this.target = target;
        this.distribution = distribution;
    }

    public PermutationTarget getTarget() {
        return target;
    }

    public EmpiricalDistribution getDistribution() {
        return distribution;
    }

    public double getObserved() {
        return distribution.getObserved();
    }

    public double getPValue() {
        return distribution.getUpperTailFraction();
    }

    @Override
    public String toString() {
        return "Permutation test on " + target + ": observed " + getObserved() + ", p = " + getPValue()
            + " (" + distribution.getCompleted() + " replicates)";
    }
}
