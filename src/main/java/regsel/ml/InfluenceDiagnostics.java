package regsel.ml;

/**
 * Per-observation diagnostics: leverage hᵢ, standardized residual eᵢ/(σ̂√(1−hᵢ)) and
 * Cook's distance rᵢ²hᵢ/(rank·(1−hᵢ)).
 */
public final class InfluenceDiagnostics {

    private final double[] leverage;
    private final double[] standardizedResiduals;
    private final double[] cooksDistance;

    public InfluenceDiagnostics(double[] leverage, double[] standardizedResiduals, double[] cooksDistance) {
        this.leverage = leverage;
        this.standardizedResiduals = standardizedResiduals;
        this.cooksDistance = cooksDistance;
    }

    public double[] getLeverage() { return leverage.clone(); }
    public double[] getStandardizedResiduals() { return standardizedResiduals.clone(); }
    public double[] getCooksDistance() { return cooksDistance.clone(); }

    /** Index of the observation with the largest Cook's distance. */
    public int getMostInfluential() {
        int best = 0;
        for (int i = 1; i < cooksDistance.length; i++) {
            if (cooksDistance[i] > cooksDistance[best]) best = i;
        }
        return best;
    }
}
