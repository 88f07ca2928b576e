package regsel.ml;

/**
 * Joint confidence region for two coefficients S = {a, b}:
 * (β̂_S − β_S)ᵗ M (β̂_S − β_S) ≤ 2σ̂²F₂,df(α), with M = [(XᵗX)⁻¹_SS]⁻¹.
 * <p>
 * When S holds every coefficient of the model, M is simply the 2×2 block of XᵗX.
 */
public final class ConfidenceEllipse {

    private final String termA;
    private final String termB;
    private final double centerA;
    private final double centerB;
    private final double[][] v;
    private final double[][] m;
    private final double radiusSquared;
    private final double level;

    ConfidenceEllipse(String termA, String termB, double centerA, double centerB,
                      double[][] v, double radiusSquared, double level) {
        this.termA = termA;
        this.termB = termB;
        this.centerA = centerA;
        this.centerB = centerB;
        this.v = v;
        double det = v[0][0] * v[1][1] - v[0][1] * v[1][0];
        this.m = new double[][] {
            {v[1][1] / det, -v[0][1] / det},
            {-v[1][0] / det, v[0][0] / det}
        };
        this.radiusSquared = radiusSquared;
        this.level = level;
    }

    public String getTermA() { return termA; }
    public String getTermB() { return termB; }
    public double getCenterA() { return centerA; }
    public double getCenterB() { return centerB; }
    public double getRadiusSquared() { return radiusSquared; }

    /** Confidence level 1 − α. */
    public double getLevel() { return level; }

    /** M, the quadratic form of the region. */
    public double[][] getMatrix() {
        return new double[][] {m[0].clone(), m[1].clone()};
    }

    /** (β̂_S − β_S)ᵗ M (β̂_S − β_S) for the point (a, b). */
    public double distance(double a, double b) {
        double da = centerA - a;
        double db = centerB - b;
        return da * (m[0][0] * da + m[0][1] * db) + db * (m[1][0] * da + m[1][1] * db);
    }

    public boolean contains(double a, double b) {
        return distance(a, b) <= radiusSquared;
    }

    /** {@code points} points on the boundary, as rows {a, b}. */
    public double[][] boundary(int points) {
        if (points < 3) throw new IllegalArgumentException("points must be >= 3");
        // V = LLᵗ; d = √c·L·(cos θ, sin θ) satisfies dᵗV⁻¹d = c
        double l11 = Math.sqrt(v[0][0]);
        double l21 = v[1][0] / l11;
        double l22 = Math.sqrt(Math.max(0, v[1][1] - l21 * l21));
        double c = Math.sqrt(radiusSquared);
        double[][] out = new double[points][2];
        for (int k = 0; k < points; k++) {
            double theta = 2 * Math.PI * k / points;
            double u = Math.cos(theta);
            double w = Math.sin(theta);
            out[k][0] = centerA + c * l11 * u;
            out[k][1] = centerB + c * (l21 * u + l22 * w);
        }
        return out;
    }

    @Override
    public String toString() {
        return "ConfidenceEllipse{" + termA + "=" + centerA + ", " + termB + "=" + centerB
            + ", level=" + level + ", radius²=" + radiusSquared + "}";
    }
}
