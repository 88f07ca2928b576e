package regsel.ml;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Near-singularity report for a fit: the condition number of the retained design columns and
 * the variance inflation factor VIFⱼ = 1/(1 − R²ⱼ) of each predictor, where R²ⱼ comes from
 * regressing predictor j on the other columns.
 */
public final class CollinearityDiagnostics {

    private final double conditionNumber;
    private final Map<String, Double> varianceInflation;

    public CollinearityDiagnostics(double conditionNumber, Map<String, Double> varianceInflation) {
        this.conditionNumber = conditionNumber;
        this.varianceInflation = Collections.unmodifiableMap(new LinkedHashMap<>(varianceInflation));
    }

    public double getConditionNumber() {
        return conditionNumber;
    }

    public Map<String, Double> getVarianceInflation() {
        return varianceInflation;
    }

    public double vif(String term) {
        Double v = varianceInflation.get(term);
        if (v == null) throw new UnknownTermException(term);
        return v;
    }

    public double getMaxVif() {
        double max = 1;
        for (double v : varianceInflation.values()) max = Math.max(max, v);
        return max;
    }

    @Override
    public String toString() {
        return "CollinearityDiagnostics{kappa=" + conditionNumber + ", vif=" + varianceInflation + "}";
    }
}
