package regsel.ml;

/**
 * A scalar extracted from a fit, evaluated once on the observed fit and once per replicate.
 */
@FunctionalInterface
public interface StatisticFunction {

    double apply(FittedModel model);

    /** β̂ of the named term. */
    static StatisticFunction coefficient(String term) {
        return model -> model.getCoefficient(term);
    }

    /** β̂ / se(β̂) of the named term. */
    static StatisticFunction tStatistic(String term) {
        return model -> {
            int j = model.termIndex(term);
            return model.getCoefficient(j) / model.getStandardError(j);
        };
    }

    /** |β̂ / se(β̂)| of the named term. */
    static StatisticFunction absTStatistic(String term) {
        StatisticFunction t = tStatistic(term);
        return model -> Math.abs(t.apply(model));
    }

    /** Global regression F statistic against the intercept-only (or empty) model. */
    static StatisticFunction overallF() {
        return model -> {
            int numDf = model.getRank() - (model.hasIntercept() ? 1 : 0);
            return ((model.getTss() - model.getRss()) / numDf) / (model.getRss() / model.getResidualDf());
        };
    }

    static StatisticFunction rSquared() {
        return FittedModel::getRSquared;
    }

    /** Look a statistic up by name: "coef", "t", "abs-t" (needing a term), "F" or "r2". */
    static StatisticFunction named(String name, String term) {
        switch (name.trim().toLowerCase()) {
            case "coef":
            case "coefficient":
                return coefficient(requireTerm(name, term));
            case "t":
                return tStatistic(requireTerm(name, term));
            case "abs-t":
            case "abst":
                return absTStatistic(requireTerm(name, term));
            case "f":
                return overallF();
            case "r2":
                return rSquared();
            default:
                throw new IllegalArgumentException("Unknown statistic: " + name);
        }
    }

    private static String requireTerm(String name, String term) {
        if (term == null || term.isBlank()) {
            throw new IllegalArgumentException("Statistic '" + name + "' needs a term");
        }
        return term;
    }
}
