package regsel.ml;

import java.util.Optional;

/** One grid point of a transform search: the parameter, its profile log-likelihood, and optionally the refit. */
public final class TransformCandidate {

    private final double parameter;
    private final double logLikelihood;
    private final FittedModel model;

    public TransformCandidate(double parameter, double logLikelihood, FittedModel model) {
        this.parameter = parameter;
        this.logLikelihood = logLikelihood;
        this.model = model;
    }

    /** λ for Box-Cox, α for the shifted log. */
    public double getParameter() {
        return parameter;
    }

    public double getLogLikelihood() {
        return logLikelihood;
    }

    /** Fit on the transformed response; present for the best candidate only. */
    public Optional<FittedModel> getModel() {
        return Optional.ofNullable(model);
    }

    @Override
    public String toString() {
        return "TransformCandidate{parameter=" + parameter + ", logLikelihood=" + logLikelihood + "}";
    }
}
