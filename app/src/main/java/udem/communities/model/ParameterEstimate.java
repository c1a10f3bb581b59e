package udem.communities.model;

import udem.communities.errors.OptimizationException;

/**
 * Parameter value estimated from a partition. {@code rawValue} is what the estimator produced,
 * {@code value} the same number clamped into the model's domain.
 */
public record ParameterEstimate(ModelKind kind, double value, double rawValue, boolean clamped) {

    public static ParameterEstimate of(ModelKind kind, double raw) {
        if (Double.isNaN(raw) || raw == Double.NEGATIVE_INFINITY) {
            throw new OptimizationException(kind.modelName() + ": estimator produced " + raw, Double.NaN);
        }
        double finite = Math.min(raw, Double.MAX_VALUE);
        if (kind.inDomain(finite) && finite == raw) return new ParameterEstimate(kind, raw, raw, false);
        return new ParameterEstimate(kind, kind.clamp(finite), raw, true);
    }

    public ModelParameter toParameter() {
        return new ModelParameter(kind, value);
    }
}
