package udem.communities.errors;

/**
 * The numeric minimizer did not produce a finite improvement.
 * {@link #lastValidEstimate()} is the best parameter value known before the failure, NaN if none.
 */
public class OptimizationException extends CommunityDetectionException {
    private final double lastValidEstimate;

    public OptimizationException(String message, double lastValidEstimate) {
        super(message);
        this.lastValidEstimate = lastValidEstimate;
    }

    public OptimizationException(String message, double lastValidEstimate, Throwable cause) {
        super(message, cause);
        this.lastValidEstimate = lastValidEstimate;
    }

    public double lastValidEstimate() {
        return lastValidEstimate;
    }
}
