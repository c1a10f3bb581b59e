package udem.communities.detection;

/**
 * One partition/parameter alternation.
 *
 * @param parameterFallback true when estimation failed and the previous parameter was kept
 */
public record IterationRecord(
        int iteration,
        int communityCount,
        double parameter,
        double logLikelihood,
        boolean parameterFallback
) {
}
