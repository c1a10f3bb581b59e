package udem.communities.errors;

/**
 * Input that violates a model or graph contract: parameter out of domain, directed graph,
 * negative or non-finite weight, partition not covering the graph.
 */
public class ValidationException extends CommunityDetectionException {

    public ValidationException(String message) {
        super(message);
    }
}
