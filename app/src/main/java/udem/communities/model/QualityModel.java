package udem.communities.model;

/**
 * One generative model: the objective maximized by the greedy search at a fixed parameter,
 * its exact per-move deltas, the log-likelihood of a partition and the parameter estimator.
 * <p>
 * A move is evaluated in two halves, the way the local search applies it: {@link #removeGain}
 * while the node still sits in its community, then {@link #insertGain} once it has been taken
 * out. Their sum is the exact change of {@link #quality}.
 */
public interface QualityModel {

    ModelKind kind();

    /**
     * Objective maximized by the local search under a fixed parameter.
     */
    double quality(CommunityStatistics stats, double parameter);

    /**
     * Change of {@link #quality} when {@code node} leaves its community to stand alone.
     *
     * @param weightToOwn weight from the node to the other members of its community
     */
    double removeGain(CommunityView view, int node, double weightToOwn, double parameter);

    /**
     * Change of {@link #quality} when the isolated {@code node} joins {@code community}.
     */
    double insertGain(CommunityView view, int node, int community, double weightToCommunity, double parameter);

    /**
     * Change of {@link #quality} when {@code node} moves from {@code from} (its current community) to {@code to}.
     */
    default double moveGain(CommunityView view, int node, int from, int to, double parameter) {
        if (view.communityOf(node) != from) {
            throw new IllegalArgumentException("node " + node + " is not in community " + from);
        }
        if (from == to) return 0.0;
        return removeGain(view, node, view.linkWeight(node, from), parameter)
                + insertGain(view, node, to, view.linkWeight(node, to), parameter);
    }

    double totalLogLikelihood(CommunityStatistics stats, double parameter);

    ParameterEstimate estimateParameter(CommunityStatistics stats);
}
