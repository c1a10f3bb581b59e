package udem.communities.model;

/**
 * Read access to the community aggregates of one level, as needed by move gains.
 * A node taken out of its community for evaluation reports community -1.
 */
public interface CommunityView {

    GraphSummary summary();

    int communityOf(int node);

    double nodeDegree(int node);

    double nodeSelfLoop(int node);

    int nodeSize(int node);

    double communityDegree(int community);

    double communityInternal(int community);

    int communitySize(int community);

    /**
     * Weight of the edges from {@code node} to the other members of {@code community}.
     */
    double linkWeight(int node, int community);
}
