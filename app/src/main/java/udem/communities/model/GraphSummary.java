package udem.communities.model;

import udem.communities.graph.core.WeightedGraph;

/**
 * Partition-independent quantities of the original graph.
 *
 * @param nodeCount     original nodes
 * @param totalWeight   E, edges counted once plus self-loops
 * @param degreeEntropy sum of {@code d log d} over the original weighted degrees
 */
public record GraphSummary(int nodeCount, double totalWeight, double degreeEntropy) {

    public static GraphSummary of(WeightedGraph graph) {
        double dld = 0.0;
        for (int u = 0; u < graph.nodeCount(); u++) dld += LogMath.xlogx(graph.weightedDegree(u));
        return new GraphSummary(graph.nodeCount(), graph.totalWeight(), dld);
    }

    public double pairCount() {
        return nodeCount * (nodeCount - 1.0) / 2.0;
    }
}
