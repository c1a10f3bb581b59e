package udem.communities.graph.core;

import java.util.List;
import java.util.stream.IntStream;

/**
 * Undirected weighted graph over the nodes {@code 0..nodeCount()-1}.
 * <p>
 * Neighbor lists are symmetric and never contain the node itself: a self-loop is reported by
 * {@link #selfLoopWeight(int)} only. A self-loop counts twice in {@link #weightedDegree(int)} and
 * once in {@link #totalWeight()}, so the degrees always sum to twice the total weight.
 */
public interface WeightedGraph {

    record Neighbor(int node, double weight) {
    }

    int nodeCount();

    default IntStream nodes() {
        return IntStream.range(0, nodeCount());
    }

    List<Neighbor> neighbors(int node);

    double selfLoopWeight(int node);

    double weightedDegree(int node);

    /**
     * Sum of all edge weights counted once, self-loops included.
     */
    double totalWeight();
}
