package udem.communities.graph.core;

import udem.communities.errors.ValidationException;

/**
 * Newman-Girvan modularity with a resolution factor.
 */
public final class Modularity {

    private Modularity() {
    }

    public static double of(WeightedGraph graph, Partition partition) {
        return of(graph, partition, 1.0);
    }

    public static double of(WeightedGraph graph, Partition partition, double resolution) {
        partition.checkCovers(graph);
        double links = graph.totalWeight();
        if (links == 0.0) throw new ValidationException("a graph without links has an undefined modularity");

        int k = partition.communityCount();
        double[] inc = new double[k];
        double[] deg = new double[k];
        for (int u = 0; u < graph.nodeCount(); u++) {
            int c = partition.communityOf(u);
            deg[c] += graph.weightedDegree(u);
            inc[c] += graph.selfLoopWeight(u);
            for (var nb : graph.neighbors(u)) {
                if (partition.communityOf(nb.node()) == c) inc[c] += nb.weight() / 2.0;
            }
        }
        double q = 0.0;
        for (int c = 0; c < k; c++) {
            double share = deg[c] / (2.0 * links);
            q += inc[c] / links - resolution * share * share;
        }
        return q;
    }
}
