package udem.communities.model;

import udem.communities.graph.core.Partition;
import udem.communities.graph.core.WeightedGraph;

/**
 * Per-community sums every model formula is written in: degree, internal weight (self-loops
 * included, other edges once) and size in original nodes.
 */
public final class CommunityStatistics {
    private final GraphSummary summary;
    private final double[] degrees;
    private final double[] internals;
    private final int[] sizes;
    private final double internalWeight;

    public CommunityStatistics(GraphSummary summary, double[] degrees, double[] internals, int[] sizes) {
        this.summary = summary;
        this.degrees = degrees;
        this.internals = internals;
        this.sizes = sizes;
        double ein = 0.0;
        for (double w : internals) ein += w;
        this.internalWeight = ein;
    }

    public static CommunityStatistics of(WeightedGraph graph, Partition partition) {
        partition.checkCovers(graph);
        int k = partition.communityCount();
        double[] deg = new double[k];
        double[] in = new double[k];
        int[] size = new int[k];
        for (int u = 0; u < graph.nodeCount(); u++) {
            int c = partition.communityOf(u);
            deg[c] += graph.weightedDegree(u);
            in[c] += graph.selfLoopWeight(u);
            size[c]++;
            for (var nb : graph.neighbors(u)) {
                if (nb.node() > u && partition.communityOf(nb.node()) == c) in[c] += nb.weight();
            }
        }
        return new CommunityStatistics(GraphSummary.of(graph), deg, in, size);
    }

    public GraphSummary summary() {
        return summary;
    }

    public int communityCount() {
        return degrees.length;
    }

    public double degree(int community) {
        return degrees[community];
    }

    public double internal(int community) {
        return internals[community];
    }

    public int size(int community) {
        return sizes[community];
    }

    public double totalWeight() {
        return summary.totalWeight();
    }

    public double internalWeight() {
        return internalWeight;
    }

    public double externalWeight() {
        return Math.max(summary.totalWeight() - internalWeight, 0.0);
    }

    public double squaredDegreeSum() {
        double s = 0.0;
        for (double d : degrees) s += d * d;
        return s;
    }

    /**
     * Node pairs sharing a community, in original nodes.
     */
    public double internalPairs() {
        double p = 0.0;
        for (int s : sizes) p += s * (s - 1.0) / 2.0;
        return p;
    }
}
