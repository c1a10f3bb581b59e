package udem.communities.louvain;

import udem.communities.graph.core.LevelGraph;
import udem.communities.graph.core.Partition;
import udem.communities.model.CommunityStatistics;
import udem.communities.model.CommunityView;
import udem.communities.model.GraphSummary;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Mutable community state of one aggregation level. Owned by the local search working on it;
 * aggregates are updated per move in O(degree) and never rebuilt.
 */
public final class Level implements CommunityView {
    private final LevelGraph graph;
    private final GraphSummary summary;
    private final int[] node2com;
    private final double[] comDegree;
    private final double[] comInternal;
    private final int[] comSize;

    private Level(LevelGraph graph, GraphSummary summary, int[] node2com) {
        int n = graph.nodeCount();
        this.graph = graph;
        this.summary = summary;
        this.node2com = node2com;
        this.comDegree = new double[n];
        this.comInternal = new double[n];
        this.comSize = new int[n];
        for (int u = 0; u < n; u++) {
            int c = node2com[u];
            comDegree[c] += graph.weightedDegree(u);
            comInternal[c] += graph.selfLoopWeight(u);
            comSize[c] += graph.nodeSize(u);
            for (var nb : graph.neighbors(u)) {
                if (nb.node() > u && node2com[nb.node()] == c) comInternal[c] += nb.weight();
            }
        }
    }

    public static Level singletons(LevelGraph graph, GraphSummary summary) {
        return new Level(graph, summary, Partition.singletons(graph.nodeCount()).toArray());
    }

    public static Level of(LevelGraph graph, GraphSummary summary, Partition initial) {
        initial.checkCovers(graph);
        return new Level(graph, summary, initial.toArray());
    }

    public LevelGraph graph() {
        return graph;
    }

    /**
     * Weights from {@code node} to each neighboring community, in neighbor order; self-loops excluded.
     */
    public Map<Integer, Double> neighborCommunities(int node) {
        Map<Integer, Double> weights = new LinkedHashMap<>();
        for (var nb : graph.neighbors(node)) {
            weights.merge(node2com[nb.node()], nb.weight(), Double::sum);
        }
        return weights;
    }

    void remove(int node, int community, double weightToCommunity) {
        comDegree[community] -= graph.weightedDegree(node);
        comInternal[community] -= weightToCommunity + graph.selfLoopWeight(node);
        comSize[community] -= graph.nodeSize(node);
        node2com[node] = -1;
    }

    void insert(int node, int community, double weightToCommunity) {
        node2com[node] = community;
        comDegree[community] += graph.weightedDegree(node);
        comInternal[community] += weightToCommunity + graph.selfLoopWeight(node);
        comSize[community] += graph.nodeSize(node);
    }

    public Partition partition() {
        return Partition.renumbered(node2com);
    }

    /**
     * Snapshot over the non-empty communities.
     */
    public CommunityStatistics statistics() {
        int n = graph.nodeCount();
        double[] deg = new double[n];
        double[] in = new double[n];
        int[] size = new int[n];
        int k = 0;
        for (int c = 0; c < n; c++) {
            if (comSize[c] == 0) continue;
            deg[k] = comDegree[c];
            in[k] = comInternal[c];
            size[k] = comSize[c];
            k++;
        }
        return new CommunityStatistics(summary, Arrays.copyOf(deg, k), Arrays.copyOf(in, k), Arrays.copyOf(size, k));
    }

    @Override
    public GraphSummary summary() {
        return summary;
    }

    @Override
    public int communityOf(int node) {
        return node2com[node];
    }

    @Override
    public double nodeDegree(int node) {
        return graph.weightedDegree(node);
    }

    @Override
    public double nodeSelfLoop(int node) {
        return graph.selfLoopWeight(node);
    }

    @Override
    public int nodeSize(int node) {
        return graph.nodeSize(node);
    }

    @Override
    public double communityDegree(int community) {
        return comDegree[community];
    }

    @Override
    public double communityInternal(int community) {
        return comInternal[community];
    }

    @Override
    public int communitySize(int community) {
        return comSize[community];
    }

    @Override
    public double linkWeight(int node, int community) {
        double w = 0.0;
        for (var nb : graph.neighbors(node)) {
            if (node2com[nb.node()] == community) w += nb.weight();
        }
        return w;
    }
}
