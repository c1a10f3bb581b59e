package udem.communities.graph.core;

import udem.communities.errors.ValidationException;

import java.util.*;

/**
 * Immutable compact graph used at every aggregation level.
 * Each node also carries the number of original nodes it stands for.
 */
public final class LevelGraph implements WeightedGraph {
    private final List<List<Neighbor>> adjacency;
    private final double[] loops;
    private final double[] degrees;
    private final int[] sizes;
    private final double totalWeight;

    private LevelGraph(List<List<Neighbor>> adjacency, double[] loops, int[] sizes) {
        this.adjacency = adjacency;
        this.loops = loops;
        this.sizes = sizes;
        this.degrees = new double[loops.length];
        double edges = 0.0;
        double selfLoops = 0.0;
        for (int u = 0; u < loops.length; u++) {
            double d = 2.0 * loops[u];
            for (var nb : adjacency.get(u)) {
                d += nb.weight();
                if (nb.node() > u) edges += nb.weight();
            }
            degrees[u] = d;
            selfLoops += loops[u];
        }
        this.totalWeight = edges + selfLoops;
    }

    public static Builder builder(int nodeCount) {
        return new Builder(nodeCount);
    }

    /**
     * Copies any graph honouring the {@link WeightedGraph} contract; every node stands for itself.
     */
    public static LevelGraph copyOf(WeightedGraph graph) {
        if (graph instanceof LevelGraph lg) return lg;
        var b = builder(graph.nodeCount());
        for (int u = 0; u < graph.nodeCount(); u++) {
            double loop = graph.selfLoopWeight(u);
            if (loop != 0.0) b.addEdge(u, u, loop);
            for (var nb : graph.neighbors(u)) {
                if (nb.node() > u) b.addEdge(u, nb.node(), nb.weight());
            }
        }
        return b.build();
    }

    @Override
    public int nodeCount() {
        return loops.length;
    }

    @Override
    public List<Neighbor> neighbors(int node) {
        return adjacency.get(node);
    }

    @Override
    public double selfLoopWeight(int node) {
        return loops[node];
    }

    @Override
    public double weightedDegree(int node) {
        return degrees[node];
    }

    @Override
    public double totalWeight() {
        return totalWeight;
    }

    public int nodeSize(int node) {
        return sizes[node];
    }

    public int originalNodeCount() {
        int n = 0;
        for (int s : sizes) n += s;
        return n;
    }

    public boolean hasEdges() {
        return totalWeight > 0.0;
    }

    @Override
    public String toString() {
        return "LevelGraph{nodes=" + nodeCount() + ", totalWeight=" + totalWeight + "}";
    }

    public static final class Builder {
        private final List<Map<Integer, Double>> edges;
        private final double[] loops;
        private final int[] sizes;

        private Builder(int nodeCount) {
            if (nodeCount < 0) throw new ValidationException("negative node count: " + nodeCount);
            this.edges = new ArrayList<>(nodeCount);
            for (int i = 0; i < nodeCount; i++) edges.add(new LinkedHashMap<>());
            this.loops = new double[nodeCount];
            this.sizes = new int[nodeCount];
            Arrays.fill(sizes, 1);
        }

        /**
         * Adds an undirected edge; parallel edges are summed, {@code u == v} adds to the self-loop.
         * A zero-weight edge carries no link and is skipped.
         */
        public Builder addEdge(int u, int v, double weight) {
            checkNode(u);
            checkNode(v);
            if (!Double.isFinite(weight) || weight < 0.0) {
                throw new ValidationException("edge " + u + "-" + v + " has an invalid weight: " + weight);
            }
            if (weight == 0.0) return this;
            if (u == v) {
                loops[u] += weight;
            } else {
                edges.get(u).merge(v, weight, Double::sum);
                edges.get(v).merge(u, weight, Double::sum);
            }
            return this;
        }

        public Builder nodeSize(int node, int size) {
            checkNode(node);
            if (size < 1) throw new ValidationException("node " + node + " must stand for at least one node");
            sizes[node] = size;
            return this;
        }

        public LevelGraph build() {
            List<List<Neighbor>> adjacency = new ArrayList<>(edges.size());
            for (var m : edges) {
                List<Neighbor> list = new ArrayList<>(m.size());
                m.forEach((v, w) -> list.add(new Neighbor(v, w)));
                adjacency.add(Collections.unmodifiableList(list));
            }
            return new LevelGraph(Collections.unmodifiableList(adjacency), loops.clone(), sizes.clone());
        }

        private void checkNode(int node) {
            if (node < 0 || node >= loops.length) {
                throw new ValidationException("node " + node + " outside 0.." + (loops.length - 1));
            }
        }
    }
}
