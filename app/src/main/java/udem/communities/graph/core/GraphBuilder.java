package udem.communities.graph.core;

import org.jgrapht.Graph;
import udem.communities.errors.ValidationException;

import java.util.*;

public class GraphBuilder {

    /**
     * Undirected JGraphT graph -> compact graph. Vertices are indexed in iteration order,
     * parallel edges are summed and loops become self-loop weight.
     */
    public static <V, E> LabeledGraph<V> fromJGraphT(Graph<V, E> g) {
        if (g.getType().isDirected()) {
            throw new ValidationException("directed graphs are not supported");
        }
        List<V> vertices = new ArrayList<>(g.vertexSet());
        Map<V, Integer> index = new HashMap<>();
        for (int i = 0; i < vertices.size(); i++) index.put(vertices.get(i), i);

        var b = LevelGraph.builder(vertices.size());
        for (var e : g.edgeSet()) {
            int u = index.get(g.getEdgeSource(e));
            int v = index.get(g.getEdgeTarget(e));
            b.addEdge(u, v, g.getEdgeWeight(e));
        }
        return new LabeledGraph<>(b.build(), List.copyOf(vertices), Map.copyOf(index));
    }

    /**
     * Unweighted edge list over {@code 0..nodeCount-1}.
     */
    public static LevelGraph fromEdges(int nodeCount, int[][] edges) {
        var b = LevelGraph.builder(nodeCount);
        for (int[] e : edges) b.addEdge(e[0], e[1], 1.0);
        return b.build();
    }
}
