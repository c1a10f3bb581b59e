package udem.communities.graph.core;

import udem.communities.errors.ValidationException;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Compact graph plus the caller's vertex labels.
 */
public record LabeledGraph<V>(LevelGraph graph, List<V> vertices, Map<V, Integer> index) {

    public Map<V, Integer> labels(Partition partition) {
        partition.checkCovers(graph);
        Map<V, Integer> out = new LinkedHashMap<>();
        for (int i = 0; i < vertices.size(); i++) out.put(vertices.get(i), partition.communityOf(i));
        return out;
    }

    public Partition partitionOf(Map<V, Integer> communities) {
        int[] labels = new int[vertices.size()];
        for (int i = 0; i < labels.length; i++) {
            Integer c = communities.get(vertices.get(i));
            if (c == null) throw new ValidationException("vertex " + vertices.get(i) + " has no community");
            labels[i] = c;
        }
        return Partition.renumbered(labels);
    }
}
