package udem.communities.graph.core;

import udem.communities.errors.ValidationException;

import java.util.*;

/**
 * Node to community mapping. Community ids are always {@code 0..communityCount()-1}.
 */
public final class Partition {
    private final int[] assignment;
    private final int communityCount;

    private Partition(int[] assignment, int communityCount) {
        this.assignment = assignment;
        this.communityCount = communityCount;
    }

    public static Partition singletons(int nodeCount) {
        int[] a = new int[nodeCount];
        for (int i = 0; i < nodeCount; i++) a[i] = i;
        return new Partition(a, nodeCount);
    }

    /**
     * Renumbers arbitrary non-negative labels in order of first appearance.
     */
    public static Partition renumbered(int[] labels) {
        int[] a = new int[labels.length];
        Map<Integer, Integer> ids = new HashMap<>();
        for (int i = 0; i < labels.length; i++) {
            if (labels[i] < 0) throw new ValidationException("node " + i + " has no community");
            Integer id = ids.get(labels[i]);
            if (id == null) {
                id = ids.size();
                ids.put(labels[i], id);
            }
            a[i] = id;
        }
        return new Partition(a, ids.size());
    }

    public int size() {
        return assignment.length;
    }

    public int communityCount() {
        return communityCount;
    }

    public int communityOf(int node) {
        return assignment[node];
    }

    public int[] toArray() {
        return assignment.clone();
    }

    /**
     * Members of each community, ascending.
     */
    public List<List<Integer>> communities() {
        List<List<Integer>> out = new ArrayList<>(communityCount);
        for (int c = 0; c < communityCount; c++) out.add(new ArrayList<>());
        for (int i = 0; i < assignment.length; i++) out.get(assignment[i]).add(i);
        return out;
    }

    /**
     * Maps each node through this partition then through {@code coarser}, whose nodes are this
     * partition's communities.
     */
    public Partition compose(Partition coarser) {
        if (coarser.size() != communityCount) {
            throw new ValidationException("cannot compose a partition of " + communityCount
                    + " communities with one over " + coarser.size() + " nodes");
        }
        int[] a = new int[assignment.length];
        for (int i = 0; i < a.length; i++) a[i] = coarser.assignment[assignment[i]];
        return renumbered(a);
    }

    public void checkCovers(WeightedGraph graph) {
        if (graph.nodeCount() != assignment.length) {
            throw new ValidationException("partition covers " + assignment.length
                    + " nodes but the graph has " + graph.nodeCount());
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Partition other)) return false;
        return Arrays.equals(assignment, other.assignment);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(assignment);
    }

    @Override
    public String toString() {
        return "Partition{communities=" + communityCount + ", " + Arrays.toString(assignment) + "}";
    }
}
