package udem.communities.louvain;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import udem.communities.graph.core.LevelGraph;
import udem.communities.graph.core.Modularity;
import udem.communities.graph.core.Partition;
import udem.communities.model.ModelKind;
import udem.communities.model.QualityModels;

import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Hierarchical Aggregator Tests")
class HierarchicalAggregatorTest {

    private static final double EPSILON = 1e-12;

    /**
     * Four triangles in a ring, neighboring triangles joined by one edge.
     */
    static LevelGraph ringOfTriangles() {
        var b = LevelGraph.builder(12);
        for (int t = 0; t < 4; t++) {
            int o = 3 * t;
            b.addEdge(o, o + 1, 1.0).addEdge(o + 1, o + 2, 1.0).addEdge(o, o + 2, 1.0);
            b.addEdge(o + 2, (o + 3) % 12, 1.0);
        }
        return b.build();
    }

    @Test
    @DisplayName("Folding keeps the total weight and the node sizes")
    void testFold() {
        var g = LevelGraph.builder(4)
                .addEdge(0, 1, 2.0).addEdge(1, 2, 3.0).addEdge(2, 3, 1.0)
                .addEdge(0, 0, 1.0)
                .build();
        var folded = HierarchicalAggregator.fold(g, Partition.renumbered(new int[]{0, 0, 1, 1}));

        assertEquals(2, folded.nodeCount());
        assertEquals(g.totalWeight(), folded.totalWeight(), EPSILON);
        assertEquals(3.0, folded.selfLoopWeight(0), EPSILON);
        assertEquals(1.0, folded.selfLoopWeight(1), EPSILON);
        assertEquals(3.0, folded.neighbors(0).get(0).weight(), EPSILON);
        assertEquals(9.0, folded.weightedDegree(0), EPSILON);
        assertEquals(2, folded.nodeSize(0));
        assertEquals(4, folded.originalNodeCount());
    }

    @Test
    @DisplayName("Folding twice keeps the total weight")
    void testFoldTwice() {
        var g = ringOfTriangles();
        var first = HierarchicalAggregator.fold(g, Partition.renumbered(new int[]{0, 0, 0, 1, 1, 1, 2, 2, 2, 3, 3, 3}));
        var second = HierarchicalAggregator.fold(first, Partition.renumbered(new int[]{0, 0, 1, 1}));
        assertEquals(16.0, first.totalWeight(), EPSILON);
        assertEquals(16.0, second.totalWeight(), EPSILON);
        assertEquals(6, second.nodeSize(0));
    }

    @Test
    @DisplayName("Modularity of a folded partition is unchanged")
    void testFoldPreservesModularity() {
        var g = ringOfTriangles();
        var fine = Partition.renumbered(new int[]{0, 0, 0, 1, 1, 1, 2, 2, 2, 3, 3, 3});
        var folded = HierarchicalAggregator.fold(g, fine);
        assertEquals(Modularity.of(g, fine), Modularity.of(folded, Partition.singletons(4)), EPSILON);
    }

    @Test
    @DisplayName("Ring of triangles is split into its triangles")
    void testRingOfTriangles() {
        var g = ringOfTriangles();
        var result = new HierarchicalAggregator(QualityModels.of(ModelKind.DCPPM), 1.0, -1, 1e-7, null).run(g);

        var partition = result.partition();
        assertEquals(4, partition.communityCount());
        for (int t = 0; t < 4; t++) {
            assertEquals(partition.communityOf(3 * t), partition.communityOf(3 * t + 1));
            assertEquals(partition.communityOf(3 * t), partition.communityOf(3 * t + 2));
        }
        assertEquals(Modularity.of(g, partition), result.quality(), 1e-9);
        assertTrue(result.localOptimum());
    }

    @Test
    @DisplayName("Every dendrogram level is a coarsening of the previous one")
    void testDendrogramLevels() {
        var g = ringOfTriangles();
        var result = new HierarchicalAggregator(QualityModels.of(ModelKind.DCPPM), 0.3, -1, 1e-7, new Random(3)).run(g);
        var d = result.dendrogram();

        assertTrue(d.levelCount() >= 1);
        double previous = Double.NEGATIVE_INFINITY;
        for (int k = 0; k < d.levelCount(); k++) {
            var p = d.partitionAtLevel(k);
            assertEquals(12, p.size());
            double q = Modularity.of(g, p, 0.3);
            assertTrue(q > previous);
            previous = q;
        }
        assertEquals(result.quality(), previous, 1e-9);
    }

    @Test
    @DisplayName("Graph without edges stays in singletons")
    void testEdgeless() {
        var result = new HierarchicalAggregator(QualityModels.of(ModelKind.PPM), 1.0, -1, 1e-7, null)
                .run(LevelGraph.builder(5).build());
        assertEquals(Partition.singletons(5), result.partition());
        assertEquals(1, result.dendrogram().levelCount());
    }

    @Test
    @DisplayName("Initial partition seeds the first level")
    void testInitialPartition() {
        var g = ringOfTriangles();
        var initial = Partition.renumbered(new int[]{0, 0, 0, 1, 1, 1, 2, 2, 2, 3, 3, 3});
        var result = new HierarchicalAggregator(QualityModels.of(ModelKind.DCPPM), 1.0, -1, 1e-7, null)
                .run(g, initial);
        assertEquals(Modularity.of(g, result.partition()), result.quality(), 1e-9);
        assertTrue(result.quality() >= Modularity.of(g, initial) - 1e-12);
    }
}
