package udem.communities.louvain;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import udem.communities.graph.core.GraphBuilder;
import udem.communities.graph.core.LevelGraph;
import udem.communities.graph.core.Partition;
import udem.communities.model.GraphSummary;
import udem.communities.model.ModelKind;
import udem.communities.model.QualityModels;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Local Search Phase Tests")
class LocalSearchPhaseTest {

    private static final double EPSILON = 1e-9;

    static LevelGraph twoTriangles() {
        return GraphBuilder.fromEdges(6, new int[][]{
                {0, 1}, {1, 2}, {0, 2}, {3, 4}, {4, 5}, {3, 5}, {2, 3}
        });
    }

    @Test
    @DisplayName("Every move improves the objective by its gain")
    void testMovesImprove() {
        for (var kind : ModelKind.values()) {
            var model = QualityModels.of(kind);
            double parameter = kind.defaultValue();
            var g = twoTriangles();
            var level = Level.singletons(g, GraphSummary.of(g));
            double[] last = {model.quality(level.statistics(), parameter)};
            List<Double> gains = new ArrayList<>();

            var result = new LocalSearchPhase(model, parameter, -1, 0.0, new Random(7))
                    .onMove((lvl, node, from, to, gain) -> {
                        double q = model.quality(lvl.statistics(), parameter);
                        assertTrue(gain > 0.0);
                        assertEquals(last[0] + gain, q, EPSILON, kind + " move of node " + node);
                        last[0] = q;
                        gains.add(gain);
                    })
                    .run(level);

            assertEquals(gains.size(), result.moves());
            assertEquals(last[0], result.quality(), EPSILON);
            assertTrue(result.localOptimum());
        }
    }

    @Test
    @DisplayName("Two triangles split along the bridge")
    void testTwoTriangles() {
        var g = twoTriangles();
        var level = Level.singletons(g, GraphSummary.of(g));
        var result = new LocalSearchPhase(QualityModels.of(ModelKind.DCPPM), 1.0, -1, 1e-7, null).run(level);

        assertTrue(result.moves() > 0);
        assertEquals(Partition.renumbered(new int[]{0, 0, 0, 1, 1, 1}), level.partition());
    }

    @Test
    @DisplayName("Pass limit ends the phase before a local optimum")
    void testPassLimit() {
        var g = twoTriangles();
        var level = Level.singletons(g, GraphSummary.of(g));
        var result = new LocalSearchPhase(QualityModels.of(ModelKind.DCPPM), 1.0, 1, 0.0, null).run(level);

        assertEquals(1, result.passes());
        assertFalse(result.localOptimum());
    }

    @Test
    @DisplayName("Already optimal partition makes no move")
    void testNoMove() {
        var g = twoTriangles();
        var level = Level.of(g, GraphSummary.of(g), Partition.renumbered(new int[]{0, 0, 0, 1, 1, 1}));
        var result = new LocalSearchPhase(QualityModels.of(ModelKind.DCPPM), 1.0, -1, 1e-7, null).run(level);

        assertEquals(0, result.moves());
        assertEquals(1, result.passes());
        assertTrue(result.localOptimum());
    }

    @Test
    @DisplayName("Statistics snapshot skips emptied communities")
    void testStatisticsSnapshot() {
        var g = twoTriangles();
        var level = Level.singletons(g, GraphSummary.of(g));
        new LocalSearchPhase(QualityModels.of(ModelKind.DCPPM), 1.0, -1, 1e-7, null).run(level);

        var stats = level.statistics();
        assertEquals(2, stats.communityCount());
        assertEquals(g.totalWeight(), stats.internalWeight() + stats.externalWeight(), EPSILON);
        assertEquals(14.0, stats.degree(0) + stats.degree(1), EPSILON);
    }
}
