package udem.communities.detection;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import udem.communities.errors.ValidationException;
import udem.communities.graph.core.LevelGraph;
import udem.communities.graph.core.Partition;
import udem.communities.model.ModelKind;
import udem.communities.model.ModelParameter;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Likelihood Evaluator Tests")
class LikelihoodEvaluatorTest {

    private static OptimizationResult run(double ll) {
        return new OptimizationResult(Partition.singletons(2), ModelParameter.defaultFor(ModelKind.PPM), ll,
                true, DriverState.CONVERGED, 1, List.of());
    }

    @Test
    @DisplayName("Planted partition is more likely than singletons")
    void testPlantedBeatsSingletons() {
        var g = OptimizationDriverTest.plantedGraph();
        int[] labels = new int[20];
        for (int i = 10; i < 20; i++) labels[i] = 1;
        var planted = Partition.renumbered(labels);
        var singletons = Partition.singletons(20);
        for (var kind : ModelKind.values()) {
            var p = ModelParameter.defaultFor(kind);
            assertTrue(LikelihoodEvaluator.totalLogLikelihood(g, planted, p)
                    > LikelihoodEvaluator.totalLogLikelihood(g, singletons, p), kind.modelName());
        }
    }

    @Test
    @DisplayName("Graph without edges has zero log-likelihood")
    void testEdgeless() {
        var g = LevelGraph.builder(3).build();
        for (var kind : ModelKind.values()) {
            assertEquals(0.0, LikelihoodEvaluator.totalLogLikelihood(g, Partition.singletons(3),
                    ModelParameter.defaultFor(kind)));
        }
    }

    @Test
    @DisplayName("Partition of the wrong size is rejected")
    void testWrongSize() {
        var g = LevelGraph.builder(3).addEdge(0, 1, 1.0).build();
        assertThrows(ValidationException.class, () -> LikelihoodEvaluator.totalLogLikelihood(g,
                Partition.singletons(4), ModelParameter.defaultFor(ModelKind.DCPPM)));
    }

    @Test
    @DisplayName("Runs are ranked by log-likelihood")
    void testRanking() {
        var a = run(-10.0);
        var b = run(-3.0);
        var c = run(-7.5);
        assertEquals(b, LikelihoodEvaluator.best(List.of(a, b, c)).orElseThrow());
        assertEquals(List.of(b, c, a), LikelihoodEvaluator.rank(List.of(a, b, c)));
        assertTrue(LikelihoodEvaluator.best(List.of()).isEmpty());
    }
}
