package udem.communities.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import udem.communities.errors.OptimizationException;
import udem.communities.errors.ValidationException;
import udem.communities.graph.core.LevelGraph;
import udem.communities.graph.core.Partition;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Parameter Estimation Tests")
class ParameterEstimationTest {

    private static final double EPSILON = 1e-9;

    /**
     * Two complete blocks of ten nodes, node i of the first linked to node 10 + i of the second.
     */
    static LevelGraph plantedGraph() {
        var b = LevelGraph.builder(20);
        for (int block = 0; block < 2; block++) {
            int o = 10 * block;
            for (int i = 0; i < 10; i++) {
                for (int j = i + 1; j < 10; j++) b.addEdge(o + i, o + j, 1.0);
            }
        }
        for (int i = 0; i < 10; i++) b.addEdge(i, 10 + i, 1.0);
        return b.build();
    }

    static Partition plantedPartition() {
        int[] labels = new int[20];
        for (int i = 10; i < 20; i++) labels[i] = 1;
        return Partition.renumbered(labels);
    }

    static CommunityStatistics plantedStatistics() {
        return CommunityStatistics.of(plantedGraph(), plantedPartition());
    }

    @Test
    @DisplayName("PPM gamma from p_in = 1 and p_out = 0.1")
    void testPpmEstimate() {
        var estimate = QualityModels.of(ModelKind.PPM).estimateParameter(plantedStatistics());
        assertEquals(190 * 0.9 / (100 * Math.log(10)), estimate.value(), EPSILON);
        assertFalse(estimate.clamped());
    }

    @Test
    @DisplayName("DCPPM gamma from p_in = 1.8 and p_out = 0.2")
    void testDcppmEstimate() {
        var estimate = QualityModels.of(ModelKind.DCPPM).estimateParameter(plantedStatistics());
        assertEquals(1.6 / Math.log(9), estimate.value(), EPSILON);
    }

    @Test
    @DisplayName("ILFRs mu is the external weight share")
    void testIlfrsEstimate() {
        var estimate = QualityModels.of(ModelKind.ILFRS).estimateParameter(plantedStatistics());
        assertEquals(0.1, estimate.value(), EPSILON);
    }

    @Test
    @DisplayName("ILFR mu maximizes the log-likelihood")
    void testIlfrEstimate() {
        var model = QualityModels.of(ModelKind.ILFR);
        var stats = plantedStatistics();
        double mu = model.estimateParameter(stats).value();
        assertTrue(mu > 0.0 && mu < 1.0);
        double ll = model.totalLogLikelihood(stats, mu);
        assertTrue(ll >= model.totalLogLikelihood(stats, mu - 1e-3) - 1e-9);
        assertTrue(ll >= model.totalLogLikelihood(stats, mu + 1e-3) - 1e-9);
        assertTrue(ll >= model.totalLogLikelihood(stats, 0.1) - 1e-9);
    }

    @Test
    @DisplayName("Failing minimizer reports the external weight share")
    void testIlfrMinimizerFailure() {
        ScalarMinimizer failing = (f, lo, hi) -> {
            throw new OptimizationException("diverged", Double.NaN);
        };
        var model = QualityModels.of(ModelKind.ILFR, failing);
        var ex = assertThrows(OptimizationException.class, () -> model.estimateParameter(plantedStatistics()));
        assertEquals(0.1, ex.lastValidEstimate(), EPSILON);

        var nan = QualityModels.of(ModelKind.ILFR, (f, lo, hi) -> Double.NaN);
        assertThrows(OptimizationException.class, () -> nan.estimateParameter(plantedStatistics()));
    }

    @Test
    @DisplayName("Estimate outside the domain is clamped")
    void testClamping() {
        var g = LevelGraph.builder(2).addEdge(0, 1, 1.0).build();
        var stats = CommunityStatistics.of(g, Partition.renumbered(new int[]{0, 0}));
        var estimate = QualityModels.of(ModelKind.ILFRS).estimateParameter(stats);
        assertTrue(estimate.clamped());
        assertEquals(0.0, estimate.rawValue());
        assertEquals(ModelKind.DOMAIN_MARGIN, estimate.value(), 1e-15);
        assertThrows(OptimizationException.class, () -> ParameterEstimate.of(ModelKind.PPM, Double.NaN));
    }

    @Test
    @DisplayName("Estimation on a graph without edges is rejected")
    void testEdgeless() {
        var stats = CommunityStatistics.of(LevelGraph.builder(3).build(), Partition.singletons(3));
        for (var kind : ModelKind.values()) {
            assertThrows(ValidationException.class, () -> QualityModels.of(kind).estimateParameter(stats));
        }
    }

    @Test
    @DisplayName("Parameters are validated against the model domain")
    void testParameterDomain() {
        assertEquals(1.0, ModelParameter.of(ModelKind.PPM, Map.of()).value());
        assertEquals(0.5, ModelParameter.of(ModelKind.ILFR, null).value());
        assertEquals(0.3, ModelParameter.of(ModelKind.ILFRS, Map.of("mu", 0.3)).value());
        assertThrows(ValidationException.class, () -> ModelParameter.of(ModelKind.PPM, Map.of("gamma", 0.0)));
        assertThrows(ValidationException.class, () -> ModelParameter.of(ModelKind.ILFR, Map.of("mu", 1.0)));
        assertThrows(ValidationException.class, () -> ModelParameter.of(ModelKind.ILFR, Map.of("gamma", 1.0)));
        assertThrows(ValidationException.class, () -> ModelParameter.of(ModelKind.DCPPM, Map.of("beta", 1.0)));
        assertEquals("gamma=2.0", new ModelParameter(ModelKind.DCPPM, 2.0).toString());
    }
}
