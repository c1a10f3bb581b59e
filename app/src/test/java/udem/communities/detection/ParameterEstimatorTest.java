package udem.communities.detection;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import udem.communities.graph.core.Partition;
import udem.communities.model.ModelKind;
import udem.communities.model.QualityModels;

import java.util.HashSet;
import java.util.Set;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Parameter Estimator Tests")
class ParameterEstimatorTest {

    @Test
    @DisplayName("Estimate is computed once per partition")
    void testMemoized() {
        var calls = new AtomicInteger();
        var model = QualityModels.of(ModelKind.ILFR, (f, lo, hi) -> {
            calls.incrementAndGet();
            return 0.1;
        });
        var estimator = new ParameterEstimator(OptimizationDriverTest.plantedGraph(), model, 16);
        int[] labels = new int[20];
        for (int i = 10; i < 20; i++) labels[i] = 1;

        var first = estimator.estimate(Partition.renumbered(labels));
        var second = estimator.estimate(Partition.renumbered(labels));

        assertEquals(first, second);
        assertEquals(1, calls.get());
        assertEquals(0.1, first.value(), 1e-12);
    }

    @Test
    @DisplayName("Zero-sized cache evicts at once, on the calling thread")
    void testNoCache() {
        var calls = new AtomicInteger();
        var threads = new HashSet<Thread>();
        var model = QualityModels.of(ModelKind.ILFR, (f, lo, hi) -> {
            calls.incrementAndGet();
            threads.add(Thread.currentThread());
            return 0.1;
        });
        var estimator = new ParameterEstimator(OptimizationDriverTest.plantedGraph(), model, 0);
        int[] labels = new int[20];
        for (int i = 10; i < 20; i++) labels[i] = 1;

        estimator.estimate(Partition.renumbered(labels));
        estimator.estimate(Partition.renumbered(labels));

        assertEquals(2, calls.get());
        assertEquals(Set.of(Thread.currentThread()), threads);
    }
}
