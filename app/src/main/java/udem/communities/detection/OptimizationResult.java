package udem.communities.detection;

import udem.communities.graph.core.Partition;
import udem.communities.model.ModelParameter;

import java.util.List;

/**
 * Best (partition, parameter) pair seen during a run, by log-likelihood.
 */
public record OptimizationResult(
        Partition partition,
        ModelParameter parameter,
        double logLikelihood,
        boolean converged,
        DriverState finalState,
        int iterations,
        List<IterationRecord> history
) {
    public OptimizationResult {
        history = List.copyOf(history);
    }

    public int communityCount() {
        return partition.communityCount();
    }
}
