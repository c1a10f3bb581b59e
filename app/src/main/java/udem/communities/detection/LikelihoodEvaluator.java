package udem.communities.detection;

import udem.communities.graph.core.Partition;
import udem.communities.graph.core.WeightedGraph;
import udem.communities.model.CommunityStatistics;
import udem.communities.model.ModelParameter;
import udem.communities.model.QualityModel;
import udem.communities.model.QualityModels;

import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Log-likelihood of a partition, and ranking of independent runs by it.
 */
public final class LikelihoodEvaluator {

    private LikelihoodEvaluator() {
    }

    /**
     * 0 for a graph without edges, whatever the model.
     */
    public static double totalLogLikelihood(WeightedGraph graph, Partition partition, QualityModel model, double parameter) {
        partition.checkCovers(graph);
        if (graph.totalWeight() <= 0.0) return 0.0;
        return model.totalLogLikelihood(CommunityStatistics.of(graph, partition), parameter);
    }

    public static double totalLogLikelihood(WeightedGraph graph, Partition partition, ModelParameter parameter) {
        return totalLogLikelihood(graph, partition, QualityModels.of(parameter.kind()), parameter.value());
    }

    public static Optional<OptimizationResult> best(Collection<OptimizationResult> runs) {
        return runs.stream().max(Comparator.comparingDouble(OptimizationResult::logLikelihood));
    }

    /**
     * Highest log-likelihood first.
     */
    public static List<OptimizationResult> rank(Collection<OptimizationResult> runs) {
        return runs.stream()
                .sorted(Comparator.comparingDouble(OptimizationResult::logLikelihood).reversed())
                .toList();
    }
}
