package udem.communities.detection;

import org.jgrapht.Graph;
import udem.communities.graph.core.*;
import udem.communities.louvain.HierarchicalAggregator;
import udem.communities.model.*;

import java.util.Map;
import java.util.Random;

/**
 * Entry points. Models are named {@code ppm}, {@code dcppm}, {@code ilfr} or {@code ilfrs};
 * parameters are given as {@code {"gamma": x}} or {@code {"mu": x}}, empty for the model default.
 */
public class CommunityDetectionService {

    public record LabeledResult<V>(Map<V, Integer> communities, OptimizationResult result) {
    }

    /**
     * Alternating partition/parameter optimization from all-singleton communities.
     */
    public static OptimizationResult bestPartition(WeightedGraph graph, String model,
                                                   Map<String, Double> initialParameters,
                                                   OptimizationOptions options) {
        var kind = ModelKind.fromName(model);
        var parameter = ModelParameter.of(kind, initialParameters);
        return new OptimizationDriver(QualityModels.of(kind), options).run(graph, parameter);
    }

    public static <V, E> LabeledResult<V> bestPartition(Graph<V, E> graph, String model,
                                                        Map<String, Double> initialParameters,
                                                        OptimizationOptions options) {
        var kind = ModelKind.fromName(model);
        var parameter = ModelParameter.of(kind, initialParameters);
        var labeled = GraphBuilder.fromJGraphT(graph);
        var result = new OptimizationDriver(QualityModels.of(kind), options).run(labeled.graph(), parameter);
        return new LabeledResult<>(labeled.labels(result.partition()), result);
    }

    /**
     * Every aggregation level of one partition phase at a fixed parameter.
     */
    public static Dendrogram generateDendrogram(WeightedGraph graph, String model,
                                                Map<String, Double> parameters,
                                                OptimizationOptions options) {
        var kind = ModelKind.fromName(model);
        var parameter = ModelParameter.of(kind, parameters);
        var random = options.seed() == null ? null : new Random(options.seed());
        return new HierarchicalAggregator(QualityModels.of(kind), parameter.value(),
                options.maxPasses(), options.tolerance(), random)
                .run(LevelGraph.copyOf(graph))
                .dendrogram();
    }

    /**
     * Without parameters, ILFR and ILFRs are scored at the mu estimated from {@code partition};
     * PPM and DCPPM report the profile log-likelihood, which gamma does not enter.
     */
    public static double totalLogLikelihood(WeightedGraph graph, Partition partition, String model,
                                            Map<String, Double> parameters) {
        var kind = ModelKind.fromName(model);
        boolean estimate = (parameters == null || parameters.isEmpty())
                && !kind.isResolutionModel() && graph.totalWeight() > 0.0;
        var parameter = estimate
                ? estimateParameter(graph, partition, model).toParameter()
                : ModelParameter.of(kind, parameters);
        return LikelihoodEvaluator.totalLogLikelihood(graph, partition, parameter);
    }

    public static ParameterEstimate estimateParameter(WeightedGraph graph, Partition partition, String model) {
        var kind = ModelKind.fromName(model);
        partition.checkCovers(graph);
        return QualityModels.of(kind).estimateParameter(CommunityStatistics.of(graph, partition));
    }
}
