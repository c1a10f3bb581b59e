package udem.communities.detection;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import udem.communities.graph.core.Partition;
import udem.communities.graph.core.WeightedGraph;
import udem.communities.model.CommunityStatistics;
import udem.communities.model.ParameterEstimate;
import udem.communities.model.QualityModel;

/**
 * Best model parameter for a fixed partition of one graph. Estimates are memoized per partition,
 * so a run that comes back to a partition does not call the minimizer again. Cache maintenance
 * runs on the calling thread.
 */
public final class ParameterEstimator {
    private static final Logger log = LoggerFactory.getLogger(ParameterEstimator.class);

    private final WeightedGraph graph;
    private final QualityModel model;
    private final Cache<Partition, ParameterEstimate> cache;

    public ParameterEstimator(WeightedGraph graph, QualityModel model, int cacheSize) {
        this.graph = graph;
        this.model = model;
        this.cache = Caffeine.newBuilder()
                .maximumSize(cacheSize)
                .executor(Runnable::run)
                .build();
    }

    public ParameterEstimate estimate(Partition partition) {
        partition.checkCovers(graph);
        return cache.get(partition, this::compute);
    }

    private ParameterEstimate compute(Partition partition) {
        var estimate = model.estimateParameter(CommunityStatistics.of(graph, partition));
        if (estimate.clamped()) {
            log.warn("{}: estimated {}={} is outside its domain, clamped to {}", model.kind().modelName(),
                    model.kind().parameterName(), estimate.rawValue(), estimate.value());
        }
        return estimate;
    }
}
