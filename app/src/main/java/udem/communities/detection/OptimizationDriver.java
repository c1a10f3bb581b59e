package udem.communities.detection;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import udem.communities.errors.OptimizationException;
import udem.communities.graph.core.LevelGraph;
import udem.communities.graph.core.Partition;
import udem.communities.graph.core.WeightedGraph;
import udem.communities.louvain.HierarchicalAggregator;
import udem.communities.model.ModelParameter;
import udem.communities.model.QualityModel;
import udem.communities.model.QualityModels;

import java.util.*;

/**
 * Alternates between the best partition for the current parameter and the best parameter for
 * that partition, until the partition or the parameter stops changing.
 * <p>
 * The objective changes with the parameter, so the log-likelihood is not monotone across
 * iterations: the pair with the highest log-likelihood seen is returned, not the last one.
 * A driver is single-threaded; independent runs need independent drivers.
 */
public final class OptimizationDriver {
    private static final Logger log = LoggerFactory.getLogger(OptimizationDriver.class);

    private final QualityModel model;
    private final OptimizationOptions options;
    private DriverState state = DriverState.INITIALIZING;

    public OptimizationDriver(QualityModel model, OptimizationOptions options) {
        this.model = model;
        this.options = options;
    }

    public DriverState state() {
        return state;
    }

    public OptimizationResult run(WeightedGraph graph, ModelParameter initial) {
        return run(graph, initial, null);
    }

    /**
     * @param initialPartition starting partition of the first partition phase, null for singletons
     */
    public OptimizationResult run(WeightedGraph graph, ModelParameter initial, Partition initialPartition) {
        state = DriverState.INITIALIZING;
        if (initial.kind() != model.kind()) {
            throw new IllegalArgumentException("parameter of " + initial.kind() + " given to a " + model.kind() + " driver");
        }
        LevelGraph g = LevelGraph.copyOf(graph);
        if (initialPartition != null) initialPartition.checkCovers(g);
        if (!g.hasEdges()) {
            state = DriverState.CONVERGED;
            var singletons = Partition.singletons(g.nodeCount());
            log.info("{}: graph without edges, {} singleton communities", model.kind().modelName(), g.nodeCount());
            return new OptimizationResult(singletons, initial, 0.0, true, state, 0, List.of());
        }

        Random random = options.seed() == null ? null : new Random(options.seed());
        var estimator = new ParameterEstimator(g, model, options.estimateCacheSize());
        List<IterationRecord> history = new ArrayList<>();
        Set<Partition> seen = new HashSet<>();

        ModelParameter parameter = initial;
        Partition previous = null;
        Partition current = null;
        boolean phaseOptimum = true;
        OptimizationResult best = null;
        int iteration = 0;

        state = DriverState.PARTITION_PHASE;
        while (!state.isTerminal()) {
            switch (state) {
                case PARTITION_PHASE -> {
                    iteration++;
                    var aggregator = new HierarchicalAggregator(model, parameter.value(),
                            options.maxPasses(), options.tolerance(), random);
                    var levels = aggregator.run(g, iteration == 1 ? initialPartition : null);
                    current = levels.partition();
                    phaseOptimum = levels.localOptimum();
                    state = DriverState.PARAMETER_PHASE;
                }
                case PARAMETER_PHASE -> {
                    ModelParameter next;
                    boolean fallback = false;
                    try {
                        next = estimator.estimate(current).toParameter();
                    } catch (OptimizationException e) {
                        log.warn("{}: parameter estimation failed ({}), keeping {}",
                                model.kind().modelName(), e.getMessage(), parameter);
                        next = parameter;
                        fallback = true;
                    }
                    double ll = LikelihoodEvaluator.totalLogLikelihood(g, current, model, next.value());
                    history.add(new IterationRecord(iteration, current.communityCount(), next.value(), ll, fallback));
                    log.info("{}: iteration {} -> {} communities, {}, log-likelihood {}",
                            model.kind().modelName(), iteration, current.communityCount(), next, ll);
                    if (best == null || ll > best.logLikelihood()) {
                        best = new OptimizationResult(current, next, ll, false, state, iteration, List.of());
                    }

                    if (current.equals(previous)
                            || (!fallback && Math.abs(next.value() - parameter.value()) <= options.parameterTolerance())) {
                        state = DriverState.CONVERGED;
                    } else if (seen.contains(current)) {
                        log.warn("{}: partition of iteration {} repeats an earlier one, stopping",
                                model.kind().modelName(), iteration);
                        state = DriverState.EXHAUSTED;
                    } else if (iteration >= options.maxOuterIterations()) {
                        log.warn("{}: no fixed point after {} iterations", model.kind().modelName(), iteration);
                        state = DriverState.EXHAUSTED;
                    } else {
                        state = DriverState.PARTITION_PHASE;
                    }
                    seen.add(current);
                    previous = current;
                    parameter = next;
                }
                default -> throw new IllegalStateException("unexpected state " + state);
            }
        }

        boolean converged = state == DriverState.CONVERGED && phaseOptimum;
        log.info("{}: {} after {} iterations, best log-likelihood {} with {}",
                model.kind().modelName(), state, iteration, best.logLikelihood(), best.parameter());
        return new OptimizationResult(best.partition(), best.parameter(), best.logLikelihood(),
                converged, state, iteration, history);
    }

    public static OptimizationResult bestPartition(WeightedGraph graph, ModelParameter initial, OptimizationOptions options) {
        return new OptimizationDriver(QualityModels.of(initial.kind()), options).run(graph, initial);
    }
}
