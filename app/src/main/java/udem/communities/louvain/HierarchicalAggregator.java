package udem.communities.louvain;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import udem.communities.graph.core.Dendrogram;
import udem.communities.graph.core.LevelGraph;
import udem.communities.graph.core.Partition;
import udem.communities.model.GraphSummary;
import udem.communities.model.QualityModel;

import java.util.*;

/**
 * Multi-level optimization: local search on a level, fold its communities into the nodes of the
 * next level, repeat until a level brings no merge or no improvement above the tolerance.
 */
public final class HierarchicalAggregator {
    private static final Logger log = LoggerFactory.getLogger(HierarchicalAggregator.class);

    public record Result(Dendrogram dendrogram, double quality, boolean localOptimum) {

        public Partition partition() {
            return dendrogram.finalPartition();
        }
    }

    private final QualityModel model;
    private final double parameter;
    private final int maxPasses;
    private final double tolerance;
    private final Random random;

    public HierarchicalAggregator(QualityModel model, double parameter, int maxPasses, double tolerance, Random random) {
        this.model = model;
        this.parameter = parameter;
        this.maxPasses = maxPasses;
        this.tolerance = tolerance;
        this.random = random;
    }

    /**
     * Graph whose nodes are the communities of {@code partition}. Edges between communities sum
     * the crossing weights; intra-community edges and self-loops become the community's
     * self-loop, so the total weight is unchanged.
     */
    public static LevelGraph fold(LevelGraph graph, Partition partition) {
        partition.checkCovers(graph);
        int k = partition.communityCount();
        double[] loops = new double[k];
        int[] sizes = new int[k];
        List<Map<Integer, Double>> crossing = new ArrayList<>(k);
        for (int c = 0; c < k; c++) crossing.add(new TreeMap<>());

        for (int u = 0; u < graph.nodeCount(); u++) {
            int cu = partition.communityOf(u);
            loops[cu] += graph.selfLoopWeight(u);
            sizes[cu] += graph.nodeSize(u);
            for (var nb : graph.neighbors(u)) {
                if (nb.node() <= u) continue;
                int cv = partition.communityOf(nb.node());
                if (cu == cv) {
                    loops[cu] += nb.weight();
                } else {
                    crossing.get(Math.min(cu, cv)).merge(Math.max(cu, cv), nb.weight(), Double::sum);
                }
            }
        }

        var b = LevelGraph.builder(k);
        for (int c = 0; c < k; c++) {
            b.nodeSize(c, sizes[c]);
            if (loops[c] > 0.0) b.addEdge(c, c, loops[c]);
            int from = c;
            crossing.get(c).forEach((to, w) -> b.addEdge(from, to, w));
        }
        return b.build();
    }

    public Result run(LevelGraph graph) {
        return run(graph, null);
    }

    /**
     * @param initial starting partition of the first level, null for singletons
     */
    public Result run(LevelGraph graph, Partition initial) {
        var dendrogram = new Dendrogram();
        var summary = GraphSummary.of(graph);
        if (!graph.hasEdges()) {
            dendrogram.add(Partition.singletons(graph.nodeCount()));
            return new Result(dendrogram, 0.0, true);
        }

        var level = initial == null ? Level.singletons(graph, summary) : Level.of(graph, summary, initial);
        var phase = newPhase().run(level);
        boolean optimum = phase.localOptimum();
        double quality = phase.quality();
        Partition partition = level.partition();
        dendrogram.add(partition);
        log.debug("{}: level 0 -> {} communities, quality {}", model.kind().modelName(),
                partition.communityCount(), quality);
        LevelGraph current = fold(graph, partition);

        while (true) {
            level = Level.singletons(current, summary);
            phase = newPhase().run(level);
            if (phase.moves() == 0 || phase.quality() - quality < tolerance) break;
            optimum &= phase.localOptimum();
            quality = phase.quality();
            partition = level.partition();
            dendrogram.add(partition);
            log.debug("{}: level {} -> {} communities, quality {}", model.kind().modelName(),
                    dendrogram.levelCount() - 1, partition.communityCount(), quality);
            current = fold(current, partition);
        }
        return new Result(dendrogram, quality, optimum);
    }

    private LocalSearchPhase newPhase() {
        return new LocalSearchPhase(model, parameter, maxPasses, tolerance, random);
    }
}
