package udem.communities.louvain;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import udem.communities.model.QualityModel;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;

/**
 * Greedy single-level node reassignment.
 * <p>
 * Each sweep visits every node, takes it out of its community and puts it back into the
 * neighboring community of strictly largest positive gain, or into its own community when no
 * gain is positive. Moves apply immediately. The phase stops after a sweep without moves, after
 * a sweep improving the objective by less than {@code tolerance}, or after {@code maxPasses}
 * sweeps ({@code -1} for no bound).
 */
public final class LocalSearchPhase {
    private static final Logger log = LoggerFactory.getLogger(LocalSearchPhase.class);

    @FunctionalInterface
    public interface MoveListener {
        void onMove(Level level, int node, int from, int to, double gain);
    }

    public record Result(int passes, int moves, boolean localOptimum, double quality) {
    }

    private final QualityModel model;
    private final double parameter;
    private final int maxPasses;
    private final double tolerance;
    private final Random random;
    private MoveListener listener = (level, node, from, to, gain) -> { };

    /**
     * @param random shuffles the sweep order before every sweep; null sweeps in node order
     */
    public LocalSearchPhase(QualityModel model, double parameter, int maxPasses, double tolerance, Random random) {
        this.model = model;
        this.parameter = parameter;
        this.maxPasses = maxPasses;
        this.tolerance = tolerance;
        this.random = random;
    }

    public LocalSearchPhase onMove(MoveListener listener) {
        this.listener = listener;
        return this;
    }

    public Result run(Level level) {
        int n = level.graph().nodeCount();
        List<Integer> order = new ArrayList<>(n);
        for (int i = 0; i < n; i++) order.add(i);

        double current = model.quality(level.statistics(), parameter);
        int passes = 0;
        int moves = 0;
        boolean modified = true;
        boolean stalled = false;
        while (modified && passes != maxPasses) {
            modified = false;
            passes++;
            if (random != null) Collections.shuffle(order, random);
            int passMoves = 0;
            for (int node : order) {
                if (sweepNode(level, node)) passMoves++;
            }
            moves += passMoves;
            modified = passMoves > 0;
            log.debug("{}: pass {} moved {} of {} nodes", model.kind().modelName(), passes, passMoves, n);
            if (modified) {
                double next = model.quality(level.statistics(), parameter);
                double improvement = next - current;
                current = next;
                if (improvement < tolerance) {
                    stalled = true;
                    break;
                }
            }
        }
        boolean optimum = !modified || stalled;
        if (!optimum) {
            log.warn("{}: local search stopped after {} passes before reaching a local optimum",
                    model.kind().modelName(), passes);
        }
        return new Result(passes, moves, optimum, current);
    }

    private boolean sweepNode(Level level, int node) {
        int own = level.communityOf(node);
        var neighbors = level.neighborCommunities(node);
        double weightToOwn = neighbors.getOrDefault(own, 0.0);
        double removeGain = model.removeGain(level, node, weightToOwn, parameter);
        level.remove(node, own, weightToOwn);

        int best = own;
        double bestGain = 0.0;
        for (var entry : neighbors.entrySet()) {
            int community = entry.getKey();
            if (community == own) continue;
            double gain = removeGain + model.insertGain(level, node, community, entry.getValue(), parameter);
            if (gain > bestGain) {
                bestGain = gain;
                best = community;
            }
        }
        level.insert(node, best, neighbors.getOrDefault(best, 0.0));
        if (best == own) return false;
        listener.onMove(level, node, own, best, bestGain);
        return true;
    }
}
