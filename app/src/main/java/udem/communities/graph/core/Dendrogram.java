package udem.communities.graph.core;

import udem.communities.errors.ValidationException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Partitions produced by successive aggregation levels, finest first.
 * Level 0 is over the original nodes, level k over the communities of level k-1.
 */
public final class Dendrogram {
    private final List<Partition> levels = new ArrayList<>();

    public void add(Partition partition) {
        if (!levels.isEmpty()) {
            int expected = levels.get(levels.size() - 1).communityCount();
            if (partition.size() != expected) {
                throw new ValidationException("level " + levels.size() + " must cover "
                        + expected + " communities, got " + partition.size());
            }
        }
        levels.add(partition);
    }

    public int levelCount() {
        return levels.size();
    }

    public List<Partition> levels() {
        return Collections.unmodifiableList(levels);
    }

    /**
     * Original nodes mapped to their community at {@code level}.
     */
    public Partition partitionAtLevel(int level) {
        if (level < 0 || level >= levels.size()) {
            throw new ValidationException("level " + level + " outside 0.." + (levels.size() - 1));
        }
        Partition p = levels.get(0);
        for (int i = 1; i <= level; i++) p = p.compose(levels.get(i));
        return p;
    }

    public Partition finalPartition() {
        return partitionAtLevel(levels.size() - 1);
    }
}
