package org.Aayush.pathfinding.search;

import it.unimi.dsi.fastutil.longs.LongArrayList;
import it.unimi.dsi.fastutil.longs.LongList;
import it.unimi.dsi.fastutil.longs.LongLists;
import org.Aayush.pathfinding.graph.Address;

import java.util.List;
import java.util.Objects;

/**
 * One feasible path with its backward-unrolled amounts.
 *
 * @param nodes ordered node path from source to target.
 * @param value amount the target receives.
 * @param sourceAmount amount that leaves the source.
 * @param hopFees fee charged at each node of {@code nodes}; zero for source and target.
 */
public record PlannedPath(
        List<Address> nodes,
        long value,
        long sourceAmount,
        LongList hopFees
) {
    public PlannedPath {
        nodes = List.copyOf(Objects.requireNonNull(nodes, "nodes"));
        hopFees = LongLists.unmodifiable(new LongArrayList(Objects.requireNonNull(hopFees, "hopFees")));
        if (nodes.size() < 2) {
            throw new IllegalArgumentException("path needs at least two nodes");
        }
        if (hopFees.size() != nodes.size()) {
            throw new IllegalArgumentException("one hop fee per node is required");
        }
    }

    /**
     * Total fee the source pays on top of {@link #value()}.
     */
    public long fee() {
        return sourceAmount - value;
    }

    /**
     * Number of channels on the path.
     */
    public int hops() {
        return nodes.size() - 1;
    }
}
