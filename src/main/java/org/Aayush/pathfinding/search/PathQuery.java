package org.Aayush.pathfinding.search;

import org.Aayush.pathfinding.graph.Address;

import java.util.Objects;

/**
 * Normalized planner input.
 *
 * <p>Instances are created by the query facade after contract validation.</p>
 *
 * @param source paying node.
 * @param target receiving node, different from {@code source}.
 * @param value exact amount the target must receive.
 * @param maxPaths maximum number of distinct paths to return.
 * @param maxHops maximum number of channels per path.
 * @param maxExpansionsPerNode how many labels of one node may extend the frontier; dead-end labels are not counted.
 */
public record PathQuery(
        Address source,
        Address target,
        long value,
        int maxPaths,
        int maxHops,
        int maxExpansionsPerNode
) {
    public PathQuery {
        Objects.requireNonNull(source, "source");
        Objects.requireNonNull(target, "target");
        if (source.equals(target)) {
            throw new IllegalArgumentException("source and target must differ");
        }
        if (value <= 0) {
            throw new IllegalArgumentException("value must be > 0");
        }
        if (maxPaths <= 0) {
            throw new IllegalArgumentException("maxPaths must be > 0");
        }
        if (maxHops <= 0) {
            throw new IllegalArgumentException("maxHops must be > 0");
        }
        if (maxExpansionsPerNode <= 0) {
            throw new IllegalArgumentException("maxExpansionsPerNode must be > 0");
        }
    }
}
