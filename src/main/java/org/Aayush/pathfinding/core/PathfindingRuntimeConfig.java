package org.Aayush.pathfinding.core;

import lombok.Builder;
import lombok.Value;

/**
 * Runtime limits applied to every path query.
 */
@Value
@Builder
public class PathfindingRuntimeConfig {

    /**
     * Upper bound for {@link PathRequest#getMaxPaths()}; larger requests are rejected.
     */
    int maxPathsPerRequest;

    /**
     * Number of paths returned when a request leaves {@code maxPaths} unset.
     */
    int defaultMaxPaths;

    /**
     * Longest path, in channels, the planner explores.
     */
    int maxPathHops;

    /**
     * Each node may extend the frontier from {@code maxPaths * labelsPerNodeFactor} labels per query.
     */
    int labelsPerNodeFactor;

    public static PathfindingRuntimeConfig defaults() {
        return PathfindingRuntimeConfig.builder()
                .maxPathsPerRequest(25)
                .defaultMaxPaths(3)
                .maxPathHops(16)
                .labelsPerNodeFactor(2)
                .build();
    }
}
