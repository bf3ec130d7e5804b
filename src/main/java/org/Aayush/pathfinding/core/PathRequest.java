package org.Aayush.pathfinding.core;

import lombok.Builder;
import lombok.Value;
import org.Aayush.pathfinding.graph.Address;

/**
 * Client-facing path query.
 */
@Value
@Builder
public class PathRequest {
    /** Paying participant. */
    Address source;
    /** Receiving participant. */
    Address target;
    /** Exact amount the target must receive. */
    long value;
    /** Maximum number of distinct paths; {@code null} selects the configured default. */
    Integer maxPaths;
}
