package org.Aayush.pathfinding.core;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import org.Aayush.pathfinding.graph.Address;

import java.util.List;

/**
 * Client-facing path response.
 *
 * <p>An empty {@code paths} list means no path satisfies the capacity and fee constraints.</p>
 */
@Value
@Builder
public class PathResponse {
    /** Request source echoed for traceability. */
    Address source;
    /** Request target echoed for traceability. */
    Address target;
    /** Request value echoed for traceability. */
    long value;
    /** Paths by ascending fee, then hop count. */
    @Singular
    List<PathCandidate> paths;

    public boolean isFeasible() {
        return !paths.isEmpty();
    }
}
