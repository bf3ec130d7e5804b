package org.Aayush.pathfinding.core;

import it.unimi.dsi.fastutil.longs.LongList;
import lombok.Builder;
import lombok.Value;
import org.Aayush.pathfinding.graph.Address;

import java.util.List;

/**
 * One feasible path returned to the caller.
 */
@Value
@Builder
public class PathCandidate {
    /** Ordered node path from source to target. */
    List<Address> path;
    /** Amount the source adds on top of the requested value. */
    long estimatedFee;
    /** Fee charged at each node of {@link #path}; zero at source and target. */
    LongList hopFees;

    public int hops() {
        return path.size() - 1;
    }
}
