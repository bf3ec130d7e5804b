package org.Aayush.pathfinding.search;

import org.Aayush.pathfinding.graph.GraphView;

import java.util.List;

/**
 * Planner abstraction for fee-aware path queries.
 */
public interface PathPlanner {
    /**
     * Computes ranked feasible paths.
     *
     * @param graph consistent graph view, valid for the duration of the call.
     * @param query normalized query.
     * @return at most {@code query.maxPaths()} distinct paths by ascending fee, then hop count;
     * empty when nothing is feasible.
     */
    List<PlannedPath> plan(GraphView graph, PathQuery query);
}
