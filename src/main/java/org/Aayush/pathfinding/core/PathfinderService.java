package org.Aayush.pathfinding.core;

/**
 * Public path query contract.
 *
 * <p>Implementations perform deterministic input validation and throw
 * {@link PathfindingCoreException} for malformed queries.</p>
 */
public interface PathfinderService {
    /**
     * Finds up to {@code request.maxPaths} distinct feasible paths.
     *
     * @param request client path request.
     * @return ranked paths, empty when none is feasible.
     */
    PathResponse findPaths(PathRequest request);
}
