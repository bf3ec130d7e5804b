package org.Aayush.pathfinding.graph;

/**
 * Liveness of a participant as reported by the transport side.
 */
public enum AddressReachability {
    /** Participant is known to be online. */
    REACHABLE,
    /** Participant is known to be offline. */
    UNREACHABLE,
    /** No presence information has been received. */
    UNKNOWN
}
