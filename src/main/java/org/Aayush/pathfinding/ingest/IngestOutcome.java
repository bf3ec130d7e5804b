package org.Aayush.pathfinding.ingest;

/**
 * Result of applying one event.
 */
public enum IngestOutcome {
    /** Graph state was replaced by the event. */
    APPLIED,
    /** Fee update not newer than the schedule already applied; graph unchanged. */
    IGNORED_STALE,
    /** Close of a channel that is not open; graph unchanged. */
    IGNORED_ABSENT,
    /** Malformed or out-of-order event; logged and dropped. */
    REJECTED
}
