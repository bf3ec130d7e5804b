package org.Aayush.pathfinding.ingest;

import lombok.AccessLevel;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.ToString;
import lombok.experimental.Accessors;

/**
 * Summary counters for one {@link IngestionGateway#applyBatch(java.util.List)} call.
 */
@Getter
@ToString
@RequiredArgsConstructor(access = AccessLevel.PACKAGE)
@Accessors(fluent = true)
public final class BatchApplyResult {
    /** Number of events that replaced graph state. */
    private final int applied;
    /** Number of fee updates ignored as stale. */
    private final int ignoredStale;
    /** Number of closes for channels that were not open. */
    private final int ignoredAbsent;
    /** Number of events rejected as malformed or out of order. */
    private final int rejected;

    /**
     * Total number of events processed.
     */
    public int total() {
        return applied + ignoredStale + ignoredAbsent + rejected;
    }
}
