package org.Aayush.pathfinding.ingest;

import lombok.extern.slf4j.Slf4j;
import org.Aayush.pathfinding.graph.NetworkGraph;
import org.Aayush.pathfinding.graph.NetworkGraphException;

import java.util.List;
import java.util.Objects;

/**
 * Maps validated network events onto {@link NetworkGraph} mutations.
 * <p>
 * A rejected event never stops the stream: graph failures and malformed payloads are logged
 * with their reason code, counted and dropped.
 * </p>
 */
@Slf4j
public final class IngestionGateway {
    static final String REASON_INVALID_EVENT = "INGEST_INVALID_EVENT";

    private final NetworkGraph graph;

    public IngestionGateway(NetworkGraph graph) {
        this.graph = Objects.requireNonNull(graph, "graph");
    }

    /**
     * Applies one event.
     *
     * @param event event payload.
     * @return how the event affected the graph.
     */
    public IngestOutcome apply(ChannelEvent event) {
        Objects.requireNonNull(event, "event");
        try {
            IngestOutcome outcome = dispatch(event);
            if (outcome == IngestOutcome.IGNORED_STALE) {
                log.debug("Ignored stale {}", event);
            } else {
                log.debug("{} {}", outcome, event);
            }
            return outcome;
        } catch (NetworkGraphException ex) {
            log.warn("Rejected {} event ({}): {}", event.kind(), ex.getReasonCode(), ex.getMessage());
            return IngestOutcome.REJECTED;
        } catch (IllegalArgumentException | NullPointerException ex) {
            log.warn("Rejected {} event ({}): {}", event.kind(), REASON_INVALID_EVENT, ex.getMessage());
            return IngestOutcome.REJECTED;
        }
    }

    /**
     * Applies events in order and summarizes the outcomes.
     *
     * @param events events in delivery order.
     * @return outcome counters.
     */
    public BatchApplyResult applyBatch(List<? extends ChannelEvent> events) {
        Objects.requireNonNull(events, "events");
        int applied = 0;
        int ignoredStale = 0;
        int ignoredAbsent = 0;
        int rejected = 0;
        for (ChannelEvent event : events) {
            switch (apply(event)) {
                case APPLIED -> applied++;
                case IGNORED_STALE -> ignoredStale++;
                case IGNORED_ABSENT -> ignoredAbsent++;
                case REJECTED -> rejected++;
            }
        }
        return new BatchApplyResult(applied, ignoredStale, ignoredAbsent, rejected);
    }

    private IngestOutcome dispatch(ChannelEvent event) {
        return switch (event.kind()) {
            case CHANNEL_OPENED -> opened((ChannelOpened) event);
            case CAPACITY_CHANGED -> capacityChanged((ChannelCapacityChanged) event);
            case FEE_UPDATE -> feeUpdate((FeeUpdate) event);
            case CHANNEL_CLOSED -> closed((ChannelClosed) event);
            case REACHABILITY_CHANGED -> reachabilityChanged((ReachabilityChanged) event);
        };
    }

    private IngestOutcome opened(ChannelOpened event) {
        graph.openChannel(
                event.getChannelId(),
                event.getParticipantA(),
                event.getParticipantB(),
                0L,
                0L,
                event.getSettleTimeout()
        );
        return IngestOutcome.APPLIED;
    }

    private IngestOutcome capacityChanged(ChannelCapacityChanged event) {
        graph.updateCapacity(event.getChannelId(), event.getParticipant(), event.getNewCapacity());
        return IngestOutcome.APPLIED;
    }

    private IngestOutcome feeUpdate(FeeUpdate event) {
        boolean applied = graph.updateFeeSchedule(
                event.getChannelId(),
                event.getUpdatingParticipant(),
                event.toSchedule(),
                event.getTimestamp()
        );
        return applied ? IngestOutcome.APPLIED : IngestOutcome.IGNORED_STALE;
    }

    private IngestOutcome closed(ChannelClosed event) {
        return graph.closeChannel(event.getChannelId()) ? IngestOutcome.APPLIED : IngestOutcome.IGNORED_ABSENT;
    }

    private IngestOutcome reachabilityChanged(ReachabilityChanged event) {
        graph.setReachability(event.getAddress(), event.getStatus());
        return IngestOutcome.APPLIED;
    }
}
