package org.Aayush.pathfinding.ingest;

/**
 * Validated, deserialized network event delivered by the transport side.
 */
public interface ChannelEvent {

    /**
     * Event discriminator used by {@link IngestionGateway} for dispatch.
     */
    enum Kind {
        CHANNEL_OPENED,
        CAPACITY_CHANGED,
        FEE_UPDATE,
        CHANNEL_CLOSED,
        REACHABILITY_CHANGED
    }

    Kind kind();
}
