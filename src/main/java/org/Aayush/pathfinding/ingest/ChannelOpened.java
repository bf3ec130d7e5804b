package org.Aayush.pathfinding.ingest;

import lombok.Builder;
import lombok.Value;
import org.Aayush.pathfinding.graph.Address;
import org.Aayush.pathfinding.graph.ChannelId;

/**
 * A channel was opened on chain. Both capacities start at zero; deposits follow as
 * {@link ChannelCapacityChanged} events.
 */
@Value
@Builder
public class ChannelOpened implements ChannelEvent {
    ChannelId channelId;
    Address participantA;
    Address participantB;
    long settleTimeout;

    @Override
    public Kind kind() {
        return Kind.CHANNEL_OPENED;
    }
}
