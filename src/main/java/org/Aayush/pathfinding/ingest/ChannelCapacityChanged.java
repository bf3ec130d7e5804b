package org.Aayush.pathfinding.ingest;

import lombok.Builder;
import lombok.Value;
import org.Aayush.pathfinding.graph.Address;
import org.Aayush.pathfinding.graph.ChannelId;

/**
 * Deposit, withdraw or settled transfer: replaces the capacity {@code participant} can route
 * toward its partner.
 */
@Value
@Builder
public class ChannelCapacityChanged implements ChannelEvent {
    ChannelId channelId;
    Address participant;
    long newCapacity;

    @Override
    public Kind kind() {
        return Kind.CAPACITY_CHANGED;
    }
}
