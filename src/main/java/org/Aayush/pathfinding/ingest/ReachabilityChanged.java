package org.Aayush.pathfinding.ingest;

import lombok.Builder;
import lombok.Value;
import org.Aayush.pathfinding.graph.Address;
import org.Aayush.pathfinding.graph.AddressReachability;

/**
 * Presence change of a participant.
 */
@Value
@Builder
public class ReachabilityChanged implements ChannelEvent {
    Address address;
    AddressReachability status;

    @Override
    public Kind kind() {
        return Kind.REACHABILITY_CHANGED;
    }
}
