package org.Aayush.pathfinding.ingest;

import lombok.Builder;
import lombok.Value;
import org.Aayush.pathfinding.graph.ChannelId;

/**
 * A channel was closed or settled. May be observed more than once.
 */
@Value
@Builder
public class ChannelClosed implements ChannelEvent {
    ChannelId channelId;

    @Override
    public Kind kind() {
        return Kind.CHANNEL_CLOSED;
    }
}
