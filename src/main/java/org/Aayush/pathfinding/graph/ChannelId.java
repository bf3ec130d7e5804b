package org.Aayush.pathfinding.graph;

/**
 * Channel identifier, unique per unordered participant pair within one token network.
 *
 * @param value non-negative channel number.
 */
public record ChannelId(long value) implements Comparable<ChannelId> {

    public ChannelId {
        if (value < 0) {
            throw new IllegalArgumentException("channel_id must be >= 0");
        }
    }

    public static ChannelId of(long value) {
        return new ChannelId(value);
    }

    @Override
    public int compareTo(ChannelId other) {
        return Long.compare(value, other.value);
    }

    @Override
    public String toString() {
        return "channel#" + value;
    }
}
