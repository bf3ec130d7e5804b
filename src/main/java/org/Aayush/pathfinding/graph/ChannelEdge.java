package org.Aayush.pathfinding.graph;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;
import lombok.experimental.Accessors;
import org.Aayush.pathfinding.fee.FeeSchedule;

import java.time.Instant;
import java.util.Objects;

/**
 * One directional view of a channel, owned by {@code owner} and pointing at {@code peer}.
 * <p>
 * Instances are immutable. The graph publishes a replacement edge for every mutation, so
 * capacity and fee schedule of one direction always change together.
 * </p>
 */
@Getter
@ToString
@EqualsAndHashCode
@Accessors(fluent = true)
public final class ChannelEdge {
    /** Channel shared by both directions. */
    private final ChannelId channelId;
    /** Participant that owns and routes over this direction. */
    private final Address owner;
    /** Participant on the far end. */
    private final Address peer;
    /** Amount the owner can currently route toward the peer. */
    private final long capacity;
    /** Schedule declared by the owner for this direction. */
    private final FeeSchedule feeSchedule;
    /** Timestamp of the fee update currently applied, {@code null} before the first update. */
    private final Instant feeUpdatedAt;
    /** Settle timeout announced when the channel was opened. */
    private final long settleTimeout;

    private ChannelEdge(
            ChannelId channelId,
            Address owner,
            Address peer,
            long capacity,
            FeeSchedule feeSchedule,
            Instant feeUpdatedAt,
            long settleTimeout
    ) {
        this.channelId = Objects.requireNonNull(channelId, "channelId");
        this.owner = Objects.requireNonNull(owner, "owner");
        this.peer = Objects.requireNonNull(peer, "peer");
        this.feeSchedule = Objects.requireNonNull(feeSchedule, "feeSchedule");
        if (capacity < 0) {
            throw new IllegalArgumentException("capacity must be >= 0");
        }
        this.capacity = capacity;
        this.feeUpdatedAt = feeUpdatedAt;
        this.settleTimeout = settleTimeout;
    }

    /**
     * Creates a freshly opened direction with a zero-cost schedule.
     */
    static ChannelEdge opened(ChannelId channelId, Address owner, Address peer, long capacity, long settleTimeout) {
        return new ChannelEdge(channelId, owner, peer, capacity, FeeSchedule.ZERO, null, settleTimeout);
    }

    ChannelEdge withCapacity(long newCapacity) {
        return new ChannelEdge(channelId, owner, peer, newCapacity, feeSchedule, feeUpdatedAt, settleTimeout);
    }

    ChannelEdge withFeeSchedule(FeeSchedule schedule, Instant updatedAt) {
        return new ChannelEdge(channelId, owner, peer, capacity, schedule, updatedAt, settleTimeout);
    }
}
