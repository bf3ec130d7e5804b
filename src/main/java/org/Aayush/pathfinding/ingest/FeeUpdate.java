package org.Aayush.pathfinding.ingest;

import lombok.Builder;
import lombok.Value;
import org.Aayush.pathfinding.fee.FeeSchedule;
import org.Aayush.pathfinding.fee.ImbalancePenalty;
import org.Aayush.pathfinding.graph.Address;
import org.Aayush.pathfinding.graph.ChannelId;

import java.time.Instant;
import java.util.List;

/**
 * Fee schedule announced by {@code updatingParticipant} for its own direction of a channel.
 */
@Value
@Builder
public class FeeUpdate implements ChannelEvent {
    ChannelId channelId;
    Address updatingParticipant;
    long flat;
    long proportional;

    /**
     * Optional imbalance table; {@code null} or empty means no imbalance penalty.
     */
    List<ImbalancePenalty.Breakpoint> imbalancePenalty;

    /**
     * Sender-side creation time, used for stale-update suppression.
     */
    Instant timestamp;

    /**
     * Builds the schedule carried by this update.
     *
     * @throws IllegalArgumentException when the fee values or the table are invalid.
     */
    public FeeSchedule toSchedule() {
        ImbalancePenalty penalty = imbalancePenalty == null || imbalancePenalty.isEmpty()
                ? null
                : ImbalancePenalty.of(imbalancePenalty);
        return FeeSchedule.of(flat, proportional, penalty);
    }

    @Override
    public Kind kind() {
        return Kind.FEE_UPDATE;
    }
}
