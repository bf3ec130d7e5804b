package org.Aayush.pathfinding.fee;

import java.util.Objects;

/**
 * Fee charged by one mediating hop, split into its sender and receiver parts.
 * <p>
 * Computation is backward: the amount the mediator must forward is known, the amount it must
 * receive is {@code amountOut + total()}. The sender part is charged on the forwarded amount,
 * the receiver part is inverted on top of it.
 * </p>
 *
 * @param senderFee fee from the mediator's schedule toward the next hop.
 * @param receiverFee fee from the mediator's schedule toward the previous hop.
 */
public record MediationFee(long senderFee, long receiverFee) {

    /** Canonical result for a hop whose fee cannot be determined. */
    public static final MediationFee UNDEFINED =
            new MediationFee(FeeSchedule.UNDEFINED_FEE, FeeSchedule.UNDEFINED_FEE);

    /**
     * Computes the mediation fee for forwarding {@code amountOut}.
     *
     * @param outgoing mediator's schedule on its edge toward the next hop.
     * @param outgoingCapacity mediator's capacity toward the next hop.
     * @param incoming mediator's schedule on its edge toward the previous hop.
     * @param incomingCapacity mediator's capacity toward the previous hop.
     * @param amountOut amount the mediator must forward.
     * @return fee split, or {@link #UNDEFINED} when either side is infeasible.
     */
    public static MediationFee backward(
            FeeSchedule outgoing,
            long outgoingCapacity,
            FeeSchedule incoming,
            long incomingCapacity,
            long amountOut
    ) {
        Objects.requireNonNull(outgoing, "outgoing");
        Objects.requireNonNull(incoming, "incoming");
        long senderFee = outgoing.senderFee(outgoingCapacity, amountOut);
        if (senderFee == FeeSchedule.UNDEFINED_FEE) {
            return UNDEFINED;
        }
        long receiverFee = incoming.receiverFee(incomingCapacity, amountOut + senderFee);
        if (receiverFee == FeeSchedule.UNDEFINED_FEE) {
            return UNDEFINED;
        }
        return new MediationFee(senderFee, receiverFee);
    }

    /**
     * Returns whether both fee parts are defined.
     */
    public boolean isDefined() {
        return senderFee != FeeSchedule.UNDEFINED_FEE && receiverFee != FeeSchedule.UNDEFINED_FEE;
    }

    /**
     * Combined fee of this hop.
     *
     * @throws IllegalStateException when the fee is undefined.
     */
    public long total() {
        if (!isDefined()) {
            throw new IllegalStateException("mediation fee is undefined");
        }
        return senderFee + receiverFee;
    }
}
