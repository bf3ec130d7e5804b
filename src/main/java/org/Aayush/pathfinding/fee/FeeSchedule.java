package org.Aayush.pathfinding.fee;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;
import lombok.experimental.Accessors;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Per-direction mediation fee schedule declared by the owner of a channel edge.
 * <p>
 * A schedule has three components:
 * </p>
 * <ul>
 * <li>{@code flat}: absolute fee per use.</li>
 * <li>{@code proportional}: parts-per-million of the amount crossing the edge.</li>
 * <li>{@code imbalancePenalty}: optional piecewise-linear table, {@code null} means zero everywhere.</li>
 * </ul>
 * <p>
 * A mediator charges its outgoing schedule as sender ({@link #senderFee(long, long)}) and the
 * schedule of its edge back toward the previous hop as receiver ({@link #receiverFee(long, long)}).
 * All rounding is half-to-even. Fee evaluation never throws for infeasible amounts; it returns
 * {@link #UNDEFINED_FEE} instead.
 * </p>
 */
@Getter
@ToString
@EqualsAndHashCode
@Accessors(fluent = true)
public final class FeeSchedule {

    /** Sentinel for a fee that cannot be computed (balance outside the imbalance table). */
    public static final long UNDEFINED_FEE = Long.MIN_VALUE;

    /** Proportional rates are expressed in parts-per-million. */
    public static final long PPM = 1_000_000L;

    /** Zero-cost schedule assigned to freshly opened channels. */
    public static final FeeSchedule ZERO = new FeeSchedule(0L, 0L, null);

    /** Absolute fee per use. */
    private final long flat;
    /** Proportional rate in ppm, {@code [0, 1_000_000)}. */
    private final long proportional;
    /** Optional imbalance table, {@code null} when absent. */
    private final ImbalancePenalty imbalancePenalty;

    private FeeSchedule(long flat, long proportional, ImbalancePenalty imbalancePenalty) {
        if (proportional < 0 || proportional >= PPM) {
            throw new IllegalArgumentException("proportional must be within [0, 1000000), got " + proportional);
        }
        this.flat = flat;
        this.proportional = proportional;
        this.imbalancePenalty = imbalancePenalty;
    }

    /**
     * Creates a schedule.
     *
     * @param flat absolute fee per use.
     * @param proportional ppm rate in {@code [0, 1_000_000)}.
     * @param imbalancePenalty optional table ({@code null} for none).
     * @return immutable schedule.
     */
    public static FeeSchedule of(long flat, long proportional, ImbalancePenalty imbalancePenalty) {
        if (flat == 0L && proportional == 0L && imbalancePenalty == null) {
            return ZERO;
        }
        return new FeeSchedule(flat, proportional, imbalancePenalty);
    }

    /**
     * Creates a schedule without imbalance penalty.
     */
    public static FeeSchedule of(long flat, long proportional) {
        return of(flat, proportional, null);
    }

    /**
     * Returns whether this schedule charges nothing under any balance.
     */
    public boolean isZero() {
        return flat == 0L && proportional == 0L && imbalancePenalty == null;
    }

    /**
     * Fee charged by an owner for sending {@code amount} over its own edge.
     *
     * @param ownCapacity owner's capacity on this edge before the transfer.
     * @param amount amount leaving the owner.
     * @return fee, or {@link #UNDEFINED_FEE} when the imbalance table does not cover the move.
     */
    public long senderFee(long ownCapacity, long amount) {
        long imbalance = imbalanceFee(ownCapacity, ownCapacity - amount);
        if (imbalance == UNDEFINED_FEE) {
            return UNDEFINED_FEE;
        }
        long proportionalFee = (long) Math.rint(((double) amount * proportional) / (double) PPM);
        return flat + proportionalFee + imbalance;
    }

    /**
     * Fee charged by an owner for receiving a transfer it will forward as {@code amountOut}.
     * <p>
     * The receiver fee is proportional to the entering amount, which itself includes the fee.
     * Flat and proportional parts are inverted in closed form. The imbalance term is then taken
     * at the entering amount estimated by that first inversion and folded into a second one, so
     * the computation always finishes in two steps.
     * </p>
     *
     * @param ownCapacity owner's capacity on its edge toward the sender before the transfer.
     * @param amountOut amount the owner must have left after deducting this fee.
     * @return fee, or {@link #UNDEFINED_FEE} when the imbalance table does not cover the move.
     */
    public long receiverFee(long ownCapacity, long amountOut) {
        long estimate = invertReceiverFee(amountOut, 0L);
        long imbalance = imbalanceFee(ownCapacity, ownCapacity + amountOut + estimate);
        if (imbalance == UNDEFINED_FEE) {
            return UNDEFINED_FEE;
        }
        return invertReceiverFee(amountOut, imbalance);
    }

    /**
     * Converts a per-mediation proportional fee into the per-channel rate a mediator should
     * declare on both of its channels so that the combined charge matches the per-hop rate.
     *
     * @param perHopPpm per-mediation rate in ppm.
     * @return per-channel rate in ppm, rounded half-to-even.
     */
    public static long perChannelProportional(long perHopPpm) {
        if (perHopPpm < 0) {
            throw new IllegalArgumentException("perHopPpm must be >= 0");
        }
        return BigDecimal.valueOf(perHopPpm)
                .multiply(BigDecimal.valueOf(PPM))
                .divide(BigDecimal.valueOf(perHopPpm + 2 * PPM), 0, RoundingMode.HALF_EVEN)
                .longValueExact();
    }

    private long invertReceiverFee(long amountOut, long imbalance) {
        double rateComplement = 1.0d - (double) proportional / (double) PPM;
        return (long) Math.rint((amountOut + flat + imbalance) / rateComplement - amountOut);
    }

    private long imbalanceFee(long capacityBefore, long capacityAfter) {
        if (imbalancePenalty == null) {
            return 0L;
        }
        return imbalancePenalty.feeForCapacityChange(capacityBefore, capacityAfter);
    }
}
