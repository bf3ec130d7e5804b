package org.Aayush.pathfinding.fee;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Piecewise-linear imbalance penalty table.
 * <p>
 * Breakpoints are {@code (capacity, penalty)} pairs with strictly increasing capacities.
 * The table is defined on the closed interval {@code [firstCapacity, lastCapacity]}; evaluating
 * outside of it yields {@link Double#NaN}.
 * </p>
 * <p>
 * The x-axis is measured against {@link #span()} (the last breakpoint): an owner holding
 * capacity {@code c} sits at {@code span - c}. Sending moves the owner right on the table,
 * receiving moves it left.
 * </p>
 */
public final class ImbalancePenalty {

    private final long[] capacities;
    private final long[] penalties;
    private final double[] slopes;

    private ImbalancePenalty(long[] capacities, long[] penalties) {
        this.capacities = capacities;
        this.penalties = penalties;
        this.slopes = new double[capacities.length - 1];
        for (int i = 0; i < slopes.length; i++) {
            slopes[i] = (double) (penalties[i + 1] - penalties[i]) / (double) (capacities[i + 1] - capacities[i]);
        }
    }

    /**
     * One {@code (capacity, penalty)} breakpoint.
     *
     * @param capacity x coordinate.
     * @param penalty y coordinate (may be negative).
     */
    public record Breakpoint(long capacity, long penalty) {
    }

    /**
     * Builds a table from breakpoints.
     *
     * @param breakpoints at least two breakpoints, capacities strictly increasing.
     * @return immutable penalty table.
     * @throws IllegalArgumentException when the breakpoint contract is violated.
     */
    public static ImbalancePenalty of(List<Breakpoint> breakpoints) {
        Objects.requireNonNull(breakpoints, "breakpoints");
        if (breakpoints.size() < 2) {
            throw new IllegalArgumentException("imbalance_penalty needs at least two breakpoints");
        }
        long[] xs = new long[breakpoints.size()];
        long[] ys = new long[breakpoints.size()];
        for (int i = 0; i < breakpoints.size(); i++) {
            Breakpoint point = Objects.requireNonNull(breakpoints.get(i), "breakpoint");
            if (i > 0 && point.capacity() <= xs[i - 1]) {
                throw new IllegalArgumentException(
                        "imbalance_penalty capacities must be strictly increasing, got "
                                + point.capacity() + " after " + xs[i - 1]
                );
            }
            xs[i] = point.capacity();
            ys[i] = point.penalty();
        }
        return new ImbalancePenalty(xs, ys);
    }

    /**
     * Convenience factory from flat {@code capacity, penalty, capacity, penalty, ...} pairs.
     */
    public static ImbalancePenalty ofPairs(long... capacityPenaltyPairs) {
        if (capacityPenaltyPairs.length % 2 != 0) {
            throw new IllegalArgumentException("expected an even number of values");
        }
        List<Breakpoint> breakpoints = new ArrayList<>(capacityPenaltyPairs.length / 2);
        for (int i = 0; i < capacityPenaltyPairs.length; i += 2) {
            breakpoints.add(new Breakpoint(capacityPenaltyPairs[i], capacityPenaltyPairs[i + 1]));
        }
        return of(breakpoints);
    }

    /**
     * Last breakpoint capacity; the reference point of the x-axis.
     */
    public long span() {
        return capacities[capacities.length - 1];
    }

    /**
     * Number of breakpoints.
     */
    public int size() {
        return capacities.length;
    }

    /**
     * Returns the breakpoints as an immutable list.
     */
    public List<Breakpoint> breakpoints() {
        List<Breakpoint> out = new ArrayList<>(capacities.length);
        for (int i = 0; i < capacities.length; i++) {
            out.add(new Breakpoint(capacities[i], penalties[i]));
        }
        return List.copyOf(out);
    }

    /**
     * Linearly interpolates the table at {@code x}.
     *
     * @return interpolated penalty, or {@link Double#NaN} when {@code x} is outside the closed domain.
     */
    public double penaltyAt(double x) {
        int last = capacities.length - 1;
        if (!(x >= capacities[0] && x <= capacities[last])) {
            return Double.NaN;
        }
        if (x == capacities[last]) {
            return penalties[last];
        }
        int segment = segmentOf(x);
        return penalties[segment] + slopes[segment] * (x - capacities[segment]);
    }

    /**
     * Imbalance fee for an owner whose capacity moves from {@code capacityBefore} to {@code capacityAfter}.
     *
     * @return rounded fee (half-even), or {@link FeeSchedule#UNDEFINED_FEE} when either point is off-table.
     */
    long feeForCapacityChange(long capacityBefore, long capacityAfter) {
        long span = span();
        double before = penaltyAt((double) span - capacityBefore);
        double after = penaltyAt((double) span - capacityAfter);
        if (Double.isNaN(before) || Double.isNaN(after)) {
            return FeeSchedule.UNDEFINED_FEE;
        }
        return (long) Math.rint(after - before);
    }

    /**
     * Index of the segment {@code [capacities[i], capacities[i + 1])} containing {@code x}.
     */
    private int segmentOf(double x) {
        int low = 0;
        int high = capacities.length - 2;
        while (low < high) {
            int mid = (low + high + 1) >>> 1;
            if (capacities[mid] <= x) {
                low = mid;
            } else {
                high = mid - 1;
            }
        }
        return low;
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof ImbalancePenalty)) {
            return false;
        }
        ImbalancePenalty that = (ImbalancePenalty) other;
        return Arrays.equals(capacities, that.capacities) && Arrays.equals(penalties, that.penalties);
    }

    @Override
    public int hashCode() {
        return 31 * Arrays.hashCode(capacities) + Arrays.hashCode(penalties);
    }

    @Override
    public String toString() {
        return "ImbalancePenalty" + breakpoints();
    }
}
