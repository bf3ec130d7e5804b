package org.Aayush.pathfinding.search;

import org.Aayush.pathfinding.graph.Address;

/**
 * Backward search label: a suffix path from {@code node} to the target.
 *
 * @param node first node of the suffix.
 * @param amount amount {@code node} must forward to its successor; for the target label, the value it receives.
 * @param hops channels between {@code node} and the target.
 * @param successor next label toward the target, {@code null} for the target label.
 * @param sequence insertion order, final tie-break.
 */
record FrontierLabel(
        Address node,
        long amount,
        int hops,
        FrontierLabel successor,
        long sequence
) implements Comparable<FrontierLabel> {

    static FrontierLabel target(Address target, long value) {
        return new FrontierLabel(target, value, 0, null, 0L);
    }

    FrontierLabel extend(Address predecessor, long predecessorAmount, long nextSequence) {
        return new FrontierLabel(predecessor, predecessorAmount, hops + 1, this, nextSequence);
    }

    boolean isTarget() {
        return successor == null;
    }

    /**
     * Returns whether {@code address} already occurs on this suffix.
     */
    boolean visits(Address address) {
        for (FrontierLabel label = this; label != null; label = label.successor) {
            if (label.node.equals(address)) {
                return true;
            }
        }
        return false;
    }

    @Override
    public int compareTo(FrontierLabel other) {
        int byAmount = Long.compare(this.amount, other.amount);
        if (byAmount != 0) {
            return byAmount;
        }
        int byHops = Integer.compare(this.hops, other.hops);
        if (byHops != 0) {
            return byHops;
        }
        return Long.compare(this.sequence, other.sequence);
    }
}
