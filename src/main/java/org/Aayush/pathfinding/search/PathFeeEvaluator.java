package org.Aayush.pathfinding.search;

import it.unimi.dsi.fastutil.longs.LongArrayList;
import lombok.Getter;
import lombok.experimental.Accessors;
import org.Aayush.pathfinding.fee.MediationFee;
import org.Aayush.pathfinding.graph.Address;
import org.Aayush.pathfinding.graph.ChannelEdge;
import org.Aayush.pathfinding.graph.GraphView;

import java.util.List;
import java.util.Objects;

/**
 * Replays node paths backward with exact fee semantics.
 * <p>
 * Walking from the target toward the source, each mediator's fee is added on top of the amount
 * it must forward. The source's own schedule is never charged.
 * </p>
 */
final class PathFeeEvaluator {
    static final String REASON_PATH_TOO_SHORT = "SEARCH_PATH_TOO_SHORT";
    static final String REASON_MISSING_EDGE = "SEARCH_PATH_MISSING_EDGE";
    static final String REASON_INSUFFICIENT_CAPACITY = "SEARCH_PATH_INSUFFICIENT_CAPACITY";
    static final String REASON_UNDEFINED_FEE = "SEARCH_PATH_UNDEFINED_FEE";
    static final String REASON_NEGATIVE_AMOUNT = "SEARCH_PATH_NEGATIVE_AMOUNT";

    /**
     * Computes the amount {@code mediator} must receive from {@code previous} to forward
     * {@code amountOut} to {@code next}.
     *
     * @return fee split, {@link MediationFee#UNDEFINED} when infeasible or an edge is missing.
     */
    static MediationFee mediationFee(
            GraphView graph,
            Address previous,
            Address mediator,
            Address next,
            long amountOut
    ) {
        ChannelEdge outgoing = graph.edge(mediator, next);
        ChannelEdge incoming = graph.edge(mediator, previous);
        if (outgoing == null || incoming == null) {
            return MediationFee.UNDEFINED;
        }
        return MediationFee.backward(
                outgoing.feeSchedule(),
                outgoing.capacity(),
                incoming.feeSchedule(),
                incoming.capacity(),
                amountOut
        );
    }

    /**
     * Replays one node path so that the target receives exactly {@code value}.
     *
     * @throws PathEvaluationException when the path is not feasible in {@code graph}.
     */
    PlannedPath evaluate(GraphView graph, List<Address> nodes, long value) {
        Objects.requireNonNull(graph, "graph");
        Objects.requireNonNull(nodes, "nodes");
        int size = nodes.size();
        if (size < 2) {
            throw new PathEvaluationException(REASON_PATH_TOO_SHORT, "path needs at least two nodes");
        }

        long[] hopFees = new long[size];
        long amount = value;
        for (int i = size - 2; i >= 0; i--) {
            Address from = nodes.get(i);
            Address to = nodes.get(i + 1);
            requireTransferable(graph, from, to, amount);
            if (i > 0) {
                MediationFee fee = mediationFee(graph, nodes.get(i - 1), from, to, amount);
                requireDefined(fee, from);
                hopFees[i] = fee.total();
                amount += hopFees[i];
            }
        }
        return new PlannedPath(nodes, value, amount, LongArrayList.wrap(hopFees));
    }

    private static void requireDefined(MediationFee fee, Address mediator) {
        if (!fee.isDefined()) {
            throw new PathEvaluationException(
                    REASON_UNDEFINED_FEE,
                    "fee of mediator " + mediator + " is undefined"
            );
        }
    }

    private static void requireTransferable(GraphView graph, Address from, Address to, long amount) {
        ChannelEdge edge = graph.edge(from, to);
        if (edge == null) {
            throw new PathEvaluationException(REASON_MISSING_EDGE, "no channel from " + from + " to " + to);
        }
        if (amount < 0) {
            throw new PathEvaluationException(
                    REASON_NEGATIVE_AMOUNT,
                    "amount " + amount + " from " + from + " is negative"
            );
        }
        if (edge.capacity() < amount) {
            throw new PathEvaluationException(
                    REASON_INSUFFICIENT_CAPACITY,
                    "capacity " + edge.capacity() + " from " + from + " to " + to + " is below " + amount
            );
        }
    }

    /**
     * Path replay exception with reason code.
     */
    @Getter
    @Accessors(fluent = true)
    static final class PathEvaluationException extends RuntimeException {
        private final String reasonCode;

        PathEvaluationException(String reasonCode, String message) {
            super("[" + reasonCode + "] " + message);
            this.reasonCode = reasonCode;
        }
    }
}
