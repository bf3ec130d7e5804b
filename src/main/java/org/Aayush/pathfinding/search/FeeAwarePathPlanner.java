package org.Aayush.pathfinding.search;

import it.unimi.dsi.fastutil.objects.Object2IntOpenHashMap;
import lombok.extern.slf4j.Slf4j;
import org.Aayush.pathfinding.fee.MediationFee;
import org.Aayush.pathfinding.graph.Address;
import org.Aayush.pathfinding.graph.AddressReachability;
import org.Aayush.pathfinding.graph.ChannelEdge;
import org.Aayush.pathfinding.graph.GraphView;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.PriorityQueue;
import java.util.Set;

/**
 * Backward best-first label search from target to source.
 * <p>
 * Each label is a suffix path to the target together with the amount its first node must
 * forward. Extending a label by a predecessor fixes the previous hop of that first node, which
 * is exactly what its receiver fee depends on, so mediation fees are unrolled one hop per
 * expansion. Labels are ordered by that amount; a label reaching the source is a complete path
 * whose amount is what the source sends.
 * </p>
 * <p>
 * Rebates make partial amounts non-monotone along a suffix, so the search drains the frontier
 * and ranks every completed path before trimming to {@code maxPaths}. Work is bounded by the hop
 * limit, the {@link SearchBudget} and a per-node expansion cap. Only labels that produced at
 * least one admissible extension count toward the cap.
 * </p>
 * <p>
 * Every completed path is replayed through {@link PathFeeEvaluator} so the reported fee and
 * per-hop breakdown come from one authoritative computation.
 * </p>
 */
@Slf4j
public final class FeeAwarePathPlanner implements PathPlanner {
    private static final long NO_AMOUNT = Long.MIN_VALUE;

    private static final Comparator<PlannedPath> RANKING =
            Comparator.comparingLong(PlannedPath::fee).thenComparingInt(PlannedPath::hops);

    private final SearchBudget searchBudget;
    private final PathFeeEvaluator pathEvaluator;

    public FeeAwarePathPlanner() {
        this(SearchBudget.defaults(), new PathFeeEvaluator());
    }

    FeeAwarePathPlanner(SearchBudget searchBudget, PathFeeEvaluator pathEvaluator) {
        this.searchBudget = Objects.requireNonNull(searchBudget, "searchBudget");
        this.pathEvaluator = Objects.requireNonNull(pathEvaluator, "pathEvaluator");
    }

    @Override
    public List<PlannedPath> plan(GraphView graph, PathQuery query) {
        Objects.requireNonNull(graph, "graph");
        Objects.requireNonNull(query, "query");

        PriorityQueue<FrontierLabel> frontier = new PriorityQueue<>();
        Object2IntOpenHashMap<Address> expansions = new Object2IntOpenHashMap<>();
        Set<List<Address>> emitted = new HashSet<>();
        List<PlannedPath> found = new ArrayList<>();
        long sequence = 0L;
        int expanded = 0;

        frontier.add(FrontierLabel.target(query.target(), query.value()));
        try {
            while (!frontier.isEmpty()) {
                FrontierLabel label = frontier.poll();
                if (label.node().equals(query.source())) {
                    List<Address> nodes = nodesOf(label);
                    if (emitted.add(nodes)) {
                        found.add(pathEvaluator.evaluate(graph, nodes, query.value()));
                    }
                    continue;
                }
                if (expansions.getInt(label.node()) >= query.maxExpansionsPerNode()) {
                    continue;
                }

                searchBudget.checkExpandedLabels(++expanded);
                int extensions = 0;
                for (ChannelEdge reverse : graph.outgoing(label.node())) {
                    Address predecessor = reverse.peer();
                    if (!admissible(graph, query, label, predecessor)) {
                        continue;
                    }
                    long inbound = inboundAmount(graph, label, predecessor);
                    if (inbound == NO_AMOUNT || inbound < 0) {
                        continue;
                    }
                    ChannelEdge edge = graph.edge(predecessor, label.node());
                    if (edge == null || edge.capacity() < inbound) {
                        continue;
                    }
                    frontier.add(label.extend(predecessor, inbound, ++sequence));
                    extensions++;
                }
                if (extensions > 0) {
                    expansions.addTo(label.node(), 1);
                }
                searchBudget.checkFrontierSize(frontier.size());
            }
        } catch (SearchBudget.BudgetExceededException ex) {
            log.warn(
                    "Search {} -> {} stopped early after {} candidate path(s): {}",
                    query.source(),
                    query.target(),
                    found.size(),
                    ex.getMessage()
            );
        }

        found.sort(RANKING);
        return List.copyOf(found.subList(0, Math.min(found.size(), query.maxPaths())));
    }

    private static boolean admissible(GraphView graph, PathQuery query, FrontierLabel label, Address predecessor) {
        if (label.hops() + 1 > query.maxHops()) {
            return false;
        }
        if (label.visits(predecessor)) {
            return false;
        }
        return predecessor.equals(query.source())
                || graph.reachability(predecessor) == AddressReachability.REACHABLE;
    }

    /**
     * Amount that must arrive at the label's node when it is entered from {@code predecessor}.
     */
    private static long inboundAmount(GraphView graph, FrontierLabel label, Address predecessor) {
        if (label.isTarget()) {
            return label.amount();
        }
        MediationFee fee = PathFeeEvaluator.mediationFee(
                graph,
                predecessor,
                label.node(),
                label.successor().node(),
                label.amount()
        );
        if (!fee.isDefined()) {
            log.debug(
                    "Fee of {} between {} and {} undefined for amount {}",
                    label.node(),
                    predecessor,
                    label.successor().node(),
                    label.amount()
            );
            return NO_AMOUNT;
        }
        return label.amount() + fee.total();
    }

    private static List<Address> nodesOf(FrontierLabel sourceLabel) {
        List<Address> nodes = new ArrayList<>(sourceLabel.hops() + 1);
        for (FrontierLabel label = sourceLabel; label != null; label = label.successor()) {
            nodes.add(label.node());
        }
        return List.copyOf(nodes);
    }
}
