package org.Aayush.pathfinding.search;

import org.Aayush.pathfinding.fee.FeeSchedule;
import org.Aayush.pathfinding.graph.Address;
import org.Aayush.pathfinding.graph.AddressReachability;
import org.Aayush.pathfinding.graph.ChannelId;
import org.Aayush.pathfinding.graph.NetworkGraph;

import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.OptionalLong;

/**
 * Small numbered network fixture: node {@code n} is {@link Address#ofNumber(long)}, every node
 * starts reachable and channel ids count up from 100.
 */
final class FeeTestNetwork {
    private final NetworkGraph graph = new NetworkGraph();
    private final Map<List<Address>, ChannelId> channelIds = new HashMap<>();
    private final FeeAwarePathPlanner planner;
    private long nextChannelId = 100;
    private Instant clock = Instant.parse("2024-01-01T00:00:00Z");

    FeeTestNetwork() {
        this(new FeeAwarePathPlanner(SearchBudget.of(0, 0), new PathFeeEvaluator()));
    }

    FeeTestNetwork(FeeAwarePathPlanner planner) {
        this.planner = planner;
    }

    static Address a(long node) {
        return Address.ofNumber(node);
    }

    FeeTestNetwork channel(long participant1, long participant2, long capacity1, long capacity2) {
        ChannelId id = ChannelId.of(nextChannelId++);
        graph.openChannel(id, a(participant1), a(participant2), capacity1, capacity2, 100);
        channelIds.put(List.of(a(participant1), a(participant2)), id);
        channelIds.put(List.of(a(participant2), a(participant1)), id);
        graph.setReachability(a(participant1), AddressReachability.REACHABLE);
        graph.setReachability(a(participant2), AddressReachability.REACHABLE);
        return this;
    }

    FeeTestNetwork channel(long participant1, long participant2, long capacity) {
        return channel(participant1, participant2, capacity, capacity);
    }

    /**
     * Announces {@code schedule} for the direction owned by {@code owner} toward {@code peer}.
     */
    void setFee(long owner, long peer, FeeSchedule schedule) {
        clock = clock.plusSeconds(1);
        graph.updateFeeSchedule(channelIds.get(List.of(a(owner), a(peer))), a(owner), schedule, clock);
    }

    void resetFee(long owner, long peer) {
        setFee(owner, peer, FeeSchedule.ZERO);
    }

    void reachability(long node, AddressReachability status) {
        graph.setReachability(a(node), status);
    }

    NetworkGraph graph() {
        return graph;
    }

    List<PlannedPath> paths(long source, long target, long value, int maxPaths, int maxHops) {
        PathQuery query = new PathQuery(a(source), a(target), value, maxPaths, maxHops, maxPaths * 2);
        return graph.read(view -> planner.plan(view, query));
    }

    List<PlannedPath> paths(long source, long target, long value, int maxPaths) {
        return paths(source, target, value, maxPaths, 16);
    }

    OptionalLong estimateFee(long source, long target, long value) {
        List<PlannedPath> paths = paths(source, target, value, 1);
        return paths.isEmpty() ? OptionalLong.empty() : OptionalLong.of(paths.get(0).fee());
    }

    OptionalLong estimateFee(long source, long target) {
        return estimateFee(source, target, 10);
    }
}
