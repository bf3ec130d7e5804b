package org.Aayush.pathfinding.graph;

import it.unimi.dsi.fastutil.objects.Object2ObjectOpenHashMap;
import lombok.extern.slf4j.Slf4j;
import org.Aayush.pathfinding.fee.FeeSchedule;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Function;

/**
 * Directed multigraph of channel edges for one token network.
 * <p>
 * Storage is an explicit adjacency structure {@code owner -> (peer -> edge)} plus a channel index
 * {@code channelId -> endpoints}. Concurrency follows a multiple-readers/single-writer discipline:
 * </p>
 * <ul>
 * <li>Queries run inside {@link #read(Function)} under the shared lock and never block each other.</li>
 * <li>Every mutation runs under the exclusive lock, so a channel's two directions are opened,
 * closed and replaced as one unit from a reader's point of view.</li>
 * <li>Edges are immutable; a mutation publishes a replacement edge.</li>
 * <li>Reachability lives in a concurrent map beside the edges and does not take the graph lock.</li>
 * </ul>
 * <p>
 * All mutations are idempotent state replacements.
 * </p>
 */
@Slf4j
public final class NetworkGraph {

    private final Map<Address, Map<Address, ChannelEdge>> adjacency = new Object2ObjectOpenHashMap<>();
    private final Map<ChannelId, Endpoints> channels = new Object2ObjectOpenHashMap<>();
    private final ConcurrentHashMap<Address, AddressReachability> reachability = new ConcurrentHashMap<>();
    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
    private final GraphView view = new LockedView();

    /**
     * Unordered participant pair of one channel, in the order announced at open time.
     */
    private record Endpoints(Address participantA, Address participantB) {
        boolean contains(Address address) {
            return participantA.equals(address) || participantB.equals(address);
        }

        Address other(Address address) {
            return participantA.equals(address) ? participantB : participantA;
        }
    }

    /**
     * Opens a channel with zero initial capacities and unknown settle timeout.
     */
    public void openChannel(ChannelId channelId, Address participantA, Address participantB) {
        openChannel(channelId, participantA, participantB, 0L, 0L, 0L);
    }

    /**
     * Opens a channel and inserts both directions with zero-cost fee schedules.
     *
     * @param channelId channel id; must not exist yet.
     * @param participantA first participant.
     * @param participantB second participant, different from the first.
     * @param capacityA initial capacity of {@code participantA -> participantB}.
     * @param capacityB initial capacity of {@code participantB -> participantA}.
     * @param settleTimeout settle timeout announced with the channel.
     * @throws NetworkGraphException {@code GRAPH_DUPLICATE_CHANNEL} when the id or the pair is taken,
     *                               {@code GRAPH_INVALID_CHANNEL} for a self-channel,
     *                               {@code GRAPH_INVALID_CAPACITY} for negative capacities.
     */
    public void openChannel(
            ChannelId channelId,
            Address participantA,
            Address participantB,
            long capacityA,
            long capacityB,
            long settleTimeout
    ) {
        Objects.requireNonNull(channelId, "channelId");
        Objects.requireNonNull(participantA, "participantA");
        Objects.requireNonNull(participantB, "participantB");
        if (participantA.equals(participantB)) {
            throw new NetworkGraphException(
                    NetworkGraphException.REASON_INVALID_CHANNEL,
                    channelId + " connects " + participantA + " to itself"
            );
        }
        requireCapacity(channelId, capacityA);
        requireCapacity(channelId, capacityB);

        lock.writeLock().lock();
        try {
            if (channels.containsKey(channelId)) {
                throw new NetworkGraphException(
                        NetworkGraphException.REASON_DUPLICATE_CHANNEL,
                        channelId + " is already open"
                );
            }
            ChannelEdge existing = edgeLocked(participantA, participantB);
            if (existing != null) {
                throw new NetworkGraphException(
                        NetworkGraphException.REASON_DUPLICATE_CHANNEL,
                        participantA + " and " + participantB + " already share " + existing.channelId()
                );
            }
            channels.put(channelId, new Endpoints(participantA, participantB));
            adjacency.computeIfAbsent(participantA, ignored -> new Object2ObjectOpenHashMap<>())
                    .put(participantB, ChannelEdge.opened(channelId, participantA, participantB, capacityA, settleTimeout));
            adjacency.computeIfAbsent(participantB, ignored -> new Object2ObjectOpenHashMap<>())
                    .put(participantA, ChannelEdge.opened(channelId, participantB, participantA, capacityB, settleTimeout));
        } finally {
            lock.writeLock().unlock();
        }
        log.debug("Opened {} between {} and {}", channelId, participantA, participantB);
    }

    /**
     * Replaces the capacity of the direction owned by {@code owner}.
     *
     * @throws NetworkGraphException {@code GRAPH_UNKNOWN_CHANNEL}, {@code GRAPH_NOT_A_PARTICIPANT}
     *                               or {@code GRAPH_INVALID_CAPACITY}.
     */
    public void updateCapacity(ChannelId channelId, Address owner, long newCapacity) {
        Objects.requireNonNull(channelId, "channelId");
        Objects.requireNonNull(owner, "owner");
        requireCapacity(channelId, newCapacity);

        lock.writeLock().lock();
        try {
            Endpoints endpoints = requireChannelLocked(channelId);
            if (!endpoints.contains(owner)) {
                throw new NetworkGraphException(
                        NetworkGraphException.REASON_NOT_A_PARTICIPANT,
                        owner + " is not a participant of " + channelId
                );
            }
            Map<Address, ChannelEdge> edges = adjacency.get(owner);
            Address peer = endpoints.other(owner);
            edges.put(peer, edges.get(peer).withCapacity(newCapacity));
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Replaces, wholesale, the fee schedule of the direction owned by {@code updatingParticipant}.
     * <p>
     * Only the owner of a direction may change its schedule. Updates carrying a timestamp that is
     * not strictly newer than the one already applied to the edge are ignored.
     * </p>
     *
     * @return {@code true} when applied, {@code false} when ignored as stale.
     * @throws NetworkGraphException {@code GRAPH_UNKNOWN_CHANNEL} or {@code GRAPH_UNAUTHORIZED_FEE_UPDATE}.
     */
    public boolean updateFeeSchedule(
            ChannelId channelId,
            Address updatingParticipant,
            FeeSchedule schedule,
            Instant timestamp
    ) {
        Objects.requireNonNull(channelId, "channelId");
        Objects.requireNonNull(updatingParticipant, "updatingParticipant");
        Objects.requireNonNull(schedule, "schedule");
        Objects.requireNonNull(timestamp, "timestamp");

        lock.writeLock().lock();
        try {
            Endpoints endpoints = requireChannelLocked(channelId);
            if (!ownsDirection(endpoints, updatingParticipant)) {
                throw new NetworkGraphException(
                        NetworkGraphException.REASON_UNAUTHORIZED_FEE_UPDATE,
                        updatingParticipant + " owns no direction of " + channelId
                );
            }
            Map<Address, ChannelEdge> edges = adjacency.get(updatingParticipant);
            Address peer = endpoints.other(updatingParticipant);
            ChannelEdge current = edges.get(peer);
            Instant appliedAt = current.feeUpdatedAt();
            if (appliedAt != null && !timestamp.isAfter(appliedAt)) {
                return false;
            }
            edges.put(peer, current.withFeeSchedule(schedule, timestamp));
            return true;
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Removes both directions of a channel. Closing an absent channel is a no-op.
     *
     * @return {@code true} when the channel existed.
     */
    public boolean closeChannel(ChannelId channelId) {
        Objects.requireNonNull(channelId, "channelId");
        Endpoints endpoints;
        lock.writeLock().lock();
        try {
            endpoints = channels.remove(channelId);
            if (endpoints == null) {
                return false;
            }
            removeDirectionLocked(endpoints.participantA(), endpoints.participantB());
            removeDirectionLocked(endpoints.participantB(), endpoints.participantA());
        } finally {
            lock.writeLock().unlock();
        }
        log.debug("Closed {} between {} and {}", channelId, endpoints.participantA(), endpoints.participantB());
        return true;
    }

    /**
     * Records liveness of a participant. Does not touch edges.
     */
    public void setReachability(Address address, AddressReachability status) {
        reachability.put(Objects.requireNonNull(address, "address"), Objects.requireNonNull(status, "status"));
    }

    /**
     * Current liveness of a participant; {@link AddressReachability#UNKNOWN} when never reported.
     */
    public AddressReachability reachability(Address address) {
        return reachability.getOrDefault(address, AddressReachability.UNKNOWN);
    }

    /**
     * Runs a read-only callback against a consistent view of the graph.
     * <p>
     * The view must not escape the callback.
     * </p>
     */
    public <T> T read(Function<GraphView, T> reader) {
        Objects.requireNonNull(reader, "reader");
        lock.readLock().lock();
        try {
            return reader.apply(view);
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Convenience lookup of one direction.
     */
    public ChannelEdge edge(Address owner, Address peer) {
        return read(graph -> graph.edge(owner, peer));
    }

    /**
     * Returns both directions of a channel as {@code [A -> B, B -> A]}, or an empty list.
     */
    public List<ChannelEdge> channel(ChannelId channelId) {
        return read(graph -> {
            Endpoints endpoints = channels.get(channelId);
            if (endpoints == null) {
                return List.of();
            }
            return List.of(
                    edgeLocked(endpoints.participantA(), endpoints.participantB()),
                    edgeLocked(endpoints.participantB(), endpoints.participantA())
            );
        });
    }

    public boolean containsNode(Address address) {
        return read(graph -> graph.containsNode(address));
    }

    public int nodeCount() {
        return read(GraphView::nodeCount);
    }

    public int channelCount() {
        return read(GraphView::channelCount);
    }

    private Endpoints requireChannelLocked(ChannelId channelId) {
        Endpoints endpoints = channels.get(channelId);
        if (endpoints == null) {
            throw new NetworkGraphException(
                    NetworkGraphException.REASON_UNKNOWN_CHANNEL,
                    channelId + " is not open"
            );
        }
        return endpoints;
    }

    private static boolean ownsDirection(Endpoints endpoints, Address participant) {
        return endpoints.contains(participant);
    }

    private ChannelEdge edgeLocked(Address owner, Address peer) {
        Map<Address, ChannelEdge> edges = adjacency.get(owner);
        return edges == null ? null : edges.get(peer);
    }

    private void removeDirectionLocked(Address owner, Address peer) {
        Map<Address, ChannelEdge> edges = adjacency.get(owner);
        if (edges == null) {
            return;
        }
        edges.remove(peer);
        if (edges.isEmpty()) {
            adjacency.remove(owner);
        }
    }

    private static void requireCapacity(ChannelId channelId, long capacity) {
        if (capacity < 0) {
            throw new NetworkGraphException(
                    NetworkGraphException.REASON_INVALID_CAPACITY,
                    "capacity of " + channelId + " must be >= 0, got " + capacity
            );
        }
    }

    /**
     * View over the live maps; only handed out while the read lock is held.
     */
    private final class LockedView implements GraphView {
        @Override
        public boolean containsNode(Address address) {
            return adjacency.containsKey(address);
        }

        @Override
        public ChannelEdge edge(Address owner, Address peer) {
            return edgeLocked(owner, peer);
        }

        @Override
        public Collection<ChannelEdge> outgoing(Address owner) {
            Map<Address, ChannelEdge> edges = adjacency.get(owner);
            return edges == null ? List.of() : edges.values();
        }

        @Override
        public AddressReachability reachability(Address address) {
            return NetworkGraph.this.reachability(address);
        }

        @Override
        public int nodeCount() {
            return adjacency.size();
        }

        @Override
        public int channelCount() {
            return channels.size();
        }
    }
}
