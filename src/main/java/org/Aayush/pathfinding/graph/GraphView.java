package org.Aayush.pathfinding.graph;

import java.util.Collection;

/**
 * Read-only view of a token network used by path search.
 * <p>
 * A view is only valid inside {@link NetworkGraph#read(java.util.function.Function)}; it must not
 * escape the callback.
 * </p>
 */
public interface GraphView {

    /**
     * Returns whether the address is an endpoint of at least one open channel.
     */
    boolean containsNode(Address address);

    /**
     * Returns the edge owned by {@code owner} toward {@code peer}, or {@code null}.
     */
    ChannelEdge edge(Address owner, Address peer);

    /**
     * Returns all edges owned by {@code owner}. Because channels are bidirectional, the
     * peers of these edges are exactly the nodes with an edge into {@code owner}.
     */
    Collection<ChannelEdge> outgoing(Address owner);

    /**
     * Current liveness of a participant.
     */
    AddressReachability reachability(Address address);

    /**
     * Number of distinct nodes.
     */
    int nodeCount();

    /**
     * Number of open channels.
     */
    int channelCount();
}
