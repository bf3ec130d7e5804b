package org.Aayush.pathfinding.graph;

import org.Aayush.pathfinding.fee.FeeSchedule;
import org.Aayush.pathfinding.fee.ImbalancePenalty;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

import java.time.Instant;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Network Graph Tests")
class NetworkGraphTest {
    private static final Address A = Address.ofNumber(1);
    private static final Address B = Address.ofNumber(2);
    private static final Address C = Address.ofNumber(3);
    private static final ChannelId AB = ChannelId.of(100);
    private static final Instant T0 = Instant.parse("2024-01-01T00:00:00Z");

    private NetworkGraph graph;

    @BeforeEach
    void setUp() {
        graph = new NetworkGraph();
        graph.openChannel(AB, A, B, 100, 50, 500);
    }

    @Test
    @DisplayName("Opening a channel inserts both directions with zero-cost schedules")
    void testOpenChannel() {
        ChannelEdge forward = graph.edge(A, B);
        ChannelEdge reverse = graph.edge(B, A);
        assertNotNull(forward);
        assertNotNull(reverse);
        assertEquals(AB, forward.channelId());
        assertEquals(AB, reverse.channelId());
        assertEquals(100L, forward.capacity());
        assertEquals(50L, reverse.capacity());
        assertSame(FeeSchedule.ZERO, forward.feeSchedule());
        assertNull(forward.feeUpdatedAt());
        assertEquals(500L, forward.settleTimeout());
        assertEquals(2, graph.nodeCount());
        assertEquals(1, graph.channelCount());
        assertEquals(List.of(forward, reverse), graph.channel(AB));
    }

    @Test
    @DisplayName("Duplicate ids and duplicate pairs are rejected")
    void testDuplicateChannel() {
        NetworkGraphException sameId = assertThrows(
                NetworkGraphException.class,
                () -> graph.openChannel(AB, A, C)
        );
        assertEquals(NetworkGraphException.REASON_DUPLICATE_CHANNEL, sameId.getReasonCode());

        NetworkGraphException samePair = assertThrows(
                NetworkGraphException.class,
                () -> graph.openChannel(ChannelId.of(101), B, A)
        );
        assertEquals(NetworkGraphException.REASON_DUPLICATE_CHANNEL, samePair.getReasonCode());
        assertTrue(samePair.getMessage().startsWith("[GRAPH_DUPLICATE_CHANNEL]"));
        assertEquals(1, graph.channelCount());
    }

    @Test
    @DisplayName("Self-channels and negative capacities are invalid")
    void testInvalidChannel() {
        NetworkGraphException self = assertThrows(
                NetworkGraphException.class,
                () -> graph.openChannel(ChannelId.of(7), C, C)
        );
        assertEquals(NetworkGraphException.REASON_INVALID_CHANNEL, self.getReasonCode());

        NetworkGraphException negative = assertThrows(
                NetworkGraphException.class,
                () -> graph.openChannel(ChannelId.of(7), A, C, -1, 0, 0)
        );
        assertEquals(NetworkGraphException.REASON_INVALID_CAPACITY, negative.getReasonCode());
        assertFalse(graph.containsNode(C));
    }

    @Test
    @DisplayName("Capacity updates replace one direction only")
    void testUpdateCapacity() {
        graph.updateCapacity(AB, B, 75);
        assertEquals(100L, graph.edge(A, B).capacity());
        assertEquals(75L, graph.edge(B, A).capacity());

        assertEquals(
                NetworkGraphException.REASON_UNKNOWN_CHANNEL,
                assertThrows(NetworkGraphException.class, () -> graph.updateCapacity(ChannelId.of(9), A, 1)).getReasonCode()
        );
        assertEquals(
                NetworkGraphException.REASON_NOT_A_PARTICIPANT,
                assertThrows(NetworkGraphException.class, () -> graph.updateCapacity(AB, C, 1)).getReasonCode()
        );
        assertEquals(
                NetworkGraphException.REASON_INVALID_CAPACITY,
                assertThrows(NetworkGraphException.class, () -> graph.updateCapacity(AB, A, -5)).getReasonCode()
        );
    }

    @Test
    @DisplayName("Fee update replaces the updater's own direction wholesale")
    void testUpdateFeeSchedule() {
        FeeSchedule first = FeeSchedule.of(5, 100, ImbalancePenalty.ofPairs(0, 0, 150, 10));
        assertTrue(graph.updateFeeSchedule(AB, A, first, T0));
        assertEquals(first, graph.edge(A, B).feeSchedule());
        assertSame(FeeSchedule.ZERO, graph.edge(B, A).feeSchedule());
        assertEquals(100L, graph.edge(A, B).capacity());

        FeeSchedule second = FeeSchedule.of(1, 0);
        assertTrue(graph.updateFeeSchedule(AB, A, second, T0.plusSeconds(1)));
        assertEquals(second, graph.edge(A, B).feeSchedule());
        assertNull(graph.edge(A, B).feeSchedule().imbalancePenalty());
        assertEquals(T0.plusSeconds(1), graph.edge(A, B).feeUpdatedAt());
    }

    @Test
    @DisplayName("Fee updates from non-owners are unauthorized")
    void testUnauthorizedFeeUpdate() {
        NetworkGraphException ex = assertThrows(
                NetworkGraphException.class,
                () -> graph.updateFeeSchedule(AB, C, FeeSchedule.of(1, 0), T0)
        );
        assertEquals(NetworkGraphException.REASON_UNAUTHORIZED_FEE_UPDATE, ex.getReasonCode());
        assertSame(FeeSchedule.ZERO, graph.edge(A, B).feeSchedule());
        assertSame(FeeSchedule.ZERO, graph.edge(B, A).feeSchedule());

        assertEquals(
                NetworkGraphException.REASON_UNKNOWN_CHANNEL,
                assertThrows(
                        NetworkGraphException.class,
                        () -> graph.updateFeeSchedule(ChannelId.of(9), A, FeeSchedule.ZERO, T0)
                ).getReasonCode()
        );
    }

    @Test
    @DisplayName("Older or equal fee update timestamps are ignored")
    void testStaleFeeUpdate() {
        FeeSchedule current = FeeSchedule.of(3, 0);
        assertTrue(graph.updateFeeSchedule(AB, B, current, T0));

        assertFalse(graph.updateFeeSchedule(AB, B, FeeSchedule.of(9, 0), T0.minusSeconds(30)));
        assertFalse(graph.updateFeeSchedule(AB, B, FeeSchedule.of(9, 0), T0));
        assertEquals(current, graph.edge(B, A).feeSchedule());
        assertEquals(T0, graph.edge(B, A).feeUpdatedAt());

        // timestamps are tracked per direction
        assertTrue(graph.updateFeeSchedule(AB, A, FeeSchedule.of(9, 0), T0.minusSeconds(30)));
    }

    @Test
    @DisplayName("Closing removes both directions and is idempotent")
    void testCloseChannel() {
        graph.openChannel(ChannelId.of(200), B, C, 10, 10, 0);
        assertTrue(graph.closeChannel(AB));
        assertNull(graph.edge(A, B));
        assertNull(graph.edge(B, A));
        assertFalse(graph.containsNode(A));
        assertTrue(graph.containsNode(B));
        assertTrue(graph.channel(AB).isEmpty());

        assertFalse(graph.closeChannel(AB));
        assertEquals(1, graph.channelCount());

        // the pair may be reopened under a new id
        graph.openChannel(ChannelId.of(300), A, B);
        assertEquals(0L, graph.edge(A, B).capacity());
    }

    @Test
    @DisplayName("Reachability defaults to unknown and never touches edges")
    void testReachability() {
        assertEquals(AddressReachability.UNKNOWN, graph.reachability(A));
        graph.setReachability(A, AddressReachability.REACHABLE);
        graph.setReachability(C, AddressReachability.UNREACHABLE);
        assertEquals(AddressReachability.REACHABLE, graph.reachability(A));
        assertEquals(AddressReachability.UNREACHABLE, graph.read(view -> view.reachability(C)));
        assertFalse(graph.containsNode(C));
        assertEquals(1, graph.channelCount());
    }

    @Test
    @DisplayName("Outgoing edges list every peer of a node")
    void testOutgoing() {
        graph.openChannel(ChannelId.of(200), B, C, 10, 20, 0);
        List<Address> peers = graph.read(view -> view.outgoing(B).stream().map(ChannelEdge::peer).sorted().toList());
        assertEquals(List.of(A, C), peers);
        boolean noEdges = graph.read(view -> view.outgoing(Address.ofNumber(42)).isEmpty());
        assertTrue(noEdges);
    }

    @Test
    @Timeout(value = 10, unit = TimeUnit.SECONDS)
    @DisplayName("Readers never observe one direction of a channel without the other")
    void testNoTornChannelUnderConcurrency() throws InterruptedException {
        AtomicBoolean failed = new AtomicBoolean(false);
        CountDownLatch latch = new CountDownLatch(5);
        ExecutorService executor = Executors.newFixedThreadPool(5);
        ChannelId churn = ChannelId.of(500);

        executor.execute(() -> {
            try {
                for (int i = 0; i < 5_000; i++) {
                    graph.openChannel(churn, B, C, i, i, 0);
                    graph.updateCapacity(churn, B, i + 1L);
                    graph.closeChannel(churn);
                }
            } catch (Throwable t) {
                failed.set(true);
            } finally {
                latch.countDown();
            }
        });

        for (int i = 0; i < 4; i++) {
            executor.execute(() -> {
                try {
                    for (int j = 0; j < 20_000; j++) {
                        boolean consistent = graph.read(view -> {
                            ChannelEdge forward = view.edge(B, C);
                            ChannelEdge reverse = view.edge(C, B);
                            if (forward == null || reverse == null) {
                                return forward == null && reverse == null;
                            }
                            return forward.channelId().equals(reverse.channelId());
                        });
                        if (!consistent) {
                            failed.set(true);
                            break;
                        }
                    }
                } catch (Throwable t) {
                    failed.set(true);
                } finally {
                    latch.countDown();
                }
            });
        }

        assertTrue(latch.await(10, TimeUnit.SECONDS), "Workload timed out");
        executor.shutdownNow();
        assertFalse(failed.get(), "Graph should never expose a half-open channel");
    }
}
