package org.Aayush.pathfinding.app;

import lombok.extern.slf4j.Slf4j;
import org.Aayush.pathfinding.core.PathCandidate;
import org.Aayush.pathfinding.core.PathRequest;
import org.Aayush.pathfinding.core.PathResponse;
import org.Aayush.pathfinding.core.PathfindingCore;
import org.Aayush.pathfinding.graph.Address;
import org.Aayush.pathfinding.graph.AddressReachability;
import org.Aayush.pathfinding.graph.ChannelId;
import org.Aayush.pathfinding.graph.NetworkGraph;
import org.Aayush.pathfinding.ingest.BatchApplyResult;
import org.Aayush.pathfinding.ingest.ChannelCapacityChanged;
import org.Aayush.pathfinding.ingest.ChannelEvent;
import org.Aayush.pathfinding.ingest.ChannelOpened;
import org.Aayush.pathfinding.ingest.FeeUpdate;
import org.Aayush.pathfinding.ingest.IngestionGateway;
import org.Aayush.pathfinding.ingest.ReachabilityChanged;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Minimal application entry point used for local smoke runs.
 * <p>
 * Builds a four-node diamond through the ingestion gateway and prints the ranked paths
 * from node 1 to node 3.
 * </p>
 */
@Slf4j
public class Main {
    private static final long CAPACITY = 1_000L;
    private static final long VALUE = 100L;

    /**
     * Launches the sample routine.
     *
     * @param args command-line arguments.
     */
    public static void main(String[] args) {
        NetworkGraph graph = new NetworkGraph();
        BatchApplyResult ingest = new IngestionGateway(graph).applyBatch(demoEvents());
        log.info("Ingested {} events: {}", ingest.total(), ingest);

        PathfindingCore core = PathfindingCore.builder().graph(graph).build();
        PathResponse response = core.findPaths(PathRequest.builder()
                .source(Address.ofNumber(1))
                .target(Address.ofNumber(3))
                .value(VALUE)
                .maxPaths(2)
                .build());

        System.out.println("paths from 1 to 3 for value " + VALUE + ": " + response.getPaths().size());
        for (PathCandidate candidate : response.getPaths()) {
            String line = "hops=" + candidate.hops() + " fee=" + candidate.getEstimatedFee();
            System.out.println(line);
            log.info("{} via {}", line, candidate.getPath());
        }
    }

    private static List<ChannelEvent> demoEvents() {
        List<ChannelEvent> events = new ArrayList<>();
        long[][] channels = {{1, 2}, {2, 3}, {1, 4}, {4, 3}};
        for (int i = 0; i < channels.length; i++) {
            Address a = Address.ofNumber(channels[i][0]);
            Address b = Address.ofNumber(channels[i][1]);
            ChannelId id = ChannelId.of(i + 1);
            events.add(ChannelOpened.builder().channelId(id).participantA(a).participantB(b).settleTimeout(500).build());
            events.add(ChannelCapacityChanged.builder().channelId(id).participant(a).newCapacity(CAPACITY).build());
            events.add(ChannelCapacityChanged.builder().channelId(id).participant(b).newCapacity(CAPACITY).build());
        }
        for (long node = 1; node <= 4; node++) {
            events.add(ReachabilityChanged.builder()
                    .address(Address.ofNumber(node))
                    .status(AddressReachability.REACHABLE)
                    .build());
        }
        events.add(FeeUpdate.builder()
                .channelId(ChannelId.of(2))
                .updatingParticipant(Address.ofNumber(2))
                .flat(5)
                .timestamp(Instant.EPOCH.plusSeconds(1))
                .build());
        events.add(FeeUpdate.builder()
                .channelId(ChannelId.of(4))
                .updatingParticipant(Address.ofNumber(4))
                .flat(2)
                .timestamp(Instant.EPOCH.plusSeconds(1))
                .build());
        return events;
    }
}
