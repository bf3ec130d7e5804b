package org.Aayush.pathfinding.core;

import lombok.Builder;
import lombok.extern.slf4j.Slf4j;
import org.Aayush.pathfinding.graph.Address;
import org.Aayush.pathfinding.graph.GraphView;
import org.Aayush.pathfinding.graph.NetworkGraph;
import org.Aayush.pathfinding.search.FeeAwarePathPlanner;
import org.Aayush.pathfinding.search.PathPlanner;
import org.Aayush.pathfinding.search.PathQuery;
import org.Aayush.pathfinding.search.PlannedPath;

import java.util.List;
import java.util.Objects;
import java.util.OptionalLong;

/**
 * Path query facade: validates requests and runs the planner against a consistent graph view.
 * <p>
 * Queries only take the graph's shared lock, so any number of them run concurrently while
 * ingestion waits for in-flight queries before publishing a mutation.
 * </p>
 */
@Slf4j
public final class PathfindingCore implements PathfinderService {
    public static final String REASON_REQUEST_REQUIRED = "QUERY_REQUEST_REQUIRED";
    public static final String REASON_SOURCE_REQUIRED = "QUERY_SOURCE_REQUIRED";
    public static final String REASON_TARGET_REQUIRED = "QUERY_TARGET_REQUIRED";
    public static final String REASON_UNKNOWN_SOURCE = "QUERY_UNKNOWN_SOURCE";
    public static final String REASON_UNKNOWN_TARGET = "QUERY_UNKNOWN_TARGET";
    public static final String REASON_SAME_SOURCE_TARGET = "QUERY_SAME_SOURCE_TARGET";
    public static final String REASON_NON_POSITIVE_VALUE = "QUERY_NON_POSITIVE_VALUE";
    public static final String REASON_INVALID_MAX_PATHS = "QUERY_INVALID_MAX_PATHS";

    private final NetworkGraph graph;
    private final PathPlanner planner;
    private final PathfindingRuntimeConfig config;

    /**
     * Creates the query facade.
     *
     * @param graph live network graph.
     * @param planner optional planner override.
     * @param config optional runtime limits, {@link PathfindingRuntimeConfig#defaults()} when absent.
     */
    @Builder
    public PathfindingCore(NetworkGraph graph, PathPlanner planner, PathfindingRuntimeConfig config) {
        this.graph = Objects.requireNonNull(graph, "graph");
        this.planner = planner == null ? new FeeAwarePathPlanner() : planner;
        this.config = config == null ? PathfindingRuntimeConfig.defaults() : config;
        validateConfig(this.config);
    }

    /**
     * Executes one path query.
     *
     * @throws PathfindingCoreException when the request is malformed.
     */
    @Override
    public PathResponse findPaths(PathRequest request) {
        PathQuery query = toQuery(request);
        List<PlannedPath> planned = graph.read(view -> {
            requireKnown(view, query.source(), REASON_UNKNOWN_SOURCE, "source");
            requireKnown(view, query.target(), REASON_UNKNOWN_TARGET, "target");
            return planner.plan(view, query);
        });

        PathResponse.PathResponseBuilder builder = PathResponse.builder()
                .source(query.source())
                .target(query.target())
                .value(query.value());
        for (PlannedPath path : planned) {
            builder.path(PathCandidate.builder()
                    .path(path.nodes())
                    .estimatedFee(path.fee())
                    .hopFees(path.hopFees())
                    .build());
        }
        PathResponse response = builder.build();
        log.debug(
                "Query {} -> {} value={} maxPaths={} returned {} path(s)",
                query.source(),
                query.target(),
                query.value(),
                query.maxPaths(),
                response.getPaths().size()
        );
        return response;
    }

    /**
     * Fee of the cheapest feasible path, empty when no path is feasible.
     *
     * @throws PathfindingCoreException when the query is malformed.
     */
    public OptionalLong estimateFee(Address source, Address target, long value) {
        PathResponse response = findPaths(PathRequest.builder()
                .source(source)
                .target(target)
                .value(value)
                .maxPaths(1)
                .build());
        if (!response.isFeasible()) {
            return OptionalLong.empty();
        }
        return OptionalLong.of(response.getPaths().get(0).getEstimatedFee());
    }

    private PathQuery toQuery(PathRequest request) {
        if (request == null) {
            throw new PathfindingCoreException(REASON_REQUEST_REQUIRED, "path request must be provided");
        }
        if (request.getSource() == null) {
            throw new PathfindingCoreException(REASON_SOURCE_REQUIRED, "source must be provided");
        }
        if (request.getTarget() == null) {
            throw new PathfindingCoreException(REASON_TARGET_REQUIRED, "target must be provided");
        }
        if (request.getSource().equals(request.getTarget())) {
            throw new PathfindingCoreException(
                    REASON_SAME_SOURCE_TARGET,
                    "source and target are both " + request.getSource()
            );
        }
        if (request.getValue() <= 0) {
            throw new PathfindingCoreException(
                    REASON_NON_POSITIVE_VALUE,
                    "value must be > 0, got " + request.getValue()
            );
        }
        int maxPaths = request.getMaxPaths() == null ? config.getDefaultMaxPaths() : request.getMaxPaths();
        if (maxPaths <= 0 || maxPaths > config.getMaxPathsPerRequest()) {
            throw new PathfindingCoreException(
                    REASON_INVALID_MAX_PATHS,
                    "maxPaths must be in [1, " + config.getMaxPathsPerRequest() + "], got " + maxPaths
            );
        }
        return new PathQuery(
                request.getSource(),
                request.getTarget(),
                request.getValue(),
                maxPaths,
                config.getMaxPathHops(),
                Math.multiplyExact(maxPaths, config.getLabelsPerNodeFactor())
        );
    }

    private static void requireKnown(GraphView view, Address address, String reasonCode, String field) {
        if (!view.containsNode(address)) {
            throw new PathfindingCoreException(reasonCode, field + " " + address + " has no open channel");
        }
    }

    private static void validateConfig(PathfindingRuntimeConfig config) {
        if (config.getMaxPathsPerRequest() <= 0) {
            throw new IllegalArgumentException("maxPathsPerRequest must be > 0");
        }
        if (config.getDefaultMaxPaths() <= 0 || config.getDefaultMaxPaths() > config.getMaxPathsPerRequest()) {
            throw new IllegalArgumentException("defaultMaxPaths must be in [1, maxPathsPerRequest]");
        }
        if (config.getMaxPathHops() <= 0) {
            throw new IllegalArgumentException("maxPathHops must be > 0");
        }
        if (config.getLabelsPerNodeFactor() <= 0) {
            throw new IllegalArgumentException("labelsPerNodeFactor must be > 0");
        }
    }
}
