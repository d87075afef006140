package org.disasterops.routing.engine;

import lombok.extern.slf4j.Slf4j;
import org.disasterops.network.Connection;
import org.disasterops.network.Location;
import org.disasterops.network.NetworkGraph;
import org.disasterops.network.RoadCondition;
import org.disasterops.network.RoadNetwork;
import org.disasterops.network.RouteSegment;
import org.disasterops.network.SegmentKey;
import org.disasterops.network.TrafficLevel;
import org.disasterops.routing.search.EdgeCostFunction;
import org.disasterops.routing.search.EdgeMetric;
import org.disasterops.routing.search.PathResult;
import org.disasterops.routing.search.RouteSearch;
import org.disasterops.routing.search.RoutingAlgorithm;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Routing over a road network whose conditions change while routes are in use.
 * <p>
 * Concurrency model:
 * <ul>
 * <li>One {@link ReentrantReadWriteLock}. Every mutation (network, history, active routes,
 * cache invalidation) runs in a single write-locked section.</li>
 * <li>Queries plan under the read lock against an immutable snapshot, then publish the
 * materialized route under the write lock. If the network changed in between, the query
 * replans; after a few lost races it plans and publishes inside the write lock.</li>
 * <li>Active routes are immutable values; recalculation swaps in a new version.</li>
 * </ul>
 * No background threads are started; cache sweeping and simulation are caller-triggered.
 */
@Slf4j
public final class DynamicRoutingEngine {
    private static final int MAX_OPTIMISTIC_ATTEMPTS = 3;
    private static final int MIN_PRIORITY = 1;
    private static final int MAX_PRIORITY = 5;

    private final RoutingEngineConfig config;
    private final Clock clock;
    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
    private final RouteCache routeCache;
    private final SegmentHistory<RoadCondition> conditionHistory;
    private final SegmentHistory<TrafficLevel> trafficHistory;
    private final Map<String, DynamicRoute> activeRoutes = new LinkedHashMap<>();
    // origin/destination -> id of the route last registered from the cacheable path
    private final Map<SegmentKey, String> cachedRouteIds = new HashMap<>();
    private final AtomicLong routeSequence = new AtomicLong();

    private RoadNetwork network;
    private NetworkGraph snapshot;
    private long networkVersion;

    public DynamicRoutingEngine() {
        this(RoutingEngineConfig.defaults(), Clock.systemUTC());
    }

    public DynamicRoutingEngine(RoutingEngineConfig config, Clock clock) {
        this.config = Objects.requireNonNull(config, "config").validate();
        this.clock = Objects.requireNonNull(clock, "clock");
        this.routeCache = new RouteCache(config.getCacheTtl(), config.getMaxCachedRoutes());
        this.conditionHistory = new SegmentHistory<>(config.getHistoryLimit());
        this.trafficHistory = new SegmentHistory<>(config.getHistoryLimit());
        this.network = new RoadNetwork(clock, config.getDefaultCondition());
        this.snapshot = network.snapshot();
    }

    // ========================================================================
    // NETWORK LIFECYCLE
    // ========================================================================

    /**
     * Replaces the whole network. Cache, active routes and history are cleared.
     */
    public void initializeNetwork(Collection<Location> locations, Collection<Connection> connections) {
        RoadNetwork fresh = RoadNetwork.fromConnections(locations, connections, clock, config.getDefaultCondition());
        lock.writeLock().lock();
        try {
            network = fresh;
            routeCache.clear();
            activeRoutes.clear();
            cachedRouteIds.clear();
            conditionHistory.clear();
            trafficHistory.clear();
            onNetworkChangedLocked();
            log.info("Initialized road network with {} locations and {} segments",
                    fresh.locations().size(), fresh.segmentCount());
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Immutable graph of the current network for optimizers and offline analysis.
     */
    public NetworkGraph networkSnapshot() {
        lock.readLock().lock();
        try {
            return snapshot;
        } finally {
            lock.readLock().unlock();
        }
    }

    // ========================================================================
    // ROUTE QUERIES
    // ========================================================================

    public Optional<DynamicRoute> findOptimalRoute(String origin, String destination, int priority) {
        return findOptimalRoute(origin, destination, priority, Set.of());
    }

    /**
     * Finds and registers the fastest route.
     * <p>
     * Without avoided nodes the origin/destination cache is consulted first and filled on a
     * miss. A cache hit returns the route already registered for that path and priority when
     * it is still active. Priorities at or above the configured threshold use A*; lower ones
     * Dijkstra.
     * </p>
     *
     * @param origin origin location id.
     * @param destination destination location id.
     * @param priority 1 (lowest) to 5 (most urgent).
     * @param avoidNodes locations the route must not pass through.
     * @return the registered route, or empty when there is no path (including unknown ids).
     */
    public Optional<DynamicRoute> findOptimalRoute(String origin, String destination, int priority, Set<String> avoidNodes) {
        requireId("origin", origin);
        requireId("destination", destination);
        requirePriority(priority);
        Objects.requireNonNull(avoidNodes, "avoidNodes");
        Set<String> avoid = Set.copyOf(avoidNodes);
        boolean cacheable = avoid.isEmpty();

        return planThenPublish(
                () -> planOptimal(origin, destination, priority, avoid, cacheable),
                planned -> {
                    if (planned == null) {
                        return Optional.empty();
                    }
                    SegmentKey pair = SegmentKey.of(origin, destination);
                    if (planned.fromCache()) {
                        DynamicRoute existing = activeRoutes.get(cachedRouteIds.getOrDefault(pair, ""));
                        if (existing != null
                                && existing.getPriority() == priority
                                && existing.getWaypoints().equals(planned.waypoints())) {
                            return Optional.of(existing);
                        }
                    }
                    Instant now = clock.instant();
                    DynamicRoute route = registerRouteLocked(nextRouteId(origin, destination, ""), planned.waypoints(), priority, now);
                    if (cacheable) {
                        cachedRouteIds.put(pair, route.getRouteId());
                        if (!planned.fromCache()) {
                            routeCache.put(origin, destination, planned.waypoints(), now);
                        }
                    }
                    return Optional.of(route);
                }
        );
    }

    /**
     * Edge-disjoint alternatives: each search excludes every edge used by earlier results.
     *
     * @param count maximum number of routes, at least 1.
     * @return up to {@code count} registered routes, fastest first; empty when none exists.
     */
    public List<DynamicRoute> findAlternativeRoutes(String origin, String destination, int count) {
        requireId("origin", origin);
        requireId("destination", destination);
        if (count < 1) {
            throw new RoutingEngineException(
                    RoutingEngineException.REASON_INVALID_ARGUMENT,
                    "count must be >= 1, got " + count
            );
        }
        return planThenPublish(
                () -> planAlternatives(origin, destination, count),
                paths -> {
                    Instant now = clock.instant();
                    List<DynamicRoute> routes = new ArrayList<>(paths.size());
                    for (int i = 0; i < paths.size(); i++) {
                        routes.add(registerRouteLocked(
                                nextRouteId(origin, destination, "_alt" + i),
                                paths.get(i),
                                config.getAlternativeRoutePriority(),
                                now
                        ));
                    }
                    return routes;
                }
        );
    }

    /**
     * Single path minimising {@code time * wTime + distance * wDistance + delayFactor * wCondition}
     * per edge. Not cached.
     */
    public Optional<DynamicRoute> findWeightedRoute(String origin, String destination, RouteObjectiveWeights weights) {
        requireId("origin", origin);
        requireId("destination", destination);
        RouteObjectiveWeights validated = Objects.requireNonNull(weights, "weights").validate();
        EdgeCostFunction cost = (graph, edgeId) -> graph.getEdgeTime(edgeId) * validated.getTime()
                + graph.getEdgeDistance(edgeId) * validated.getDistance()
                + graph.getEdgeDelayFactor(edgeId) * validated.getCondition();

        return planThenPublish(
                () -> {
                    PathResult path = new RouteSearch(snapshot).route(origin, destination, RoutingAlgorithm.DIJKSTRA, cost);
                    return path.reachable() ? path.waypoints() : null;
                },
                waypoints -> waypoints == null
                        ? Optional.<DynamicRoute>empty()
                        : Optional.of(registerRouteLocked(
                                nextRouteId(origin, destination, "_weighted"),
                                waypoints,
                                config.getAlternativeRoutePriority(),
                                clock.instant()
                        ))
        );
    }

    private PlannedRoute planOptimal(String origin, String destination, int priority, Set<String> avoid, boolean cacheable) {
        if (cacheable) {
            RouteCache.LookupResult cached = routeCache.lookup(origin, destination, clock.instant());
            if (cached.state() == RouteCache.LookupState.HIT) {
                log.debug("Route cache hit {} -> {}", origin, destination);
                return new PlannedRoute(cached.waypoints(), true);
            }
            log.debug("Route cache {} {} -> {}", cached.state(), origin, destination);
        }
        NetworkGraph graph = cacheable ? snapshot : network.snapshot(avoid, Set.of());
        RoutingAlgorithm algorithm = priority >= config.getAStarPriorityThreshold()
                ? RoutingAlgorithm.A_STAR
                : RoutingAlgorithm.DIJKSTRA;
        PathResult path = new RouteSearch(graph).route(origin, destination, algorithm, EdgeMetric.TIME);
        if (!path.reachable()) {
            log.debug("No route {} -> {} (avoiding {})", origin, destination, avoid);
            return null;
        }
        return new PlannedRoute(path.waypoints(), false);
    }

    private List<List<String>> planAlternatives(String origin, String destination, int count) {
        List<List<String>> paths = new ArrayList<>(count);
        if (origin.equals(destination)) {
            return paths;
        }
        Set<SegmentKey> usedEdges = new HashSet<>();
        for (int i = 0; i < count; i++) {
            NetworkGraph graph = usedEdges.isEmpty() ? snapshot : network.snapshot(Set.of(), usedEdges);
            PathResult path = new RouteSearch(graph).fastestPath(origin, destination);
            if (!path.reachable()) {
                break;
            }
            List<String> waypoints = path.waypoints();
            paths.add(waypoints);
            for (int j = 0; j + 1 < waypoints.size(); j++) {
                usedEdges.add(SegmentKey.of(waypoints.get(j), waypoints.get(j + 1)));
            }
        }
        return paths;
    }

    /**
     * Plans under the read lock and publishes under the write lock when the network version
     * is unchanged; otherwise replans, and after {@link #MAX_OPTIMISTIC_ATTEMPTS} lost races
     * does both under the write lock.
     */
    private <P, R> R planThenPublish(Supplier<P> planner, Function<P, R> publisher) {
        for (int attempt = 1; attempt <= MAX_OPTIMISTIC_ATTEMPTS; attempt++) {
            long observedVersion;
            P plan;
            lock.readLock().lock();
            try {
                observedVersion = networkVersion;
                plan = planner.get();
            } finally {
                lock.readLock().unlock();
            }

            lock.writeLock().lock();
            try {
                if (observedVersion == networkVersion) {
                    return publisher.apply(plan);
                }
            } finally {
                lock.writeLock().unlock();
            }
            log.debug("Network changed during planning, replanning (attempt {})", attempt);
        }

        lock.writeLock().lock();
        try {
            return publisher.apply(planner.get());
        } finally {
            lock.writeLock().unlock();
        }
    }

    private DynamicRoute registerRouteLocked(String routeId, List<String> waypoints, int priority, Instant now) {
        DynamicRoute route = DynamicRoute.materialize(routeId, waypoints, currentSegmentsLocked(waypoints), priority, now);
        activeRoutes.put(routeId, route);
        if (activeRoutes.size() > config.getMaxActiveRoutes()) {
            Iterator<String> oldest = activeRoutes.keySet().iterator();
            String dropped = oldest.next();
            oldest.remove();
            cachedRouteIds.values().remove(dropped);
            log.debug("Active route limit {} reached, dropped {}", config.getMaxActiveRoutes(), dropped);
        }
        return route;
    }

    private List<RouteSegment> currentSegmentsLocked(List<String> waypoints) {
        List<RouteSegment> segments = new ArrayList<>(Math.max(0, waypoints.size() - 1));
        for (int i = 0; i + 1 < waypoints.size(); i++) {
            String from = waypoints.get(i);
            String to = waypoints.get(i + 1);
            segments.add(network.segment(from, to).orElseThrow(
                    () -> new IllegalStateException("segment vanished from network: " + from + "->" + to)));
        }
        return segments;
    }

    private String nextRouteId(String origin, String destination, String suffix) {
        return "route_" + origin + "_" + destination + suffix + "_" + routeSequence.incrementAndGet();
    }

    // ========================================================================
    // CONDITION UPDATES
    // ========================================================================

    /**
     * Sets the physical condition of a segment.
     *
     * @return false when the segment is unknown (nothing changes).
     */
    public boolean updateCondition(String from, String to, RoadCondition condition) {
        Objects.requireNonNull(condition, "condition");
        lock.writeLock().lock();
        try {
            Optional<RouteSegment> updated = network.setCondition(from, to, condition);
            if (updated.isEmpty()) {
                return false;
            }
            conditionHistory.record(updated.get().key(), condition, updated.get().getLastUpdated());
            applySegmentChangeLocked(updated.get());
            log.info("Segment {}->{} condition set to {}", from, to, condition);
            return true;
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Sets the traffic level of a segment.
     *
     * @return false when the segment is unknown (nothing changes).
     */
    public boolean updateTraffic(String from, String to, TrafficLevel traffic) {
        Objects.requireNonNull(traffic, "traffic");
        lock.writeLock().lock();
        try {
            Optional<RouteSegment> updated = network.setTraffic(from, to, traffic);
            if (updated.isEmpty()) {
                return false;
            }
            trafficHistory.record(updated.get().key(), traffic, updated.get().getLastUpdated());
            applySegmentChangeLocked(updated.get());
            log.info("Segment {}->{} traffic set to {}", from, to, traffic);
            return true;
        } finally {
            lock.writeLock().unlock();
        }
    }

    private void applySegmentChangeLocked(RouteSegment segment) {
        onNetworkChangedLocked();
        int invalidated = routeCache.invalidateTraversing(segment.getFrom(), segment.getTo());
        if (invalidated > 0) {
            log.debug("Invalidated {} cached routes through {}", invalidated, segment.key());
        }

        Instant now = clock.instant();
        SegmentKey key = segment.key();
        for (Map.Entry<String, DynamicRoute> entry : activeRoutes.entrySet()) {
            DynamicRoute route = entry.getValue();
            if (route.traverses(key)) {
                DynamicRoute recalculated = route.recalculated(currentSegmentsLocked(route.getWaypoints()), now);
                entry.setValue(recalculated);
                log.debug("Recalculated route {}: estimated time {} -> {}",
                        route.getRouteId(), route.getEstimatedTime(), recalculated.getEstimatedTime());
            }
        }
    }

    private void onNetworkChangedLocked() {
        networkVersion++;
        snapshot = network.snapshot();
    }

    // ========================================================================
    // STATUS & STATISTICS
    // ========================================================================

    public Optional<RouteStatus> getRouteStatus(String routeId) {
        lock.readLock().lock();
        try {
            DynamicRoute route = activeRoutes.get(routeId);
            return route == null ? Optional.empty() : Optional.of(RouteStatus.of(route));
        } finally {
            lock.readLock().unlock();
        }
    }

    public Optional<DynamicRoute> getActiveRoute(String routeId) {
        lock.readLock().lock();
        try {
            return Optional.ofNullable(activeRoutes.get(routeId));
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Stops tracking a route.
     *
     * @return false when the id is not active.
     */
    public boolean releaseRoute(String routeId) {
        lock.writeLock().lock();
        try {
            cachedRouteIds.values().remove(routeId);
            return activeRoutes.remove(routeId) != null;
        } finally {
            lock.writeLock().unlock();
        }
    }

    public NetworkStatistics getNetworkStatistics() {
        lock.readLock().lock();
        try {
            Map<TrafficLevel, Integer> traffic = new EnumMap<>(TrafficLevel.class);
            for (TrafficLevel level : TrafficLevel.values()) {
                traffic.put(level, 0);
            }
            Map<RoadCondition, Integer> conditions = new EnumMap<>(RoadCondition.class);
            for (RoadCondition condition : RoadCondition.values()) {
                conditions.put(condition, 0);
            }
            int blocked = 0;
            for (RouteSegment segment : network.segments()) {
                traffic.merge(segment.getTraffic(), 1, Integer::sum);
                conditions.merge(segment.getCondition(), 1, Integer::sum);
                if (!segment.isPassable()) {
                    blocked++;
                }
            }
            int total = network.segmentCount();
            return NetworkStatistics.builder()
                    .totalSegments(total)
                    .blockedSegments(blocked)
                    .passableSegments(total - blocked)
                    .activeRoutes(activeRoutes.size())
                    .trafficDistribution(Map.copyOf(traffic))
                    .conditionDistribution(Map.copyOf(conditions))
                    .cacheSize(routeCache.size())
                    .build();
        } finally {
            lock.readLock().unlock();
        }
    }

    public List<HistoryEntry<RoadCondition>> getConditionHistory(String from, String to) {
        lock.readLock().lock();
        try {
            return conditionHistory.entries(SegmentKey.of(from, to));
        } finally {
            lock.readLock().unlock();
        }
    }

    public List<HistoryEntry<TrafficLevel>> getTrafficHistory(String from, String to) {
        lock.readLock().lock();
        try {
            return trafficHistory.entries(SegmentKey.of(from, to));
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Current segment record, for callers that inspect or simulate conditions.
     */
    public Optional<RouteSegment> getSegment(String from, String to) {
        lock.readLock().lock();
        try {
            return network.segment(from, to);
        } finally {
            lock.readLock().unlock();
        }
    }

    public List<SegmentKey> segmentKeys() {
        lock.readLock().lock();
        try {
            List<SegmentKey> keys = new ArrayList<>(network.segmentCount());
            for (RouteSegment segment : network.segments()) {
                keys.add(segment.key());
            }
            return keys;
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Removes expired cache entries.
     *
     * @return number of removed entries.
     */
    public int sweepExpiredCache() {
        lock.writeLock().lock();
        try {
            int removed = routeCache.runScheduledSweep(clock.instant(), 0);
            if (removed > 0) {
                log.debug("Swept {} expired cached routes", removed);
            }
            return removed;
        } finally {
            lock.writeLock().unlock();
        }
    }

    private static void requireId(String name, String id) {
        if (id == null || id.isBlank()) {
            throw new RoutingEngineException(RoutingEngineException.REASON_INVALID_ARGUMENT, name + " must be non-blank");
        }
    }

    private static void requirePriority(int priority) {
        if (priority < MIN_PRIORITY || priority > MAX_PRIORITY) {
            throw new RoutingEngineException(
                    RoutingEngineException.REASON_INVALID_ARGUMENT,
                    "priority must be in [" + MIN_PRIORITY + "," + MAX_PRIORITY + "], got " + priority
            );
        }
    }

    private record PlannedRoute(List<String> waypoints, boolean fromCache) {
    }
}
