package org.disasterops.routing.engine;

import org.disasterops.network.Connection;
import org.disasterops.network.Location;
import org.disasterops.network.LocationType;
import org.disasterops.network.NetworkGraph;
import org.disasterops.network.RoadCondition;
import org.disasterops.network.TrafficLevel;
import org.disasterops.testutil.MutableClock;
import org.disasterops.testutil.NetworkFixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Random;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Dynamic Routing Engine Tests")
class DynamicRoutingEngineTest {

    private MutableClock clock;
    private DynamicRoutingEngine engine;

    @BeforeEach
    void setUp() {
        clock = MutableClock.atEpoch();
        engine = new DynamicRoutingEngine(RoutingEngineConfig.defaults(), clock);
        engine.initializeNetwork(NetworkFixtures.triangleLocations(), NetworkFixtures.triangleConnections());
    }

    @Test
    @DisplayName("Triangle: fastest route goes through B, blocking B->C reroutes to the direct road")
    void testBlockedSegmentReroutes() {
        DynamicRoute first = engine.findOptimalRoute("A", "C", 3).orElseThrow();
        assertEquals(List.of("A", "B", "C"), first.getWaypoints());
        assertEquals(2.4, first.getEstimatedTime(), 1e-9);
        assertEquals(2.0, first.getTotalDistance(), 1e-12);
        assertEquals(3, first.getPriority());

        assertTrue(engine.updateCondition("B", "C", RoadCondition.BLOCKED));

        DynamicRoute second = engine.findOptimalRoute("A", "C", 3).orElseThrow();
        assertEquals(List.of("A", "C"), second.getWaypoints());
        assertEquals(6.0, second.getEstimatedTime(), 1e-9);
    }

    @Test
    @DisplayName("Triangle with EXCELLENT roads: estimated time is the base time, 2 then 5 after blocking B->C")
    void testConfiguredDefaultCondition() {
        DynamicRoutingEngine excellent = new DynamicRoutingEngine(
                RoutingEngineConfig.builder().defaultCondition(RoadCondition.EXCELLENT).build(), clock);
        excellent.initializeNetwork(NetworkFixtures.triangleLocations(), NetworkFixtures.triangleConnections());

        DynamicRoute first = excellent.findOptimalRoute("A", "C", 3).orElseThrow();
        assertEquals(List.of("A", "B", "C"), first.getWaypoints());
        assertEquals(2.0, first.getEstimatedTime(), 1e-9);
        assertEquals(RoadCondition.EXCELLENT, excellent.getSegment("A", "B").orElseThrow().getCondition());

        assertTrue(excellent.updateCondition("B", "C", RoadCondition.BLOCKED));

        DynamicRoute second = excellent.findOptimalRoute("A", "C", 3).orElseThrow();
        assertEquals(List.of("A", "C"), second.getWaypoints());
        assertEquals(5.0, second.getEstimatedTime(), 1e-9);
    }

    @Test
    @DisplayName("Default condition must be passable")
    void testBlockedDefaultConditionRejected() {
        RoutingEngineException ex = assertThrows(RoutingEngineException.class, () -> new DynamicRoutingEngine(
                RoutingEngineConfig.builder().defaultCondition(RoadCondition.BLOCKED).build(), clock));
        assertEquals(RoutingEngineException.REASON_INVALID_CONFIG, ex.reasonCode());
    }

    @Test
    @DisplayName("Repeated cached queries reuse the registered route")
    void testCacheHitReusesActiveRoute() {
        DynamicRoute first = engine.findOptimalRoute("A", "C", 2).orElseThrow();
        for (int i = 0; i < 5; i++) {
            assertEquals(first.getRouteId(), engine.findOptimalRoute("A", "C", 2).orElseThrow().getRouteId());
        }
        assertEquals(1, engine.getNetworkStatistics().getActiveRoutes());

        DynamicRoute urgent = engine.findOptimalRoute("A", "C", 5).orElseThrow();
        assertNotEquals(first.getRouteId(), urgent.getRouteId());
        assertEquals(2, engine.getNetworkStatistics().getActiveRoutes());

        assertTrue(engine.releaseRoute(first.getRouteId()));
        DynamicRoute renewed = engine.findOptimalRoute("A", "C", 2).orElseThrow();
        assertNotEquals(first.getRouteId(), renewed.getRouteId());
        assertEquals(first.getWaypoints(), renewed.getWaypoints());
    }

    @Test
    @DisplayName("Active routes beyond the limit drop the oldest registration")
    void testActiveRouteLimit() {
        DynamicRoutingEngine bounded = new DynamicRoutingEngine(
                RoutingEngineConfig.builder().maxActiveRoutes(2).build(), clock);
        bounded.initializeNetwork(NetworkFixtures.triangleLocations(), NetworkFixtures.triangleConnections());

        DynamicRoute first = bounded.findOptimalRoute("A", "C", 1).orElseThrow();
        DynamicRoute second = bounded.findOptimalRoute("A", "B", 1).orElseThrow();
        DynamicRoute third = bounded.findOptimalRoute("B", "C", 1).orElseThrow();

        assertEquals(2, bounded.getNetworkStatistics().getActiveRoutes());
        assertTrue(bounded.getActiveRoute(first.getRouteId()).isEmpty());
        assertTrue(bounded.getActiveRoute(second.getRouteId()).isPresent());
        assertTrue(bounded.getActiveRoute(third.getRouteId()).isPresent());
    }

    @Test
    @DisplayName("Blocking a segment recalculates active routes through it and marks them BLOCKED")
    void testActiveRouteRecalculation() {
        DynamicRoute route = engine.findOptimalRoute("A", "C", 2).orElseThrow();
        clock.advance(Duration.ofSeconds(30));

        engine.updateCondition("B", "C", RoadCondition.BLOCKED);

        RouteStatus status = engine.getRouteStatus(route.getRouteId()).orElseThrow();
        assertEquals(RouteState.BLOCKED, status.getState());
        assertEquals(1, status.getBlockedSegments());
        assertEquals(Double.POSITIVE_INFINITY, status.getEstimatedTime());
        assertEquals(Double.POSITIVE_INFINITY, status.getDelayFactor());
        assertEquals(clock.instant(), status.getLastUpdated());
        assertEquals(List.of("A", "B", "C"), status.getWaypoints());

        DynamicRoute recalculated = engine.getActiveRoute(route.getRouteId()).orElseThrow();
        assertEquals(route.getCreatedAt(), recalculated.getCreatedAt());
        assertEquals(clock.instant(), recalculated.getLastRecalculatedAt());

        engine.updateCondition("B", "C", RoadCondition.FAIR);
        RouteStatus restored = engine.getRouteStatus(route.getRouteId()).orElseThrow();
        assertEquals(RouteState.ACTIVE, restored.getState());
        assertEquals(1.2 + 1.5, restored.getEstimatedTime(), 1e-9);
        assertEquals((1.2 + 1.5) / 2.0, restored.getDelayFactor(), 1e-9);
    }

    @Test
    @DisplayName("Traffic updates rescale routes that use the segment only")
    void testTrafficRecalculation() {
        DynamicRoute viaB = engine.findOptimalRoute("A", "C", 3).orElseThrow();
        DynamicRoute toB = engine.findOptimalRoute("A", "B", 3).orElseThrow();

        assertTrue(engine.updateTraffic("B", "C", TrafficLevel.SEVERE));

        assertEquals(1.2 + 1.2 * 2.5, engine.getActiveRoute(viaB.getRouteId()).orElseThrow().getEstimatedTime(), 1e-9);
        assertEquals(1.2, engine.getActiveRoute(toB.getRouteId()).orElseThrow().getEstimatedTime(), 1e-9);
    }

    @Test
    @DisplayName("Cached route is reused within TTL and recomputed after it")
    void testCacheTtl() {
        List<Location> locations = new ArrayList<>(NetworkFixtures.triangleLocations());
        locations.add(Location.of("D", 40.0090, -73.9990, LocationType.TRANSIT_NODE));
        List<Connection> connections = new ArrayList<>(NetworkFixtures.triangleConnections());
        connections.add(Connection.of("A", "D", 1.0, 1.0));
        connections.add(Connection.of("D", "C", 1.0, 1.1));
        engine.initializeNetwork(locations, connections);

        DynamicRoute first = engine.findOptimalRoute("A", "C", 2).orElseThrow();
        assertEquals(List.of("A", "B", "C"), first.getWaypoints());
        assertEquals(1, engine.getNetworkStatistics().getCacheSize());

        // D->C is not on the cached path, so the entry survives although A,D,C is now faster
        engine.updateCondition("D", "C", RoadCondition.EXCELLENT);
        clock.advance(Duration.ofMinutes(4));
        DynamicRoute cached = engine.findOptimalRoute("A", "C", 2).orElseThrow();
        assertEquals(first.getWaypoints(), cached.getWaypoints());
        assertEquals(first.getRouteId(), cached.getRouteId());

        clock.advance(Duration.ofMinutes(1));
        DynamicRoute recomputed = engine.findOptimalRoute("A", "C", 2).orElseThrow();
        assertEquals(List.of("A", "D", "C"), recomputed.getWaypoints());
        assertEquals(1.2 + 1.1, recomputed.getEstimatedTime(), 1e-9);
    }

    @Test
    @DisplayName("Updates invalidate cache entries traversing the segment")
    void testCacheInvalidation() {
        engine.findOptimalRoute("A", "C", 1);
        engine.findOptimalRoute("A", "B", 1);
        assertEquals(2, engine.getNetworkStatistics().getCacheSize());

        engine.updateTraffic("B", "C", TrafficLevel.HEAVY);
        assertEquals(1, engine.getNetworkStatistics().getCacheSize());

        engine.updateTraffic("A", "B", TrafficLevel.HEAVY);
        assertEquals(0, engine.getNetworkStatistics().getCacheSize());
    }

    @Test
    @DisplayName("Expired entries are removed by the caller-triggered sweep")
    void testSweep() {
        engine.findOptimalRoute("A", "C", 1);
        engine.findOptimalRoute("A", "B", 1);

        assertEquals(0, engine.sweepExpiredCache());
        clock.advance(Duration.ofMinutes(5));
        assertEquals(2, engine.sweepExpiredCache());
        assertEquals(0, engine.getNetworkStatistics().getCacheSize());
    }

    @Test
    @DisplayName("High priority uses A* with the same optimal result")
    void testHighPriorityRoute() {
        DynamicRoute low = engine.findOptimalRoute("A", "C", 1, Set.of("unused")).orElseThrow();
        DynamicRoute high = engine.findOptimalRoute("A", "C", 5, Set.of("unused")).orElseThrow();

        assertEquals(low.getWaypoints(), high.getWaypoints());
        assertEquals(low.getEstimatedTime(), high.getEstimatedTime(), 1e-12);
    }

    @Test
    @DisplayName("Avoided nodes are excluded and bypass the cache")
    void testAvoidNodes() {
        DynamicRoute route = engine.findOptimalRoute("A", "C", 3, Set.of("B")).orElseThrow();

        assertEquals(List.of("A", "C"), route.getWaypoints());
        assertEquals(0, engine.getNetworkStatistics().getCacheSize());
        assertTrue(engine.findOptimalRoute("A", "C", 3, Set.of("C")).isEmpty());
    }

    @Test
    @DisplayName("No path or unknown ids yield empty results")
    void testNoPath() {
        assertTrue(engine.findOptimalRoute("C", "A", 3).isEmpty());
        assertTrue(engine.findOptimalRoute("A", "nowhere", 3).isEmpty());
        assertTrue(engine.findAlternativeRoutes("C", "A", 2).isEmpty());
        assertEquals(0, engine.getNetworkStatistics().getActiveRoutes());
    }

    @Test
    @DisplayName("Invalid arguments are rejected with reason codes")
    void testInvalidArguments() {
        RoutingEngineException priority = assertThrows(RoutingEngineException.class,
                () -> engine.findOptimalRoute("A", "C", 6));
        assertEquals(RoutingEngineException.REASON_INVALID_ARGUMENT, priority.reasonCode());
        assertThrows(RoutingEngineException.class, () -> engine.findOptimalRoute("A", "C", 0));
        assertThrows(RoutingEngineException.class, () -> engine.findOptimalRoute(" ", "C", 3));
        assertThrows(RoutingEngineException.class, () -> engine.findAlternativeRoutes("A", "C", 0));
        assertThrows(RoutingEngineException.class,
                () -> engine.findWeightedRoute("A", "C", RouteObjectiveWeights.builder().time(-1.0).build()));

        RoutingEngineException config = assertThrows(RoutingEngineException.class,
                () -> new DynamicRoutingEngine(RoutingEngineConfig.builder().cacheTtl(Duration.ZERO).build(), clock));
        assertEquals(RoutingEngineException.REASON_INVALID_CONFIG, config.reasonCode());
        assertTrue(config.getMessage().startsWith("[ENGINE_INVALID_CONFIG]"));
    }

    @Test
    @DisplayName("Alternatives are edge-disjoint and stop when no path remains")
    void testAlternativeRoutes() {
        List<DynamicRoute> routes = engine.findAlternativeRoutes("A", "C", 3);

        assertEquals(2, routes.size());
        assertEquals(List.of("A", "B", "C"), routes.get(0).getWaypoints());
        assertEquals(List.of("A", "C"), routes.get(1).getWaypoints());
        assertTrue(routes.get(0).getRouteId().startsWith("route_A_C_alt0_"));
        assertTrue(routes.get(1).getRouteId().startsWith("route_A_C_alt1_"));
        for (DynamicRoute route : routes) {
            assertTrue(engine.getActiveRoute(route.getRouteId()).isPresent());
        }
        assertTrue(engine.findAlternativeRoutes("A", "A", 2).isEmpty());
    }

    @Test
    @DisplayName("Weighted route with heavy distance weight prefers the shorter path")
    void testWeightedRoute() {
        RouteObjectiveWeights weights = RouteObjectiveWeights.builder().time(0.0).distance(1.0).condition(0.0).build();
        DynamicRoute route = engine.findWeightedRoute("A", "C", weights).orElseThrow();
        assertEquals(List.of("A", "B", "C"), route.getWaypoints());

        engine.updateCondition("A", "B", RoadCondition.BLOCKED);
        assertEquals(List.of("A", "C"), engine.findWeightedRoute("A", "C", weights).orElseThrow().getWaypoints());
    }

    @Test
    @DisplayName("Statistics report segment, route and distribution counts")
    void testStatistics() {
        engine.findOptimalRoute("A", "C", 3);
        engine.updateCondition("A", "C", RoadCondition.BLOCKED);
        engine.updateTraffic("A", "B", TrafficLevel.MODERATE);

        NetworkStatistics stats = engine.getNetworkStatistics();
        assertEquals(3, stats.getTotalSegments());
        assertEquals(1, stats.getBlockedSegments());
        assertEquals(2, stats.getPassableSegments());
        assertEquals(1, stats.getActiveRoutes());
        assertEquals(2, stats.getTrafficDistribution().get(TrafficLevel.LIGHT));
        assertEquals(1, stats.getTrafficDistribution().get(TrafficLevel.MODERATE));
        assertEquals(0, stats.getTrafficDistribution().get(TrafficLevel.SEVERE));
        assertEquals(2, stats.getConditionDistribution().get(RoadCondition.GOOD));
        assertEquals(1, stats.getConditionDistribution().get(RoadCondition.BLOCKED));
        assertEquals(0, stats.getConditionDistribution().get(RoadCondition.EXCELLENT));
    }

    @Test
    @DisplayName("History keeps the newest entries up to the limit")
    void testBoundedHistory() {
        DynamicRoutingEngine bounded = new DynamicRoutingEngine(
                RoutingEngineConfig.builder().historyLimit(3).build(), clock);
        bounded.initializeNetwork(NetworkFixtures.triangleLocations(), NetworkFixtures.triangleConnections());

        RoadCondition[] sequence = {
                RoadCondition.FAIR, RoadCondition.POOR, RoadCondition.DAMAGED, RoadCondition.BLOCKED, RoadCondition.GOOD
        };
        for (RoadCondition condition : sequence) {
            clock.advance(Duration.ofSeconds(1));
            bounded.updateCondition("A", "B", condition);
        }
        bounded.updateTraffic("A", "B", TrafficLevel.HEAVY);

        List<HistoryEntry<RoadCondition>> history = bounded.getConditionHistory("A", "B");
        assertEquals(3, history.size());
        assertEquals(RoadCondition.DAMAGED, history.get(0).value());
        assertEquals(RoadCondition.GOOD, history.get(2).value());
        assertEquals(clock.instant(), history.get(2).recordedAt());
        assertEquals(1, bounded.getTrafficHistory("A", "B").size());
        assertTrue(bounded.getConditionHistory("B", "C").isEmpty());
    }

    @Test
    @DisplayName("Unknown segments are not found and change nothing")
    void testUnknownSegmentUpdate() {
        NetworkGraph before = engine.networkSnapshot();

        assertFalse(engine.updateCondition("C", "A", RoadCondition.BLOCKED));
        assertFalse(engine.updateTraffic("X", "Y", TrafficLevel.HEAVY));

        assertSame(before, engine.networkSnapshot());
        assertTrue(engine.getConditionHistory("C", "A").isEmpty());
        assertEquals(0, engine.getNetworkStatistics().getBlockedSegments());
    }

    @Test
    @DisplayName("Released and unknown routes have no status")
    void testReleaseRoute() {
        DynamicRoute route = engine.findOptimalRoute("A", "B", 3).orElseThrow();

        assertTrue(engine.releaseRoute(route.getRouteId()));
        assertFalse(engine.releaseRoute(route.getRouteId()));
        assertEquals(Optional.empty(), engine.getRouteStatus(route.getRouteId()));
        assertEquals(Optional.empty(), engine.getRouteStatus("route_missing"));
    }

    @Test
    @DisplayName("Re-initialization clears routes, cache and history")
    void testReinitialize() {
        engine.findOptimalRoute("A", "C", 3);
        engine.updateTraffic("A", "B", TrafficLevel.HEAVY);

        engine.initializeNetwork(NetworkFixtures.regionLocations(), NetworkFixtures.regionConnections());

        NetworkStatistics stats = engine.getNetworkStatistics();
        assertEquals(0, stats.getActiveRoutes());
        assertEquals(0, stats.getCacheSize());
        assertEquals(14, stats.getTotalSegments());
        assertTrue(engine.getTrafficHistory("A", "B").isEmpty());
        assertEquals(7, engine.networkSnapshot().nodeCount());
    }

    @Test
    @Timeout(value = 20, unit = TimeUnit.SECONDS)
    @DisplayName("Concurrent queries and updates keep routes consistent with the network")
    void testConcurrentQueriesAndUpdates() throws Exception {
        engine.initializeNetwork(NetworkFixtures.randomLocations(30, 5L), NetworkFixtures.randomConnections(30, 60, 5L));
        List<String> nodes = new ArrayList<>();
        for (int i = 0; i < 30; i++) {
            nodes.add("N" + i);
        }

        int readers = 4;
        ExecutorService executor = Executors.newFixedThreadPool(readers + 1);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<?>> futures = new ArrayList<>();
        for (int r = 0; r < readers; r++) {
            long seed = r;
            futures.add(executor.submit(() -> {
                Random random = new Random(seed);
                start.await();
                for (int i = 0; i < 200; i++) {
                    String origin = nodes.get(random.nextInt(nodes.size()));
                    String destination = nodes.get(random.nextInt(nodes.size()));
                    Optional<DynamicRoute> route = engine.findOptimalRoute(origin, destination, 1 + random.nextInt(5));
                    route.ifPresent(found -> {
                        assertEquals(origin, found.getOrigin());
                        assertEquals(destination, found.getDestination());
                        assertEquals(found.getWaypoints().size() - 1, found.getSegments().size());
                    });
                }
                return null;
            }));
        }
        futures.add(executor.submit(() -> {
            ConditionSimulator simulator = new ConditionSimulator(engine, new Random(11L));
            start.await();
            for (int i = 0; i < 50; i++) {
                simulator.simulateTraffic();
                simulator.simulateIncidents();
            }
            return null;
        }));

        start.countDown();
        for (Future<?> future : futures) {
            future.get(15, TimeUnit.SECONDS);
        }
        executor.shutdown();
        assertTrue(executor.awaitTermination(5, TimeUnit.SECONDS));

        NetworkStatistics stats = engine.getNetworkStatistics();
        assertEquals(stats.getTotalSegments(), stats.getBlockedSegments() + stats.getPassableSegments());
        for (String node : nodes) {
            engine.findOptimalRoute("N0", node, 3).ifPresent(route -> {
                for (int i = 0; i + 1 < route.getWaypoints().size(); i++) {
                    assertTrue(engine.getSegment(route.getWaypoints().get(i), route.getWaypoints().get(i + 1))
                            .orElseThrow().isPassable());
                }
            });
        }
    }
}
