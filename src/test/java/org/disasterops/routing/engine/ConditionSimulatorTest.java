package org.disasterops.routing.engine;

import org.disasterops.network.RoadCondition;
import org.disasterops.network.RouteSegment;
import org.disasterops.testutil.MutableClock;
import org.disasterops.testutil.NetworkFixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.HashSet;
import java.util.List;
import java.util.Random;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Condition Simulator Tests")
class ConditionSimulatorTest {

    private DynamicRoutingEngine engine;

    @BeforeEach
    void setUp() {
        engine = new DynamicRoutingEngine(RoutingEngineConfig.defaults(), MutableClock.atEpoch());
        engine.initializeNetwork(NetworkFixtures.regionLocations(), NetworkFixtures.regionConnections());
    }

    @Test
    @DisplayName("Traffic simulation touches three distinct segments through the engine")
    void testSimulateTraffic() {
        List<SimulatedChange> changes = new ConditionSimulator(engine, new Random(7L)).simulateTraffic();

        assertEquals(ConditionSimulator.TRAFFIC_SAMPLE_SIZE, changes.size());
        Set<Object> distinct = new HashSet<>();
        for (SimulatedChange change : changes) {
            distinct.add(change.segment());
            RouteSegment segment = engine.getSegment(change.segment().from(), change.segment().to()).orElseThrow();
            assertEquals(change.value(), segment.getTraffic());
            assertEquals(1, engine.getTrafficHistory(change.segment().from(), change.segment().to()).size());
        }
        assertEquals(changes.size(), distinct.size());
    }

    @Test
    @DisplayName("Incidents degrade or block segments and never improve them")
    void testSimulateIncidents() {
        ConditionSimulator simulator = new ConditionSimulator(engine, new Random(3L));
        for (int round = 0; round < 20; round++) {
            List<SimulatedChange> changes = simulator.simulateIncidents();
            assertEquals(ConditionSimulator.INCIDENT_SAMPLE_SIZE, changes.size());
            for (SimulatedChange change : changes) {
                RoadCondition condition = (RoadCondition) change.value();
                assertTrue(condition == RoadCondition.POOR
                        || condition == RoadCondition.DAMAGED
                        || condition == RoadCondition.BLOCKED, condition::toString);
            }
        }
        NetworkStatistics stats = engine.getNetworkStatistics();
        assertEquals(0, stats.getConditionDistribution().get(RoadCondition.EXCELLENT));
        assertEquals(0, stats.getConditionDistribution().get(RoadCondition.FAIR));
        assertTrue(stats.getBlockedSegments() > 0);
    }

    @Test
    @DisplayName("Same seed replays the same changes")
    void testDeterministicWithSeed() {
        DynamicRoutingEngine other = new DynamicRoutingEngine(RoutingEngineConfig.defaults(), MutableClock.atEpoch());
        other.initializeNetwork(NetworkFixtures.regionLocations(), NetworkFixtures.regionConnections());

        List<SimulatedChange> first = new ConditionSimulator(engine, new Random(99L)).simulateTraffic();
        List<SimulatedChange> second = new ConditionSimulator(other, new Random(99L)).simulateTraffic();

        assertEquals(first, second);
    }

    @Test
    @DisplayName("Empty network produces no changes")
    void testEmptyNetwork() {
        DynamicRoutingEngine empty = new DynamicRoutingEngine();
        ConditionSimulator simulator = new ConditionSimulator(empty, new Random(1L));

        assertTrue(simulator.simulateTraffic().isEmpty());
        assertTrue(simulator.simulateIncidents().isEmpty());
        assertEquals(0, empty.getNetworkStatistics().getTotalSegments());
    }
}
