package org.disasterops.allocation.exact;

import org.disasterops.allocation.model.DisasterZone;
import org.disasterops.allocation.model.ReliefCenter;
import org.disasterops.allocation.model.Resource;
import org.disasterops.network.Location;
import org.disasterops.network.LocationType;
import org.disasterops.network.NetworkGraph;
import org.disasterops.network.RoadNetwork;
import org.disasterops.testutil.NetworkFixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Min-Cost Flow Allocator Tests")
class MinCostFlowAllocatorTest {
    private static final double EPS = 1e-6;

    private final MinCostFlowAllocator allocator = new MinCostFlowAllocator();
    private NetworkGraph regionGraph;

    @BeforeEach
    void setUp() {
        regionGraph = RoadNetwork.fromConnections(
                NetworkFixtures.regionLocations(), NetworkFixtures.regionConnections()).snapshot();
    }

    @Test
    @DisplayName("Ample stock: every zone is filled from its nearest center")
    void testNearestCenterFlow() {
        LinearAllocationResult result = allocator.allocate(
                NetworkFixtures.regionCenters(), NetworkFixtures.regionZones(), regionGraph);

        assertTrue(result.isOptimal());
        // cost = demand * priority * travel time of the nearest center
        double expected = 220 * 5 * 7.2 + 100 * 3 * 15.6 + 230 * 4 * 6.0 + 50 * 1 * 13.2;
        assertEquals(expected, result.getObjectiveValue(), 1e-4);
        assertEquals(220.0, result.deliveredTo("DZ1"), EPS);
        assertEquals(100.0, result.deliveredTo("DZ2"), EPS);
        assertEquals(230.0, result.deliveredTo("DZ3"), EPS);
        assertEquals(50.0, result.deliveredTo("DZ4"), EPS);
        assertEquals(220.0, result.shippedFrom("RC1"), EPS);
        assertEquals(380.0, result.shippedFrom("RC2"), EPS);
    }

    @Test
    @DisplayName("Short stock at the near center sends it where it saves the most")
    void testScarceNearCenter() {
        List<Location> locations = NetworkFixtures.regionLocations();
        List<ReliefCenter> centers = List.of(
                NetworkFixtures.regionCenters().get(0),
                new ReliefCenter(locations.get(1), List.of(Resource.of("water", 200, "liters")), 800)
        );

        LinearAllocationResult result = allocator.allocate(centers, NetworkFixtures.regionZones(), regionGraph);

        assertTrue(result.isOptimal());
        assertEquals(200.0, result.shippedFrom("RC2"), EPS);
        assertEquals(400.0, result.shippedFrom("RC1"), EPS);
        double expected = 220 * 5 * 7.2 + 200 * 4 * 6.0 + 30 * 4 * 24.0 + 100 * 3 * 16.8 + 50 * 1 * 14.4;
        assertEquals(expected, result.getObjectiveValue(), 1e-4);
        assertEquals(230.0, result.deliveredTo("DZ3"), EPS);
    }

    @Test
    @DisplayName("Demand above total stock has no feasible flow")
    void testInsufficientStock() {
        LinearAllocationResult result = allocator.allocate(
                ExactFixtures.scarceWaterCenters(), ExactFixtures.scarceWaterZones(), ExactFixtures.scarceWaterGraph());

        assertFalse(result.isOptimal());
        assertEquals(AllocationStatus.INFEASIBLE, result.getStatus());
        assertTrue(result.getFlows().isEmpty());
        assertTrue(Double.isNaN(result.getObjectiveValue()));
    }

    @Test
    @DisplayName("Exact stock is fully shipped and priced by travel time times priority")
    void testBalancedStock() {
        List<ReliefCenter> centers = List.of(
                new ReliefCenter(ExactFixtures.DEPOT, List.of(Resource.of("water", 160, "liters")), 200));

        LinearAllocationResult result = allocator.allocate(
                centers, ExactFixtures.scarceWaterZones(), ExactFixtures.scarceWaterGraph());

        assertTrue(result.isOptimal());
        assertEquals(80.0, result.deliveredTo("A"), EPS);
        assertEquals(80.0, result.deliveredTo("B"), EPS);
        assertEquals(80 * 5 * 2.4 + 80 * 1 * 1.2, result.getObjectiveValue(), 1e-4);
    }

    @Test
    @DisplayName("A zone with demand but no route makes the flow infeasible")
    void testUnreachableDemand() {
        Location island = Location.of("ISLAND", 41.0, -75.0, LocationType.DEMAND_ZONE);
        NetworkGraph graph = RoadNetwork.fromConnections(List.of(ExactFixtures.DEPOT, island), List.of()).snapshot();
        List<DisasterZone> zones = List.of(
                new DisasterZone(island, 5, 100, List.of(Resource.of("water", 10, "liters")), 3));

        assertEquals(AllocationStatus.INFEASIBLE,
                allocator.allocate(ExactFixtures.scarceWaterCenters(), zones, graph).getStatus());
    }
}
