package org.disasterops.testutil;

import org.disasterops.allocation.model.DisasterZone;
import org.disasterops.allocation.model.ReliefCenter;
import org.disasterops.allocation.model.Resource;
import org.disasterops.network.Connection;
import org.disasterops.network.Location;
import org.disasterops.network.LocationType;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

/**
 * Shared networks and allocation instances for tests.
 */
public final class NetworkFixtures {

    private NetworkFixtures() {
    }

    /**
     * A, B, C roughly 1 km apart; A->B and B->C take 1, the direct A->C takes 5.
     */
    public static List<Location> triangleLocations() {
        return List.of(
                Location.of("A", 40.0000, -74.0000, LocationType.SUPPLY_CENTER),
                Location.of("B", 40.0090, -74.0000, LocationType.TRANSIT_NODE),
                Location.of("C", 40.0180, -74.0000, LocationType.DEMAND_ZONE)
        );
    }

    public static List<Connection> triangleConnections() {
        return List.of(
                Connection.of("A", "B", 1.0, 1.0),
                Connection.of("B", "C", 1.0, 1.0),
                Connection.of("A", "C", 5.0, 5.0)
        );
    }

    /**
     * Two relief centers, four zones, a transit hub and a few bidirectional roads.
     */
    public static List<Location> regionLocations() {
        return List.of(
                Location.of("RC1", 40.7128, -74.0060, LocationType.SUPPLY_CENTER),
                Location.of("RC2", 40.7580, -73.9855, LocationType.SUPPLY_CENTER),
                Location.of("HUB", 40.7350, -73.9950, LocationType.TRANSIT_NODE),
                Location.of("DZ1", 40.7000, -74.0150, LocationType.DEMAND_ZONE),
                Location.of("DZ2", 40.7300, -73.9700, LocationType.DEMAND_ZONE),
                Location.of("DZ3", 40.7700, -73.9600, LocationType.DEMAND_ZONE),
                Location.of("DZ4", 40.7450, -74.0050, LocationType.DEMAND_ZONE)
        );
    }

    public static List<Connection> regionConnections() {
        List<Connection> connections = new ArrayList<>();
        both(connections, "RC1", "DZ1", 2.0, 6.0);
        both(connections, "RC1", "HUB", 3.0, 8.0);
        both(connections, "RC2", "HUB", 3.0, 7.0);
        both(connections, "RC2", "DZ3", 2.0, 5.0);
        both(connections, "HUB", "DZ2", 2.5, 6.0);
        both(connections, "HUB", "DZ4", 1.5, 4.0);
        both(connections, "DZ1", "DZ4", 5.0, 15.0);
        return connections;
    }

    public static List<ReliefCenter> regionCenters() {
        List<Location> locations = regionLocations();
        return List.of(
                new ReliefCenter(locations.get(0), List.of(
                        Resource.of("water", 500, "liters"),
                        Resource.of("food", 300, "kg"),
                        Resource.of("medicine", 50, "kits")
                ), 1000),
                new ReliefCenter(locations.get(1), List.of(
                        Resource.of("water", 400, "liters"),
                        Resource.of("food", 200, "kg")
                ), 800)
        );
    }

    public static List<DisasterZone> regionZones() {
        List<Location> locations = regionLocations();
        return List.of(
                new DisasterZone(locations.get(3), 9, 5000, List.of(
                        Resource.of("water", 200, "liters"),
                        Resource.of("medicine", 20, "kits")
                ), 5),
                new DisasterZone(locations.get(4), 5, 2000, List.of(
                        Resource.of("food", 100, "kg")
                ), 3),
                new DisasterZone(locations.get(5), 7, 3000, List.of(
                        Resource.of("water", 150, "liters"),
                        Resource.of("food", 80, "kg")
                ), 4),
                new DisasterZone(locations.get(6), 2, 500, List.of(
                        Resource.of("water", 50, "liters")
                ), 1)
        );
    }

    /**
     * Random grid-like instance: {@code nodes} locations on a small lattice with nearby roads
     * in both directions.
     */
    public static List<Location> randomLocations(int nodes, long seed) {
        Random random = new Random(seed);
        List<Location> locations = new ArrayList<>(nodes);
        for (int i = 0; i < nodes; i++) {
            locations.add(Location.of(
                    "N" + i,
                    40.0 + random.nextDouble() * 0.5,
                    -74.0 + random.nextDouble() * 0.5,
                    LocationType.TRANSIT_NODE
            ));
        }
        return locations;
    }

    public static List<Connection> randomConnections(int nodes, int extraEdges, long seed) {
        Random random = new Random(seed);
        List<Connection> connections = new ArrayList<>();
        for (int i = 0; i + 1 < nodes; i++) {
            double distance = 1.0 + random.nextDouble() * 9.0;
            both(connections, "N" + i, "N" + (i + 1), distance, distance * (1.0 + random.nextDouble()));
        }
        for (int e = 0; e < extraEdges; e++) {
            int from = random.nextInt(nodes);
            int to = random.nextInt(nodes);
            if (from == to) {
                continue;
            }
            double distance = 1.0 + random.nextDouble() * 20.0;
            connections.add(Connection.of("N" + from, "N" + to, distance, distance * (1.0 + random.nextDouble())));
        }
        return connections;
    }

    private static void both(List<Connection> connections, String a, String b, double distance, double time) {
        connections.add(Connection.of(a, b, distance, time));
        connections.add(Connection.of(b, a, distance, time));
    }
}
