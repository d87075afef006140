package org.disasterops.network;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.Set;

/**
 * Mutable road network: the authoritative segment table plus a derived adjacency of
 * passable edges.
 *
 * <p>Invariant: a segment is an adjacency edge iff its condition is not
 * {@link RoadCondition#BLOCKED}. Blocked segments stay in the table so they can be
 * restored and reported.</p>
 *
 * <p>Not thread-safe. {@code DynamicRoutingEngine} guards every instance it owns; routing
 * and optimization read immutable {@link #snapshot()} graphs instead.</p>
 */
public final class RoadNetwork {

    private final Clock clock;
    private final RoadCondition defaultCondition;
    private final Map<String, Location> locations = new LinkedHashMap<>();
    private final Map<SegmentKey, RouteSegment> segments = new LinkedHashMap<>();
    // from -> (to -> effective time) for passable segments only
    private final Map<String, Map<String, Double>> adjacency = new LinkedHashMap<>();

    public RoadNetwork() {
        this(Clock.systemUTC());
    }

    public RoadNetwork(Clock clock) {
        this(clock, RoadCondition.GOOD);
    }

    /**
     * @param defaultCondition condition given to every segment created by {@link #addSegment}.
     * @throws IllegalArgumentException when {@code defaultCondition} is BLOCKED.
     */
    public RoadNetwork(Clock clock, RoadCondition defaultCondition) {
        this.clock = Objects.requireNonNull(clock, "clock");
        this.defaultCondition = Objects.requireNonNull(defaultCondition, "defaultCondition");
        if (defaultCondition.isBlocked()) {
            throw new IllegalArgumentException("defaultCondition must be passable");
        }
    }

    /**
     * Bulk-builds a network; every connection becomes a GOOD/LIGHT segment.
     */
    public static RoadNetwork fromConnections(Collection<Location> locations, Collection<Connection> connections) {
        return fromConnections(locations, connections, Clock.systemUTC());
    }

    public static RoadNetwork fromConnections(
            Collection<Location> locations,
            Collection<Connection> connections,
            Clock clock
    ) {
        return fromConnections(locations, connections, clock, RoadCondition.GOOD);
    }

    /**
     * Bulk-builds a network whose segments start in {@code defaultCondition} with LIGHT traffic.
     */
    public static RoadNetwork fromConnections(
            Collection<Location> locations,
            Collection<Connection> connections,
            Clock clock,
            RoadCondition defaultCondition
    ) {
        Objects.requireNonNull(locations, "locations");
        Objects.requireNonNull(connections, "connections");
        RoadNetwork network = new RoadNetwork(clock, defaultCondition);
        for (Location location : locations) {
            network.addLocation(location);
        }
        for (Connection connection : connections) {
            network.addSegment(connection.getFrom(), connection.getTo(), connection.getDistance(), connection.travelTime());
        }
        return network;
    }

    // ========================================================================
    // MUTATION
    // ========================================================================

    /**
     * Adds or replaces a location.
     */
    public void addLocation(Location location) {
        Objects.requireNonNull(location, "location");
        locations.put(location.getId(), location);
    }

    /**
     * Creates or overwrites the segment {@code from -> to} with the default condition
     * (GOOD unless configured) and LIGHT traffic.
     *
     * @throws IllegalArgumentException when an endpoint is unknown or distance/time is invalid.
     */
    public RouteSegment addSegment(String from, String to, double distance, double baseTime) {
        requireLocation(from);
        requireLocation(to);
        RouteSegment segment = new RouteSegment(
                from, to, distance, baseTime, defaultCondition, TrafficLevel.LIGHT, clock.instant());
        putSegment(segment);
        return segment;
    }

    /**
     * Changes the condition of an existing segment.
     *
     * @return the replacement segment, or empty when {@code from -> to} is unknown.
     */
    public Optional<RouteSegment> setCondition(String from, String to, RoadCondition condition) {
        Objects.requireNonNull(condition, "condition");
        RouteSegment current = segments.get(new SegmentKey(from, to));
        if (current == null) {
            return Optional.empty();
        }
        RouteSegment updated = current.withCondition(condition).withLastUpdated(clock.instant());
        putSegment(updated);
        return Optional.of(updated);
    }

    /**
     * Changes the traffic level of an existing segment.
     *
     * @return the replacement segment, or empty when {@code from -> to} is unknown.
     */
    public Optional<RouteSegment> setTraffic(String from, String to, TrafficLevel traffic) {
        Objects.requireNonNull(traffic, "traffic");
        RouteSegment current = segments.get(new SegmentKey(from, to));
        if (current == null) {
            return Optional.empty();
        }
        RouteSegment updated = current.withTraffic(traffic).withLastUpdated(clock.instant());
        putSegment(updated);
        return Optional.of(updated);
    }

    private void putSegment(RouteSegment segment) {
        segments.put(segment.key(), segment);
        if (segment.isPassable()) {
            adjacency.computeIfAbsent(segment.getFrom(), ignored -> new LinkedHashMap<>())
                    .put(segment.getTo(), segment.effectiveTime());
        } else {
            Map<String, Double> outgoing = adjacency.get(segment.getFrom());
            if (outgoing != null) {
                outgoing.remove(segment.getTo());
            }
        }
    }

    private void requireLocation(String id) {
        if (id == null || !locations.containsKey(id)) {
            throw new IllegalArgumentException("unknown location: " + id);
        }
    }

    // ========================================================================
    // QUERIES
    // ========================================================================

    public RoadCondition defaultCondition() {
        return defaultCondition;
    }

    public Optional<Location> location(String id) {
        return Optional.ofNullable(locations.get(id));
    }

    public boolean containsLocation(String id) {
        return locations.containsKey(id);
    }

    public Collection<Location> locations() {
        return Collections.unmodifiableCollection(locations.values());
    }

    public Optional<RouteSegment> segment(String from, String to) {
        return Optional.ofNullable(segments.get(new SegmentKey(from, to)));
    }

    public Collection<RouteSegment> segments() {
        return Collections.unmodifiableCollection(segments.values());
    }

    /**
     * Effective time of the passable edge {@code from -> to}; empty when blocked or absent.
     */
    public OptionalDouble edgeWeight(String from, String to) {
        Map<String, Double> outgoing = adjacency.get(from);
        if (outgoing == null) {
            return OptionalDouble.empty();
        }
        Double weight = outgoing.get(to);
        return weight == null ? OptionalDouble.empty() : OptionalDouble.of(weight);
    }

    /**
     * Targets of passable edges leaving {@code from}.
     */
    public Set<String> neighbors(String from) {
        Map<String, Double> outgoing = adjacency.get(from);
        return outgoing == null ? Set.of() : Collections.unmodifiableSet(outgoing.keySet());
    }

    public int segmentCount() {
        return segments.size();
    }

    public int blockedSegmentCount() {
        int blocked = 0;
        for (RouteSegment segment : segments.values()) {
            if (!segment.isPassable()) {
                blocked++;
            }
        }
        return blocked;
    }

    // ========================================================================
    // SNAPSHOTS
    // ========================================================================

    /**
     * Immutable graph of every location and every passable segment.
     */
    public NetworkGraph snapshot() {
        return snapshot(Set.of(), Set.of());
    }

    /**
     * Immutable graph without the given nodes (and their edges) and without the given edges.
     */
    public NetworkGraph snapshot(Set<String> excludedNodes, Set<SegmentKey> excludedEdges) {
        Objects.requireNonNull(excludedNodes, "excludedNodes");
        Objects.requireNonNull(excludedEdges, "excludedEdges");
        List<Location> nodes = new ArrayList<>(locations.size());
        for (Location location : locations.values()) {
            if (!excludedNodes.contains(location.getId())) {
                nodes.add(location);
            }
        }
        List<RouteSegment> edges = new ArrayList<>(segments.size());
        for (RouteSegment segment : segments.values()) {
            if (segment.isPassable() && !excludedEdges.contains(segment.key())) {
                edges.add(segment);
            }
        }
        return NetworkGraph.build(nodes, edges);
    }
}
