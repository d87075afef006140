package org.disasterops.network;

import lombok.Getter;
import lombok.experimental.Accessors;
import org.disasterops.core.id.IDMapper;

import java.util.ArrayList;
import java.util.List;
import java.util.NoSuchElementException;

/**
 * Immutable point-in-time routing graph in CSR layout.
 * <p>
 * Built from a {@link RoadNetwork} snapshot and shared freely between threads:
 * optimizers and route queries never observe later network updates through it.
 * <p>
 * Layout:
 * - SoA (Structure of Arrays) edge properties: target, origin, effective time, base distance, delay factor.
 * - CSR (Compressed Sparse Row) index: edges of node {@code n} are {@code [firstEdge[n], firstEdge[n + 1])}.
 * - Node coordinates as latitude/longitude degrees.
 * - Only passable segments are edges; blocked segments never appear.
 */
public final class NetworkGraph {

    // CSR Index: first_edge[node_idx] -> start index in edge arrays
    private final int[] firstEdge;

    // Edge Properties
    private final int[] edgeTarget;
    private final int[] edgeOrigin;
    private final double[] edgeTime;
    private final double[] edgeDistance;
    private final double[] edgeDelayFactor;

    // Node Properties
    private final double[] latitude;
    private final double[] longitude;

    @Getter
    @Accessors(fluent = true)
    private final IDMapper nodeIds;
    @Getter
    @Accessors(fluent = true)
    private final int nodeCount;
    @Getter
    @Accessors(fluent = true)
    private final int edgeCount;

    private NetworkGraph(
            IDMapper nodeIds,
            double[] latitude,
            double[] longitude,
            int[] firstEdge,
            int[] edgeTarget,
            int[] edgeOrigin,
            double[] edgeTime,
            double[] edgeDistance,
            double[] edgeDelayFactor
    ) {
        this.nodeIds = nodeIds;
        this.nodeCount = nodeIds.size();
        this.edgeCount = edgeTarget.length;
        this.latitude = latitude;
        this.longitude = longitude;
        this.firstEdge = firstEdge;
        this.edgeTarget = edgeTarget;
        this.edgeOrigin = edgeOrigin;
        this.edgeTime = edgeTime;
        this.edgeDistance = edgeDistance;
        this.edgeDelayFactor = edgeDelayFactor;
    }

    /**
     * Builds a CSR graph from node and segment lists.
     *
     * <p>Blocked segments and segments touching a node outside {@code nodes} are skipped.
     * Edges of one origin keep their input order.</p>
     *
     * @param nodes graph nodes in index order.
     * @param segments candidate edges.
     * @return immutable graph.
     */
    static NetworkGraph build(List<Location> nodes, List<RouteSegment> segments) {
        List<String> ids = new ArrayList<>(nodes.size());
        double[] lat = new double[nodes.size()];
        double[] lon = new double[nodes.size()];
        for (int i = 0; i < nodes.size(); i++) {
            Location location = nodes.get(i);
            ids.add(location.getId());
            lat[i] = location.getLatitude();
            lon[i] = location.getLongitude();
        }
        IDMapper mapper = IDMapper.ofOrdered(ids);

        int nodeCount = mapper.size();
        int[] originOf = new int[segments.size()];
        int[] targetOf = new int[segments.size()];
        int[] degree = new int[nodeCount];
        int accepted = 0;
        for (int i = 0; i < segments.size(); i++) {
            RouteSegment segment = segments.get(i);
            int origin = mapper.indexOf(segment.getFrom());
            int target = mapper.indexOf(segment.getTo());
            if (!segment.isPassable() || origin < 0 || target < 0) {
                originOf[i] = -1;
                continue;
            }
            originOf[i] = origin;
            targetOf[i] = target;
            degree[origin]++;
            accepted++;
        }

        int[] firstEdge = new int[nodeCount + 1];
        for (int n = 0; n < nodeCount; n++) {
            firstEdge[n + 1] = firstEdge[n] + degree[n];
        }
        int[] cursor = new int[nodeCount];
        System.arraycopy(firstEdge, 0, cursor, 0, nodeCount);

        int[] edgeTarget = new int[accepted];
        int[] edgeOrigin = new int[accepted];
        double[] edgeTime = new double[accepted];
        double[] edgeDistance = new double[accepted];
        double[] edgeDelay = new double[accepted];
        for (int i = 0; i < segments.size(); i++) {
            int origin = originOf[i];
            if (origin < 0) {
                continue;
            }
            RouteSegment segment = segments.get(i);
            int slot = cursor[origin]++;
            edgeTarget[slot] = targetOf[i];
            edgeOrigin[slot] = origin;
            edgeTime[slot] = segment.effectiveTime();
            edgeDistance[slot] = segment.getBaseDistance();
            edgeDelay[slot] = segment.delayFactor();
        }

        return new NetworkGraph(mapper, lat, lon, firstEdge, edgeTarget, edgeOrigin, edgeTime, edgeDistance, edgeDelay);
    }

    // ========================================================================
    // CORE ACCESSORS (O(1))
    // ========================================================================

    /**
     * UNCHECKED - caller must ensure edgeId is valid.
     */
    public int getEdgeDestination(int edgeId) {
        assert edgeId >= 0 && edgeId < edgeCount : "Edge " + edgeId + " out of bounds";
        return edgeTarget[edgeId];
    }

    public int getEdgeOrigin(int edgeId) {
        if (edgeId < 0 || edgeId >= edgeCount) {
            throw new IndexOutOfBoundsException("Edge " + edgeId + " out of bounds [0, " + edgeCount + ")");
        }
        return edgeOrigin[edgeId];
    }

    /**
     * Effective traversal time captured at snapshot time.
     */
    public double getEdgeTime(int edgeId) {
        assert edgeId >= 0 && edgeId < edgeCount;
        return edgeTime[edgeId];
    }

    public double getEdgeDistance(int edgeId) {
        assert edgeId >= 0 && edgeId < edgeCount;
        return edgeDistance[edgeId];
    }

    /**
     * Condition multiplier times traffic multiplier captured at snapshot time.
     */
    public double getEdgeDelayFactor(int edgeId) {
        assert edgeId >= 0 && edgeId < edgeCount;
        return edgeDelayFactor[edgeId];
    }

    public double getNodeLatitude(int nodeId) {
        assert nodeId >= 0 && nodeId < nodeCount;
        return latitude[nodeId];
    }

    public double getNodeLongitude(int nodeId) {
        assert nodeId >= 0 && nodeId < nodeCount;
        return longitude[nodeId];
    }

    public int getNodeDegree(int nodeId) {
        if (nodeId < 0 || nodeId >= nodeCount) {
            throw new IndexOutOfBoundsException("Node " + nodeId + " out of bounds");
        }
        return firstEdge[nodeId + 1] - firstEdge[nodeId];
    }

    // ========================================================================
    // ID RESOLUTION
    // ========================================================================

    /**
     * @return internal node index or {@code -1} when the location is not in this graph.
     */
    public int nodeIndex(String locationId) {
        return nodeIds.indexOf(locationId);
    }

    public String nodeId(int nodeIndex) {
        return nodeIds.toExternal(nodeIndex);
    }

    public boolean containsNode(String locationId) {
        return nodeIds.containsExternal(locationId);
    }

    /**
     * Finds the edge {@code from -> to}.
     *
     * @return edge id or {@code -1} when absent (unknown endpoint, blocked or never added).
     */
    public int findEdge(String from, String to) {
        int origin = nodeIndex(from);
        int target = nodeIndex(to);
        if (origin < 0 || target < 0) {
            return -1;
        }
        for (int e = firstEdge[origin]; e < firstEdge[origin + 1]; e++) {
            if (edgeTarget[e] == target) {
                return e;
            }
        }
        return -1;
    }

    // ========================================================================
    // TRAVERSAL
    // ========================================================================

    /**
     * Returns a zero-allocation iterator.
     */
    public EdgeIterator iterator() {
        return new EdgeIterator(this);
    }

    /**
     * Reusable cursor over the outgoing edges of one node.
     */
    public static final class EdgeIterator {
        private final NetworkGraph graph;
        private int current;
        private int end;

        EdgeIterator(NetworkGraph graph) {
            this.graph = graph;
        }

        /**
         * Resets iterator to traverse edges outgoing from a specific node.
         */
        public EdgeIterator resetForNode(int nodeId) {
            this.current = graph.firstEdge[nodeId];
            this.end = graph.firstEdge[nodeId + 1];
            return this;
        }

        public boolean hasNext() {
            return current < end;
        }

        public int next() {
            if (current >= end) throw new NoSuchElementException();
            return current++;
        }
    }

    @Override
    public String toString() {
        return String.format("NetworkGraph[nodes=%d, edges=%d, avgDegree=%.2f]",
                nodeCount, edgeCount, nodeCount > 0 ? (double) edgeCount / nodeCount : 0);
    }
}
