package org.disasterops.allocation.fitness;

import lombok.Getter;
import lombok.experimental.Accessors;
import org.disasterops.allocation.model.Assignment;
import org.disasterops.allocation.model.DisasterZone;
import org.disasterops.allocation.model.ReliefCenter;
import org.disasterops.core.id.IDMapper;
import org.disasterops.network.NetworkGraph;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable indexed view of one allocation instance.
 *
 * <p>Centers and zones get dense indexes in input order; optimizers work on {@code int[]}
 * genomes where {@code genes[zone] = center}. Travel costs and resource matches are
 * precomputed once.</p>
 */
public final class AllocationProblem {
    private final List<ReliefCenter> centers;
    private final List<DisasterZone> zones;
    @Getter
    @Accessors(fluent = true)
    private final IDMapper centerIds;
    @Getter
    @Accessors(fluent = true)
    private final IDMapper zoneIds;
    @Getter
    @Accessors(fluent = true)
    private final DistanceTable distances;
    private final double[][] resourceMatch;

    private AllocationProblem(
            List<ReliefCenter> centers,
            List<DisasterZone> zones,
            IDMapper centerIds,
            IDMapper zoneIds,
            DistanceTable distances
    ) {
        this.centers = centers;
        this.zones = zones;
        this.centerIds = centerIds;
        this.zoneIds = zoneIds;
        this.distances = distances;
        this.resourceMatch = new double[centers.size()][zones.size()];
        for (int c = 0; c < centers.size(); c++) {
            for (int z = 0; z < zones.size(); z++) {
                resourceMatch[c][z] = resourceMatch(centers.get(c), zones.get(z));
            }
        }
    }

    /**
     * Indexes an instance and computes its travel-cost table on {@code graph}.
     *
     * @throws AllocationException when centers or zones are empty or ids repeat.
     */
    public static AllocationProblem of(List<ReliefCenter> centers, List<DisasterZone> zones, NetworkGraph graph) {
        Objects.requireNonNull(centers, "centers");
        Objects.requireNonNull(zones, "zones");
        Objects.requireNonNull(graph, "graph");
        if (centers.isEmpty()) {
            throw new AllocationException(AllocationException.REASON_NO_CENTERS, "at least one relief center is required");
        }
        if (zones.isEmpty()) {
            throw new AllocationException(AllocationException.REASON_NO_ZONES, "at least one disaster zone is required");
        }
        List<ReliefCenter> centerList = List.copyOf(centers);
        List<DisasterZone> zoneList = List.copyOf(zones);
        IDMapper centerIds = mapIds(centerList.stream().map(ReliefCenter::id).toList(), "center");
        IDMapper zoneIds = mapIds(zoneList.stream().map(DisasterZone::id).toList(), "zone");
        return new AllocationProblem(
                centerList,
                zoneList,
                centerIds,
                zoneIds,
                DistanceTable.compute(centerList, zoneList, graph)
        );
    }

    private static IDMapper mapIds(List<String> ids, String kind) {
        try {
            return IDMapper.ofOrdered(ids);
        } catch (IllegalArgumentException ex) {
            throw new AllocationException(AllocationException.REASON_DUPLICATE_ID, kind + " ids must be unique: " + ex.getMessage(), ex);
        }
    }

    /**
     * Share of a zone's needed resources the center can cover in full; 0 for a zone with no needs.
     */
    public static double resourceMatch(ReliefCenter center, DisasterZone zone) {
        int needed = zone.getResourcesNeeded().size();
        int covered = 0;
        for (var need : zone.getResourcesNeeded()) {
            if (center.canSupply(need.getId(), need.getQuantity())) {
                covered++;
            }
        }
        return covered / (double) Math.max(needed, 1);
    }

    public int centerCount() {
        return centers.size();
    }

    public int zoneCount() {
        return zones.size();
    }

    public ReliefCenter center(int index) {
        return centers.get(index);
    }

    public DisasterZone zone(int index) {
        return zones.get(index);
    }

    public List<ReliefCenter> centers() {
        return centers;
    }

    public List<DisasterZone> zones() {
        return zones;
    }

    public double resourceMatch(int centerIndex, int zoneIndex) {
        return resourceMatch[centerIndex][zoneIndex];
    }

    /**
     * Converts an assignment into a genome.
     *
     * @throws AllocationException when a zone is missing or an id is unknown.
     */
    public int[] encode(Assignment assignment) {
        Objects.requireNonNull(assignment, "assignment");
        int[] genes = new int[zones.size()];
        for (Map.Entry<String, String> entry : assignment.asMap().entrySet()) {
            if (!zoneIds.containsExternal(entry.getKey())) {
                throw new AllocationException(AllocationException.REASON_UNKNOWN_ZONE, "unknown zone: " + entry.getKey());
            }
            if (!centerIds.containsExternal(entry.getValue())) {
                throw new AllocationException(AllocationException.REASON_UNKNOWN_CENTER,
                        "unknown center " + entry.getValue() + " for zone " + entry.getKey());
            }
        }
        List<String> missing = new ArrayList<>();
        for (int z = 0; z < zones.size(); z++) {
            String zoneId = zoneIds.toExternal(z);
            String centerId = assignment.asMap().get(zoneId);
            if (centerId == null) {
                missing.add(zoneId);
                continue;
            }
            genes[z] = centerIds.toInternal(centerId);
        }
        if (!missing.isEmpty()) {
            throw new AllocationException(AllocationException.REASON_INCOMPLETE_ASSIGNMENT, "zones without a center: " + missing);
        }
        return genes;
    }

    public Assignment decode(int[] genes) {
        requireGenome(genes);
        Map<String, String> centerByZone = new LinkedHashMap<>();
        for (int z = 0; z < genes.length; z++) {
            centerByZone.put(zoneIds.toExternal(z), centerIds.toExternal(genes[z]));
        }
        return Assignment.of(centerByZone);
    }

    /**
     * @throws AllocationException when the genome does not assign exactly every zone to a known center.
     */
    public void requireGenome(int[] genes) {
        Objects.requireNonNull(genes, "genes");
        if (genes.length != zones.size()) {
            throw new AllocationException(AllocationException.REASON_INCOMPLETE_ASSIGNMENT,
                    "genome covers " + genes.length + " zones, expected " + zones.size());
        }
        for (int z = 0; z < genes.length; z++) {
            if (genes[z] < 0 || genes[z] >= centers.size()) {
                throw new AllocationException(AllocationException.REASON_UNKNOWN_CENTER,
                        "zone " + zoneIds.toExternal(z) + " assigned to center index " + genes[z]);
            }
        }
    }
}
