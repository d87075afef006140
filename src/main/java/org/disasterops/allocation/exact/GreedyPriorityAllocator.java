package org.disasterops.allocation.exact;

import lombok.extern.slf4j.Slf4j;
import org.disasterops.allocation.model.DisasterZone;
import org.disasterops.allocation.model.ReliefCenter;
import org.disasterops.allocation.model.Resource;
import org.disasterops.network.NetworkGraph;
import org.disasterops.routing.search.PathResult;
import org.disasterops.routing.search.RouteSearch;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * Single-source greedy allocation.
 *
 * <p>Zones are served in descending priority (input order breaks ties). Each zone goes to the
 * reachable center that can cover every one of its needs from current stock and has the
 * shortest delivery time; that stock is withdrawn before the next zone is considered. A zone
 * no center can fully cover is reported as unserved and receives nothing.</p>
 */
@Slf4j
public final class GreedyPriorityAllocator {

    public GreedyAllocationResult allocate(List<ReliefCenter> centers, List<DisasterZone> zones, NetworkGraph graph) {
        Objects.requireNonNull(centers, "centers");
        Objects.requireNonNull(zones, "zones");
        RouteSearch search = new RouteSearch(Objects.requireNonNull(graph, "graph"));

        List<ReliefCenter> working = new ArrayList<>(centers);
        List<DisasterZone> ordered = new ArrayList<>(zones);
        ordered.sort(Comparator.comparingInt(DisasterZone::getPriority).reversed());

        List<ZoneDispatch> dispatches = new ArrayList<>();
        List<String> unserved = new ArrayList<>();
        for (DisasterZone zone : ordered) {
            int bestCenter = -1;
            PathResult bestPath = null;
            for (int c = 0; c < working.size(); c++) {
                ReliefCenter center = working.get(c);
                if (!coversAll(center, zone)) {
                    continue;
                }
                PathResult path = search.fastestPath(center.id(), zone.id());
                if (path.reachable() && (bestPath == null || path.cost() < bestPath.cost())) {
                    bestCenter = c;
                    bestPath = path;
                }
            }
            if (bestCenter < 0) {
                log.debug("Zone {} (priority {}) left unserved", zone.id(), zone.getPriority());
                unserved.add(zone.id());
                continue;
            }
            ReliefCenter center = working.get(bestCenter);
            for (Resource needed : zone.getResourcesNeeded()) {
                if (needed.getQuantity() > 0) {
                    center = center.withdraw(needed.getId(), needed.getQuantity());
                }
            }
            working.set(bestCenter, center);
            dispatches.add(new ZoneDispatch(
                    center.id(), zone.id(), zone.getResourcesNeeded(), bestPath.waypoints(), bestPath.cost()));
        }
        log.info("Greedy allocation served {} of {} zones", dispatches.size(), zones.size());
        return new GreedyAllocationResult(dispatches, working, unserved);
    }

    private static boolean coversAll(ReliefCenter center, DisasterZone zone) {
        for (Resource needed : zone.getResourcesNeeded()) {
            if (!center.canSupply(needed.getId(), needed.getQuantity())) {
                return false;
            }
        }
        return true;
    }
}
