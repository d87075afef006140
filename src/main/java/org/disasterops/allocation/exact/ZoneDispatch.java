package org.disasterops.allocation.exact;

import org.disasterops.allocation.model.Resource;

import java.util.List;
import java.util.Objects;

/**
 * One zone served in full by one center along a concrete path.
 *
 * @param centerId     serving center.
 * @param zoneId       served zone.
 * @param resources    shipped lines, equal to the zone's needs.
 * @param path         waypoints from center to zone, both inclusive.
 * @param deliveryTime effective travel time of {@code path}.
 */
public record ZoneDispatch(
        String centerId,
        String zoneId,
        List<Resource> resources,
        List<String> path,
        double deliveryTime
) {

    public ZoneDispatch {
        Objects.requireNonNull(centerId, "centerId");
        Objects.requireNonNull(zoneId, "zoneId");
        resources = List.copyOf(resources);
        path = List.copyOf(path);
    }
}
