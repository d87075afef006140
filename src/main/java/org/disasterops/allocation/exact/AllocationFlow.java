package org.disasterops.allocation.exact;

import java.util.Objects;

/**
 * Units moved from one center to one zone in an LP allocation.
 */
public record AllocationFlow(String centerId, String zoneId, double quantity) {

    public AllocationFlow {
        Objects.requireNonNull(centerId, "centerId");
        Objects.requireNonNull(zoneId, "zoneId");
        if (!(quantity >= 0.0)) {
            throw new IllegalArgumentException("quantity must be >= 0, got " + quantity);
        }
    }
}
