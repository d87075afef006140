package org.disasterops.allocation.model;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;
import org.disasterops.network.Location;

import java.util.List;
import java.util.Objects;

/**
 * Demand point with its needs and urgency.
 *
 * <p>Severity is 1..10, priority 1..5 with 5 most urgent.</p>
 */
@Getter
@ToString
@EqualsAndHashCode
public final class DisasterZone {
    public static final int MIN_PRIORITY = 1;
    public static final int MAX_PRIORITY = 5;

    private final Location location;
    private final int severity;
    private final int populationAffected;
    private final List<Resource> resourcesNeeded;
    private final int priority;

    public DisasterZone(
            Location location,
            int severity,
            int populationAffected,
            List<Resource> resourcesNeeded,
            int priority
    ) {
        this.location = Objects.requireNonNull(location, "location");
        if (severity < 1 || severity > 10) {
            throw new IllegalArgumentException("severity must be in [1,10], got " + severity);
        }
        if (populationAffected < 0) {
            throw new IllegalArgumentException("populationAffected must be >= 0, got " + populationAffected);
        }
        if (priority < MIN_PRIORITY || priority > MAX_PRIORITY) {
            throw new IllegalArgumentException("priority must be in [1,5], got " + priority);
        }
        this.severity = severity;
        this.populationAffected = populationAffected;
        this.resourcesNeeded = List.copyOf(Objects.requireNonNull(resourcesNeeded, "resourcesNeeded"));
        this.priority = priority;
    }

    public String id() {
        return location.getId();
    }

    public int totalDemand() {
        int total = 0;
        for (Resource needed : resourcesNeeded) {
            total += needed.getQuantity();
        }
        return total;
    }
}
