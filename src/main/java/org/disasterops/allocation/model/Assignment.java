package org.disasterops.allocation.model;

import lombok.EqualsAndHashCode;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Zone id to serving center id; one entry per zone. Immutable.
 */
@EqualsAndHashCode
public final class Assignment {
    private final Map<String, String> centerByZone;

    private Assignment(Map<String, String> centerByZone) {
        this.centerByZone = Collections.unmodifiableMap(centerByZone);
    }

    public static Assignment of(Map<String, String> centerByZone) {
        Objects.requireNonNull(centerByZone, "centerByZone");
        Map<String, String> copy = new LinkedHashMap<>();
        for (Map.Entry<String, String> entry : centerByZone.entrySet()) {
            copy.put(
                    Objects.requireNonNull(entry.getKey(), "zone id"),
                    Objects.requireNonNull(entry.getValue(), "center id for zone " + entry.getKey())
            );
        }
        return new Assignment(copy);
    }

    public Optional<String> centerFor(String zoneId) {
        return Optional.ofNullable(centerByZone.get(zoneId));
    }

    public Set<String> zoneIds() {
        return centerByZone.keySet();
    }

    public Map<String, String> asMap() {
        return centerByZone;
    }

    public int size() {
        return centerByZone.size();
    }

    @Override
    public String toString() {
        return "Assignment" + centerByZone;
    }
}
