package org.disasterops.allocation.model;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;
import org.disasterops.network.Location;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Supply point holding resource stock. Immutable; withdrawals return a new center.
 */
@Getter
@ToString
@EqualsAndHashCode
public final class ReliefCenter {
    private final Location location;
    private final Map<String, Resource> resources;
    private final int capacity;

    public ReliefCenter(Location location, Collection<Resource> resources, int capacity) {
        this.location = Objects.requireNonNull(location, "location");
        Objects.requireNonNull(resources, "resources");
        if (capacity < 0) {
            throw new IllegalArgumentException("capacity must be >= 0, got " + capacity);
        }
        Map<String, Resource> byId = new LinkedHashMap<>();
        for (Resource resource : resources) {
            if (byId.putIfAbsent(resource.getId(), resource) != null) {
                throw new IllegalArgumentException(
                        "duplicate resource " + resource.getId() + " at center " + location.getId());
            }
        }
        this.resources = Collections.unmodifiableMap(byId);
        this.capacity = capacity;
    }

    private ReliefCenter(Location location, Map<String, Resource> resources, int capacity) {
        this.location = location;
        this.resources = Collections.unmodifiableMap(resources);
        this.capacity = capacity;
    }

    public String id() {
        return location.getId();
    }

    public Optional<Resource> resource(String resourceId) {
        return Optional.ofNullable(resources.get(resourceId));
    }

    public int availableQuantity(String resourceId) {
        Resource resource = resources.get(resourceId);
        return resource == null ? 0 : resource.getQuantity();
    }

    public boolean canSupply(String resourceId, int quantity) {
        return availableQuantity(resourceId) >= quantity;
    }

    /**
     * @return sum of all stock quantities.
     */
    public int totalSupply() {
        int total = 0;
        for (Resource resource : resources.values()) {
            total += resource.getQuantity();
        }
        return total;
    }

    /**
     * @return a center with {@code quantity} less of the resource; this center when
     * {@code quantity} is 0, whether or not the resource is stocked.
     * @throws IllegalArgumentException when a positive quantity is missing or insufficient.
     */
    public ReliefCenter withdraw(String resourceId, int quantity) {
        if (quantity == 0) {
            return this;
        }
        Resource current = resources.get(resourceId);
        if (current == null) {
            throw new IllegalArgumentException("center " + id() + " holds no " + resourceId);
        }
        Map<String, Resource> updated = new LinkedHashMap<>(resources);
        updated.put(resourceId, current.withdraw(quantity));
        return new ReliefCenter(location, updated, capacity);
    }
}
