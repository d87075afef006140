package org.disasterops.allocation.model;

import lombok.Value;

/**
 * Immutable stock or demand line of one resource type.
 */
@Value
public class Resource {
    String id;
    String name;
    int quantity;
    String unit;

    public Resource(String id, String name, int quantity, String unit) {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("resource id must be non-blank");
        }
        if (quantity < 0) {
            throw new IllegalArgumentException("quantity of " + id + " must be >= 0, got " + quantity);
        }
        this.id = id;
        this.name = name == null ? id : name;
        this.quantity = quantity;
        this.unit = unit == null ? "" : unit;
    }

    public static Resource of(String id, int quantity, String unit) {
        return new Resource(id, id, quantity, unit);
    }

    /**
     * @return a copy holding {@code quantity - amount}.
     * @throws IllegalArgumentException when {@code amount} is negative or exceeds the quantity.
     */
    public Resource withdraw(int amount) {
        if (amount < 0) {
            throw new IllegalArgumentException("withdraw amount must be >= 0, got " + amount);
        }
        if (amount > quantity) {
            throw new IllegalArgumentException(
                    "cannot withdraw " + amount + " " + id + ", only " + quantity + " available");
        }
        return new Resource(id, name, quantity - amount, unit);
    }

    public Resource withQuantity(int newQuantity) {
        return new Resource(id, name, newQuantity, unit);
    }
}
