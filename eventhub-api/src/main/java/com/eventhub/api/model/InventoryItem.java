/*
 * Copyright (c) 2025 EventHub
 * Licensed under the Apache License, Version 2.0
 */
package com.eventhub.api.model;

import com.eventhub.api.Outcome;

import java.util.Objects;

/**
 * A stock-keeping record whose quantity can be reserved by events.
 *
 * <p><b>Invariant:</b> {@code 0 <= allocatedQuantity <= totalQuantity} after every
 * call. Rejected mutations return a non-OK {@link Outcome} and leave the item
 * unchanged.
 */
public class InventoryItem {

    private final int id;
    private String name;
    private int totalQuantity;
    private int allocatedQuantity;
    private String description;

    public InventoryItem(int id, String name, int totalQuantity, int allocatedQuantity, String description) {
        if (totalQuantity < 0) {
            throw new IllegalArgumentException("totalQuantity must be >= 0: " + totalQuantity);
        }
        if (allocatedQuantity < 0 || allocatedQuantity > totalQuantity) {
            throw new IllegalArgumentException(
                    "allocatedQuantity must be within [0, " + totalQuantity + "]: " + allocatedQuantity);
        }
        this.id = id;
        this.name = Objects.requireNonNull(name, "name");
        this.totalQuantity = totalQuantity;
        this.allocatedQuantity = allocatedQuantity;
        this.description = Objects.requireNonNull(description, "description");
    }

    public int getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = Objects.requireNonNull(name, "name");
    }

    public String getDescription() {
        return description;
    }

    public void setDescription(String description) {
        this.description = Objects.requireNonNull(description, "description");
    }

    public int getTotalQuantity() {
        return totalQuantity;
    }

    public int getAllocatedQuantity() {
        return allocatedQuantity;
    }

    public int getAvailableQuantity() {
        return totalQuantity - allocatedQuantity;
    }

    /**
     * Reserves {@code quantity} units.
     *
     * @return {@link Outcome#INVALID_QUANTITY} if {@code quantity <= 0},
     *         {@link Outcome#INSUFFICIENT_AVAILABLE} if it exceeds availability,
     *         otherwise {@link Outcome#OK}
     */
    public Outcome allocate(int quantity) {
        if (quantity <= 0) {
            return Outcome.INVALID_QUANTITY;
        }
        if (quantity > getAvailableQuantity()) {
            return Outcome.INSUFFICIENT_AVAILABLE;
        }
        allocatedQuantity += quantity;
        return Outcome.OK;
    }

    /**
     * Returns {@code quantity} reserved units to the available pool.
     *
     * @return {@link Outcome#INVALID_QUANTITY} if {@code quantity <= 0},
     *         {@link Outcome#OVER_DEALLOCATION} if it exceeds the allocated amount,
     *         otherwise {@link Outcome#OK}
     */
    public Outcome deallocate(int quantity) {
        if (quantity <= 0) {
            return Outcome.INVALID_QUANTITY;
        }
        if (quantity > allocatedQuantity) {
            return Outcome.OVER_DEALLOCATION;
        }
        allocatedQuantity -= quantity;
        return Outcome.OK;
    }

    /**
     * Replaces the total quantity.
     *
     * @return {@link Outcome#NEGATIVE_QUANTITY} if {@code newTotal < 0},
     *         {@link Outcome#BELOW_ALLOCATED} if it would drop below the allocated amount,
     *         otherwise {@link Outcome#OK}
     */
    public Outcome setTotalQuantity(int newTotal) {
        if (newTotal < 0) {
            return Outcome.NEGATIVE_QUANTITY;
        }
        if (newTotal < allocatedQuantity) {
            return Outcome.BELOW_ALLOCATED;
        }
        totalQuantity = newTotal;
        return Outcome.OK;
    }

    /**
     * Overwrites the allocated quantity with a value recomputed from event ledgers.
     * If the ledgers reserve more than the recorded total, the total is raised to
     * match so the item stays within bounds.
     *
     * @param allocated the recomputed allocation, must be {@code >= 0}
     * @return {@code true} if the total had to be raised
     */
    public boolean restoreAllocation(int allocated) {
        if (allocated < 0) {
            throw new IllegalArgumentException("allocated must be >= 0: " + allocated);
        }
        boolean raised = allocated > totalQuantity;
        if (raised) {
            totalQuantity = allocated;
        }
        allocatedQuantity = allocated;
        return raised;
    }

    @Override
    public String toString() {
        return "InventoryItem[id=" + id + ", name=" + name + ", total=" + totalQuantity
                + ", allocated=" + allocatedQuantity + "]";
    }
}
