/*
 * Copyright (c) 2025 EventHub
 * Licensed under the Apache License, Version 2.0
 */
package com.eventhub.api.model;

import it.unimi.dsi.fastutil.ints.Int2IntLinkedOpenHashMap;
import it.unimi.dsi.fastutil.ints.Int2IntMap;
import it.unimi.dsi.fastutil.ints.Int2IntMaps;
import it.unimi.dsi.fastutil.ints.IntLinkedOpenHashSet;
import it.unimi.dsi.fastutil.ints.IntSet;
import it.unimi.dsi.fastutil.ints.IntSets;

import java.util.Objects;
import java.util.logging.Logger;

/**
 * A scheduled event with its attendee references and inventory ledger.
 *
 * <h2>Allocation ledger</h2>
 * <p>The ledger maps inventory item ids to reserved quantities. It only records
 * intent: callers must reserve the quantity on the {@link InventoryItem} first and
 * record it here only if that succeeded. When releasing, callers must apply the
 * amount returned by {@link #deallocateInventoryItem(int, int)} to the item, not
 * the amount they asked for. Entries never hold zero or negative quantities.
 *
 * <h2>Attendees</h2>
 * <p>Attendee ids are unique within one event. Uniqueness across events is
 * enforced by the catalog.
 */
public class Event {
    private static final Logger logger = Logger.getLogger(Event.class.getName());

    private final int id;
    private String name;
    private String date;
    private String time;
    private String location;
    private String description;
    private String category;
    private EventStatus status;

    private final IntLinkedOpenHashSet attendeeIds = new IntLinkedOpenHashSet();
    private final Int2IntLinkedOpenHashMap allocatedInventory = new Int2IntLinkedOpenHashMap();

    public Event(int id, String name, String date, String time, String location,
                 String description, String category, EventStatus status) {
        this.id = id;
        this.name = Objects.requireNonNull(name, "name");
        this.date = Objects.requireNonNull(date, "date");
        this.time = Objects.requireNonNull(time, "time");
        this.location = Objects.requireNonNull(location, "location");
        this.description = Objects.requireNonNull(description, "description");
        this.category = Objects.requireNonNull(category, "category");
        this.status = Objects.requireNonNull(status, "status");
        allocatedInventory.defaultReturnValue(0);
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

    public String getDate() {
        return date;
    }

    public void setDate(String date) {
        this.date = Objects.requireNonNull(date, "date");
    }

    public String getTime() {
        return time;
    }

    public void setTime(String time) {
        this.time = Objects.requireNonNull(time, "time");
    }

    public String getLocation() {
        return location;
    }

    public void setLocation(String location) {
        this.location = Objects.requireNonNull(location, "location");
    }

    public String getDescription() {
        return description;
    }

    public void setDescription(String description) {
        this.description = Objects.requireNonNull(description, "description");
    }

    public String getCategory() {
        return category;
    }

    public void setCategory(String category) {
        this.category = Objects.requireNonNull(category, "category");
    }

    public EventStatus getStatus() {
        return status;
    }

    public void setStatus(EventStatus status) {
        this.status = Objects.requireNonNull(status, "status");
    }

    // ==================== Attendees ====================

    /**
     * Adds an attendee reference. A duplicate id is reported and ignored.
     *
     * @return {@code true} if the id was added
     */
    public boolean addAttendee(int attendeeId) {
        if (!attendeeIds.add(attendeeId)) {
            logger.fine(() -> "Attendee " + attendeeId + " already registered for event " + id);
            return false;
        }
        return true;
    }

    /**
     * @return {@code true} if the id was present
     */
    public boolean removeAttendee(int attendeeId) {
        return attendeeIds.remove(attendeeId);
    }

    public boolean hasAttendee(int attendeeId) {
        return attendeeIds.contains(attendeeId);
    }

    /**
     * @return read-only view of the attendee ids
     */
    public IntSet getAttendeeIds() {
        return IntSets.unmodifiable(attendeeIds);
    }

    // ==================== Allocation ledger ====================

    /**
     * Records {@code quantity} more units of an item against this event.
     * Repeated calls accumulate. Non-positive quantities, and quantities that
     * would push the entry past {@link Integer#MAX_VALUE}, are ignored.
     *
     * @return {@code true} if the ledger changed
     */
    public boolean allocateInventoryItem(int itemId, int quantity) {
        if (quantity <= 0 || quantity > Integer.MAX_VALUE - allocatedInventory.get(itemId)) {
            return false;
        }
        allocatedInventory.addTo(itemId, quantity);
        return true;
    }

    /**
     * Releases up to {@code quantity} units of an item from the ledger.
     *
     * @return the amount actually released: {@code min(recorded, quantity)},
     *         or {@code 0} if {@code quantity <= 0} or the item is not recorded
     */
    public int deallocateInventoryItem(int itemId, int quantity) {
        if (quantity <= 0 || !allocatedInventory.containsKey(itemId)) {
            return 0;
        }
        int current = allocatedInventory.get(itemId);
        int actual = Math.min(current, quantity);
        int remaining = current - actual;
        if (remaining <= 0) {
            allocatedInventory.remove(itemId);
        } else {
            allocatedInventory.put(itemId, remaining);
        }
        return actual;
    }

    /**
     * @return quantity of the item recorded for this event, {@code 0} if none
     */
    public int getAllocatedQuantity(int itemId) {
        return allocatedInventory.get(itemId);
    }

    /**
     * @return read-only view of the ledger, item id to quantity
     */
    public Int2IntMap getAllocatedInventory() {
        return Int2IntMaps.unmodifiable(allocatedInventory);
    }

    @Override
    public String toString() {
        return "Event[id=" + id + ", name=" + name + ", date=" + date + ", status=" + status + "]";
    }
}
