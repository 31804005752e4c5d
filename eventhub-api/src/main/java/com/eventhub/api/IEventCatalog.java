/*
 * Copyright (c) 2025 EventHub
 * Licensed under the Apache License, Version 2.0
 */
package com.eventhub.api;

import com.eventhub.api.model.Attendee;
import com.eventhub.api.model.Event;
import com.eventhub.api.model.EventField;
import com.eventhub.api.model.EventStatus;
import com.eventhub.api.model.InventoryItem;
import com.eventhub.api.model.LoadSummary;
import com.eventhub.api.model.Role;
import com.eventhub.api.model.User;

import java.util.List;
import java.util.Optional;

/**
 * Contract for the data store that owns users, events, attendees and inventory.
 *
 * <p>Implementations keep the cross-entity invariants:
 * <ul>
 *   <li>every item's allocated quantity equals the sum of the event ledgers that reference it</li>
 *   <li>an attendee id appears in at most one event</li>
 *   <li>ids are never reused within a process</li>
 * </ul>
 *
 * <p>Every mutation that returns {@link Outcome#OK} has already been persisted
 * when it returns. Rejected mutations leave state unchanged.
 *
 * <p><b>Thread Safety:</b> Not thread-safe. One operator, one thread.
 */
public interface IEventCatalog {

    /**
     * Replaces in-memory state with the persisted collections.
     *
     * @return counts and skipped-line diagnostics
     */
    LoadSummary load();

    /**
     * Seeds default accounts, events and items into any empty collection.
     *
     * @return {@code true} if anything was seeded
     */
    boolean seedIfEmpty();

    // ==================== Users ====================

    Result<User> createUser(String username, String password, Role role);

    Outcome deleteUser(String username, User actingUser);

    Optional<User> findUser(String username);

    Optional<User> authenticate(String username, String password);

    List<User> users();

    // ==================== Events ====================

    Result<Event> createEvent(String name, String date, String time,
                              String location, String description, String category);

    Outcome editEvent(int eventId, EventField field, String value);

    Outcome updateEventStatus(int eventId, EventStatus status);

    /**
     * Deletes an event, returning its inventory to the pool and removing its attendees.
     */
    Outcome deleteEvent(int eventId);

    Optional<Event> findEvent(int eventId);

    List<Event> searchEvents(String term);

    List<Event> events();

    // ==================== Registration ====================

    Result<Attendee> registerForEvent(User user, int eventId, String contactInfo);

    Outcome cancelRegistration(User user, int eventId);

    Outcome checkIn(int eventId, int attendeeId);

    /**
     * Updates the contact info on every attendee record owned by the user,
     * creating a generic profile if the user has none.
     */
    Outcome updateContactInfo(User user, String contactInfo);

    Optional<Attendee> findAttendee(int attendeeId);

    List<Attendee> attendeesForEvent(int eventId);

    List<Attendee> attendees();

    // ==================== Inventory ====================

    Result<InventoryItem> addItem(String name, int totalQuantity, String description);

    Outcome renameItem(int itemId, String name);

    Outcome describeItem(int itemId, String description);

    Outcome setItemTotal(int itemId, int totalQuantity);

    Outcome allocateToEvent(int eventId, int itemId, int quantity);

    /**
     * @return the amount actually released, which may be less than requested
     */
    Result<Integer> deallocateFromEvent(int eventId, int itemId, int quantity);

    Optional<InventoryItem> findItem(int itemId);

    Optional<InventoryItem> findItemByName(String name);

    List<InventoryItem> items();
}
