/*
 * Copyright (c) 2025 EventHub
 * Licensed under the Apache License, Version 2.0
 */
package com.eventhub.catalog;

import com.eventhub.api.IEventCatalog;
import com.eventhub.api.IRecordCodec;
import com.eventhub.api.Outcome;
import com.eventhub.api.Result;
import com.eventhub.api.model.Attendee;
import com.eventhub.api.model.Event;
import com.eventhub.api.model.EventField;
import com.eventhub.api.model.EventStatus;
import com.eventhub.api.model.InventoryItem;
import com.eventhub.api.model.LoadSummary;
import com.eventhub.api.model.Role;
import com.eventhub.api.model.SkippedRecord;
import com.eventhub.api.model.User;
import com.eventhub.codec.AttendeeRecordCodec;
import com.eventhub.codec.DecodedBatch;
import com.eventhub.codec.EventRecordCodec;
import com.eventhub.codec.InventoryRecordCodec;
import com.eventhub.codec.RecordBatchDecoder;
import com.eventhub.codec.UserRecordCodec;
import com.eventhub.infra.persistence.PersistenceException;
import com.eventhub.infra.persistence.RecordCollection;
import com.eventhub.infra.persistence.RecordStore;
import com.eventhub.validation.FieldValidator;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;
import it.unimi.dsi.fastutil.ints.Int2IntMap;
import it.unimi.dsi.fastutil.ints.Int2ObjectLinkedOpenHashMap;
import it.unimi.dsi.fastutil.ints.Int2ObjectMap;
import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntIterator;
import it.unimi.dsi.fastutil.ints.IntList;
import it.unimi.dsi.fastutil.ints.IntOpenHashSet;
import it.unimi.dsi.fastutil.ints.IntSet;
import it.unimi.dsi.fastutil.objects.ObjectIterator;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * The system's data store: owns users, events, attendees and inventory, keeps
 * their cross-references consistent, and writes every change through to a
 * {@link RecordStore} before returning.
 *
 * <h2>Consistency</h2>
 * <ul>
 *   <li>An item's allocated quantity always equals the sum of the event ledger
 *       entries for it. Allocation reserves on the item first and only then
 *       records the ledger entry; release applies the amount the ledger
 *       actually gave back. After load, allocations are rebuilt from the
 *       ledgers by {@link AllocationReconciler}.</li>
 *   <li>An attendee id is claimed by at most one event. On load, later claims
 *       are dropped.</li>
 *   <li>Id counters only move forward and start past the largest loaded id.</li>
 * </ul>
 *
 * <p>Construct one catalog at start-up and pass it to whatever needs it.
 *
 * <p><b>Thread Safety:</b> Not thread-safe. Every call runs to completion on the
 * caller's thread, including its saves.
 */
public class EventCatalog implements IEventCatalog {
    private static final Logger logger = Logger.getLogger(EventCatalog.class.getName());

    private final RecordStore store;
    private final Tracer tracer;

    private final IRecordCodec<User> userCodec = new UserRecordCodec();
    private final IRecordCodec<Event> eventCodec = new EventRecordCodec();
    private final IRecordCodec<Attendee> attendeeCodec = new AttendeeRecordCodec();
    private final IRecordCodec<InventoryItem> inventoryCodec = new InventoryRecordCodec();
    private final AllocationReconciler reconciler = new AllocationReconciler();

    private final Map<String, User> users = new LinkedHashMap<>();
    private final Int2ObjectMap<Event> events = new Int2ObjectLinkedOpenHashMap<>();
    private final Int2ObjectMap<Attendee> attendees = new Int2ObjectLinkedOpenHashMap<>();
    private final Int2ObjectMap<InventoryItem> items = new Int2ObjectLinkedOpenHashMap<>();

    private final IdSequence userIds = new IdSequence();
    private final IdSequence eventIds = new IdSequence();
    private final IdSequence attendeeIds = new IdSequence();
    private final IdSequence itemIds = new IdSequence();

    public EventCatalog(RecordStore store, Tracer tracer) {
        this.store = Objects.requireNonNull(store, "store");
        this.tracer = Objects.requireNonNull(tracer, "tracer");
    }

    // ==================== Load ====================

    @Override
    public LoadSummary load() {
        Span span = tracer.spanBuilder("catalog.load").startSpan();
        try (Scope scope = span.makeCurrent()) {
            List<SkippedRecord> skipped = new ArrayList<>();

            DecodedBatch<User> userBatch = decode(RecordCollection.USERS, userCodec, skipped);
            DecodedBatch<Event> eventBatch = decode(RecordCollection.EVENTS, eventCodec, skipped);
            DecodedBatch<Attendee> attendeeBatch = decode(RecordCollection.ATTENDEES, attendeeCodec, skipped);
            DecodedBatch<InventoryItem> itemBatch = decode(RecordCollection.INVENTORY, inventoryCodec, skipped);

            users.clear();
            events.clear();
            attendees.clear();
            items.clear();

            IntSet seenUserIds = new IntOpenHashSet();
            for (User user : userBatch.records()) {
                if (isUsernameTaken(user.username())) {
                    skipped.add(duplicate(RecordCollection.USERS, userCodec.encode(user), "username " + user.username()));
                    continue;
                }
                if (!seenUserIds.add(user.id())) {
                    skipped.add(duplicate(RecordCollection.USERS, userCodec.encode(user), "id " + user.id()));
                    continue;
                }
                users.put(user.username(), user);
                userIds.advancePast(user.id());
            }
            putUnique(RecordCollection.EVENTS, eventBatch.records(), events, Event::getId, eventCodec, skipped);
            putUnique(RecordCollection.ATTENDEES, attendeeBatch.records(), attendees, Attendee::getId, attendeeCodec, skipped);
            putUnique(RecordCollection.INVENTORY, itemBatch.records(), items, InventoryItem::getId, inventoryCodec, skipped);

            advancePastAll(eventIds, events.keySet());
            advancePastAll(attendeeIds, attendees.keySet());
            advancePastAll(itemIds, items.keySet());

            int repairs = releaseDuplicateAttendeeClaims();
            AllocationReconciler.Reconciliation reconciliation = reconciler.reconcile(items, events.values());
            repairs += reconciliation.raisedTotals() + reconciliation.droppedEntries();

            LoadSummary summary = new LoadSummary(users.size(), events.size(), attendees.size(), items.size(),
                    skipped, repairs);
            span.setAttribute("load.skipped", skipped.size());
            span.setAttribute("load.repairs", repairs);
            span.setAttribute("load.correctedAllocations", reconciliation.corrected());
            logger.info(String.format("Loaded %d users, %d events, %d attendees, %d items (%d lines skipped, %d repairs)",
                    summary.users(), summary.events(), summary.attendees(), summary.items(),
                    skipped.size(), repairs));
            return summary;
        } catch (RuntimeException e) {
            span.recordException(e);
            throw e;
        } finally {
            span.end();
        }
    }

    @Override
    public boolean seedIfEmpty() {
        return new CatalogSeeder().seed(this);
    }

    private <T> DecodedBatch<T> decode(RecordCollection collection, IRecordCodec<T> codec, List<SkippedRecord> skipped) {
        DecodedBatch<T> batch = RecordBatchDecoder.decodeAll(collection.collectionName(),
                store.readLines(collection), codec);
        skipped.addAll(batch.skipped());
        return batch;
    }

    private <T> void putUnique(RecordCollection collection, List<T> records, Int2ObjectMap<T> target,
                               Function<T, Integer> idOf, IRecordCodec<T> codec, List<SkippedRecord> skipped) {
        for (T record : records) {
            int id = idOf.apply(record);
            if (target.containsKey(id)) {
                skipped.add(duplicate(collection, codec.encode(record), "id " + id));
                continue;
            }
            target.put(id, record);
        }
    }

    private static void advancePastAll(IdSequence sequence, IntSet ids) {
        IntIterator it = ids.iterator();
        while (it.hasNext()) {
            sequence.advancePast(it.nextInt());
        }
    }

    private static SkippedRecord duplicate(RecordCollection collection, String line, String what) {
        logger.warning("Skipping duplicate " + collection.collectionName() + " record with " + what);
        return new SkippedRecord(collection.collectionName(), 0, line, "Duplicate " + what);
    }

    /**
     * Drops attendee ids already claimed by an earlier event.
     *
     * @return number of references dropped
     */
    private int releaseDuplicateAttendeeClaims() {
        IntSet claimed = new IntOpenHashSet();
        int dropped = 0;
        for (Event event : events.values()) {
            IntList duplicates = new IntArrayList();
            IntIterator it = event.getAttendeeIds().iterator();
            while (it.hasNext()) {
                int attendeeId = it.nextInt();
                if (!claimed.add(attendeeId)) {
                    duplicates.add(attendeeId);
                }
            }
            for (int i = 0; i < duplicates.size(); i++) {
                int attendeeId = duplicates.getInt(i);
                event.removeAttendee(attendeeId);
                logger.warning("Attendee " + attendeeId + " already belongs to another event; removed from event "
                        + event.getId());
                dropped++;
            }
        }
        return dropped;
    }

    // ==================== Users ====================

    @Override
    public Result<User> createUser(String username, String password, Role role) {
        Objects.requireNonNull(role, "role");
        if (!FieldValidator.isValidText(username, false)) {
            return Result.failure(Outcome.INVALID_TEXT);
        }
        if (!FieldValidator.isValidPassword(password)) {
            return Result.failure(Outcome.INVALID_PASSWORD);
        }
        if (!FieldValidator.isValidText(password, false)) {
            return Result.failure(Outcome.INVALID_TEXT);
        }
        if (isUsernameTaken(username)) {
            return Result.failure(Outcome.DUPLICATE_USERNAME);
        }
        User user = new User(userIds.next(), username, password, role);
        users.put(username, user);
        logger.info("Created " + role + " account '" + username + "' (id " + user.id() + ")");
        saveAll(RecordCollection.USERS);
        return Result.ok(user);
    }

    /**
     * Usernames are unique ignoring case, since legacy attendee records are
     * matched to accounts case-insensitively.
     */
    private boolean isUsernameTaken(String username) {
        for (String existing : users.keySet()) {
            if (existing.equalsIgnoreCase(username)) {
                return true;
            }
        }
        return false;
    }

    @Override
    public Outcome deleteUser(String username, User actingUser) {
        if (actingUser == null || !actingUser.isAdmin()) {
            return Outcome.NOT_PERMITTED;
        }
        if (actingUser.username().equals(username)) {
            return Outcome.CANNOT_DELETE_SELF;
        }
        if (users.remove(username) == null) {
            return Outcome.USER_NOT_FOUND;
        }
        logger.info("Deleted account '" + username + "'");
        saveAll(RecordCollection.USERS);
        return Outcome.OK;
    }

    @Override
    public Optional<User> findUser(String username) {
        return Optional.ofNullable(users.get(username));
    }

    @Override
    public Optional<User> authenticate(String username, String password) {
        User user = users.get(username);
        if (user == null || !user.password().equals(password)) {
            return Optional.empty();
        }
        return Optional.of(user);
    }

    @Override
    public List<User> users() {
        return List.copyOf(users.values());
    }

    // ==================== Events ====================

    @Override
    public Result<Event> createEvent(String name, String date, String time,
                                     String location, String description, String category) {
        if (!FieldValidator.isValidText(name, false)
                || !FieldValidator.isValidText(location, true)
                || !FieldValidator.isValidText(description, true)
                || !FieldValidator.isValidText(category, true)) {
            return Result.failure(Outcome.INVALID_TEXT);
        }
        if (!FieldValidator.isValidDate(date)) {
            return Result.failure(Outcome.INVALID_DATE);
        }
        if (!FieldValidator.isValidTime(time)) {
            return Result.failure(Outcome.INVALID_TIME);
        }
        Event event = new Event(eventIds.next(), name, date, time, location, description, category,
                EventStatus.UPCOMING);
        events.put(event.getId(), event);
        logger.info("Created event '" + name + "' (id " + event.getId() + ")");
        saveAll(RecordCollection.EVENTS);
        return Result.ok(event);
    }

    @Override
    public Outcome editEvent(int eventId, EventField field, String value) {
        Objects.requireNonNull(field, "field");
        Event event = events.get(eventId);
        if (event == null) {
            return Outcome.EVENT_NOT_FOUND;
        }
        switch (field) {
            case NAME -> {
                if (!FieldValidator.isValidText(value, false)) return Outcome.INVALID_TEXT;
                event.setName(value);
            }
            case DATE -> {
                if (!FieldValidator.isValidDate(value)) return Outcome.INVALID_DATE;
                event.setDate(value);
            }
            case TIME -> {
                if (!FieldValidator.isValidTime(value)) return Outcome.INVALID_TIME;
                event.setTime(value);
            }
            case LOCATION -> {
                if (!FieldValidator.isValidText(value, true)) return Outcome.INVALID_TEXT;
                event.setLocation(value);
            }
            case DESCRIPTION -> {
                if (!FieldValidator.isValidText(value, true)) return Outcome.INVALID_TEXT;
                event.setDescription(value);
            }
            case CATEGORY -> {
                if (!FieldValidator.isValidText(value, true)) return Outcome.INVALID_TEXT;
                event.setCategory(value);
            }
        }
        saveAll(RecordCollection.EVENTS);
        return Outcome.OK;
    }

    @Override
    public Outcome updateEventStatus(int eventId, EventStatus status) {
        Objects.requireNonNull(status, "status");
        Event event = events.get(eventId);
        if (event == null) {
            return Outcome.EVENT_NOT_FOUND;
        }
        event.setStatus(status);
        logger.info("Event " + eventId + " status set to " + status);
        saveAll(RecordCollection.EVENTS);
        return Outcome.OK;
    }

    /**
     * Best-effort cascade: returns the event's ledger to the items, removes the
     * attendees registered for it, then removes the event. An unknown item in the
     * ledger is skipped; it does not stop the remaining steps.
     */
    @Override
    public Outcome deleteEvent(int eventId) {
        Event event = events.get(eventId);
        if (event == null) {
            return Outcome.EVENT_NOT_FOUND;
        }
        Span span = tracer.spanBuilder("catalog.delete-event").startSpan();
        try (Scope scope = span.makeCurrent()) {
            span.setAttribute("event.id", eventId);

            int released = 0;
            for (Int2IntMap.Entry entry : event.getAllocatedInventory().int2IntEntrySet()) {
                InventoryItem item = items.get(entry.getIntKey());
                if (item == null) {
                    logger.warning("Event " + eventId + " holds unknown item " + entry.getIntKey() + "; skipping");
                    continue;
                }
                released += releaseFromItem(item, entry.getIntValue());
            }

            int removedAttendees = 0;
            ObjectIterator<Attendee> it = attendees.values().iterator();
            while (it.hasNext()) {
                if (it.next().getEventId() == eventId) {
                    it.remove();
                    removedAttendees++;
                }
            }

            events.remove(eventId);
            span.setAttribute("released.units", released);
            span.setAttribute("removed.attendees", removedAttendees);
            logger.info(String.format("Deleted event '%s' (id %d): released %d units, removed %d attendees",
                    event.getName(), eventId, released, removedAttendees));

            saveAll(RecordCollection.EVENTS, RecordCollection.INVENTORY, RecordCollection.ATTENDEES);
            return Outcome.OK;
        } catch (RuntimeException e) {
            span.recordException(e);
            throw e;
        } finally {
            span.end();
        }
    }

    @Override
    public Optional<Event> findEvent(int eventId) {
        return Optional.ofNullable(events.get(eventId));
    }

    @Override
    public List<Event> searchEvents(String term) {
        String needle = term == null ? "" : term.toLowerCase(Locale.ROOT);
        List<Event> matches = new ArrayList<>();
        for (Event event : events.values()) {
            if (event.getName().toLowerCase(Locale.ROOT).contains(needle) || event.getDate().contains(needle)) {
                matches.add(event);
            }
        }
        return matches;
    }

    @Override
    public List<Event> events() {
        return List.copyOf(events.values());
    }

    // ==================== Registration ====================

    @Override
    public Result<Attendee> registerForEvent(User user, int eventId, String contactInfo) {
        if (user == null || user.isAdmin()) {
            return Result.failure(Outcome.NOT_PERMITTED);
        }
        if (!FieldValidator.isValidText(contactInfo, false)) {
            return Result.failure(Outcome.INVALID_TEXT);
        }
        Event event = events.get(eventId);
        if (event == null) {
            return Result.failure(Outcome.EVENT_NOT_FOUND);
        }
        if (!event.getStatus().acceptsRegistrations()) {
            return Result.failure(Outcome.EVENT_CLOSED);
        }

        Attendee existing = null;
        Attendee genericProfile = null;
        for (Attendee attendee : ownedBy(user)) {
            if (attendee.getEventId() == eventId && existing == null) {
                existing = attendee;
            } else if (attendee.isGenericProfile() && genericProfile == null) {
                genericProfile = attendee;
            }
        }

        if (existing != null) {
            event.addAttendee(existing.getId());
            saveAll(RecordCollection.EVENTS, RecordCollection.ATTENDEES);
            return Result.of(Outcome.ALREADY_REGISTERED, existing);
        }

        Attendee attendee = new Attendee(attendeeIds.next(), user.username(), contactInfo, eventId, false, user.id());
        attendees.put(attendee.getId(), attendee);
        event.addAttendee(attendee.getId());
        if (genericProfile != null) {
            genericProfile.setContactInfo(contactInfo);
        }
        logger.info("Registered attendee " + attendee.getId() + " (" + user.username() + ") for event " + eventId);
        saveAll(RecordCollection.EVENTS, RecordCollection.ATTENDEES);
        return Result.ok(attendee);
    }

    @Override
    public Outcome cancelRegistration(User user, int eventId) {
        if (user == null || user.isAdmin()) {
            return Outcome.NOT_PERMITTED;
        }
        Event event = events.get(eventId);
        if (event == null) {
            return Outcome.EVENT_NOT_FOUND;
        }
        Attendee registration = null;
        for (Attendee attendee : ownedBy(user)) {
            if (attendee.getEventId() == eventId) {
                registration = attendee;
                break;
            }
        }
        if (registration == null) {
            return Outcome.NOT_REGISTERED;
        }
        event.removeAttendee(registration.getId());
        attendees.remove(registration.getId());
        logger.info("Canceled registration " + registration.getId() + " for event " + eventId);
        saveAll(RecordCollection.EVENTS, RecordCollection.ATTENDEES);
        return Outcome.OK;
    }

    @Override
    public Outcome checkIn(int eventId, int attendeeId) {
        if (!events.containsKey(eventId)) {
            return Outcome.EVENT_NOT_FOUND;
        }
        Attendee attendee = attendees.get(attendeeId);
        if (attendee == null || attendee.getEventId() != eventId) {
            return Outcome.ATTENDEE_NOT_FOUND;
        }
        if (!attendee.checkIn()) {
            return Outcome.ALREADY_CHECKED_IN;
        }
        logger.info("Attendee " + attendeeId + " checked in for event " + eventId);
        saveAll(RecordCollection.ATTENDEES);
        return Outcome.OK;
    }

    @Override
    public Outcome updateContactInfo(User user, String contactInfo) {
        if (user == null || user.isAdmin()) {
            return Outcome.NOT_PERMITTED;
        }
        if (!FieldValidator.isValidText(contactInfo, false)) {
            return Outcome.INVALID_TEXT;
        }
        boolean hasGenericProfile = false;
        for (Attendee attendee : ownedBy(user)) {
            attendee.setContactInfo(contactInfo);
            hasGenericProfile |= attendee.isGenericProfile();
        }
        if (!hasGenericProfile) {
            Attendee profile = new Attendee(attendeeIds.next(), user.username(), contactInfo,
                    Attendee.NO_EVENT, false, user.id());
            attendees.put(profile.getId(), profile);
            logger.info("Created generic profile " + profile.getId() + " for " + user.username());
        }
        saveAll(RecordCollection.ATTENDEES);
        return Outcome.OK;
    }

    @Override
    public Optional<Attendee> findAttendee(int attendeeId) {
        return Optional.ofNullable(attendees.get(attendeeId));
    }

    @Override
    public List<Attendee> attendeesForEvent(int eventId) {
        List<Attendee> result = new ArrayList<>();
        for (Attendee attendee : attendees.values()) {
            if (attendee.getEventId() == eventId) {
                result.add(attendee);
            }
        }
        return result;
    }

    @Override
    public List<Attendee> attendees() {
        return List.copyOf(attendees.values());
    }

    /**
     * Attendee records belonging to a user. Records written before ownership was
     * tracked are matched by case-insensitive name and adopted on first use.
     */
    private List<Attendee> ownedBy(User user) {
        List<Attendee> owned = new ArrayList<>();
        for (Attendee attendee : attendees.values()) {
            if (attendee.getOwnerUserId() == user.id()) {
                owned.add(attendee);
            } else if (!attendee.hasOwner() && attendee.getName().equalsIgnoreCase(user.username())) {
                attendee.adoptOwner(user.id());
                logger.info("Linked legacy attendee " + attendee.getId() + " to user " + user.username());
                owned.add(attendee);
            }
        }
        return owned;
    }

    // ==================== Inventory ====================

    @Override
    public Result<InventoryItem> addItem(String name, int totalQuantity, String description) {
        if (!FieldValidator.isValidText(name, false) || !FieldValidator.isValidText(description, true)) {
            return Result.failure(Outcome.INVALID_TEXT);
        }
        if (totalQuantity < 0) {
            return Result.failure(Outcome.INVALID_QUANTITY);
        }
        InventoryItem item = new InventoryItem(itemIds.next(), name, totalQuantity, 0, description);
        items.put(item.getId(), item);
        logger.info("Added inventory item '" + name + "' (id " + item.getId() + ", total " + totalQuantity + ")");
        saveAll(RecordCollection.INVENTORY);
        return Result.ok(item);
    }

    @Override
    public Outcome renameItem(int itemId, String name) {
        InventoryItem item = items.get(itemId);
        if (item == null) {
            return Outcome.ITEM_NOT_FOUND;
        }
        if (!FieldValidator.isValidText(name, false)) {
            return Outcome.INVALID_TEXT;
        }
        item.setName(name);
        saveAll(RecordCollection.INVENTORY);
        return Outcome.OK;
    }

    @Override
    public Outcome describeItem(int itemId, String description) {
        InventoryItem item = items.get(itemId);
        if (item == null) {
            return Outcome.ITEM_NOT_FOUND;
        }
        if (!FieldValidator.isValidText(description, true)) {
            return Outcome.INVALID_TEXT;
        }
        item.setDescription(description);
        saveAll(RecordCollection.INVENTORY);
        return Outcome.OK;
    }

    @Override
    public Outcome setItemTotal(int itemId, int totalQuantity) {
        InventoryItem item = items.get(itemId);
        if (item == null) {
            return Outcome.ITEM_NOT_FOUND;
        }
        Outcome outcome = item.setTotalQuantity(totalQuantity);
        if (outcome.isOk()) {
            saveAll(RecordCollection.INVENTORY);
        }
        return outcome;
    }

    @Override
    public Outcome allocateToEvent(int eventId, int itemId, int quantity) {
        Event event = events.get(eventId);
        if (event == null) {
            return Outcome.EVENT_NOT_FOUND;
        }
        InventoryItem item = items.get(itemId);
        if (item == null) {
            return Outcome.ITEM_NOT_FOUND;
        }
        // item first: the ledger must never record a reservation the item refused
        Outcome outcome = item.allocate(quantity);
        if (!outcome.isOk()) {
            return outcome;
        }
        event.allocateInventoryItem(itemId, quantity);
        logger.info(String.format("Allocated %d of item %d to event %d", quantity, itemId, eventId));
        saveAll(RecordCollection.INVENTORY, RecordCollection.EVENTS);
        return Outcome.OK;
    }

    @Override
    public Result<Integer> deallocateFromEvent(int eventId, int itemId, int quantity) {
        Event event = events.get(eventId);
        if (event == null) {
            return Result.failure(Outcome.EVENT_NOT_FOUND);
        }
        InventoryItem item = items.get(itemId);
        if (item == null) {
            return Result.failure(Outcome.ITEM_NOT_FOUND);
        }
        if (quantity <= 0) {
            return Result.failure(Outcome.INVALID_QUANTITY);
        }
        if (event.getAllocatedQuantity(itemId) == 0) {
            return Result.failure(Outcome.NOT_ALLOCATED);
        }
        int actual = event.deallocateInventoryItem(itemId, quantity);
        releaseFromItem(item, actual);
        logger.info(String.format("Deallocated %d of item %d from event %d (requested %d)",
                actual, itemId, eventId, quantity));
        saveAll(RecordCollection.INVENTORY, RecordCollection.EVENTS);
        return Result.ok(actual);
    }

    @Override
    public Optional<InventoryItem> findItem(int itemId) {
        return Optional.ofNullable(items.get(itemId));
    }

    @Override
    public Optional<InventoryItem> findItemByName(String name) {
        for (InventoryItem item : items.values()) {
            if (item.getName().equalsIgnoreCase(name)) {
                return Optional.of(item);
            }
        }
        return Optional.empty();
    }

    @Override
    public List<InventoryItem> items() {
        return List.copyOf(items.values());
    }

    /**
     * Returns up to {@code quantity} units to the item, never taking its
     * allocation below zero.
     *
     * @return units actually released
     */
    private static int releaseFromItem(InventoryItem item, int quantity) {
        int releasable = Math.min(quantity, item.getAllocatedQuantity());
        if (releasable < quantity) {
            logger.warning(String.format("Item %d holds only %d allocated units, cannot release %d",
                    item.getId(), item.getAllocatedQuantity(), quantity));
        }
        if (releasable > 0) {
            item.deallocate(releasable);
        }
        return releasable;
    }

    // ==================== Persistence ====================

    /**
     * Saves each collection in turn. A failure does not stop the remaining
     * collections from being written; the first failure is rethrown afterwards
     * with any later ones attached as suppressed.
     */
    private void saveAll(RecordCollection... collections) {
        PersistenceException failure = null;
        for (RecordCollection collection : collections) {
            try {
                save(collection);
            } catch (PersistenceException e) {
                if (failure == null) {
                    failure = e;
                } else {
                    failure.addSuppressed(e);
                }
            }
        }
        if (failure != null) {
            throw failure;
        }
    }

    private void save(RecordCollection collection) {
        Span span = tracer.spanBuilder("catalog.save").startSpan();
        try (Scope scope = span.makeCurrent()) {
            span.setAttribute("collection", collection.collectionName());
            List<String> lines = switch (collection) {
                case USERS -> encodeAll(users.values(), userCodec);
                case EVENTS -> encodeAll(events.values(), eventCodec);
                case ATTENDEES -> encodeAll(attendees.values(), attendeeCodec);
                case INVENTORY -> encodeAll(items.values(), inventoryCodec);
            };
            store.writeLines(collection, lines);
            span.setAttribute("records", lines.size());
        } catch (PersistenceException e) {
            span.recordException(e);
            logger.log(Level.SEVERE, "Failed to save " + collection.collectionName(), e);
            throw e;
        } finally {
            span.end();
        }
    }

    private static <T> List<String> encodeAll(Iterable<T> entities, IRecordCodec<T> codec) {
        List<String> lines = new ArrayList<>();
        for (T entity : entities) {
            lines.add(codec.encode(entity));
        }
        return lines;
    }
}
