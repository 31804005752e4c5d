/*
 * Copyright (c) 2025 EventHub
 * Licensed under the Apache License, Version 2.0
 */
package com.eventhub.catalog;

import com.eventhub.api.Outcome;
import com.eventhub.api.Result;
import com.eventhub.api.model.Attendee;
import com.eventhub.api.model.Event;
import com.eventhub.api.model.InventoryItem;
import com.eventhub.api.model.LoadSummary;
import com.eventhub.api.model.Role;
import com.eventhub.api.model.User;
import com.eventhub.infra.persistence.InMemoryRecordStore;
import com.eventhub.infra.persistence.RecordCollection;
import io.opentelemetry.api.OpenTelemetry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class EventCatalogLoadTest {

    private static final String USERS = "1,admin,adminpass,0";
    private static final String EVENT_PREFIX = ",2025-10-20,09:00,Grand Hall,,Conference,0,";

    private InMemoryRecordStore store;
    private EventCatalog catalog;

    @BeforeEach
    void setUp() {
        store = new InMemoryRecordStore();
        catalog = new EventCatalog(store, OpenTelemetry.noop().getTracer("test"));
    }

    private static String event(int id, String name, String attendees, String allocations) {
        return id + "," + name + EVENT_PREFIX + attendees + "," + allocations;
    }

    @Test
    @DisplayName("allocated quantity is rebuilt from event ledgers, not trusted from the inventory file")
    void shouldRecomputeAllocationFromLedgers() {
        store.seed(RecordCollection.INVENTORY, List.of("5,Chairs,20,0,Standard chairs"));
        store.seed(RecordCollection.EVENTS, List.of(
                event(1, "A", "", "5:3"),
                event(2, "B", "", "5:4")));

        LoadSummary summary = catalog.load();

        assertThat(catalog.findItem(5).orElseThrow().getAllocatedQuantity()).isEqualTo(7);
        assertThat(summary.isClean()).isTrue();
    }

    @Test
    void shouldRaiseTotalWhenLedgersExceedIt() {
        store.seed(RecordCollection.INVENTORY, List.of("5,Chairs,5,5,Standard chairs"));
        store.seed(RecordCollection.EVENTS, List.of(
                event(1, "A", "", "5:3"),
                event(2, "B", "", "5:4")));

        LoadSummary summary = catalog.load();

        InventoryItem chairs = catalog.findItem(5).orElseThrow();
        assertThat(chairs.getTotalQuantity()).isEqualTo(7);
        assertThat(chairs.getAllocatedQuantity()).isEqualTo(7);
        assertThat(summary.repairs()).isEqualTo(1);
    }

    @Test
    void shouldIgnoreLedgerEntriesForUnknownItems() {
        store.seed(RecordCollection.INVENTORY, List.of("5,Chairs,20,9,Standard chairs"));
        store.seed(RecordCollection.EVENTS, List.of(event(1, "A", "", "99:4")));

        catalog.load();

        assertThat(catalog.findItem(5).orElseThrow().getAllocatedQuantity()).isZero();
    }

    @Test
    void shouldSkipMalformedLinesAndKeepLoading() {
        store.seed(RecordCollection.INVENTORY, List.of(
                "1,Projector,5,0,HD Projector",
                "abc,Chairs,100,0,Standard chairs"));

        LoadSummary summary = catalog.load();

        assertThat(summary.items()).isEqualTo(1);
        assertThat(summary.skipped()).singleElement()
                .satisfies(skipped -> assertThat(skipped.lineNumber()).isEqualTo(2));
        assertThat(summary.isClean()).isFalse();
    }

    @Test
    void shouldSkipDuplicateIds() {
        store.seed(RecordCollection.INVENTORY, List.of(
                "1,Projector,5,0,HD Projector",
                "1,Chairs,100,0,Standard chairs"));

        LoadSummary summary = catalog.load();

        assertThat(catalog.items()).extracting(InventoryItem::getName).containsExactly("Projector");
        assertThat(summary.skipped()).hasSize(1);
    }

    @Test
    void shouldSkipUsersWithDuplicateIds() {
        store.seed(RecordCollection.USERS, List.of(USERS, "2,alice,alicepass,1", "2,bob,bobpass,1"));
        store.seed(RecordCollection.EVENTS, List.of(event(1, "A", "5", "")));
        store.seed(RecordCollection.ATTENDEES, List.of("5,alice,alice@example.com,1,0,2"));

        LoadSummary summary = catalog.load();

        assertThat(catalog.findUser("bob")).isEmpty();
        assertThat(summary.users()).isEqualTo(2);
        assertThat(summary.skipped()).singleElement()
                .satisfies(skipped -> assertThat(skipped.reason()).contains("id 2"));
        assertThat(catalog.findEvent(1).orElseThrow().getAttendeeIds()).containsExactly(5);
    }

    @Test
    void shouldSkipUsernamesDifferingOnlyInCase() {
        store.seed(RecordCollection.USERS, List.of(USERS, "2,Bob,bobpass1,1", "3,bob,bobpass2,1"));

        LoadSummary summary = catalog.load();

        assertThat(catalog.users()).extracting(User::username).containsExactly("admin", "Bob");
        assertThat(summary.skipped()).hasSize(1);
    }

    @Test
    @DisplayName("a ledger entry that overflows is dropped instead of aborting the load")
    void shouldSurviveOverflowingLedgerEntryInOneEvent() {
        store.seed(RecordCollection.INVENTORY, List.of("5,Chairs,20,0,Standard chairs"));
        store.seed(RecordCollection.EVENTS, List.of(event(1, "A", "", "5:2147483647;5:1")));

        LoadSummary summary = catalog.load();

        assertThat(catalog.findEvent(1).orElseThrow().getAllocatedQuantity(5)).isEqualTo(Integer.MAX_VALUE);
        InventoryItem chairs = catalog.findItem(5).orElseThrow();
        assertThat(chairs.getAllocatedQuantity()).isEqualTo(Integer.MAX_VALUE);
        assertThat(chairs.getTotalQuantity()).isEqualTo(Integer.MAX_VALUE);
        assertThat(summary.events()).isEqualTo(1);
    }

    @Test
    void shouldSurviveLedgersWhoseSumOverflows() {
        store.seed(RecordCollection.INVENTORY, List.of("5,Chairs,20,0,Standard chairs"));
        store.seed(RecordCollection.EVENTS, List.of(
                event(1, "A", "", "5:2000000000"),
                event(2, "B", "", "5:2000000000")));

        LoadSummary summary = catalog.load();

        assertThat(catalog.findItem(5).orElseThrow().getAllocatedQuantity()).isEqualTo(2_000_000_000);
        assertThat(catalog.findEvent(1).orElseThrow().getAllocatedQuantity(5)).isEqualTo(2_000_000_000);
        assertThat(catalog.findEvent(2).orElseThrow().getAllocatedInventory()).isEmpty();
        assertThat(summary.repairs()).isEqualTo(2);
    }

    @Test
    @DisplayName("an attendee claimed by two events stays with the first")
    void shouldDropLaterAttendeeClaims() {
        store.seed(RecordCollection.EVENTS, List.of(
                event(1, "A", "3;4", ""),
                event(2, "B", "3", "")));

        LoadSummary summary = catalog.load();

        assertThat(catalog.findEvent(1).orElseThrow().getAttendeeIds()).containsExactlyInAnyOrder(3, 4);
        assertThat(catalog.findEvent(2).orElseThrow().getAttendeeIds()).isEmpty();
        assertThat(summary.repairs()).isEqualTo(1);
    }

    @Test
    void shouldContinueIdsPastLoadedMaximum() {
        store.seed(RecordCollection.USERS, List.of(USERS, "7,user1,user1pass,1"));
        store.seed(RecordCollection.EVENTS, List.of(event(4, "A", "", "")));
        store.seed(RecordCollection.ATTENDEES, List.of("9,user1,x,4,0,7"));
        store.seed(RecordCollection.INVENTORY, List.of("12,Chairs,10,0,"));
        catalog.load();

        User user1 = catalog.findUser("user1").orElseThrow();
        assertThat(catalog.createEvent("B", "2025-01-01", "10:00", "", "", "").value().getId()).isEqualTo(5);
        assertThat(catalog.addItem("Tables", 1, "").value().getId()).isEqualTo(13);
        assertThat(catalog.registerForEvent(user1, 5, "x").value().getId()).isEqualTo(10);
        assertThat(catalog.createUser("carol", "carolpass",
                Role.REGULAR_USER).value().id()).isEqualTo(8);
    }

    @Test
    @DisplayName("deleting an event returns its inventory and removes its attendees")
    void shouldCascadeDeleteLoadedEvent() {
        store.seed(RecordCollection.USERS, List.of(USERS, "2,user1,user1pass,1"));
        store.seed(RecordCollection.INVENTORY, List.of("5,Chairs,20,0,Standard chairs"));
        store.seed(RecordCollection.EVENTS, List.of(event(1, "A", "1", "5:10")));
        store.seed(RecordCollection.ATTENDEES, List.of("1,user1,user1@example.com,1,0,2"));
        catalog.load();
        assertThat(catalog.findItem(5).orElseThrow().getAllocatedQuantity()).isEqualTo(10);

        assertThat(catalog.deleteEvent(1)).isEqualTo(Outcome.OK);

        assertThat(catalog.findItem(5).orElseThrow().getAllocatedQuantity()).isZero();
        assertThat(catalog.attendees()).isEmpty();
        assertThat(catalog.events()).isEmpty();
        assertThat(store.readLines(RecordCollection.EVENTS)).isEmpty();
        assertThat(store.readLines(RecordCollection.ATTENDEES)).isEmpty();
        assertThat(store.readLines(RecordCollection.INVENTORY)).containsExactly("5,Chairs,20,0,Standard chairs");
    }

    @Test
    void shouldCascadePastUnknownLedgerItems() {
        store.seed(RecordCollection.INVENTORY, List.of("5,Chairs,20,0,"));
        store.seed(RecordCollection.EVENTS, List.of(event(1, "A", "", "99:4;5:6")));
        catalog.load();

        assertThat(catalog.deleteEvent(1)).isEqualTo(Outcome.OK);

        assertThat(catalog.findItem(5).orElseThrow().getAllocatedQuantity()).isZero();
        assertThat(catalog.findEvent(1)).isEmpty();
    }

    @Test
    @DisplayName("attendee records without an owner are matched by name and adopted")
    void shouldAdoptLegacyAttendeeByName() {
        store.seed(RecordCollection.USERS, List.of(USERS, "2,user1,user1pass,1", "3,user2,user2pass,1"));
        store.seed(RecordCollection.EVENTS, List.of(event(1, "A", "5", "")));
        store.seed(RecordCollection.ATTENDEES, List.of("5,USER1,old@example.com,1,0"));
        catalog.load();
        User user1 = catalog.findUser("user1").orElseThrow();
        User user2 = catalog.findUser("user2").orElseThrow();

        assertThat(catalog.cancelRegistration(user2, 1)).isEqualTo(Outcome.NOT_REGISTERED);
        Result<Attendee> again = catalog.registerForEvent(user1, 1, "new@example.com");

        assertThat(again.outcome()).isEqualTo(Outcome.ALREADY_REGISTERED);
        assertThat(again.value().getId()).isEqualTo(5);
        assertThat(again.value().getOwnerUserId()).isEqualTo(user1.id());
        assertThat(store.readLines(RecordCollection.ATTENDEES)).containsExactly("5,USER1,old@example.com,1,0,2");
    }

    @Test
    void shouldReloadWhatWasSaved() {
        catalog.load();
        catalog.seedIfEmpty();
        User user1 = catalog.findUser("user1").orElseThrow();
        Event conference = catalog.events().get(0);
        catalog.allocateToEvent(conference.getId(), 1, 2);
        catalog.registerForEvent(user1, conference.getId(), "user1@example.com");

        EventCatalog reloaded = new EventCatalog(store, OpenTelemetry.noop().getTracer("test"));
        LoadSummary summary = reloaded.load();

        assertThat(summary.isClean()).isTrue();
        assertThat(summary.users()).isEqualTo(3);
        assertThat(summary.attendees()).isEqualTo(1);
        Event restored = reloaded.findEvent(conference.getId()).orElseThrow();
        assertThat(restored.getAttendeeIds()).hasSize(1);
        assertThat(restored.getAllocatedQuantity(1)).isEqualTo(2);
        assertThat(reloaded.findItem(1).orElseThrow().getAllocatedQuantity()).isEqualTo(2);
    }
}
