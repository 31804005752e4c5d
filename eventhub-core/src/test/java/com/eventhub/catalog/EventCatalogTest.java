/*
 * Copyright (c) 2025 EventHub
 * Licensed under the Apache License, Version 2.0
 */
package com.eventhub.catalog;

import com.eventhub.api.Outcome;
import com.eventhub.api.Result;
import com.eventhub.api.model.Attendee;
import com.eventhub.api.model.Event;
import com.eventhub.api.model.EventField;
import com.eventhub.api.model.EventStatus;
import com.eventhub.api.model.InventoryItem;
import com.eventhub.api.model.Role;
import com.eventhub.api.model.User;
import com.eventhub.infra.persistence.InMemoryRecordStore;
import com.eventhub.infra.persistence.RecordCollection;
import io.opentelemetry.api.OpenTelemetry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class EventCatalogTest {

    private InMemoryRecordStore store;
    private EventCatalog catalog;

    private User admin;
    private User user1;
    private User user2;
    private Event conference;
    private Event festival;
    private InventoryItem projector;
    private InventoryItem chairs;

    @BeforeEach
    void setUp() {
        store = new InMemoryRecordStore();
        catalog = new EventCatalog(store, OpenTelemetry.noop().getTracer("test"));
        catalog.load();
        assertThat(catalog.seedIfEmpty()).isTrue();

        admin = catalog.findUser("admin").orElseThrow();
        user1 = catalog.findUser("user1").orElseThrow();
        user2 = catalog.findUser("user2").orElseThrow();
        conference = catalog.searchEvents("tech conference").get(0);
        festival = catalog.searchEvents("summer").get(0);
        projector = catalog.findItemByName("projector").orElseThrow();
        chairs = catalog.findItemByName("Chairs").orElseThrow();
    }

    // ==================== Users ====================

    @Test
    void shouldSeedStarterData() {
        assertThat(catalog.users()).extracting(User::username).containsExactly("admin", "user1", "user2");
        assertThat(admin.isAdmin()).isTrue();
        assertThat(catalog.events()).hasSize(2);
        assertThat(projector.getTotalQuantity()).isEqualTo(5);
        assertThat(chairs.getTotalQuantity()).isEqualTo(100);
        assertThat(catalog.seedIfEmpty()).isFalse();
    }

    @Test
    void shouldAuthenticateOnlyWithMatchingPassword() {
        assertThat(catalog.authenticate("user1", "user1pass")).contains(user1);
        assertThat(catalog.authenticate("user1", "wrong")).isEmpty();
        assertThat(catalog.authenticate("nobody", "user1pass")).isEmpty();
    }

    @Test
    void shouldValidateNewUsers() {
        assertThat(catalog.createUser("user1", "another1", Role.REGULAR_USER).outcome())
                .isEqualTo(Outcome.DUPLICATE_USERNAME);
        assertThat(catalog.createUser("USER1", "another1", Role.REGULAR_USER).outcome())
                .isEqualTo(Outcome.DUPLICATE_USERNAME);
        assertThat(catalog.createUser("carol", "short", Role.REGULAR_USER).outcome())
                .isEqualTo(Outcome.INVALID_PASSWORD);
        assertThat(catalog.createUser("car,ol", "longenough", Role.REGULAR_USER).outcome())
                .isEqualTo(Outcome.INVALID_TEXT);

        Result<User> created = catalog.createUser("carol", "carolpass", Role.REGULAR_USER);
        assertThat(created.isOk()).isTrue();
        assertThat(created.value().id()).isEqualTo(4);
        assertThat(store.readLines(RecordCollection.USERS)).contains("4,carol,carolpass,1");
    }

    @Test
    void shouldOnlyLetAdminsDeleteOtherUsers() {
        assertThat(catalog.deleteUser("user2", user1)).isEqualTo(Outcome.NOT_PERMITTED);
        assertThat(catalog.deleteUser("admin", admin)).isEqualTo(Outcome.CANNOT_DELETE_SELF);
        assertThat(catalog.deleteUser("ghost", admin)).isEqualTo(Outcome.USER_NOT_FOUND);

        assertThat(catalog.deleteUser("user2", admin)).isEqualTo(Outcome.OK);
        assertThat(catalog.findUser("user2")).isEmpty();
    }

    // ==================== Events ====================

    @Test
    void shouldValidateNewEvents() {
        assertThat(catalog.createEvent("Gala", "2025-13-01", "18:00", "Hall", "", "Social").outcome())
                .isEqualTo(Outcome.INVALID_DATE);
        assertThat(catalog.createEvent("Gala", "2025-12-01", "24:00", "Hall", "", "Social").outcome())
                .isEqualTo(Outcome.INVALID_TIME);
        assertThat(catalog.createEvent("Gala, Night", "2025-12-01", "18:00", "Hall", "", "Social").outcome())
                .isEqualTo(Outcome.INVALID_TEXT);

        Result<Event> gala = catalog.createEvent("Gala", "2025-12-01", "18:00", "Hall", "", "Social");
        assertThat(gala.isOk()).isTrue();
        assertThat(gala.value().getId()).isEqualTo(3);
        assertThat(gala.value().getStatus()).isEqualTo(EventStatus.UPCOMING);
    }

    @Test
    void shouldEditEventFields() {
        assertThat(catalog.editEvent(conference.getId(), EventField.LOCATION, "Main Hall")).isEqualTo(Outcome.OK);
        assertThat(catalog.editEvent(conference.getId(), EventField.DATE, "20-10-2025")).isEqualTo(Outcome.INVALID_DATE);
        assertThat(catalog.editEvent(99, EventField.NAME, "x")).isEqualTo(Outcome.EVENT_NOT_FOUND);

        assertThat(conference.getLocation()).isEqualTo("Main Hall");
        assertThat(conference.getDate()).isEqualTo("2025-10-20");
    }

    @Test
    void shouldSearchByNameOrDate() {
        assertThat(catalog.searchEvents("MUSIC")).containsExactly(festival);
        assertThat(catalog.searchEvents("2025-10")).containsExactly(conference);
        assertThat(catalog.searchEvents("2025")).containsExactly(conference, festival);
        assertThat(catalog.searchEvents("opera")).isEmpty();
    }

    // ==================== Registration ====================

    @Test
    void shouldRegisterRegularUser() {
        Result<Attendee> result = catalog.registerForEvent(user1, conference.getId(), "user1@example.com");

        assertThat(result.isOk()).isTrue();
        Attendee attendee = result.value();
        assertThat(attendee.getName()).isEqualTo("user1");
        assertThat(attendee.getOwnerUserId()).isEqualTo(user1.id());
        assertThat(conference.hasAttendee(attendee.getId())).isTrue();
        assertThat(catalog.attendeesForEvent(conference.getId())).containsExactly(attendee);
    }

    @Test
    void shouldReportDuplicateRegistrationWithoutChange() {
        Attendee first = catalog.registerForEvent(user1, conference.getId(), "a@example.com").value();

        Result<Attendee> second = catalog.registerForEvent(user1, conference.getId(), "b@example.com");

        assertThat(second.outcome()).isEqualTo(Outcome.ALREADY_REGISTERED);
        assertThat(second.value()).isSameAs(first);
        assertThat(catalog.attendees()).hasSize(1);
        assertThat(first.getContactInfo()).isEqualTo("a@example.com");
    }

    @Test
    void shouldRejectRegistrationForAdminsAndClosedEvents() {
        assertThat(catalog.registerForEvent(admin, conference.getId(), "x").outcome())
                .isEqualTo(Outcome.NOT_PERMITTED);
        assertThat(catalog.registerForEvent(user1, 99, "x").outcome())
                .isEqualTo(Outcome.EVENT_NOT_FOUND);

        catalog.updateEventStatus(festival.getId(), EventStatus.CANCELED);
        assertThat(catalog.registerForEvent(user1, festival.getId(), "x").outcome())
                .isEqualTo(Outcome.EVENT_CLOSED);

        catalog.updateEventStatus(festival.getId(), EventStatus.COMPLETED);
        assertThat(catalog.registerForEvent(user1, festival.getId(), "x").outcome())
                .isEqualTo(Outcome.EVENT_CLOSED);

        catalog.updateEventStatus(festival.getId(), EventStatus.ONGOING);
        assertThat(catalog.registerForEvent(user1, festival.getId(), "x").isOk()).isTrue();
    }

    @Test
    void shouldCancelOwnRegistrationOnly() {
        Attendee attendee = catalog.registerForEvent(user1, conference.getId(), "x").value();

        assertThat(catalog.cancelRegistration(user2, conference.getId())).isEqualTo(Outcome.NOT_REGISTERED);
        assertThat(catalog.cancelRegistration(user1, conference.getId())).isEqualTo(Outcome.OK);

        assertThat(conference.hasAttendee(attendee.getId())).isFalse();
        assertThat(catalog.findAttendee(attendee.getId())).isEmpty();
        assertThat(catalog.cancelRegistration(user1, conference.getId())).isEqualTo(Outcome.NOT_REGISTERED);
    }

    @Test
    void shouldCheckInOnceForTheRightEvent() {
        Attendee attendee = catalog.registerForEvent(user1, conference.getId(), "x").value();

        assertThat(catalog.checkIn(festival.getId(), attendee.getId())).isEqualTo(Outcome.ATTENDEE_NOT_FOUND);
        assertThat(catalog.checkIn(conference.getId(), 99)).isEqualTo(Outcome.ATTENDEE_NOT_FOUND);
        assertThat(catalog.checkIn(conference.getId(), attendee.getId())).isEqualTo(Outcome.OK);
        assertThat(catalog.checkIn(conference.getId(), attendee.getId())).isEqualTo(Outcome.ALREADY_CHECKED_IN);
        assertThat(attendee.isCheckedIn()).isTrue();
    }

    @Test
    @DisplayName("contact update touches only the user's own records and creates a generic profile")
    void shouldUpdateContactInfoForOwnRecords() {
        Attendee mine = catalog.registerForEvent(user1, conference.getId(), "old").value();
        Attendee theirs = catalog.registerForEvent(user2, conference.getId(), "theirs").value();

        assertThat(catalog.updateContactInfo(user1, "new@example.com")).isEqualTo(Outcome.OK);

        assertThat(mine.getContactInfo()).isEqualTo("new@example.com");
        assertThat(theirs.getContactInfo()).isEqualTo("theirs");
        assertThat(catalog.attendees())
                .filteredOn(Attendee::isGenericProfile)
                .singleElement()
                .satisfies(profile -> {
                    assertThat(profile.getOwnerUserId()).isEqualTo(user1.id());
                    assertThat(profile.getContactInfo()).isEqualTo("new@example.com");
                });

        catalog.updateContactInfo(user1, "newer");
        assertThat(catalog.attendees()).filteredOn(Attendee::isGenericProfile).hasSize(1);
    }

    @Test
    void shouldCopyNewContactToGenericProfileOnRegistration() {
        catalog.updateContactInfo(user1, "profile");

        catalog.registerForEvent(user1, festival.getId(), "fresh");

        assertThat(catalog.attendees())
                .filteredOn(Attendee::isGenericProfile)
                .extracting(Attendee::getContactInfo)
                .containsExactly("fresh");
    }

    // ==================== Inventory ====================

    @Test
    void shouldAllocateThroughItemAndLedger() {
        assertThat(catalog.allocateToEvent(conference.getId(), projector.getId(), 3)).isEqualTo(Outcome.OK);

        assertThat(projector.getAllocatedQuantity()).isEqualTo(3);
        assertThat(conference.getAllocatedQuantity(projector.getId())).isEqualTo(3);
        assertThat(store.readLines(RecordCollection.EVENTS).get(0)).endsWith(",," + projector.getId() + ":3");
    }

    @Test
    @DisplayName("a refused item allocation leaves no ledger entry")
    void shouldNotRecordRefusedAllocation() {
        int writes = store.writeCount();

        assertThat(catalog.allocateToEvent(conference.getId(), projector.getId(), 6))
                .isEqualTo(Outcome.INSUFFICIENT_AVAILABLE);
        assertThat(catalog.allocateToEvent(conference.getId(), projector.getId(), 0))
                .isEqualTo(Outcome.INVALID_QUANTITY);

        assertThat(projector.getAllocatedQuantity()).isZero();
        assertThat(conference.getAllocatedInventory()).isEmpty();
        assertThat(store.writeCount()).isEqualTo(writes);
    }

    @Test
    void shouldReportMissingEventOrItemOnAllocate() {
        assertThat(catalog.allocateToEvent(99, projector.getId(), 1)).isEqualTo(Outcome.EVENT_NOT_FOUND);
        assertThat(catalog.allocateToEvent(conference.getId(), 99, 1)).isEqualTo(Outcome.ITEM_NOT_FOUND);
    }

    @Test
    void shouldDeallocateOnlyWhatTheEventHolds() {
        catalog.allocateToEvent(conference.getId(), chairs.getId(), 30);
        catalog.allocateToEvent(festival.getId(), chairs.getId(), 20);

        Result<Integer> released = catalog.deallocateFromEvent(conference.getId(), chairs.getId(), 50);

        assertThat(released.value()).isEqualTo(30);
        assertThat(chairs.getAllocatedQuantity()).isEqualTo(20);
        assertThat(conference.getAllocatedInventory()).isEmpty();
        assertThat(catalog.deallocateFromEvent(conference.getId(), chairs.getId(), 1).outcome())
                .isEqualTo(Outcome.NOT_ALLOCATED);
        assertThat(catalog.deallocateFromEvent(festival.getId(), chairs.getId(), 0).outcome())
                .isEqualTo(Outcome.INVALID_QUANTITY);
    }

    @Test
    void shouldNotShrinkTotalBelowAllocation() {
        catalog.allocateToEvent(conference.getId(), projector.getId(), 5);

        assertThat(catalog.setItemTotal(projector.getId(), 2)).isEqualTo(Outcome.BELOW_ALLOCATED);
        assertThat(projector.getTotalQuantity()).isEqualTo(5);
        assertThat(catalog.setItemTotal(projector.getId(), 8)).isEqualTo(Outcome.OK);
        assertThat(projector.getAvailableQuantity()).isEqualTo(3);
    }

    @Test
    void shouldAddAndEditItems() {
        assertThat(catalog.addItem("Tables", -1, "").outcome()).isEqualTo(Outcome.INVALID_QUANTITY);

        InventoryItem tables = catalog.addItem("Tables", 12, "Folding").value();
        assertThat(tables.getId()).isEqualTo(3);

        assertThat(catalog.renameItem(tables.getId(), "Round tables")).isEqualTo(Outcome.OK);
        assertThat(catalog.describeItem(tables.getId(), "Seats eight")).isEqualTo(Outcome.OK);
        assertThat(catalog.renameItem(99, "x")).isEqualTo(Outcome.ITEM_NOT_FOUND);
        assertThat(store.readLines(RecordCollection.INVENTORY)).contains("3,Round tables,12,0,Seats eight");
    }

    // ==================== Delete ====================

    @Test
    void shouldCascadeEventDeletion() {
        catalog.allocateToEvent(conference.getId(), chairs.getId(), 40);
        catalog.allocateToEvent(festival.getId(), chairs.getId(), 10);
        Attendee attendee = catalog.registerForEvent(user1, conference.getId(), "x").value();
        Attendee other = catalog.registerForEvent(user1, festival.getId(), "x").value();

        assertThat(catalog.deleteEvent(conference.getId())).isEqualTo(Outcome.OK);

        assertThat(catalog.findEvent(conference.getId())).isEmpty();
        assertThat(chairs.getAllocatedQuantity()).isEqualTo(10);
        assertThat(catalog.findAttendee(attendee.getId())).isEmpty();
        assertThat(catalog.findAttendee(other.getId())).isPresent();
        assertThat(catalog.deleteEvent(conference.getId())).isEqualTo(Outcome.EVENT_NOT_FOUND);
    }

    @Test
    void shouldNeverReuseIds() {
        int deletedId = conference.getId();
        catalog.deleteEvent(deletedId);

        Event next = catalog.createEvent("Gala", "2025-12-01", "18:00", "Hall", "", "Social").value();

        assertThat(next.getId()).isGreaterThan(festival.getId()).isNotEqualTo(deletedId);
    }
}
