/*
 * Copyright (c) 2025 EventHub
 * Licensed under the Apache License, Version 2.0
 */
package com.eventhub.api.model;

import java.util.Objects;

/**
 * A registration linking a person to at most one event.
 *
 * <p>An attendee with {@code eventId == 0} is a generic profile that is not
 * registered for anything. {@code ownerUserId} is the id of the account that
 * owns the record, or {@code 0} when unknown (records written before the owner
 * field existed).
 */
public class Attendee {

    /** Event id used by generic profiles. */
    public static final int NO_EVENT = 0;

    /** Owner id used when no account is linked. */
    public static final int NO_OWNER = 0;

    private final int id;
    private final String name;
    private String contactInfo;
    private final int eventId;
    private boolean checkedIn;
    private int ownerUserId;

    public Attendee(int id, String name, String contactInfo, int eventId, boolean checkedIn, int ownerUserId) {
        this.id = id;
        this.name = Objects.requireNonNull(name, "name");
        this.contactInfo = Objects.requireNonNull(contactInfo, "contactInfo");
        this.eventId = eventId;
        this.checkedIn = checkedIn;
        this.ownerUserId = ownerUserId;
    }

    public int getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    public String getContactInfo() {
        return contactInfo;
    }

    public void setContactInfo(String contactInfo) {
        this.contactInfo = Objects.requireNonNull(contactInfo, "contactInfo");
    }

    public int getEventId() {
        return eventId;
    }

    public boolean isGenericProfile() {
        return eventId == NO_EVENT;
    }

    public boolean isCheckedIn() {
        return checkedIn;
    }

    /**
     * Marks the attendee as checked in. There is no reverse transition.
     *
     * @return {@code false} if the attendee was already checked in
     */
    public boolean checkIn() {
        if (checkedIn) {
            return false;
        }
        checkedIn = true;
        return true;
    }

    public int getOwnerUserId() {
        return ownerUserId;
    }

    public boolean hasOwner() {
        return ownerUserId != NO_OWNER;
    }

    /**
     * Links an unowned record to an account. Ownership never changes once set.
     *
     * @throws IllegalStateException if the record already has an owner
     */
    public void adoptOwner(int userId) {
        if (hasOwner()) {
            throw new IllegalStateException("Attendee " + id + " is already owned by user " + ownerUserId);
        }
        this.ownerUserId = userId;
    }

    @Override
    public String toString() {
        return "Attendee[id=" + id + ", name=" + name + ", eventId=" + eventId
                + ", checkedIn=" + checkedIn + "]";
    }
}
