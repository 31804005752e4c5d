/*
 * Copyright (c) 2025 EventHub
 * Licensed under the Apache License, Version 2.0
 */
package com.eventhub.codec;

import com.eventhub.api.IRecordCodec;
import com.eventhub.api.model.Attendee;

/**
 * {@code id,name,contactInfo,eventId,checkedIn(0|1)[,ownerUserId]}
 *
 * <p>The owner field is optional so files written before it existed still load;
 * those records decode with {@link Attendee#NO_OWNER}.
 */
public class AttendeeRecordCodec implements IRecordCodec<Attendee> {

    private static final int REQUIRED_FIELDS = 5;
    private static final int MAX_FIELDS = 6;

    @Override
    public String encode(Attendee attendee) {
        return RecordFields.join(
                attendee.getId(),
                attendee.getName(),
                attendee.getContactInfo(),
                attendee.getEventId(),
                attendee.isCheckedIn() ? "1" : "0",
                attendee.getOwnerUserId());
    }

    @Override
    public Attendee decode(String line) {
        RecordFields fields = RecordFields.parse(line, MAX_FIELDS).require(REQUIRED_FIELDS, "Attendee");
        int id = fields.integer(0, "attendee id");
        int eventId = fields.integer(3, "event id");
        boolean checkedIn = "1".equals(fields.text(4).trim());
        int owner = Attendee.NO_OWNER;
        if (fields.has(5) && !fields.text(5).isBlank()) {
            owner = fields.integer(5, "owner user id");
        }
        return new Attendee(id, fields.text(1), fields.text(2), eventId, checkedIn, owner);
    }
}
