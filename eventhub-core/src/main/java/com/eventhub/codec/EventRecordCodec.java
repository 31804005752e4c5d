/*
 * Copyright (c) 2025 EventHub
 * Licensed under the Apache License, Version 2.0
 */
package com.eventhub.codec;

import com.eventhub.api.IRecordCodec;
import com.eventhub.api.exceptions.MalformedRecordException;
import com.eventhub.api.model.Event;
import com.eventhub.api.model.EventStatus;
import it.unimi.dsi.fastutil.ints.Int2IntMap;
import it.unimi.dsi.fastutil.ints.IntIterator;

import java.util.logging.Logger;

/**
 * Event record codec.
 *
 * <p><b>Format:</b>
 * <pre>
 * id,name,date,time,location,description,category,statusCode,attendeeIds,allocations
 * 7,Expo,2025-10-20,09:00,Hall A,Annual expo,Conference,0,3;7;12,2:5;9:1
 * </pre>
 *
 * <p>The first eight fields are required. The two trailing collection fields may be
 * absent or empty; both decode to an empty collection. Within them a bad attendee
 * id or {@code itemId:qty} pair is logged and skipped without failing the record.
 * Pairs with a non-positive quantity are dropped.
 */
public class EventRecordCodec implements IRecordCodec<Event> {
    private static final Logger logger = Logger.getLogger(EventRecordCodec.class.getName());

    private static final int REQUIRED_FIELDS = 8;
    private static final int MAX_FIELDS = 10;

    static final char ENTRY_DELIMITER = ';';
    static final char PAIR_DELIMITER = ':';

    @Override
    public String encode(Event event) {
        return RecordFields.join(
                event.getId(),
                event.getName(),
                event.getDate(),
                event.getTime(),
                event.getLocation(),
                event.getDescription(),
                event.getCategory(),
                event.getStatus().code(),
                encodeAttendees(event),
                encodeAllocations(event));
    }

    @Override
    public Event decode(String line) {
        RecordFields fields = RecordFields.parse(line, MAX_FIELDS).require(REQUIRED_FIELDS, "Event");
        int id = fields.integer(0, "event id");
        int statusCode = fields.integer(7, "status code");
        EventStatus status;
        try {
            status = EventStatus.fromCode(statusCode);
        } catch (IllegalArgumentException e) {
            throw new MalformedRecordException(e.getMessage(), line, e);
        }

        Event event = new Event(id, fields.text(1), fields.text(2), fields.text(3),
                fields.text(4), fields.text(5), fields.text(6), status);
        decodeAttendees(event, fields.optionalText(8));
        decodeAllocations(event, fields.optionalText(9));
        return event;
    }

    private static String encodeAttendees(Event event) {
        StringBuilder sb = new StringBuilder();
        IntIterator it = event.getAttendeeIds().iterator();
        while (it.hasNext()) {
            if (sb.length() > 0) {
                sb.append(ENTRY_DELIMITER);
            }
            sb.append(it.nextInt());
        }
        return sb.toString();
    }

    private static String encodeAllocations(Event event) {
        StringBuilder sb = new StringBuilder();
        for (Int2IntMap.Entry entry : event.getAllocatedInventory().int2IntEntrySet()) {
            if (sb.length() > 0) {
                sb.append(ENTRY_DELIMITER);
            }
            sb.append(entry.getIntKey()).append(PAIR_DELIMITER).append(entry.getIntValue());
        }
        return sb.toString();
    }

    private static void decodeAttendees(Event event, String raw) {
        if (raw.isBlank()) {
            return;
        }
        for (String token : raw.split(String.valueOf(ENTRY_DELIMITER))) {
            String trimmed = token.trim();
            if (trimmed.isEmpty()) {
                continue;
            }
            try {
                event.addAttendee(Integer.parseInt(trimmed));
            } catch (NumberFormatException e) {
                logger.warning("Skipping malformed attendee id '" + trimmed + "' in event " + event.getId());
            }
        }
    }

    private static void decodeAllocations(Event event, String raw) {
        if (raw.isBlank()) {
            return;
        }
        for (String token : raw.split(String.valueOf(ENTRY_DELIMITER))) {
            String trimmed = token.trim();
            if (trimmed.isEmpty()) {
                continue;
            }
            int colon = trimmed.indexOf(PAIR_DELIMITER);
            if (colon < 0) {
                logger.warning("Skipping malformed allocation '" + trimmed + "' in event " + event.getId());
                continue;
            }
            try {
                int itemId = Integer.parseInt(trimmed.substring(0, colon).trim());
                int quantity = Integer.parseInt(trimmed.substring(colon + 1).trim());
                if (quantity <= 0) {
                    logger.warning("Dropping non-positive allocation '" + trimmed + "' in event " + event.getId());
                    continue;
                }
                if (!event.allocateInventoryItem(itemId, quantity)) {
                    logger.warning("Dropping allocation '" + trimmed + "' in event " + event.getId()
                            + ": ledger entry would overflow");
                }
            } catch (NumberFormatException e) {
                logger.warning("Skipping malformed allocation '" + trimmed + "' in event " + event.getId());
            }
        }
    }
}
