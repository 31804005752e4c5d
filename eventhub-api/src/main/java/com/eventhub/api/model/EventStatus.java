/*
 * Copyright (c) 2025 EventHub
 * Licensed under the Apache License, Version 2.0
 */
package com.eventhub.api.model;

/**
 * Lifecycle state of an event. The numeric code is the value persisted in
 * the events file and must not be renumbered.
 */
public enum EventStatus {
    UPCOMING(0, "Upcoming"),
    ONGOING(1, "Ongoing"),
    COMPLETED(2, "Completed"),
    CANCELED(3, "Canceled");

    private final int code;
    private final String label;

    EventStatus(int code, String label) {
        this.code = code;
        this.label = label;
    }

    public int code() {
        return code;
    }

    public String label() {
        return label;
    }

    /**
     * Registration is only open while an event has not been canceled or completed.
     */
    public boolean acceptsRegistrations() {
        return this == UPCOMING || this == ONGOING;
    }

    /**
     * @throws IllegalArgumentException if no status has the given code
     */
    public static EventStatus fromCode(int code) {
        for (EventStatus status : values()) {
            if (status.code == code) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unknown event status code: " + code);
    }
}
