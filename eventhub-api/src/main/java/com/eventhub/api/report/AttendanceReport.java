/*
 * Copyright (c) 2025 EventHub
 * Licensed under the Apache License, Version 2.0
 */
package com.eventhub.api.report;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Attendance figures for a single event.
 *
 * <p>Entries follow the event's attendee order. An id that no longer resolves to
 * an attendee record is listed with {@code known = false}.
 */
public record AttendanceReport(
    @JsonProperty("event_id") int eventId,
    @JsonProperty("event_name") String eventName,
    @JsonProperty("date") String date,
    @JsonProperty("time") String time,
    @JsonProperty("entries") List<Entry> entries,
    @JsonProperty("registered") int registered,
    @JsonProperty("checked_in") int checkedIn,
    @JsonProperty("attendance_percentage") double attendancePercentage
) {

    public AttendanceReport {
        entries = entries == null ? List.of() : List.copyOf(entries);
    }

    public record Entry(
        @JsonProperty("attendee_id") int attendeeId,
        @JsonProperty("name") String name,
        @JsonProperty("contact_info") String contactInfo,
        @JsonProperty("checked_in") boolean checkedIn,
        @JsonProperty("known") boolean known
    ) {

        public static Entry unknown(int attendeeId) {
            return new Entry(attendeeId, null, null, false, false);
        }
    }
}
