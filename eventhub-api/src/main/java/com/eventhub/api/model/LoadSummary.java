/*
 * Copyright (c) 2025 EventHub
 * Licensed under the Apache License, Version 2.0
 */
package com.eventhub.api.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * What a catalog load read back, including the lines it had to skip.
 */
public record LoadSummary(
    @JsonProperty("users") int users,
    @JsonProperty("events") int events,
    @JsonProperty("attendees") int attendees,
    @JsonProperty("items") int items,
    @JsonProperty("skipped") List<SkippedRecord> skipped,
    @JsonProperty("repairs") int repairs
) {

    public LoadSummary {
        skipped = skipped == null ? List.of() : List.copyOf(skipped);
    }

    public boolean isClean() {
        return skipped.isEmpty() && repairs == 0;
    }
}
