/*
 * Copyright (c) 2025 EventHub
 * Licensed under the Apache License, Version 2.0
 */
package com.eventhub.api.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Diagnostic for a persisted line that was skipped during load.
 *
 * @param collection the collection the line belongs to (e.g. {@code events})
 * @param lineNumber 1-based line number within the collection
 * @param line       the raw line
 * @param reason     why it was skipped
 */
public record SkippedRecord(
    @JsonProperty("collection") String collection,
    @JsonProperty("line_number") int lineNumber,
    @JsonProperty("line") String line,
    @JsonProperty("reason") String reason
) {
}
