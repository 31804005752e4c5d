/*
 * Copyright (c) 2025 EventHub
 * Licensed under the Apache License, Version 2.0
 */
package com.eventhub.codec;

import com.eventhub.api.model.SkippedRecord;

import java.util.List;

/**
 * Entities decoded from one collection, plus the lines that were skipped.
 */
public record DecodedBatch<T>(List<T> records, List<SkippedRecord> skipped) {

    public DecodedBatch {
        records = List.copyOf(records);
        skipped = List.copyOf(skipped);
    }
}
