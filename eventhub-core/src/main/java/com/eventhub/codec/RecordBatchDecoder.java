/*
 * Copyright (c) 2025 EventHub
 * Licensed under the Apache License, Version 2.0
 */
package com.eventhub.codec;

import com.eventhub.api.IRecordCodec;
import com.eventhub.api.exceptions.MalformedRecordException;
import com.eventhub.api.model.SkippedRecord;

import java.util.ArrayList;
import java.util.List;
import java.util.logging.Logger;

/**
 * Decodes a whole collection line by line. A line that fails to decode is
 * logged and reported as a {@link SkippedRecord}; it never aborts the batch.
 * Blank lines are ignored.
 */
public final class RecordBatchDecoder {
    private static final Logger logger = Logger.getLogger(RecordBatchDecoder.class.getName());

    private RecordBatchDecoder() {
    }

    public static <T> DecodedBatch<T> decodeAll(String collection, List<String> lines, IRecordCodec<T> codec) {
        List<T> records = new ArrayList<>(lines.size());
        List<SkippedRecord> skipped = new ArrayList<>();

        int lineNumber = 0;
        for (String line : lines) {
            lineNumber++;
            if (line == null || line.isBlank()) {
                continue;
            }
            try {
                records.add(codec.decode(line));
            } catch (MalformedRecordException | IllegalArgumentException e) {
                logger.warning(String.format("Skipping malformed %s record at line %d: '%s' (%s)",
                        collection, lineNumber, line, e.getMessage()));
                skipped.add(new SkippedRecord(collection, lineNumber, line, e.getMessage()));
            }
        }
        return new DecodedBatch<>(records, skipped);
    }
}
