/*
 * Copyright (c) 2025 EventHub
 * Licensed under the Apache License, Version 2.0
 */
package com.eventhub.codec;

import com.eventhub.api.exceptions.MalformedRecordException;

import java.util.ArrayList;
import java.util.List;

/**
 * Positional field access over one comma-delimited record line.
 *
 * <p>Unlike {@link String#split(String)}, empty trailing fields are kept, so
 * {@code "1,a,"} has three fields and {@code "1,a"} has two. This is what lets a
 * codec tell an absent trailing field from a present-but-empty one.
 */
final class RecordFields {

    static final char FIELD_DELIMITER = ',';

    private final String line;
    private final List<String> fields;

    private RecordFields(String line, List<String> fields) {
        this.line = line;
        this.fields = fields;
    }

    /**
     * Splits {@code line} into at most {@code maxFields} fields. The last field
     * receives the remainder of the line, delimiters included.
     */
    static RecordFields parse(String line, int maxFields) {
        if (line == null) {
            throw new MalformedRecordException("Record line is null", null);
        }
        List<String> fields = new ArrayList<>(maxFields);
        int start = 0;
        while (fields.size() < maxFields - 1) {
            int comma = line.indexOf(FIELD_DELIMITER, start);
            if (comma < 0) {
                break;
            }
            fields.add(line.substring(start, comma));
            start = comma + 1;
        }
        fields.add(line.substring(start));
        return new RecordFields(line, fields);
    }

    static String join(Object... values) {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < values.length; i++) {
            if (i > 0) {
                sb.append(FIELD_DELIMITER);
            }
            sb.append(values[i]);
        }
        return sb.toString();
    }

    int size() {
        return fields.size();
    }

    boolean has(int index) {
        return index < fields.size();
    }

    /**
     * @throws MalformedRecordException if the line has fewer than {@code count} fields
     */
    RecordFields require(int count, String recordType) {
        if (fields.size() < count) {
            throw new MalformedRecordException(
                    recordType + " record needs at least " + count + " fields but has " + fields.size(), line);
        }
        return this;
    }

    String text(int index) {
        return fields.get(index);
    }

    /**
     * @return the field, or {@code ""} if the line ends before it
     */
    String optionalText(int index) {
        return has(index) ? fields.get(index) : "";
    }

    int integer(int index, String fieldName) {
        String raw = fields.get(index).trim();
        try {
            return Integer.parseInt(raw);
        } catch (NumberFormatException e) {
            throw new MalformedRecordException("Non-numeric " + fieldName + ": '" + raw + "'", line, e);
        }
    }

    String line() {
        return line;
    }
}
