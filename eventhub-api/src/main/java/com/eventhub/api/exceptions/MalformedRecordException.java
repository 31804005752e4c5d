/*
 * Copyright (c) 2025 EventHub
 * Licensed under the Apache License, Version 2.0
 */
package com.eventhub.api.exceptions;

/**
 * Thrown by a record codec when a persisted line cannot be decoded.
 *
 * <p>Unchecked so codecs stay simple; the batch decoder catches it per line
 * and skips the record instead of failing the load.
 */
public class MalformedRecordException extends RuntimeException {

    private final String line;

    public MalformedRecordException(String message, String line) {
        super(message);
        this.line = line;
    }

    public MalformedRecordException(String message, String line, Throwable cause) {
        super(message, cause);
        this.line = line;
    }

    /**
     * @return the raw line that failed to decode
     */
    public String getLine() {
        return line;
    }
}
