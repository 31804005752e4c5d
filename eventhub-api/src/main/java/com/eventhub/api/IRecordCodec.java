/*
 * Copyright (c) 2025 EventHub
 * Licensed under the Apache License, Version 2.0
 */
package com.eventhub.api;

import com.eventhub.api.exceptions.MalformedRecordException;

/**
 * Contract for converting an entity to and from one line of delimited text.
 *
 * @param <T> the entity type
 */
public interface IRecordCodec<T> {

    /**
     * Encodes an entity as a single line without a trailing line separator.
     *
     * @param entity the entity to encode
     * @return the encoded line
     */
    String encode(T entity);

    /**
     * Decodes one persisted line.
     *
     * @param line the raw line, without its line separator
     * @return the decoded entity
     * @throws MalformedRecordException if required fields are missing or unparsable
     */
    T decode(String line) throws MalformedRecordException;
}
