/*
 * Copyright (c) 2025 EventHub
 * Licensed under the Apache License, Version 2.0
 */
package com.eventhub.infra.persistence;

import java.util.List;

/**
 * Storage backend for line-oriented record collections.
 *
 * <p>This interface abstracts the storage medium, allowing implementations to use:
 * <ul>
 *   <li>Flat text files, one per collection (default)</li>
 *   <li>In-memory lists (tests)</li>
 * </ul>
 *
 * <p>The store knows nothing about record formats; encoding and decoding happen
 * in the codecs.
 */
public interface RecordStore {

    /**
     * Read every line of a collection.
     *
     * @param collection the collection to read
     * @return the lines in order, or an empty list if the collection was never written
     * @throws PersistenceException if the backend fails
     */
    List<String> readLines(RecordCollection collection);

    /**
     * Replace a collection with the given lines.
     *
     * @param collection the collection to write
     * @param lines      the encoded records
     * @throws PersistenceException if the backend fails
     */
    void writeLines(RecordCollection collection, List<String> lines);
}
