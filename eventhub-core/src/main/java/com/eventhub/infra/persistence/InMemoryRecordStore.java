/*
 * Copyright (c) 2025 EventHub
 * Licensed under the Apache License, Version 2.0
 */
package com.eventhub.infra.persistence;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * In-memory implementation of RecordStore.
 *
 * <p>Collections are lost when the process exits. Used by tests and for
 * dry runs where nothing should touch the disk.
 */
public class InMemoryRecordStore implements RecordStore {

    private final Map<RecordCollection, List<String>> collections = new EnumMap<>(RecordCollection.class);
    private int writes;

    @Override
    public List<String> readLines(RecordCollection collection) {
        return List.copyOf(collections.getOrDefault(collection, List.of()));
    }

    @Override
    public void writeLines(RecordCollection collection, List<String> lines) {
        collections.put(collection, new ArrayList<>(lines));
        writes++;
    }

    /**
     * Replace a collection's raw lines directly, bypassing the catalog.
     */
    public void seed(RecordCollection collection, List<String> lines) {
        collections.put(collection, new ArrayList<>(lines));
    }

    /**
     * @return number of {@link #writeLines} calls so far
     */
    public int writeCount() {
        return writes;
    }
}
