/*
 * Copyright (c) 2025 EventHub
 * Licensed under the Apache License, Version 2.0
 */
package com.eventhub.infra.persistence;

/**
 * The persisted collections, one record per line each.
 */
public enum RecordCollection {
    USERS("users", "users.txt"),
    EVENTS("events", "events.txt"),
    ATTENDEES("attendees", "attendees.txt"),
    INVENTORY("inventory", "inventory.txt");

    private final String collectionName;
    private final String fileName;

    RecordCollection(String collectionName, String fileName) {
        this.collectionName = collectionName;
        this.fileName = fileName;
    }

    public String collectionName() {
        return collectionName;
    }

    public String fileName() {
        return fileName;
    }

    /**
     * @return file name used when the collection is exported, e.g. {@code events_export.txt}
     */
    public String exportFileName() {
        return collectionName + "_export.txt";
    }
}
