/*
 * Copyright (c) 2025 EventHub
 * Licensed under the Apache License, Version 2.0
 */
package com.eventhub.catalog;

/**
 * Monotonic id counter for one entity type. Ids start at 1; 0 is reserved
 * as "none" by attendee references.
 */
final class IdSequence {

    private int next = 1;

    int next() {
        return next++;
    }

    /**
     * Moves the counter past an id seen on load. Never moves it backwards.
     */
    void advancePast(int id) {
        if (id >= next) {
            next = id + 1;
        }
    }

    int peek() {
        return next;
    }
}
