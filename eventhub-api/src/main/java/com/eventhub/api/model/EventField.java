/*
 * Copyright (c) 2025 EventHub
 * Licensed under the Apache License, Version 2.0
 */
package com.eventhub.api.model;

/**
 * Editable event attributes.
 */
public enum EventField {
    NAME,
    DATE,
    TIME,
    LOCATION,
    DESCRIPTION,
    CATEGORY
}
