/*
 * Copyright (c) 2025 EventHub
 * Licensed under the Apache License, Version 2.0
 */
package com.eventhub.api;

/**
 * Coarse classification of a rejected operation. None of these are fatal:
 * the operation leaves state untouched and the caller decides whether to retry.
 */
public enum ErrorCategory {
    /** Bad date, time, quantity or text; re-prompt at the boundary. */
    VALIDATION,
    /** Unknown id or name; the operation was a no-op. */
    NOT_FOUND,
    /** Quantity would break an item's total/allocated bounds. */
    CAPACITY,
    /** Duplicate name or registration, or a state that was already reached. */
    CONFLICT,
    /** The acting user lacks the capability for this operation. */
    PERMISSION
}
