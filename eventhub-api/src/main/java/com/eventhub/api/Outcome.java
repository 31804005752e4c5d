/*
 * Copyright (c) 2025 EventHub
 * Licensed under the Apache License, Version 2.0
 */
package com.eventhub.api;

/**
 * Result code of a catalog or entity mutation.
 *
 * <p>Expected business conditions (insufficient stock, duplicate registration,
 * unknown ids) are reported through these codes rather than thrown, so a
 * caller can chain attempts without unwinding.
 */
public enum Outcome {
    OK(null, "OK"),

    INVALID_QUANTITY(ErrorCategory.VALIDATION, "Quantity must be positive"),
    NEGATIVE_QUANTITY(ErrorCategory.VALIDATION, "Quantity cannot be negative"),
    INVALID_DATE(ErrorCategory.VALIDATION, "Date must be YYYY-MM-DD"),
    INVALID_TIME(ErrorCategory.VALIDATION, "Time must be HH:MM (24-hour)"),
    INVALID_TEXT(ErrorCategory.VALIDATION, "Text may not be empty or contain commas or line breaks"),
    INVALID_PASSWORD(ErrorCategory.VALIDATION, "Password must be at least 6 characters long"),

    EVENT_NOT_FOUND(ErrorCategory.NOT_FOUND, "Event not found"),
    ITEM_NOT_FOUND(ErrorCategory.NOT_FOUND, "Inventory item not found"),
    ATTENDEE_NOT_FOUND(ErrorCategory.NOT_FOUND, "Attendee not found for this event"),
    USER_NOT_FOUND(ErrorCategory.NOT_FOUND, "User not found"),
    NOT_REGISTERED(ErrorCategory.NOT_FOUND, "Not registered for this event"),
    NOT_ALLOCATED(ErrorCategory.NOT_FOUND, "Item is not allocated to this event"),

    INSUFFICIENT_AVAILABLE(ErrorCategory.CAPACITY, "Not enough quantity available"),
    OVER_DEALLOCATION(ErrorCategory.CAPACITY, "Cannot deallocate more than is allocated"),
    BELOW_ALLOCATED(ErrorCategory.CAPACITY, "Total cannot be less than the allocated quantity"),

    DUPLICATE_USERNAME(ErrorCategory.CONFLICT, "Username already exists"),
    ALREADY_REGISTERED(ErrorCategory.CONFLICT, "Already registered for this event"),
    ALREADY_CHECKED_IN(ErrorCategory.CONFLICT, "Attendee is already checked in"),
    EVENT_CLOSED(ErrorCategory.CONFLICT, "Event is not open for registration"),
    CANNOT_DELETE_SELF(ErrorCategory.CONFLICT, "Cannot delete the signed-in user"),

    NOT_PERMITTED(ErrorCategory.PERMISSION, "Operation not permitted for this user");

    private final ErrorCategory category;
    private final String message;

    Outcome(ErrorCategory category, String message) {
        this.category = category;
        this.message = message;
    }

    public boolean isOk() {
        return this == OK;
    }

    /**
     * @return the error category, or {@code null} for {@link #OK}
     */
    public ErrorCategory category() {
        return category;
    }

    public String message() {
        return message;
    }
}
