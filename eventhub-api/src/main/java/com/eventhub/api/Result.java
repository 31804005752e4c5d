/*
 * Copyright (c) 2025 EventHub
 * Licensed under the Apache License, Version 2.0
 */
package com.eventhub.api;

import java.util.Objects;

/**
 * An {@link Outcome} paired with the value it produced.
 *
 * <p>Some non-OK outcomes still carry a value: {@link Outcome#ALREADY_REGISTERED}
 * returns the existing attendee record, for example.
 */
public record Result<T>(Outcome outcome, T value) {

    public Result {
        Objects.requireNonNull(outcome, "outcome");
    }

    public static <T> Result<T> ok(T value) {
        return new Result<>(Outcome.OK, value);
    }

    public static <T> Result<T> failure(Outcome outcome) {
        return new Result<>(outcome, null);
    }

    public static <T> Result<T> of(Outcome outcome, T value) {
        return new Result<>(outcome, value);
    }

    public boolean isOk() {
        return outcome.isOk();
    }
}
