/*
 * Copyright (c) 2025 EventHub
 * Licensed under the Apache License, Version 2.0
 */
package com.eventhub.validation;

/**
 * Format checks for user-supplied fields before they reach an entity.
 *
 * <p>Dates are {@code YYYY-MM-DD} with year 1900-2100, month 1-12 and day 1-31.
 * Month lengths and leap years are not checked. Times are
 * {@code HH:MM} on a 24-hour clock.
 */
public final class FieldValidator {

    public static final int MIN_PASSWORD_LENGTH = 6;

    private FieldValidator() {
    }

    public static boolean isValidDate(String date) {
        if (date == null || date.length() != 10 || date.charAt(4) != '-' || date.charAt(7) != '-') {
            return false;
        }
        int year = parseDigits(date, 0, 4);
        int month = parseDigits(date, 5, 7);
        int day = parseDigits(date, 8, 10);
        return year >= 1900 && year <= 2100
                && month >= 1 && month <= 12
                && day >= 1 && day <= 31;
    }

    public static boolean isValidTime(String time) {
        if (time == null || time.length() != 5 || time.charAt(2) != ':') {
            return false;
        }
        int hour = parseDigits(time, 0, 2);
        int minute = parseDigits(time, 3, 5);
        return hour >= 0 && hour <= 23 && minute >= 0 && minute <= 59;
    }

    /**
     * A persisted text field may not contain the record delimiter or a line break,
     * since either would split the record.
     *
     * @param allowEmpty whether a blank value is acceptable
     */
    public static boolean isValidText(String value, boolean allowEmpty) {
        if (value == null) {
            return false;
        }
        if (!allowEmpty && value.isBlank()) {
            return false;
        }
        return value.indexOf(',') < 0 && value.indexOf('\n') < 0 && value.indexOf('\r') < 0;
    }

    public static boolean isValidPassword(String password) {
        return password != null && password.length() >= MIN_PASSWORD_LENGTH;
    }

    /**
     * @return the value of the digits in {@code [from, to)}, or -1 if any is not an ASCII digit
     */
    private static int parseDigits(String s, int from, int to) {
        int value = 0;
        for (int i = from; i < to; i++) {
            char c = s.charAt(i);
            if (c < '0' || c > '9') {
                return -1;
            }
            value = value * 10 + (c - '0');
        }
        return value;
    }
}
