/*
 * Copyright (c) 2025 EventHub
 * Licensed under the Apache License, Version 2.0
 */
package com.eventhub.codec;

import com.eventhub.api.IRecordCodec;
import com.eventhub.api.exceptions.MalformedRecordException;
import com.eventhub.api.model.Role;
import com.eventhub.api.model.User;

/**
 * {@code id,username,password,roleCode}
 */
public class UserRecordCodec implements IRecordCodec<User> {

    private static final int FIELD_COUNT = 4;

    @Override
    public String encode(User user) {
        return RecordFields.join(user.id(), user.username(), user.password(), user.role().code());
    }

    @Override
    public User decode(String line) {
        RecordFields fields = RecordFields.parse(line, FIELD_COUNT).require(FIELD_COUNT, "User");
        int id = fields.integer(0, "user id");
        int roleCode = fields.integer(3, "role code");
        Role role;
        try {
            role = Role.fromCode(roleCode);
        } catch (IllegalArgumentException e) {
            throw new MalformedRecordException(e.getMessage(), line, e);
        }
        return new User(id, fields.text(1), fields.text(2), role);
    }
}
