/*
 * Copyright (c) 2025 EventHub
 * Licensed under the Apache License, Version 2.0
 */
package com.eventhub.api.model;

import java.util.Objects;

/**
 * An account that can sign in to the shell.
 *
 * <p>The role is a tag rather than a subtype: privileged operations check
 * {@link #isAdmin()} instead of dispatching on the user's class.
 */
public record User(int id, String username, String password, Role role) {

    public User {
        Objects.requireNonNull(username, "username");
        Objects.requireNonNull(password, "password");
        Objects.requireNonNull(role, "role");
    }

    public boolean isAdmin() {
        return role == Role.ADMIN;
    }

    @Override
    public String toString() {
        // never print the password
        return "User[id=" + id + ", username=" + username + ", role=" + role + "]";
    }
}
