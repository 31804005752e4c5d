/*
 * Copyright (c) 2025 EventHub
 * Licensed under the Apache License, Version 2.0
 */
package com.eventhub.catalog;

import com.eventhub.api.IEventCatalog;
import com.eventhub.api.model.Role;

import java.util.logging.Logger;

/**
 * Populates empty collections with a starter data set on first run.
 * Goes through the public catalog operations, so seeded data is validated and
 * persisted like anything else.
 */
public class CatalogSeeder {
    private static final Logger logger = Logger.getLogger(CatalogSeeder.class.getName());

    /**
     * @return {@code true} if anything was seeded
     */
    public boolean seed(IEventCatalog catalog) {
        boolean seeded = false;
        if (catalog.users().isEmpty()) {
            logger.info("No users found. Seeding initial accounts.");
            catalog.createUser("admin", "adminpass", Role.ADMIN);
            catalog.createUser("user1", "user1pass", Role.REGULAR_USER);
            catalog.createUser("user2", "user2pass", Role.REGULAR_USER);
            seeded = true;
        }
        if (catalog.events().isEmpty()) {
            logger.info("No events found. Seeding initial events.");
            catalog.createEvent("Tech Conference 2025", "2025-10-20", "09:00",
                    "Grand Hall", "Annual tech conference", "Conference");
            catalog.createEvent("Summer Music Festival", "2025-07-15", "14:00",
                    "City Park", "Outdoor music event", "Social");
            seeded = true;
        }
        if (catalog.items().isEmpty()) {
            logger.info("No inventory found. Seeding initial items.");
            catalog.addItem("Projector", 5, "HD Projector");
            catalog.addItem("Chairs", 100, "Standard chairs");
            seeded = true;
        }
        return seeded;
    }
}
