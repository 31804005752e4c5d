/*
 * Copyright (c) 2025 EventHub
 * Licensed under the Apache License, Version 2.0
 */
package com.eventhub.cli;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Objects;
import java.util.function.UnaryOperator;

/**
 * Start-up settings. Each value comes from a system property, then an
 * environment variable, then a default.
 *
 * <ul>
 *   <li>{@code eventhub.data.dir} / {@code EVENTHUB_DATA_DIR}: where the record files live (default {@code data})</li>
 *   <li>{@code eventhub.seed} / {@code EVENTHUB_SEED}: seed empty collections on start (default {@code true})</li>
 *   <li>{@code eventhub.export.dir} / {@code EVENTHUB_EXPORT_DIR}: where reports and exports go (default: the data dir)</li>
 * </ul>
 */
public record EventHubConfig(Path dataDirectory, Path exportDirectory, boolean seedOnStart) {

    static final String DATA_DIR_PROPERTY = "eventhub.data.dir";
    static final String DATA_DIR_ENV = "EVENTHUB_DATA_DIR";
    static final String SEED_PROPERTY = "eventhub.seed";
    static final String SEED_ENV = "EVENTHUB_SEED";
    static final String EXPORT_DIR_PROPERTY = "eventhub.export.dir";
    static final String EXPORT_DIR_ENV = "EVENTHUB_EXPORT_DIR";

    static final String DEFAULT_DATA_DIR = "data";

    public EventHubConfig {
        Objects.requireNonNull(dataDirectory, "dataDirectory");
        Objects.requireNonNull(exportDirectory, "exportDirectory");
    }

    public static EventHubConfig fromEnvironment() {
        return resolve(System::getProperty, System::getenv);
    }

    static EventHubConfig resolve(UnaryOperator<String> properties, UnaryOperator<String> environment) {
        Path dataDir = Paths.get(lookup(properties, environment, DATA_DIR_PROPERTY, DATA_DIR_ENV, DEFAULT_DATA_DIR));
        String exportDir = lookup(properties, environment, EXPORT_DIR_PROPERTY, EXPORT_DIR_ENV, null);
        boolean seed = Boolean.parseBoolean(lookup(properties, environment, SEED_PROPERTY, SEED_ENV, "true"));
        return new EventHubConfig(dataDir, exportDir == null ? dataDir : Paths.get(exportDir), seed);
    }

    private static String lookup(UnaryOperator<String> properties, UnaryOperator<String> environment,
                                 String property, String env, String defaultValue) {
        String value = properties.apply(property);
        if (value == null || value.isBlank()) {
            value = environment.apply(env);
        }
        if (value == null || value.isBlank()) {
            return defaultValue;
        }
        return value.trim();
    }
}
