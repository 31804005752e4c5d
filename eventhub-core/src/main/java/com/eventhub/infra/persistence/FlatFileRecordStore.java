/*
 * Copyright (c) 2025 EventHub
 * Licensed under the Apache License, Version 2.0
 */
package com.eventhub.infra.persistence;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Stores each collection as a UTF-8 text file in one directory.
 *
 * <p>Writes truncate and rewrite the whole file. There is no partial-write
 * detection: a crash mid-write can leave a truncated file, which the tolerant
 * decoders survive on the next load.
 */
public class FlatFileRecordStore implements RecordStore {
    private static final Logger logger = Logger.getLogger(FlatFileRecordStore.class.getName());

    private final Path directory;

    public FlatFileRecordStore(Path directory) {
        this.directory = Objects.requireNonNull(directory, "directory");
    }

    public Path pathOf(RecordCollection collection) {
        return directory.resolve(collection.fileName());
    }

    @Override
    public List<String> readLines(RecordCollection collection) {
        Path file = pathOf(collection);
        if (!Files.exists(file)) {
            logger.info("No " + collection.collectionName() + " file at " + file + ", starting empty");
            return List.of();
        }
        try {
            // Malformed bytes decode to U+FFFD so a torn write damages one line, not the file.
            List<String> lines = new String(Files.readAllBytes(file), StandardCharsets.UTF_8).lines().toList();
            logger.fine(() -> "Read " + lines.size() + " lines from " + file);
            return lines;
        } catch (IOException e) {
            logger.log(Level.SEVERE, "Failed to read " + file, e);
            throw new PersistenceException("Failed to read " + collection.collectionName(), e);
        }
    }

    @Override
    public void writeLines(RecordCollection collection, List<String> lines) {
        Path file = pathOf(collection);
        try {
            Files.createDirectories(directory);
            Files.write(file, lines, StandardCharsets.UTF_8);
            logger.fine(() -> "Wrote " + lines.size() + " lines to " + file);
        } catch (IOException e) {
            logger.log(Level.SEVERE, "Failed to write " + file, e);
            throw new PersistenceException("Failed to write " + collection.collectionName(), e);
        }
    }
}
