/*
 * Copyright (c) 2025 EventHub
 * Licensed under the Apache License, Version 2.0
 */
package com.eventhub.report;

import com.eventhub.api.IRecordCodec;
import com.eventhub.api.model.Attendee;
import com.eventhub.api.model.Event;
import com.eventhub.infra.persistence.PersistenceException;
import com.eventhub.infra.persistence.RecordCollection;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Writes reports and data exports into an output directory.
 *
 * <p>Collection exports use the same one-line-per-record format as the data
 * files; the encoder is supplied by the caller.
 */
public class ReportExporter {
    private static final Logger logger = Logger.getLogger(ReportExporter.class.getName());

    static final String ATTENDEE_LIST_HEADER = "ID,Name,ContactInfo,CheckedInStatus";
    private static final String RULE = "---------------------------------------------------------";

    private final Path outputDirectory;
    private final ObjectMapper objectMapper;

    public ReportExporter(Path outputDirectory) {
        this.outputDirectory = Objects.requireNonNull(outputDirectory, "outputDirectory");
        this.objectMapper = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);
    }

    /**
     * Serializes any report record as pretty-printed JSON.
     */
    public Path writeJson(Object report, String fileName) {
        Path target = outputDirectory.resolve(fileName);
        try {
            Files.createDirectories(outputDirectory);
            objectMapper.writeValue(target.toFile(), report);
        } catch (IOException e) {
            logger.log(Level.SEVERE, "Failed to write report " + target, e);
            throw new PersistenceException("Failed to write report " + target, e);
        }
        logger.info("Wrote report " + target);
        return target;
    }

    /**
     * Writes {@code attendees_event_<id>.txt}: a short header followed by one
     * {@code id,name,contact,status} row per attendee.
     */
    public Path writeAttendeeList(Event event, List<Attendee> attendees) {
        List<String> lines = new ArrayList<>();
        lines.add("Attendee List for Event: " + event.getName() + " (ID: " + event.getId() + ")");
        lines.add("Date: " + event.getDate() + " Time: " + event.getTime());
        lines.add(RULE);
        if (attendees.isEmpty()) {
            lines.add("No attendees registered for this event.");
        } else {
            lines.add(ATTENDEE_LIST_HEADER);
            for (Attendee attendee : attendees) {
                lines.add(String.join(",",
                        String.valueOf(attendee.getId()),
                        attendee.getName(),
                        attendee.getContactInfo(),
                        attendee.isCheckedIn() ? "Checked In" : "Not Checked In"));
            }
        }
        return write(outputDirectory.resolve("attendees_event_" + event.getId() + ".txt"), lines);
    }

    /**
     * Writes {@code <collection>_export.txt} with one encoded record per line.
     */
    public <T> Path exportCollection(RecordCollection collection, List<T> records, IRecordCodec<T> encoder) {
        List<String> lines = new ArrayList<>(records.size());
        for (T record : records) {
            lines.add(encoder.encode(record));
        }
        return write(outputDirectory.resolve(collection.exportFileName()), lines);
    }

    private Path write(Path target, List<String> lines) {
        try {
            Files.createDirectories(outputDirectory);
            Files.write(target, lines, StandardCharsets.UTF_8);
        } catch (IOException e) {
            logger.log(Level.SEVERE, "Failed to write " + target, e);
            throw new PersistenceException("Failed to write " + target, e);
        }
        logger.info(String.format("Exported %d lines to %s", lines.size(), target));
        return target;
    }
}
