/*
 * Copyright (c) 2025 EventHub
 * Licensed under the Apache License, Version 2.0
 */
package com.eventhub.cli;

import com.eventhub.api.model.LoadSummary;
import com.eventhub.api.model.SkippedRecord;
import com.eventhub.catalog.EventCatalog;
import com.eventhub.infra.persistence.FlatFileRecordStore;
import com.eventhub.infra.telemetry.TracingService;
import com.eventhub.report.ReportExporter;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.OutputStreamWriter;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.util.logging.Level;
import java.util.logging.LogManager;
import java.util.logging.Logger;

public class EventHubApplication {
    private static final Logger logger = Logger.getLogger(EventHubApplication.class.getName());

    public static void main(String[] args) {
        configureLogging();
        TracingService tracingService = TracingService.create();
        try {
            new EventHubApplication().run(EventHubConfig.fromEnvironment(), tracingService);
        } catch (Exception e) {
            logger.log(Level.SEVERE, "EventHub failed: " + e.getMessage(), e);
            System.exit(1);
        } finally {
            tracingService.shutdown();
        }
    }

    void run(EventHubConfig config, TracingService tracingService) throws IOException {
        logger.info("Starting EventHub with data directory " + config.dataDirectory().toAbsolutePath());

        EventCatalog catalog = new EventCatalog(new FlatFileRecordStore(config.dataDirectory()),
                tracingService.getTracer());
        LoadSummary summary = catalog.load();
        for (SkippedRecord skipped : summary.skipped()) {
            logger.warning(String.format("Skipped %s line %d: %s", skipped.collection(), skipped.lineNumber(),
                    skipped.reason()));
        }
        if (config.seedOnStart() && catalog.seedIfEmpty()) {
            logger.info("Seeded initial data");
        }

        BufferedReader in = new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8));
        PrintWriter out = new PrintWriter(new OutputStreamWriter(System.out, StandardCharsets.UTF_8), true);
        new CommandShell(catalog, new ReportExporter(config.exportDirectory()), in, out).run();
    }

    private static void configureLogging() {
        try (InputStream config = EventHubApplication.class.getResourceAsStream("/logging.properties")) {
            if (config != null) {
                LogManager.getLogManager().readConfiguration(config);
            }
        } catch (IOException e) {
            logger.log(Level.WARNING, "Could not read logging.properties, using defaults", e);
        }
    }
}
