/*
 * Copyright (c) 2025 EventHub
 * Licensed under the Apache License, Version 2.0
 */
package com.eventhub.report;

import com.eventhub.api.IEventCatalog;
import com.eventhub.api.model.Attendee;
import com.eventhub.api.model.Event;
import com.eventhub.api.model.InventoryItem;
import com.eventhub.api.report.AttendanceReport;
import com.eventhub.api.report.InventoryReport;
import it.unimi.dsi.fastutil.ints.Int2IntMap;
import it.unimi.dsi.fastutil.ints.IntIterator;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Builds read-only report snapshots from the catalog's current state.
 */
public class ReportBuilder {

    private final IEventCatalog catalog;

    public ReportBuilder(IEventCatalog catalog) {
        this.catalog = Objects.requireNonNull(catalog, "catalog");
    }

    /**
     * Attendance for one event. Attendee ids the event references but the
     * catalog no longer knows appear as unknown entries and count as
     * registered, not checked in.
     *
     * @return empty if the event does not exist
     */
    public Optional<AttendanceReport> attendance(int eventId) {
        Optional<Event> found = catalog.findEvent(eventId);
        if (found.isEmpty()) {
            return Optional.empty();
        }
        Event event = found.get();

        List<AttendanceReport.Entry> entries = new ArrayList<>();
        int checkedIn = 0;
        IntIterator it = event.getAttendeeIds().iterator();
        while (it.hasNext()) {
            int attendeeId = it.nextInt();
            Optional<Attendee> attendee = catalog.findAttendee(attendeeId);
            if (attendee.isEmpty()) {
                entries.add(AttendanceReport.Entry.unknown(attendeeId));
                continue;
            }
            Attendee a = attendee.get();
            if (a.isCheckedIn()) {
                checkedIn++;
            }
            entries.add(new AttendanceReport.Entry(a.getId(), a.getName(), a.getContactInfo(), a.isCheckedIn(), true));
        }

        int registered = entries.size();
        double percentage = registered == 0 ? 0.0 : checkedIn * 100.0 / registered;
        return Optional.of(new AttendanceReport(event.getId(), event.getName(), event.getDate(), event.getTime(),
                entries, registered, checkedIn, percentage));
    }

    public InventoryReport inventory() {
        List<InventoryReport.Row> rows = new ArrayList<>();
        int total = 0;
        int allocated = 0;
        for (InventoryItem item : catalog.items()) {
            rows.add(new InventoryReport.Row(item.getId(), item.getName(), item.getTotalQuantity(),
                    item.getAllocatedQuantity(), item.getAvailableQuantity(), item.getDescription()));
            total += item.getTotalQuantity();
            allocated += item.getAllocatedQuantity();
        }

        List<InventoryReport.EventAllocation> byEvent = new ArrayList<>();
        for (Event event : catalog.events()) {
            if (event.getAllocatedInventory().isEmpty()) {
                continue;
            }
            List<InventoryReport.Line> lines = new ArrayList<>();
            for (Int2IntMap.Entry entry : event.getAllocatedInventory().int2IntEntrySet()) {
                String itemName = catalog.findItem(entry.getIntKey())
                        .map(InventoryItem::getName)
                        .orElse("Unknown item");
                lines.add(new InventoryReport.Line(entry.getIntKey(), itemName, entry.getIntValue()));
            }
            byEvent.add(new InventoryReport.EventAllocation(event.getId(), event.getName(), lines));
        }

        return new InventoryReport(rows, total, allocated, total - allocated, byEvent);
    }
}
