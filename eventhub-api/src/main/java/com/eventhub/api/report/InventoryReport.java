/*
 * Copyright (c) 2025 EventHub
 * Licensed under the Apache License, Version 2.0
 */
package com.eventhub.api.report;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Stock levels for every item plus the per-event breakdown of allocations.
 */
public record InventoryReport(
    @JsonProperty("rows") List<Row> rows,
    @JsonProperty("total_quantity") int totalQuantity,
    @JsonProperty("total_allocated") int totalAllocated,
    @JsonProperty("total_available") int totalAvailable,
    @JsonProperty("allocations_by_event") List<EventAllocation> allocationsByEvent
) {

    public InventoryReport {
        rows = rows == null ? List.of() : List.copyOf(rows);
        allocationsByEvent = allocationsByEvent == null ? List.of() : List.copyOf(allocationsByEvent);
    }

    public record Row(
        @JsonProperty("item_id") int itemId,
        @JsonProperty("name") String name,
        @JsonProperty("total") int total,
        @JsonProperty("allocated") int allocated,
        @JsonProperty("available") int available,
        @JsonProperty("description") String description
    ) {
    }

    public record EventAllocation(
        @JsonProperty("event_id") int eventId,
        @JsonProperty("event_name") String eventName,
        @JsonProperty("lines") List<Line> lines
    ) {

        public EventAllocation {
            lines = lines == null ? List.of() : List.copyOf(lines);
        }
    }

    public record Line(
        @JsonProperty("item_id") int itemId,
        @JsonProperty("item_name") String itemName,
        @JsonProperty("quantity") int quantity
    ) {
    }
}
