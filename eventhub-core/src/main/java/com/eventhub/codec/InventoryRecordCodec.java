/*
 * Copyright (c) 2025 EventHub
 * Licensed under the Apache License, Version 2.0
 */
package com.eventhub.codec;

import com.eventhub.api.IRecordCodec;
import com.eventhub.api.exceptions.MalformedRecordException;
import com.eventhub.api.model.InventoryItem;

/**
 * {@code id,name,totalQuantity,allocatedQuantity,description}
 *
 * <p>The description takes the rest of the line. The persisted allocated
 * quantity is only a hint: the catalog recomputes it from event ledgers after
 * load, so here it is just clamped into {@code [0, total]}.
 */
public class InventoryRecordCodec implements IRecordCodec<InventoryItem> {

    private static final int REQUIRED_FIELDS = 4;
    private static final int MAX_FIELDS = 5;

    @Override
    public String encode(InventoryItem item) {
        return RecordFields.join(
                item.getId(),
                item.getName(),
                item.getTotalQuantity(),
                item.getAllocatedQuantity(),
                item.getDescription());
    }

    @Override
    public InventoryItem decode(String line) {
        RecordFields fields = RecordFields.parse(line, MAX_FIELDS).require(REQUIRED_FIELDS, "Inventory");
        int id = fields.integer(0, "item id");
        int total = fields.integer(2, "total quantity");
        int allocated = fields.integer(3, "allocated quantity");
        if (total < 0) {
            throw new MalformedRecordException("Negative total quantity: " + total, line);
        }
        int clamped = Math.max(0, Math.min(allocated, total));
        return new InventoryItem(id, fields.text(1), total, clamped, fields.optionalText(4));
    }
}
