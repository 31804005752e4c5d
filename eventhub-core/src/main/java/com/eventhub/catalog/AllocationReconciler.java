/*
 * Copyright (c) 2025 EventHub
 * Licensed under the Apache License, Version 2.0
 */
package com.eventhub.catalog;

import com.eventhub.api.model.Event;
import com.eventhub.api.model.InventoryItem;
import it.unimi.dsi.fastutil.ints.Int2IntMap;
import it.unimi.dsi.fastutil.ints.Int2IntOpenHashMap;
import it.unimi.dsi.fastutil.ints.Int2ObjectMap;
import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntList;

import java.util.ArrayList;
import java.util.List;
import java.util.logging.Logger;

/**
 * Rebuilds every item's allocated quantity from the event ledgers.
 *
 * <p>Events and inventory are persisted separately, so the allocated quantity
 * stored with an item can disagree with the ledgers after an interrupted save.
 * The ledgers win. Status does not matter: a canceled event still holds its
 * allocation until it is deleted or released.
 */
public class AllocationReconciler {
    private static final Logger logger = Logger.getLogger(AllocationReconciler.class.getName());

    /**
     * Outcome of one reconciliation pass.
     *
     * @param corrected     items whose stored allocation differed from the ledgers
     * @param raisedTotals  items whose total had to grow to hold the ledger sum
     * @param orphanEntries ledger entries that reference an unknown item
     * @param droppedEntries ledger entries removed because the item's sum would overflow
     */
    public record Reconciliation(int corrected, int raisedTotals, int orphanEntries, int droppedEntries) {
    }

    public Reconciliation reconcile(Int2ObjectMap<InventoryItem> items, Iterable<Event> events) {
        Int2IntOpenHashMap sums = new Int2IntOpenHashMap();
        int orphans = 0;
        List<Event> overflowingEvents = new ArrayList<>();
        IntList overflowingItems = new IntArrayList();

        for (Event event : events) {
            for (Int2IntMap.Entry entry : event.getAllocatedInventory().int2IntEntrySet()) {
                int itemId = entry.getIntKey();
                if (!items.containsKey(itemId)) {
                    orphans++;
                    logger.fine("Ignoring allocation of unknown item " + itemId + " in event " + event.getId());
                    continue;
                }
                try {
                    sums.put(itemId, Math.addExact(sums.get(itemId), entry.getIntValue()));
                } catch (ArithmeticException e) {
                    overflowingEvents.add(event);
                    overflowingItems.add(itemId);
                }
            }
        }
        for (int i = 0; i < overflowingEvents.size(); i++) {
            Event event = overflowingEvents.get(i);
            int itemId = overflowingItems.getInt(i);
            int released = event.deallocateInventoryItem(itemId, Integer.MAX_VALUE);
            logger.warning(String.format("Dropped allocation of %d units of item %d from event %d: total would overflow",
                    released, itemId, event.getId()));
        }

        int corrected = 0;
        int raised = 0;
        for (InventoryItem item : items.values()) {
            int recomputed = sums.get(item.getId());
            if (recomputed != item.getAllocatedQuantity()) {
                corrected++;
                logger.info(String.format("Item %d allocation corrected from %d to %d",
                        item.getId(), item.getAllocatedQuantity(), recomputed));
            }
            int previousTotal = item.getTotalQuantity();
            if (item.restoreAllocation(recomputed)) {
                raised++;
                logger.warning(String.format("Item %d total raised from %d to %d to cover event allocations",
                        item.getId(), previousTotal, recomputed));
            }
        }
        return new Reconciliation(corrected, raised, orphans, overflowingEvents.size());
    }
}
