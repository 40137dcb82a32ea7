package com.bridgeai.server.ai.learning;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Fixed-capacity ring of feedback records. The write index only grows; the slot
 * written is {@code index % capacity}, so once full the oldest record is
 * overwritten first.
 *
 * Not thread-safe; the owner serializes access.
 */
public class HistoryLog {
    public static final int CAPACITY = 1000;

    private final HistoryEntry[] slots = new HistoryEntry[CAPACITY];
    private long index = 0;

    public void append(HistoryEntry entry) {
        if (entry == null) {
            throw new IllegalArgumentException("History entry is required");
        }
        slots[(int) (index % CAPACITY)] = entry;
        index++;
    }

    /** Total number of appends since creation (never wrapped). */
    public long getIndex() {
        return index;
    }

    public int size() {
        return (int) Math.min(index, CAPACITY);
    }

    public boolean isEmpty() {
        return index == 0;
    }

    /** Raw slot access; null when the slot has never been written. */
    public HistoryEntry slot(int slot) {
        return slots[slot];
    }

    /**
     * Most recent entries, newest first, at most {@code limit} of them.
     */
    public List<HistoryEntry> recent(int limit) {
        int n = (int) Math.min(limit, Math.min(index, CAPACITY));
        List<HistoryEntry> out = new ArrayList<>(n);
        for (int i = 0; i < n; i++) {
            int slot = (int) ((index - 1 - i) % CAPACITY);
            out.add(slots[slot]);
        }
        return out;
    }

    /**
     * Every stored entry in slot order (not chronological once wrapped).
     */
    public List<HistoryEntry> stored() {
        int n = size();
        List<HistoryEntry> out = new ArrayList<>(n);
        for (int i = 0; i < n; i++) {
            out.add(slots[i]);
        }
        return out;
    }

    public HistoryLog copy() {
        HistoryLog c = new HistoryLog();
        System.arraycopy(slots, 0, c.slots, 0, CAPACITY);
        c.index = index;
        return c;
    }

    /**
     * Rebuilds a log from persisted slots. Used by the snapshot codec only.
     * The first {@code min(index, CAPACITY)} slots must be filled and the rest
     * empty, exactly as {@link #append} leaves them.
     */
    public static HistoryLog restore(HistoryEntry[] persistedSlots, long persistedIndex) {
        if (persistedSlots.length != CAPACITY) {
            throw new IllegalArgumentException("Expected " + CAPACITY + " history slots, got " + persistedSlots.length);
        }
        if (persistedIndex < 0) {
            throw new IllegalArgumentException("History index must not be negative");
        }
        long filled = Math.min(persistedIndex, CAPACITY);
        for (int i = 0; i < CAPACITY; i++) {
            boolean present = persistedSlots[i] != null;
            if (present != (i < filled)) {
                throw new IllegalArgumentException("History slot " + i + (present ? " is set" : " is empty") +
                        " but the history index is " + persistedIndex);
            }
        }
        HistoryLog log = new HistoryLog();
        System.arraycopy(persistedSlots, 0, log.slots, 0, CAPACITY);
        log.index = persistedIndex;
        return log;
    }

    @Override
    public String toString() {
        return "HistoryLog{index=" + index + ", size=" + size() + ", newest=" +
                Arrays.toString(recent(3).toArray()) + '}';
    }
}
