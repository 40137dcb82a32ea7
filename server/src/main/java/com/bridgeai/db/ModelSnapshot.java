package com.bridgeai.db;

/**
 * Catalogue row for a stored model snapshot, without the blob.
 */
public class ModelSnapshot {
    private final long id;
    private final String name;
    private final long historyIndex;
    private final int sizeBytes;
    private final long createdTs;

    public ModelSnapshot(long id, String name, long historyIndex, int sizeBytes, long createdTs) {
        this.id = id;
        this.name = name;
        this.historyIndex = historyIndex;
        this.sizeBytes = sizeBytes;
        this.createdTs = createdTs;
    }

    public long getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    public long getHistoryIndex() {
        return historyIndex;
    }

    public int getSizeBytes() {
        return sizeBytes;
    }

    public long getCreatedTs() {
        return createdTs;
    }

    @Override
    public String toString() {
        return "ModelSnapshot{name='" + name + "', historyIndex=" + historyIndex + ", bytes=" + sizeBytes + '}';
    }
}
