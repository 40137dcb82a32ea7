package com.bridgeai.server.ai;

import java.util.Arrays;

/**
 * A device request flowing through the bridge. Immutable: the queue keeps its
 * own copy, so producers may discard theirs right after enqueue.
 */
public class CommRequest {
    public static final int MAX_PRIORITY = 10;
    public static final long MAX_SIZE = 0xFFFFFFFFL;

    private final RequestType type;
    private final int deviceId; // u32 bit pattern
    private final long address;
    private final long size; // u32 value
    private final byte[] data; // may be null
    private final int flags;
    private final long timestampNanos; // System.nanoTime() at creation
    private final int priority;

    public CommRequest(RequestType type, int deviceId, long address, long size, byte[] data, int flags,
            long timestampNanos, int priority) {
        if (type == null) {
            throw new IllegalArgumentException("Request type is required");
        }
        if (size < 0 || size > MAX_SIZE) {
            throw new IllegalArgumentException("Request size must be within 0.." + MAX_SIZE + ": " + size);
        }
        if (priority < 0 || priority > MAX_PRIORITY) {
            throw new IllegalArgumentException("Priority must be within 0.." + MAX_PRIORITY + ": " + priority);
        }
        this.type = type;
        this.deviceId = deviceId;
        this.address = address;
        this.size = size;
        this.data = data != null ? Arrays.copyOf(data, data.length) : null;
        this.flags = flags;
        this.timestampNanos = timestampNanos;
        this.priority = priority;
    }

    /**
     * Convenience factory stamping the request with the current monotonic time.
     */
    public static CommRequest of(RequestType type, int deviceId, long address, long size, int flags, int priority) {
        return new CommRequest(type, deviceId, address, size, null, flags, System.nanoTime(), priority);
    }

    public CommRequest withSize(long newSize) {
        return new CommRequest(type, deviceId, address, newSize, data, flags, timestampNanos, priority);
    }

    public RequestType getType() {
        return type;
    }

    public int getDeviceId() {
        return deviceId;
    }

    public long getAddress() {
        return address;
    }

    public long getSize() {
        return size;
    }

    public byte[] getData() {
        return data != null ? Arrays.copyOf(data, data.length) : null;
    }

    public boolean hasData() {
        return data != null;
    }

    public int getFlags() {
        return flags;
    }

    public long getTimestampNanos() {
        return timestampNanos;
    }

    public int getPriority() {
        return priority;
    }

    /**
     * History pattern: request type in the top byte, low 24 bits of the device id
     * below it.
     */
    public int pattern() {
        return (type.getCode() << 24) | (deviceId & 0xFFFFFF);
    }

    @Override
    public String toString() {
        return "CommRequest{type=" + type +
                ", device=0x" + Integer.toHexString(deviceId) +
                ", address=0x" + Long.toHexString(address) +
                ", size=" + size +
                ", flags=0x" + Integer.toHexString(flags) +
                ", priority=" + priority + '}';
    }
}
