package com.bridgeai.server.bridge;

import com.bridgeai.server.error.BridgeException;
import com.bridgeai.server.error.ErrorCode;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Devices keyed by id. Guarded by its own lock, independent of the queue and
 * model locks.
 */
public class DeviceRegistry {
    private final Object lock = new Object();
    private final Map<Integer, DeviceContext> devices = new LinkedHashMap<>();
    private final int capacity;

    public DeviceRegistry(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("Registry capacity must be positive: " + capacity);
        }
        this.capacity = capacity;
    }

    public DeviceContext register(DeviceContext context) {
        synchronized (lock) {
            if (devices.size() >= capacity) {
                throw new BridgeException(ErrorCode.CAPACITY_EXCEEDED,
                        "Device registry is full (" + capacity + " devices)");
            }
            if (devices.containsKey(context.getDeviceId())) {
                throw new BridgeException(ErrorCode.INVALID_ARGUMENT,
                        "Device 0x" + Integer.toHexString(context.getDeviceId()) + " is already registered");
            }
            devices.put(context.getDeviceId(), context);
            return context;
        }
    }

    public void unregister(DeviceContext context) {
        synchronized (lock) {
            DeviceContext current = devices.get(context.getDeviceId());
            if (current != context) {
                throw new BridgeException(ErrorCode.NOT_FOUND, "Device context is not registered: " + context);
            }
            devices.remove(context.getDeviceId());
            context.markUnregistered();
        }
    }

    public DeviceContext find(int deviceId) {
        synchronized (lock) {
            DeviceContext ctx = devices.get(deviceId);
            if (ctx == null) {
                throw new BridgeException(ErrorCode.NOT_FOUND,
                        "Unknown device 0x" + Integer.toHexString(deviceId));
            }
            return ctx;
        }
    }

    public List<DeviceContext> list() {
        synchronized (lock) {
            return new ArrayList<>(devices.values());
        }
    }

    public int size() {
        synchronized (lock) {
            return devices.size();
        }
    }

    public int getCapacity() {
        return capacity;
    }

    public void clear() {
        synchronized (lock) {
            for (DeviceContext ctx : devices.values()) {
                ctx.markUnregistered();
            }
            devices.clear();
        }
    }
}
