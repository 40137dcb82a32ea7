package com.bridgeai.server.bridge;

import java.util.concurrent.atomic.AtomicInteger;

/**
 * Registry record for one device. Queue entries hold a reference to it, which
 * keeps it alive until drained; {@link #isRegistered()} turns false on
 * unregister so the worker can refuse to forward for a removed device.
 */
public class DeviceContext {
    private final int deviceId;
    private final ChipsetType chipsetType;
    private final Object callerHandle;
    private final Object kernelHandle;
    private final boolean aiManaged;
    private final AtomicInteger activeRequests = new AtomicInteger();
    private volatile boolean registered = true;

    public DeviceContext(int deviceId, ChipsetType chipsetType, Object callerHandle, Object kernelHandle,
            boolean aiManaged) {
        this.deviceId = deviceId;
        this.chipsetType = chipsetType != null ? chipsetType : ChipsetType.UNKNOWN;
        this.callerHandle = callerHandle;
        this.kernelHandle = kernelHandle;
        this.aiManaged = aiManaged;
    }

    public int getDeviceId() {
        return deviceId;
    }

    public ChipsetType getChipsetType() {
        return chipsetType;
    }

    public Object getCallerHandle() {
        return callerHandle;
    }

    public Object getKernelHandle() {
        return kernelHandle;
    }

    public boolean isAiManaged() {
        return aiManaged;
    }

    public int getActiveRequests() {
        return activeRequests.get();
    }

    void requestQueued() {
        activeRequests.incrementAndGet();
    }

    /** Decrements the in-flight count, never below zero. */
    void responseSent() {
        activeRequests.updateAndGet(n -> n > 0 ? n - 1 : 0);
    }

    public boolean isRegistered() {
        return registered;
    }

    void markUnregistered() {
        registered = false;
    }

    @Override
    public String toString() {
        return "DeviceContext{id=0x" + Integer.toHexString(deviceId) + ", chipset=" + chipsetType +
                ", aiManaged=" + aiManaged + ", active=" + activeRequests.get() +
                ", registered=" + registered + '}';
    }
}
