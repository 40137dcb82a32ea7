package com.bridgeai.server.portforward;

public class PortForwardStats {
    private final long totalRules;
    private final long totalPackets;
    private final long totalBytes;
    private final long droppedPackets;
    private final long errors;

    public PortForwardStats(long totalRules, long totalPackets, long totalBytes, long droppedPackets, long errors) {
        this.totalRules = totalRules;
        this.totalPackets = totalPackets;
        this.totalBytes = totalBytes;
        this.droppedPackets = droppedPackets;
        this.errors = errors;
    }

    public long getTotalRules() {
        return totalRules;
    }

    public long getTotalPackets() {
        return totalPackets;
    }

    public long getTotalBytes() {
        return totalBytes;
    }

    public long getDroppedPackets() {
        return droppedPackets;
    }

    public long getErrors() {
        return errors;
    }
}
