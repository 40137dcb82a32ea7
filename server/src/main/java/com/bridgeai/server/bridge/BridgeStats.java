package com.bridgeai.server.bridge;

public class BridgeStats {
    private final long totalRequests;
    private final long forwardedToKernel;
    private final long forwardedToCaller;
    private final long aiOptimized;
    private final long aiBatched;
    private final long failures;
    private final long avgLatencyUs;
    private final float aiAccuracy;

    public BridgeStats(long totalRequests, long forwardedToKernel, long forwardedToCaller, long aiOptimized,
            long aiBatched, long failures, long avgLatencyUs, float aiAccuracy) {
        this.totalRequests = totalRequests;
        this.forwardedToKernel = forwardedToKernel;
        this.forwardedToCaller = forwardedToCaller;
        this.aiOptimized = aiOptimized;
        this.aiBatched = aiBatched;
        this.failures = failures;
        this.avgLatencyUs = avgLatencyUs;
        this.aiAccuracy = aiAccuracy;
    }

    public long getTotalRequests() {
        return totalRequests;
    }

    public long getForwardedToKernel() {
        return forwardedToKernel;
    }

    public long getForwardedToCaller() {
        return forwardedToCaller;
    }

    public long getAiOptimized() {
        return aiOptimized;
    }

    public long getAiBatched() {
        return aiBatched;
    }

    public long getFailures() {
        return failures;
    }

    public long getAvgLatencyUs() {
        return avgLatencyUs;
    }

    public float getAiAccuracy() {
        return aiAccuracy;
    }

    @Override
    public String toString() {
        return "BridgeStats{total=" + totalRequests + ", toKernel=" + forwardedToKernel +
                ", toCaller=" + forwardedToCaller + ", aiOptimized=" + aiOptimized +
                ", aiBatched=" + aiBatched + ", failures=" + failures +
                ", avgLatencyUs=" + avgLatencyUs + ", aiAccuracy=" + aiAccuracy + '}';
    }
}
