package com.bridgeai.server.ai;

public class AiStats {
    private final long requestsProcessed;
    private final float accuracy;
    private final long avgLatencyUs;

    public AiStats(long requestsProcessed, float accuracy, long avgLatencyUs) {
        this.requestsProcessed = requestsProcessed;
        this.accuracy = accuracy;
        this.avgLatencyUs = avgLatencyUs;
    }

    public long getRequestsProcessed() {
        return requestsProcessed;
    }

    public float getAccuracy() {
        return accuracy;
    }

    public long getAvgLatencyUs() {
        return avgLatencyUs;
    }
}
