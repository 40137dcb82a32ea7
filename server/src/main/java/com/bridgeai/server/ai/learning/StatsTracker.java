package com.bridgeai.server.ai.learning;

/**
 * Running counters fed by predictions and feedback.
 *
 * Latency is an exponential moving average with weight 1/10 on the newest
 * sample; an average of zero means no sample has been seen yet, and the next
 * sample is taken as-is.
 */
public class StatsTracker {
    private long requestsProcessed;
    private long successfulPredictions;
    private long failedPredictions;
    private long avgLatencyUs;

    public StatsTracker() {
    }

    public StatsTracker(long requestsProcessed, long successfulPredictions, long failedPredictions,
            long avgLatencyUs) {
        this.requestsProcessed = requestsProcessed;
        this.successfulPredictions = successfulPredictions;
        this.failedPredictions = failedPredictions;
        this.avgLatencyUs = avgLatencyUs;
    }

    public void recordRequest() {
        requestsProcessed++;
    }

    public void recordOutcome(boolean success, long actualLatencyUs) {
        if (success) {
            successfulPredictions++;
        } else {
            failedPredictions++;
        }

        if (avgLatencyUs == 0) {
            avgLatencyUs = actualLatencyUs;
        } else {
            avgLatencyUs = (avgLatencyUs * 9 + actualLatencyUs) / 10;
        }
    }

    public float accuracy() {
        long total = successfulPredictions + failedPredictions;
        return total > 0 ? (float) successfulPredictions / (float) total : 0.0f;
    }

    public long getRequestsProcessed() {
        return requestsProcessed;
    }

    public long getSuccessfulPredictions() {
        return successfulPredictions;
    }

    public long getFailedPredictions() {
        return failedPredictions;
    }

    public long getAvgLatencyUs() {
        return avgLatencyUs;
    }

    public StatsTracker copy() {
        return new StatsTracker(requestsProcessed, successfulPredictions, failedPredictions, avgLatencyUs);
    }
}
