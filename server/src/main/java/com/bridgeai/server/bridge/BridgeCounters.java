package com.bridgeai.server.bridge;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Bridge-level counters, updated from caller threads and the worker without a
 * shared lock.
 */
public class BridgeCounters {
    final AtomicLong totalRequests = new AtomicLong();
    final AtomicLong forwardedToKernel = new AtomicLong();
    final AtomicLong forwardedToCaller = new AtomicLong();
    final AtomicLong aiOptimized = new AtomicLong();
    final AtomicLong aiBatched = new AtomicLong();
    final AtomicLong failures = new AtomicLong();

    public BridgeStats snapshot(long avgLatencyUs, float aiAccuracy) {
        return new BridgeStats(totalRequests.get(), forwardedToKernel.get(), forwardedToCaller.get(),
                aiOptimized.get(), aiBatched.get(), failures.get(), avgLatencyUs, aiAccuracy);
    }

    public long getFailures() {
        return failures.get();
    }

    public long getForwardedToKernel() {
        return forwardedToKernel.get();
    }

    public long getAiOptimized() {
        return aiOptimized.get();
    }

    public long getAiBatched() {
        return aiBatched.get();
    }
}
