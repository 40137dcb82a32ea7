package com.bridgeai.server.bridge;

import com.bridgeai.server.ai.AiBuffer;
import com.bridgeai.server.ai.CommRequest;
import com.bridgeai.server.ai.Prediction;
import com.bridgeai.server.error.BridgeException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.BooleanSupplier;

/**
 * Sole consumer of a {@link RequestQueue}. Each cycle waits for work or the
 * batch window, then drains whatever is queued, whether the wait ended on a
 * signal or a timeout.
 *
 * <p>{@link #run()} loops over {@link #runCycle()} until a stop is requested.
 * Tests call {@link #runCycle()} or {@link #drain()} directly.
 */
public class BatchWorker implements Runnable {
    private static final Logger logger = LoggerFactory.getLogger(BatchWorker.class);

    private final RequestQueue queue;
    private final AiBuffer ai;
    private final BooleanSupplier aiActive;
    private final ForwardTarget forwardTarget;
    private final BridgeCounters counters;
    private final long batchWindowNanos;

    private volatile boolean stopRequested = false;
    private volatile WorkerState state = WorkerState.IDLE;
    private final AtomicLong cycles = new AtomicLong();

    public BatchWorker(RequestQueue queue, AiBuffer ai, BooleanSupplier aiActive, ForwardTarget forwardTarget,
            BridgeCounters counters, long batchTimeoutMs) {
        if (batchTimeoutMs <= 0) {
            throw new IllegalArgumentException("Batch window must be positive: " + batchTimeoutMs);
        }
        this.queue = queue;
        this.ai = ai;
        this.aiActive = aiActive;
        this.forwardTarget = forwardTarget;
        this.counters = counters;
        this.batchWindowNanos = TimeUnit.MILLISECONDS.toNanos(batchTimeoutMs);
    }

    @Override
    public void run() {
        logger.info("Batch worker started (window {} ms)", TimeUnit.NANOSECONDS.toMillis(batchWindowNanos));
        try {
            while (runCycle()) {
                // next cycle
            }
        } finally {
            state = WorkerState.STOPPED;
            logger.info("Batch worker stopped after {} cycles", cycles.get());
        }
    }

    /**
     * One Waiting, Draining, Idle pass.
     *
     * @return false once a stop has been observed
     */
    public boolean runCycle() {
        if (stopRequested) {
            state = WorkerState.STOPPED;
            return false;
        }
        state = WorkerState.WAITING;
        try {
            queue.awaitWork(batchWindowNanos, () -> stopRequested);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            stopRequested = true;
        }
        if (stopRequested) {
            state = WorkerState.STOPPED;
            return false;
        }
        state = WorkerState.DRAINING;
        drain();
        state = WorkerState.IDLE;
        return true;
    }

    /**
     * Takes the current queue snapshot and routes each entry in FIFO order.
     *
     * @return number of entries drained
     */
    public int drain() {
        List<QueueEntry> batch = queue.drainBatch();
        cycles.incrementAndGet();
        for (QueueEntry entry : batch) {
            process(entry);
        }
        if (!batch.isEmpty()) {
            logger.debug("Drained batch of {} requests", batch.size());
        }
        return batch.size();
    }

    private void process(QueueEntry entry) {
        DeviceContext ctx = entry.getContext();
        CommRequest request = entry.getRequest();
        if (!ctx.isRegistered()) {
            counters.failures.incrementAndGet();
            logger.warn("Dropping {} queued for unregistered device 0x{}", request.getType(),
                    Integer.toHexString(ctx.getDeviceId()));
            return;
        }

        if (aiActive.getAsBoolean()) {
            try {
                Prediction prediction = ai.processRequest(request);
                counters.aiOptimized.incrementAndGet();
                if (prediction.isShouldBatch()) {
                    counters.aiBatched.incrementAndGet();
                }
                logger.debug("Device 0x{} {}: {}", Integer.toHexString(ctx.getDeviceId()), request.getType(),
                        prediction);
            } catch (BridgeException e) {
                counters.failures.incrementAndGet();
                logger.warn("Prediction failed for {}: {}", request, e.getMessage());
            } catch (RuntimeException e) {
                counters.failures.incrementAndGet();
                logger.warn("Prediction failed for {}", request, e);
            }
        }

        boolean acked;
        try {
            acked = forwardTarget.forward(ctx, request);
        } catch (RuntimeException e) {
            logger.warn("Forward target threw for {}", request, e);
            acked = false;
        }
        if (!acked) {
            logger.warn("Forward of {} to device 0x{} was not acknowledged", request.getType(),
                    Integer.toHexString(ctx.getDeviceId()));
        }
        counters.forwardedToKernel.incrementAndGet();
    }

    /** Sets the stop flag and wakes the worker if it is waiting. */
    public void requestStop() {
        stopRequested = true;
        queue.wakeConsumer();
    }

    public boolean isStopRequested() {
        return stopRequested;
    }

    public WorkerState getState() {
        return state;
    }

    public long getCycles() {
        return cycles.get();
    }
}
