package com.bridgeai.server.bridge;

import com.bridgeai.server.ai.AiBuffer;
import com.bridgeai.server.ai.AiStats;
import com.bridgeai.server.ai.CommRequest;
import com.bridgeai.server.ai.Prediction;
import com.bridgeai.server.error.BridgeException;
import com.bridgeai.server.error.ErrorCode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.ThreadFactory;

/**
 * Request bridge between callers and the kernel side. Owns the device
 * registry, the request queue, one worker thread and the AI model.
 *
 * <p>The registry, the queue and the model each have their own lock. Every
 * operation other than {@link #init()} and {@link #shutdown()} fails with
 * {@link ErrorCode#NOT_INITIALIZED} before init.
 */
public class KernelBridge {
    private static final Logger logger = LoggerFactory.getLogger(KernelBridge.class);

    public static final String WORKER_THREAD_NAME = "bridge-worker";
    private static final long JOIN_TIMEOUT_MS = 5000;

    private final BridgeConfig config;
    private final AiBuffer ai;
    private final ForwardTarget forwardTarget;
    private final ThreadFactory threadFactory;

    private final Object lifecycleLock = new Object();
    private volatile boolean initialized = false;
    private volatile BridgeMode mode;

    private DeviceRegistry registry;
    private RequestQueue queue;
    private BridgeCounters counters;
    private BatchWorker worker;
    private Thread workerThread;

    public KernelBridge(BridgeConfig config) {
        this(config, new AiBuffer(), new LoggingForwardTarget(), KernelBridge::newWorkerThread);
    }

    public KernelBridge(BridgeConfig config, AiBuffer ai, ForwardTarget forwardTarget, ThreadFactory threadFactory) {
        if (config == null || ai == null || forwardTarget == null || threadFactory == null) {
            throw new IllegalArgumentException("Bridge collaborators are required");
        }
        config.validate();
        this.config = config;
        this.ai = ai;
        this.forwardTarget = forwardTarget;
        this.threadFactory = threadFactory;
        this.mode = config.mode;
    }

    private static Thread newWorkerThread(Runnable r) {
        Thread t = new Thread(r, WORKER_THREAD_NAME);
        t.setDaemon(true);
        return t;
    }

    /**
     * Builds the registry and queue, initializes the model when AI is enabled
     * and starts the worker. A second call is a no-op.
     */
    public void init() {
        synchronized (lifecycleLock) {
            if (initialized) {
                return;
            }
            registry = new DeviceRegistry(config.maxDevices);
            queue = new RequestQueue(config.maxPendingRequests);
            counters = new BridgeCounters();
            if (config.aiEnabled) {
                ai.init(mode == BridgeMode.LEARNING);
            }
            worker = new BatchWorker(queue, ai, this::isAiActive, forwardTarget, counters, config.batchTimeoutMs);
            try {
                workerThread = threadFactory.newThread(worker);
                if (workerThread == null) {
                    throw new IllegalStateException("Thread factory returned no thread");
                }
                workerThread.start();
            } catch (RuntimeException e) {
                logger.error("Failed to start bridge worker", e);
                if (config.aiEnabled) {
                    ai.shutdown();
                }
                worker = null;
                workerThread = null;
                throw new BridgeException(ErrorCode.WORKER_START_FAILED, "Failed to start bridge worker", e);
            }
            initialized = true;
        }
        logger.info("Kernel bridge initialized (mode={}, ai={}, queue={}, devices={})",
                mode, config.aiEnabled, config.maxPendingRequests, config.maxDevices);
    }

    /**
     * Stops and joins the worker, shuts the model down and drops every device.
     * Entries still queued are discarded.
     */
    public void shutdown() {
        synchronized (lifecycleLock) {
            if (!initialized) {
                return;
            }
            initialized = false;
            worker.requestStop();
            try {
                workerThread.join(JOIN_TIMEOUT_MS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            if (workerThread.isAlive()) {
                logger.warn("Bridge worker did not stop within {} ms", JOIN_TIMEOUT_MS);
            }
            int discarded = queue.drainBatch().size();
            if (discarded > 0) {
                logger.info("Discarded {} queued requests on shutdown", discarded);
            }
            if (config.aiEnabled) {
                ai.shutdown();
            }
            registry.clear();
        }
        logger.info("Kernel bridge shut down");
    }

    public boolean isInitialized() {
        return initialized;
    }

    public DeviceContext registerDevice(int deviceId, ChipsetType chipsetType, Object callerHandle,
            Object kernelHandle) {
        requireInitialized();
        DeviceContext ctx = registry.register(
                new DeviceContext(deviceId, chipsetType, callerHandle, kernelHandle, config.aiEnabled));
        logger.info("Registered device 0x{} ({})", Integer.toHexString(deviceId), ctx.getChipsetType());
        return ctx;
    }

    public void unregisterDevice(DeviceContext context) {
        requireInitialized();
        requireArg(context, "device context");
        registry.unregister(context);
        logger.info("Unregistered device 0x{} ({} requests in flight)",
                Integer.toHexString(context.getDeviceId()), context.getActiveRequests());
    }

    public DeviceContext findDevice(int deviceId) {
        requireInitialized();
        return registry.find(deviceId);
    }

    public List<DeviceContext> listDevices() {
        requireInitialized();
        return registry.list();
    }

    /**
     * Queues a copy of the request for the worker. A full queue fails at once
     * with {@link ErrorCode#CAPACITY_EXCEEDED}.
     */
    public void enqueueRequest(DeviceContext context, CommRequest request) {
        requireInitialized();
        requireArg(context, "device context");
        requireArg(request, "request");
        if (!context.isRegistered()) {
            throw new BridgeException(ErrorCode.NOT_FOUND,
                    "Device 0x" + Integer.toHexString(context.getDeviceId()) + " is not registered");
        }
        counters.totalRequests.incrementAndGet();
        try {
            queue.enqueue(new QueueEntry(request, context));
        } catch (BridgeException e) {
            counters.failures.incrementAndGet();
            throw e;
        }
        context.requestQueued();
    }

    /** Kernel-to-caller direction: completes one in-flight request. */
    public void sendResponse(DeviceContext context, int payloadSize) {
        requireInitialized();
        requireArg(context, "device context");
        if (payloadSize < 0) {
            throw new BridgeException(ErrorCode.INVALID_ARGUMENT, "Payload size must not be negative");
        }
        counters.forwardedToCaller.incrementAndGet();
        context.responseSent();
        logger.debug("Response of {} bytes to device 0x{}", payloadSize, Integer.toHexString(context.getDeviceId()));
    }

    public void submitFeedback(CommRequest request, Prediction prediction, int actualLatencyUs, boolean success) {
        requireInitialized();
        ai.feedback(request, prediction, actualLatencyUs, success);
    }

    public BridgeStats getStats() {
        requireInitialized();
        long avgLatency = 0;
        float accuracy = 0.0f;
        if (ai.isInitialized()) {
            AiStats aiStats = ai.getStats();
            avgLatency = aiStats.getAvgLatencyUs();
            accuracy = aiStats.getAccuracy();
        }
        return counters.snapshot(avgLatency, accuracy);
    }

    public void setMode(BridgeMode newMode) {
        requireInitialized();
        requireArg(newMode, "mode");
        BridgeMode previous = mode;
        mode = newMode;
        logger.info("Bridge mode {} -> {}", previous, newMode);
    }

    public BridgeMode getMode() {
        return mode;
    }

    public void saveModel(Path path) {
        requireInitialized();
        requireArg(path, "path");
        ai.save(path);
    }

    public void loadModel(Path path) {
        requireInitialized();
        requireArg(path, "path");
        ai.load(path);
    }

    public AiBuffer getAiBuffer() {
        return ai;
    }

    public int getQueueDepth() {
        requireInitialized();
        return queue.size();
    }

    public WorkerState getWorkerState() {
        BatchWorker w = worker;
        return w != null ? w.getState() : WorkerState.STOPPED;
    }

    public BridgeConfig getConfig() {
        return config;
    }

    private boolean isAiActive() {
        return config.aiEnabled && mode != BridgeMode.PASSTHROUGH;
    }

    private void requireInitialized() {
        if (!initialized) {
            throw BridgeException.notInitialized("Kernel bridge");
        }
    }

    private static void requireArg(Object value, String name) {
        if (value == null) {
            throw new BridgeException(ErrorCode.INVALID_ARGUMENT, name + " is required");
        }
    }
}
