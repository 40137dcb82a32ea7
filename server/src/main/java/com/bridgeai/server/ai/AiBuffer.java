package com.bridgeai.server.ai;

import com.bridgeai.server.ai.inference.DecisionModel;
import com.bridgeai.server.ai.learning.HistoryEntry;
import com.bridgeai.server.ai.learning.StatsTracker;
import com.bridgeai.server.ai.store.ModelStore;
import com.bridgeai.server.error.BridgeException;
import com.bridgeai.server.error.ErrorCode;
import com.bridgeai.util.ModelStateCodec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.List;
import java.util.Random;

/**
 * Owner of the model state. Every operation that touches weights, history or
 * counters runs under one lock, so inference is serialized.
 *
 * Feedback is recorded into history and counters only. The weights are never
 * updated, whatever {@link ModelConfig#isLearningEnabled()} says; the flag
 * decides only whether feedback is recorded at all.
 */
public class AiBuffer {
    private static final Logger logger = LoggerFactory.getLogger(AiBuffer.class);

    private final Object lock = new Object();
    private final FeatureExtractor extractor;
    private final ModelStore store;
    private final Random rng;

    private ModelState state;
    private boolean initialized = false;

    public AiBuffer() {
        this(new FeatureExtractor(), new ModelStore(), new Random());
    }

    public AiBuffer(FeatureExtractor extractor, ModelStore store, Random rng) {
        this.extractor = extractor;
        this.store = store;
        this.rng = rng;
    }

    /**
     * Cold start with freshly initialized weights. Calling it again while
     * initialized is a no-op.
     */
    public void init(boolean learningEnabled) {
        synchronized (lock) {
            if (initialized) {
                return;
            }
            state = ModelState.fresh(learningEnabled, rng);
            initialized = true;
        }
        logger.info("AI buffer initialized (learning={})", learningEnabled);
    }

    public void shutdown() {
        synchronized (lock) {
            initialized = false;
            state = null;
        }
        logger.info("AI buffer shut down");
    }

    public boolean isInitialized() {
        synchronized (lock) {
            return initialized;
        }
    }

    public Prediction processRequest(CommRequest request) {
        requireArg(request, "request");
        synchronized (lock) {
            requireInitialized();
            FeatureVector features = extractor.extract(request, state.getHistory());
            Prediction prediction = DecisionModel.predict(state.getNetwork(), features);
            state.getStats().recordRequest();
            if (logger.isTraceEnabled()) {
                logger.trace("{} -> {}", request, prediction);
            }
            return prediction;
        }
    }

    /**
     * Inference on a prepared feature vector. Counters are left alone.
     */
    public Prediction predict(FeatureVector features) {
        requireArg(features, "features");
        synchronized (lock) {
            requireInitialized();
            return DecisionModel.predict(state.getNetwork(), features);
        }
    }

    public FeatureVector extractFeatures(CommRequest request) {
        requireArg(request, "request");
        synchronized (lock) {
            requireInitialized();
            return extractor.extract(request, state.getHistory());
        }
    }

    public void feedback(CommRequest request, Prediction prediction, int actualLatencyUs, boolean success) {
        requireArg(request, "request");
        requireArg(prediction, "prediction");
        if (actualLatencyUs < 0) {
            throw new BridgeException(ErrorCode.INVALID_ARGUMENT, "Latency must not be negative");
        }
        synchronized (lock) {
            requireInitialized();
            if (!state.getConfig().isLearningEnabled()) {
                return;
            }
            state.getHistory().append(
                    new HistoryEntry(request.pattern(), prediction.getDecision(), actualLatencyUs, success));
            state.getStats().recordOutcome(success, actualLatencyUs);
        }
    }

    public AiStats getStats() {
        synchronized (lock) {
            requireInitialized();
            StatsTracker stats = state.getStats();
            return new AiStats(stats.getRequestsProcessed(), stats.accuracy(), stats.getAvgLatencyUs());
        }
    }

    public long getHistoryIndex() {
        synchronized (lock) {
            requireInitialized();
            return state.getHistory().getIndex();
        }
    }

    public List<HistoryEntry> recentHistory(int limit) {
        synchronized (lock) {
            requireInitialized();
            return state.getHistory().recent(limit);
        }
    }

    public boolean isLearningEnabled() {
        synchronized (lock) {
            requireInitialized();
            return state.getConfig().isLearningEnabled();
        }
    }

    /**
     * Failure rate among stored feedback of the same request type, or 0.5 when
     * there is none.
     */
    public float predictFailure(CommRequest request) {
        requireArg(request, "request");
        synchronized (lock) {
            requireInitialized();
            int failures = 0;
            int total = 0;
            for (HistoryEntry e : state.getHistory().stored()) {
                if (e != null && e.getTypeCode() == request.getType().getCode()) {
                    total++;
                    if (!e.isSuccess()) {
                        failures++;
                    }
                }
            }
            return total > 0 ? (float) failures / (float) total : 0.5f;
        }
    }

    public CommRequest optimizeRequest(CommRequest request) {
        requireArg(request, "request");
        checkInitialized();
        return RequestOptimizer.optimize(request);
    }

    public BatchPlan predictBatch(List<CommRequest> requests) {
        requireArg(requests, "requests");
        checkInitialized();
        return RequestOptimizer.planBatches(requests);
    }

    public void save(Path path) {
        ModelState snapshot;
        synchronized (lock) {
            requireInitialized();
            snapshot = state.copy();
        }
        store.save(path, snapshot);
    }

    /**
     * Replaces the in-memory model with the file's contents and marks the buffer
     * initialized. On any failure the current state is left untouched.
     */
    public void load(Path path) {
        ModelState loaded = store.load(path);
        install(loaded);
    }

    public byte[] exportState() {
        synchronized (lock) {
            requireInitialized();
            return ModelStateCodec.toBytes(state);
        }
    }

    public void importState(byte[] blob) {
        requireArg(blob, "blob");
        install(ModelStateCodec.fromBytes(blob));
    }

    private void install(ModelState loaded) {
        synchronized (lock) {
            state = loaded;
            initialized = true;
        }
    }

    private void requireInitialized() {
        if (!initialized) {
            throw BridgeException.notInitialized("AI buffer");
        }
    }

    private void checkInitialized() {
        synchronized (lock) {
            requireInitialized();
        }
    }

    private static void requireArg(Object value, String name) {
        if (value == null) {
            throw new BridgeException(ErrorCode.INVALID_ARGUMENT, name + " is required");
        }
    }
}
