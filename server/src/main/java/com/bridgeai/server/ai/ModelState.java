package com.bridgeai.server.ai;

import com.bridgeai.server.ai.inference.QuantizedNetwork;
import com.bridgeai.server.ai.learning.HistoryLog;
import com.bridgeai.server.ai.learning.StatsTracker;

import java.util.Random;

/**
 * Everything that is persisted as one unit: network, counters, feedback
 * history and the config block.
 */
public class ModelState {
    private final QuantizedNetwork network;
    private final StatsTracker stats;
    private final HistoryLog history;
    private final ModelConfig config;

    public ModelState(QuantizedNetwork network, StatsTracker stats, HistoryLog history, ModelConfig config) {
        this.network = network;
        this.stats = stats;
        this.history = history;
        this.config = config;
    }

    public static ModelState fresh(boolean learningEnabled, Random rng) {
        return new ModelState(QuantizedNetwork.xavier(rng), new StatsTracker(), new HistoryLog(),
                ModelConfig.defaults(learningEnabled));
    }

    public QuantizedNetwork getNetwork() {
        return network;
    }

    public StatsTracker getStats() {
        return stats;
    }

    public HistoryLog getHistory() {
        return history;
    }

    public ModelConfig getConfig() {
        return config;
    }

    public ModelState copy() {
        return new ModelState(network, stats.copy(), history.copy(), config);
    }
}
