package com.bridgeai.server.ai;

/**
 * Persisted configuration block of the model. {@code learningRate} and
 * {@code batchSize} are carried for layout compatibility; nothing reads them to
 * update weights.
 */
public class ModelConfig {
    public static final float DEFAULT_LEARNING_RATE = 0.01f;
    public static final int DEFAULT_BATCH_SIZE = 10;

    private final boolean learningEnabled;
    private final float learningRate;
    private final int batchSize;

    public ModelConfig(boolean learningEnabled, float learningRate, int batchSize) {
        this.learningEnabled = learningEnabled;
        this.learningRate = learningRate;
        this.batchSize = batchSize;
    }

    public static ModelConfig defaults(boolean learningEnabled) {
        return new ModelConfig(learningEnabled, DEFAULT_LEARNING_RATE, DEFAULT_BATCH_SIZE);
    }

    public boolean isLearningEnabled() {
        return learningEnabled;
    }

    public float getLearningRate() {
        return learningRate;
    }

    public int getBatchSize() {
        return batchSize;
    }
}
