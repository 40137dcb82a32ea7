package com.bridgeai.server.ai;

public class Prediction {
    private final Decision decision;
    private final float confidence;
    private final int estimatedLatencyUs;
    private final boolean shouldBatch;
    private final int batchDelayUs;

    public Prediction(Decision decision, float confidence, int estimatedLatencyUs, boolean shouldBatch,
            int batchDelayUs) {
        this.decision = decision;
        this.confidence = confidence;
        this.estimatedLatencyUs = estimatedLatencyUs;
        this.shouldBatch = shouldBatch;
        this.batchDelayUs = batchDelayUs;
    }

    public Decision getDecision() {
        return decision;
    }

    public float getConfidence() {
        return confidence;
    }

    public int getEstimatedLatencyUs() {
        return estimatedLatencyUs;
    }

    public boolean isShouldBatch() {
        return shouldBatch;
    }

    public int getBatchDelayUs() {
        return batchDelayUs;
    }

    @Override
    public String toString() {
        return "Prediction{decision=" + decision +
                ", confidence=" + String.format("%.4f", confidence) +
                ", latencyUs=" + estimatedLatencyUs +
                ", batch=" + shouldBatch +
                ", batchDelayUs=" + batchDelayUs + '}';
    }
}
