package com.bridgeai.server.ai.inference;

import com.bridgeai.server.ai.Decision;
import com.bridgeai.server.ai.FeatureVector;
import com.bridgeai.server.ai.Prediction;

/**
 * Reads a {@link Prediction} out of the network's 16 softmax outputs.
 *
 * Output layout: [0, 6) decision classes, 6 latency (x10000 us), 7 batch flag
 * (&gt; 0.5), 8 batch delay (x1000 us). Outputs 9..15 carry no meaning but still
 * take part in the softmax normalization.
 */
public class DecisionModel {

    public static final int OUT_LATENCY = 6;
    public static final int OUT_BATCH = 7;
    public static final int OUT_BATCH_DELAY = 8;

    private static final float LATENCY_SCALE_US = 10000.0f;
    private static final float BATCH_DELAY_SCALE_US = 1000.0f;
    private static final float BATCH_THRESHOLD = 0.5f;

    public static Prediction predict(QuantizedNetwork network, FeatureVector features) {
        return interpret(network.forward(features));
    }

    public static Prediction interpret(float[] probs) {
        if (probs.length != QuantizedNetwork.OUTPUT_SIZE) {
            throw new IllegalArgumentException("Expected " + QuantizedNetwork.OUTPUT_SIZE + " outputs");
        }
        int best = MathUtil.argmax(probs, 0, Decision.COUNT);
        Decision decision = Decision.fromOrdinal(best);
        float confidence = probs[best];

        int latencyUs = (int) (probs[OUT_LATENCY] * LATENCY_SCALE_US);
        boolean shouldBatch = probs[OUT_BATCH] > BATCH_THRESHOLD;
        int batchDelayUs = shouldBatch ? (int) (probs[OUT_BATCH_DELAY] * BATCH_DELAY_SCALE_US) : 0;

        return new Prediction(decision, confidence, latencyUs, shouldBatch, batchDelayUs);
    }
}
