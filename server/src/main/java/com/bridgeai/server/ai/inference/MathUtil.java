package com.bridgeai.server.ai.inference;

public class MathUtil {

    public static float relu(float x) {
        return x > 0.0f ? x : 0.0f;
    }

    /**
     * Computes the softmax of an array of scores.
     * Uses the "max trick" for numerical stability:
     * softmax(x_i) = exp(x_i - max(x)) / sum(exp(x_j - max(x)))
     */
    public static float[] softmax(float[] scores) {
        if (scores == null || scores.length == 0) {
            throw new IllegalArgumentException("Softmax needs at least one score");
        }

        float max = scores[0];
        for (int i = 1; i < scores.length; i++) {
            if (scores[i] > max)
                max = scores[i];
        }

        float[] probs = new float[scores.length];
        float sum = 0.0f;
        for (int i = 0; i < scores.length; i++) {
            float val = (float) Math.exp(scores[i] - max);
            probs[i] = val;
            sum += val;
        }

        for (int i = 0; i < probs.length; i++) {
            probs[i] /= sum;
        }
        return probs;
    }

    /**
     * Index of the maximum value within {@code [from, to)}. Ties keep the lowest
     * index.
     */
    public static int argmax(float[] x, int from, int to) {
        if (from < 0 || to > x.length || from >= to) {
            throw new IllegalArgumentException("Invalid range [" + from + ", " + to + ") for length " + x.length);
        }
        int bestIdx = from;
        float bestVal = x[from];
        for (int i = from + 1; i < to; i++) {
            if (x[i] > bestVal) {
                bestVal = x[i];
                bestIdx = i;
            }
        }
        return bestIdx;
    }

    public static int argmax(float[] x) {
        return argmax(x, 0, x.length);
    }
}
