package com.bridgeai.server.ai;

import java.util.Arrays;

/**
 * Fixed-length normalized input to the decision network.
 */
public class FeatureVector {
    public static final int SIZE = 32;

    private final float[] values;

    public FeatureVector(float[] values) {
        if (values == null || values.length != SIZE) {
            throw new IllegalArgumentException("Feature vector must hold exactly " + SIZE + " values");
        }
        this.values = Arrays.copyOf(values, SIZE);
    }

    public float get(int index) {
        return values[index];
    }

    public float[] toArray() {
        return Arrays.copyOf(values, SIZE);
    }

    @Override
    public String toString() {
        return "FeatureVector" + Arrays.toString(Arrays.copyOf(values, 10)) + "...";
    }
}
