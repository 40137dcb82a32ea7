package com.bridgeai.server.ai.inference;

import com.bridgeai.server.ai.FeatureVector;

import java.util.Random;

/**
 * Two dense layers with int8 weights and biases. A weight {@code w} stands for
 * {@code w / 127 * scale} where the scale belongs to the layer, not the weight.
 *
 * hidden = relu(bias_h * scaleHidden + sum(x * w_ih / 127 * scaleInput))
 * output = bias_o * scaleOutput + sum(h * w_ho / 127 * scaleHidden)
 *
 * Instances are treated as immutable after construction.
 */
public class QuantizedNetwork {
    public static final int INPUT_SIZE = FeatureVector.SIZE;
    public static final int HIDDEN_SIZE = 64;
    public static final int OUTPUT_SIZE = 16;

    private static final float QUANT = 127.0f;

    // [input][hidden]
    private final byte[][] weightsInputHidden;
    // [hidden][output]
    private final byte[][] weightsHiddenOutput;
    private final byte[] biasHidden;
    private final byte[] biasOutput;

    private final float scaleInput;
    private final float scaleHidden;
    private final float scaleOutput;

    public QuantizedNetwork(byte[][] weightsInputHidden, byte[][] weightsHiddenOutput, byte[] biasHidden,
            byte[] biasOutput, float scaleInput, float scaleHidden, float scaleOutput) {
        this.weightsInputHidden = copyMatrix(weightsInputHidden, INPUT_SIZE, HIDDEN_SIZE, "input->hidden");
        this.weightsHiddenOutput = copyMatrix(weightsHiddenOutput, HIDDEN_SIZE, OUTPUT_SIZE, "hidden->output");
        this.biasHidden = copyVector(biasHidden, HIDDEN_SIZE, "hidden bias");
        this.biasOutput = copyVector(biasOutput, OUTPUT_SIZE, "output bias");
        this.scaleInput = scaleInput;
        this.scaleHidden = scaleHidden;
        this.scaleOutput = scaleOutput;
    }

    /**
     * Xavier-style cold start: uniform(-1, 1) scaled by sqrt(2 / (fanIn + fanOut)),
     * then multiplied by 127 and truncated to int8. Biases are drawn from
     * [-10, 9]. All scales are 1.0.
     */
    public static QuantizedNetwork xavier(Random rng) {
        byte[][] wih = new byte[INPUT_SIZE][HIDDEN_SIZE];
        byte[][] who = new byte[HIDDEN_SIZE][OUTPUT_SIZE];
        byte[] bh = new byte[HIDDEN_SIZE];
        byte[] bo = new byte[OUTPUT_SIZE];

        float scale = (float) Math.sqrt(2.0 / (INPUT_SIZE + HIDDEN_SIZE));
        for (int i = 0; i < INPUT_SIZE; i++) {
            for (int h = 0; h < HIDDEN_SIZE; h++) {
                float weight = (rng.nextFloat() - 0.5f) * 2.0f * scale;
                wih[i][h] = (byte) (int) (weight * QUANT);
            }
        }

        scale = (float) Math.sqrt(2.0 / (HIDDEN_SIZE + OUTPUT_SIZE));
        for (int h = 0; h < HIDDEN_SIZE; h++) {
            for (int o = 0; o < OUTPUT_SIZE; o++) {
                float weight = (rng.nextFloat() - 0.5f) * 2.0f * scale;
                who[h][o] = (byte) (int) (weight * QUANT);
            }
        }

        for (int h = 0; h < HIDDEN_SIZE; h++) {
            bh[h] = (byte) (rng.nextInt(20) - 10);
        }
        for (int o = 0; o < OUTPUT_SIZE; o++) {
            bo[o] = (byte) (rng.nextInt(20) - 10);
        }

        return new QuantizedNetwork(wih, who, bh, bo, 1.0f, 1.0f, 1.0f);
    }

    /**
     * Raw output layer, before softmax.
     */
    public float[] logits(FeatureVector input) {
        float[] hidden = new float[HIDDEN_SIZE];
        for (int h = 0; h < HIDDEN_SIZE; h++) {
            float sum = biasHidden[h] * scaleHidden;
            for (int i = 0; i < INPUT_SIZE; i++) {
                sum += input.get(i) * (weightsInputHidden[i][h] / QUANT) * scaleInput;
            }
            hidden[h] = MathUtil.relu(sum);
        }

        // No activation on the output layer
        float[] output = new float[OUTPUT_SIZE];
        for (int o = 0; o < OUTPUT_SIZE; o++) {
            float sum = biasOutput[o] * scaleOutput;
            for (int h = 0; h < HIDDEN_SIZE; h++) {
                sum += hidden[h] * (weightsHiddenOutput[h][o] / QUANT) * scaleHidden;
            }
            output[o] = sum;
        }
        return output;
    }

    /**
     * Forward pass with softmax over all {@link #OUTPUT_SIZE} outputs.
     */
    public float[] forward(FeatureVector input) {
        return MathUtil.softmax(logits(input));
    }

    public byte weightInputHidden(int input, int hidden) {
        return weightsInputHidden[input][hidden];
    }

    public byte weightHiddenOutput(int hidden, int output) {
        return weightsHiddenOutput[hidden][output];
    }

    public byte biasHidden(int hidden) {
        return biasHidden[hidden];
    }

    public byte biasOutput(int output) {
        return biasOutput[output];
    }

    public float getScaleInput() {
        return scaleInput;
    }

    public float getScaleHidden() {
        return scaleHidden;
    }

    public float getScaleOutput() {
        return scaleOutput;
    }

    private static byte[][] copyMatrix(byte[][] src, int rows, int cols, String name) {
        if (src == null || src.length != rows) {
            throw new IllegalArgumentException(name + " weights must have " + rows + " rows");
        }
        byte[][] dst = new byte[rows][];
        for (int r = 0; r < rows; r++) {
            dst[r] = copyVector(src[r], cols, name + " row " + r);
        }
        return dst;
    }

    private static byte[] copyVector(byte[] src, int length, String name) {
        if (src == null || src.length != length) {
            throw new IllegalArgumentException(name + " must have length " + length);
        }
        byte[] dst = new byte[length];
        System.arraycopy(src, 0, dst, 0, length);
        return dst;
    }
}
