package com.bridgeai.util;

import com.bridgeai.server.ai.Decision;
import com.bridgeai.server.ai.ModelConfig;
import com.bridgeai.server.ai.ModelState;
import com.bridgeai.server.ai.inference.QuantizedNetwork;
import com.bridgeai.server.ai.learning.HistoryEntry;
import com.bridgeai.server.ai.learning.HistoryLog;
import com.bridgeai.server.ai.learning.StatsTracker;
import com.bridgeai.server.error.BridgeException;
import com.bridgeai.server.error.ErrorCode;

import java.nio.BufferUnderflowException;
import java.nio.ByteBuffer;

/**
 * Fixed-size big-endian layout of a {@link ModelState}:
 *
 * <pre>
 * int8[32][64]  input->hidden weights
 * int8[64][16]  hidden->output weights
 * int8[64]      hidden bias
 * int8[16]      output bias
 * f32 x3        input, hidden, output scales
 * i64 x4        requests, successes, failures, avg latency us
 * 1000 x { i32 pattern, u8 decision, i32 latency us, u8 flags(bit0 present, bit1 success) }
 * i64           history index
 * u8, f32, i32  learning enabled, learning rate, batch size
 * </pre>
 *
 * There is no version field; any blob whose length differs from
 * {@link #SIZE} is rejected as corrupt.
 */
public class ModelStateCodec {

    private static final int HISTORY_RECORD_BYTES = Integer.BYTES + 1 + Integer.BYTES + 1;

    public static final int SIZE = QuantizedNetwork.INPUT_SIZE * QuantizedNetwork.HIDDEN_SIZE
            + QuantizedNetwork.HIDDEN_SIZE * QuantizedNetwork.OUTPUT_SIZE
            + QuantizedNetwork.HIDDEN_SIZE
            + QuantizedNetwork.OUTPUT_SIZE
            + 3 * Float.BYTES
            + 4 * Long.BYTES
            + HistoryLog.CAPACITY * HISTORY_RECORD_BYTES
            + Long.BYTES
            + 1 + Float.BYTES + Integer.BYTES;

    /** Byte offset of the history index; it is followed only by the config block. */
    public static final int HISTORY_INDEX_OFFSET = SIZE - (Long.BYTES + 1 + Float.BYTES + Integer.BYTES);

    private static final int FLAG_PRESENT = 0x01;
    private static final int FLAG_SUCCESS = 0x02;

    public static byte[] toBytes(ModelState state) {
        if (state == null) {
            return null;
        }
        ByteBuffer buffer = ByteBuffer.allocate(SIZE);
        QuantizedNetwork net = state.getNetwork();

        for (int i = 0; i < QuantizedNetwork.INPUT_SIZE; i++) {
            for (int h = 0; h < QuantizedNetwork.HIDDEN_SIZE; h++) {
                buffer.put(net.weightInputHidden(i, h));
            }
        }
        for (int h = 0; h < QuantizedNetwork.HIDDEN_SIZE; h++) {
            for (int o = 0; o < QuantizedNetwork.OUTPUT_SIZE; o++) {
                buffer.put(net.weightHiddenOutput(h, o));
            }
        }
        for (int h = 0; h < QuantizedNetwork.HIDDEN_SIZE; h++) {
            buffer.put(net.biasHidden(h));
        }
        for (int o = 0; o < QuantizedNetwork.OUTPUT_SIZE; o++) {
            buffer.put(net.biasOutput(o));
        }
        buffer.putFloat(net.getScaleInput());
        buffer.putFloat(net.getScaleHidden());
        buffer.putFloat(net.getScaleOutput());

        StatsTracker stats = state.getStats();
        buffer.putLong(stats.getRequestsProcessed());
        buffer.putLong(stats.getSuccessfulPredictions());
        buffer.putLong(stats.getFailedPredictions());
        buffer.putLong(stats.getAvgLatencyUs());

        HistoryLog history = state.getHistory();
        for (int slot = 0; slot < HistoryLog.CAPACITY; slot++) {
            HistoryEntry e = history.slot(slot);
            if (e == null) {
                buffer.putInt(0).put((byte) 0).putInt(0).put((byte) 0);
            } else {
                int flags = FLAG_PRESENT | (e.isSuccess() ? FLAG_SUCCESS : 0);
                buffer.putInt(e.getPattern())
                        .put((byte) e.getDecision().ordinal())
                        .putInt(e.getLatencyUs())
                        .put((byte) flags);
            }
        }
        buffer.putLong(history.getIndex());

        ModelConfig config = state.getConfig();
        buffer.put((byte) (config.isLearningEnabled() ? 1 : 0));
        buffer.putFloat(config.getLearningRate());
        buffer.putInt(config.getBatchSize());

        return buffer.array();
    }

    /**
     * History index recorded in a blob, read without decoding the rest.
     */
    public static long historyIndex(byte[] bytes) {
        if (bytes == null || bytes.length != SIZE) {
            throw new BridgeException(ErrorCode.MODEL_CORRUPT, "Model blob must have " + SIZE + " bytes");
        }
        return ByteBuffer.wrap(bytes).getLong(HISTORY_INDEX_OFFSET);
    }

    public static ModelState fromBytes(byte[] bytes) {
        if (bytes == null) {
            return null;
        }
        if (bytes.length != SIZE) {
            throw new BridgeException(ErrorCode.MODEL_CORRUPT,
                    "Model blob has " + bytes.length + " bytes, expected " + SIZE);
        }
        try {
            ByteBuffer buffer = ByteBuffer.wrap(bytes);

            byte[][] wih = new byte[QuantizedNetwork.INPUT_SIZE][QuantizedNetwork.HIDDEN_SIZE];
            for (byte[] row : wih) {
                buffer.get(row);
            }
            byte[][] who = new byte[QuantizedNetwork.HIDDEN_SIZE][QuantizedNetwork.OUTPUT_SIZE];
            for (byte[] row : who) {
                buffer.get(row);
            }
            byte[] bh = new byte[QuantizedNetwork.HIDDEN_SIZE];
            buffer.get(bh);
            byte[] bo = new byte[QuantizedNetwork.OUTPUT_SIZE];
            buffer.get(bo);
            float scaleInput = buffer.getFloat();
            float scaleHidden = buffer.getFloat();
            float scaleOutput = buffer.getFloat();
            QuantizedNetwork network = new QuantizedNetwork(wih, who, bh, bo, scaleInput, scaleHidden, scaleOutput);

            StatsTracker stats = new StatsTracker(buffer.getLong(), buffer.getLong(), buffer.getLong(),
                    buffer.getLong());

            HistoryEntry[] slots = new HistoryEntry[HistoryLog.CAPACITY];
            for (int slot = 0; slot < HistoryLog.CAPACITY; slot++) {
                int pattern = buffer.getInt();
                int decision = buffer.get() & 0xFF;
                int latency = buffer.getInt();
                int flags = buffer.get() & 0xFF;
                if ((flags & FLAG_PRESENT) != 0) {
                    slots[slot] = new HistoryEntry(pattern, Decision.fromOrdinal(decision), latency,
                            (flags & FLAG_SUCCESS) != 0);
                }
            }
            HistoryLog history = HistoryLog.restore(slots, buffer.getLong());

            boolean learningEnabled = buffer.get() != 0;
            ModelConfig config = new ModelConfig(learningEnabled, buffer.getFloat(), buffer.getInt());

            return new ModelState(network, stats, history, config);
        } catch (IllegalArgumentException | BufferUnderflowException e) {
            throw new BridgeException(ErrorCode.MODEL_CORRUPT, "Model blob is malformed: " + e.getMessage(), e);
        }
    }
}
