package com.bridgeai.util;

import com.bridgeai.server.ai.Decision;
import com.bridgeai.server.ai.ModelState;
import com.bridgeai.server.ai.learning.HistoryEntry;
import com.bridgeai.server.error.BridgeException;
import com.bridgeai.server.error.ErrorCode;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.nio.ByteBuffer;
import java.util.Arrays;
import java.util.Random;

public class ModelStateCodecTest {

    @Test
    public void testFixedSize() {
        ModelState state = ModelState.fresh(true, new Random(3));
        byte[] bytes = ModelStateCodec.toBytes(state);
        Assertions.assertEquals(ModelStateCodec.SIZE, bytes.length);
        Assertions.assertEquals(13213, ModelStateCodec.SIZE);
    }

    @Test
    public void testRoundTripPreservesHistoryAndConfig() {
        ModelState state = ModelState.fresh(true, new Random(3));
        state.getHistory().append(new HistoryEntry(0x02000010, Decision.DEFER, 321, false));
        state.getStats().recordRequest();
        state.getStats().recordOutcome(false, 321);

        ModelState decoded = ModelStateCodec.fromBytes(ModelStateCodec.toBytes(state));

        Assertions.assertEquals(1, decoded.getHistory().getIndex());
        HistoryEntry e = decoded.getHistory().slot(0);
        Assertions.assertEquals(0x02000010, e.getPattern());
        Assertions.assertEquals(Decision.DEFER, e.getDecision());
        Assertions.assertEquals(321, e.getLatencyUs());
        Assertions.assertFalse(e.isSuccess());
        Assertions.assertNull(decoded.getHistory().slot(1));
        Assertions.assertEquals(1, decoded.getStats().getRequestsProcessed());
        Assertions.assertEquals(321, decoded.getStats().getAvgLatencyUs());
        Assertions.assertTrue(decoded.getConfig().isLearningEnabled());
        Assertions.assertArrayEquals(ModelStateCodec.toBytes(state), ModelStateCodec.toBytes(decoded));
    }

    @Test
    public void testWrongLengthIsCorrupt() {
        byte[] bytes = ModelStateCodec.toBytes(ModelState.fresh(false, new Random(3)));

        BridgeException shortBlob = Assertions.assertThrows(BridgeException.class,
                () -> ModelStateCodec.fromBytes(Arrays.copyOf(bytes, bytes.length - 1)));
        Assertions.assertEquals(ErrorCode.MODEL_CORRUPT, shortBlob.getCode());

        BridgeException longBlob = Assertions.assertThrows(BridgeException.class,
                () -> ModelStateCodec.fromBytes(Arrays.copyOf(bytes, bytes.length + 4)));
        Assertions.assertEquals(ErrorCode.MODEL_CORRUPT, longBlob.getCode());
    }

    @Test
    public void testHistoryIndexWithEmptySlotsIsCorrupt() {
        byte[] bytes = ModelStateCodec.toBytes(ModelState.fresh(false, new Random(3)));
        ByteBuffer.wrap(bytes).putLong(ModelStateCodec.HISTORY_INDEX_OFFSET, 5);

        BridgeException ex = Assertions.assertThrows(BridgeException.class, () -> ModelStateCodec.fromBytes(bytes));
        Assertions.assertEquals(ErrorCode.MODEL_CORRUPT, ex.getCode());
    }

    @Test
    public void testEntryBeyondHistoryIndexIsCorrupt() {
        ModelState state = ModelState.fresh(true, new Random(3));
        state.getHistory().append(new HistoryEntry(0x01000001, Decision.BUFFER, 50, true));
        state.getHistory().append(new HistoryEntry(0x01000001, Decision.BUFFER, 60, true));
        byte[] bytes = ModelStateCodec.toBytes(state);
        ByteBuffer.wrap(bytes).putLong(ModelStateCodec.HISTORY_INDEX_OFFSET, 1);

        BridgeException ex = Assertions.assertThrows(BridgeException.class, () -> ModelStateCodec.fromBytes(bytes));
        Assertions.assertEquals(ErrorCode.MODEL_CORRUPT, ex.getCode());
    }

    @Test
    public void testWrappedHistoryDecodes() {
        ModelState state = ModelState.fresh(true, new Random(3));
        for (int i = 0; i < 1500; i++) {
            state.getHistory().append(new HistoryEntry(i, Decision.PASS_THROUGH, i, true));
        }

        ModelState decoded = ModelStateCodec.fromBytes(ModelStateCodec.toBytes(state));
        Assertions.assertEquals(1500, decoded.getHistory().getIndex());
        Assertions.assertEquals(1499, decoded.getHistory().recent(1).get(0).getPattern());
    }

    @Test
    public void testHistoryIndexReadFromBlob() {
        ModelState state = ModelState.fresh(true, new Random(3));
        for (int i = 0; i < 4; i++) {
            state.getHistory().append(new HistoryEntry(7, Decision.OPTIMIZE, 10, true));
        }
        Assertions.assertEquals(4, ModelStateCodec.historyIndex(ModelStateCodec.toBytes(state)));

        BridgeException ex = Assertions.assertThrows(BridgeException.class,
                () -> ModelStateCodec.historyIndex(new byte[12]));
        Assertions.assertEquals(ErrorCode.MODEL_CORRUPT, ex.getCode());
    }
}
