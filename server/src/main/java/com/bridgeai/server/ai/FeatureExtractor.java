package com.bridgeai.server.ai;

import com.bridgeai.server.ai.learning.HistoryEntry;
import com.bridgeai.server.ai.learning.HistoryLog;

import java.util.List;
import java.util.function.LongSupplier;

/**
 * Turns a request plus recent feedback history into the 32-wide network input.
 *
 * <ul>
 * <li>f0 type / 7</li>
 * <li>f1, f2 low and second byte of the device id / 255</li>
 * <li>f3 low 16 bits of the address / 65535</li>
 * <li>f4 size / 4096, not clamped</li>
 * <li>f5 low byte of flags / 255</li>
 * <li>f6 priority / 10</li>
 * <li>f7 request age in ms, clamped to 1.0</li>
 * <li>f8 same-type hits among the last 100 feedback records / 100</li>
 * <li>f9 mean latency of the last 100 records / 10000, or 0.5 without history</li>
 * <li>f10..f31 f(i mod 10) * 0.5</li>
 * </ul>
 */
public class FeatureExtractor {
    static final int HISTORY_WINDOW = 100;
    static final int MEANINGFUL = 10;

    private static final float PAGE_SIZE = 4096.0f;
    private static final float NANOS_PER_MS = 1_000_000.0f;
    private static final float LATENCY_NORM_US = 10000.0f;
    private static final float NO_HISTORY_LATENCY = 0.5f;

    private final LongSupplier nanoClock;

    public FeatureExtractor() {
        this(System::nanoTime);
    }

    public FeatureExtractor(LongSupplier nanoClock) {
        this.nanoClock = nanoClock;
    }

    public FeatureVector extract(CommRequest req, HistoryLog history) {
        float[] f = new float[FeatureVector.SIZE];

        f[0] = (float) req.getType().getCode() / (float) RequestType.COUNT;
        f[1] = (float) (req.getDeviceId() & 0xFF) / 255.0f;
        f[2] = (float) ((req.getDeviceId() >>> 8) & 0xFF) / 255.0f;
        f[3] = (float) (req.getAddress() & 0xFFFF) / 65535.0f;
        f[4] = (float) req.getSize() / PAGE_SIZE;
        f[5] = (float) (req.getFlags() & 0xFF) / 255.0f;
        f[6] = (float) req.getPriority() / (float) CommRequest.MAX_PRIORITY;

        long age = nanoClock.getAsLong() - req.getTimestampNanos();
        // a timestamp from the future reads as a maximally old request
        f[7] = age < 0 ? 1.0f : Math.min(1.0f, (float) age / NANOS_PER_MS);

        List<HistoryEntry> recent = history.recent(HISTORY_WINDOW);
        int sameType = 0;
        long latencySum = 0;
        for (HistoryEntry e : recent) {
            if (e.getTypeCode() == req.getType().getCode()) {
                sameType++;
            }
            latencySum += Integer.toUnsignedLong(e.getLatencyUs());
        }
        f[8] = (float) sameType / (float) HISTORY_WINDOW;
        f[9] = recent.isEmpty() ? NO_HISTORY_LATENCY
                : (float) latencySum / (float) recent.size() / LATENCY_NORM_US;

        for (int i = MEANINGFUL; i < FeatureVector.SIZE; i++) {
            f[i] = f[i % MEANINGFUL] * 0.5f;
        }
        return new FeatureVector(f);
    }
}
