package com.bridgeai.server.ai.learning;

import com.bridgeai.server.ai.Decision;

/**
 * One recorded feedback outcome.
 */
public class HistoryEntry {
    private final int pattern;
    private final Decision decision;
    private final int latencyUs;
    private final boolean success;

    public HistoryEntry(int pattern, Decision decision, int latencyUs, boolean success) {
        this.pattern = pattern;
        this.decision = decision;
        this.latencyUs = latencyUs;
        this.success = success;
    }

    public int getPattern() {
        return pattern;
    }

    /** Request type code packed into the top byte of the pattern. */
    public int getTypeCode() {
        return (pattern >>> 24) & 0xFF;
    }

    public int getDeviceBits() {
        return pattern & 0xFFFFFF;
    }

    public Decision getDecision() {
        return decision;
    }

    public int getLatencyUs() {
        return latencyUs;
    }

    public boolean isSuccess() {
        return success;
    }

    @Override
    public String toString() {
        return "HistoryEntry{type=" + getTypeCode() + ", device=0x" + Integer.toHexString(getDeviceBits()) +
                ", decision=" + decision + ", latencyUs=" + latencyUs + ", success=" + success + '}';
    }
}
