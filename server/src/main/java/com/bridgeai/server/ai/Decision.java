package com.bridgeai.server.ai;

/**
 * Handling decision predicted for a request. Ordinal order matches the first six
 * network outputs.
 */
public enum Decision {
    PASS_THROUGH,
    BUFFER,
    OPTIMIZE,
    DEFER,
    REJECT,
    RETRY;

    public static final int COUNT = 6;

    public static Decision fromOrdinal(int ordinal) {
        Decision[] all = values();
        if (ordinal < 0 || ordinal >= all.length) {
            throw new IllegalArgumentException("No decision with ordinal " + ordinal);
        }
        return all[ordinal];
    }
}
