package com.bridgeai.server.ai;

/**
 * Kinds of device request. The numeric code is the discriminant used in
 * feature extraction and in the packed history pattern.
 */
public enum RequestType {
    IO_READ(0),
    IO_WRITE(1),
    DMA_ALLOC(2),
    INTERRUPT(3),
    PCI_CONFIG(4),
    POWER_STATE(5),
    UNKNOWN(6);

    // Known discriminants including UNKNOWN
    public static final int COUNT = 7;

    private final int code;

    RequestType(int code) {
        this.code = code;
    }

    public int getCode() {
        return code;
    }

    public static RequestType fromCode(int code) {
        for (RequestType t : values()) {
            if (t.code == code) {
                return t;
            }
        }
        return UNKNOWN;
    }
}
