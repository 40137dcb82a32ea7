package com.bridgeai.server.portforward;

public enum Protocol {
    ANY(0),
    TCP(6),
    UDP(17),
    SCTP(132);

    private final int number;

    Protocol(int number) {
        this.number = number;
    }

    /** IANA protocol number. */
    public int getNumber() {
        return number;
    }

    public static Protocol fromNumber(int number) {
        for (Protocol p : values()) {
            if (p.number == number) {
                return p;
            }
        }
        throw new IllegalArgumentException("Unsupported protocol number: " + number);
    }
}
