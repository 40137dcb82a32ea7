package com.bridgeai.server.portforward;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * One forwarding rule. The table hands out copies; mutating a returned rule
 * has no effect until it is passed to {@link PortForwardTable#updateRule}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class ForwardRule {
    public static final int FLAG_ENABLED = 0x0001;
    public static final int FLAG_PERSISTENT = 0x0002;
    public static final int FLAG_BIDIRECTIONAL = 0x0020;

    public static final int MAX_NAME_LENGTH = 63;
    public static final String ANY_ADDRESS = "0.0.0.0";

    private int id;
    private String name = "";
    private String srcAddr = ANY_ADDRESS;
    private int srcPort;
    private String dstAddr = ANY_ADDRESS;
    private int dstPort;
    private Protocol protocol = Protocol.ANY;
    private int flags = FLAG_ENABLED;
    private int driverId;

    private long packetsForwarded;
    private long bytesForwarded;
    private long lastActivityNanos;

    public ForwardRule() {
    }

    public ForwardRule(String name, String srcAddr, int srcPort, String dstAddr, int dstPort, Protocol protocol,
            int flags, int driverId) {
        this.name = name;
        this.srcAddr = srcAddr;
        this.srcPort = srcPort;
        this.dstAddr = dstAddr;
        this.dstPort = dstPort;
        this.protocol = protocol;
        this.flags = flags;
        this.driverId = driverId;
    }

    public ForwardRule copy() {
        ForwardRule r = new ForwardRule(name, srcAddr, srcPort, dstAddr, dstPort, protocol, flags, driverId);
        r.id = id;
        r.packetsForwarded = packetsForwarded;
        r.bytesForwarded = bytesForwarded;
        r.lastActivityNanos = lastActivityNanos;
        return r;
    }

    void validate() {
        if (name == null || name.length() > MAX_NAME_LENGTH) {
            throw new IllegalArgumentException("Rule name must be at most " + MAX_NAME_LENGTH + " characters");
        }
        if (srcAddr == null || dstAddr == null) {
            throw new IllegalArgumentException("Rule addresses are required");
        }
        checkPort(srcPort, "srcPort");
        checkPort(dstPort, "dstPort");
        if (protocol == null) {
            throw new IllegalArgumentException("Rule protocol is required");
        }
    }

    private static void checkPort(int port, String field) {
        if (port < 0 || port > 0xFFFF) {
            throw new IllegalArgumentException(field + " out of range: " + port);
        }
    }

    public boolean isEnabled() {
        return (flags & FLAG_ENABLED) != 0;
    }

    void recordTraffic(int bytes, long nowNanos) {
        packetsForwarded++;
        bytesForwarded += bytes;
        lastActivityNanos = nowNanos;
    }

    void resetCounters() {
        packetsForwarded = 0;
        bytesForwarded = 0;
        lastActivityNanos = 0;
    }

    public int getId() {
        return id;
    }

    void setId(int id) {
        this.id = id;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public String getSrcAddr() {
        return srcAddr;
    }

    public void setSrcAddr(String srcAddr) {
        this.srcAddr = srcAddr;
    }

    public int getSrcPort() {
        return srcPort;
    }

    public void setSrcPort(int srcPort) {
        this.srcPort = srcPort;
    }

    public String getDstAddr() {
        return dstAddr;
    }

    public void setDstAddr(String dstAddr) {
        this.dstAddr = dstAddr;
    }

    public int getDstPort() {
        return dstPort;
    }

    public void setDstPort(int dstPort) {
        this.dstPort = dstPort;
    }

    public Protocol getProtocol() {
        return protocol;
    }

    public void setProtocol(Protocol protocol) {
        this.protocol = protocol;
    }

    public int getFlags() {
        return flags;
    }

    public void setFlags(int flags) {
        this.flags = flags;
    }

    public int getDriverId() {
        return driverId;
    }

    public void setDriverId(int driverId) {
        this.driverId = driverId;
    }

    public long getPacketsForwarded() {
        return packetsForwarded;
    }

    public long getBytesForwarded() {
        return bytesForwarded;
    }

    public long getLastActivityNanos() {
        return lastActivityNanos;
    }

    @Override
    public String toString() {
        return "ForwardRule{id=" + id + ", name='" + name + "', " + protocol + " " + srcAddr + ":" + srcPort +
                " -> " + dstAddr + ":" + dstPort + ", flags=0x" + Integer.toHexString(flags) +
                ", driver=" + driverId + '}';
    }
}
