package com.bridgeai.server.portforward;

/**
 * Inspects a packet handed to {@link PortForwardTable#forwardPacket}.
 */
@FunctionalInterface
public interface PacketCallback {

    /**
     * @return 0 to accept; any other value drops the packet and is returned to
     *         the caller
     */
    int onPacket(int driverId, byte[] packet);
}
