package net.spookly.dimensions.handler;

import net.spookly.dimensions.protocol.Packet;

/**
 * Inspects packets sent by a destination server before they are relayed to the client.
 */
@FunctionalInterface
public interface BackendPacketHandler {
    /**
     * @return true when the packet was consumed and must not be forwarded
     */
    boolean handlePacket(ClientSession session, Packet packet);
}
