package net.spookly.dimensions.handler;

import net.spookly.dimensions.protocol.Packet;

/**
 * Inspects packets sent by a client before they are relayed to its destination.
 */
@FunctionalInterface
public interface ClientPacketHandler {
    /**
     * @return true when the packet was consumed and must not be forwarded
     */
    boolean handlePacket(ClientSession session, Packet packet);
}
