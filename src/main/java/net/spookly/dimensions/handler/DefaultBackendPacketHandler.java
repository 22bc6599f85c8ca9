package net.spookly.dimensions.handler;

import net.spookly.dimensions.protocol.Packet;
import net.spookly.dimensions.protocol.PacketType;

/**
 * Relays every destination packet, noting when the destination assigns the client a slot.
 */
public final class DefaultBackendPacketHandler implements BackendPacketHandler {
    @Override
    public boolean handlePacket(ClientSession session, Packet packet) {
        if (packet.type() == PacketType.SET_USER_SLOT && !session.backendAccepted()) {
            session.markBackendAccepted();
        }
        return false;
    }
}
