package net.spookly.dimensions.handler;

import java.time.Clock;
import java.util.Objects;

import io.netty.handler.codec.CorruptedFrameException;
import net.spookly.dimensions.protocol.Packet;
import net.spookly.dimensions.protocol.PacketType;
import net.spookly.dimensions.protocol.TerrariaPackets;
import net.spookly.dimensions.registry.RoutingServer;
import net.spookly.dimensions.registry.TrackedPlayer;

/**
 * Claims player names fleet-wide and routes slash commands to the active command handler.
 */
public final class DefaultClientPacketHandler implements ClientPacketHandler {
    private final Clock clock;

    public DefaultClientPacketHandler() {
        this(Clock.systemUTC());
    }

    public DefaultClientPacketHandler(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    @Override
    public boolean handlePacket(ClientSession session, Packet packet) {
        try {
            switch (packet.type()) {
                case PacketType.PLAYER_INFO:
                    return handlePlayerInfo(session, packet);
                case PacketType.NET_MODULES:
                    return handleNetModule(session, packet);
                default:
                    return false;
            }
        } catch (CorruptedFrameException e) {
            // Leave malformed payloads for the destination to reject.
            return false;
        }
    }

    private boolean handlePlayerInfo(ClientSession session, Packet packet) {
        if (session.trackedPlayer() != null) {
            return false;
        }
        String name = TerrariaPackets.readPlayerName(packet.payload());
        if (name.isBlank()) {
            session.disconnect("Your name must not be empty.");
            return true;
        }
        RoutingServer destination = session.destination();
        TrackedPlayer player = new TrackedPlayer(
                name,
                destination == null ? null : destination.name(),
                session.listenPort(),
                clock.instant()
        );
        if (!session.globalTracking().tryClaim(player)) {
            session.disconnect("The name " + name + " is already in use on this network.");
            return true;
        }
        session.track(player);
        return false;
    }

    private boolean handleNetModule(ClientSession session, Packet packet) {
        TerrariaPackets.ChatInput chat = TerrariaPackets.readChatInput(packet.payload());
        if (chat == null || chat.text() == null || !chat.text().startsWith("/")) {
            return false;
        }
        return session.handlers().command().handle(session, chat.text());
    }
}
