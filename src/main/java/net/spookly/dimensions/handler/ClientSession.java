package net.spookly.dimensions.handler;

import net.spookly.dimensions.registry.DestinationRegistry;
import net.spookly.dimensions.registry.GlobalTracking;
import net.spookly.dimensions.registry.RoutingServer;
import net.spookly.dimensions.registry.ServerDetailsRegistry;
import net.spookly.dimensions.registry.TrackedPlayer;

/**
 * View of one proxied client connection as seen by packet and command handlers.
 */
public interface ClientSession {
    String remoteAddress();

    int listenPort();

    /**
     * Destination the session is currently relayed to, null before the first backend connects.
     */
    RoutingServer destination();

    /**
     * Name claim held by this session in the global tracking table, null until PlayerInfo arrives.
     */
    TrackedPlayer trackedPlayer();

    void track(TrackedPlayer player);

    boolean backendAccepted();

    void markBackendAccepted();

    HandlerRegistry handlers();

    DestinationRegistry destinations();

    ServerDetailsRegistry serverDetails();

    GlobalTracking globalTracking();

    /**
     * Send a chat line to the client.
     */
    void sendMessage(String text, int red, int green, int blue);

    default void sendMessage(String text) {
        sendMessage(text, 255, 240, 20);
    }

    /**
     * Send a disconnect reason to the client and close the connection.
     */
    void disconnect(String reason);

    /**
     * Move the client to another destination, keeping the client connection open.
     */
    void switchDestination(RoutingServer target);
}
