package net.spookly.dimensions.listen;

import java.util.List;

import net.spookly.dimensions.config.DimensionsConfig;
import net.spookly.dimensions.registry.RoutingServer;

/**
 * A bound listening port and the pool of destinations it routes new clients to.
 */
public interface ListenServer {
    int port();

    /**
     * Current destination pool in configuration order.
     */
    List<RoutingServer> routingServers();

    /**
     * Replace the destination pool in place; established sessions keep their destination.
     *
     * @throws IllegalArgumentException when the entry is for a different port
     */
    void updateInfo(DimensionsConfig.ServerConfig entry);

    /**
     * Release the bound port without waiting for established sessions to drain.
     */
    void shutdown();
}
