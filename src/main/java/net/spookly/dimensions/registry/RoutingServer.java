package net.spookly.dimensions.registry;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NonNull;
import lombok.ToString;
import lombok.experimental.Accessors;
import net.spookly.dimensions.config.DimensionsConfig;

/**
 * Backend destination ("dimension") a listen server may route clients to.
 */
@Getter
@ToString
@Accessors(fluent = true)
@AllArgsConstructor
public final class RoutingServer {
    @NonNull
    private final String name;
    @NonNull
    private final String serverIP;
    private final int serverPort;

    public static RoutingServer fromConfig(DimensionsConfig.RoutingServerConfig config) {
        return new RoutingServer(config.name, config.serverIP, config.serverPort);
    }
}
