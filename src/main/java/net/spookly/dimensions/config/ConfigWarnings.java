package net.spookly.dimensions.config;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.PosixFileAttributeView;
import java.nio.file.attribute.PosixFilePermission;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Collects non-fatal configuration warnings.
 */
public final class ConfigWarnings {
    private ConfigWarnings() {
    }

    public static List<String> collect(DimensionsConfig config, Path configPath) {
        List<String> warnings = new ArrayList<>();
        if (config == null) {
            return warnings;
        }
        Set<Integer> listenPorts = new HashSet<>();
        Set<String> names = new HashSet<>();
        if (config.servers != null) {
            for (DimensionsConfig.ServerConfig server : config.servers) {
                listenPorts.add(server.listenPort);
                for (DimensionsConfig.RoutingServerConfig routingServer : server.routingServers) {
                    if (!names.add(routingServer.name)) {
                        warnings.add("routing server name declared more than once, last declaration wins: "
                                + routingServer.name);
                    }
                }
            }
        }
        DimensionsConfig.OptionsConfig options = config.options;
        if (options != null && options.restApiEnabled() && listenPorts.contains(options.restApi.port)) {
            warnings.add("options.restApi.port collides with a listen port: " + options.restApi.port);
        }
        if (config.control != null && hasPassword(config.control.redisUri)) {
            warnIfWorldReadable(warnings, configPath);
        }
        return warnings;
    }

    private static boolean hasPassword(String redisUri) {
        if (redisUri == null) {
            return false;
        }
        int at = redisUri.indexOf('@');
        int scheme = redisUri.indexOf("://");
        return scheme >= 0 && at > scheme;
    }

    private static void warnIfWorldReadable(List<String> warnings, Path configPath) {
        if (configPath == null || !Files.isRegularFile(configPath)) {
            return;
        }
        PosixFileAttributeView view = Files.getFileAttributeView(configPath, PosixFileAttributeView.class);
        if (view == null) {
            return;
        }
        try {
            Set<PosixFilePermission> permissions = view.readAttributes().permissions();
            if (permissions.contains(PosixFilePermission.OTHERS_READ)) {
                warnings.add("config holds a Redis password and is world-readable: " + configPath);
            }
        } catch (IOException ignored) {
            // Permissions are advisory only.
        }
    }
}
