package net.spookly.dimensions.config;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

public final class ConfigValidator {
    private ConfigValidator() {
    }

    /**
     * Validate configuration, throwing ConfigException on any violations.
     */
    public static void validate(DimensionsConfig config) {
        List<String> errors = new ArrayList<>();
        if (config == null) {
            errors.add("config is required");
            throwIfErrors(errors);
            return;
        }

        validateServers(config, errors);
        validateOptions(config, errors);
        validateControl(config, errors);

        throwIfErrors(errors);
    }

    private static void validateServers(DimensionsConfig config, List<String> errors) {
        if (config.servers == null || config.servers.isEmpty()) {
            errors.add("servers must include at least one listen server");
            return;
        }
        Set<Integer> ports = new HashSet<>();
        for (int i = 0; i < config.servers.size(); i++) {
            DimensionsConfig.ServerConfig server = config.servers.get(i);
            String field = "servers[" + i + "]";
            if (server == null) {
                errors.add(field + " must not be empty");
                continue;
            }
            if (requirePort(errors, server.listenPort, field + ".listenPort") && !ports.add(server.listenPort)) {
                errors.add(field + ".listenPort is declared more than once: " + server.listenPort);
            }
            if (server.routingServers == null || server.routingServers.isEmpty()) {
                errors.add(field + ".routingServers must include at least one routing server");
                continue;
            }
            for (int j = 0; j < server.routingServers.size(); j++) {
                validateRoutingServer(server.routingServers.get(j), field + ".routingServers[" + j + "]", errors);
            }
        }
    }

    private static void validateRoutingServer(DimensionsConfig.RoutingServerConfig routingServer,
                                              String field,
                                              List<String> errors) {
        if (routingServer == null) {
            errors.add(field + " must not be empty");
            return;
        }
        requireNonBlank(errors, routingServer.name, field + ".name");
        requireNonBlank(errors, routingServer.serverIP, field + ".serverIP");
        requirePort(errors, routingServer.serverPort, field + ".serverPort");
    }

    private static void validateOptions(DimensionsConfig config, List<String> errors) {
        DimensionsConfig.OptionsConfig options = config.options;
        if (options == null) {
            return;
        }
        if (options.restApi != null && isTrue(options.restApi.enabled)) {
            requirePort(errors, options.restApi.port, "options.restApi.port");
        }
        if (options.connection != null) {
            optionalPositive(errors, options.connection.backendConnectTimeoutMs,
                    "options.connection.backendConnectTimeoutMs");
            optionalPositive(errors, options.connection.maxFailedAttempts, "options.connection.maxFailedAttempts");
            optionalPositive(errors, options.connection.disableSeconds, "options.connection.disableSeconds");
        }
        if (options.extensions != null) {
            requireNonBlank(errors, options.extensions.directory, "options.extensions.directory");
        }
    }

    private static void validateControl(DimensionsConfig config, List<String> errors) {
        DimensionsConfig.ControlConfig control = config.control;
        if (control == null) {
            return;
        }
        if (control.channel != null && control.channel.isBlank()) {
            errors.add("control.channel must not be blank");
        }
        if (control.redisUri != null && !control.redisUri.isBlank()
                && !control.redisUri.startsWith("redis://") && !control.redisUri.startsWith("rediss://")) {
            errors.add("control.redisUri must start with redis:// or rediss://");
        }
    }

    private static void requireNonBlank(List<String> errors, String value, String field) {
        if (value == null || value.trim().isEmpty()) {
            errors.add(field + " is required");
        }
    }

    private static boolean requirePort(List<String> errors, Integer value, String field) {
        if (value == null || value < 1 || value > 65535) {
            errors.add(field + " must be between 1 and 65535");
            return false;
        }
        return true;
    }

    private static void optionalPositive(List<String> errors, Integer value, String field) {
        if (value != null && value <= 0) {
            errors.add(field + " must be greater than 0");
        }
    }

    private static boolean isTrue(Boolean value) {
        return value != null && value;
    }

    private static void throwIfErrors(List<String> errors) {
        if (!errors.isEmpty()) {
            StringBuilder builder = new StringBuilder("Invalid config:\n");
            for (String error : errors) {
                builder.append("- ").append(error).append('\n');
            }
            throw new ConfigException(builder.toString());
        }
    }
}
