package net.spookly.dimensions.config;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.List;

import org.junit.jupiter.api.Test;

class ConfigValidatorTest {
    @Test
    void acceptsMinimalConfig() {
        assertDoesNotThrow(() -> ConfigValidator.validate(config(entry(7777, routing("world1", 7778)))));
    }

    @Test
    void requiresAtLeastOneServer() {
        DimensionsConfig config = new DimensionsConfig();
        config.servers = new ArrayList<>();

        ConfigException exception = assertThrows(ConfigException.class, () -> ConfigValidator.validate(config));

        assertTrue(exception.getMessage().contains("servers must include at least one listen server"));
    }

    @Test
    void collectsEveryViolation() {
        DimensionsConfig config = config(
                entry(7777, routing("world1", 7778)),
                entry(7777, routing(" ", 0)),
                entry(70000)
        );

        ConfigException exception = assertThrows(ConfigException.class, () -> ConfigValidator.validate(config));

        String message = exception.getMessage();
        assertTrue(message.contains("servers[1].listenPort is declared more than once: 7777"));
        assertTrue(message.contains("servers[1].routingServers[0].name is required"));
        assertTrue(message.contains("servers[1].routingServers[0].serverPort must be between 1 and 65535"));
        assertTrue(message.contains("servers[2].listenPort must be between 1 and 65535"));
        assertTrue(message.contains("servers[2].routingServers must include at least one routing server"));
    }

    @Test
    void requiresRestPortOnlyWhenEnabled() {
        DimensionsConfig config = config(entry(7777, routing("world1", 7778)));
        config.options = new DimensionsConfig.OptionsConfig();
        config.options.restApi = new DimensionsConfig.RestApiOptions();
        config.options.restApi.enabled = false;
        assertDoesNotThrow(() -> ConfigValidator.validate(config));

        config.options.restApi.enabled = true;
        ConfigException exception = assertThrows(ConfigException.class, () -> ConfigValidator.validate(config));
        assertTrue(exception.getMessage().contains("options.restApi.port must be between 1 and 65535"));
    }

    @Test
    void rejectsNonPositiveConnectionOptions() {
        DimensionsConfig config = config(entry(7777, routing("world1", 7778)));
        config.options = new DimensionsConfig.OptionsConfig();
        config.options.connection = new DimensionsConfig.ConnectionOptions();
        config.options.connection.maxFailedAttempts = 0;

        ConfigException exception = assertThrows(ConfigException.class, () -> ConfigValidator.validate(config));

        assertTrue(exception.getMessage().contains("options.connection.maxFailedAttempts must be greater than 0"));
    }

    @Test
    void rejectsBlankChannelAndForeignScheme() {
        DimensionsConfig config = config(entry(7777, routing("world1", 7778)));
        config.control = new DimensionsConfig.ControlConfig();
        config.control.channel = "";
        config.control.redisUri = "http://localhost:6379";

        ConfigException exception = assertThrows(ConfigException.class, () -> ConfigValidator.validate(config));

        assertTrue(exception.getMessage().contains("control.channel must not be blank"));
        assertTrue(exception.getMessage().contains("control.redisUri must start with redis:// or rediss://"));
    }

    static DimensionsConfig config(DimensionsConfig.ServerConfig... entries) {
        DimensionsConfig config = new DimensionsConfig();
        config.servers = new ArrayList<>(List.of(entries));
        return config;
    }

    static DimensionsConfig.ServerConfig entry(int port, DimensionsConfig.RoutingServerConfig... routing) {
        DimensionsConfig.ServerConfig entry = new DimensionsConfig.ServerConfig();
        entry.listenPort = port;
        entry.routingServers = new ArrayList<>(List.of(routing));
        return entry;
    }

    static DimensionsConfig.RoutingServerConfig routing(String name, int port) {
        DimensionsConfig.RoutingServerConfig routing = new DimensionsConfig.RoutingServerConfig();
        routing.name = name;
        routing.serverIP = "127.0.0.1";
        routing.serverPort = port;
        return routing;
    }
}
