package net.spookly.dimensions.config;

import java.util.List;

public class DimensionsConfig {
    public List<ServerConfig> servers;
    public OptionsConfig options;
    public ControlConfig control;

    /**
     * One listening port and the destinations it may route new clients to.
     */
    public static class ServerConfig {
        public Integer listenPort;
        public List<RoutingServerConfig> routingServers;
    }

    public static class RoutingServerConfig {
        public String name;
        public String serverIP;
        public Integer serverPort;
    }

    /**
     * Option groups shared by reference with every listen server.
     *
     * <p>A reload merges groups into the live instance instead of replacing it, so holders of the
     * reference observe new values without being rebuilt.
     */
    public static class OptionsConfig {
        public LogOptions log;
        public RestApiOptions restApi;
        public ConnectionOptions connection;
        public ExtensionOptions extensions;

        /**
         * Overwrite every group present in {@code update}; groups it omits keep their current value.
         */
        public void mergeFrom(OptionsConfig update) {
            if (update == null) {
                return;
            }
            if (update.log != null) {
                log = update.log;
            }
            if (update.restApi != null) {
                restApi = update.restApi;
            }
            if (update.connection != null) {
                connection = update.connection;
            }
            if (update.extensions != null) {
                extensions = update.extensions;
            }
        }

        public boolean logExtensionLoad() {
            return log != null && Boolean.TRUE.equals(log.extensionLoad);
        }

        public boolean logClientConnect() {
            return log != null && Boolean.TRUE.equals(log.clientConnect);
        }

        public boolean logClientDisconnect() {
            return log != null && Boolean.TRUE.equals(log.clientDisconnect);
        }

        public boolean logDestinationErrors() {
            return log == null || log.destinationErrors == null || log.destinationErrors;
        }

        public int backendConnectTimeoutMs() {
            return connection == null || connection.backendConnectTimeoutMs == null
                    ? ConfigDefaults.BACKEND_CONNECT_TIMEOUT_MS
                    : connection.backendConnectTimeoutMs;
        }

        public int maxFailedAttempts() {
            return connection == null || connection.maxFailedAttempts == null
                    ? ConfigDefaults.MAX_FAILED_ATTEMPTS
                    : connection.maxFailedAttempts;
        }

        public int disableSeconds() {
            return connection == null || connection.disableSeconds == null
                    ? ConfigDefaults.DISABLE_SECONDS
                    : connection.disableSeconds;
        }

        public String extensionsDirectory() {
            return extensions == null || extensions.directory == null
                    ? ConfigDefaults.EXTENSIONS_DIRECTORY
                    : extensions.directory;
        }

        public boolean restApiEnabled() {
            return restApi != null && Boolean.TRUE.equals(restApi.enabled);
        }
    }

    public static class LogOptions {
        public Boolean extensionLoad;
        public Boolean clientConnect;
        public Boolean clientDisconnect;
        public Boolean destinationErrors;
    }

    public static class RestApiOptions {
        public Boolean enabled;
        public Integer port;
    }

    public static class ConnectionOptions {
        public Integer backendConnectTimeoutMs;
        /**
         * Consecutive failed backend connects after which a destination is taken out of rotation.
         */
        public Integer maxFailedAttempts;
        public Integer disableSeconds;
    }

    public static class ExtensionOptions {
        public String directory;
    }

    /**
     * Redis pub/sub control channel, read once at startup.
     */
    public static class ControlConfig {
        public String redisUri;
        public String channel;
    }
}
