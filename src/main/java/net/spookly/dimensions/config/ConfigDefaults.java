package net.spookly.dimensions.config;

/**
 * Default configuration written when no config file exists, and the fallbacks applied to
 * optional sections of a loaded document.
 */
public final class ConfigDefaults {
    public static final String REDIS_URI = "redis://127.0.0.1:6379";
    public static final String CONTROL_CHANNEL = "dimensions_cli";
    public static final String EXTENSIONS_DIRECTORY = "extensions";
    public static final int BACKEND_CONNECT_TIMEOUT_MS = 5000;
    public static final int MAX_FAILED_ATTEMPTS = 3;
    public static final int DISABLE_SECONDS = 20;

    private static final String DEFAULT_YAML = """
            # Generated default Dimensions config.
            servers:
              - listenPort: 7777
                routingServers:
                  - name: world1
                    serverIP: 127.0.0.1
                    serverPort: 7778

            options:
              log:
                extensionLoad: true
                clientConnect: false
                clientDisconnect: false
                destinationErrors: true
              restApi:
                enabled: false
                port: 3000
              connection:
                backendConnectTimeoutMs: 5000
                maxFailedAttempts: 3
                disableSeconds: 20
              extensions:
                directory: extensions

            control:
              redisUri: "env:DIMENSIONS_REDIS_URI:redis://127.0.0.1:6379"
              channel: dimensions_cli
            """;

    private ConfigDefaults() {
    }

    public static String defaultYaml() {
        return DEFAULT_YAML;
    }

    /**
     * Fill optional sections that were left out of a document.
     */
    static void apply(DimensionsConfig config) {
        if (config.options == null) {
            config.options = new DimensionsConfig.OptionsConfig();
        }
        if (config.control == null) {
            config.control = new DimensionsConfig.ControlConfig();
        }
        if (config.control.redisUri == null || config.control.redisUri.isBlank()) {
            config.control.redisUri = REDIS_URI;
        }
        if (config.control.channel == null) {
            config.control.channel = CONTROL_CHANNEL;
        }
    }
}
