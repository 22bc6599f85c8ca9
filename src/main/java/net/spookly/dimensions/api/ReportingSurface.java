package net.spookly.dimensions.api;

/**
 * Read-only fleet status endpoint that follows the configured port across reloads.
 */
public interface ReportingSurface {
    /**
     * Called during a topology reload with the port from the new configuration.
     */
    void handleReload(int port);

    void stop();
}
