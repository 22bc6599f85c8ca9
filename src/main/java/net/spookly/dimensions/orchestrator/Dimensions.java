package net.spookly.dimensions.orchestrator;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentSkipListMap;

import lombok.Builder;
import lombok.Getter;
import lombok.NonNull;
import lombok.experimental.Accessors;
import net.spookly.dimensions.api.ReportingSurface;
import net.spookly.dimensions.api.ReportingSurfaceFactory;
import net.spookly.dimensions.config.ConfigSource;
import net.spookly.dimensions.config.DimensionsConfig;
import net.spookly.dimensions.extension.ClassLoaderModuleLoader;
import net.spookly.dimensions.extension.ExtensionContext;
import net.spookly.dimensions.extension.ExtensionManager;
import net.spookly.dimensions.extension.ExtensionSource;
import net.spookly.dimensions.extension.ModuleLoader;
import net.spookly.dimensions.handler.HandlerFactories;
import net.spookly.dimensions.handler.HandlerRegistry;
import net.spookly.dimensions.listen.ListenServer;
import net.spookly.dimensions.listen.ListenServerFactory;
import net.spookly.dimensions.registry.DestinationRegistry;
import net.spookly.dimensions.registry.GlobalTracking;
import net.spookly.dimensions.registry.ServerDetailsRegistry;
import net.spookly.dimensions.registry.TrackedPlayer;
import net.spookly.dimensions.util.ConsoleLog;
import net.spookly.dimensions.util.DimensionsLog;

/**
 * Owns the live listen servers and the shared registries, and applies reloads to them.
 *
 * <p>Every operation after {@link #start()} is expected to run on one thread at a time; the
 * control channel dispatcher provides that thread.
 */
@Accessors(fluent = true)
public final class Dimensions {
    @Getter
    private final DimensionsConfig.OptionsConfig options;
    @Getter
    private final DestinationRegistry destinations = new DestinationRegistry();
    @Getter
    private final ServerDetailsRegistry serverDetails = new ServerDetailsRegistry();
    @Getter
    private final GlobalTracking globalTracking = new GlobalTracking();
    @Getter
    private final HandlerRegistry handlers;
    @Getter
    private final ExtensionManager extensionManager;
    private final DimensionsConfig initialConfig;
    private final ConfigSource configSource;
    private final ListenServerFactory listenServerFactory;
    private final ReportingSurfaceFactory reportingSurfaceFactory;
    private final DimensionsLog log;
    private final Map<Integer, ListenServer> listenServers = new ConcurrentSkipListMap<>();
    private ReportingSurface restApi;
    private boolean started;
    private boolean stopped;

    @Builder
    private Dimensions(@NonNull DimensionsConfig config,
                       @NonNull ConfigSource configSource,
                       @NonNull ListenServerFactory listenServerFactory,
                       HandlerFactories handlerFactories,
                       ExtensionSource extensionSource,
                       ModuleLoader moduleLoader,
                       ReportingSurfaceFactory reportingSurfaceFactory,
                       DimensionsLog log) {
        this.initialConfig = config;
        this.configSource = configSource;
        this.listenServerFactory = listenServerFactory;
        this.reportingSurfaceFactory = reportingSurfaceFactory;
        this.log = log == null ? ConsoleLog.INSTANCE : log;
        DimensionsConfig.OptionsConfig liveOptions = config.options == null
                ? new DimensionsConfig.OptionsConfig()
                : config.options;
        this.options = liveOptions;
        this.handlers = new HandlerRegistry(
                handlerFactories == null ? HandlerFactories.defaults() : handlerFactories, this.log);
        ModuleLoader loader = moduleLoader != null
                ? moduleLoader
                : new ClassLoaderModuleLoader(() -> Path.of(liveOptions.extensionsDirectory()),
                        Dimensions.class.getClassLoader());
        ExtensionContext context = new ExtensionContext(handlers, destinations, serverDetails, globalTracking, this.log);
        this.extensionManager = new ExtensionManager(handlers, extensionSource, liveOptions, context, loader, this.log);
    }

    /**
     * Load extensions, bind every configured port and start the REST API when enabled.
     *
     * @throws IllegalStateException when called twice or when a port cannot be bound
     */
    public void start() {
        if (started) {
            throw new IllegalStateException("Dimensions already started");
        }
        started = true;
        extensionManager.loadExtensions();
        if (initialConfig.servers != null) {
            for (DimensionsConfig.ServerConfig entry : initialConfig.servers) {
                createListenServer(entry);
            }
        }
        if (options.restApiEnabled()) {
            restApi = createRestApi(options.restApi.port);
        }
    }

    /**
     * Log how many clients each destination holds and which names are tracked. Read-only.
     *
     * @return the per-destination line
     */
    public String printServerCounts() {
        StringBuilder players = new StringBuilder("Tracked players:");
        for (TrackedPlayer player : globalTracking.snapshot().values()) {
            players.append(' ').append(player.name())
                    .append('@').append(player.destination())
                    .append(':').append(player.listenPort());
        }
        StringBuilder info = new StringBuilder();
        for (String name : destinations.names()) {
            info.append('[').append(name).append(": ").append(serverDetails.clientCount(name)).append("] ");
        }
        log.info(players.toString());
        log.info(info.toString());
        return info.toString();
    }

    public boolean reloadClientHandlers() {
        return handlers.swapClientPacketHandler();
    }

    public boolean reloadBackendHandlers() {
        return handlers.swapBackendPacketHandler();
    }

    public boolean reloadCommandHandler() {
        return handlers.swapCommandHandler();
    }

    public int reloadExtensions() {
        return extensionManager.reloadExtensions();
    }

    public int passOnReloadToExtensions(String command) {
        return extensionManager.passOnReload(command);
    }

    /**
     * Re-read the configuration and reconcile the live listen servers against it.
     *
     * <p>Ports kept by the new configuration are updated in place, ports it drops are shut down and
     * new ports are bound, in that order, then the option groups are merged. A failure stops the
     * pass where it happened; steps already applied stay applied.
     *
     * @return true when the whole pass completed
     */
    public boolean reloadServers() {
        try {
            DimensionsConfig next = configSource.load();
            reloadRestApi(next.options);

            List<DimensionsConfig.ServerConfig> entries = next.servers == null ? List.of() : next.servers;
            List<ReloadTicket> tickets = new ArrayList<>();
            Set<Integer> roster = new HashSet<>();
            for (int i = 0; i < entries.size(); i++) {
                DimensionsConfig.ServerConfig entry = entries.get(i);
                int port = entry.listenPort;
                ListenServer existing = listenServers.get(port);
                if (existing != null) {
                    existing.updateInfo(entry);
                    registerDestinations(existing);
                } else {
                    tickets.add(new ReloadTicket(port, i));
                }
                roster.add(port);
            }

            for (Integer port : new ArrayList<>(listenServers.keySet())) {
                if (!roster.contains(port)) {
                    listenServers.get(port).shutdown();
                    listenServers.remove(port);
                }
            }

            for (ReloadTicket ticket : tickets) {
                createListenServer(entries.get(ticket.topologyIndex()));
            }

            options.mergeFrom(next.options);
        } catch (RuntimeException e) {
            log.error("Error loading Config: " + e);
            return false;
        }
        log.notice("Reloaded Config.");
        return true;
    }

    private void reloadRestApi(DimensionsConfig.OptionsConfig next) {
        if (next == null || next.restApi == null) {
            return;
        }
        if (next.restApiEnabled()) {
            if (restApi != null) {
                restApi.handleReload(next.restApi.port);
            } else {
                restApi = createRestApi(next.restApi.port);
            }
        } else if (restApi != null) {
            restApi.stop();
            restApi = null;
        }
    }

    private ReportingSurface createRestApi(int port) {
        if (reportingSurfaceFactory == null) {
            log.error("REST API is enabled but no reporting surface is available");
            return null;
        }
        return reportingSurfaceFactory.create(port, globalTracking, serverDetails, destinations, this::listenPorts);
    }

    private void createListenServer(DimensionsConfig.ServerConfig entry) {
        ListenServer server = listenServerFactory.create(
                entry, serverDetails, handlers, destinations, options, globalTracking);
        listenServers.put(server.port(), server);
        registerDestinations(server);
    }

    private void registerDestinations(ListenServer server) {
        destinations.registerAll(server.routingServers());
        server.routingServers().forEach(destination -> serverDetails.getOrCreate(destination.name()));
    }

    /**
     * Unload extensions, release every port and stop the REST API. Later calls do nothing.
     */
    public void shutdown() {
        if (stopped) {
            return;
        }
        stopped = true;
        extensionManager.unloadExtensions();
        for (ListenServer server : listenServers.values()) {
            server.shutdown();
        }
        listenServers.clear();
        if (restApi != null) {
            restApi.stop();
            restApi = null;
        }
    }

    /**
     * Read-only view of the live listen servers keyed by port.
     */
    public Map<Integer, ListenServer> listenServers() {
        return Collections.unmodifiableMap(listenServers);
    }

    public List<Integer> listenPorts() {
        return List.copyOf(listenServers.keySet());
    }

    public ReportingSurface restApi() {
        return restApi;
    }
}
