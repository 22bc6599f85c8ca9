package net.spookly.dimensions.api;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeSet;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.function.Supplier;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpHandler;
import com.sun.net.httpserver.HttpServer;
import net.spookly.dimensions.registry.DestinationRegistry;
import net.spookly.dimensions.registry.GlobalTracking;
import net.spookly.dimensions.registry.RoutingServer;
import net.spookly.dimensions.registry.ServerDetails;
import net.spookly.dimensions.registry.ServerDetailsRegistry;
import net.spookly.dimensions.registry.TrackedPlayer;
import net.spookly.dimensions.util.DimensionsLog;

/**
 * HTTP reporting surface over the shared registries.
 */
public final class RestApi implements ReportingSurface {
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final GlobalTracking globalTracking;
    private final ServerDetailsRegistry serverDetails;
    private final DestinationRegistry destinations;
    private final Supplier<Collection<Integer>> listenPorts;
    private final DimensionsLog log;
    private final ExecutorService executor = Executors.newFixedThreadPool(2);
    private volatile HttpServer server;
    private volatile int port;

    /**
     * Bind and start serving on {@code port}; port 0 picks a free one.
     *
     * @throws IllegalStateException when the port cannot be bound
     */
    public RestApi(int port,
                   GlobalTracking globalTracking,
                   ServerDetailsRegistry serverDetails,
                   DestinationRegistry destinations,
                   Supplier<Collection<Integer>> listenPorts,
                   DimensionsLog log) {
        this.globalTracking = Objects.requireNonNull(globalTracking, "globalTracking");
        this.serverDetails = Objects.requireNonNull(serverDetails, "serverDetails");
        this.destinations = Objects.requireNonNull(destinations, "destinations");
        this.listenPorts = Objects.requireNonNull(listenPorts, "listenPorts");
        this.log = log == null ? DimensionsLog.NOOP : log;
        this.port = port;
        this.server = bind(port);
    }

    public static ReportingSurfaceFactory factory(DimensionsLog log) {
        return (port, globalTracking, serverDetails, destinations, listenPorts) ->
                new RestApi(port, globalTracking, serverDetails, destinations, listenPorts, log);
    }

    private HttpServer bind(int port) {
        HttpServer created;
        try {
            created = HttpServer.create(new InetSocketAddress(port), 0);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to bind REST API on port " + port, e);
        }
        created.setExecutor(executor);
        created.createContext("/servers", new ServersHandler());
        created.createContext("/players", new PlayersHandler());
        created.createContext("/status", new StatusHandler());
        created.createContext("/", new NotFoundHandler());
        created.start();
        log.info("REST API listening on port " + created.getAddress().getPort());
        return created;
    }

    /**
     * Rebind when the configured port changed; the same port keeps the running listener.
     */
    @Override
    public synchronized void handleReload(int newPort) {
        if (newPort == port && server != null) {
            return;
        }
        HttpServer next = bind(newPort);
        HttpServer previous = server;
        server = next;
        port = newPort;
        if (previous != null) {
            previous.stop(0);
        }
    }

    @Override
    public synchronized void stop() {
        HttpServer current = server;
        server = null;
        if (current != null) {
            current.stop(0);
            log.info("REST API stopped");
        }
        executor.shutdown();
    }

    /**
     * Port from the configuration, as last passed to the constructor or {@link #handleReload(int)}.
     */
    public int port() {
        return port;
    }

    /**
     * Port actually bound, or -1 once stopped.
     */
    public int boundPort() {
        HttpServer current = server;
        return current == null ? -1 : current.getAddress().getPort();
    }

    private abstract static class GetHandler implements HttpHandler {
        private final String path;

        GetHandler(String path) {
            this.path = path;
        }

        @Override
        public final void handle(HttpExchange exchange) throws IOException {
            try {
                if (!path.equals(exchange.getRequestURI().getPath())) {
                    writeResponse(exchange, 404, ApiResponse.error("not found"));
                    return;
                }
                if (!"GET".equalsIgnoreCase(exchange.getRequestMethod())) {
                    writeResponse(exchange, 405, ApiResponse.error("method not allowed"));
                    return;
                }
                writeResponse(exchange, 200, ApiResponse.ok(body()));
            } catch (RuntimeException e) {
                writeResponse(exchange, 500, ApiResponse.error("internal error"));
            } finally {
                exchange.close();
            }
        }

        protected abstract Object body();
    }

    private final class ServersHandler extends GetHandler {
        ServersHandler() {
            super("/servers");
        }

        @Override
        protected Object body() {
            List<Map<String, Object>> servers = new ArrayList<>();
            for (RoutingServer destination : destinations.list()) {
                ServerDetails details = serverDetails.get(destination.name());
                Map<String, Object> view = new LinkedHashMap<>();
                view.put("name", destination.name());
                view.put("serverIP", destination.serverIP());
                view.put("serverPort", destination.serverPort());
                view.put("clientCount", details == null ? 0 : details.clientCount());
                view.put("failedConnAttempts", details == null ? 0 : details.failedConnAttempts());
                view.put("disabled", details != null && details.disabled());
                servers.add(view);
            }
            return servers;
        }
    }

    private final class PlayersHandler extends GetHandler {
        PlayersHandler() {
            super("/players");
        }

        @Override
        protected Object body() {
            List<Map<String, Object>> players = new ArrayList<>();
            for (TrackedPlayer player : globalTracking.snapshot().values()) {
                Map<String, Object> view = new LinkedHashMap<>();
                view.put("name", player.name());
                view.put("destination", player.destination());
                view.put("listenPort", player.listenPort());
                view.put("joinedAt", player.joinedAt() == null ? null : player.joinedAt().toString());
                players.add(view);
            }
            return players;
        }
    }

    private final class StatusHandler extends GetHandler {
        StatusHandler() {
            super("/status");
        }

        @Override
        protected Object body() {
            Map<String, Object> status = new LinkedHashMap<>();
            status.put("listenPorts", new TreeSet<>(listenPorts.get()));
            status.put("destinations", destinations.size());
            status.put("clients", serverDetails.totalClients());
            status.put("players", globalTracking.size());
            return status;
        }
    }

    private static final class NotFoundHandler implements HttpHandler {
        @Override
        public void handle(HttpExchange exchange) throws IOException {
            try {
                writeResponse(exchange, 404, ApiResponse.error("not found"));
            } finally {
                exchange.close();
            }
        }
    }

    private static void writeResponse(HttpExchange exchange, int status, ApiResponse response) throws IOException {
        byte[] payload = MAPPER.writeValueAsBytes(response);
        exchange.getResponseHeaders().add("Content-Type", "application/json");
        exchange.sendResponseHeaders(status, payload.length);
        try (OutputStream output = exchange.getResponseBody()) {
            output.write(payload);
        }
    }
}
