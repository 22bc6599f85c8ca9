package net.spookly.dimensions.registry;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

import lombok.NonNull;

/**
 * Fleet-wide index of backend destinations by name, shared by every listen server.
 *
 * <p>A name maps to at most one destination; registering a name again replaces the entry.
 */
public final class DestinationRegistry {
    private final Map<String, RoutingServer> servers = new ConcurrentHashMap<>();

    public void register(@NonNull RoutingServer server) {
        servers.put(server.name(), server);
    }

    public void registerAll(List<RoutingServer> pool) {
        for (RoutingServer server : pool) {
            register(server);
        }
    }

    public RoutingServer get(String name) {
        return name == null ? null : servers.get(name);
    }

    /**
     * Case-insensitive lookup used for player-typed destination names.
     */
    public RoutingServer findIgnoreCase(String name) {
        if (name == null) {
            return null;
        }
        RoutingServer exact = servers.get(name);
        if (exact != null) {
            return exact;
        }
        for (RoutingServer server : servers.values()) {
            if (server.name().equalsIgnoreCase(name)) {
                return server;
            }
        }
        return null;
    }

    public boolean contains(String name) {
        return name != null && servers.containsKey(name);
    }

    /**
     * Registered names in sorted order.
     */
    public List<String> names() {
        List<String> names = new ArrayList<>(servers.keySet());
        Collections.sort(names);
        return names;
    }

    public List<RoutingServer> list() {
        List<RoutingServer> result = new ArrayList<>();
        for (String name : names()) {
            RoutingServer server = servers.get(name);
            if (server != null) {
                result.add(server);
            }
        }
        return result;
    }

    public int size() {
        return servers.size();
    }
}
