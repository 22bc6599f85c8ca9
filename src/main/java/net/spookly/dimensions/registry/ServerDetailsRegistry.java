package net.spookly.dimensions.registry;

import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;

import lombok.NonNull;

/**
 * Per-destination runtime counters keyed by destination name.
 *
 * <p>Rows are created the first time a destination is seen and are kept after the destination
 * leaves the topology, so counters survive a destination being removed and re-added.
 */
public final class ServerDetailsRegistry {
    private final Map<String, ServerDetails> details = new ConcurrentHashMap<>();

    public ServerDetails getOrCreate(@NonNull String name) {
        return details.computeIfAbsent(name, ignored -> new ServerDetails());
    }

    public ServerDetails get(String name) {
        return name == null ? null : details.get(name);
    }

    /**
     * Client count for a destination, zero when no row exists yet.
     */
    public int clientCount(String name) {
        ServerDetails row = get(name);
        return row == null ? 0 : row.clientCount();
    }

    public int totalClients() {
        int total = 0;
        for (ServerDetails row : details.values()) {
            total += row.clientCount();
        }
        return total;
    }

    /**
     * Sorted read-only view of the rows.
     */
    public Map<String, ServerDetails> snapshot() {
        return Collections.unmodifiableMap(new TreeMap<>(details));
    }

    public int size() {
        return details.size();
    }
}
