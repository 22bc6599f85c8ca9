package net.spookly.dimensions.registry;

import java.util.Collections;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;

import lombok.NonNull;

/**
 * Fleet-wide table of player names currently in use, shared by every listen server so a name
 * can only be used once across all dimensions.
 *
 * <p>Names compare case-insensitively.
 */
public final class GlobalTracking {
    private final Map<String, TrackedPlayer> names = new ConcurrentHashMap<>();

    /**
     * Claim a name for a player, returning false when another session already holds it.
     */
    public boolean tryClaim(@NonNull TrackedPlayer player) {
        return names.putIfAbsent(key(player.name()), player) == null;
    }

    /**
     * Release a name, only if it is still held by {@code claimant}.
     */
    public boolean release(String name, TrackedPlayer claimant) {
        if (name == null || claimant == null) {
            return false;
        }
        return names.remove(key(name), claimant);
    }

    /**
     * Record that a tracked player moved to another destination.
     */
    public TrackedPlayer moveTo(String name, String destination) {
        if (name == null) {
            return null;
        }
        return names.computeIfPresent(key(name), (ignored, current) -> current.withDestination(destination));
    }

    public TrackedPlayer get(String name) {
        return name == null ? null : names.get(key(name));
    }

    public boolean contains(String name) {
        return name != null && names.containsKey(key(name));
    }

    public int size() {
        return names.size();
    }

    /**
     * Sorted read-only view keyed by the normalized name.
     */
    public Map<String, TrackedPlayer> snapshot() {
        return Collections.unmodifiableMap(new TreeMap<>(names));
    }

    private static String key(String name) {
        return name.trim().toLowerCase(Locale.ROOT);
    }
}
