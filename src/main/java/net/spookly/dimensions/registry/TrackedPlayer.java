package net.spookly.dimensions.registry;

import java.time.Instant;

import lombok.Value;
import lombok.With;
import lombok.experimental.Accessors;

/**
 * Presence entry for a player name claimed somewhere in the fleet.
 */
@Value
@With
@Accessors(fluent = true)
public class TrackedPlayer {
    String name;
    String destination;
    int listenPort;
    Instant joinedAt;
}
