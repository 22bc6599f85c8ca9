package net.spookly.dimensions.registry;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;

import java.util.List;

import org.junit.jupiter.api.Test;

class DestinationRegistryTest {
    @Test
    void reRegisteringANameReplacesTheEntry() {
        DestinationRegistry registry = new DestinationRegistry();
        RoutingServer original = new RoutingServer("world1", "10.0.0.1", 7778);
        RoutingServer replacement = new RoutingServer("world1", "10.0.0.2", 7778);

        registry.register(original);
        registry.register(replacement);

        assertEquals(1, registry.size());
        assertSame(replacement, registry.get("world1"));
    }

    @Test
    void listsInNameOrderAndFindsIgnoringCase() {
        DestinationRegistry registry = new DestinationRegistry();
        RoutingServer arena = new RoutingServer("Arena", "10.0.0.3", 7780);
        registry.registerAll(List.of(new RoutingServer("world1", "10.0.0.1", 7778), arena));

        assertEquals(List.of("Arena", "world1"), registry.names());
        assertSame(arena, registry.findIgnoreCase("arena"));
        assertNull(registry.findIgnoreCase("lobby"));
    }
}
