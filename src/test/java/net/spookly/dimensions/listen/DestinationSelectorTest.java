package net.spookly.dimensions.listen;

import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;

import java.util.List;

import net.spookly.dimensions.registry.RoutingServer;
import net.spookly.dimensions.registry.ServerDetailsRegistry;
import org.junit.jupiter.api.Test;

class DestinationSelectorTest {
    private final RoutingServer world1 = new RoutingServer("world1", "127.0.0.1", 7778);
    private final RoutingServer world2 = new RoutingServer("world2", "127.0.0.1", 7780);
    private final RoutingServer world3 = new RoutingServer("world3", "127.0.0.1", 7782);

    @Test
    void picksTheLeastLoadedDestination() {
        ServerDetailsRegistry details = new ServerDetailsRegistry();
        details.getOrCreate("world1").incrementClients();
        details.getOrCreate("world1").incrementClients();
        details.getOrCreate("world2").incrementClients();
        details.getOrCreate("world3").incrementClients();

        assertSame(world2, DestinationSelector.select(List.of(world1, world2, world3), details));
    }

    @Test
    void poolOrderBreaksTiesAndMissingRowsCountAsEmpty() {
        assertSame(world1, DestinationSelector.select(List.of(world1, world2), new ServerDetailsRegistry()));
    }

    @Test
    void skipsDisabledDestinations() {
        ServerDetailsRegistry details = new ServerDetailsRegistry();
        details.getOrCreate("world1").setDisabled(true);
        details.getOrCreate("world2").incrementClients();

        assertSame(world2, DestinationSelector.select(List.of(world1, world2), details));

        details.getOrCreate("world2").setDisabled(true);
        assertNull(DestinationSelector.select(List.of(world1, world2), details));
    }
}
