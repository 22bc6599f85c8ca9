package net.spookly.dimensions.api;

import java.util.Collection;
import java.util.function.Supplier;

import net.spookly.dimensions.registry.DestinationRegistry;
import net.spookly.dimensions.registry.GlobalTracking;
import net.spookly.dimensions.registry.ServerDetailsRegistry;

/**
 * Creates and starts a reporting surface over the shared registries.
 */
@FunctionalInterface
public interface ReportingSurfaceFactory {
    ReportingSurface create(int port,
                            GlobalTracking globalTracking,
                            ServerDetailsRegistry serverDetails,
                            DestinationRegistry destinations,
                            Supplier<Collection<Integer>> listenPorts);
}
