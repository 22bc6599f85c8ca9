package net.spookly.dimensions.listen;

import net.spookly.dimensions.config.DimensionsConfig;
import net.spookly.dimensions.handler.HandlerRegistry;
import net.spookly.dimensions.registry.DestinationRegistry;
import net.spookly.dimensions.registry.GlobalTracking;
import net.spookly.dimensions.registry.ServerDetailsRegistry;

/**
 * Creates a bound listen server; the registries and options are shared by reference, not copied.
 */
@FunctionalInterface
public interface ListenServerFactory {
    /**
     * @throws IllegalStateException when the port cannot be bound
     */
    ListenServer create(DimensionsConfig.ServerConfig entry,
                        ServerDetailsRegistry serverDetails,
                        HandlerRegistry handlers,
                        DestinationRegistry destinations,
                        DimensionsConfig.OptionsConfig options,
                        GlobalTracking globalTracking);
}
