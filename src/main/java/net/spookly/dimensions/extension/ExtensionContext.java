package net.spookly.dimensions.extension;

import net.spookly.dimensions.handler.HandlerRegistry;
import net.spookly.dimensions.registry.DestinationRegistry;
import net.spookly.dimensions.registry.GlobalTracking;
import net.spookly.dimensions.registry.ServerDetailsRegistry;
import net.spookly.dimensions.util.DimensionsLog;

/**
 * Shared state handed to an extension when it is loaded.
 */
public record ExtensionContext(HandlerRegistry handlers,
                               DestinationRegistry destinations,
                               ServerDetailsRegistry serverDetails,
                               GlobalTracking globalTracking,
                               DimensionsLog log) {
}
