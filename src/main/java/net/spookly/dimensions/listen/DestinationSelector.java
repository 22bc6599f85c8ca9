package net.spookly.dimensions.listen;

import java.util.List;

import net.spookly.dimensions.registry.RoutingServer;
import net.spookly.dimensions.registry.ServerDetails;
import net.spookly.dimensions.registry.ServerDetailsRegistry;

/**
 * Picks the destination for a new client: the enabled destination with the fewest clients,
 * earlier pool entries winning ties.
 */
public final class DestinationSelector {
    private DestinationSelector() {
    }

    /**
     * @return the chosen destination, or null when every destination is disabled or the pool is empty
     */
    public static RoutingServer select(List<RoutingServer> pool, ServerDetailsRegistry serverDetails) {
        RoutingServer best = null;
        int bestCount = Integer.MAX_VALUE;
        for (RoutingServer candidate : pool) {
            ServerDetails details = serverDetails.get(candidate.name());
            if (details != null && details.disabled()) {
                continue;
            }
            int count = details == null ? 0 : details.clientCount();
            if (count < bestCount) {
                best = candidate;
                bestCount = count;
            }
        }
        return best;
    }
}
