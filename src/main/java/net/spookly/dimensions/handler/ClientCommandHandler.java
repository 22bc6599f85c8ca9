package net.spookly.dimensions.handler;

import java.util.Locale;

import net.spookly.dimensions.registry.RoutingServer;

/**
 * Proxy-level chat commands: {@code /who}, {@code /dimensions} and {@code /<dimension>} to move.
 */
public final class ClientCommandHandler implements CommandHandler {
    @Override
    public boolean handle(ClientSession session, String commandLine) {
        if (commandLine == null) {
            return false;
        }
        String trimmed = commandLine.trim();
        if (!trimmed.startsWith("/") || trimmed.length() == 1) {
            return false;
        }
        String name = trimmed.substring(1).split("\\s+", 2)[0];
        switch (name.toLowerCase(Locale.ROOT)) {
            case "who":
                who(session);
                return true;
            case "dimensions":
                listDimensions(session);
                return true;
            default:
                return moveTo(session, name);
        }
    }

    private void who(ClientSession session) {
        int online = session.globalTracking().size();
        session.sendMessage("There " + (online == 1 ? "is 1 player" : "are " + online + " players")
                + " across all Dimensions.");
    }

    private void listDimensions(ClientSession session) {
        StringBuilder builder = new StringBuilder("Dimensions: ");
        boolean first = true;
        for (RoutingServer server : session.destinations().list()) {
            if (!first) {
                builder.append(", ");
            }
            first = false;
            builder.append(server.name())
                    .append(" (")
                    .append(session.serverDetails().clientCount(server.name()))
                    .append(')');
        }
        session.sendMessage(builder.toString());
    }

    private boolean moveTo(ClientSession session, String name) {
        RoutingServer target = session.destinations().findIgnoreCase(name);
        if (target == null) {
            return false;
        }
        RoutingServer current = session.destination();
        if (current != null && current.name().equals(target.name())) {
            session.sendMessage("You are already in " + target.name() + ".");
            return true;
        }
        session.sendMessage("Moving you to " + target.name() + "...");
        session.switchDestination(target);
        return true;
    }
}
