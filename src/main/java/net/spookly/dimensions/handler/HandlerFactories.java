package net.spookly.dimensions.handler;

import java.util.Objects;
import java.util.function.Supplier;

/**
 * One constructor per handler kind. A hot-swap invokes the factory again and installs the result.
 */
public record HandlerFactories(Supplier<? extends CommandHandler> command,
                               Supplier<? extends ClientPacketHandler> clientPacketHandler,
                               Supplier<? extends BackendPacketHandler> backendPacketHandler) {
    public HandlerFactories {
        Objects.requireNonNull(command, "command");
        Objects.requireNonNull(clientPacketHandler, "clientPacketHandler");
        Objects.requireNonNull(backendPacketHandler, "backendPacketHandler");
    }

    public static HandlerFactories defaults() {
        return new HandlerFactories(
                ClientCommandHandler::new,
                DefaultClientPacketHandler::new,
                DefaultBackendPacketHandler::new
        );
    }
}
