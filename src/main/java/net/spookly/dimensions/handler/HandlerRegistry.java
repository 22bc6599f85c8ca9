package net.spookly.dimensions.handler;

import java.util.List;
import java.util.Objects;
import java.util.function.Supplier;

import net.spookly.dimensions.extension.LoadedExtension;
import net.spookly.dimensions.util.DimensionsLog;

/**
 * Currently active handlers, read by listen servers on every packet.
 *
 * <p>Each slot is a single volatile reference, so a swap is visible to the next lookup and a
 * caller that already holds the old instance finishes with it. A slot is never null.
 */
public final class HandlerRegistry {
    private final HandlerFactories factories;
    private final DimensionsLog log;
    private volatile CommandHandler command;
    private volatile ClientPacketHandler clientPacketHandler;
    private volatile BackendPacketHandler backendPacketHandler;
    private volatile List<LoadedExtension> extensions = List.of();

    /**
     * Build the initial handlers; a factory failure here is fatal since there is nothing to fall back to.
     */
    public HandlerRegistry(HandlerFactories factories, DimensionsLog log) {
        this.factories = Objects.requireNonNull(factories, "factories");
        this.log = log == null ? DimensionsLog.NOOP : log;
        this.command = requireInstance(factories.command().get(), "command");
        this.clientPacketHandler = requireInstance(factories.clientPacketHandler().get(), "clientPacketHandler");
        this.backendPacketHandler = requireInstance(factories.backendPacketHandler().get(), "backendPacketHandler");
    }

    public CommandHandler command() {
        return command;
    }

    public ClientPacketHandler clientPacketHandler() {
        return clientPacketHandler;
    }

    public BackendPacketHandler backendPacketHandler() {
        return backendPacketHandler;
    }

    public List<LoadedExtension> extensions() {
        return extensions;
    }

    public void setExtensions(List<LoadedExtension> loaded) {
        this.extensions = loaded == null ? List.of() : List.copyOf(loaded);
    }

    /**
     * Replace the command handler with a fresh instance; keeps the current one if construction fails.
     */
    public boolean swapCommandHandler() {
        CommandHandler next = construct(factories.command(), "Command Handler");
        if (next == null) {
            return false;
        }
        command = next;
        return true;
    }

    public boolean swapClientPacketHandler() {
        ClientPacketHandler next = construct(factories.clientPacketHandler(), "Client Packet Handler");
        if (next == null) {
            return false;
        }
        clientPacketHandler = next;
        return true;
    }

    public boolean swapBackendPacketHandler() {
        BackendPacketHandler next = construct(factories.backendPacketHandler(), "Backend Packet Handler");
        if (next == null) {
            return false;
        }
        backendPacketHandler = next;
        return true;
    }

    private <T> T construct(Supplier<? extends T> factory, String label) {
        try {
            return requireInstance(factory.get(), label);
        } catch (RuntimeException | LinkageError e) {
            log.error("Error loading " + label + ": ", e);
            return null;
        }
    }

    private static <T> T requireInstance(T instance, String label) {
        if (instance == null) {
            throw new IllegalStateException(label + " factory returned null");
        }
        return instance;
    }
}
