package net.spookly.dimensions.handler;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.concurrent.atomic.AtomicInteger;

import net.spookly.dimensions.util.RecordingLog;
import org.junit.jupiter.api.Test;

class HandlerRegistryTest {
    @Test
    void swapInstallsAFreshInstance() {
        HandlerRegistry registry = new HandlerRegistry(HandlerFactories.defaults(), null);
        CommandHandler before = registry.command();

        assertTrue(registry.swapCommandHandler());

        assertNotSame(before, registry.command());
    }

    @Test
    void failedSwapKeepsThePreviousInstanceAndLogs() {
        AtomicInteger builds = new AtomicInteger();
        HandlerFactories factories = new HandlerFactories(
                ClientCommandHandler::new,
                () -> {
                    if (builds.incrementAndGet() > 1) {
                        throw new IllegalStateException("broken build");
                    }
                    return new DefaultClientPacketHandler();
                },
                DefaultBackendPacketHandler::new);
        RecordingLog log = new RecordingLog();
        HandlerRegistry registry = new HandlerRegistry(factories, log);
        ClientPacketHandler before = registry.clientPacketHandler();

        assertFalse(registry.swapClientPacketHandler());

        assertSame(before, registry.clientPacketHandler());
        assertTrue(log.errors.get(0).startsWith("Error loading Client Packet Handler: "));
    }

    @Test
    void factoryReturningNullCountsAsFailure() {
        AtomicInteger builds = new AtomicInteger();
        HandlerFactories factories = new HandlerFactories(
                ClientCommandHandler::new,
                DefaultClientPacketHandler::new,
                () -> builds.incrementAndGet() > 1 ? null : new DefaultBackendPacketHandler());
        HandlerRegistry registry = new HandlerRegistry(factories, null);
        BackendPacketHandler before = registry.backendPacketHandler();

        assertFalse(registry.swapBackendPacketHandler());

        assertSame(before, registry.backendPacketHandler());
    }

    @Test
    void commandSwapLeavesPacketHandlersAlone() {
        HandlerRegistry registry = new HandlerRegistry(HandlerFactories.defaults(), null);
        ClientPacketHandler client = registry.clientPacketHandler();
        BackendPacketHandler backend = registry.backendPacketHandler();

        registry.swapCommandHandler();

        assertSame(client, registry.clientPacketHandler());
        assertSame(backend, registry.backendPacketHandler());
    }

    @Test
    void initialConstructionFailureIsFatal() {
        HandlerFactories factories = new HandlerFactories(
                () -> null, DefaultClientPacketHandler::new, DefaultBackendPacketHandler::new);

        assertThrows(IllegalStateException.class, () -> new HandlerRegistry(factories, null));
    }
}
