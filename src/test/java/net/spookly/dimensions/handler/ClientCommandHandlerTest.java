package net.spookly.dimensions.handler;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Instant;
import java.util.List;

import net.spookly.dimensions.registry.RoutingServer;
import net.spookly.dimensions.registry.TrackedPlayer;
import org.junit.jupiter.api.Test;

class ClientCommandHandlerTest {
    private final ClientCommandHandler handler = new ClientCommandHandler();

    @Test
    void whoCountsPlayersAcrossTheFleet() {
        FakeClientSession session = FakeClientSession.standalone();
        session.globalTracking().tryClaim(new TrackedPlayer("Steve", "world1", 7777, Instant.EPOCH));

        assertTrue(handler.handle(session, "/who"));
        session.globalTracking().tryClaim(new TrackedPlayer("Alex", "world2", 7779, Instant.EPOCH));
        assertTrue(handler.handle(session, "/WHO"));

        assertEquals(List.of(
                "There is 1 player across all Dimensions.",
                "There are 2 players across all Dimensions."
        ), session.messages);
    }

    @Test
    void dimensionsListsEveryDestinationWithItsClientCount() {
        FakeClientSession session = FakeClientSession.standalone();
        session.destinations().register(new RoutingServer("world1", "127.0.0.1", 7778));
        session.destinations().register(new RoutingServer("world2", "127.0.0.1", 7780));
        session.serverDetails().getOrCreate("world2").incrementClients();

        assertTrue(handler.handle(session, "/dimensions"));

        assertEquals(List.of("Dimensions: world1 (0), world2 (1)"), session.messages);
    }

    @Test
    void movesToANamedDimension() {
        FakeClientSession session = FakeClientSession.standalone();
        RoutingServer world2 = new RoutingServer("world2", "127.0.0.1", 7780);
        session.destinations().register(world2);
        session.destination = new RoutingServer("world1", "127.0.0.1", 7778);

        assertTrue(handler.handle(session, "/World2"));

        assertEquals(List.of(world2), session.switches);
        assertEquals(List.of("Moving you to world2..."), session.messages);
    }

    @Test
    void doesNotMoveToTheCurrentDimension() {
        FakeClientSession session = FakeClientSession.standalone();
        RoutingServer world1 = new RoutingServer("world1", "127.0.0.1", 7778);
        session.destinations().register(world1);
        session.destination = world1;

        assertTrue(handler.handle(session, "/world1"));

        assertTrue(session.switches.isEmpty());
        assertEquals(List.of("You are already in world1."), session.messages);
    }

    @Test
    void unknownCommandsAreLeftForTheDestination() {
        FakeClientSession session = FakeClientSession.standalone();

        assertFalse(handler.handle(session, "/help"));
        assertFalse(handler.handle(session, "/"));
        assertFalse(handler.handle(session, "hello"));
        assertTrue(session.messages.isEmpty());
    }
}
