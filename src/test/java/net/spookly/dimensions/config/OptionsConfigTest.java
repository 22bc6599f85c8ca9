package net.spookly.dimensions.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class OptionsConfigTest {
    @Test
    void mergeReplacesPresentGroupsAndKeepsAbsentOnes() {
        DimensionsConfig.OptionsConfig live = new DimensionsConfig.OptionsConfig();
        live.log = new DimensionsConfig.LogOptions();
        live.log.extensionLoad = true;
        live.connection = new DimensionsConfig.ConnectionOptions();
        live.connection.backendConnectTimeoutMs = 1500;
        DimensionsConfig.ConnectionOptions staleConnection = live.connection;

        DimensionsConfig.OptionsConfig update = new DimensionsConfig.OptionsConfig();
        update.log = new DimensionsConfig.LogOptions();
        update.log.extensionLoad = false;

        live.mergeFrom(update);

        assertFalse(live.logExtensionLoad());
        assertSame(staleConnection, live.connection);
        assertEquals(1500, live.backendConnectTimeoutMs());
    }

    @Test
    void mergeWithNullKeepsEverything() {
        DimensionsConfig.OptionsConfig live = new DimensionsConfig.OptionsConfig();
        live.restApi = new DimensionsConfig.RestApiOptions();
        live.restApi.enabled = true;
        live.restApi.port = 3000;

        live.mergeFrom(null);

        assertTrue(live.restApiEnabled());
    }

    @Test
    void destinationErrorsAreLoggedUnlessDisabled() {
        DimensionsConfig.OptionsConfig options = new DimensionsConfig.OptionsConfig();
        assertTrue(options.logDestinationErrors());

        options.log = new DimensionsConfig.LogOptions();
        options.log.destinationErrors = false;
        assertFalse(options.logDestinationErrors());
    }
}
