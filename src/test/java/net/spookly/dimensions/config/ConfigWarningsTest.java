package net.spookly.dimensions.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;

import org.junit.jupiter.api.Test;

class ConfigWarningsTest {
    @Test
    void warnsOnDuplicateRoutingServerNames() {
        DimensionsConfig config = ConfigLoader.parse("""
                servers:
                  - listenPort: 7777
                    routingServers:
                      - name: world1
                        serverIP: 127.0.0.1
                        serverPort: 7778
                  - listenPort: 7779
                    routingServers:
                      - name: world1
                        serverIP: 127.0.0.1
                        serverPort: 7780
                """, null);

        List<String> warnings = ConfigWarnings.collect(config, null);

        assertEquals(1, warnings.size());
        assertTrue(warnings.get(0).contains("last declaration wins: world1"));
    }

    @Test
    void warnsWhenRestPortCollidesWithListenPort() {
        DimensionsConfig config = ConfigLoader.parse("""
                servers:
                  - listenPort: 7777
                    routingServers:
                      - name: world1
                        serverIP: 127.0.0.1
                        serverPort: 7778
                options:
                  restApi:
                    enabled: true
                    port: 7777
                """, null);

        List<String> warnings = ConfigWarnings.collect(config, null);

        assertEquals(List.of("options.restApi.port collides with a listen port: 7777"), warnings);
    }

    @Test
    void noWarningsForDefaultConfig() {
        DimensionsConfig config = ConfigLoader.parse(ConfigDefaults.defaultYaml(), null);

        assertTrue(ConfigWarnings.collect(config, null).isEmpty());
    }
}
