package net.spookly.dimensions.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;

class ValueExpanderTest {
    private final ValueExpander expander = new ValueExpander(null, Map.of("REDIS_HOST", "cache")::get);

    @Test
    void expandsEnvironmentReferencesInNestedValues() {
        Object expanded = expander.expand(Map.of(
                "control", Map.of("redisUri", "env:REDIS_HOST"),
                "ports", List.of(7777, "env:MISSING:7778")
        ));

        assertEquals(Map.of(
                "control", Map.of("redisUri", "cache"),
                "ports", List.of(7777, "7778")
        ), expanded);
    }

    @Test
    void defaultMayContainColons() {
        assertEquals("redis://127.0.0.1:6379", expander.expand("env:MISSING:redis://127.0.0.1:6379"));
    }

    @Test
    void missingVariableWithoutDefaultFails() {
        ConfigException exception = assertThrows(ConfigException.class, () -> expander.expand("env:MISSING"));

        assertEquals("Missing required environment variable: MISSING", exception.getMessage());
    }

    @Test
    void plainStringsAreUntouched() {
        assertEquals("world1", expander.expand("world1"));
    }
}
