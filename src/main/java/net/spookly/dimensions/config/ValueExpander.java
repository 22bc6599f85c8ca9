package net.spookly.dimensions.config;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * Expands {@code env:NAME}, {@code env:NAME:default} and {@code path:file} scalar values in a raw
 * YAML tree before it is bound to {@link DimensionsConfig}.
 */
final class ValueExpander {
    private static final String ENV_PREFIX = "env:";
    private static final String PATH_PREFIX = "path:";

    private final Path baseDir;
    private final Function<String, String> environment;

    ValueExpander(Path baseDir, Function<String, String> environment) {
        this.baseDir = baseDir;
        this.environment = environment;
    }

    static Object expand(Object value, Path baseDir) {
        return new ValueExpander(baseDir, System::getenv).expand(value);
    }

    Object expand(Object value) {
        if (value instanceof Map<?, ?> raw) {
            Map<Object, Object> expanded = new LinkedHashMap<>();
            raw.forEach((key, child) -> expanded.put(key, expand(child)));
            return expanded;
        }
        if (value instanceof List<?> raw) {
            List<Object> expanded = new ArrayList<>(raw.size());
            for (Object item : raw) {
                expanded.add(expand(item));
            }
            return expanded;
        }
        if (value instanceof String raw) {
            if (raw.startsWith(ENV_PREFIX)) {
                return expandEnv(raw.substring(ENV_PREFIX.length()));
            }
            if (raw.startsWith(PATH_PREFIX)) {
                return expandPath(raw.substring(PATH_PREFIX.length()));
            }
        }
        return value;
    }

    private String expandEnv(String reference) {
        String key = reference;
        String fallback = null;
        int separator = reference.indexOf(':');
        if (separator >= 0) {
            key = reference.substring(0, separator);
            fallback = reference.substring(separator + 1);
        }
        if (key.isBlank()) {
            throw new ConfigException("Environment variable name is empty");
        }
        String value = environment.apply(key);
        if (value != null) {
            return value;
        }
        if (fallback != null) {
            return fallback;
        }
        throw new ConfigException("Missing required environment variable: " + key);
    }

    private String expandPath(String location) {
        if (location.isBlank()) {
            throw new ConfigException("Path value is empty");
        }
        Path resolved;
        try {
            resolved = Path.of(location);
        } catch (InvalidPathException e) {
            throw new ConfigException("Invalid path value: " + location, e);
        }
        if (baseDir != null && !resolved.isAbsolute()) {
            resolved = baseDir.resolve(resolved).normalize();
        }
        try {
            String content = Files.readString(resolved, StandardCharsets.UTF_8).strip();
            if (content.isEmpty()) {
                throw new ConfigException("Path value is empty: " + resolved);
            }
            return content;
        } catch (IOException e) {
            throw new ConfigException("Failed to read config path: " + resolved, e);
        }
    }
}
