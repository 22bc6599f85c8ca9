package net.spookly.dimensions.config;

import java.io.IOException;
import java.io.Reader;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

public final class ConfigLoader {
    private static final ObjectMapper MAPPER = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, true);

    private ConfigLoader() {
    }

    /**
     * Load and validate the Dimensions YAML configuration.
     */
    public static DimensionsConfig load(Path path) {
        if (path == null) {
            throw new ConfigException("Config path is required");
        }
        if (!Files.exists(path)) {
            writeDefaultConfig(path);
            throw new ConfigException("Config file did not exist, generated default at: " + path);
        }
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            return parse(reader, path.toString(), path.toAbsolutePath().getParent());
        } catch (IOException e) {
            throw new ConfigException("Failed to read config: " + path, e);
        }
    }

    /**
     * Parse a YAML document held in memory; relative {@code path:} values resolve against {@code baseDir}.
     */
    public static DimensionsConfig parse(String yamlText, Path baseDir) {
        return parse(new StringReader(yamlText), "<inline>", baseDir);
    }

    private static DimensionsConfig parse(Reader reader, String source, Path baseDir) {
        Object raw;
        try {
            raw = new Yaml().load(reader);
        } catch (YAMLException e) {
            throw new ConfigException("Malformed config: " + source, e);
        }
        if (raw == null) {
            throw new ConfigException("Config file is empty: " + source);
        }
        Object expanded = ValueExpander.expand(raw, baseDir);
        DimensionsConfig config;
        try {
            config = MAPPER.convertValue(expanded, DimensionsConfig.class);
        } catch (IllegalArgumentException e) {
            throw new ConfigException("Failed to parse config: " + source, e);
        }
        ConfigValidator.validate(config);
        ConfigDefaults.apply(config);
        return config;
    }

    private static void writeDefaultConfig(Path path) {
        try {
            Path parent = path.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.writeString(path, ConfigDefaults.defaultYaml(), StandardCharsets.UTF_8, StandardOpenOption.CREATE_NEW);
        } catch (IOException e) {
            throw new ConfigException("Failed to write default config: " + path, e);
        }
    }
}
