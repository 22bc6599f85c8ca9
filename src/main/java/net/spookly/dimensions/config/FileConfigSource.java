package net.spookly.dimensions.config;

import java.nio.file.Path;
import java.util.Objects;

/**
 * Re-reads the YAML file on every load so a {@code reload} picks up edits.
 */
public final class FileConfigSource implements ConfigSource {
    private final Path path;

    public FileConfigSource(Path path) {
        this.path = Objects.requireNonNull(path, "path");
    }

    public Path path() {
        return path;
    }

    @Override
    public DimensionsConfig load() {
        return ConfigLoader.load(path);
    }
}
