package net.spookly.dimensions.config;

/**
 * Reloadable source of the configuration document; every call reads a fresh snapshot.
 */
@FunctionalInterface
public interface ConfigSource {
    /**
     * @throws ConfigException when the document cannot be read or is invalid
     */
    DimensionsConfig load();
}
