package net.spookly.dimensions.extension;

/**
 * Pluggable add-on discovered from the extensions directory.
 *
 * <p>Implementations are registered as {@code META-INF/services/net.spookly.dimensions.extension.Extension}
 * providers and need a public no-argument constructor.
 */
public interface Extension {
    String name();

    String version();

    default void onLoad(ExtensionContext context) {
    }

    default void onUnload() {
    }
}
