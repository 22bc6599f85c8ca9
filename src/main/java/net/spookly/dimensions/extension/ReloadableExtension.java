package net.spookly.dimensions.extension;

/**
 * Capability for extensions that react to control-channel commands the proxy does not handle.
 */
public interface ReloadableExtension extends Extension {
    default boolean reloadable() {
        return true;
    }

    /**
     * Name the extension reloads under; blank means the capability is not offered.
     */
    String reloadName();

    void reload(ExtensionReloadContext context);
}
