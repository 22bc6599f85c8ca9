package net.spookly.dimensions.extension;

/**
 * Passed to a reloadable extension together with the command that triggered the reload.
 */
public record ExtensionReloadContext(String command, ModuleLoader moduleLoader) {
}
