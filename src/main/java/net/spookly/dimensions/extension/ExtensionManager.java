package net.spookly.dimensions.extension;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

import net.spookly.dimensions.config.DimensionsConfig;
import net.spookly.dimensions.handler.HandlerRegistry;
import net.spookly.dimensions.util.DimensionsLog;

/**
 * Loads, unloads and reloads the extension list held by the handler registry.
 */
public final class ExtensionManager {
    private final HandlerRegistry handlers;
    private final ExtensionSource source;
    private final DimensionsConfig.OptionsConfig options;
    private final ExtensionContext context;
    private final ModuleLoader moduleLoader;
    private final DimensionsLog log;

    public ExtensionManager(HandlerRegistry handlers,
                            ExtensionSource source,
                            DimensionsConfig.OptionsConfig options,
                            ExtensionContext context,
                            ModuleLoader moduleLoader,
                            DimensionsLog log) {
        this.handlers = Objects.requireNonNull(handlers, "handlers");
        this.source = source == null ? ExtensionSource.NONE : source;
        this.options = Objects.requireNonNull(options, "options");
        this.context = Objects.requireNonNull(context, "context");
        this.moduleLoader = Objects.requireNonNull(moduleLoader, "moduleLoader");
        this.log = log == null ? DimensionsLog.NOOP : log;
    }

    /**
     * Discover and load extensions into the registry; returns how many loaded.
     */
    public int loadExtensions() {
        List<Extension> discovered;
        try {
            discovered = source.discover();
        } catch (RuntimeException e) {
            log.error("Error discovering extensions: ", e);
            discovered = List.of();
        }
        List<LoadedExtension> loaded = new ArrayList<>(discovered.size());
        for (Extension extension : discovered) {
            if (extension == null) {
                continue;
            }
            LoadedExtension entry;
            try {
                // Capability checks call into the extension as well.
                entry = LoadedExtension.of(extension);
                extension.onLoad(context);
            } catch (RuntimeException e) {
                log.error("Error loading extension " + nameOf(extension) + ": ", e);
                continue;
            }
            loaded.add(entry);
            if (options.logExtensionLoad()) {
                log.notice("[Extension] " + entry.name() + " " + entry.version() + " loaded.");
            }
        }
        handlers.setExtensions(loaded);
        return loaded.size();
    }

    /**
     * Unload every extension and load the set again from the discovery source.
     */
    public int reloadExtensions() {
        unloadExtensions();
        return loadExtensions();
    }

    public void unloadExtensions() {
        List<LoadedExtension> current = handlers.extensions();
        for (LoadedExtension entry : current) {
            try {
                entry.extension().onUnload();
            } catch (RuntimeException e) {
                log.error("Error unloading extension " + entry.name() + ": ", e);
            }
            if (options.logExtensionLoad()) {
                log.notice("[Extension] " + entry.name() + " " + entry.version() + " unloaded.");
            }
        }
        handlers.setExtensions(List.of());
    }

    private static String nameOf(Extension extension) {
        try {
            String name = extension.name();
            return name == null ? extension.getClass().getName() : name;
        } catch (RuntimeException e) {
            return extension.getClass().getName();
        }
    }

    /**
     * Hand a command the proxy does not recognise to every reloadable extension, in load order.
     *
     * @return number of extensions invoked
     */
    public int passOnReload(String command) {
        int invoked = 0;
        ExtensionReloadContext reloadContext = new ExtensionReloadContext(command, moduleLoader);
        for (LoadedExtension entry : handlers.extensions()) {
            if (!entry.isReloadable()) {
                continue;
            }
            invoked++;
            try {
                entry.reloadable().reload(reloadContext);
            } catch (RuntimeException e) {
                log.error("Error reloading extension " + entry.name() + ": ", e);
            }
        }
        return invoked;
    }
}
