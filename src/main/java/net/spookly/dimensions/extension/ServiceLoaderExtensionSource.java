package net.spookly.dimensions.extension;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;
import java.util.ServiceConfigurationError;
import java.util.ServiceLoader;
import java.util.function.Supplier;

import net.spookly.dimensions.util.DimensionsLog;

/**
 * Discovers {@link Extension} providers in the jars of the extensions directory.
 */
public final class ServiceLoaderExtensionSource implements ExtensionSource {
    private static final int MAX_CONSECUTIVE_FAILURES = 32;

    private final Supplier<Path> directory;
    private final ClassLoader parent;
    private final DimensionsLog log;

    public ServiceLoaderExtensionSource(Supplier<Path> directory, ClassLoader parent, DimensionsLog log) {
        this.directory = Objects.requireNonNull(directory, "directory");
        this.parent = parent == null ? ServiceLoaderExtensionSource.class.getClassLoader() : parent;
        this.log = log == null ? DimensionsLog.NOOP : log;
    }

    @Override
    public List<Extension> discover() {
        ClassLoader loader = ExtensionJars.newClassLoader(directory.get(), parent);
        Iterator<Extension> providers = ServiceLoader.load(Extension.class, loader).iterator();
        List<Extension> discovered = new ArrayList<>();
        int consecutiveFailures = 0;
        while (consecutiveFailures < MAX_CONSECUTIVE_FAILURES) {
            try {
                if (!providers.hasNext()) {
                    break;
                }
                discovered.add(providers.next());
                consecutiveFailures = 0;
            } catch (ServiceConfigurationError e) {
                consecutiveFailures++;
                log.error("Error discovering extension: ", e);
            }
        }
        return discovered;
    }
}
