package net.spookly.dimensions.extension;

import java.nio.file.Path;
import java.util.Objects;
import java.util.function.Supplier;

/**
 * Module loader backed by a new class loader over the extensions directory per call.
 */
public final class ClassLoaderModuleLoader implements ModuleLoader {
    private final Supplier<Path> directory;
    private final ClassLoader parent;

    public ClassLoaderModuleLoader(Supplier<Path> directory, ClassLoader parent) {
        this.directory = Objects.requireNonNull(directory, "directory");
        this.parent = parent == null ? ClassLoaderModuleLoader.class.getClassLoader() : parent;
    }

    @Override
    public <T> T newInstance(String className, Class<T> type) {
        Objects.requireNonNull(className, "className");
        Objects.requireNonNull(type, "type");
        ClassLoader loader = ExtensionJars.newClassLoader(directory.get(), parent);
        Class<?> loaded;
        try {
            loaded = Class.forName(className, true, loader);
        } catch (ClassNotFoundException | LinkageError e) {
            throw new IllegalStateException("Failed to load module class: " + className, e);
        }
        if (!type.isAssignableFrom(loaded)) {
            throw new IllegalStateException(className + " is not a " + type.getName());
        }
        try {
            return type.cast(loaded.getDeclaredConstructor().newInstance());
        } catch (ReflectiveOperationException e) {
            throw new IllegalStateException("Failed to instantiate module class: " + className, e);
        }
    }
}
