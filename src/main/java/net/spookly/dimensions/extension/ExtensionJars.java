package net.spookly.dimensions.extension;

import java.io.IOException;
import java.net.MalformedURLException;
import java.net.URL;
import java.net.URLClassLoader;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Stream;

/**
 * Builds class loaders over the jars of an extensions directory.
 */
final class ExtensionJars {
    private ExtensionJars() {
    }

    /**
     * Jars in {@code directory}, sorted by file name; empty when the directory does not exist.
     */
    static List<Path> list(Path directory) {
        if (directory == null || !Files.isDirectory(directory)) {
            return List.of();
        }
        try (Stream<Path> entries = Files.list(directory)) {
            return entries
                    .filter(Files::isRegularFile)
                    .filter(path -> path.getFileName().toString().endsWith(".jar"))
                    .sorted()
                    .toList();
        } catch (IOException e) {
            throw new IllegalStateException("Failed to list extensions directory: " + directory, e);
        }
    }

    /**
     * A new loader over the current jars, so replaced jars are read again.
     */
    static ClassLoader newClassLoader(Path directory, ClassLoader parent) {
        List<Path> jars = list(directory);
        if (jars.isEmpty()) {
            return parent;
        }
        List<URL> urls = new ArrayList<>(jars.size());
        for (Path jar : jars) {
            try {
                urls.add(jar.toUri().toURL());
            } catch (MalformedURLException e) {
                throw new IllegalStateException("Invalid extension jar path: " + jar, e);
            }
        }
        return new URLClassLoader("dimensions-extensions", urls.toArray(new URL[0]), parent);
    }
}
