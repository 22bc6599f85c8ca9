package net.spookly.dimensions.extension;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import org.junit.jupiter.api.Test;

class ServiceLoaderExtensionSourceTest {
    @Test
    void discoversRegisteredProvidersWithFreshInstances() throws IOException {
        Path empty = Files.createTempDirectory("dimensions-extensions");
        ServiceLoaderExtensionSource source =
                new ServiceLoaderExtensionSource(() -> empty, getClass().getClassLoader(), null);

        List<Extension> first = source.discover();
        List<Extension> second = source.discover();

        assertEquals(1, first.size());
        assertTrue(first.get(0) instanceof SampleExtension);
        assertNotSame(first.get(0), second.get(0));
        assertTrue(LoadedExtension.of(first.get(0)).isReloadable());
    }

    @Test
    void listsOnlyJarsInNameOrder() throws IOException {
        Path directory = Files.createTempDirectory("dimensions-extensions");
        Files.createFile(directory.resolve("b.jar"));
        Files.createFile(directory.resolve("a.jar"));
        Files.createFile(directory.resolve("notes.txt"));

        List<Path> jars = ExtensionJars.list(directory);

        assertEquals(List.of(directory.resolve("a.jar"), directory.resolve("b.jar")), jars);
        assertTrue(ExtensionJars.list(directory.resolve("missing")).isEmpty());
    }

    @Test
    void moduleLoaderInstantiatesByClassName() {
        ModuleLoader loader = new ClassLoaderModuleLoader(() -> Path.of("missing"), getClass().getClassLoader());

        Extension extension = loader.newInstance(SampleExtension.class.getName(), Extension.class);

        assertEquals("sample", extension.name());
        assertThrows(IllegalStateException.class,
                () -> loader.newInstance(SampleExtension.class.getName(), Runnable.class));
        assertThrows(IllegalStateException.class,
                () -> loader.newInstance("net.spookly.dimensions.extension.Missing", Extension.class));
    }
}
