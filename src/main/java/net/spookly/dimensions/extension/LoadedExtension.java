package net.spookly.dimensions.extension;

import lombok.Getter;
import lombok.NonNull;
import lombok.experimental.Accessors;

/**
 * An extension together with the capabilities it declared when it was loaded.
 */
@Getter
@Accessors(fluent = true)
public final class LoadedExtension {
    private static final String UNKNOWN = "unknown";

    private final Extension extension;
    /**
     * Non-null only when the extension offered the reload capability at load time.
     */
    private final ReloadableExtension reloadable;

    private LoadedExtension(Extension extension, ReloadableExtension reloadable) {
        this.extension = extension;
        this.reloadable = reloadable;
    }

    public static LoadedExtension of(@NonNull Extension extension) {
        ReloadableExtension reloadable = null;
        if (extension instanceof ReloadableExtension candidate
                && candidate.reloadable()
                && candidate.reloadName() != null
                && !candidate.reloadName().isBlank()) {
            reloadable = candidate;
        }
        return new LoadedExtension(extension, reloadable);
    }

    public boolean isReloadable() {
        return reloadable != null;
    }

    public String name() {
        String name = extension.name();
        return name == null ? UNKNOWN : name;
    }

    public String version() {
        String version = extension.version();
        return version == null ? UNKNOWN : version;
    }
}
