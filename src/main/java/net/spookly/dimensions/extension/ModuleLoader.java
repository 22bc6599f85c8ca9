package net.spookly.dimensions.extension;

/**
 * Loads classes from a fresh class loader on every call, so an extension can replace its own
 * implementation classes without a restart.
 */
public interface ModuleLoader {
    /**
     * Instantiate {@code className} through its public no-argument constructor.
     *
     * @throws IllegalStateException when the class is missing, not a {@code type}, or fails to construct
     */
    <T> T newInstance(String className, Class<T> type);
}
