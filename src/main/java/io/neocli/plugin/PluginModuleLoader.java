package io.neocli.plugin;

import java.nio.file.Path;

/**
 * Loads the unit behind a plugin entry point and returns its exported object, or {@code null}
 * when the unit exports nothing.
 */
public interface PluginModuleLoader {
    Object load(Path entryPoint) throws Exception;

    default void close() {
    }
}
