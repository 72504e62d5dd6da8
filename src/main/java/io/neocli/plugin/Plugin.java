package io.neocli.plugin;

import io.neocli.command.CliCommand;

import java.util.List;
import java.util.Map;

/**
 * Contract of an externally authored plugin. A plugin JAR exposes its implementation through
 * {@code META-INF/services/io.neocli.plugin.Plugin}.
 */
public interface Plugin {
    String name();

    String version();

    default String description() {
        return null;
    }

    default String author() {
        return null;
    }

    default String homepage() {
        return null;
    }

    default Map<String, String> dependencies() {
        return Map.of();
    }

    /**
     * Commands registered under the plugin's group once {@link #initialize(PluginContext)} succeeds.
     */
    default List<CliCommand> commands() {
        return List.of();
    }

    default LifecycleHooks hooks() {
        return null;
    }

    void initialize(PluginContext context) throws Exception;

    default void dispose() throws Exception {
    }
}
