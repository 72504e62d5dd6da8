package io.neocli.plugin;

import java.nio.file.Path;

public record LoadedPlugin(
        PluginManifest manifest,
        Plugin plugin,
        Path path
) {
}
