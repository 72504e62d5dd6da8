package io.neocli.plugin;

import com.fasterxml.jackson.databind.JsonNode;
import io.neocli.errors.ErrorOptions;
import io.neocli.errors.PluginError;
import io.neocli.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.ServiceConfigurationError;
import java.util.Set;
import java.util.TreeSet;

/**
 * Discovers plugin directories under one root and loads each plugin's entry point.
 * <p>
 * Per plugin: discovered, validated (manifest), loaded (module + capability check). A failure at
 * either step is logged and the loader moves on to the next candidate; {@link #loadPlugin} itself
 * throws {@link PluginError}, {@link #loadAllPlugins} turns that into skip-and-continue.
 */
public final class PluginLoader {
    static final List<String> LOAD_SUGGESTIONS = List.of(
            "Check that the plugin is a valid JAR file",
            "Ensure all dependencies are bundled with the plugin",
            "Verify the plugin was compiled for a compatible Java version"
    );
    static final List<String> EXPORT_SUGGESTIONS = List.of(
            "Ensure the plugin declares META-INF/services/" + Plugin.class.getName(),
            "The exported class must implement " + Plugin.class.getName(),
            "Required: name(), version(), initialize()"
    );

    private static final Logger log = LoggerFactory.getLogger(PluginLoader.class);

    private final Path pluginsDir;
    private final PluginModuleLoader moduleLoader;

    public PluginLoader(Path pluginsDir) {
        this(pluginsDir, new JarPluginModuleLoader());
    }

    public PluginLoader(Path pluginsDir, PluginModuleLoader moduleLoader) {
        this.pluginsDir = pluginsDir;
        this.moduleLoader = moduleLoader;
    }

    public Path pluginsDir() {
        return pluginsDir;
    }

    public boolean pluginsDirExists() {
        return pluginsDir != null && Files.isDirectory(pluginsDir);
    }

    public List<PluginManifest> discoverPlugins() {
        if (!pluginsDirExists()) {
            log.debug("Plugins directory does not exist: {}", pluginsDir);
            return List.of();
        }

        // sorted so discovery order does not depend on the filesystem
        Set<Path> candidates = new TreeSet<>();
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(pluginsDir, Files::isDirectory)) {
            for (Path dir : stream) {
                candidates.add(dir);
            }
        } catch (IOException e) {
            log.warn("Failed to list plugins directory {}: {}", pluginsDir, e.getMessage());
            return List.of();
        }

        List<PluginManifest> manifests = new ArrayList<>();
        for (Path dir : candidates) {
            Path manifestPath = dir.resolve(PluginManifest.FILE_NAME);
            if (!Files.isRegularFile(manifestPath)) {
                log.debug("Skipping {}: no {}", dir.getFileName(), PluginManifest.FILE_NAME);
                continue;
            }
            PluginManifest manifest;
            try {
                JsonNode node = Jsons.mapper().readTree(manifestPath.toFile());
                if (node == null || !node.isObject()) {
                    log.debug("Skipping {}: manifest is not a JSON object", dir.getFileName());
                    continue;
                }
                manifest = PluginManifest.fromJson(node, dir);
            } catch (IOException e) {
                log.debug("Skipping {}: {}", dir.getFileName(), e.getMessage());
                continue;
            }

            List<String> missing = manifest.missingFields();
            if (!missing.isEmpty()) {
                log.warn("Invalid plugin manifest in {}: missing {}", dir.getFileName(), String.join(" and ", missing));
                continue;
            }
            if (manifest.disabled()) {
                log.debug("Plugin \"{}\" is disabled in manifest", manifest.name());
                continue;
            }
            manifests.add(manifest);
            log.debug("Discovered plugin: {}@{}", manifest.name(), manifest.version());
        }
        return manifests;
    }

    /**
     * @throws PluginError if the entry point is missing, cannot be loaded, or does not export a valid plugin
     */
    public LoadedPlugin loadPlugin(PluginManifest manifest) {
        Path pluginDir = manifest.directory() != null ? manifest.directory() : pluginsDir.resolve(manifest.name());
        String entryPoint = manifest.entryPoint();
        Path modulePath = pluginDir.resolve(entryPoint);

        if (!Files.exists(modulePath)) {
            throw new PluginError(
                    "Plugin entry point not found: " + entryPoint,
                    manifest.name(),
                    ErrorOptions.suggestions(
                            "Ensure " + entryPoint + " exists in the plugin directory",
                            "Check the \"main\" field in " + PluginManifest.FILE_NAME
                    )
            );
        }

        Object exported;
        try {
            exported = moduleLoader.load(modulePath);
        } catch (Exception | ServiceConfigurationError | LinkageError e) {
            throw new PluginError(
                    "Failed to load plugin: " + e.getMessage(),
                    manifest.name(),
                    new ErrorOptions(null, LOAD_SUGGESTIONS, e)
            );
        }

        Plugin plugin = checkExport(exported, manifest.name());
        return new LoadedPlugin(manifest, plugin, pluginDir);
    }

    public Map<String, LoadedPlugin> loadAllPlugins(Collection<String> disabledPlugins) {
        Collection<String> disabled = disabledPlugins == null ? List.of() : disabledPlugins;
        Map<String, LoadedPlugin> plugins = new LinkedHashMap<>();
        for (PluginManifest manifest : discoverPlugins()) {
            if (disabled.contains(manifest.name())) {
                log.debug("Plugin \"{}\" is disabled in configuration", manifest.name());
                continue;
            }
            try {
                LoadedPlugin loaded = loadPlugin(manifest);
                plugins.put(manifest.name(), loaded);
                log.debug("Loaded plugin: {}@{}", manifest.name(), manifest.version());
            } catch (PluginError e) {
                log.warn("Failed to load plugin \"{}\": {}", manifest.name(), e.getMessage());
            } catch (RuntimeException | LinkageError e) {
                log.warn("Failed to load plugin \"{}\": {}", manifest.name(), e.toString());
            }
        }
        return plugins;
    }

    public void close() {
        moduleLoader.close();
    }

    private static Plugin checkExport(Object exported, String pluginName) {
        if (!(exported instanceof Plugin)) {
            throw invalidExport(pluginName);
        }
        Plugin plugin = (Plugin) exported;
        String name;
        String version;
        try {
            name = plugin.name();
            version = plugin.version();
        } catch (RuntimeException | LinkageError e) {
            throw new PluginError(
                    "Invalid plugin export: " + e.getMessage(),
                    pluginName,
                    new ErrorOptions(null, EXPORT_SUGGESTIONS, e)
            );
        }
        if (name == null || name.isBlank() || version == null || version.isBlank()) {
            throw invalidExport(pluginName);
        }
        return plugin;
    }

    private static PluginError invalidExport(String pluginName) {
        return new PluginError(
                "Invalid plugin export: missing required properties",
                pluginName,
                new ErrorOptions(null, EXPORT_SUGGESTIONS, null)
        );
    }
}
