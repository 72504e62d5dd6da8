package io.neocli.plugin;

import io.neocli.command.CliCommand;
import io.neocli.command.CommandMetadata;
import io.neocli.command.CommandRegistry;
import io.neocli.errors.Result;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Tracks loaded plugins through initialization and disposal and fans lifecycle hooks out to them.
 */
public final class PluginRegistry {
    private static final Logger log = LoggerFactory.getLogger(PluginRegistry.class);

    private static final class Entry {
        private final Plugin plugin;
        private final Path path;
        private PluginState state = PluginState.LOADED;
        private Throwable error;

        private Entry(Plugin plugin, Path path) {
            this.plugin = plugin;
            this.path = path;
        }
    }

    @FunctionalInterface
    private interface HookCall {
        void call(LifecycleHooks hooks) throws Exception;
    }

    private final Map<String, Entry> plugins = new LinkedHashMap<>();
    private final PluginLoader loader;
    private final PluginContextFactory contextFactory;
    private final CommandRegistry commandRegistry;

    public PluginRegistry(PluginLoader loader, PluginContextFactory contextFactory, CommandRegistry commandRegistry) {
        this.loader = loader;
        this.contextFactory = contextFactory;
        this.commandRegistry = commandRegistry;
    }

    public void registerPlugin(LoadedPlugin loaded) {
        String name = loaded.plugin().name();
        if (plugins.containsKey(name)) {
            log.warn("Plugin \"{}\" is already registered", name);
            return;
        }
        plugins.put(name, new Entry(loaded.plugin(), loaded.path()));
        log.debug("Registered plugin: {}", name);
    }

    public void initializeAll() {
        PluginContext context = contextFactory.create();
        Result<Void> loaded = context.config().load();
        if (loaded.isFailure()) {
            log.debug("Plugin configuration not loaded: {}", loaded.error().getMessage());
        }

        for (Map.Entry<String, Entry> item : plugins.entrySet()) {
            String name = item.getKey();
            Entry entry = item.getValue();
            if (entry.state != PluginState.LOADED) {
                continue;
            }
            try {
                entry.plugin.initialize(context);
                entry.state = PluginState.INITIALIZED;
                registerCommands(name, entry.plugin);
                log.debug("Initialized plugin: {}", name);
            } catch (Exception | LinkageError e) {
                entry.state = PluginState.ERROR;
                entry.error = e;
                log.warn("Failed to initialize plugin \"{}\": {}", name, e.getMessage());
            }
        }
    }

    public void disposeAll() {
        for (Map.Entry<String, Entry> item : plugins.entrySet()) {
            Entry entry = item.getValue();
            if (entry.state != PluginState.INITIALIZED) {
                continue;
            }
            try {
                entry.plugin.dispose();
                entry.state = PluginState.DISPOSED;
                log.debug("Disposed plugin: {}", item.getKey());
            } catch (Exception | LinkageError e) {
                log.warn("Error disposing plugin \"{}\": {}", item.getKey(), e.getMessage());
            }
        }
        commandRegistry.clear();
    }

    public Optional<Plugin> getPlugin(String name) {
        Entry entry = plugins.get(name);
        return entry == null ? Optional.empty() : Optional.of(entry.plugin);
    }

    public Optional<PluginState> getState(String name) {
        Entry entry = plugins.get(name);
        return entry == null ? Optional.empty() : Optional.of(entry.state);
    }

    public Optional<Path> getPath(String name) {
        Entry entry = plugins.get(name);
        return entry == null ? Optional.empty() : Optional.ofNullable(entry.path);
    }

    public Optional<Throwable> getError(String name) {
        Entry entry = plugins.get(name);
        return entry == null ? Optional.empty() : Optional.ofNullable(entry.error);
    }

    public List<Plugin> getLoadedPlugins() {
        List<Plugin> out = new ArrayList<>(plugins.size());
        for (Entry entry : plugins.values()) {
            out.add(entry.plugin);
        }
        return out;
    }

    public List<Plugin> getInitializedPlugins() {
        List<Plugin> out = new ArrayList<>();
        for (Entry entry : plugins.values()) {
            if (entry.state == PluginState.INITIALIZED) {
                out.add(entry.plugin);
            }
        }
        return out;
    }

    public void executeBeforeCommand(String commandName, Object options) {
        runHooks("beforeCommand", hooks -> hooks.beforeCommand(commandName, options));
    }

    public void executeAfterCommand(String commandName, Result<Void> result) {
        runHooks("afterCommand", hooks -> hooks.afterCommand(commandName, result));
    }

    public void executeOnError(Throwable error) {
        runHooks("onError", hooks -> hooks.onError(error));
    }

    public void executeOnExit(int code) {
        runHooks("onExit", hooks -> hooks.onExit(code));
    }

    public void loadPlugins(Collection<String> disabledPlugins) {
        Map<String, LoadedPlugin> loaded = loader.loadAllPlugins(disabledPlugins);
        for (LoadedPlugin plugin : loaded.values()) {
            registerPlugin(plugin);
        }
        initializeAll();
    }

    public int size() {
        return plugins.size();
    }

    public void clear() {
        plugins.clear();
    }

    private void registerCommands(String pluginName, Plugin plugin) {
        List<CliCommand> commands = plugin.commands();
        if (commands == null) {
            return;
        }
        for (CliCommand command : commands) {
            try {
                commandRegistry.register(command, CommandMetadata.grouped(command, pluginName));
                log.debug("Registered command \"{}\" from plugin \"{}\"", command.name(), pluginName);
            } catch (RuntimeException e) {
                log.warn("Failed to register command \"{}\": {}", command.name(), e.getMessage());
            }
        }
    }

    private void runHooks(String hookName, HookCall call) {
        for (Map.Entry<String, Entry> item : plugins.entrySet()) {
            if (item.getValue().state != PluginState.INITIALIZED) {
                continue;
            }
            try {
                LifecycleHooks hooks = item.getValue().plugin.hooks();
                if (hooks != null) {
                    call.call(hooks);
                }
            } catch (Exception | LinkageError e) {
                log.debug("Plugin \"{}\" {} hook error: {}", item.getKey(), hookName, e.getMessage());
            }
        }
    }
}
