package io.neocli.runtime;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.neocli.command.CommandRegistry;
import io.neocli.config.JsonFileConfigStore;
import io.neocli.config.NeoConfig;
import io.neocli.config.NeoVersion;
import io.neocli.container.Container;
import io.neocli.errors.ErrorHandler;
import io.neocli.errors.RetryStrategy;
import io.neocli.event.EventBus;
import io.neocli.logging.CliLogger;
import io.neocli.logging.Slf4jCliLogger;
import io.neocli.plugin.JarPluginModuleLoader;
import io.neocli.plugin.PluginContextFactory;
import io.neocli.plugin.PluginLoader;
import io.neocli.plugin.PluginModuleLoader;
import io.neocli.plugin.PluginRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;

/**
 * Composition root. Every shared runtime object is built exactly once here and handed to its
 * consumers by reference; {@link #close()} is the explicit teardown at process exit. The error handler
 * runs {@link #shutdown(int)} before it terminates the process, so plugins are disposed on failure too.
 */
public final class NeoRuntime implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(NeoRuntime.class);

    private final NeoConfig config;
    private final String version;
    private final Container container = new Container();
    private final EventBus eventBus = new EventBus();
    private final CommandRegistry commandRegistry = new CommandRegistry();
    private final CliLogger logger;
    private final ErrorHandler errorHandler;
    private final JsonFileConfigStore configStore;
    private final PluginLoader pluginLoader;
    private final PluginRegistry pluginRegistry;
    private boolean pluginsLoaded;
    private boolean closed;

    public NeoRuntime(NeoConfig config) {
        this(config, new ErrorHandler(), new JarPluginModuleLoader(), new Slf4jCliLogger());
    }

    public NeoRuntime(NeoConfig config, ErrorHandler errorHandler, PluginModuleLoader moduleLoader, CliLogger logger) {
        this.config = config;
        this.version = NeoVersion.current();
        this.logger = logger;
        this.errorHandler = errorHandler;
        this.errorHandler.registerStrategy(new RetryStrategy());
        this.errorHandler.beforeExit(this::shutdown);
        this.configStore = new JsonFileConfigStore(config.configFile());
        this.pluginLoader = new PluginLoader(resolvePluginsDir(config, configStore.read()), moduleLoader);
        PluginContextFactory contextFactory = new PluginContextFactory(
                version, configStore, logger, eventBus, commandRegistry);
        this.pluginRegistry = new PluginRegistry(pluginLoader, contextFactory, commandRegistry);

        container.registerValue(Tokens.NEO_CONFIG, config);
        container.registerValue(Tokens.LOGGER, logger);
        container.registerValue(Tokens.CONFIG_STORE, configStore);
        container.registerValue(Tokens.EVENT_BUS, eventBus);
        container.registerValue(Tokens.COMMAND_REGISTRY, commandRegistry);
        container.registerValue(Tokens.ERROR_HANDLER, errorHandler);
        container.registerValue(Tokens.PLUGIN_LOADER, pluginLoader);
        container.registerValue(Tokens.PLUGIN_REGISTRY, pluginRegistry);
    }

    public void loadPlugins() {
        if (pluginsLoaded) {
            return;
        }
        ObjectNode persisted = configStore.read();
        JsonNode plugins = persisted.path("plugins");
        if (plugins.path("enabled").isBoolean() && !plugins.path("enabled").booleanValue()) {
            log.debug("Plugin system disabled in configuration");
            return;
        }
        List<String> disabled = new ArrayList<>();
        for (JsonNode name : plugins.path("disabled")) {
            if (name.isTextual()) {
                disabled.add(name.asText());
            }
        }
        pluginRegistry.loadPlugins(disabled);
        pluginsLoaded = true;
    }

    public boolean pluginsLoaded() {
        return pluginsLoaded;
    }

    public NeoConfig config() {
        return config;
    }

    public String version() {
        return version;
    }

    public Container container() {
        return container;
    }

    public EventBus eventBus() {
        return eventBus;
    }

    public CommandRegistry commandRegistry() {
        return commandRegistry;
    }

    public CliLogger logger() {
        return logger;
    }

    public ErrorHandler errorHandler() {
        return errorHandler;
    }

    public PluginLoader pluginLoader() {
        return pluginLoader;
    }

    public PluginRegistry pluginRegistry() {
        return pluginRegistry;
    }

    public void shutdown(int exitCode) {
        if (closed) {
            return;
        }
        closed = true;
        pluginRegistry.executeOnExit(exitCode);
        pluginRegistry.disposeAll();
        eventBus.clear();
        container.clear();
        pluginLoader.close();
    }

    @Override
    public void close() {
        shutdown(0);
    }

    static Path resolvePluginsDir(NeoConfig config, ObjectNode persisted) {
        JsonNode custom = persisted.path("plugins").path("directory");
        if (!custom.isTextual() || custom.asText().isBlank()) {
            return config.pluginsDir();
        }
        String raw = custom.asText().trim();
        if (raw.equals("~") || raw.startsWith("~/")) {
            raw = System.getProperty("user.home") + raw.substring(1);
        }
        Path path = Paths.get(raw);
        return path.isAbsolute() ? path : config.configDir().resolve(path).normalize();
    }
}
