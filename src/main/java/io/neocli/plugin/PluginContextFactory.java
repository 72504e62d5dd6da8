package io.neocli.plugin;

import com.fasterxml.jackson.databind.node.ObjectNode;
import io.neocli.command.CommandRegistry;
import io.neocli.config.ConfigStore;
import io.neocli.event.EventBus;
import io.neocli.logging.CliLogger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.ForkJoinPool;

/**
 * Builds the context handed to {@link Plugin#initialize(PluginContext)}. The logger, event bus and
 * command registry are the process-wide instances; each context gets its own configuration view.
 */
public final class PluginContextFactory {
    private static final Logger log = LoggerFactory.getLogger(PluginContextFactory.class);

    private final String version;
    private final ConfigStore configStore;
    private final CliLogger logger;
    private final EventBus eventBus;
    private final CommandRegistry commandRegistry;
    private final Executor executor;

    public PluginContextFactory(
            String version,
            ConfigStore configStore,
            CliLogger logger,
            EventBus eventBus,
            CommandRegistry commandRegistry
    ) {
        this(version, configStore, logger, eventBus, commandRegistry, ForkJoinPool.commonPool());
    }

    public PluginContextFactory(
            String version,
            ConfigStore configStore,
            CliLogger logger,
            EventBus eventBus,
            CommandRegistry commandRegistry,
            Executor executor
    ) {
        this.version = version;
        this.configStore = configStore;
        this.logger = logger;
        this.eventBus = eventBus;
        this.commandRegistry = commandRegistry;
        this.executor = executor;
    }

    /**
     * The configuration cache is filled by a background read issued here; callers that need a
     * fresh value call {@link Configuration#load()} instead of relying on it.
     */
    public PluginContext create() {
        ConfigurationAdapter config = new ConfigurationAdapter(configStore);
        CompletableFuture
                .supplyAsync(this::readConfig, executor)
                .thenAccept(config::prime)
                .exceptionally(e -> {
                    log.debug("Background configuration read failed: {}", e.getMessage());
                    return null;
                });
        return new PluginContext(version, config, logger, eventBus, commandRegistry);
    }

    private ObjectNode readConfig() {
        try {
            return configStore.read();
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }
}
