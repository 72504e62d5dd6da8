package io.neocli.plugin;

import io.neocli.command.CommandRegistry;
import io.neocli.event.EventBus;
import io.neocli.logging.CliLogger;

public record PluginContext(
        String version,
        Configuration config,
        CliLogger logger,
        EventBus eventBus,
        CommandRegistry commandRegistry
) {
}
