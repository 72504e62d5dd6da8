package io.neocli.runtime;

import io.neocli.command.CommandRegistry;
import io.neocli.config.ConfigStore;
import io.neocli.config.NeoConfig;
import io.neocli.container.Token;
import io.neocli.errors.ErrorHandler;
import io.neocli.event.EventBus;
import io.neocli.logging.CliLogger;
import io.neocli.plugin.PluginLoader;
import io.neocli.plugin.PluginRegistry;

public final class Tokens {
    public static final Token<NeoConfig> NEO_CONFIG = Token.unique("NeoConfig");
    public static final Token<CliLogger> LOGGER = Token.unique("Logger");
    public static final Token<ConfigStore> CONFIG_STORE = Token.unique("Config");
    public static final Token<EventBus> EVENT_BUS = Token.unique("EventBus");
    public static final Token<CommandRegistry> COMMAND_REGISTRY = Token.unique("CommandRegistry");
    public static final Token<ErrorHandler> ERROR_HANDLER = Token.unique("ErrorHandler");
    public static final Token<PluginLoader> PLUGIN_LOADER = Token.unique("PluginLoader");
    public static final Token<PluginRegistry> PLUGIN_REGISTRY = Token.unique("PluginRegistry");

    private Tokens() {
    }
}
