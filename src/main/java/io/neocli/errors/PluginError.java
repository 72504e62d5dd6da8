package io.neocli.errors;

public class PluginError extends AppError {
    private final String pluginName;

    public PluginError(String message, String pluginName) {
        this(message, pluginName, ErrorOptions.NONE);
    }

    public PluginError(String message, String pluginName, ErrorOptions options) {
        super(message, options);
        this.pluginName = pluginName;
    }

    public String pluginName() {
        return pluginName;
    }

    @Override
    public String code() {
        return "PLUGIN_ERROR";
    }

    @Override
    public ErrorSeverity severity() {
        return ErrorSeverity.MEDIUM;
    }

    @Override
    public ErrorCategory category() {
        return ErrorCategory.PLUGIN;
    }
}
