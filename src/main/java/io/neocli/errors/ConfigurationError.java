package io.neocli.errors;

import java.util.List;

public class ConfigurationError extends AppError {
    static final List<String> DEFAULT_SUGGESTIONS = List.of(
            "Check your configuration file for syntax errors",
            "Ensure all required configuration values are set",
            "Run \"neo config validate\" to check your configuration"
    );

    private final String configKey;

    public ConfigurationError(String message) {
        this(message, null, ErrorOptions.NONE);
    }

    public ConfigurationError(String message, String configKey) {
        this(message, configKey, ErrorOptions.NONE);
    }

    public ConfigurationError(String message, String configKey, ErrorOptions options) {
        super(message, (options == null ? ErrorOptions.NONE : options).withDefaultSuggestions(DEFAULT_SUGGESTIONS));
        this.configKey = configKey;
    }

    public String configKey() {
        return configKey;
    }

    @Override
    public String code() {
        return "CONFIGURATION_ERROR";
    }

    @Override
    public ErrorSeverity severity() {
        return ErrorSeverity.HIGH;
    }

    @Override
    public ErrorCategory category() {
        return ErrorCategory.CONFIGURATION;
    }
}
