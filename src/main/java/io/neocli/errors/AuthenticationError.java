package io.neocli.errors;

import java.util.List;

public class AuthenticationError extends AppError {
    static final String DEFAULT_MESSAGE = "Authentication failed";
    static final List<String> DEFAULT_SUGGESTIONS = List.of(
            "Check your credentials",
            "Run \"neo auth login\" to authenticate",
            "Verify your API token is still valid"
    );

    public AuthenticationError() {
        this(DEFAULT_MESSAGE, ErrorOptions.NONE);
    }

    public AuthenticationError(String message) {
        this(message, ErrorOptions.NONE);
    }

    public AuthenticationError(String message, ErrorOptions options) {
        super(message == null ? DEFAULT_MESSAGE : message,
                (options == null ? ErrorOptions.NONE : options).withDefaultSuggestions(DEFAULT_SUGGESTIONS));
    }

    @Override
    public String code() {
        return "AUTHENTICATION_ERROR";
    }

    @Override
    public ErrorSeverity severity() {
        return ErrorSeverity.HIGH;
    }

    @Override
    public ErrorCategory category() {
        return ErrorCategory.AUTHENTICATION;
    }
}
