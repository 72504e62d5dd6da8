package io.neocli.errors;

import java.util.List;

public class NetworkError extends AppError {
    static final List<String> DEFAULT_SUGGESTIONS = List.of(
            "Check your internet connection",
            "Verify the API endpoint is correct",
            "Check if you need to configure a proxy"
    );

    private final String url;
    private final Integer statusCode;

    public NetworkError(String message) {
        this(message, null, null, ErrorOptions.NONE);
    }

    public NetworkError(String message, String url, Integer statusCode) {
        this(message, url, statusCode, ErrorOptions.NONE);
    }

    public NetworkError(String message, String url, Integer statusCode, ErrorOptions options) {
        super(message, (options == null ? ErrorOptions.NONE : options).withDefaultSuggestions(DEFAULT_SUGGESTIONS));
        this.url = url;
        this.statusCode = statusCode;
    }

    public String url() {
        return url;
    }

    public Integer statusCode() {
        return statusCode;
    }

    @Override
    public String code() {
        return "NETWORK_ERROR";
    }

    @Override
    public ErrorSeverity severity() {
        return ErrorSeverity.MEDIUM;
    }

    @Override
    public ErrorCategory category() {
        return ErrorCategory.NETWORK;
    }
}
