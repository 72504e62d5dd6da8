package io.neocli.errors;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Optional details attached to an {@link AppError} at construction time.
 */
public record ErrorOptions(
        Map<String, Object> context,
        List<String> suggestions,
        Throwable originalError
) {
    public static final ErrorOptions NONE = new ErrorOptions(null, null, null);

    public ErrorOptions {
        context = context == null ? null : Collections.unmodifiableMap(new LinkedHashMap<>(context));
        suggestions = suggestions == null ? null : List.copyOf(suggestions);
    }

    public static ErrorOptions suggestions(String... suggestions) {
        return new ErrorOptions(null, List.of(suggestions), null);
    }

    public static ErrorOptions context(Map<String, Object> context) {
        return new ErrorOptions(context, null, null);
    }

    public static ErrorOptions cause(Throwable originalError) {
        return new ErrorOptions(null, null, originalError);
    }

    public ErrorOptions withSuggestions(List<String> values) {
        return new ErrorOptions(context, values, originalError);
    }

    public ErrorOptions withCause(Throwable cause) {
        return new ErrorOptions(context, suggestions, cause);
    }

    ErrorOptions withDefaultSuggestions(List<String> defaults) {
        return suggestions == null ? withSuggestions(defaults) : this;
    }
}
