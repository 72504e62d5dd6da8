package io.neocli.errors;

import io.neocli.util.Jsons;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Base of the failure taxonomy. Every subclass fixes its code, severity and category;
 * instances are immutable once constructed.
 */
public abstract class AppError extends RuntimeException {
    private final Instant timestamp;
    private final Map<String, Object> context;
    private final List<String> suggestions;

    protected AppError(String message, ErrorOptions options) {
        super(message, options == null ? null : options.originalError());
        ErrorOptions resolved = options == null ? ErrorOptions.NONE : options;
        this.timestamp = Instant.now();
        this.context = resolved.context();
        this.suggestions = resolved.suggestions();
    }

    public abstract String code();

    public abstract ErrorSeverity severity();

    public abstract ErrorCategory category();

    public String name() {
        return getClass().getSimpleName();
    }

    public Instant timestamp() {
        return timestamp;
    }

    public Optional<Map<String, Object>> context() {
        return Optional.ofNullable(context);
    }

    public List<String> suggestions() {
        return suggestions == null ? List.of() : suggestions;
    }

    public Optional<Throwable> originalError() {
        return Optional.ofNullable(getCause());
    }

    public String userMessage() {
        StringBuilder sb = new StringBuilder(String.valueOf(getMessage()));
        if (!suggestions().isEmpty()) {
            sb.append("\n\nSuggestions:");
            for (String suggestion : suggestions()) {
                sb.append("\n  • ").append(suggestion);
            }
        }
        return sb.toString();
    }

    public String detailedReport() {
        List<String> report = new ArrayList<>();
        report.add("Error: " + name());
        report.add("Code: " + code());
        report.add("Message: " + getMessage());
        report.add("Severity: " + severity().label());
        report.add("Category: " + category().name());
        report.add("Timestamp: " + timestamp);
        if (context != null) {
            report.add("Context: " + Jsons.describe(context));
        }
        if (!suggestions().isEmpty()) {
            report.add("Suggestions: " + String.join(", ", suggestions()));
        }
        report.add("Stack Trace:\n" + stackTrace());
        return String.join("\n", report);
    }

    public Map<String, Object> toJson() {
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("name", name());
        out.put("code", code());
        out.put("message", getMessage());
        out.put("severity", severity().label());
        out.put("category", category().name());
        out.put("timestamp", timestamp.toString());
        out.put("context", context);
        out.put("suggestions", suggestions);
        out.put("stack", stackTrace());
        return out;
    }

    private String stackTrace() {
        StringWriter buffer = new StringWriter();
        printStackTrace(new PrintWriter(buffer));
        return buffer.toString().stripTrailing();
    }
}
