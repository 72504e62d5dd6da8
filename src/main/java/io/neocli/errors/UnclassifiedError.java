package io.neocli.errors;

/**
 * Wraps a thrown value that is not part of the taxonomy. Only produced by
 * {@link ErrorHandler#normalize(Object)}.
 */
public final class UnclassifiedError extends AppError {
    private final ErrorSeverity severity;

    UnclassifiedError(String message, ErrorSeverity severity, ErrorOptions options) {
        super(message, options);
        this.severity = severity;
    }

    @Override
    public String code() {
        return "UNKNOWN_ERROR";
    }

    @Override
    public ErrorSeverity severity() {
        return severity;
    }

    @Override
    public ErrorCategory category() {
        return ErrorCategory.UNKNOWN;
    }
}
