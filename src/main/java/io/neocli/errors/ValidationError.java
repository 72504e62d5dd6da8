package io.neocli.errors;

public class ValidationError extends AppError {
    private final String field;
    private final Object value;

    public ValidationError(String message) {
        this(message, null, null, ErrorOptions.NONE);
    }

    public ValidationError(String message, String field, Object value) {
        this(message, field, value, ErrorOptions.NONE);
    }

    public ValidationError(String message, String field, Object value, ErrorOptions options) {
        super(message, options);
        this.field = field;
        this.value = value;
    }

    public String field() {
        return field;
    }

    public Object value() {
        return value;
    }

    @Override
    public String code() {
        return "VALIDATION_ERROR";
    }

    @Override
    public ErrorSeverity severity() {
        return ErrorSeverity.LOW;
    }

    @Override
    public ErrorCategory category() {
        return ErrorCategory.VALIDATION;
    }
}
