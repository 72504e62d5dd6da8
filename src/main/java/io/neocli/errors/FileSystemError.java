package io.neocli.errors;

import java.util.Locale;

public class FileSystemError extends AppError {
    public enum Operation {
        READ,
        WRITE,
        DELETE,
        CREATE,
        ACCESS;

        public String label() {
            return name().toLowerCase(Locale.ROOT);
        }
    }

    private final String path;
    private final Operation operation;

    public FileSystemError(String message, String path, Operation operation) {
        this(message, path, operation, ErrorOptions.NONE);
    }

    public FileSystemError(String message, String path, Operation operation, ErrorOptions options) {
        super(message, options);
        this.path = path;
        this.operation = operation;
    }

    public String path() {
        return path;
    }

    public Operation operation() {
        return operation;
    }

    @Override
    public String code() {
        return "FILESYSTEM_ERROR";
    }

    @Override
    public ErrorSeverity severity() {
        return ErrorSeverity.MEDIUM;
    }

    @Override
    public ErrorCategory category() {
        return ErrorCategory.FILESYSTEM;
    }
}
