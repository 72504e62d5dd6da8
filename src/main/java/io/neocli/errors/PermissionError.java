package io.neocli.errors;

public class PermissionError extends AppError {
    private final String resource;
    private final String requiredPermission;

    public PermissionError(String message, String resource) {
        this(message, resource, null, ErrorOptions.NONE);
    }

    public PermissionError(String message, String resource, String requiredPermission) {
        this(message, resource, requiredPermission, ErrorOptions.NONE);
    }

    public PermissionError(String message, String resource, String requiredPermission, ErrorOptions options) {
        super(message, options);
        this.resource = resource;
        this.requiredPermission = requiredPermission;
    }

    public String resource() {
        return resource;
    }

    public String requiredPermission() {
        return requiredPermission;
    }

    @Override
    public String code() {
        return "PERMISSION_ERROR";
    }

    @Override
    public ErrorSeverity severity() {
        return ErrorSeverity.HIGH;
    }

    @Override
    public ErrorCategory category() {
        return ErrorCategory.PERMISSION;
    }
}
