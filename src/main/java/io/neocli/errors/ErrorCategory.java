package io.neocli.errors;

public enum ErrorCategory {
    VALIDATION,
    CONFIGURATION,
    FILESYSTEM,
    NETWORK,
    COMMAND,
    PLUGIN,
    AUTHENTICATION,
    PERMISSION,
    UNKNOWN
}
