package io.neocli.errors;

import java.util.Locale;

public enum ErrorSeverity {
    LOW,
    MEDIUM,
    HIGH,
    CRITICAL;

    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
