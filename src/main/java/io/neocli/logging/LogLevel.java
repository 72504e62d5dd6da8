package io.neocli.logging;

public enum LogLevel {
    DEBUG,
    INFO,
    WARN,
    ERROR,
    NONE
}
