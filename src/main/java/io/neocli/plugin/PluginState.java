package io.neocli.plugin;

public enum PluginState {
    LOADED,
    INITIALIZED,
    ERROR,
    DISPOSED
}
