package io.neocli.plugin;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.neocli.config.ConfigStore;
import io.neocli.errors.ErrorOptions;
import io.neocli.errors.PluginError;
import io.neocli.errors.Result;
import io.neocli.errors.ValidationError;
import io.neocli.util.Jsons;

import java.io.IOException;

/**
 * Cached, dot-path view over a {@link ConfigStore}. The cache is empty until {@link #load()} runs
 * or the context factory's background read lands; values set before then are kept.
 */
final class ConfigurationAdapter implements Configuration {
    static final String CONFIG_SOURCE = "config";

    private final ConfigStore store;
    private ObjectNode cache;
    private boolean dirty;

    ConfigurationAdapter(ConfigStore store) {
        this.store = store;
    }

    @Override
    public synchronized JsonNode get(String key) {
        if (cache == null || key == null) {
            return null;
        }
        JsonNode current = cache;
        for (String part : key.split("\\.")) {
            if (current == null || !current.isObject()) {
                return null;
            }
            current = current.get(part);
        }
        return current;
    }

    @Override
    public <T> T get(String key, Class<T> type) {
        JsonNode node = get(key);
        if (node == null || node.isNull()) {
            return null;
        }
        try {
            return Jsons.mapper().treeToValue(node, type);
        } catch (JsonProcessingException e) {
            throw new ValidationError(
                    "Configuration value at " + key + " is not a " + type.getSimpleName(),
                    key,
                    node.toString(),
                    ErrorOptions.cause(e)
            );
        }
    }

    @Override
    public synchronized void set(String key, Object value) {
        if (cache == null) {
            cache = Jsons.mapper().createObjectNode();
        }
        String[] parts = key.split("\\.");
        ObjectNode current = cache;
        for (int i = 0; i < parts.length - 1; i++) {
            JsonNode next = current.get(parts[i]);
            if (next == null || !next.isObject()) {
                next = current.putObject(parts[i]);
            }
            current = (ObjectNode) next;
        }
        current.set(parts[parts.length - 1], Jsons.mapper().valueToTree(value));
        dirty = true;
    }

    @Override
    public boolean has(String key) {
        return get(key) != null;
    }

    @Override
    public synchronized void delete(String key) {
        if (cache == null) {
            return;
        }
        String[] parts = key.split("\\.");
        ObjectNode current = cache;
        for (int i = 0; i < parts.length - 1; i++) {
            JsonNode next = current.get(parts[i]);
            if (next == null || !next.isObject()) {
                return;
            }
            current = (ObjectNode) next;
        }
        current.remove(parts[parts.length - 1]);
        dirty = true;
    }

    @Override
    public synchronized void clear() {
        cache = Jsons.mapper().createObjectNode();
        dirty = true;
    }

    @Override
    public synchronized ObjectNode getAll() {
        return cache == null ? Jsons.mapper().createObjectNode() : cache.deepCopy();
    }

    @Override
    public Result<Void> validate() {
        return Result.ok();
    }

    @Override
    public synchronized Result<Void> save() {
        if (cache == null) {
            return Result.failure(new PluginError("No configuration to save", CONFIG_SOURCE));
        }
        try {
            store.write(cache);
            dirty = false;
            return Result.ok();
        } catch (IOException | RuntimeException e) {
            return Result.failure(new PluginError("Failed to save configuration: " + e.getMessage(),
                    CONFIG_SOURCE, ErrorOptions.cause(e)));
        }
    }

    @Override
    public synchronized Result<Void> load() {
        try {
            cache = store.read();
            dirty = false;
            return Result.ok();
        } catch (IOException | RuntimeException e) {
            return Result.failure(new PluginError("Failed to load configuration: " + e.getMessage(),
                    CONFIG_SOURCE, ErrorOptions.cause(e)));
        }
    }

    @Override
    public synchronized boolean isDirty() {
        return dirty;
    }

    synchronized void prime(ObjectNode config) {
        if (cache == null && !dirty) {
            cache = config;
        }
    }
}
