package io.neocli.plugin;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.neocli.errors.Result;

/**
 * Plugin view of the persisted configuration. Keys are dot-separated paths such as
 * {@code preferences.theme}.
 */
public interface Configuration {
    JsonNode get(String key);

    <T> T get(String key, Class<T> type);

    void set(String key, Object value);

    boolean has(String key);

    void delete(String key);

    void clear();

    ObjectNode getAll();

    Result<Void> validate();

    Result<Void> save();

    Result<Void> load();

    boolean isDirty();
}
