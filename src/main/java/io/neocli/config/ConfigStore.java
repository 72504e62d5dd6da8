package io.neocli.config;

import com.fasterxml.jackson.databind.node.ObjectNode;

import java.io.IOException;

/**
 * Persisted configuration document.
 */
public interface ConfigStore {
    ObjectNode read() throws IOException;

    void write(ObjectNode config) throws IOException;
}
