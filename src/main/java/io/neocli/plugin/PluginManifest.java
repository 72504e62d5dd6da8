package io.neocli.plugin;

import com.fasterxml.jackson.databind.JsonNode;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Parsed {@code plugin.json}. {@code minVersion} is informational only.
 */
public record PluginManifest(
        String name,
        String version,
        String description,
        String main,
        String author,
        String homepage,
        String minVersion,
        Boolean enabled,
        Path directory
) {
    public static final String FILE_NAME = "plugin.json";
    public static final String DEFAULT_MAIN = "plugin.jar";

    public static PluginManifest fromJson(JsonNode node, Path directory) {
        JsonNode neo = node.path("neo");
        JsonNode enabled = neo.path("enabled");
        return new PluginManifest(
                text(node, "name"),
                text(node, "version"),
                text(node, "description"),
                text(node, "main"),
                text(node, "author"),
                text(node, "homepage"),
                text(neo, "minVersion"),
                enabled.isBoolean() ? enabled.booleanValue() : null,
                directory
        );
    }

    public List<String> missingFields() {
        List<String> missing = new ArrayList<>(2);
        if (name == null || name.isBlank()) {
            missing.add("name");
        }
        if (version == null || version.isBlank()) {
            missing.add("version");
        }
        return missing;
    }

    public boolean disabled() {
        return Boolean.FALSE.equals(enabled);
    }

    public String entryPoint() {
        return main == null || main.isBlank() ? DEFAULT_MAIN : main;
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value == null || value.isNull() ? null : value.asText();
    }
}
