package io.neocli.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.neocli.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Instant;
import java.util.Iterator;
import java.util.Map;
import java.util.Optional;

/**
 * {@code config.json} under the configuration directory, deep-merged over the built-in defaults on read.
 */
public final class JsonFileConfigStore implements ConfigStore {
    private static final Logger log = LoggerFactory.getLogger(JsonFileConfigStore.class);

    private final Path configFile;

    public JsonFileConfigStore(Path configFile) {
        this.configFile = configFile;
    }

    public Path configFile() {
        return configFile;
    }

    public boolean isInitialized() {
        return Files.exists(configFile);
    }

    public static ObjectNode defaults() {
        ObjectNode root = Jsons.mapper().createObjectNode();
        root.put("activeProfile", "default");
        root.putObject("autoSwitch");
        root.putObject("plugins").put("enabled", true);
        ObjectNode preferences = root.putObject("preferences");
        preferences.putObject("aliases").put("n", true);
        preferences.put("banner", "full");
        preferences.put("theme", "auto");
        ObjectNode updates = root.putObject("updates");
        updates.putNull("lastCheckedAt");
        updates.putNull("latestVersion");
        root.putObject("user");
        return root;
    }

    @Override
    public ObjectNode read() {
        ObjectNode merged = defaults();
        if (!isInitialized()) {
            return merged;
        }
        try {
            JsonNode stored = Jsons.mapper().readTree(configFile.toFile());
            if (stored == null || !stored.isObject()) {
                log.warn("Ignoring config file {}: top-level value is not an object", configFile);
                return merged;
            }
            merge(merged, (ObjectNode) stored);
            return merged;
        } catch (IOException e) {
            log.warn("Failed to read config file {}: {}", configFile, e.getMessage());
            return defaults();
        }
    }

    @Override
    public void write(ObjectNode config) throws IOException {
        Path parent = configFile.getParent();
        if (parent != null && !Files.isDirectory(parent)) {
            Files.createDirectories(parent);
            log.debug("Created config directory: {}", parent);
        }
        Jsons.mapper().writerWithDefaultPrettyPrinter().writeValue(configFile.toFile(), config);
        log.debug("Config saved to: {}", configFile);
    }

    public Optional<Path> backup() {
        if (!isInitialized()) {
            return Optional.empty();
        }
        String stamp = Instant.now().toString().replace(':', '-').replace('.', '-');
        Path backupFile = configFile.resolveSibling("config.backup." + stamp + ".json");
        try {
            Files.copy(configFile, backupFile, StandardCopyOption.REPLACE_EXISTING);
            log.debug("Config backed up to: {}", backupFile);
            return Optional.of(backupFile);
        } catch (IOException e) {
            log.warn("Failed to backup config: {}", e.getMessage());
            return Optional.empty();
        }
    }

    static void merge(ObjectNode target, ObjectNode overlay) {
        Iterator<Map.Entry<String, JsonNode>> fields = overlay.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> entry = fields.next();
            JsonNode existing = target.get(entry.getKey());
            JsonNode incoming = entry.getValue();
            if (existing != null && existing.isObject() && incoming != null && incoming.isObject()) {
                merge((ObjectNode) existing, (ObjectNode) incoming);
            } else {
                target.set(entry.getKey(), incoming);
            }
        }
    }
}
