package io.neocli.config;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Map;

public final class NeoConfig {
    public static final String CONFIG_DIR_ENV = "NEO_CONFIG_DIR";
    public static final String CONFIG_FILE_NAME = "config.json";
    public static final String PLUGINS_DIR_NAME = "plugins";
    public static final String PROFILES_DIR_NAME = "profiles";

    private final Path configDir;

    public NeoConfig(Path configDir) {
        this.configDir = configDir.toAbsolutePath().normalize();
    }

    public static NeoConfig fromDirectory(String dir) {
        return fromDirectory(dir, System.getenv(), System.getProperty("user.home"));
    }

    static NeoConfig fromDirectory(String dir, Map<String, String> env, String userHome) {
        if (dir != null && !dir.isBlank()) {
            return new NeoConfig(Paths.get(dir.trim()));
        }
        String fromEnv = env == null ? null : env.get(CONFIG_DIR_ENV);
        if (fromEnv != null && !fromEnv.isBlank()) {
            return new NeoConfig(Paths.get(fromEnv.trim()));
        }
        String home = userHome == null || userHome.isBlank() ? "." : userHome;
        return new NeoConfig(Paths.get(home, ".config", "neo"));
    }

    public Path configDir() {
        return configDir;
    }

    public Path configFile() {
        return configDir.resolve(CONFIG_FILE_NAME);
    }

    public Path pluginsDir() {
        return configDir.resolve(PLUGINS_DIR_NAME);
    }

    public Path profilesDir() {
        return configDir.resolve(PROFILES_DIR_NAME);
    }
}
