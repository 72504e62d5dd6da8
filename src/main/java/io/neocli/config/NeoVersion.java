package io.neocli.config;

import java.io.IOException;
import java.io.InputStream;
import java.util.Properties;

public final class NeoVersion {
    static final String RESOURCE = "/neo-version.properties";
    static final String FALLBACK = "0.0.0-dev";

    private static final String VERSION = load();

    private NeoVersion() {
    }

    public static String current() {
        return VERSION;
    }

    private static String load() {
        try (InputStream in = NeoVersion.class.getResourceAsStream(RESOURCE)) {
            if (in == null) {
                return FALLBACK;
            }
            Properties props = new Properties();
            props.load(in);
            String value = props.getProperty("version", "").trim();
            return value.isEmpty() || value.startsWith("${") ? FALLBACK : value;
        } catch (IOException e) {
            return FALLBACK;
        }
    }
}
