package io.neocli.plugin;

/**
 * Exported through a services file written into test JARs at runtime.
 */
public class ServicePlugin implements Plugin {
    public ServicePlugin() {
    }

    @Override
    public String name() {
        return "service-plugin";
    }

    @Override
    public String version() {
        return "1.0.0";
    }

    @Override
    public void initialize(PluginContext context) {
    }
}
