package io.neocli.plugin;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URL;
import java.net.URLClassLoader;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.ServiceLoader;

/**
 * Loads a plugin JAR in its own classloader and takes the first {@link Plugin} service it declares.
 * Classloaders stay open for the process lifetime; {@link #close()} releases them at exit.
 */
public final class JarPluginModuleLoader implements PluginModuleLoader {
    private static final Logger log = LoggerFactory.getLogger(JarPluginModuleLoader.class);

    private final ClassLoader hostLoader;
    private final List<URLClassLoader> loaders = new ArrayList<>();

    public JarPluginModuleLoader() {
        this(Plugin.class.getClassLoader());
    }

    public JarPluginModuleLoader(ClassLoader hostLoader) {
        this.hostLoader = hostLoader;
    }

    @Override
    public Object load(Path entryPoint) throws IOException {
        URL jarUrl = entryPoint.toUri().toURL();
        URLClassLoader loader = new URLClassLoader(new URL[]{jarUrl}, hostLoader);
        loaders.add(loader);

        Iterator<Plugin> providers = ServiceLoader.load(Plugin.class, loader).iterator();
        if (!providers.hasNext()) {
            return null;
        }
        Plugin first = providers.next();
        if (providers.hasNext()) {
            log.debug("{} declares more than one plugin; using {}", entryPoint.getFileName(), first.getClass().getName());
        }
        return first;
    }

    @Override
    public void close() {
        for (URLClassLoader loader : loaders) {
            try {
                loader.close();
            } catch (IOException e) {
                log.debug("Failed to close plugin classloader: {}", e.getMessage());
            }
        }
        loaders.clear();
    }
}
