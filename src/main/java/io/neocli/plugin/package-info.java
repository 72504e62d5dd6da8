/**
 * Plugin discovery, loading and lifecycle.
 *
 * <p>A plugin is a directory under the plugins root holding {@code plugin.json} and a JAR that
 * exports one {@link io.neocli.plugin.Plugin} through {@link java.util.ServiceLoader}.
 */
package io.neocli.plugin;
