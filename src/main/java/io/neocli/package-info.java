/**
 * neo source tree root.
 *
 * <p>Primary entry points while reading code:
 *
 * <ul>
 *   <li>{@code io.neocli.Main} bootstraps the CLI process.</li>
 *   <li>{@code io.neocli.cli.NeoCommand} mounts built-in and plugin commands on picocli.</li>
 *   <li>{@code io.neocli.runtime.NeoRuntime} wires the shared runtime objects together.</li>
 *   <li>{@code io.neocli.plugin.PluginRegistry} drives plugin initialization, hooks, and disposal.</li>
 * </ul>
 */
package io.neocli;
