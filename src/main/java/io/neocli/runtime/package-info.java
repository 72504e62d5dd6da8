/**
 * Composition root package.
 *
 * <p>{@link io.neocli.runtime.NeoRuntime} builds the event bus, command registry, error handler,
 * plugin loader and plugin registry once per process and publishes them in the container under
 * the keys in {@link io.neocli.runtime.Tokens}.
 */
package io.neocli.runtime;
