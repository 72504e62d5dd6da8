package io.neocli.container;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.function.Supplier;

/**
 * Token to provider registry with singleton/transient lifetimes and child scopes.
 * A scope falls back to its parent only for tokens it does not register itself, and never
 * mutates the parent.
 */
public final class Container {
    private record Registration<T>(Provider<T> provider, Lifetime lifetime) {
    }

    private final Map<Token<?>, Registration<?>> registrations = new HashMap<>();
    private final Map<Token<?>, Object> instances = new HashMap<>();
    private final Deque<Token<?>> resolving = new ArrayDeque<>();
    private final Container parent;

    public Container() {
        this(null);
    }

    private Container(Container parent) {
        this.parent = parent;
    }

    public <T> void register(Token<T> token, Provider<T> provider) {
        register(token, provider, Lifetime.SINGLETON);
    }

    public <T> void register(Token<T> token, Provider<T> provider, Lifetime lifetime) {
        Objects.requireNonNull(token, "token");
        Objects.requireNonNull(provider, "provider");
        registrations.put(token, new Registration<>(provider, lifetime == null ? Lifetime.SINGLETON : lifetime));
        instances.remove(token);
    }

    public <T> void registerValue(Token<T> token, T value) {
        register(token, Provider.value(value), Lifetime.SINGLETON);
    }

    public <T> void registerClass(Token<T> token, Class<? extends T> type) {
        registerClass(token, type, Lifetime.SINGLETON);
    }

    public <T> void registerClass(Token<T> token, Class<? extends T> type, Lifetime lifetime) {
        register(token, Provider.type(type), lifetime);
    }

    public <T> void registerFactory(Token<T> token, Supplier<? extends T> factory) {
        registerFactory(token, factory, Lifetime.SINGLETON);
    }

    public <T> void registerFactory(Token<T> token, Supplier<? extends T> factory, Lifetime lifetime) {
        register(token, Provider.factory(factory), lifetime);
    }

    /**
     * @throws IllegalStateException if no provider is registered for the token here or in any ancestor,
     *                               or an alias chain leads back to a token already being resolved
     */
    @SuppressWarnings("unchecked")
    public <T> T resolve(Token<T> token) {
        Objects.requireNonNull(token, "token");
        Registration<T> registration = (Registration<T>) registrations.get(token);
        if (registration == null) {
            if (parent != null) {
                return parent.resolve(token);
            }
            throw new IllegalStateException("No provider registered for token: " + token);
        }

        if (registration.lifetime() == Lifetime.SINGLETON && instances.containsKey(token)) {
            return (T) instances.get(token);
        }

        if (resolving.contains(token)) {
            throw new IllegalStateException("Circular dependency while resolving token: " + token);
        }
        resolving.push(token);
        T instance;
        try {
            instance = registration.provider().provide(this);
        } finally {
            resolving.pop();
        }

        if (registration.lifetime() == Lifetime.SINGLETON) {
            instances.put(token, instance);
        }
        return instance;
    }

    public boolean has(Token<?> token) {
        if (registrations.containsKey(token)) {
            return true;
        }
        return parent != null && parent.has(token);
    }

    public Container createScope() {
        return new Container(this);
    }

    public void clear() {
        registrations.clear();
        instances.clear();
    }

    public int size() {
        return registrations.size();
    }
}
