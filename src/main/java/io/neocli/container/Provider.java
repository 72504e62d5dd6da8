package io.neocli.container;

import java.lang.reflect.InvocationTargetException;
import java.util.Objects;
import java.util.function.Supplier;

/**
 * How the container produces a value for a token.
 */
public interface Provider<T> {
    T provide(Container container);

    static <T> Provider<T> value(T value) {
        return new ValueProvider<>(value);
    }

    static <T> Provider<T> type(Class<? extends T> type) {
        return new ClassProvider<>(Objects.requireNonNull(type, "type"));
    }

    static <T> Provider<T> factory(Supplier<? extends T> factory) {
        return new FactoryProvider<>(Objects.requireNonNull(factory, "factory"));
    }

    static <T> Provider<T> existing(Token<? extends T> token) {
        return new ExistingProvider<>(Objects.requireNonNull(token, "token"));
    }

    record ValueProvider<T>(T value) implements Provider<T> {
        @Override
        public T provide(Container container) {
            return value;
        }
    }

    record ClassProvider<T>(Class<? extends T> type) implements Provider<T> {
        @Override
        public T provide(Container container) {
            try {
                return type.getDeclaredConstructor().newInstance();
            } catch (InvocationTargetException e) {
                Throwable cause = e.getCause() == null ? e : e.getCause();
                throw new IllegalStateException("Failed to construct " + type.getName() + ": " + cause.getMessage(), cause);
            } catch (ReflectiveOperationException e) {
                throw new IllegalStateException("Cannot instantiate " + type.getName()
                        + " (a public no-arg constructor is required)", e);
            }
        }
    }

    record FactoryProvider<T>(Supplier<? extends T> factory) implements Provider<T> {
        @Override
        public T provide(Container container) {
            return factory.get();
        }
    }

    record ExistingProvider<T>(Token<? extends T> token) implements Provider<T> {
        @Override
        public T provide(Container container) {
            return container.resolve(token);
        }
    }
}
