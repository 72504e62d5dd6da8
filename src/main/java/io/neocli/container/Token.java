package io.neocli.container;

import java.util.Objects;

/**
 * Identity under which a dependency is registered. Named tokens are equal by name, class tokens by
 * class, unique tokens only to themselves.
 */
public final class Token<T> {
    private enum Kind { NAMED, UNIQUE, TYPE }

    private final Kind kind;
    private final String description;
    private final Class<T> type;

    private Token(Kind kind, String description, Class<T> type) {
        this.kind = kind;
        this.description = description;
        this.type = type;
    }

    public static <T> Token<T> named(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("token name cannot be empty");
        }
        return new Token<>(Kind.NAMED, name, null);
    }

    public static <T> Token<T> unique(String description) {
        return new Token<>(Kind.UNIQUE, description == null ? "" : description, null);
    }

    public static <T> Token<T> of(Class<T> type) {
        Objects.requireNonNull(type, "type");
        return new Token<>(Kind.TYPE, type.getName(), type);
    }

    public String description() {
        return description;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Token)) {
            return false;
        }
        Token<?> other = (Token<?>) o;
        return switch (kind) {
            case UNIQUE -> false;
            case NAMED -> other.kind == Kind.NAMED && description.equals(other.description);
            case TYPE -> other.kind == Kind.TYPE && type.equals(other.type);
        };
    }

    @Override
    public int hashCode() {
        return switch (kind) {
            case UNIQUE -> System.identityHashCode(this);
            case NAMED -> description.hashCode();
            case TYPE -> type.hashCode();
        };
    }

    @Override
    public String toString() {
        return switch (kind) {
            case UNIQUE -> "Token(" + description + ")";
            case NAMED -> description;
            case TYPE -> type.getSimpleName();
        };
    }
}
