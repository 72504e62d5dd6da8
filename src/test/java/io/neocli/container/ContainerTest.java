package io.neocli.container;

import org.junit.jupiter.api.Test;

import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ContainerTest {
    @Test
    void valueRegistrationResolvesToSameObject() {
        Container container = new Container();
        Token<String> name = Token.named("appName");
        container.registerValue(name, "neo");

        assertEquals("neo", container.resolve(name));
        assertEquals("neo", container.resolve(Token.named("appName")));
    }

    @Test
    void singletonFactoryRunsOnce() {
        Container container = new Container();
        AtomicInteger calls = new AtomicInteger();
        Token<Object> token = Token.unique("service");
        container.registerFactory(token, () -> {
            calls.incrementAndGet();
            return new Object();
        });

        Object first = container.resolve(token);
        Object second = container.resolve(token);

        assertSame(first, second);
        assertEquals(1, calls.get());
    }

    @Test
    void transientFactoryRunsPerResolution() {
        Container container = new Container();
        AtomicInteger calls = new AtomicInteger();
        Token<Object> token = Token.unique("transient");
        container.registerFactory(token, () -> {
            calls.incrementAndGet();
            return new Object();
        }, Lifetime.TRANSIENT);

        assertNotSame(container.resolve(token), container.resolve(token));
        assertEquals(2, calls.get());
    }

    @Test
    void transientFactoryYieldsFreshValues() {
        Container container = new Container();
        AtomicInteger n = new AtomicInteger();
        Token<Integer> token = Token.named("rand");
        container.registerFactory(token, n::incrementAndGet, Lifetime.TRANSIENT);

        assertEquals(1, container.resolve(token));
        assertEquals(2, container.resolve(token));
        assertEquals(3, container.resolve(token));
    }

    @Test
    void singletonMutationIsVisibleThroughLaterResolves() {
        Container container = new Container();
        Token<Counter> token = Token.named("counter");
        container.registerClass(token, Counter.class);

        container.resolve(token).count = 5;

        assertEquals(5, container.resolve(token).count);
    }

    @Test
    void classRegistrationConstructsWithNoArgConstructor() {
        Container container = new Container();
        Token<Counter> token = Token.of(Counter.class);
        container.registerClass(token, Counter.class);

        Counter counter = container.resolve(token);
        assertSame(counter, container.resolve(Token.of(Counter.class)));
    }

    @Test
    void classWithoutNoArgConstructorFailsOnResolve() {
        Container container = new Container();
        Token<NeedsArgs> token = Token.of(NeedsArgs.class);
        container.registerClass(token, NeedsArgs.class);

        assertThrows(IllegalStateException.class, () -> container.resolve(token));
    }

    @Test
    void reRegistrationDropsCachedSingleton() {
        Container container = new Container();
        Token<String> token = Token.named("greeting");
        container.registerValue(token, "hello");
        assertEquals("hello", container.resolve(token));

        container.registerValue(token, "hi");

        assertEquals("hi", container.resolve(token));
        assertEquals(1, container.size());
    }

    @Test
    void unknownTokenFails() {
        Container container = new Container();
        IllegalStateException error = assertThrows(IllegalStateException.class,
                () -> container.resolve(Token.named("missing")));
        assertTrue(error.getMessage().contains("missing"));
    }

    @Test
    void uniqueTokensNeverCollide() {
        Container container = new Container();
        Token<String> first = Token.unique("config");
        Token<String> second = Token.unique("config");
        container.registerValue(first, "a");

        assertTrue(container.has(first));
        assertFalse(container.has(second));
        assertThrows(IllegalStateException.class, () -> container.resolve(second));
    }

    @Test
    void scopeOverridesWithoutTouchingParent() {
        Container root = new Container();
        Token<String> token = Token.named("x");
        root.registerValue(token, "A");

        Container scope = root.createScope();
        scope.registerValue(token, "B");

        assertEquals("B", scope.resolve(token));
        assertEquals("A", root.resolve(token));
    }

    @Test
    void scopeFallsBackToParent() {
        Container root = new Container();
        Token<String> token = Token.named("shared");
        root.registerValue(token, "parent");

        Container scope = root.createScope();

        assertTrue(scope.has(token));
        assertEquals("parent", scope.resolve(token));
        assertEquals(0, scope.size());
    }

    @Test
    void parentSingletonIsSharedWithScopes() {
        Container root = new Container();
        Token<Object> token = Token.unique("singleton");
        root.registerFactory(token, Object::new);

        assertSame(root.resolve(token), root.createScope().resolve(token));
    }

    @Test
    void clearingScopeLeavesParentIntact() {
        Container root = new Container();
        Token<String> token = Token.named("kept");
        root.registerValue(token, "value");
        Container scope = root.createScope();
        scope.registerValue(Token.named("local"), "scoped");

        scope.clear();

        assertEquals(0, scope.size());
        assertEquals("value", scope.resolve(token));
        assertFalse(scope.has(Token.named("local")));
    }

    @Test
    void existingProviderAliasesAnotherToken() {
        Container container = new Container();
        Token<String> original = Token.named("original");
        Token<String> alias = Token.named("alias");
        container.registerValue(original, "value");
        container.register(alias, Provider.existing(original));

        assertEquals("value", container.resolve(alias));
    }

    @Test
    void circularAliasFails() {
        Container container = new Container();
        Token<String> a = Token.named("a");
        Token<String> b = Token.named("b");
        container.register(a, Provider.existing(b));
        container.register(b, Provider.existing(a));

        IllegalStateException error = assertThrows(IllegalStateException.class, () -> container.resolve(a));
        assertTrue(error.getMessage().startsWith("Circular dependency"));
        assertThrows(IllegalStateException.class, () -> container.resolve(a));
    }

    @Test
    void tokenEquality() {
        assertEquals(Token.named("x"), Token.named("x"));
        assertEquals(Token.named("x").hashCode(), Token.named("x").hashCode());
        assertEquals(Token.of(String.class), Token.of(String.class));
        assertFalse(Token.named("java.lang.String").equals(Token.of(String.class)));
        Token<Object> unique = Token.unique("u");
        assertEquals(unique, unique);
        assertThrows(IllegalArgumentException.class, () -> Token.named(" "));
    }

    public static class Counter {
        int count;

        public Counter() {
        }
    }

    public static class NeedsArgs {
        public NeedsArgs(String value) {
        }
    }
}
