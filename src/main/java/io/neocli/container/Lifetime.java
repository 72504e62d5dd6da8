package io.neocli.container;

public enum Lifetime {
    SINGLETON,
    TRANSIENT
}
