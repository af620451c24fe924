package com.vaultrebalancer.cache;

import java.util.Optional;
import java.util.function.Supplier;

/**
 * Key/value cache whose entries expire a fixed time after they were written.
 *
 * <p>Instances are injected, never static, so every test gets a fresh cache driven by its own
 * clock.
 */
public interface TtlCache<K, V> {

    Optional<V> get(K key);

    void put(K key, V value);

    /**
     * Returns the cached value for {@code key}, or computes, stores and returns a fresh one.
     * When {@code refresh} is true the cached value is ignored and replaced.
     */
    V get(K key, boolean refresh, Supplier<V> loader);

    void invalidate(K key);

    void invalidateAll();
}
