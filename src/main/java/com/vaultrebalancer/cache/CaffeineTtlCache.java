package com.vaultrebalancer.cache;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Ticker;
import java.time.Clock;
import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

/**
 * {@link TtlCache} backed by a Caffeine cache with expire-after-write.
 *
 * <p>Caffeine's {@link Ticker} is driven from the injected {@link Clock}, so a test that
 * advances its clock past the TTL sees the entry expire without sleeping.
 */
public class CaffeineTtlCache<K, V> implements TtlCache<K, V> {

    private final Cache<K, V> cache;

    public CaffeineTtlCache(Duration ttl, long maximumSize, Clock clock) {
        Objects.requireNonNull(clock, "clock");
        this.cache = Caffeine.newBuilder()
                .expireAfterWrite(ttl.toNanos(), TimeUnit.NANOSECONDS)
                .maximumSize(maximumSize)
                .ticker(() -> TimeUnit.MILLISECONDS.toNanos(clock.millis()))
                .executor(Runnable::run)
                .build();
    }

    @Override
    public Optional<V> get(K key) {
        return Optional.ofNullable(cache.getIfPresent(key));
    }

    @Override
    public void put(K key, V value) {
        cache.put(key, value);
    }

    @Override
    public V get(K key, boolean refresh, Supplier<V> loader) {
        if (!refresh) {
            return cache.get(key, k -> loader.get());
        }
        V loaded = loader.get();
        if (loaded != null) {
            cache.put(key, loaded);
        }
        return loaded;
    }

    @Override
    public void invalidate(K key) {
        cache.invalidate(key);
    }

    @Override
    public void invalidateAll() {
        cache.invalidateAll();
    }
}
