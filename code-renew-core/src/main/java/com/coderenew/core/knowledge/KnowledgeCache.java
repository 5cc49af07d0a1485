package com.coderenew.core.knowledge;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Collection;
import java.util.Comparator;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;

/**
 * Size-bounded cache whose entries expire a fixed time after they were stored.
 *
 * <p>Entries are never invalidated explicitly; an expired entry is replaced the
 * next time its key is requested. {@link #computeIfAbsent} is atomic per key, so
 * concurrent callers for the same missing key share one loaded value.
 *
 * @param <K> key type
 * @param <V> value type
 */
public final class KnowledgeCache<K, V> {

    /**
     * Cached value with the time it was stored.
     *
     * @param value cached value
     * @param storedAt store time
     * @param <V> value type
     */
    public record KnowledgeCacheEntry<V>(V value, Instant storedAt) {

        boolean isExpired(Instant now, Duration ttl) {
            return !now.isBefore(storedAt.plus(ttl));
        }
    }

    private final Map<K, KnowledgeCacheEntry<V>> entries = new ConcurrentHashMap<>();
    private final Clock clock;
    private final Duration ttl;
    private final int maxEntries;

    public KnowledgeCache(Clock clock, Duration ttl, int maxEntries) {
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.ttl = Objects.requireNonNull(ttl, "ttl must not be null");
        if (maxEntries <= 0) {
            throw new IllegalArgumentException("maxEntries must be positive: " + maxEntries);
        }
        this.maxEntries = maxEntries;
    }

    /**
     * Returns the live value for the key, loading and storing it if absent or expired.
     *
     * @param key cache key
     * @param loader value loader, called at most once per miss
     * @return cached or freshly loaded value
     */
    public V computeIfAbsent(K key, Function<K, V> loader) {
        Instant now = clock.instant();
        KnowledgeCacheEntry<V> current = entries.get(key);
        if (current != null && !current.isExpired(now, ttl)) {
            return current.value();
        }
        if (current == null) {
            evictIfFull(now);
        }
        return entries.compute(key, (k, existing) -> {
            if (existing != null && !existing.isExpired(now, ttl)) {
                return existing;
            }
            return new KnowledgeCacheEntry<>(loader.apply(k), now);
        }).value();
    }

    /**
     * Returns the live value for the key without loading.
     *
     * @param key cache key
     * @return value, empty if absent or expired
     */
    public Optional<V> getIfPresent(K key) {
        KnowledgeCacheEntry<V> entry = entries.get(key);
        if (entry == null || entry.isExpired(clock.instant(), ttl)) {
            return Optional.empty();
        }
        return Optional.of(entry.value());
    }

    /**
     * Returns all unexpired values.
     *
     * @return live values
     */
    public Collection<V> liveValues() {
        Instant now = clock.instant();
        return entries.values().stream()
            .filter(entry -> !entry.isExpired(now, ttl))
            .map(KnowledgeCacheEntry::value)
            .toList();
    }

    public int size() {
        return entries.size();
    }

    private void evictIfFull(Instant now) {
        if (entries.size() < maxEntries) {
            return;
        }
        entries.entrySet().removeIf(e -> e.getValue().isExpired(now, ttl));
        while (entries.size() >= maxEntries) {
            entries.entrySet().stream()
                .min(Comparator.comparing(e -> e.getValue().storedAt()))
                .map(Map.Entry::getKey)
                .ifPresent(entries::remove);
        }
    }
}
