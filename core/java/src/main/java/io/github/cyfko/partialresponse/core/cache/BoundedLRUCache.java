package io.github.cyfko.partialresponse.core.cache;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Function;

/**
 * A bounded, thread-safe LRU cache.
 * <p>
 * Backed by an access-ordered {@link LinkedHashMap}: every hit moves the entry to the most-recently-used end,
 * and the eldest entry is evicted once the capacity is exceeded. Since lookups reorder the map, reads and
 * writes share a single lock.
 * </p>
 *
 * <pre>{@code
 * BoundedLRUCache<String, ParseResult> cache = new BoundedLRUCache<>(1000);
 * ParseResult result = cache.computeIfAbsent(selector, this::parseUncached);
 * }</pre>
 *
 * @param <K> the type of keys
 * @param <V> the type of values
 * @author Frank KOSSI
 * @since 1.0.0
 */
public class BoundedLRUCache<K, V> {

    private final int maxSize;
    private final Map<K, V> entries;
    private final Lock lock = new ReentrantLock();

    /**
     * @param maxSize the maximum number of entries to keep
     * @throws IllegalArgumentException if maxSize is not positive
     */
    public BoundedLRUCache(int maxSize) {
        if (maxSize <= 0) {
            throw new IllegalArgumentException("maxSize must be positive, got: " + maxSize);
        }
        this.maxSize = maxSize;
        this.entries = new LinkedHashMap<>(16, 0.75f, true) {
            @Override
            protected boolean removeEldestEntry(Map.Entry<K, V> eldest) {
                return size() > BoundedLRUCache.this.maxSize;
            }
        };
    }

    /**
     * @param key the key to look up
     * @return the cached value, or {@code null} if absent
     */
    public V get(K key) {
        lock.lock();
        try {
            return entries.get(key);
        } finally {
            lock.unlock();
        }
    }

    public void put(K key, V value) {
        Objects.requireNonNull(value, "value");
        lock.lock();
        try {
            entries.put(key, value);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Returns the cached value for the key, computing and caching it first if needed.
     * <p>
     * The mapping function runs outside the lock, so two threads missing on the same key may both compute it;
     * the first value stored wins and is returned to both.
     * </p>
     *
     * @param key             the key
     * @param mappingFunction computes the value on a miss; must not return {@code null}
     * @return the cached or newly computed value
     */
    public V computeIfAbsent(K key, Function<? super K, ? extends V> mappingFunction) {
        V value = get(key);
        if (value != null) {
            return value;
        }

        V computed = Objects.requireNonNull(mappingFunction.apply(key), "computed value");
        lock.lock();
        try {
            V existing = entries.putIfAbsent(key, computed);
            return existing != null ? existing : computed;
        } finally {
            lock.unlock();
        }
    }

    public int size() {
        lock.lock();
        try {
            return entries.size();
        } finally {
            lock.unlock();
        }
    }

    public void clear() {
        lock.lock();
        try {
            entries.clear();
        } finally {
            lock.unlock();
        }
    }

    public int getMaxSize() {
        return maxSize;
    }
}
