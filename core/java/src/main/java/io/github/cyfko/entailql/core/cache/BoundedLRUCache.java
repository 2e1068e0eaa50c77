package io.github.cyfko.entailql.core.cache;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Function;

/**
 * A bounded LRU (Least Recently Used) cache.
 * <p>
 * Backed by an access-ordered {@link LinkedHashMap} that drops its eldest entry once the
 * capacity is exceeded. A lookup counts as a use, so the entry evicted is always the one that
 * was read or written least recently.
 * </p>
 *
 * <h2>Thread Safety</h2>
 * <p>
 * Every operation runs under a single {@link ReentrantLock}: an access-ordered map reorders
 * itself on {@code get}, so reads mutate state too. {@link #computeIfAbsent(Object, Function)}
 * computes under the lock, so concurrent callers for the same key compute the value once.
 * </p>
 *
 * <pre>{@code
 * BoundedLRUCache<String, CompiledPremise> cache = new BoundedLRUCache<>(256);
 * CompiledPremise premise = cache.computeIfAbsent("a => b", this::doCompile);
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
    private long hits;
    private long misses;

    /**
     * Creates a bounded LRU cache with the specified maximum size.
     *
     * @param maxSize the maximum number of entries to store
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
     * Retrieves a value, marking it as most recently used.
     *
     * @param key the key to look up
     * @return the cached value, or null if not present
     */
    public V get(K key) {
        lock.lock();
        try {
            return entries.get(key);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Stores a value, evicting the least recently used entry if the cache is full.
     *
     * @param key   the key to store
     * @param value the value to store
     */
    public void put(K key, V value) {
        lock.lock();
        try {
            entries.put(key, value);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Returns the cached value for a key, computing and storing it first if absent.
     * Exceptions thrown by the mapping function propagate and leave the cache unchanged.
     *
     * @param key             the key to compute for
     * @param mappingFunction the function to compute the value
     * @return the cached or newly computed value
     */
    public V computeIfAbsent(K key, Function<? super K, ? extends V> mappingFunction) {
        lock.lock();
        try {
            V value = entries.get(key);
            if (value != null) {
                hits++;
                return value;
            }
            misses++;
            value = mappingFunction.apply(key);
            if (value != null) {
                entries.put(key, value);
            }
            return value;
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

    public boolean containsKey(K key) {
        lock.lock();
        try {
            return entries.containsKey(key);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Removes all entries and resets the hit and miss counters.
     */
    public void clear() {
        lock.lock();
        try {
            entries.clear();
            hits = 0;
            misses = 0;
        } finally {
            lock.unlock();
        }
    }

    public int getMaxSize() {
        return maxSize;
    }

    public long getHits() {
        lock.lock();
        try {
            return hits;
        } finally {
            lock.unlock();
        }
    }

    public long getMisses() {
        lock.lock();
        try {
            return misses;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Returns cache statistics as a formatted string.
     *
     * @return statistics string
     */
    public String getStats() {
        lock.lock();
        try {
            return String.format("BoundedLRUCache[size=%d, maxSize=%d, hits=%d, misses=%d]",
                    entries.size(), maxSize, hits, misses);
        } finally {
            lock.unlock();
        }
    }
}
