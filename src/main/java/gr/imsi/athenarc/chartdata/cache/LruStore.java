package gr.imsi.athenarc.chartdata.cache;

import com.google.common.base.MoreObjects;
import com.google.common.base.Preconditions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * A bounded key-value store that evicts the least recently used entries once either
 * its item capacity or its memory budget is exceeded.
 * <p>
 * When a memory budget is configured it is authoritative and the item capacity is
 * not enforced. Entry sizes come from the configured {@link SizeCalculator}; without
 * one every entry counts as a single unit. A value larger than the whole budget is
 * still admitted, and ends up as the only resident of the store.
 * <p>
 * Reads refresh recency, so {@link #get(Object)} takes the write lock as well. Only
 * {@link #peek(Object)}, {@link #has(Object)}, {@link #keys()} and the reporting
 * methods run under the read lock.
 *
 * @param <K> key type
 * @param <V> value type
 */
public class LruStore<K, V> {

    private static final Logger LOG = LoggerFactory.getLogger(LruStore.class);

    public static final int DEFAULT_CAPACITY = 100;

    // iteration starts at the least recently used entry, reads move a key to the end
    private final LinkedHashMap<K, V> entries;
    private final Map<K, Long> sizes;
    private final ReadWriteLock lock;

    private final int capacity;
    private final long maxMemory;
    private final SizeCalculator<V> sizeCalculator;
    private final RemovalListener<K, V> removalListener;

    private long currentMemory;
    private final AtomicLong hits = new AtomicLong();
    private final AtomicLong misses = new AtomicLong();

    private LruStore(Builder<K, V> builder) {
        this.capacity = builder.capacity;
        this.maxMemory = builder.maxMemory;
        this.sizeCalculator = builder.sizeCalculator;
        this.removalListener = builder.removalListener;
        this.entries = new LinkedHashMap<>();
        this.sizes = new HashMap<>();
        this.lock = new ReentrantReadWriteLock();
    }

    public static <K, V> Builder<K, V> builder() {
        return new Builder<>();
    }

    /**
     * Returns the value for {@code key} and marks it as the most recently used entry,
     * or {@code null} when the key is not present.
     */
    public V get(K key) {
        lock.writeLock().lock();
        try {
            V value = entries.remove(key);
            if (value != null) {
                entries.put(key, value);
                hits.incrementAndGet();
            } else {
                misses.incrementAndGet();
            }
            return value;
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Returns the value for {@code key} without touching recency or hit statistics.
     */
    public V peek(K key) {
        lock.readLock().lock();
        try {
            return entries.get(key);
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Inserts or replaces the value for {@code key}, evicting least recently used
     * entries one at a time until the new value fits.
     */
    public void set(K key, V value) {
        Preconditions.checkNotNull(key, "key");
        Preconditions.checkNotNull(value, "value");
        long valueSize = sizeCalculator != null ? sizeCalculator.sizeOf(value) : 1L;
        List<Map.Entry<K, V>> evicted = new ArrayList<>();

        lock.writeLock().lock();
        try {
            // a replacement behaves like a removal followed by a fresh insert
            if (entries.remove(key) != null) {
                currentMemory -= sizes.remove(key);
            }

            if (maxMemory > 0) {
                while (currentMemory + valueSize > maxMemory && !entries.isEmpty()) {
                    evicted.add(evictEldest());
                }
            } else {
                while (entries.size() >= capacity && !entries.isEmpty()) {
                    evicted.add(evictEldest());
                }
            }

            entries.put(key, value);
            sizes.put(key, valueSize);
            currentMemory += valueSize;
        } finally {
            lock.writeLock().unlock();
        }

        if (maxMemory > 0 && valueSize > maxMemory) {
            LOG.warn("Value for key {} ({} bytes) exceeds the whole memory budget of {} bytes", key, valueSize, maxMemory);
        }
        notifyEvictions(evicted);
    }

    public boolean has(K key) {
        lock.readLock().lock();
        try {
            return entries.containsKey(key);
        } finally {
            lock.readLock().unlock();
        }
    }

    public boolean delete(K key) {
        lock.writeLock().lock();
        try {
            if (entries.remove(key) == null) {
                return false;
            }
            currentMemory -= sizes.remove(key);
            return true;
        } finally {
            lock.writeLock().unlock();
        }
    }

    public void clear() {
        lock.writeLock().lock();
        try {
            entries.clear();
            sizes.clear();
            currentMemory = 0;
            hits.set(0);
            misses.set(0);
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Returns a snapshot of the keys, most recently used first.
     */
    public List<K> keys() {
        lock.readLock().lock();
        try {
            List<K> keys = new ArrayList<>(entries.keySet());
            Collections.reverse(keys);
            return keys;
        } finally {
            lock.readLock().unlock();
        }
    }

    public int size() {
        lock.readLock().lock();
        try {
            return entries.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    public int capacity() {
        return capacity;
    }

    /**
     * @return the tracked memory usage in bytes, or the item count when no size
     * calculator is configured
     */
    public long memoryUsage() {
        lock.readLock().lock();
        try {
            return currentMemory;
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * @return the configured memory budget in bytes, or 0 when the store is bounded by
     * item count only
     */
    public long maxMemory() {
        return maxMemory;
    }

    public double hitRate() {
        long h = hits.get();
        long total = h + misses.get();
        return total == 0 ? 0.0 : (double) h / total;
    }

    private Map.Entry<K, V> evictEldest() {
        Iterator<Map.Entry<K, V>> it = entries.entrySet().iterator();
        Map.Entry<K, V> eldest = it.next();
        K key = eldest.getKey();
        V value = eldest.getValue();
        it.remove();
        long size = sizes.remove(key);
        currentMemory -= size;
        LOG.debug("Evicted key {} ({} bytes), memory now {} / {}", key, size, currentMemory, maxMemory);
        return Map.entry(key, value);
    }

    private void notifyEvictions(List<Map.Entry<K, V>> evicted) {
        if (removalListener == null) {
            return;
        }
        for (Map.Entry<K, V> entry : evicted) {
            removalListener.onEviction(entry.getKey(), entry.getValue());
        }
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("size", size())
                .add("capacity", capacity)
                .add("memoryUsage", memoryUsage())
                .add("maxMemory", maxMemory)
                .toString();
    }

    public static class Builder<K, V> {
        private int capacity = DEFAULT_CAPACITY;
        private long maxMemory;
        private SizeCalculator<V> sizeCalculator;
        private RemovalListener<K, V> removalListener;

        public Builder<K, V> capacity(int capacity) {
            Preconditions.checkArgument(capacity > 0, "capacity must be positive: %s", capacity);
            this.capacity = capacity;
            return this;
        }

        public Builder<K, V> maxMemory(long maxMemory) {
            Preconditions.checkArgument(maxMemory > 0, "memory budget must be positive: %s", maxMemory);
            this.maxMemory = maxMemory;
            return this;
        }

        public Builder<K, V> sizeCalculator(SizeCalculator<V> sizeCalculator) {
            this.sizeCalculator = sizeCalculator;
            return this;
        }

        public Builder<K, V> removalListener(RemovalListener<K, V> removalListener) {
            this.removalListener = removalListener;
            return this;
        }

        public LruStore<K, V> build() {
            if (maxMemory > 0 && sizeCalculator == null) {
                throw new IllegalStateException("A memory budget requires a size calculator");
            }
            return new LruStore<>(this);
        }
    }
}
