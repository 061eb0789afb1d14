package gr.imsi.athenarc.chartdata.cache;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.base.Preconditions;
import com.google.common.base.Ticker;
import com.google.common.collect.ImmutableSet;
import com.google.common.util.concurrent.ThreadFactoryBuilder;

import java.time.Duration;
import java.util.Collection;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.function.Predicate;
import java.util.regex.Pattern;

/**
 * Time-aware cache on top of an {@link LruStore} with a tag index for bulk
 * invalidation and an optional stale-while-revalidate refresh strategy.
 * <p>
 * Every {@code set} rebuilds the tag associations of its key: tags the previous
 * entry carried but the new one does not are removed from the index, so they never
 * read back. Evicted and deleted keys leave the index as well.
 * <p>
 * Mutations ({@code set}, {@code delete}, invalidations and the evictions they
 * trigger) are serialized on this instance.
 *
 * @param <T> cached value type
 */
public class CacheManager<T> implements AutoCloseable {
    private static final Logger LOG = LoggerFactory.getLogger(CacheManager.class);

    public static final Duration DEFAULT_MAX_AGE = Duration.ofMinutes(5);
    public static final long DEFAULT_MAX_MEMORY_MB = 50;

    private final LruStore<String, CacheEntry<T>> store;
    private final Map<String, Set<String>> tagIndex = new HashMap<>();
    private final Set<String> revalidating = ConcurrentHashMap.newKeySet();

    private final long defaultMaxAgeMillis;
    private final SizeCalculator<Object> sizeEstimator;
    private final Ticker ticker;
    private final Executor executor;
    private final ExecutorService ownedExecutor;

    // Private constructor used by builder
    private CacheManager(Builder builder) {
        this.defaultMaxAgeMillis = builder.defaultMaxAge.toMillis();
        this.sizeEstimator = builder.sizeEstimator != null ? builder.sizeEstimator : new SizeEstimator();
        this.ticker = builder.ticker;
        this.ownedExecutor = builder.executor != null ? null : defaultExecutor();
        this.executor = builder.executor != null ? builder.executor : ownedExecutor;
        this.store = LruStore.<String, CacheEntry<T>>builder()
                .maxMemory(builder.maxMemoryBytes)
                .sizeCalculator(CacheEntry::getSizeBytes)
                .removalListener(this::onEviction)
                .build();
        LOG.info("Cache manager initialized with {} MB max memory, default max age {} ms",
                builder.maxMemoryBytes / (1024 * 1024), defaultMaxAgeMillis);
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Returns the cached value if present and fresh, or {@code null}.
     */
    public CompletableFuture<T> get(String key) {
        return get(key, null, CacheStrategy.defaults());
    }

    public CompletableFuture<T> get(String key, Fetcher<T> fetcher) {
        return get(key, fetcher, CacheStrategy.defaults());
    }

    /**
     * Looks up {@code key}, loading it through {@code fetcher} on a miss or once the
     * entry is older than the effective max age.
     * <p>
     * With {@link CacheStrategy#isStaleWhileRevalidate()} an expired entry is returned
     * immediately while a single background refresh runs for the key; a failed refresh
     * keeps the stale entry. A foreground fetch failure completes the returned future
     * exceptionally.
     *
     * @param key the cache key
     * @param fetcher loads a fresh value, may be {@code null}
     * @param strategy per-call options
     * @return a future with the value, or with {@code null} when nothing is cached and
     * no fetcher is given
     */
    public CompletableFuture<T> get(String key, Fetcher<T> fetcher, CacheStrategy strategy) {
        Preconditions.checkNotNull(key, "key");
        Preconditions.checkNotNull(strategy, "strategy");
        CacheEntry<T> entry = store.get(key);

        if (entry != null) {
            long maxAge = strategy.getMaxAge() != null ? strategy.getMaxAge().toMillis() : defaultMaxAgeMillis;
            if (entry.ageAt(now()) < maxAge) {
                LOG.debug("Cache hit for key {}", key);
                return CompletableFuture.completedFuture(entry.getData());
            }
            if (strategy.isStaleWhileRevalidate() && fetcher != null) {
                revalidateInBackground(key, fetcher, strategy);
                return CompletableFuture.completedFuture(entry.getData());
            }
        }

        if (fetcher == null) {
            return CompletableFuture.completedFuture(null);
        }

        LOG.debug("Cache {} for key {}, fetching", entry == null ? "miss" : "expired entry", key);
        return invoke(fetcher)
                .thenApply(data -> {
                    if (data != null) {
                        store(key, data, tagsFor(strategy, entry));
                    }
                    return data;
                });
    }

    public void set(String key, T value) {
        set(key, value, CacheStrategy.defaults());
    }

    /**
     * Stores {@code value} under {@code key} with exactly the strategy's tags
     * (none when the strategy carries no tags).
     */
    public void set(String key, T value, CacheStrategy strategy) {
        Preconditions.checkNotNull(value, "value");
        ImmutableSet<String> tags = strategy.getTags() != null ? strategy.getTags() : ImmutableSet.of();
        store(key, value, tags);
    }

    public synchronized boolean delete(String key) {
        CacheEntry<T> entry = store.peek(key);
        if (entry == null || !store.delete(key)) {
            return false;
        }
        untag(key, entry.getTags());
        return true;
    }

    /**
     * Deletes every key accepted by {@code matcher}.
     *
     * @return the number of deleted keys
     */
    public synchronized int invalidatePattern(Predicate<String> matcher) {
        int invalidated = 0;
        for (String key : store.keys()) {
            if (matcher.test(key) && delete(key)) {
                invalidated++;
            }
        }
        LOG.debug("Invalidated {} keys by pattern", invalidated);
        return invalidated;
    }

    public int invalidatePattern(Pattern pattern) {
        return invalidatePattern(key -> pattern.matcher(key).find());
    }

    /**
     * Deletes every key carrying one of {@code tags} and drops those tag buckets.
     *
     * @return the number of deleted keys, each counted once
     */
    public synchronized int invalidateTags(Collection<String> tags) {
        int invalidated = 0;
        for (String tag : tags) {
            Set<String> keys = tagIndex.remove(tag);
            if (keys == null) {
                continue;
            }
            for (String key : keys) {
                if (delete(key)) {
                    invalidated++;
                }
            }
        }
        LOG.debug("Invalidated {} keys for tags {}", invalidated, tags);
        return invalidated;
    }

    public synchronized void clear() {
        store.clear();
        tagIndex.clear();
        revalidating.clear();
    }

    /**
     * @return the keys currently indexed under {@code tag}
     */
    public synchronized Set<String> keysForTag(String tag) {
        Set<String> keys = tagIndex.get(tag);
        return keys == null ? ImmutableSet.of() : ImmutableSet.copyOf(keys);
    }

    public CacheStats getStats() {
        int tagCount;
        synchronized (this) {
            tagCount = tagIndex.size();
        }
        return new CacheStats(store.size(), store.capacity(), store.memoryUsage(), store.maxMemory(),
                store.hitRate(), tagCount, revalidating.size());
    }

    private void revalidateInBackground(String key, Fetcher<T> fetcher, CacheStrategy strategy) {
        // Prevent duplicate revalidations
        if (!revalidating.add(key)) {
            LOG.debug("Revalidation already in flight for key {}", key);
            return;
        }
        LOG.debug("Serving stale value for key {}, revalidating in background", key);
        CompletableFuture<CompletableFuture<T>> scheduled;
        try {
            scheduled = CompletableFuture.supplyAsync(() -> invoke(fetcher), executor);
        } catch (RejectedExecutionException e) {
            LOG.warn("Revalidation of key {} rejected, keeping stale value", key, e);
            revalidating.remove(key);
            return;
        }
        scheduled
                .thenCompose(future -> future)
                .whenComplete((data, error) -> {
                    try {
                        if (error != null) {
                            LOG.warn("Failed to revalidate cache for key {}", key, error);
                        } else if (data != null) {
                            store(key, data, tagsFor(strategy, store.peek(key)));
                        }
                    } finally {
                        revalidating.remove(key);
                    }
                });
    }

    private synchronized void store(String key, T data, ImmutableSet<String> tags) {
        long size = sizeEstimator.sizeOf(data);
        CacheEntry<T> previous = store.peek(key);
        if (previous != null) {
            untag(key, previous.getTags());
        }
        for (String tag : tags) {
            tagIndex.computeIfAbsent(tag, t -> new HashSet<>()).add(key);
        }
        store.set(key, new CacheEntry<>(data, now(), size, tags));
    }

    private synchronized void onEviction(String key, CacheEntry<T> entry) {
        untag(key, entry.getTags());
    }

    private void untag(String key, Set<String> tags) {
        for (String tag : tags) {
            Set<String> keys = tagIndex.get(tag);
            if (keys != null) {
                keys.remove(key);
                if (keys.isEmpty()) {
                    tagIndex.remove(tag);
                }
            }
        }
    }

    private ImmutableSet<String> tagsFor(CacheStrategy strategy, CacheEntry<T> previous) {
        if (strategy.getTags() != null) {
            return strategy.getTags();
        }
        return previous != null ? previous.getTags() : ImmutableSet.of();
    }

    private CompletableFuture<T> invoke(Fetcher<T> fetcher) {
        try {
            CompletableFuture<T> future = fetcher.fetch();
            return future != null ? future : CompletableFuture.completedFuture(null);
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
    }

    private long now() {
        return TimeUnit.NANOSECONDS.toMillis(ticker.read());
    }

    /**
     * Stops the revalidation executor created by this manager. An executor passed to
     * the builder is left running. Cached entries stay readable.
     */
    @Override
    public void close() {
        if (ownedExecutor != null) {
            ownedExecutor.shutdown();
        }
    }

    private static ExecutorService defaultExecutor() {
        return Executors.newCachedThreadPool(new ThreadFactoryBuilder()
                .setNameFormat("cache-revalidate-%d")
                .setDaemon(true)
                .build());
    }

    public static class Builder {
        private long maxMemoryBytes = DEFAULT_MAX_MEMORY_MB * 1024 * 1024;
        private Duration defaultMaxAge = DEFAULT_MAX_AGE;
        private SizeCalculator<Object> sizeEstimator;
        private Ticker ticker = Ticker.systemTicker();
        private Executor executor;

        public Builder maxMemoryMb(long maxMemoryMb) {
            return maxMemoryBytes(maxMemoryMb * 1024 * 1024);
        }

        public Builder maxMemoryBytes(long maxMemoryBytes) {
            Preconditions.checkArgument(maxMemoryBytes > 0, "memory budget must be positive: %s", maxMemoryBytes);
            this.maxMemoryBytes = maxMemoryBytes;
            return this;
        }

        public Builder defaultMaxAge(Duration defaultMaxAge) {
            this.defaultMaxAge = Preconditions.checkNotNull(defaultMaxAge);
            return this;
        }

        public Builder sizeEstimator(SizeCalculator<Object> sizeEstimator) {
            this.sizeEstimator = sizeEstimator;
            return this;
        }

        public Builder ticker(Ticker ticker) {
            this.ticker = Preconditions.checkNotNull(ticker);
            return this;
        }

        /**
         * Executor running background revalidations.
         */
        public Builder executor(Executor executor) {
            this.executor = executor;
            return this;
        }

        public <T> CacheManager<T> build() {
            return new CacheManager<>(this);
        }
    }
}
