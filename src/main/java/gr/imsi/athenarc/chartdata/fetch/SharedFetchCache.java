package gr.imsi.athenarc.chartdata.fetch;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.base.Preconditions;
import com.google.common.base.Ticker;
import com.google.common.collect.ImmutableSet;

import gr.imsi.athenarc.chartdata.domain.AxisMode;
import gr.imsi.athenarc.chartdata.domain.RawRecord;

import java.time.Duration;
import java.util.Collection;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

/**
 * Per-period fetch cache that stores in-flight fetches rather than their results.
 * <p>
 * Callers asking for the same {@link FetchKey} within the time-to-live receive the
 * very same future, so they observe the same records, or the same failure, as the
 * caller that started the fetch. The underlying fetcher runs at most once per key
 * and TTL window. Failures are not cached any longer than successes.
 */
public class SharedFetchCache {

    private static final Logger LOG = LoggerFactory.getLogger(SharedFetchCache.class);

    public static final Duration DEFAULT_TTL = Duration.ofMinutes(5);

    private final ConcurrentHashMap<FetchKey, FetchRecord> records = new ConcurrentHashMap<>();
    private final long ttlMillis;
    private final Ticker ticker;

    public SharedFetchCache() {
        this(DEFAULT_TTL, Ticker.systemTicker());
    }

    public SharedFetchCache(Duration ttl) {
        this(ttl, Ticker.systemTicker());
    }

    public SharedFetchCache(Duration ttl, Ticker ticker) {
        Preconditions.checkArgument(!ttl.isNegative() && !ttl.isZero(), "ttl must be positive: %s", ttl);
        this.ttlMillis = ttl.toMillis();
        this.ticker = Preconditions.checkNotNull(ticker);
    }

    public CompletableFuture<List<RawRecord>> get(String periodId, Collection<String> parameters,
                                                  Supplier<CompletableFuture<List<RawRecord>>> fetcher) {
        return get(periodId, parameters, fetcher, null, null);
    }

    /**
     * Returns the shared fetch for the given period and configuration shape, starting
     * it through {@code fetcher} when no live fetch exists.
     *
     * @param periodId the period to fetch
     * @param parameters requested parameter names, in any order
     * @param fetcher starts the actual fetch
     * @param axisMode the chart's axis mode, may be {@code null}
     * @param paramSignature order-sensitive summary of the Y-parameter configuration, may be {@code null}
     */
    public CompletableFuture<List<RawRecord>> get(String periodId, Collection<String> parameters,
                                                  Supplier<CompletableFuture<List<RawRecord>>> fetcher,
                                                  AxisMode axisMode, String paramSignature) {
        FetchKey key = new FetchKey(axisMode, periodId, parameters, paramSignature);
        long now = now();
        sweepExpired(now);

        CompletableFuture<List<RawRecord>> pending = new CompletableFuture<>();
        FetchRecord record = records.compute(key, (k, existing) ->
                existing != null && now - existing.createdAt < ttlMillis
                        ? existing
                        : new FetchRecord(pending, now));

        if (record.future != pending) {
            LOG.debug("Joining shared fetch for {}", key);
            return record.future;
        }

        LOG.debug("Starting shared fetch for {}", key);
        start(key, fetcher, pending);
        return pending;
    }

    public void clear() {
        records.clear();
    }

    public void clearForPeriod(String periodId) {
        clearForSources(ImmutableSet.of(periodId));
    }

    /**
     * Drops every record whose key belongs to one of {@code periodIds}, whatever its
     * axis mode, parameters or signature.
     */
    public void clearForSources(Collection<String> periodIds) {
        Set<String> ids = ImmutableSet.copyOf(periodIds);
        records.keySet().removeIf(key -> ids.contains(key.getPeriodId()));
    }

    public int size() {
        return records.size();
    }

    private void start(FetchKey key, Supplier<CompletableFuture<List<RawRecord>>> fetcher,
                       CompletableFuture<List<RawRecord>> pending) {
        CompletableFuture<List<RawRecord>> fetch;
        try {
            fetch = fetcher.get();
        } catch (RuntimeException e) {
            fetch = CompletableFuture.failedFuture(e);
        }
        if (fetch == null) {
            fetch = CompletableFuture.failedFuture(new IllegalStateException("Fetcher returned no future for " + key));
        }
        fetch.whenComplete((result, error) -> {
            if (error != null) {
                LOG.debug("Shared fetch for {} failed: {}", key, error.toString());
                pending.completeExceptionally(error);
            } else {
                pending.complete(result);
            }
        });
    }

    private void sweepExpired(long now) {
        records.values().removeIf(record -> now - record.createdAt >= ttlMillis);
    }

    private long now() {
        return TimeUnit.NANOSECONDS.toMillis(ticker.read());
    }

    private static final class FetchRecord {
        private final CompletableFuture<List<RawRecord>> future;
        private final long createdAt;

        private FetchRecord(CompletableFuture<List<RawRecord>> future, long createdAt) {
            this.future = future;
            this.createdAt = createdAt;
        }
    }
}
