package gr.imsi.athenarc.chartdata.cache;

import java.util.concurrent.CompletableFuture;

/**
 * Loads a fresh value for a cache key.
 */
@FunctionalInterface
public interface Fetcher<T> {

    CompletableFuture<T> fetch();
}
