package gr.imsi.athenarc.chartdata.cache;

/**
 * Notified when an {@link LruStore} evicts an entry to make room for another one.
 * Explicit deletes, clears and replacements are not reported.
 */
@FunctionalInterface
public interface RemovalListener<K, V> {

    void onEviction(K key, V value);
}
