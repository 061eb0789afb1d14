package gr.imsi.athenarc.chartdata.cache;

import com.google.common.base.MoreObjects;
import com.google.common.collect.ImmutableSet;

/**
 * An immutable cache entry. Updates replace the entry as a whole.
 */
public final class CacheEntry<T> {

    private final T data;
    private final long createdAt;
    private final long sizeBytes;
    private final ImmutableSet<String> tags;

    public CacheEntry(T data, long createdAt, long sizeBytes, ImmutableSet<String> tags) {
        this.data = data;
        this.createdAt = createdAt;
        this.sizeBytes = sizeBytes;
        this.tags = tags;
    }

    public T getData() {
        return data;
    }

    /**
     * @return creation time in milliseconds, as read from the owning cache's ticker
     */
    public long getCreatedAt() {
        return createdAt;
    }

    public long getSizeBytes() {
        return sizeBytes;
    }

    public ImmutableSet<String> getTags() {
        return tags;
    }

    long ageAt(long nowMillis) {
        return nowMillis - createdAt;
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("createdAt", createdAt)
                .add("sizeBytes", sizeBytes)
                .add("tags", tags)
                .toString();
    }
}
