package gr.imsi.athenarc.chartdata.cache;

import com.google.common.base.MoreObjects;

/**
 * Read-only diagnostics snapshot of a {@link CacheManager}.
 */
public final class CacheStats {

    private final int size;
    private final int capacity;
    private final long memoryUsage;
    private final long maxMemory;
    private final double hitRate;
    private final int tagCount;
    private final int pendingRevalidations;

    public CacheStats(int size, int capacity, long memoryUsage, long maxMemory, double hitRate,
                      int tagCount, int pendingRevalidations) {
        this.size = size;
        this.capacity = capacity;
        this.memoryUsage = memoryUsage;
        this.maxMemory = maxMemory;
        this.hitRate = hitRate;
        this.tagCount = tagCount;
        this.pendingRevalidations = pendingRevalidations;
    }

    public int getSize() {
        return size;
    }

    public int getCapacity() {
        return capacity;
    }

    public long getMemoryUsage() {
        return memoryUsage;
    }

    public long getMaxMemory() {
        return maxMemory;
    }

    public double getHitRate() {
        return hitRate;
    }

    public int getTagCount() {
        return tagCount;
    }

    public int getPendingRevalidations() {
        return pendingRevalidations;
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("size", size)
                .add("capacity", capacity)
                .add("memoryUsage", memoryUsage)
                .add("maxMemory", maxMemory)
                .add("hitRate", hitRate)
                .add("tagCount", tagCount)
                .add("pendingRevalidations", pendingRevalidations)
                .toString();
    }
}
