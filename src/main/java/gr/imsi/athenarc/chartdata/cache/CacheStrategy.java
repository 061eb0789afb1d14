package gr.imsi.athenarc.chartdata.cache;

import com.google.common.base.MoreObjects;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableSet;

import java.time.Duration;
import java.util.Arrays;
import java.util.Collection;

/**
 * Per-call caching options for {@link CacheManager}.
 * A {@code null} max age means the cache's default applies, and {@code null} tags
 * mean "keep whatever the replaced entry carried".
 */
public final class CacheStrategy {

    private static final CacheStrategy DEFAULTS = new Builder().build();

    private final Duration maxAge;
    private final boolean staleWhileRevalidate;
    private final ImmutableSet<String> tags;

    private CacheStrategy(Builder builder) {
        this.maxAge = builder.maxAge;
        this.staleWhileRevalidate = builder.staleWhileRevalidate;
        this.tags = builder.tags;
    }

    public static CacheStrategy defaults() {
        return DEFAULTS;
    }

    public static CacheStrategy withTags(String... tags) {
        return builder().tags(tags).build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public Duration getMaxAge() {
        return maxAge;
    }

    public boolean isStaleWhileRevalidate() {
        return staleWhileRevalidate;
    }

    public ImmutableSet<String> getTags() {
        return tags;
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("maxAge", maxAge)
                .add("staleWhileRevalidate", staleWhileRevalidate)
                .add("tags", tags)
                .toString();
    }

    public static class Builder {
        private Duration maxAge;
        private boolean staleWhileRevalidate;
        private ImmutableSet<String> tags;

        public Builder maxAge(Duration maxAge) {
            Preconditions.checkArgument(!maxAge.isNegative(), "maxAge must not be negative");
            this.maxAge = maxAge;
            return this;
        }

        public Builder staleWhileRevalidate(boolean staleWhileRevalidate) {
            this.staleWhileRevalidate = staleWhileRevalidate;
            return this;
        }

        public Builder tags(Collection<String> tags) {
            this.tags = ImmutableSet.copyOf(tags);
            return this;
        }

        public Builder tags(String... tags) {
            return tags(Arrays.asList(tags));
        }

        public CacheStrategy build() {
            return new CacheStrategy(this);
        }
    }
}
