package gr.imsi.athenarc.chartdata.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.base.MoreObjects;
import com.google.common.base.Preconditions;

import gr.imsi.athenarc.chartdata.cache.CacheManager;
import gr.imsi.athenarc.chartdata.chart.ChartDataCoordinator;
import gr.imsi.athenarc.chartdata.chart.SamplingSettings;
import gr.imsi.athenarc.chartdata.chart.SettingsProvider;
import gr.imsi.athenarc.chartdata.fetch.SharedFetchCache;
import gr.imsi.athenarc.chartdata.sampling.SamplingMethod;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.time.Duration;
import java.util.Properties;

/**
 * Settings of the caching and sampling pipeline. Built with {@link #builder()} or read
 * from an {@code application.properties} file on the classpath; missing keys fall back
 * to the defaults.
 */
public class ChartDataConfiguration {

    private static final Logger LOG = LoggerFactory.getLogger(ChartDataConfiguration.class);

    public static final String DEFAULT_RESOURCE = "/application.properties";
    public static final String DEFAULT_TIMESTAMP_COLUMN = "timestamp";

    private final long cacheMaxMemoryMb;
    private final Duration cacheDefaultMaxAge;
    private final Duration fetchTtl;
    private final Duration debounce;
    private final SamplingSettings samplingSettings;
    private final String dataDirectory;
    private final String timestampColumn;

    private ChartDataConfiguration(Builder builder) {
        this.cacheMaxMemoryMb = builder.cacheMaxMemoryMb;
        this.cacheDefaultMaxAge = builder.cacheDefaultMaxAge;
        this.fetchTtl = builder.fetchTtl;
        this.debounce = builder.debounce;
        this.samplingSettings = new SamplingSettings(builder.samplingEnabled, builder.samplingMethod,
                builder.samplingTargetPoints);
        this.dataDirectory = builder.dataDirectory;
        this.timestampColumn = builder.timestampColumn;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static ChartDataConfiguration defaults() {
        return builder().build();
    }

    public static ChartDataConfiguration load() {
        return load(DEFAULT_RESOURCE);
    }

    /**
     * Reads the given classpath resource. A missing resource yields the defaults.
     *
     * @throws UncheckedIOException if the resource exists but cannot be read
     */
    public static ChartDataConfiguration load(String resource) {
        Properties properties = new Properties();
        try (InputStream input = ChartDataConfiguration.class.getResourceAsStream(resource)) {
            if (input == null) {
                LOG.warn("Unable to find {} in resources, using defaults", resource);
                return defaults();
            }
            properties.load(input);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read " + resource, e);
        }
        return fromProperties(properties);
    }

    /**
     * Maps properties onto a configuration.
     *
     * @throws IllegalArgumentException if a value is malformed
     */
    public static ChartDataConfiguration fromProperties(Properties properties) {
        Builder builder = builder();
        String value;
        if ((value = property(properties, "cache.maxMemoryMb")) != null) {
            builder.cacheMaxMemoryMb(Long.parseLong(value));
        }
        if ((value = property(properties, "cache.defaultMaxAgeMs")) != null) {
            builder.cacheDefaultMaxAge(Duration.ofMillis(Long.parseLong(value)));
        }
        if ((value = property(properties, "fetch.ttlMs")) != null) {
            builder.fetchTtl(Duration.ofMillis(Long.parseLong(value)));
        }
        if ((value = property(properties, "chart.debounceMs")) != null) {
            builder.debounce(Duration.ofMillis(Long.parseLong(value)));
        }
        if ((value = property(properties, "sampling.enabled")) != null) {
            builder.samplingEnabled(Boolean.parseBoolean(value));
        }
        if ((value = property(properties, "sampling.method")) != null) {
            builder.samplingMethod(SamplingMethod.fromString(value));
        }
        if ((value = property(properties, "sampling.targetPoints")) != null) {
            builder.samplingTargetPoints(Integer.parseInt(value));
        }
        if ((value = property(properties, "data.directory")) != null) {
            builder.dataDirectory(value);
        }
        if ((value = property(properties, "data.timestampColumn")) != null) {
            builder.timestampColumn(value);
        }
        ChartDataConfiguration configuration = builder.build();
        LOG.debug("Loaded {}", configuration);
        return configuration;
    }

    private static String property(Properties properties, String key) {
        String value = properties.getProperty(key);
        if (value == null || value.isBlank()) {
            return null;
        }
        return value.trim();
    }

    public <T> CacheManager<T> createCacheManager() {
        return CacheManager.builder()
                .maxMemoryMb(cacheMaxMemoryMb)
                .defaultMaxAge(cacheDefaultMaxAge)
                .build();
    }

    public SharedFetchCache createFetchCache() {
        return new SharedFetchCache(fetchTtl);
    }

    public SettingsProvider settingsProvider() {
        return SettingsProvider.fixed(samplingSettings);
    }

    /**
     * @return a coordinator builder with the debounce delay and sampling settings of
     * this configuration applied
     */
    public ChartDataCoordinator.Builder coordinatorBuilder() {
        return ChartDataCoordinator.builder()
                .withDebounce(debounce)
                .withSettingsProvider(settingsProvider());
    }

    public long getCacheMaxMemoryMb() {
        return cacheMaxMemoryMb;
    }

    public Duration getCacheDefaultMaxAge() {
        return cacheDefaultMaxAge;
    }

    public Duration getFetchTtl() {
        return fetchTtl;
    }

    public Duration getDebounce() {
        return debounce;
    }

    public SamplingSettings getSamplingSettings() {
        return samplingSettings;
    }

    public String getDataDirectory() {
        return dataDirectory;
    }

    public String getTimestampColumn() {
        return timestampColumn;
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("cacheMaxMemoryMb", cacheMaxMemoryMb)
                .add("cacheDefaultMaxAge", cacheDefaultMaxAge)
                .add("fetchTtl", fetchTtl)
                .add("debounce", debounce)
                .add("sampling", samplingSettings)
                .add("dataDirectory", dataDirectory)
                .add("timestampColumn", timestampColumn)
                .toString();
    }

    public static class Builder {
        private long cacheMaxMemoryMb = CacheManager.DEFAULT_MAX_MEMORY_MB;
        private Duration cacheDefaultMaxAge = CacheManager.DEFAULT_MAX_AGE;
        private Duration fetchTtl = SharedFetchCache.DEFAULT_TTL;
        private Duration debounce = ChartDataCoordinator.DEFAULT_DEBOUNCE;
        private boolean samplingEnabled = true;
        private SamplingMethod samplingMethod = SamplingMethod.ADAPTIVE;
        private int samplingTargetPoints = SamplingSettings.DEFAULT_TARGET_POINT_COUNT;
        private String dataDirectory = "data";
        private String timestampColumn = DEFAULT_TIMESTAMP_COLUMN;

        public Builder cacheMaxMemoryMb(long cacheMaxMemoryMb) {
            Preconditions.checkArgument(cacheMaxMemoryMb > 0, "cache.maxMemoryMb must be positive: %s", cacheMaxMemoryMb);
            this.cacheMaxMemoryMb = cacheMaxMemoryMb;
            return this;
        }

        public Builder cacheDefaultMaxAge(Duration cacheDefaultMaxAge) {
            this.cacheDefaultMaxAge = Preconditions.checkNotNull(cacheDefaultMaxAge);
            return this;
        }

        public Builder fetchTtl(Duration fetchTtl) {
            this.fetchTtl = Preconditions.checkNotNull(fetchTtl);
            return this;
        }

        public Builder debounce(Duration debounce) {
            this.debounce = Preconditions.checkNotNull(debounce);
            return this;
        }

        public Builder samplingEnabled(boolean samplingEnabled) {
            this.samplingEnabled = samplingEnabled;
            return this;
        }

        public Builder samplingMethod(SamplingMethod samplingMethod) {
            this.samplingMethod = Preconditions.checkNotNull(samplingMethod);
            return this;
        }

        public Builder samplingTargetPoints(int samplingTargetPoints) {
            this.samplingTargetPoints = samplingTargetPoints;
            return this;
        }

        public Builder dataDirectory(String dataDirectory) {
            this.dataDirectory = dataDirectory;
            return this;
        }

        public Builder timestampColumn(String timestampColumn) {
            this.timestampColumn = timestampColumn;
            return this;
        }

        public ChartDataConfiguration build() {
            return new ChartDataConfiguration(this);
        }
    }
}
