package gr.imsi.athenarc.chartdata.chart;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.base.Preconditions;
import com.google.common.base.Stopwatch;
import com.google.common.collect.ImmutableList;
import com.google.common.util.concurrent.ThreadFactoryBuilder;

import gr.imsi.athenarc.chartdata.domain.Period;
import gr.imsi.athenarc.chartdata.domain.RawRecord;
import gr.imsi.athenarc.chartdata.fetch.PeriodDataProvider;
import gr.imsi.athenarc.chartdata.fetch.PeriodFetchException;
import gr.imsi.athenarc.chartdata.fetch.SharedFetchCache;
import gr.imsi.athenarc.chartdata.sampling.DefaultSamplingEngine;
import gr.imsi.athenarc.chartdata.sampling.SamplingEngine;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Collectors;

/**
 * Drives the data of a single chart: debounces configuration changes, fetches every
 * selected period through the {@link SharedFetchCache}, turns the records into points,
 * samples them and publishes the result.
 * <p>
 * Each {@link #update(ChartConfig)} supersedes any cycle still in flight. A superseded
 * cycle runs to completion but never publishes and never touches the
 * {@link LoadingRegistry}. All state transitions run on the coordinator's
 * single-threaded scheduler; fetch completions hop back onto it.
 * <p>
 * A failed cycle keeps the points of the last successful one and records the error.
 */
public class ChartDataCoordinator implements AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(ChartDataCoordinator.class);

    public static final Duration DEFAULT_DEBOUNCE = Duration.ofMillis(300);

    private final String chartId;
    private final SharedFetchCache fetchCache;
    private final PeriodDataProvider dataProvider;
    private final SamplingEngine samplingEngine;
    private final SettingsProvider settingsProvider;
    private final LoadingRegistry loadingRegistry;
    private final ChartDataTransformer transformer;
    private final long debounceMillis;
    private final ScheduledExecutorService executor;
    private final boolean ownsExecutor;

    private final AtomicLong version = new AtomicLong();
    private final List<ChartDataListener> listeners = new CopyOnWriteArrayList<>();

    private volatile ChartDataState state = ChartDataState.initial();
    private volatile ChartConfig lastConfig;
    private ScheduledFuture<?> pendingCycle;
    private boolean closed;

    private ChartDataCoordinator(Builder builder) {
        this.chartId = builder.chartId;
        this.fetchCache = builder.fetchCache;
        this.dataProvider = builder.dataProvider;
        this.samplingEngine = builder.samplingEngine;
        this.settingsProvider = builder.settingsProvider;
        this.loadingRegistry = builder.loadingRegistry;
        this.transformer = builder.transformer;
        this.debounceMillis = builder.debounce.toMillis();
        if (builder.executor != null) {
            this.executor = builder.executor;
            this.ownsExecutor = false;
        } else {
            this.executor = Executors.newSingleThreadScheduledExecutor(new ThreadFactoryBuilder()
                    .setDaemon(true)
                    .setNameFormat("chart-" + chartId + "-%d")
                    .build());
            this.ownsExecutor = true;
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Schedules a cycle for {@code config} after the debounce delay, cancelling any
     * cycle still waiting for its delay and superseding any cycle in flight.
     */
    public synchronized void update(ChartConfig config) {
        Preconditions.checkNotNull(config, "config");
        Preconditions.checkState(!closed, "Coordinator of chart %s is closed", chartId);
        lastConfig = config;
        schedule(config, debounceMillis);
    }

    /**
     * Re-runs the last configuration without waiting for the debounce delay. The shared
     * fetches of its periods are dropped first so the provider is asked again.
     */
    public synchronized void refresh() {
        Preconditions.checkState(!closed, "Coordinator of chart %s is closed", chartId);
        ChartConfig config = lastConfig;
        if (config == null) {
            LOG.debug("Nothing to refresh for chart {}", chartId);
            return;
        }
        fetchCache.clearForSources(config.getPeriods().stream().map(Period::getId).collect(Collectors.toList()));
        schedule(config, 0);
    }

    private void schedule(ChartConfig config, long delayMillis) {
        long cycleId = version.incrementAndGet();
        if (pendingCycle != null) {
            pendingCycle.cancel(false);
        }
        pendingCycle = executor.schedule(() -> runCycle(config, cycleId), delayMillis, TimeUnit.MILLISECONDS);
    }

    public ChartDataState getState() {
        return state;
    }

    public List<ChartDataPoint> getData() {
        return state.getPoints();
    }

    public boolean isLoading() {
        return state.isLoading();
    }

    public Throwable getError() {
        return state.getError();
    }

    public String getChartId() {
        return chartId;
    }

    public void addListener(ChartDataListener listener) {
        listeners.add(Preconditions.checkNotNull(listener));
    }

    public void removeListener(ChartDataListener listener) {
        listeners.remove(listener);
    }

    @Override
    public void close() {
        synchronized (this) {
            if (closed) {
                return;
            }
            closed = true;
            version.incrementAndGet();
            if (pendingCycle != null) {
                pendingCycle.cancel(false);
            }
        }
        loadingRegistry.unregisterLoading(chartId);
        if (ownsExecutor) {
            executor.shutdown();
        }
        LOG.debug("Closed coordinator of chart {}", chartId);
    }

    private boolean isCurrent(long cycleId) {
        return version.get() == cycleId;
    }

    private void runCycle(ChartConfig config, long cycleId) {
        ChartDataState loading;
        // close() supersedes under the same monitor, so a closed chart is never re-registered
        synchronized (this) {
            if (!isCurrent(cycleId)) {
                return;
            }
            loadingRegistry.registerLoading(chartId);
            loading = state.loading(cycleId);
            state = loading;
        }
        Stopwatch stopwatch = Stopwatch.createStarted();
        notifyListeners(loading);

        try {
            SamplingSettings settings = settingsProvider.getSamplingSettings();
            FetchPlan plan = FetchPlan.of(config);
            if (config.getPeriods().isEmpty() || !plan.isFetchable()) {
                LOG.debug("Chart {} has nothing to fetch ({})", chartId, plan);
                complete(cycleId, state.succeeded(ImmutableList.of(), cycleId));
                return;
            }

            List<Period> periods = config.getPeriods();
            List<CompletableFuture<List<RawRecord>>> fetches = new ArrayList<>(periods.size());
            for (Period period : periods) {
                fetches.add(fetchPeriod(period, plan));
            }
            CompletableFuture.allOf(fetches.toArray(new CompletableFuture[0]))
                    .whenCompleteAsync((ignored, error) ->
                            finish(cycleId, periods, plan, settings, fetches, error, stopwatch), executor);
        } catch (RuntimeException e) {
            fail(cycleId, e);
        }
    }

    private CompletableFuture<List<RawRecord>> fetchPeriod(Period period, FetchPlan plan) {
        String periodId = period.getId();
        List<String> parameters = plan.getParameters();
        return fetchCache.get(periodId, parameters,
                        () -> dataProvider.fetch(periodId, parameters),
                        plan.getAxisMode(), plan.getSignature())
                .exceptionally(error -> {
                    throw new PeriodFetchException(periodId, unwrap(error));
                });
    }

    private void finish(long cycleId, List<Period> periods, FetchPlan plan, SamplingSettings settings,
                        List<CompletableFuture<List<RawRecord>>> fetches, Throwable error, Stopwatch stopwatch) {
        if (!isCurrent(cycleId)) {
            LOG.debug("Discarding superseded cycle {} of chart {}", cycleId, chartId);
            return;
        }
        if (error != null) {
            fail(cycleId, unwrap(error));
            return;
        }
        try {
            List<List<RawRecord>> recordsPerPeriod = fetches.stream()
                    .map(CompletableFuture::join)
                    .collect(Collectors.toList());
            List<ChartDataPoint> points = transformer.assemble(periods, recordsPerPeriod, plan);
            List<ChartDataPoint> sampled = transformer.sample(points, plan.getAxisMode(), settings, samplingEngine);
            complete(cycleId, state.succeeded(sampled, cycleId));
            LOG.info("Chart {} loaded {} points from {} periods in {}",
                    chartId, sampled.size(), periods.size(), stopwatch.stop());
        } catch (RuntimeException e) {
            fail(cycleId, unwrap(e));
        }
    }

    private void fail(long cycleId, Throwable error) {
        if (!isCurrent(cycleId)) {
            return;
        }
        LOG.warn("Chart {} failed to load data: {}", chartId, error.getMessage(), error);
        complete(cycleId, state.failed(error, cycleId));
    }

    private void complete(long cycleId, ChartDataState newState) {
        synchronized (this) {
            if (!isCurrent(cycleId)) {
                return;
            }
            state = newState;
            loadingRegistry.unregisterLoading(chartId);
        }
        notifyListeners(newState);
    }

    private void notifyListeners(ChartDataState published) {
        for (ChartDataListener listener : listeners) {
            try {
                listener.onStateChanged(chartId, published);
            } catch (RuntimeException e) {
                LOG.error("Listener of chart {} failed", chartId, e);
            }
        }
    }

    private static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while (current instanceof CompletionException && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    /**
     * Builder for {@link ChartDataCoordinator}. The chart id, the shared fetch cache and
     * the data provider are required.
     */
    public static class Builder {
        private String chartId;
        private SharedFetchCache fetchCache;
        private PeriodDataProvider dataProvider;
        private SamplingEngine samplingEngine = new DefaultSamplingEngine();
        private SettingsProvider settingsProvider = SettingsProvider.fixed(SamplingSettings.defaults());
        private LoadingRegistry loadingRegistry = new LoadingRegistry();
        private ChartDataTransformer transformer = new ChartDataTransformer();
        private Duration debounce = DEFAULT_DEBOUNCE;
        private ScheduledExecutorService executor;

        public Builder withChartId(String chartId) {
            this.chartId = chartId;
            return this;
        }

        public Builder withFetchCache(SharedFetchCache fetchCache) {
            this.fetchCache = fetchCache;
            return this;
        }

        public Builder withDataProvider(PeriodDataProvider dataProvider) {
            this.dataProvider = dataProvider;
            return this;
        }

        public Builder withSamplingEngine(SamplingEngine samplingEngine) {
            this.samplingEngine = samplingEngine;
            return this;
        }

        public Builder withSettingsProvider(SettingsProvider settingsProvider) {
            this.settingsProvider = settingsProvider;
            return this;
        }

        public Builder withLoadingRegistry(LoadingRegistry loadingRegistry) {
            this.loadingRegistry = loadingRegistry;
            return this;
        }

        public Builder withTransformer(ChartDataTransformer transformer) {
            this.transformer = transformer;
            return this;
        }

        public Builder withDebounce(Duration debounce) {
            this.debounce = debounce;
            return this;
        }

        /**
         * Runs cycles on the given scheduler, which must be single-threaded. The caller
         * keeps ownership; {@link ChartDataCoordinator#close()} does not shut it down.
         */
        public Builder withExecutor(ScheduledExecutorService executor) {
            this.executor = executor;
            return this;
        }

        public ChartDataCoordinator build() {
            if (chartId == null || chartId.isEmpty()) {
                throw new IllegalStateException("Cannot build ChartDataCoordinator: missing chart id");
            }
            if (fetchCache == null || dataProvider == null) {
                throw new IllegalStateException("Cannot build ChartDataCoordinator: missing fetch cache or data provider");
            }
            Preconditions.checkNotNull(samplingEngine, "samplingEngine");
            Preconditions.checkNotNull(settingsProvider, "settingsProvider");
            Preconditions.checkNotNull(loadingRegistry, "loadingRegistry");
            Preconditions.checkNotNull(transformer, "transformer");
            Preconditions.checkArgument(!debounce.isNegative(), "debounce must not be negative: %s", debounce);
            return new ChartDataCoordinator(this);
        }
    }
}
