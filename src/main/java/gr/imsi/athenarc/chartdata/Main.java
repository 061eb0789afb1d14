package gr.imsi.athenarc.chartdata;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.beust.jcommander.JCommander;
import com.beust.jcommander.Parameter;

import gr.imsi.athenarc.chartdata.cache.CacheManager;
import gr.imsi.athenarc.chartdata.chart.ChartConfig;
import gr.imsi.athenarc.chartdata.chart.ChartDataCoordinator;
import gr.imsi.athenarc.chartdata.chart.ChartDataPoint;
import gr.imsi.athenarc.chartdata.chart.ChartDataState;
import gr.imsi.athenarc.chartdata.chart.LoadingRegistry;
import gr.imsi.athenarc.chartdata.chart.SamplingSettings;
import gr.imsi.athenarc.chartdata.chart.SettingsProvider;
import gr.imsi.athenarc.chartdata.chart.YParameter;
import gr.imsi.athenarc.chartdata.config.ChartDataConfiguration;
import gr.imsi.athenarc.chartdata.datasource.CsvPeriodDataProvider;
import gr.imsi.athenarc.chartdata.domain.AxisMode;
import gr.imsi.athenarc.chartdata.domain.Period;
import gr.imsi.athenarc.chartdata.domain.RawRecord;
import gr.imsi.athenarc.chartdata.fetch.SharedFetchCache;
import gr.imsi.athenarc.chartdata.sampling.SamplingMethod;

import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Loads one chart from a directory of period CSV files and prints a summary of the
 * resulting series.
 */
public class Main {

    private static final Logger LOG = LoggerFactory.getLogger(Main.class);

    @Parameter(names = "-data", description = "Directory holding <periodId>.csv files")
    private String dataDirectory;

    @Parameter(names = "-periods", variableArity = true, required = true, description = "Period ids to plot")
    private List<String> periods = new ArrayList<>();

    @Parameter(names = "-x", description = "X parameter, used by the time and parameter axis modes")
    private String xParameter;

    @Parameter(names = "-y", variableArity = true, required = true, description = "Y parameters to plot")
    private List<String> yParameters = new ArrayList<>();

    @Parameter(names = "-axis", description = "Axis mode (datetime/time/parameter)")
    private String axis = "datetime";

    @Parameter(names = "-target", description = "Target point count after sampling")
    private Integer target;

    @Parameter(names = "-method", description = "Sampling method (none/nth-point/lttb/adaptive)")
    private String method;

    @Parameter(names = "--help", help = true)
    private boolean help;

    public static void main(String... args) throws InterruptedException {
        Main main = new Main();
        JCommander jCommander = JCommander.newBuilder()
                .addObject(main)
                .build();
        jCommander.setProgramName("chart-data-cache");
        jCommander.parse(args);
        if (main.help) {
            jCommander.usage();
            return;
        }
        main.run();
    }

    private void run() throws InterruptedException {
        ChartDataConfiguration configuration = ChartDataConfiguration.load();
        String directory = dataDirectory != null ? dataDirectory : configuration.getDataDirectory();

        SamplingSettings defaults = configuration.getSamplingSettings();
        SamplingSettings sampling = new SamplingSettings(
                defaults.isEnabled(),
                method != null ? SamplingMethod.fromString(method) : defaults.getMethod(),
                target != null ? target : defaults.getTargetPointCount());

        ChartConfig.Builder chartConfig = ChartConfig.builder()
                .withAxisMode(AxisMode.fromString(axis))
                .withXParameter(xParameter);
        periods.forEach(id -> chartConfig.withPeriod(Period.of(id)));
        yParameters.forEach(y -> chartConfig.withYParameter(YParameter.of(y)));

        SharedFetchCache fetchCache = configuration.createFetchCache();
        LoadingRegistry loadingRegistry = new LoadingRegistry();
        CountDownLatch done = new CountDownLatch(1);
        AtomicReference<ChartDataState> result = new AtomicReference<>();

        try (CacheManager<List<RawRecord>> fileCache = configuration.createCacheManager()) {
            try (CsvPeriodDataProvider provider = new CsvPeriodDataProvider(Paths.get(directory),
                    configuration.getTimestampColumn(), fileCache);
                 ChartDataCoordinator coordinator = configuration.coordinatorBuilder()
                         .withChartId("main")
                         .withFetchCache(fetchCache)
                         .withDataProvider(provider)
                         .withSettingsProvider(SettingsProvider.fixed(sampling))
                         .withLoadingRegistry(loadingRegistry)
                         .build()) {
                coordinator.addListener((chartId, state) -> {
                    if (!state.isLoading()) {
                        result.set(state);
                        done.countDown();
                    }
                });
                coordinator.update(chartConfig.build());
                if (!done.await(5, TimeUnit.MINUTES)) {
                    LOG.error("Timed out waiting for chart data");
                    return;
                }
            }
            LOG.info("File cache: {}", fileCache.getStats());
        }

        ChartDataState state = result.get();
        if (state.getError() != null) {
            LOG.error("Loading failed: {}", state.getError().getMessage());
            return;
        }
        LOG.info("Loaded {} points", state.getPoints().size());
        state.getPoints().stream()
                .map(ChartDataPoint::getSeriesKey)
                .distinct()
                .forEach(series -> LOG.info("Series {}: {} points", series,
                        state.getPoints().stream().filter(p -> p.getSeriesKey().equals(series)).count()));
    }
}
