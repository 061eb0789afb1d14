package gr.imsi.athenarc.chartdata.datasource;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.base.Preconditions;
import com.google.common.base.Stopwatch;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import com.univocity.parsers.csv.CsvParser;
import com.univocity.parsers.csv.CsvParserSettings;

import gr.imsi.athenarc.chartdata.cache.CacheManager;
import gr.imsi.athenarc.chartdata.cache.CacheStrategy;
import gr.imsi.athenarc.chartdata.domain.RawRecord;
import gr.imsi.athenarc.chartdata.fetch.PeriodDataProvider;

import java.io.IOException;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Reads period data from CSV files named {@code <periodId>.csv} in a directory. Each
 * file has a header row, a timestamp column and one column per parameter.
 * <p>
 * Parsed files are kept in an optional {@link CacheManager}, tagged with their period
 * id, so that fetches asking for different columns of the same period parse it once.
 */
public class CsvPeriodDataProvider implements PeriodDataProvider, AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(CsvPeriodDataProvider.class);

    private static final String KEY_PREFIX = "csv:";

    private final Path directory;
    private final String timestampColumn;
    private final CacheManager<List<RawRecord>> fileCache;
    private final ExecutorService executor;

    public CsvPeriodDataProvider(Path directory, String timestampColumn) {
        this(directory, timestampColumn, null);
    }

    /**
     * @param directory the directory holding the period files
     * @param timestampColumn name of the timestamp column in every file
     * @param fileCache cache of parsed files, may be {@code null}
     */
    public CsvPeriodDataProvider(Path directory, String timestampColumn, CacheManager<List<RawRecord>> fileCache) {
        this.directory = Preconditions.checkNotNull(directory, "directory");
        this.timestampColumn = Preconditions.checkNotNull(timestampColumn, "timestampColumn");
        this.fileCache = fileCache;
        this.executor = Executors.newFixedThreadPool(2, new ThreadFactoryBuilder()
                .setNameFormat("csv-reader-%d")
                .setDaemon(true)
                .build());
    }

    /**
     * Reads the file of {@code periodId} on the provider's executor and keeps only the
     * requested columns. Columns missing from the file are left out of the records.
     * The future fails with an {@link UncheckedIOException} if the file cannot be read.
     */
    @Override
    public CompletableFuture<List<RawRecord>> fetch(String periodId, List<String> parameterNames) {
        CompletableFuture<List<RawRecord>> records = fileCache != null
                ? fileCache.get(KEY_PREFIX + periodId, () -> readAsync(periodId), CacheStrategy.withTags(periodId))
                : readAsync(periodId);
        return records.thenApply(all -> project(all, parameterNames));
    }

    /**
     * Forgets the parsed file of {@code periodId}, if cached.
     */
    public void invalidate(String periodId) {
        if (fileCache != null) {
            fileCache.invalidateTags(List.of(periodId));
        }
    }

    private CompletableFuture<List<RawRecord>> readAsync(String periodId) {
        return CompletableFuture.supplyAsync(() -> read(periodId), executor);
    }

    List<RawRecord> read(String periodId) {
        Path file = directory.resolve(periodId + ".csv");
        Stopwatch stopwatch = Stopwatch.createStarted();

        CsvParserSettings settings = new CsvParserSettings();
        settings.setLineSeparatorDetectionEnabled(true);
        CsvParser parser = new CsvParser(settings);

        List<RawRecord> records = new ArrayList<>();
        try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            parser.beginParsing(reader);
            try {
                String[] headers = parser.parseNext();
                if (headers == null) {
                    LOG.warn("File {} has no header row", file);
                    return records;
                }
                int timestampIndex = indexOf(headers, timestampColumn);
                if (timestampIndex < 0) {
                    throw new IllegalStateException("File " + file + " has no column " + timestampColumn);
                }

                String[] row;
                while ((row = parser.parseNext()) != null) {
                    Map<String, Object> values = new HashMap<>();
                    for (int i = 0; i < headers.length && i < row.length; i++) {
                        if (row[i] != null) {
                            values.put(headers[i], row[i]);
                        }
                    }
                    String timestamp = timestampIndex < row.length ? row[timestampIndex] : null;
                    records.add(new RawRecord(timestamp, values));
                }
            } finally {
                parser.stopParsing();
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read " + file, e);
        }
        LOG.info("Read {} rows of period {} in {}", records.size(), periodId, stopwatch.stop());
        return records;
    }

    private static List<RawRecord> project(List<RawRecord> records, List<String> parameterNames) {
        List<RawRecord> projected = new ArrayList<>(records.size());
        for (RawRecord record : records) {
            Map<String, Object> values = new HashMap<>();
            for (String parameter : parameterNames) {
                Object value = record.get(parameter);
                if (value != null) {
                    values.put(parameter, value);
                }
            }
            projected.add(new RawRecord(record.getTimestamp(), values));
        }
        return projected;
    }

    private static int indexOf(String[] headers, String column) {
        for (int i = 0; i < headers.length; i++) {
            if (column.equals(headers[i])) {
                return i;
            }
        }
        return -1;
    }

    @Override
    public void close() {
        executor.shutdown();
    }
}
