package gr.imsi.athenarc.chartdata.fetch;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import gr.imsi.athenarc.chartdata.ManualTicker;
import gr.imsi.athenarc.chartdata.domain.AxisMode;
import gr.imsi.athenarc.chartdata.domain.RawRecord;

import java.time.Duration;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

public class SharedFetchCacheTest {

    private ManualTicker ticker;
    private SharedFetchCache cache;
    private AtomicInteger calls;

    @BeforeEach
    public void setUp() {
        ticker = new ManualTicker();
        cache = new SharedFetchCache(Duration.ofMillis(500), ticker);
        calls = new AtomicInteger();
    }

    private Supplier<CompletableFuture<List<RawRecord>>> counting(CompletableFuture<List<RawRecord>> result) {
        return () -> {
            calls.incrementAndGet();
            return result;
        };
    }

    private static List<RawRecord> records(String... timestamps) {
        return Arrays.stream(timestamps)
                .map(t -> new RawRecord(t, Map.of("T", 1)))
                .collect(Collectors.toList());
    }

    @Test
    public void testConcurrentCallersShareOneFetch() {
        CompletableFuture<List<RawRecord>> pending = new CompletableFuture<>();

        CompletableFuture<List<RawRecord>> first = cache.get("p1", List.of("T", "P"), counting(pending));
        CompletableFuture<List<RawRecord>> second = cache.get("p1", List.of("P", "T"), counting(pending));

        assertSame(first, second);
        assertEquals(1, calls.get());

        List<RawRecord> data = records("2024-01-01");
        pending.complete(data);
        assertSame(first.join(), second.join());
        assertEquals(data, first.join());
    }

    @Test
    public void testFailureIsSharedByAllJoiners() {
        CompletableFuture<List<RawRecord>> pending = new CompletableFuture<>();
        CompletableFuture<List<RawRecord>> first = cache.get("p1", List.of("T"), counting(pending));
        CompletableFuture<List<RawRecord>> second = cache.get("p1", List.of("T"), counting(pending));

        IllegalStateException failure = new IllegalStateException("offline");
        pending.completeExceptionally(failure);

        CompletionException e1 = assertThrows(CompletionException.class, first::join);
        CompletionException e2 = assertThrows(CompletionException.class, second::join);
        assertSame(failure, e1.getCause());
        assertSame(failure, e2.getCause());
        assertEquals(1, calls.get());
    }

    @Test
    public void testFetcherThrowingSynchronouslyFailsTheFuture() {
        CompletableFuture<List<RawRecord>> result = cache.get("p1", List.of("T"), () -> {
            throw new IllegalArgumentException("bad period");
        });

        CompletionException e = assertThrows(CompletionException.class, result::join);
        assertTrue(e.getCause() instanceof IllegalArgumentException);
    }

    @Test
    public void testExpiredRecordIsFetchedAgain() {
        CompletableFuture<List<RawRecord>> done = CompletableFuture.completedFuture(records("a"));
        cache.get("p1", List.of("T"), counting(done));

        ticker.advanceMillis(499);
        cache.get("p1", List.of("T"), counting(done));
        assertEquals(1, calls.get());

        ticker.advanceMillis(1);
        cache.get("p1", List.of("T"), counting(done));
        assertEquals(2, calls.get());
    }

    @Test
    public void testExpiredRecordsAreSweptOnAccess() {
        CompletableFuture<List<RawRecord>> done = CompletableFuture.completedFuture(records("a"));
        cache.get("p1", List.of("T"), counting(done));
        cache.get("p2", List.of("T"), counting(done));
        assertEquals(2, cache.size());

        ticker.advanceMillis(600);
        cache.get("p3", List.of("T"), counting(done));

        assertEquals(1, cache.size());
    }

    @Test
    public void testSignatureAndAxisModeArePartOfTheKey() {
        CompletableFuture<List<RawRecord>> done = CompletableFuture.completedFuture(records("a"));
        cache.get("p1", List.of("T"), counting(done), AxisMode.DATETIME, "parameter:T");
        cache.get("p1", List.of("T"), counting(done), AxisMode.DATETIME, "calculated:T");
        cache.get("p1", List.of("T"), counting(done), AxisMode.TIME, "parameter:T");
        cache.get("p1", List.of("T"), counting(done), AxisMode.DATETIME, "parameter:T");

        assertEquals(3, calls.get());
        assertEquals(3, cache.size());
    }

    @Test
    public void testClearForPeriodMatchesWholeIdOnly() {
        CompletableFuture<List<RawRecord>> done = CompletableFuture.completedFuture(records("a"));
        cache.get("run", List.of("T"), counting(done));
        cache.get("run", List.of("P"), counting(done), AxisMode.TIME, "parameter:P");
        cache.get("run-2", List.of("T"), counting(done));
        cache.get("pre-run", List.of("T"), counting(done));

        cache.clearForPeriod("run");

        assertEquals(2, cache.size());
        cache.get("run-2", List.of("T"), counting(done));
        assertEquals(4, calls.get());
    }

    @Test
    public void testClearForSources() {
        CompletableFuture<List<RawRecord>> done = CompletableFuture.completedFuture(records("a"));
        cache.get("a", List.of("T"), counting(done));
        cache.get("b", List.of("T"), counting(done));
        cache.get("c", List.of("T"), counting(done));

        cache.clearForSources(List.of("a", "c"));
        assertEquals(1, cache.size());

        cache.clear();
        assertEquals(0, cache.size());
    }
}
