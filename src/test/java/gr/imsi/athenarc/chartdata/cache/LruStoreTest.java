package gr.imsi.athenarc.chartdata.cache;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

public class LruStoreTest {

    private static LruStore<String, Integer> memoryBounded(long maxMemory, List<String> evicted) {
        return LruStore.<String, Integer>builder()
                .maxMemory(maxMemory)
                .sizeCalculator(Integer::longValue)
                .removalListener((key, value) -> evicted.add(key))
                .build();
    }

    @Test
    public void testEvictsLeastRecentlyUsedUntilValueFits() {
        List<String> evicted = new ArrayList<>();
        LruStore<String, Integer> store = memoryBounded(100, evicted);
        store.set("A", 40);
        store.set("B", 30);
        store.set("C", 20);

        store.set("D", 60);

        assertEquals(List.of("A", "B"), evicted);
        assertFalse(store.has("A"));
        assertFalse(store.has("B"));
        assertTrue(store.has("C"));
        assertTrue(store.has("D"));
        assertEquals(80, store.memoryUsage());
    }

    @Test
    public void testReadRefreshesRecency() {
        List<String> evicted = new ArrayList<>();
        LruStore<String, Integer> store = memoryBounded(100, evicted);
        store.set("A", 40);
        store.set("B", 30);
        store.set("C", 20);

        assertEquals(40, store.get("A"));
        store.set("D", 60);

        assertEquals(List.of("B", "C"), evicted);
        assertTrue(store.has("A"));
        assertEquals(List.of("D", "A"), store.keys());
    }

    @Test
    public void testPeekDoesNotRefreshRecency() {
        List<String> evicted = new ArrayList<>();
        LruStore<String, Integer> store = memoryBounded(60, evicted);
        store.set("A", 30);
        store.set("B", 30);

        assertEquals(30, store.peek("A"));
        store.set("C", 30);

        assertEquals(List.of("A"), evicted);
    }

    @Test
    public void testOversizedValueIsAdmittedAlone() {
        List<String> evicted = new ArrayList<>();
        LruStore<String, Integer> store = memoryBounded(100, evicted);
        store.set("A", 10);
        store.set("B", 10);

        store.set("HUGE", 150);

        assertEquals(List.of("A", "B"), evicted);
        assertEquals(1, store.size());
        assertEquals(150, store.memoryUsage());
    }

    @Test
    public void testReplacementReleasesPreviousSize() {
        List<String> evicted = new ArrayList<>();
        LruStore<String, Integer> store = memoryBounded(100, evicted);
        store.set("A", 60);
        store.set("A", 80);

        assertTrue(evicted.isEmpty());
        assertEquals(80, store.memoryUsage());
        assertEquals(1, store.size());
    }

    @Test
    public void testCapacityBoundWithoutSizeCalculator() {
        LruStore<String, String> store = LruStore.<String, String>builder().capacity(2).build();
        store.set("a", "1");
        store.set("b", "2");
        store.get("a");
        store.set("c", "3");

        assertEquals(2, store.size());
        assertTrue(store.has("a"));
        assertFalse(store.has("b"));
        assertEquals(List.of("c", "a"), store.keys());
    }

    @Test
    public void testDeleteAndClear() {
        List<String> evicted = new ArrayList<>();
        LruStore<String, Integer> store = memoryBounded(100, evicted);
        store.set("A", 10);
        store.set("B", 20);

        assertTrue(store.delete("A"));
        assertFalse(store.delete("A"));
        assertEquals(20, store.memoryUsage());

        store.clear();
        assertEquals(0, store.size());
        assertEquals(0, store.memoryUsage());
        assertTrue(evicted.isEmpty());
    }

    @Test
    public void testHitRate() {
        LruStore<String, String> store = LruStore.<String, String>builder().capacity(10).build();
        store.set("a", "1");
        store.get("a");
        store.get("a");
        store.get("a");
        store.get("missing");

        assertEquals(0.75, store.hitRate(), 1e-9);
    }

    @Test
    public void testMemoryBudgetRequiresSizeCalculator() {
        assertThrows(IllegalStateException.class,
                () -> LruStore.<String, String>builder().maxMemory(100).build());
    }

    @Test
    public void testConcurrentSetAndDeleteKeepMemoryAccounting() throws Exception {
        AtomicInteger evictions = new AtomicInteger();
        LruStore<String, Integer> store = LruStore.<String, Integer>builder()
                .maxMemory(200)
                .sizeCalculator(Integer::longValue)
                .removalListener((key, value) -> evictions.incrementAndGet())
                .build();

        ExecutorService workers = Executors.newFixedThreadPool(8);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<?>> results = new ArrayList<>();
        for (int w = 0; w < 8; w++) {
            results.add(workers.submit(() -> {
                start.await();
                ThreadLocalRandom random = ThreadLocalRandom.current();
                for (int i = 0; i < 5000; i++) {
                    String key = "k" + random.nextInt(40);
                    if (random.nextInt(4) == 0) {
                        store.delete(key);
                    } else {
                        store.set(key, 1 + random.nextInt(50));
                    }
                }
                return null;
            }));
        }
        start.countDown();
        for (Future<?> result : results) {
            result.get(30, TimeUnit.SECONDS);
        }
        workers.shutdown();

        long resident = 0;
        for (String key : store.keys()) {
            resident += store.peek(key);
        }
        assertEquals(resident, store.memoryUsage());
        assertTrue(store.memoryUsage() <= 200);
        assertTrue(evictions.get() > 0);
    }
}
