package io.opaquotes.stream;

import io.opaquotes.domain.stream.TickerFilter;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class ConcurrentSubscriptionRegistryTest {

    private ConcurrentSubscriptionRegistry registry;

    @BeforeEach
    void setUp() {
        registry = new ConcurrentSubscriptionRegistry(16);
    }

    private static List<String> ids(List<Subscription> subs) {
        return subs.stream().map(Subscription::getConnectionId).toList();
    }

    @Test
    void testRegisteredSubscriptionVisibleToNextSnapshot() {
        registry.register("c1", TickerFilter.tickers(Set.of("AAPL")), new RecordingTransport());

        assertEquals(List.of("c1"), ids(registry.snapshotMatching("AAPL")));
        assertTrue(registry.snapshotMatching("MSFT").isEmpty());
        assertEquals(1, registry.size());
    }

    @Test
    void testUnregisteredSubscriptionInvisibleToNextSnapshot() {
        registry.register("c1", TickerFilter.all(), new RecordingTransport());

        assertTrue(registry.unregister("c1").isPresent());

        assertTrue(registry.snapshotMatching("AAPL").isEmpty());
        assertTrue(registry.snapshotAll().isEmpty());
        assertEquals(0, registry.size());
    }

    @Test
    void testMatchingCombinesWildcardAndTickerIndex() {
        registry.register("all", TickerFilter.all(), new RecordingTransport());
        registry.register("aapl", TickerFilter.tickers(Set.of("AAPL", "MSFT")), new RecordingTransport());
        registry.register("tsla", TickerFilter.tickers(Set.of("TSLA")), new RecordingTransport());

        assertEquals(List.of("all", "aapl"), ids(registry.snapshotMatching("AAPL")));
        assertEquals(List.of("all", "aapl"), ids(registry.snapshotMatching("MSFT")));
        assertEquals(List.of("all", "tsla"), ids(registry.snapshotMatching("TSLA")));
        assertEquals(List.of("all"), ids(registry.snapshotMatching("NVDA")));
        assertEquals(3, registry.indexedTickerCount());
    }

    @Test
    void testDuplicateIdRejectedAndOriginalKept() {
        RecordingTransport first = new RecordingTransport();
        registry.register("c1", TickerFilter.all(), first);

        DuplicateConnectionException e = assertThrows(DuplicateConnectionException.class,
            () -> registry.register("c1", TickerFilter.tickers(Set.of("AAPL")), new RecordingTransport()));

        assertEquals("c1", e.getConnectionId());
        assertEquals(1, registry.size());
        assertSame(first, registry.get("c1").orElseThrow().getTransport());
    }

    @Test
    void testUnregisterIsIdempotent() {
        registry.register("c1", TickerFilter.tickers(Set.of("AAPL")), new RecordingTransport());

        assertTrue(registry.unregister("c1").isPresent());
        assertTrue(registry.unregister("c1").isEmpty());
        assertTrue(registry.unregister("never-registered").isEmpty());
        assertEquals(0, registry.indexedTickerCount());
    }

    @Test
    void testSnapshotIsDetachedFromLaterMutations() {
        registry.register("c1", TickerFilter.all(), new RecordingTransport());
        List<Subscription> snapshot = registry.snapshotMatching("AAPL");

        registry.register("c2", TickerFilter.all(), new RecordingTransport());
        registry.unregister("c1");

        assertEquals(List.of("c1"), ids(snapshot));
    }

    @Test
    void testConcurrentRegisterUnregisterWhileRouting() throws Exception {
        int writers = 4;
        int perWriter = 500;
        ExecutorService pool = Executors.newFixedThreadPool(writers + 1);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<?>> futures = new ArrayList<>();

        for (int w = 0; w < writers; w++) {
            int writer = w;
            futures.add(pool.submit(() -> {
                start.await();
                for (int i = 0; i < perWriter; i++) {
                    String id = "w" + writer + "-" + i;
                    TickerFilter filter = i % 2 == 0 ? TickerFilter.all() : TickerFilter.tickers(Set.of("AAPL"));
                    registry.register(id, filter, new RecordingTransport());
                    if (i % 3 != 0) {
                        registry.unregister(id);
                    }
                }
                return null;
            }));
        }
        futures.add(pool.submit(() -> {
            start.await();
            for (int i = 0; i < 2000; i++) {
                for (Subscription s : registry.snapshotMatching("AAPL")) {
                    assertTrue(s.matches("AAPL"));
                }
            }
            return null;
        }));

        start.countDown();
        for (Future<?> f : futures) {
            f.get(30, TimeUnit.SECONDS);
        }
        pool.shutdown();

        // i % 3 == 0 survive: 167 per writer for 500 iterations
        int expected = writers * ((perWriter + 2) / 3);
        assertEquals(expected, registry.size());
        assertEquals(expected, registry.snapshotAll().size());
    }
}
