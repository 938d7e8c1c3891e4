package me.codebuddy.resilience.domain.resilience;

import me.codebuddy.resilience.domain.model.BulkheadSnapshot;
import me.codebuddy.resilience.testsupport.RecordingMetrics;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.lang.reflect.Modifier;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class BulkheadTest {

    private RecordingMetrics metrics;
    private ExecutorService executor;

    @BeforeEach
    void setUp() {
        metrics = new RecordingMetrics();
        executor = Executors.newCachedThreadPool();
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    private Bulkhead bulkhead(int capacity, int queueCapacity, Duration queueTimeout) {
        return new Bulkhead("model-provider", BulkheadConfig.builder()
                .capacity(capacity)
                .queueCapacity(queueCapacity)
                .queueTimeout(queueTimeout)
                .build(), metrics);
    }

    private Future<String> occupy(Bulkhead bulkhead, CountDownLatch started, CountDownLatch release) {
        return executor.submit(() -> bulkhead.execute(() -> {
            started.countDown();
            assertTrue(release.await(5, TimeUnit.SECONDS));
            return "done";
        }));
    }

    private static void awaitQueued(Bulkhead bulkhead, int expected) throws InterruptedException {
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
        while (bulkhead.getSnapshot().queuedCount() < expected && System.nanoTime() < deadline) {
            Thread.sleep(5);
        }
        assertEquals(expected, bulkhead.getSnapshot().queuedCount());
    }

    // ===== Admission =====

    @Test
    void shouldRejectImmediatelyWhenFullAndQueueTimeoutIsZero() throws Exception {
        Bulkhead bulkhead = bulkhead(2, 1, Duration.ZERO);
        CountDownLatch started = new CountDownLatch(2);
        CountDownLatch release = new CountDownLatch(1);
        Future<String> first = occupy(bulkhead, started, release);
        Future<String> second = occupy(bulkhead, started, release);
        assertTrue(started.await(5, TimeUnit.SECONDS));

        AtomicInteger invoked = new AtomicInteger();
        BulkheadFullException rejected = assertThrows(BulkheadFullException.class,
                () -> bulkhead.execute(invoked::incrementAndGet));

        assertEquals(0, invoked.get());
        assertEquals("model-provider", rejected.getPoolName());
        assertFalse(rejected.isQueueTimedOut());
        assertEquals(List.of("model-provider"), metrics.bulkheadRejections);

        release.countDown();
        assertEquals("done", first.get(5, TimeUnit.SECONDS));
        assertEquals("done", second.get(5, TimeUnit.SECONDS));

        BulkheadSnapshot snapshot = bulkhead.getSnapshot();
        assertEquals(0, snapshot.activeCount());
        assertEquals(2, snapshot.totalAdmitted());
        assertEquals(1, snapshot.totalRejected());
    }

    @Test
    void shouldRejectWhenQueueIsFull() throws Exception {
        Bulkhead bulkhead = bulkhead(1, 1, Duration.ofSeconds(5));
        CountDownLatch started = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        Future<String> running = occupy(bulkhead, started, release);
        assertTrue(started.await(5, TimeUnit.SECONDS));

        Future<String> queued = executor.submit(() -> bulkhead.execute(() -> "queued"));
        awaitQueued(bulkhead, 1);

        assertThrows(BulkheadFullException.class, () -> bulkhead.execute(() -> "overflow"));

        release.countDown();
        assertEquals("done", running.get(5, TimeUnit.SECONDS));
        assertEquals("queued", queued.get(5, TimeUnit.SECONDS));
    }

    @Test
    void shouldTimeOutQueuedCall() throws Exception {
        Bulkhead bulkhead = bulkhead(1, 5, Duration.ofMillis(50));
        CountDownLatch started = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        Future<String> running = occupy(bulkhead, started, release);
        assertTrue(started.await(5, TimeUnit.SECONDS));

        BulkheadFullException rejected = assertThrows(BulkheadFullException.class,
                () -> bulkhead.execute(() -> "late"));

        assertTrue(rejected.isQueueTimedOut());
        BulkheadSnapshot snapshot = bulkhead.getSnapshot();
        assertEquals(1, snapshot.queueTimeouts());
        assertEquals(0, snapshot.queuedCount());

        release.countDown();
        running.get(5, TimeUnit.SECONDS);
    }

    @Test
    void shouldAdmitQueuedCallsInArrivalOrder() throws Exception {
        Bulkhead bulkhead = bulkhead(1, 3, Duration.ofSeconds(5));
        CountDownLatch started = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        Future<String> running = occupy(bulkhead, started, release);
        assertTrue(started.await(5, TimeUnit.SECONDS));

        List<Integer> order = new CopyOnWriteArrayList<>();
        Future<?>[] waiters = new Future<?>[3];
        for (int i = 0; i < 3; i++) {
            int id = i;
            waiters[i] = executor.submit(() -> bulkhead.execute(() -> order.add(id)));
            awaitQueued(bulkhead, i + 1);
        }

        release.countDown();
        running.get(5, TimeUnit.SECONDS);
        for (Future<?> waiter : waiters) {
            waiter.get(5, TimeUnit.SECONDS);
        }

        assertEquals(List.of(0, 1, 2), order);
        assertEquals(0, bulkhead.getSnapshot().activeCount());
    }

    @Test
    void shouldNeverExceedCapacity() throws Exception {
        Bulkhead bulkhead = bulkhead(3, 50, Duration.ofSeconds(5));
        AtomicInteger current = new AtomicInteger();
        AtomicInteger peak = new AtomicInteger();
        CountDownLatch done = new CountDownLatch(20);

        for (int i = 0; i < 20; i++) {
            executor.submit(() -> {
                try {
                    bulkhead.execute(() -> {
                        int now = current.incrementAndGet();
                        peak.accumulateAndGet(now, Math::max);
                        Thread.sleep(10);
                        current.decrementAndGet();
                        return null;
                    });
                } finally {
                    done.countDown();
                }
                return null;
            });
        }

        assertTrue(done.await(10, TimeUnit.SECONDS));
        assertTrue(peak.get() <= 3, "peak concurrency was " + peak.get());
        assertEquals(20, bulkhead.getSnapshot().totalAdmitted());
        assertEquals(0, bulkhead.getSnapshot().activeCount());
    }

    @Test
    void shouldReleaseSlotWhenOperationFails() {
        Bulkhead bulkhead = bulkhead(1, 0, Duration.ZERO);

        assertThrows(IllegalStateException.class, () -> bulkhead.execute(() -> {
            throw new IllegalStateException("boom");
        }));

        assertEquals(0, bulkhead.getSnapshot().activeCount());
        assertTrue(metrics.bulkheadStates.size() >= 2);
    }

    @Test
    void shouldExposeSlotsOnlyThroughExecute() throws Exception {
        assertFalse(Modifier.isPublic(Bulkhead.class.getDeclaredMethod("acquire").getModifiers()));
        assertFalse(Modifier.isPublic(Bulkhead.class.getDeclaredMethod("release").getModifiers()));
        assertTrue(Modifier.isPublic(Bulkhead.class.getMethod("execute", Callable.class)
                .getModifiers()));
    }
}
