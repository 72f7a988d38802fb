package quota.java.engine;

import org.junit.jupiter.api.Test;
import quota.core.clock.SystemClock;
import quota.core.model.Decision;
import quota.core.model.RegistrationOutcome;
import quota.core.model.UsageResult;

import java.time.Duration;
import java.util.concurrent.*;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Concurrency tests for QuotaEngine.
 *
 * Focus:
 * - Same-key linearization: exactly min(N, L) admitted
 * - Cross-key independence
 * - Forced re-registration racing in-flight uses
 * - No deadlock under mixed traffic
 */
class QuotaEngineConcurrencyTest {

    private static final Duration LONG_WINDOW = Duration.ofHours(1);

    @Test
    void testConcurrent_sameKeyAdmitsExactlyLimit() throws InterruptedException {
        QuotaEngine engine = new QuotaEngine(SystemClock.instance(), new InMemoryKeyRegistry());
        engine.register("hot-key", 50, LONG_WINDOW, false);

        int[] outcome = runSingleUses(engine, "hot-key", 200);

        assertEquals(50, outcome[0]);
        assertEquals(150, outcome[1]);
    }

    @Test
    void testConcurrent_fewerCallersThanLimitAllAdmitted() throws InterruptedException {
        QuotaEngine engine = new QuotaEngine(SystemClock.instance(), new InMemoryKeyRegistry());
        engine.register("key", 50, LONG_WINDOW, false);

        int[] outcome = runSingleUses(engine, "key", 20);

        assertEquals(20, outcome[0]);
        assertEquals(0, outcome[1]);
    }

    @Test
    void testConcurrent_multipleKeysShouldNotInterfere() throws InterruptedException {
        QuotaEngine engine = new QuotaEngine(SystemClock.instance(), new InMemoryKeyRegistry());
        engine.register("key1", 10, LONG_WINDOW, false);
        engine.register("key2", 30, LONG_WINDOW, false);

        int numThreads = 60; // 20 per key, 20 on an unregistered key
        CountDownLatch startLatch = new CountDownLatch(1);
        CountDownLatch doneLatch = new CountDownLatch(numThreads);

        AtomicInteger key1Admitted = new AtomicInteger(0);
        AtomicInteger key2Admitted = new AtomicInteger(0);
        AtomicInteger notFound = new AtomicInteger(0);

        ExecutorService executor = Executors.newFixedThreadPool(numThreads);

        for (int i = 0; i < numThreads; i++) {
            final int threadId = i;
            executor.submit(() -> {
                try {
                    startLatch.await();
                    for (int j = 0; j < 5; j++) {
                        switch (threadId % 3) {
                            case 0 -> {
                                if (engine.checkAndRecord("key1").isAdmitted()) key1Admitted.incrementAndGet();
                            }
                            case 1 -> {
                                if (engine.checkAndRecord("key2").isAdmitted()) key2Admitted.incrementAndGet();
                            }
                            default -> {
                                if (engine.checkAndRecord("ghost").decision() == Decision.NOT_FOUND) {
                                    notFound.incrementAndGet();
                                }
                            }
                        }
                    }
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                } finally {
                    doneLatch.countDown();
                }
            });
        }

        startLatch.countDown();
        assertTrue(doneLatch.await(5, TimeUnit.SECONDS));

        executor.shutdown();
        assertTrue(executor.awaitTermination(5, TimeUnit.SECONDS));

        assertEquals(10, key1Admitted.get());
        assertEquals(30, key2Admitted.get());
        assertEquals(100, notFound.get());
        assertEquals(2, engine.trackedKeys());
    }

    @Test
    void testConcurrent_forcedRegistrationRacingUses() throws InterruptedException {
        QuotaEngine engine = new QuotaEngine(SystemClock.instance(), new InMemoryKeyRegistry());
        int limit = 10;
        int overwrites = 50;
        engine.register("key", limit, LONG_WINDOW, false);

        int numUsers = 8;
        CountDownLatch startLatch = new CountDownLatch(1);
        CountDownLatch doneLatch = new CountDownLatch(numUsers + 1);
        AtomicInteger admitted = new AtomicInteger(0);
        AtomicInteger overwritten = new AtomicInteger(0);

        ExecutorService executor = Executors.newFixedThreadPool(numUsers + 1);

        for (int i = 0; i < numUsers; i++) {
            executor.submit(() -> {
                try {
                    startLatch.await();
                    for (int j = 0; j < 500; j++) {
                        if (engine.checkAndRecord("key").isAdmitted()) {
                            admitted.incrementAndGet();
                        }
                    }
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                } finally {
                    doneLatch.countDown();
                }
            });
        }
        executor.submit(() -> {
            try {
                startLatch.await();
                for (int j = 0; j < overwrites; j++) {
                    if (engine.register("key", limit, LONG_WINDOW, true) == RegistrationOutcome.OVERWRITTEN) {
                        overwritten.incrementAndGet();
                    }
                    Thread.yield();
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            } finally {
                doneLatch.countDown();
            }
        });

        startLatch.countDown();
        assertTrue(doneLatch.await(10, TimeUnit.SECONDS), "Test timed out");
        executor.shutdown();
        assertTrue(executor.awaitTermination(5, TimeUnit.SECONDS));

        assertEquals(overwrites, overwritten.get());
        // each registration admits at most `limit` uses
        assertTrue(admitted.get() <= limit * (overwrites + 1),
            "Admitted " + admitted.get() + " uses across " + (overwrites + 1) + " registrations");

        // once quiet, a forced overwrite hands out exactly one fresh window
        engine.register("key", limit, LONG_WINDOW, true);
        int[] outcome = runSingleUses(engine, "key", 3 * limit);
        assertEquals(limit, outcome[0]);
        assertEquals(2 * limit, outcome[1]);
    }

    @Test
    void testConcurrent_noDeadlockWithRegistrationsAndUses() throws InterruptedException {
        QuotaEngine engine = new QuotaEngine(SystemClock.instance(), new InMemoryKeyRegistry());
        engine.register("key1", 100, Duration.ofMillis(50), false);
        engine.register("key2", 100, Duration.ofMillis(50), false);

        int numThreads = 20;
        CountDownLatch startLatch = new CountDownLatch(1);
        CountDownLatch doneLatch = new CountDownLatch(numThreads);

        ExecutorService executor = Executors.newFixedThreadPool(numThreads);

        for (int i = 0; i < numThreads; i++) {
            final int threadId = i;
            executor.submit(() -> {
                try {
                    startLatch.await();
                    for (int j = 0; j < 200; j++) {
                        String key = (threadId % 2 == 0) ? "key1" : "key2";
                        if (j % 50 == 0) {
                            engine.register(key, 100, Duration.ofMillis(50), true);
                        }
                        engine.checkAndRecord(key);
                    }
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                } finally {
                    doneLatch.countDown();
                }
            });
        }

        startLatch.countDown();

        // If there's a deadlock, this will timeout
        assertTrue(doneLatch.await(10, TimeUnit.SECONDS), "Deadlock detected - test timed out");

        executor.shutdown();
        assertTrue(executor.awaitTermination(5, TimeUnit.SECONDS));
    }

    /**
     * Fires {@code numThreads} single uses of one key at once.
     *
     * @return {admitted, denied}
     */
    private static int[] runSingleUses(QuotaEngine engine, String key, int numThreads) throws InterruptedException {
        CountDownLatch startLatch = new CountDownLatch(1);
        CountDownLatch doneLatch = new CountDownLatch(numThreads);

        AtomicInteger admitCount = new AtomicInteger(0);
        AtomicInteger denyCount = new AtomicInteger(0);

        ExecutorService executor = Executors.newFixedThreadPool(Math.min(numThreads, 64));

        for (int i = 0; i < numThreads; i++) {
            executor.submit(() -> {
                try {
                    startLatch.await(); // Wait for signal to start
                    UsageResult result = engine.checkAndRecord(key);
                    if (result.decision() == Decision.ADMITTED) {
                        admitCount.incrementAndGet();
                    } else if (result.decision() == Decision.DENIED) {
                        denyCount.incrementAndGet();
                    }
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                } finally {
                    doneLatch.countDown();
                }
            });
        }

        startLatch.countDown(); // Signal all threads to start
        assertTrue(doneLatch.await(5, TimeUnit.SECONDS), "Test timed out");

        executor.shutdown();
        assertTrue(executor.awaitTermination(5, TimeUnit.SECONDS), "Executor did not terminate");

        return new int[] {admitCount.get(), denyCount.get()};
    }
}
