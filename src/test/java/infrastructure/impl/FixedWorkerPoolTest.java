package infrastructure.impl;

import org.junit.jupiter.api.Test;

import java.io.Closeable;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class FixedWorkerPoolTest {

    /** Stand-in for a socket. */
    static final class Job implements Closeable {
        final int id;
        volatile boolean closed;
        Job(int id) { this.id = id; }
        @Override public void close() { closed = true; }
        @Override public String toString() { return "job-" + id; }
    }

    @Test
    void rejectsNonPositiveSize() {
        assertThrows(IllegalArgumentException.class, () -> new FixedWorkerPool<Job>(0, "w", j -> {}));
    }

    @Test
    void neverRunsMoreThanPoolSizeAtOnce() throws Exception {
        AtomicInteger active = new AtomicInteger();
        AtomicInteger peak = new AtomicInteger();
        Set<Integer> done = ConcurrentHashMap.newKeySet();
        CountDownLatch all = new CountDownLatch(30);

        FixedWorkerPool<Job> pool = new FixedWorkerPool<>(3, "w", job -> {
            int now = active.incrementAndGet();
            peak.accumulateAndGet(now, Math::max);
            try {
                Thread.sleep(20);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            active.decrementAndGet();
            done.add(job.id);
            all.countDown();
        });
        try {
            for (int i = 0; i < 30; i++) assertTrue(pool.submit(new Job(i)));
            assertTrue(all.await(10, TimeUnit.SECONDS));
        } finally {
            pool.shutdown();
        }

        assertEquals(30, done.size());
        assertTrue(peak.get() <= 3, "peak concurrency " + peak.get());
        assertEquals(3, pool.size());
    }

    @Test
    void shutdownDrainsQueuedWorkBeforeReturning() throws Exception {
        CountDownLatch gate = new CountDownLatch(1);
        List<Integer> processed = new CopyOnWriteArrayList<>();

        FixedWorkerPool<Job> pool = new FixedWorkerPool<>(1, "w", job -> {
            try {
                gate.await();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            processed.add(job.id);
        });
        for (int i = 0; i < 5; i++) pool.submit(new Job(i));

        Thread closer = new Thread(() -> {
            try {
                pool.shutdown();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        });
        closer.start();
        Thread.sleep(100);
        assertTrue(closer.isAlive(), "shutdown must wait for queued work");

        gate.countDown();
        closer.join(5_000);
        assertFalse(closer.isAlive());
        assertEquals(List.of(0, 1, 2, 3, 4), processed);
    }

    @Test
    void submitAfterShutdownDropsAndClosesTheItem() throws Exception {
        AtomicInteger calls = new AtomicInteger();
        FixedWorkerPool<Job> pool = new FixedWorkerPool<>(2, "w", job -> calls.incrementAndGet());
        pool.shutdown();
        pool.shutdown(); // idempotent

        Job late = new Job(99);
        assertFalse(pool.submit(late));
        assertTrue(late.closed);
        assertEquals(0, calls.get());
    }

    @Test
    void workerSurvivesAFailingItem() throws Exception {
        CountDownLatch second = new CountDownLatch(1);
        FixedWorkerPool<Job> pool = new FixedWorkerPool<>(1, "w", job -> {
            if (job.id == 1) throw new IllegalStateException("bad job");
            second.countDown();
        });
        Job bad = new Job(1);
        try {
            pool.submit(bad);
            pool.submit(new Job(2));
            assertTrue(second.await(5, TimeUnit.SECONDS));
        } finally {
            pool.shutdown();
        }
        assertTrue(bad.closed);
    }

    @Test
    void rejectsNullItems() throws Exception {
        FixedWorkerPool<Job> pool = new FixedWorkerPool<>(1, "w", job -> {});
        try {
            assertThrows(NullPointerException.class, () -> pool.submit(null));
        } finally {
            pool.shutdown();
        }
    }

    @Test
    void workerSurvivesAnErrorFromItsItem() throws Exception {
        CountDownLatch served = new CountDownLatch(2);
        FixedWorkerPool<Job> pool = new FixedWorkerPool<>(1, "w", job -> {
            if (job.id < 2) throw new StackOverflowError("deep");
            served.countDown();
        });
        Job first = new Job(0);
        Job second = new Job(1);
        try {
            pool.submit(first);
            pool.submit(second);
            pool.submit(new Job(2));
            pool.submit(new Job(3));
            assertTrue(served.await(5, TimeUnit.SECONDS), "single worker must outlive both errors");
        } finally {
            pool.shutdown();
        }
        assertTrue(first.closed);
        assertTrue(second.closed);
    }
}
