package com.jreinhal.zerag.config;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class WorkerPoolConfigTest {

    private ThreadPoolExecutor executor;

    @AfterEach
    void tearDown() {
        if (executor != null) {
            executor.shutdownNow();
        }
    }

    @Test
    void syncPoolUsesConfiguredSizes() {
        executor = new WorkerPoolConfig().syncExecutor(2, 6, 30);

        assertEquals(2, executor.getCorePoolSize());
        assertEquals(6, executor.getMaximumPoolSize());
        assertEquals(30, executor.getQueue().remainingCapacity());
        assertTrue(executor.allowsCoreThreadTimeOut());
    }

    @Test
    void nonsenseSizesAreClamped() {
        WorkerPoolConfig.PoolSpec spec = new WorkerPoolConfig.PoolSpec("sync", 0, -1, 0);

        assertEquals(1, spec.coreThreads());
        assertEquals(1, spec.maxThreads());
        assertEquals(1, spec.queueCapacity());
    }

    @Test
    void rerankQueueScalesWithThreads() {
        executor = new WorkerPoolConfig().rerankExecutor(3);

        assertEquals(3, executor.getCorePoolSize());
        assertEquals(3, executor.getMaximumPoolSize());
        assertEquals(30, executor.getQueue().remainingCapacity());
    }

    @Test
    void saturatedPoolRejectsInsteadOfRunningOnCaller() throws Exception {
        executor = new WorkerPoolConfig().syncExecutor(1, 1, 1);
        CountDownLatch release = new CountDownLatch(1);
        CountDownLatch started = new CountDownLatch(1);
        executor.execute(() -> {
            started.countDown();
            try {
                release.await(5, TimeUnit.SECONDS);
            }
            catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        });
        assertTrue(started.await(5, TimeUnit.SECONDS));
        executor.execute(() -> { });

        Thread[] ranOn = new Thread[1];
        assertThrows(RejectedExecutionException.class, () -> executor.execute(() -> ranOn[0] = Thread.currentThread()));
        assertNull(ranOn[0]);

        WorkerPoolConfig.BusyPoolRejection handler = (WorkerPoolConfig.BusyPoolRejection) executor.getRejectedExecutionHandler();
        assertEquals(1, handler.rejectedCount());
        release.countDown();
    }

    @Test
    void workersAreNamedDaemons() throws Exception {
        executor = new WorkerPoolConfig().rerankExecutor(2);
        Thread[] worker = new Thread[1];
        CountDownLatch done = new CountDownLatch(1);
        executor.execute(() -> {
            worker[0] = Thread.currentThread();
            done.countDown();
        });

        assertTrue(done.await(5, TimeUnit.SECONDS));
        assertTrue(worker[0].getName().startsWith("rerank-worker-"));
        assertTrue(worker[0].isDaemon());
    }
}
