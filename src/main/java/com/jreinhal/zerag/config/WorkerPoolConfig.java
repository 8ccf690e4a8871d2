package com.jreinhal.zerag.config;

import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.RejectedExecutionHandler;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;

/**
 * The two background pools: {@code syncExecutor} rebuilds data sources, {@code rerankExecutor}
 * scores query/passage pairs in parallel. A full queue rejects; the caller's thread never runs
 * the task. {@link RejectedExecutionException} surfaces as HTTP 503.
 */
@Configuration
public class WorkerPoolConfig {

    private static final Logger log = LoggerFactory.getLogger(WorkerPoolConfig.class);

    /** Idle workers above zero are released after this long. */
    static final long KEEP_ALIVE_SECONDS = 30L;

    @Bean(name = "syncExecutor", destroyMethod = "shutdown")
    public ThreadPoolExecutor syncExecutor(
            @Value("${zerag.workers.sync.core-threads:2}") int coreThreads,
            @Value("${zerag.workers.sync.max-threads:4}") int maxThreads,
            @Value("${zerag.workers.sync.queue-capacity:50}") int queueCapacity) {
        return new PoolSpec("sync", coreThreads, maxThreads, queueCapacity).create();
    }

    /**
     * Fixed-size; the queue holds ten batches per worker so one large rerank does not trip rejection.
     */
    @Bean(name = "rerankExecutor", destroyMethod = "shutdown")
    public ThreadPoolExecutor rerankExecutor(@Value("${zerag.workers.rerank.threads:4}") int threads) {
        return new PoolSpec("rerank", threads, threads, threads * 10).create();
    }

    /**
     * Pool sizing after clamping: at least one worker, max never below core, a non-empty queue.
     */
    record PoolSpec(String name, int coreThreads, int maxThreads, int queueCapacity) {

        PoolSpec {
            coreThreads = Math.max(1, coreThreads);
            maxThreads = Math.max(coreThreads, maxThreads);
            queueCapacity = Math.max(1, queueCapacity);
        }

        ThreadPoolExecutor create() {
            CustomizableThreadFactory threads = new CustomizableThreadFactory(this.name + "-worker-");
            threads.setDaemon(true);
            ThreadPoolExecutor executor = new ThreadPoolExecutor(this.coreThreads, this.maxThreads,
                    KEEP_ALIVE_SECONDS, TimeUnit.SECONDS, new LinkedBlockingQueue<>(this.queueCapacity), threads,
                    new BusyPoolRejection(this.name));
            executor.allowCoreThreadTimeOut(true);
            log.info("Worker pool '{}' ready (core={}, max={}, queue={})", this.name, this.coreThreads,
                    this.maxThreads, this.queueCapacity);
            return executor;
        }
    }

    /**
     * Counts and logs rejections, then throws.
     */
    public static final class BusyPoolRejection implements RejectedExecutionHandler {
        private final String pool;
        private final AtomicLong rejected = new AtomicLong();

        BusyPoolRejection(String pool) {
            this.pool = pool;
        }

        @Override
        public void rejectedExecution(Runnable task, ThreadPoolExecutor executor) {
            long total = this.rejected.incrementAndGet();
            log.warn("Worker pool '{}' is saturated: {} active, {} queued, {} rejected so far", this.pool,
                    executor.getActiveCount(), executor.getQueue().size(), total);
            throw new RejectedExecutionException("The " + this.pool + " workers are busy, try again later");
        }

        public long rejectedCount() {
            return this.rejected.get();
        }
    }
}
