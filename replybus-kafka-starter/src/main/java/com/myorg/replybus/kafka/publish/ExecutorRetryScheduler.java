package com.myorg.replybus.kafka.publish;

import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * One daemon timer thread ({@code replybus-publish-retry-timer}) waits out the delays; the retries
 * themselves run on daemon workers named {@code replybus-publish-retry-N}. A send that blocks on
 * broker metadata therefore holds up only its own retry.
 */
@Slf4j
public class ExecutorRetryScheduler implements RetryScheduler, AutoCloseable {

    public static final String THREAD_PREFIX = "replybus-publish-retry";

    private final ScheduledExecutorService timer;
    private final ExecutorService workers;

    public ExecutorRetryScheduler() {
        this.timer = Executors.newSingleThreadScheduledExecutor(r -> daemon(r, THREAD_PREFIX + "-timer"));
        AtomicInteger seq = new AtomicInteger();
        this.workers = Executors.newCachedThreadPool(r -> daemon(r, THREAD_PREFIX + "-" + seq.incrementAndGet()));
    }

    @Override
    public void schedule(Runnable task, Duration delay) {
        long ms = delay == null ? 0 : Math.max(0, delay.toMillis());
        if (ms == 0) {
            workers.execute(task);
            return;
        }
        timer.schedule(() -> handOff(task), ms, TimeUnit.MILLISECONDS);
    }

    private void handOff(Runnable task) {
        try {
            workers.execute(task);
        } catch (RejectedExecutionException e) {
            log.warn("Dropped publish retry, scheduler is shut down");
        }
    }

    @Override
    public void close() {
        int pending = timer.shutdownNow().size();
        workers.shutdownNow();
        if (pending > 0) {
            log.warn("Dropped {} pending publish retries on shutdown", pending);
        }
    }

    private static Thread daemon(Runnable r, String name) {
        Thread t = new Thread(r, name);
        t.setDaemon(true);
        return t;
    }
}
