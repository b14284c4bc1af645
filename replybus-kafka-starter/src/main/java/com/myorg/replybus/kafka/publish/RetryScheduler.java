package com.myorg.replybus.kafka.publish;

import java.time.Duration;

/**
 * Runs a retry later. Implementations must not run the task on the caller's stack, even for a
 * zero delay.
 */
@FunctionalInterface
public interface RetryScheduler {
    void schedule(Runnable task, Duration delay);
}
