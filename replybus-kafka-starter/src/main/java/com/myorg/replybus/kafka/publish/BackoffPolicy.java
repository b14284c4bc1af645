package com.myorg.replybus.kafka.publish;

import java.time.Duration;

@FunctionalInterface
public interface BackoffPolicy {

    /** Delay to wait after attempt {@code attemptNumber} (0-based) failed. */
    Duration delayFor(int attemptNumber);
}
