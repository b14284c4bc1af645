package com.myorg.replybus.kafka.publish;

import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.LongUnaryOperator;

/**
 * {@code base * 2^attempt + random[0, jitter)}, optionally capped at {@code maxDelay}.
 * With the defaults (1s base, 1s jitter, no cap) the delays run 1s, 2s, 4s, 8s... plus up to a
 * second of jitter, with no upper bound.
 */
public class ExponentialJitterBackoff implements BackoffPolicy {

    private final long baseMs;
    private final long jitterMs;
    private final Duration maxDelay; // may be null
    private final LongUnaryOperator jitterSource; // bound -> value in [0, bound)

    public ExponentialJitterBackoff(Duration base, Duration jitter, Duration maxDelay) {
        this(base, jitter, maxDelay, bound -> ThreadLocalRandom.current().nextLong(bound));
    }

    public ExponentialJitterBackoff(Duration base, Duration jitter, Duration maxDelay, LongUnaryOperator jitterSource) {
        this.baseMs = Math.max(0, base.toMillis());
        this.jitterMs = Math.max(0, jitter.toMillis());
        this.maxDelay = maxDelay;
        this.jitterSource = jitterSource;
    }

    public static ExponentialJitterBackoff defaults() {
        return new ExponentialJitterBackoff(Duration.ofSeconds(1), Duration.ofSeconds(1), null);
    }

    @Override
    public Duration delayFor(int attemptNumber) {
        int pow = Math.max(0, Math.min(30, attemptNumber));
        long ms = baseMs * (1L << pow);
        if (jitterMs > 0) {
            ms += jitterSource.applyAsLong(jitterMs);
        }

        Duration delay = Duration.ofMillis(ms);
        if (maxDelay != null && delay.compareTo(maxDelay) > 0) {
            return maxDelay;
        }
        return delay;
    }
}
