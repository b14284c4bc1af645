package com.myorg.replybus.kafka.publish;

/**
 * Where one logical publish stands in its retry sequence. {@code attemptNumber} is 0-based.
 */
public record PublishOptions(int attemptNumber, int maxAttempts, boolean withBackoff) {

    public static final int DEFAULT_MAX_ATTEMPTS = 10;

    public PublishOptions {
        if (attemptNumber < 0) {
            throw new IllegalArgumentException("attemptNumber must be >= 0, was " + attemptNumber);
        }
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1, was " + maxAttempts);
        }
    }

    public static PublishOptions defaults() {
        return new PublishOptions(0, DEFAULT_MAX_ATTEMPTS, true);
    }

    public static PublishOptions of(int maxAttempts, boolean withBackoff) {
        return new PublishOptions(0, maxAttempts, withBackoff);
    }

    public boolean hasAttemptsLeft() {
        return attemptNumber < maxAttempts - 1;
    }

    public PublishOptions next() {
        return new PublishOptions(attemptNumber + 1, maxAttempts, withBackoff);
    }
}
