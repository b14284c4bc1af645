package com.myorg.replybus.kafka.publish;

import org.junit.jupiter.api.RepeatedTest;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

class ExponentialJitterBackoffTest {

    @RepeatedTest(20)
    void defaults_delayStaysWithinExponentialWindow() {
        ExponentialJitterBackoff backoff = ExponentialJitterBackoff.defaults();
        for (int k = 0; k < 8; k++) {
            long ms = backoff.delayFor(k).toMillis();
            long floor = (1L << k) * 1000;
            assertThat(ms).isBetween(floor, floor + 999);
        }
    }

    @Test
    void jitterSource_isAddedOnTop() {
        ExponentialJitterBackoff backoff = new ExponentialJitterBackoff(
                Duration.ofMillis(100), Duration.ofMillis(50), null, bound -> bound - 1);

        assertThat(backoff.delayFor(0)).isEqualTo(Duration.ofMillis(149));
        assertThat(backoff.delayFor(3)).isEqualTo(Duration.ofMillis(849));
    }

    @Test
    void maxDelay_capsTheResult() {
        ExponentialJitterBackoff backoff = new ExponentialJitterBackoff(
                Duration.ofSeconds(1), Duration.ZERO, Duration.ofSeconds(5));

        assertThat(backoff.delayFor(1)).isEqualTo(Duration.ofSeconds(2));
        assertThat(backoff.delayFor(5)).isEqualTo(Duration.ofSeconds(5));
    }

    @Test
    void largeAttemptNumbers_doNotOverflow() {
        ExponentialJitterBackoff backoff = new ExponentialJitterBackoff(
                Duration.ofSeconds(1), Duration.ZERO, null);

        assertThat(backoff.delayFor(1_000)).isEqualTo(backoff.delayFor(30)).isPositive();
    }
}
