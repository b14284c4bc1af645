package com.myorg.replybus.kafka.publish;

import com.myorg.replybus.kafka.binding.BrokerProducer;
import com.myorg.replybus.kafka.binding.SendAck;
import com.myorg.replybus.kafka.session.ProducerSessionManager;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;

import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.RejectedExecutionException;

/**
 * At-least-once publish of an already serialized message.
 *
 * <p>Each attempt takes the shared producer from {@link ProducerSessionManager} and sends once.
 * A failed send is retried until {@link PublishOptions#maxAttempts()} is reached, after which the
 * returned future fails with the last send error as-is. A failure to obtain the producer is not
 * retried here.
 */
@Slf4j
public class RetryingPublisher {

    private final ProducerSessionManager sessions;
    private final BackoffPolicy backoff;
    private final RetryScheduler scheduler;
    private final PublishOptions defaults;
    private final PublisherMetrics metrics; // may be null

    public RetryingPublisher(ProducerSessionManager sessions,
                             BackoffPolicy backoff,
                             RetryScheduler scheduler,
                             PublishOptions defaults,
                             PublisherMetrics metrics) {
        this.sessions = sessions;
        this.backoff = backoff;
        this.scheduler = scheduler;
        this.defaults = defaults == null ? PublishOptions.defaults() : defaults;
        this.metrics = metrics;
    }

    public PublishOptions getDefaults() {
        return defaults;
    }

    public CompletableFuture<SendAck> publish(String payload, String topic) {
        return publish(payload, topic, defaults);
    }

    public CompletableFuture<SendAck> publish(String payload, String topic, PublishOptions options) {
        Objects.requireNonNull(topic, "topic");
        Objects.requireNonNull(options, "options");
        return new PublishAttempt(payload, topic, options).start();
    }

    /** One logical publish; re-armed through the scheduler instead of recursing. */
    private final class PublishAttempt {
        private final String payload;
        private final String topic;
        private final CompletableFuture<SendAck> result = new CompletableFuture<>();
        // caller's MDC, restored around every callback so retry logs keep it
        private final Map<String, String> mdc = MDC.getCopyOfContextMap();
        private volatile PublishOptions state;

        PublishAttempt(String payload, String topic, PublishOptions options) {
            this.payload = payload;
            this.topic = topic;
            this.state = options;
        }

        CompletableFuture<SendAck> start() {
            run();
            return result;
        }

        private void run() {
            sessions.getProducer().whenComplete((producer, connectErr) -> withMdc(() -> {
                if (connectErr != null) {
                    result.completeExceptionally(unwrap(connectErr));
                    return;
                }
                sendOnce(producer).whenComplete((ack, sendErr) -> withMdc(() -> {
                    if (sendErr == null) {
                        if (metrics != null) metrics.incSuccess(topic);
                        result.complete(ack);
                        return;
                    }
                    onSendFailure(unwrap(sendErr));
                }));
            }));
        }

        private void withMdc(Runnable body) {
            Map<String, String> previous = MDC.getCopyOfContextMap();
            setMdc(mdc);
            try {
                body.run();
            } finally {
                setMdc(previous);
            }
        }

        private CompletableFuture<SendAck> sendOnce(BrokerProducer producer) {
            try {
                return producer.send(topic, payload);
            } catch (RuntimeException e) {
                return CompletableFuture.failedFuture(e);
            }
        }

        private void onSendFailure(Throwable err) {
            PublishOptions current = state;
            if (!current.hasAttemptsLeft()) {
                log.warn("Publish FAILED topic={} after attempts={} error={}",
                        topic, current.attemptNumber() + 1, err.toString());
                if (metrics != null) metrics.incExhausted(topic);
                result.completeExceptionally(err);
                return;
            }

            Duration delay = current.withBackoff() ? backoff.delayFor(current.attemptNumber()) : Duration.ZERO;
            log.warn("Publish RETRY topic={} attempt={}/{} delayMs={} error={}",
                    topic, current.attemptNumber() + 2, current.maxAttempts(), delay.toMillis(), err.toString());
            if (metrics != null) metrics.incRetry(topic);

            state = current.next();
            try {
                scheduler.schedule(this::run, delay);
            } catch (RejectedExecutionException e) {
                err.addSuppressed(e);
                result.completeExceptionally(err);
            }
        }
    }

    private static void setMdc(Map<String, String> context) {
        if (context == null) {
            MDC.clear();
        } else {
            MDC.setContextMap(context);
        }
    }

    private static Throwable unwrap(Throwable t) {
        while (t instanceof CompletionException && t.getCause() != null) {
            t = t.getCause();
        }
        return t;
    }
}
