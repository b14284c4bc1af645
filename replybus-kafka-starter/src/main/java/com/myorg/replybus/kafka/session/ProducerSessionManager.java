package com.myorg.replybus.kafka.session;

import com.myorg.replybus.kafka.binding.BrokerConnector;
import com.myorg.replybus.kafka.binding.BrokerProducer;
import com.myorg.replybus.kafka.exception.BrokerConnectionException;
import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Owns the one publishing session of an adapter instance.
 *
 * <p>The first {@link #getProducer()} call opens the connection; every call, before or after it
 * resolves, gets back the same future. The outcome is kept forever: a failed connect is not
 * retried, so later callers see the same {@link BrokerConnectionException}.
 */
@Slf4j
public class ProducerSessionManager implements AutoCloseable {

    private final BrokerConnector connector;
    private final String clientIdPrefix;

    private final AtomicReference<CompletableFuture<BrokerProducer>> producer = new AtomicReference<>();
    private final AtomicBoolean closed = new AtomicBoolean();

    public ProducerSessionManager(BrokerConnector connector, String clientIdPrefix) {
        this.connector = connector;
        this.clientIdPrefix = clientIdPrefix == null ? "" : clientIdPrefix;
    }

    public CompletableFuture<BrokerProducer> getProducer() {
        CompletableFuture<BrokerProducer> existing = producer.get();
        if (existing != null) return existing;

        CompletableFuture<BrokerProducer> candidate = new CompletableFuture<>();
        if (!producer.compareAndSet(null, candidate)) {
            // lost the race, someone else is connecting
            return producer.get();
        }

        String clientId = newClientId();
        CompletableFuture<BrokerProducer> attempt;
        try {
            attempt = connector.connect(clientId);
        } catch (RuntimeException e) {
            attempt = CompletableFuture.failedFuture(e);
        }

        attempt.whenComplete((p, err) -> {
            if (err != null) {
                Throwable cause = unwrap(err);
                log.error("Producer connection failed clientId={} error={}", clientId, cause.toString());
                candidate.completeExceptionally(
                        new BrokerConnectionException("Failed to connect producer clientId=" + clientId, cause));
            } else {
                candidate.complete(p);
            }
        });
        return candidate;
    }

    /** Whether a connection attempt has been started on this instance. */
    public boolean isInitialized() {
        return producer.get() != null;
    }

    /**
     * Closes the producer. A connect still in flight is closed as soon as it lands.
     */
    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) return;
        CompletableFuture<BrokerProducer> f = producer.get();
        if (f == null) return;
        if (!f.isDone()) {
            log.info("Producer still connecting, it will be closed once connected");
        }
        f.thenAccept(this::closeProducer);
    }

    private void closeProducer(BrokerProducer p) {
        try {
            p.close();
        } catch (RuntimeException e) {
            log.warn("Failed to close producer error={}", e.toString());
        }
    }

    private String newClientId() {
        // collisions are tolerated, the id only labels the client in broker logs
        return clientIdPrefix + ThreadLocalRandom.current().nextInt(10_000);
    }

    static Throwable unwrap(Throwable t) {
        while (t instanceof CompletionException && t.getCause() != null) {
            t = t.getCause();
        }
        return t;
    }
}
