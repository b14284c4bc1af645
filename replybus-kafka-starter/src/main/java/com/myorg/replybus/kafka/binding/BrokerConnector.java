package com.myorg.replybus.kafka.binding;

import java.util.concurrent.CompletableFuture;

/**
 * Opens publishing sessions. The returned future completes once the producer is ready to send,
 * or exceptionally if the broker could not be reached.
 */
@FunctionalInterface
public interface BrokerConnector {
    CompletableFuture<BrokerProducer> connect(String clientId);
}
