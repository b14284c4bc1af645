package com.myorg.replybus.kafka.binding;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * A live publishing session to the broker.
 */
public interface BrokerProducer extends AutoCloseable {

    CompletableFuture<SendAck> send(String topic, String payload);

    CompletableFuture<Void> createTopics(List<String> topicNames);

    @Override
    default void close() {
        // no-op by default
    }
}
