package com.myorg.replybus.kafka.topic;

import com.myorg.replybus.kafka.session.ProducerSessionManager;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Creates topics through the shared producer session. One request for all names, no retry.
 */
@Slf4j
@RequiredArgsConstructor
public class TopicProvisioner {

    private final ProducerSessionManager sessions;

    public CompletableFuture<Void> createTopics(String... topicNames) {
        return createTopics(List.of(topicNames));
    }

    public CompletableFuture<Void> createTopics(List<String> topicNames) {
        List<String> names = List.copyOf(topicNames);
        return sessions.getProducer()
                .thenCompose(producer -> {
                    log.info("Creating topics={}", names);
                    return producer.createTopics(names);
                })
                .whenComplete((ok, err) -> {
                    if (err != null) {
                        log.warn("Topic creation failed topics={} error={}", names, err.toString());
                    }
                });
    }
}
