package com.myorg.replybus.kafka.consume;

import lombok.extern.slf4j.Slf4j;
import org.springframework.kafka.listener.MessageListenerContainer;

@Slf4j
public class TopicSubscription implements AutoCloseable {

    private final String topic;
    private final String clientId;
    private final MessageListenerContainer container;

    TopicSubscription(String topic, String clientId, MessageListenerContainer container) {
        this.topic = topic;
        this.clientId = clientId;
        this.container = container;
    }

    public String topic() {
        return topic;
    }

    public String clientId() {
        return clientId;
    }

    public boolean isRunning() {
        return container.isRunning();
    }

    @Override
    public void close() {
        if (!container.isRunning()) return;
        log.info("Stopping subscription topic={} clientId={}", topic, clientId);
        container.stop();
    }
}
