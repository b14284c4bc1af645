package com.myorg.replybus.kafka.binding;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.kafka.clients.admin.Admin;
import org.apache.kafka.clients.admin.NewTopic;
import org.apache.kafka.clients.producer.RecordMetadata;
import org.springframework.kafka.core.DefaultKafkaProducerFactory;
import org.springframework.kafka.core.KafkaTemplate;

import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicBoolean;

@Slf4j
@RequiredArgsConstructor
public class KafkaBrokerProducer implements BrokerProducer {

    private final KafkaTemplate<String, String> template;
    private final Admin admin;
    private final DefaultKafkaProducerFactory<String, String> factory; // may be null when the template is supplied
    private final int partitions;

    private final AtomicBoolean closed = new AtomicBoolean();

    @Override
    public CompletableFuture<SendAck> send(String topic, String payload) {
        return template.send(topic, payload).thenApply(result -> {
            RecordMetadata md = result.getRecordMetadata();
            return new SendAck(md.topic(), md.partition(), md.offset());
        });
    }

    @Override
    public CompletableFuture<Void> createTopics(List<String> topicNames) {
        List<NewTopic> topics = topicNames.stream()
                .map(name -> new NewTopic(name, Optional.of(partitions), Optional.empty()))
                .toList();

        return KafkaFutures.toCompletable(admin.createTopics(topics).all());
    }

    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) return;
        try {
            admin.close(Duration.ofSeconds(5));
        } catch (Exception e) {
            log.warn("Failed to close admin client: {}", e.toString());
        }
        if (factory != null) {
            factory.destroy();
        }
    }
}
