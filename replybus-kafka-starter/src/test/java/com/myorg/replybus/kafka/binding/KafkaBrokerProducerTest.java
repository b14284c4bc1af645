package com.myorg.replybus.kafka.binding;

import org.apache.kafka.clients.admin.Admin;
import org.apache.kafka.clients.admin.CreateTopicsResult;
import org.apache.kafka.clients.admin.NewTopic;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.apache.kafka.clients.producer.RecordMetadata;
import org.apache.kafka.common.KafkaFuture;
import org.apache.kafka.common.TopicPartition;
import org.apache.kafka.common.errors.TopicExistsException;
import org.apache.kafka.common.internals.KafkaFutureImpl;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;

import java.time.Duration;
import java.util.Collection;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.tuple;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class KafkaBrokerProducerTest {

    @SuppressWarnings("unchecked")
    private final KafkaTemplate<String, String> template = mock(KafkaTemplate.class);
    private final Admin admin = mock(Admin.class);

    @Test
    void send_shouldMapRecordMetadataToAck() throws Exception {
        RecordMetadata md = new RecordMetadata(new TopicPartition("replies", 2), 41L, 0, 0L, 0, 5);
        SendResult<String, String> result = new SendResult<>(new ProducerRecord<>("replies", "hello"), md);
        when(template.send("replies", "hello")).thenReturn(CompletableFuture.completedFuture(result));

        KafkaBrokerProducer producer = new KafkaBrokerProducer(template, admin, null, 1);
        SendAck ack = producer.send("replies", "hello").get(5, TimeUnit.SECONDS);

        assertThat(ack).isEqualTo(new SendAck("replies", 2, 41L));
    }

    @Test
    @SuppressWarnings("unchecked")
    void createTopics_shouldRequestAllNamesWithConfiguredPartitions() throws Exception {
        CreateTopicsResult created = mock(CreateTopicsResult.class);
        when(created.all()).thenReturn(KafkaFuture.completedFuture(null));
        when(admin.createTopics(any(Collection.class))).thenReturn(created);

        new KafkaBrokerProducer(template, admin, null, 3)
                .createTopics(List.of("requests", "replies"))
                .get(5, TimeUnit.SECONDS);

        ArgumentCaptor<Collection<NewTopic>> captor = ArgumentCaptor.forClass(Collection.class);
        verify(admin).createTopics(captor.capture());
        assertThat(captor.getValue())
                .extracting(NewTopic::name, NewTopic::numPartitions)
                .containsExactly(
                        tuple("requests", 3),
                        tuple("replies", 3));
    }

    @Test
    @SuppressWarnings("unchecked")
    void createTopics_shouldSurfaceBrokerError() {
        KafkaFutureImpl<Void> failed = new KafkaFutureImpl<>();
        failed.completeExceptionally(new TopicExistsException("replies exists"));
        CreateTopicsResult created = mock(CreateTopicsResult.class);
        when(created.all()).thenReturn(failed);
        when(admin.createTopics(any(Collection.class))).thenReturn(created);

        CompletableFuture<Void> f = new KafkaBrokerProducer(template, admin, null, 1).createTopics(List.of("replies"));

        assertThatThrownBy(() -> f.get(5, TimeUnit.SECONDS))
                .isInstanceOf(ExecutionException.class)
                .hasCauseInstanceOf(TopicExistsException.class);
    }

    @Test
    void close_isIdempotent() {
        KafkaBrokerProducer producer = new KafkaBrokerProducer(template, admin, null, 1);

        producer.close();
        producer.close();

        verify(admin, times(1)).close(Duration.ofSeconds(5));
    }
}
