package com.myorg.replybus.kafka.consume;

import com.myorg.replybus.kafka.ReplyBusKafkaProperties;
import lombok.extern.slf4j.Slf4j;
import org.apache.kafka.clients.consumer.ConsumerConfig;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.apache.kafka.common.serialization.StringDeserializer;
import org.springframework.kafka.core.ConsumerFactory;
import org.springframework.kafka.core.DefaultKafkaConsumerFactory;
import org.springframework.kafka.listener.ConcurrentMessageListenerContainer;
import org.springframework.kafka.listener.ContainerProperties;
import org.springframework.kafka.listener.MessageListener;
import org.springframework.util.StringUtils;

import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Opens push-style subscriptions. Each call gets its own consumer client and listener container.
 */
@Slf4j
public class MessageStreamFactory {

    static final String DEFAULT_GROUP_ID = "replybus-default-group";

    private final ReplyBusKafkaProperties props;

    public MessageStreamFactory(ReplyBusKafkaProperties props) {
        this.props = props;
    }

    public TopicSubscription subscribe(String topic, TopicMessageListener listener) {
        return subscribe(topic, Map.of(), listener);
    }

    /**
     * @param overrides raw Kafka consumer settings applied on top of {@code replybus.kafka.consumer.*}
     */
    public TopicSubscription subscribe(String topic, Map<String, Object> overrides, TopicMessageListener listener) {
        String clientId = props.getConsumer().getClientIdPrefix() + ThreadLocalRandom.current().nextInt(10_000);

        ConcurrentMessageListenerContainer<String, String> container = createContainer(topic, clientId, overrides, listener);
        container.start();

        log.info("Subscribed topic={} clientId={} groupId={}",
                topic, clientId, container.getContainerProperties().getGroupId());
        return new TopicSubscription(topic, clientId, container);
    }

    ConcurrentMessageListenerContainer<String, String> createContainer(
            String topic, String clientId, Map<String, Object> overrides, TopicMessageListener listener) {
        Map<String, Object> cfg = effectiveConfig(clientId, overrides);
        ConsumerFactory<String, String> cf = new DefaultKafkaConsumerFactory<>(cfg);

        ContainerProperties cp = new ContainerProperties(topic);
        cp.setClientId(clientId);
        cp.setGroupId(String.valueOf(cfg.get(ConsumerConfig.GROUP_ID_CONFIG)));
        cp.setAckMode(ContainerProperties.AckMode.RECORD);
        cp.setMessageListener((MessageListener<String, String>) (ConsumerRecord<String, String> rec) ->
                listener.onMessage(rec.value()));

        ConcurrentMessageListenerContainer<String, String> container = new ConcurrentMessageListenerContainer<>(cf, cp);
        container.setConcurrency(Math.max(1, props.getConsumer().getConcurrency()));
        container.setCommonErrorHandler(new ForwardingErrorHandler(topic, listener));
        container.setBeanName("replybus-" + topic + "-" + clientId);
        return container;
    }

    Map<String, Object> effectiveConfig(String clientId, Map<String, Object> overrides) {
        Map<String, Object> cfg = consumerConfig(clientId);
        if (overrides != null) {
            cfg.putAll(overrides);
        }
        return cfg;
    }

    Map<String, Object> consumerConfig(String clientId) {
        ReplyBusKafkaProperties.Consumer c = props.getConsumer();
        Map<String, Object> cfg = new HashMap<>();
        cfg.put(ConsumerConfig.BOOTSTRAP_SERVERS_CONFIG, props.getBootstrapServers());
        cfg.put(ConsumerConfig.CLIENT_ID_CONFIG, clientId);
        cfg.put(ConsumerConfig.KEY_DESERIALIZER_CLASS_CONFIG, StringDeserializer.class);
        cfg.put(ConsumerConfig.VALUE_DESERIALIZER_CLASS_CONFIG, StringDeserializer.class);
        cfg.put(ConsumerConfig.ENABLE_AUTO_COMMIT_CONFIG, false);
        cfg.put(ConsumerConfig.AUTO_OFFSET_RESET_CONFIG, c.getAutoOffsetReset());
        cfg.put(ConsumerConfig.GROUP_ID_CONFIG,
                StringUtils.hasText(c.getGroupId()) ? c.getGroupId() : DEFAULT_GROUP_ID);
        return cfg;
    }
}
