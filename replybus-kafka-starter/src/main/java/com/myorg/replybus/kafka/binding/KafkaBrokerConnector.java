package com.myorg.replybus.kafka.binding;

import com.myorg.replybus.kafka.ReplyBusKafkaProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.kafka.clients.admin.Admin;
import org.apache.kafka.clients.admin.AdminClientConfig;
import org.apache.kafka.clients.producer.ProducerConfig;
import org.apache.kafka.common.serialization.StringSerializer;
import org.springframework.kafka.core.DefaultKafkaProducerFactory;
import org.springframework.kafka.core.KafkaTemplate;

import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.TimeUnit;

@Slf4j
@RequiredArgsConstructor
public class KafkaBrokerConnector implements BrokerConnector {

    private final ReplyBusKafkaProperties props;

    @Override
    public CompletableFuture<BrokerProducer> connect(String clientId) {
        DefaultKafkaProducerFactory<String, String> factory;
        Admin admin;
        try {
            factory = new DefaultKafkaProducerFactory<>(producerConfig(clientId));
            admin = Admin.create(adminConfig(clientId));
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }

        KafkaBrokerProducer producer = new KafkaBrokerProducer(
                new KafkaTemplate<>(factory), admin, factory, props.getTopics().getPartitions());
        long timeoutMs = props.getProducer().getReadyTimeout().toMillis();

        log.info("Connecting producer clientId={} bootstrapServers={}", clientId, props.getBootstrapServers());

        // "ready" = the cluster answered a metadata request
        return KafkaFutures.toCompletable(admin.describeCluster().clusterId())
                .orTimeout(timeoutMs, TimeUnit.MILLISECONDS)
                .handle((clusterId, err) -> {
                    if (err != null) {
                        // may be on the admin's network thread, close elsewhere
                        CompletableFuture.runAsync(producer::close);
                        throw new CompletionException(err);
                    }
                    log.info("Producer ready clientId={} clusterId={}", clientId, clusterId);
                    return (BrokerProducer) producer;
                });
    }

    Map<String, Object> producerConfig(String clientId) {
        ReplyBusKafkaProperties.Producer p = props.getProducer();
        Map<String, Object> cfg = new HashMap<>();
        cfg.put(ProducerConfig.BOOTSTRAP_SERVERS_CONFIG, props.getBootstrapServers());
        cfg.put(ProducerConfig.CLIENT_ID_CONFIG, clientId);
        cfg.put(ProducerConfig.KEY_SERIALIZER_CLASS_CONFIG, StringSerializer.class);
        cfg.put(ProducerConfig.VALUE_SERIALIZER_CLASS_CONFIG, StringSerializer.class);
        cfg.put(ProducerConfig.ACKS_CONFIG, p.getAcks());
        cfg.put(ProducerConfig.ENABLE_IDEMPOTENCE_CONFIG, p.isIdempotence());
        cfg.put(ProducerConfig.COMPRESSION_TYPE_CONFIG, p.getCompression());
        cfg.put(ProducerConfig.LINGER_MS_CONFIG, p.getLingerMs());
        return cfg;
    }

    Map<String, Object> adminConfig(String clientId) {
        Map<String, Object> cfg = new HashMap<>();
        cfg.put(AdminClientConfig.BOOTSTRAP_SERVERS_CONFIG, props.getBootstrapServers());
        cfg.put(AdminClientConfig.CLIENT_ID_CONFIG, clientId + "-admin");
        return cfg;
    }
}
