package com.myorg.replybus.kafka;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

@Data
@ConfigurationProperties(prefix = "replybus.kafka")
public class ReplyBusKafkaProperties {
    private String bootstrapServers = "localhost:9092";
    private final Producer producer = new Producer();
    private final Consumer consumer = new Consumer();
    private final Publisher publisher = new Publisher();
    private final Topics topics = new Topics();

    @Data
    public static class Producer {
        // client.id = prefix + random number in [0, 10000)
        private String clientIdPrefix = "producer-";
        private String acks = "all";
        private boolean idempotence = true;
        private String compression = "none";
        private int lingerMs = 5;
        /**
         * How long to wait for the cluster to answer before the connection counts as failed.
         */
        private Duration readyTimeout = Duration.ofSeconds(30);
    }

    @Data
    public static class Consumer {
        private String groupId;
        private String clientIdPrefix = "worker-";
        private String autoOffsetReset = "earliest";
        private int concurrency = 1;
    }

    @Data
    public static class Publisher {
        private int maxAttempts = 10;
        private boolean withBackoff = true;
        // delay before attempt n+1 = backoffBase * 2^n + random[0, jitter)
        private Duration backoffBase = Duration.ofSeconds(1);
        private Duration jitter = Duration.ofSeconds(1);
        /**
         * Optional ceiling on a single retry delay. Unset means the delay keeps doubling.
         */
        private Duration maxDelay;
    }

    @Data
    public static class Topics {
        private int partitions = 1;
        // created once at startup through the shared producer session
        private List<String> provision = new ArrayList<>();
    }
}
