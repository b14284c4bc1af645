package com.myorg.replybus.kafka.autoconfig;

import com.myorg.replybus.kafka.binding.BrokerConnector;
import com.myorg.replybus.kafka.consume.MessageStreamFactory;
import com.myorg.replybus.kafka.publish.ExecutorRetryScheduler;
import com.myorg.replybus.kafka.publish.PublishOptions;
import com.myorg.replybus.kafka.publish.RetryingPublisher;
import com.myorg.replybus.kafka.session.ProducerSessionManager;
import com.myorg.replybus.kafka.support.FakeBrokerProducer;
import com.myorg.replybus.kafka.topic.TopicProvisioner;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.apache.kafka.common.errors.TopicExistsException;
import org.junit.jupiter.api.Test;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Wiring only. The fake connector keeps the context free of a real broker.
 */
class ReplyBusKafkaAutoConfigurationTest {

    private final ApplicationContextRunner runner = new ApplicationContextRunner()
            .withConfiguration(AutoConfigurations.of(
                    ReplyBusKafkaAutoConfiguration.class,
                    ReplyBusKafkaConsumerAutoConfiguration.class
            ))
            .withUserConfiguration(FakeBrokerConfig.class);

    @Test
    void shouldWirePublisherWithConfiguredDefaults_withoutConnecting() {
        runner.withPropertyValues(
                        "replybus.kafka.publisher.max-attempts=4",
                        "replybus.kafka.publisher.with-backoff=false")
                .run(ctx -> {
                    assertThat(ctx).hasSingleBean(RetryingPublisher.class);
                    assertThat(ctx).hasSingleBean(TopicProvisioner.class);
                    assertThat(ctx).hasSingleBean(MessageStreamFactory.class);
                    assertThat(ctx).hasSingleBean(ExecutorRetryScheduler.class);

                    assertThat(ctx.getBean(RetryingPublisher.class).getDefaults())
                            .isEqualTo(PublishOptions.of(4, false));

                    // lazy: nothing connects until the first publish
                    assertThat(ctx.getBean(ProducerSessionManager.class).isInitialized()).isFalse();
                    assertThat(ctx.getBean(FakeBrokerConfig.class).connects.get()).isZero();
                });
    }

    @Test
    void publish_shouldConnectOnceThroughSharedSession() {
        runner.run(ctx -> {
            RetryingPublisher publisher = ctx.getBean(RetryingPublisher.class);
            publisher.publish("a", "replies").join();
            publisher.publish("b", "replies").join();

            FakeBrokerConfig cfg = ctx.getBean(FakeBrokerConfig.class);
            assertThat(cfg.connects.get()).isEqualTo(1);
            assertThat(cfg.producer.sentPayloads()).containsExactly("a", "b");
        });
    }

    @Test
    void provisioningRunner_shouldCreateConfiguredTopics() {
        runner.withPropertyValues("replybus.kafka.topics.provision=requests,replies")
                .run(ctx -> {
                    ctx.getBean("replyBusTopicProvisioning", ApplicationRunner.class).run(null);

                    assertThat(ctx.getBean(FakeBrokerConfig.class).producer.createdTopics())
                            .containsExactly(List.of("requests", "replies"));
                });
    }

    @Test
    void provisioningRunner_shouldTolerateExistingTopics() {
        runner.withPropertyValues("replybus.kafka.topics.provision=replies")
                .run(ctx -> {
                    ctx.getBean(FakeBrokerConfig.class).producer
                            .failCreateTopicsWith(new TopicExistsException("replies"));

                    ctx.getBean("replyBusTopicProvisioning", ApplicationRunner.class).run(null);
                });
    }

    @Test
    void meterRegistryPresent_shouldPreRegisterPublishCounters() {
        runner.withBean(MeterRegistry.class, SimpleMeterRegistry::new)
                .run(ctx -> {
                    MeterRegistry registry = ctx.getBean(MeterRegistry.class);
                    assertThat(registry.find("replybus.publish.success").counter()).isNotNull();
                    assertThat(registry.find("replybus.publish.exhausted").counter()).isNotNull();
                });
    }

    @Configuration(proxyBeanMethods = false)
    static class FakeBrokerConfig {

        final AtomicInteger connects = new AtomicInteger();
        final FakeBrokerProducer producer = FakeBrokerProducer.healthy();

        @Bean
        BrokerConnector brokerConnector() {
            return clientId -> {
                connects.incrementAndGet();
                return CompletableFuture.completedFuture(producer);
            };
        }
    }
}
