package com.myorg.replybus.kafka.autoconfig;

import com.myorg.replybus.kafka.ReplyBusKafkaProperties;
import com.myorg.replybus.kafka.binding.BrokerConnector;
import com.myorg.replybus.kafka.binding.KafkaBrokerConnector;
import com.myorg.replybus.kafka.publish.BackoffPolicy;
import com.myorg.replybus.kafka.publish.ExecutorRetryScheduler;
import com.myorg.replybus.kafka.publish.ExponentialJitterBackoff;
import com.myorg.replybus.kafka.publish.PublishOptions;
import com.myorg.replybus.kafka.publish.PublisherMetrics;
import com.myorg.replybus.kafka.publish.RetryScheduler;
import com.myorg.replybus.kafka.publish.RetryingPublisher;
import com.myorg.replybus.kafka.session.ProducerSessionManager;
import com.myorg.replybus.kafka.topic.TopicProvisioner;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.apache.kafka.common.errors.TopicExistsException;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.core.NestedExceptionUtils;
import org.springframework.kafka.core.KafkaTemplate;

import java.util.List;
import java.util.concurrent.CompletionException;

/**
 * Producer side: one shared session per application context, the retrying publisher on top of
 * it, and topic provisioning.
 */
@Slf4j
@AutoConfiguration
@ConditionalOnClass(KafkaTemplate.class)
@EnableConfigurationProperties(ReplyBusKafkaProperties.class)
public class ReplyBusKafkaAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public BrokerConnector brokerConnector(ReplyBusKafkaProperties props) {
        return new KafkaBrokerConnector(props);
    }

    @Bean(destroyMethod = "close")
    @ConditionalOnMissingBean
    public ProducerSessionManager producerSessionManager(BrokerConnector connector, ReplyBusKafkaProperties props) {
        return new ProducerSessionManager(connector, props.getProducer().getClientIdPrefix());
    }

    @Bean
    @ConditionalOnMissingBean
    public BackoffPolicy replyBusBackoffPolicy(ReplyBusKafkaProperties props) {
        var p = props.getPublisher();
        return new ExponentialJitterBackoff(p.getBackoffBase(), p.getJitter(), p.getMaxDelay());
    }

    @Bean(destroyMethod = "close")
    @ConditionalOnMissingBean(RetryScheduler.class)
    public ExecutorRetryScheduler replyBusRetryScheduler() {
        return new ExecutorRetryScheduler();
    }

    @Bean
    @ConditionalOnMissingBean
    public RetryingPublisher retryingPublisher(ProducerSessionManager sessions,
                                               BackoffPolicy backoff,
                                               RetryScheduler scheduler,
                                               ReplyBusKafkaProperties props,
                                               ObjectProvider<MeterRegistry> registryProvider) {
        var p = props.getPublisher();
        PublishOptions defaults = PublishOptions.of(p.getMaxAttempts(), p.isWithBackoff());

        PublisherMetrics metrics = null;
        MeterRegistry registry = registryProvider.getIfAvailable();
        if (registry != null) {
            metrics = new PublisherMetrics(registry);
            metrics.preRegister();
        }
        return new RetryingPublisher(sessions, backoff, scheduler, defaults, metrics);
    }

    @Bean
    @ConditionalOnMissingBean
    public TopicProvisioner topicProvisioner(ProducerSessionManager sessions) {
        return new TopicProvisioner(sessions);
    }

    @Bean
    public ApplicationRunner replyBusTopicProvisioning(ReplyBusKafkaProperties props, TopicProvisioner provisioner) {
        return args -> {
            List<String> topics = props.getTopics().getProvision();
            if (topics == null || topics.isEmpty()) return;
            try {
                provisioner.createTopics(topics).join();
            } catch (CompletionException e) {
                Throwable root = NestedExceptionUtils.getMostSpecificCause(e);
                if (root instanceof TopicExistsException) {
                    log.info("Topics already present topics={}", topics);
                    return;
                }
                throw e;
            }
        };
    }
}
