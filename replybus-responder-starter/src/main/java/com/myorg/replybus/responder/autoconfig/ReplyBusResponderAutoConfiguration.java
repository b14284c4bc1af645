package com.myorg.replybus.responder.autoconfig;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.myorg.replybus.kafka.autoconfig.ReplyBusKafkaAutoConfiguration;
import com.myorg.replybus.kafka.autoconfig.ReplyBusKafkaConsumerAutoConfiguration;
import com.myorg.replybus.kafka.consume.MessageStreamFactory;
import com.myorg.replybus.kafka.publish.RetryingPublisher;
import com.myorg.replybus.responder.ReplyBusResponderProperties;
import com.myorg.replybus.responder.RequestConverter;
import com.myorg.replybus.responder.RequestHandler;
import com.myorg.replybus.responder.RequestListener;
import com.myorg.replybus.responder.RequestSubscriptions;
import com.myorg.replybus.responder.ResponseDispatcher;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnExpression;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.autoconfigure.jackson.JacksonAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

@AutoConfiguration(after = {
        JacksonAutoConfiguration.class,
        ReplyBusKafkaAutoConfiguration.class,
        ReplyBusKafkaConsumerAutoConfiguration.class
})
@ConditionalOnBean(RetryingPublisher.class)
@EnableConfigurationProperties(ReplyBusResponderProperties.class)
public class ReplyBusResponderAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public ObjectMapper replyBusObjectMapper() {
        return new ObjectMapper();
    }

    @Bean
    @ConditionalOnMissingBean
    public ResponseDispatcher responseDispatcher(RetryingPublisher publisher, ObjectMapper mapper) {
        return new ResponseDispatcher(publisher, mapper);
    }

    @Bean
    @ConditionalOnMissingBean
    public RequestConverter requestConverter(ObjectMapper mapper) {
        return new RequestConverter(mapper);
    }

    /**
     * YAML lists are not reliably "present" for {@code @ConditionalOnProperty}, hence the expression.
     */
    @Bean(initMethod = "start", destroyMethod = "close")
    @ConditionalOnBean({RequestHandler.class, MessageStreamFactory.class})
    @ConditionalOnProperty(prefix = "replybus.responder.listener", name = "enabled", havingValue = "true", matchIfMissing = true)
    @ConditionalOnExpression(
            "('${replybus.responder.request-topics:}'.length() > 0) || " +
                    "('${replybus.responder.request-topics[0]:}'.length() > 0)"
    )
    public RequestSubscriptions requestSubscriptions(MessageStreamFactory streams,
                                                     ReplyBusResponderProperties props,
                                                     RequestConverter converter,
                                                     RequestHandler handler,
                                                     ResponseDispatcher dispatcher) {
        return new RequestSubscriptions(streams, props.getRequestTopics(),
                topic -> new RequestListener(topic, converter, handler, dispatcher));
    }
}
