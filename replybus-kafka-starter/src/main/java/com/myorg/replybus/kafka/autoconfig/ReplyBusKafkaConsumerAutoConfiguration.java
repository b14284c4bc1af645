package com.myorg.replybus.kafka.autoconfig;

import com.myorg.replybus.kafka.ReplyBusKafkaProperties;
import com.myorg.replybus.kafka.consume.MessageStreamFactory;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.kafka.listener.ConcurrentMessageListenerContainer;

@AutoConfiguration
@ConditionalOnClass(ConcurrentMessageListenerContainer.class)
@EnableConfigurationProperties(ReplyBusKafkaProperties.class)
public class ReplyBusKafkaConsumerAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public MessageStreamFactory messageStreamFactory(ReplyBusKafkaProperties props) {
        return new MessageStreamFactory(props);
    }
}
