package com.myorg.replybus.kafka.consume;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.kafka.clients.consumer.Consumer;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.springframework.core.NestedExceptionUtils;
import org.springframework.kafka.listener.CommonErrorHandler;
import org.springframework.kafka.listener.MessageListenerContainer;

/**
 * Hands every container-side failure to the subscriber instead of retrying. The failed record
 * counts as consumed.
 */
@Slf4j
@RequiredArgsConstructor
class ForwardingErrorHandler implements CommonErrorHandler {

    private final String topic;
    private final TopicMessageListener listener;

    @Override
    public boolean handleOne(Exception thrownException, ConsumerRecord<?, ?> record,
                             Consumer<?, ?> consumer, MessageListenerContainer container) {
        log.warn("Listener failed topic={} partition={} offset={} error={}",
                record.topic(), record.partition(), record.offset(), thrownException.toString());
        forward(thrownException);
        return true;
    }

    @Override
    public void handleOtherException(Exception thrownException, Consumer<?, ?> consumer,
                                     MessageListenerContainer container, boolean batchListener) {
        log.warn("Consumer error topic={} error={}", topic, thrownException.toString());
        forward(thrownException);
    }

    private void forward(Exception thrownException) {
        Throwable root = NestedExceptionUtils.getMostSpecificCause(thrownException);
        try {
            listener.onError(root);
        } catch (RuntimeException e) {
            log.error("onError callback threw topic={}", topic, e);
        }
    }
}
