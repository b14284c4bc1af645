package com.myorg.replybus.responder;

import com.myorg.replybus.kafka.consume.MessageStreamFactory;
import com.myorg.replybus.kafka.consume.TopicSubscription;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;

/**
 * One subscription per request topic, opened on {@link #start()} and closed together.
 */
@Slf4j
public class RequestSubscriptions implements AutoCloseable {

    private final MessageStreamFactory streams;
    private final List<String> topics;
    private final Function<String, RequestListener> listenerFactory;
    private final List<TopicSubscription> open = new ArrayList<>();

    public RequestSubscriptions(MessageStreamFactory streams,
                                List<String> topics,
                                Function<String, RequestListener> listenerFactory) {
        this.streams = streams;
        this.topics = List.copyOf(topics);
        this.listenerFactory = listenerFactory;
    }

    public synchronized void start() {
        if (!open.isEmpty()) return;
        for (String topic : topics) {
            open.add(streams.subscribe(topic, listenerFactory.apply(topic)));
        }
        log.info("Listening for requests topics={}", topics);
    }

    public synchronized List<TopicSubscription> subscriptions() {
        return List.copyOf(open);
    }

    @Override
    public synchronized void close() {
        for (TopicSubscription s : open) {
            try {
                s.close();
            } catch (RuntimeException e) {
                log.warn("Failed to stop subscription topic={} error={}", s.topic(), e.toString());
            }
        }
        open.clear();
    }
}
