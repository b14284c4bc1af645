package com.myorg.replybus.kafka.consume;

import java.util.function.Consumer;

/**
 * Push-style view of a topic: one callback per message value, one per failure.
 * Offset-out-of-range conditions arrive through {@link #onError(Throwable)} as Kafka's
 * {@code OffsetOutOfRangeException}.
 */
public interface TopicMessageListener {

    void onMessage(String payload);

    void onError(Throwable error);

    static TopicMessageListener of(Consumer<String> onMessage, Consumer<Throwable> onError) {
        return new TopicMessageListener() {
            @Override
            public void onMessage(String payload) {
                onMessage.accept(payload);
            }

            @Override
            public void onError(Throwable error) {
                onError.accept(error);
            }
        };
    }
}
