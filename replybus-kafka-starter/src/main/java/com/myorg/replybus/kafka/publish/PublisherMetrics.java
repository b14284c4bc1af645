package com.myorg.replybus.kafka.publish;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;

@RequiredArgsConstructor
public class PublisherMetrics {

    public static final String SUCCESS = "replybus.publish.success";
    public static final String RETRY = "replybus.publish.retry";
    public static final String EXHAUSTED = "replybus.publish.exhausted";

    private final MeterRegistry registry;

    /** Register untagged base meters so they show up before the first publish. */
    public void preRegister() {
        Counter.builder(SUCCESS).register(registry);
        Counter.builder(RETRY).register(registry);
        Counter.builder(EXHAUSTED).register(registry);
    }

    public void incSuccess(String topic) { inc(SUCCESS, topic); }
    public void incRetry(String topic) { inc(RETRY, topic); }
    public void incExhausted(String topic) { inc(EXHAUSTED, topic); }

    private void inc(String metric, String topic) {
        Counter.builder(metric)
                .tag("topic", topic)
                .register(registry)
                .increment();
    }
}
