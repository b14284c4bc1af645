package com.myorg.replybus.kafka.support;

import com.myorg.replybus.kafka.binding.BrokerProducer;
import com.myorg.replybus.kafka.binding.SendAck;
import org.slf4j.MDC;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Fails the first {@code failuresBeforeSuccess} sends, then acknowledges. Records what was sent.
 */
public class FakeBrokerProducer implements BrokerProducer {

    private final int failuresBeforeSuccess;
    private final AtomicInteger sendCalls = new AtomicInteger();
    private final List<String> sentTopics = new CopyOnWriteArrayList<>();
    private final List<String> sentPayloads = new CopyOnWriteArrayList<>();
    private final List<String> sendThreads = new CopyOnWriteArrayList<>();
    private final List<String> sendCorrIds = new CopyOnWriteArrayList<>();
    private final List<List<String>> createdTopics = new CopyOnWriteArrayList<>();
    private volatile RuntimeException createTopicsError;
    private volatile boolean closed;

    public FakeBrokerProducer(int failuresBeforeSuccess) {
        this.failuresBeforeSuccess = failuresBeforeSuccess;
    }

    public static FakeBrokerProducer alwaysFailing() {
        return new FakeBrokerProducer(Integer.MAX_VALUE);
    }

    public static FakeBrokerProducer healthy() {
        return new FakeBrokerProducer(0);
    }

    @Override
    public CompletableFuture<SendAck> send(String topic, String payload) {
        int call = sendCalls.incrementAndGet();
        sentTopics.add(topic);
        sentPayloads.add(payload);
        sendThreads.add(Thread.currentThread().getName());
        sendCorrIds.add(String.valueOf(MDC.get("corrId")));
        if (call <= failuresBeforeSuccess) {
            return CompletableFuture.failedFuture(new SendFailure("send #" + call + " failed"));
        }
        return CompletableFuture.completedFuture(new SendAck(topic, 0, call - 1L));
    }

    @Override
    public CompletableFuture<Void> createTopics(List<String> topicNames) {
        if (createTopicsError != null) {
            return CompletableFuture.failedFuture(createTopicsError);
        }
        createdTopics.add(List.copyOf(topicNames));
        return CompletableFuture.completedFuture(null);
    }

    @Override
    public void close() {
        closed = true;
    }

    public void failCreateTopicsWith(RuntimeException e) {
        this.createTopicsError = e;
    }

    public int sendCalls() {
        return sendCalls.get();
    }

    public List<String> sentTopics() {
        return sentTopics;
    }

    public List<String> sentPayloads() {
        return sentPayloads;
    }

    public List<String> sendThreads() {
        return sendThreads;
    }

    /** MDC {@code corrId} seen by each send, {@code "null"} when unset. */
    public List<String> sendCorrIds() {
        return sendCorrIds;
    }

    public List<List<String>> createdTopics() {
        return createdTopics;
    }

    public boolean isClosed() {
        return closed;
    }

    public static class SendFailure extends RuntimeException {
        public SendFailure(String msg) { super(msg); }
    }
}
