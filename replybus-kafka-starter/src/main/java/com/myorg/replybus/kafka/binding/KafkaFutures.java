package com.myorg.replybus.kafka.binding;

import org.apache.kafka.common.KafkaFuture;

import java.util.concurrent.CompletableFuture;

final class KafkaFutures {
    private KafkaFutures() {}

    /**
     * Bridge into a plain CompletableFuture. The stage returned by {@code toCompletionStage()}
     * refuses external completion, which breaks {@code orTimeout} downstream.
     */
    static <T> CompletableFuture<T> toCompletable(KafkaFuture<T> kafkaFuture) {
        CompletableFuture<T> cf = new CompletableFuture<>();
        kafkaFuture.whenComplete((value, err) -> {
            if (err != null) {
                cf.completeExceptionally(err);
            } else {
                cf.complete(value);
            }
        });
        return cf;
    }
}
