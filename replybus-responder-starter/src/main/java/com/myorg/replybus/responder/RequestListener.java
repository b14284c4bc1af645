package com.myorg.replybus.responder;

import com.fasterxml.jackson.databind.JsonNode;
import com.myorg.replybus.contracts.request.ReplyRequest;
import com.myorg.replybus.contracts.request.RequestMessages;
import com.myorg.replybus.kafka.consume.TopicMessageListener;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;

import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Consumes one request topic: handle each request, then reply. Failures are logged and the
 * message counts as consumed.
 */
@Slf4j
@RequiredArgsConstructor
public class RequestListener implements TopicMessageListener {

    private final String topic;
    private final RequestConverter converter;
    private final RequestHandler handler;
    private final ResponseDispatcher dispatcher;

    @Override
    public void onMessage(String payload) {
        if (payload == null) return;

        JsonNode node;
        try {
            node = converter.toTree(payload);
        } catch (IllegalArgumentException e) {
            log.warn("Skipping malformed message topic={} error={}", topic, e.getMessage());
            return;
        }
        if (!RequestMessages.isRequest(node)) {
            log.debug("Skipping non-request message topic={}", topic);
            return;
        }

        ReplyRequest request;
        try {
            request = converter.toRequest(node);
        } catch (IllegalArgumentException e) {
            log.warn("Skipping unreadable request topic={} error={}", topic, e.getMessage());
            return;
        }

        try {
            ReplyMdc.put(request, topic);
            handle(request);
        } finally {
            ReplyMdc.clear();
        }
    }

    /**
     * Returned future never fails. The caller's MDC is carried into the reply continuation,
     * which usually completes on another thread.
     */
    CompletableFuture<Void> handle(ReplyRequest request) {
        String corrId = request.getCorrelationId();
        Map<String, String> mdc = MDC.getCopyOfContextMap();

        CompletableFuture<?> result;
        try {
            result = handler.handle(request);
        } catch (RuntimeException e) {
            result = CompletableFuture.failedFuture(e);
        }
        if (result == null) {
            result = CompletableFuture.completedFuture(null);
        }

        return result
                .thenCompose(response -> ReplyMdc.with(mdc, () -> dispatcher.respond(response, request)))
                .handle((ack, err) -> ReplyMdc.with(mdc, () -> {
                    if (err != null) {
                        log.error("Request FAILED topic={} corrId={} requestId={}",
                                topic, corrId, request.getRequestId(), err);
                    } else {
                        log.debug("Replied corrId={} to topic={} partition={} offset={}",
                                corrId, ack.topic(), ack.partition(), ack.offset());
                    }
                    return null;
                }));
    }

    @Override
    public void onError(Throwable error) {
        log.warn("Request stream error topic={} error={}", topic, error.toString());
    }
}
