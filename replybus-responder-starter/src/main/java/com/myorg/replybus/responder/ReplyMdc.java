package com.myorg.replybus.responder;

import com.myorg.replybus.contracts.request.ReplyRequest;
import org.slf4j.MDC;

import java.util.Map;
import java.util.function.Supplier;

public final class ReplyMdc {

    public static final String CORR_ID = "corrId";
    public static final String REQUEST_ID = "requestId";
    public static final String TOPIC = "topic";

    private ReplyMdc() {
    }

    public static void put(ReplyRequest request, String topic) {
        if (topic != null) MDC.put(TOPIC, topic);
        if (request == null) return;
        if (request.getCorrelationId() != null) MDC.put(CORR_ID, request.getCorrelationId());
        if (request.getRequestId() != null) MDC.put(REQUEST_ID, request.getRequestId());
    }

    /**
     * Runs {@code body} with {@code context} as the MDC, then puts back whatever the thread had.
     * For continuations that finish on another thread.
     */
    public static <T> T with(Map<String, String> context, Supplier<T> body) {
        Map<String, String> previous = MDC.getCopyOfContextMap();
        set(context);
        try {
            return body.get();
        } finally {
            set(previous);
        }
    }

    private static void set(Map<String, String> context) {
        if (context == null) {
            MDC.clear();
        } else {
            MDC.setContextMap(context);
        }
    }

    public static void clear() {
        MDC.remove(CORR_ID);
        MDC.remove(REQUEST_ID);
        MDC.remove(TOPIC);
    }
}
