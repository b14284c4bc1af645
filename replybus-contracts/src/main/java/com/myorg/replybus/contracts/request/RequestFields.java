package com.myorg.replybus.contracts.request;

public final class RequestFields {
    private RequestFields() {}

    public static final String CORRELATION_ID = "correlation_id";
    public static final String REQUEST_ID = "request_id";
    public static final String RESPONSE_TOPIC = "response_topic";
}
